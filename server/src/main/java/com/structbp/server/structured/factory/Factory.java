package com.structbp.server.structured.factory;

import com.structbp.server.factored.DenseFactor;
import com.structbp.server.factored.Extended;
import com.structbp.server.factored.Factor;
import com.structbp.server.factored.Semiring;
import com.structbp.server.factored.SumProductSemiring;
import com.structbp.server.factored.Variable;
import com.structbp.server.model.Apply;
import com.structbp.server.model.Constant;
import com.structbp.server.model.Element;
import com.structbp.server.model.Flip;
import com.structbp.server.model.Select;
import com.structbp.server.structured.ChainComponent;
import com.structbp.server.structured.ComponentCollection;
import com.structbp.server.structured.ProblemComponent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns components into factors under the sum-product semiring.
 */
public final class Factory {

    private static final SumProductSemiring SEMIRING = SumProductSemiring.INSTANCE;

    private Factory() {
    }

    /**
     * The factor with no variables holding the semiring's one; the identity of product.
     */
    public static <T> Factor<T> unit(Semiring<T> semiring) {
        Factor<T> unit = new DenseFactor<>(Collections.emptyList(), semiring);
        unit.set(new int[0], semiring.one());
        return unit;
    }

    /**
     * Factors encoding how the component's element depends on its arguments.
     */
    public static List<Factor<Double>> makeFactors(ComponentCollection collection, ProblemComponent<?> component) {
        Element<?> element = component.getElement();
        if (component instanceof ChainComponent) {
            return List.of(makeChainFactor(collection, (ChainComponent<?, ?>) component));
        }
        if (element instanceof Constant) {
            return List.of(makeConstantFactor(component));
        }
        if (element instanceof Flip) {
            return List.of(makeFlipFactor((Flip) element, component.getVariable()));
        }
        if (element instanceof Select) {
            return List.of(makeSelectFactor((Select<?>) element, component.getVariable()));
        }
        if (element instanceof Apply) {
            return List.of(makeApplyFactor(collection, (Apply<?>) element, component.getVariable()));
        }
        throw new UnsupportedOperationException(
                "No factor rule for element type " + element.getClass().getSimpleName());
    }

    private static Factor<Double> makeConstantFactor(ProblemComponent<?> component) {
        Factor<Double> factor = new DenseFactor<>(List.of(component.getVariable()), SEMIRING);
        factor.set(new int[] { 0 }, 1.0);
        return factor;
    }

    private static Factor<Double> makeFlipFactor(Flip flip, Variable<?> variable) {
        Factor<Double> factor = new DenseFactor<>(List.of(variable), SEMIRING);
        List<? extends Extended<?>> range = variable.getRange();
        for (int i = 0; i < range.size(); i++) {
            boolean value = (Boolean) range.get(i).getValue();
            factor.set(new int[] { i }, value ? flip.getProbability() : 1.0 - flip.getProbability());
        }
        return factor;
    }

    private static <T> Factor<Double> makeSelectFactor(Select<T> select, Variable<?> variable) {
        Factor<Double> factor = new DenseFactor<>(List.of(variable), SEMIRING);
        List<? extends Extended<?>> range = variable.getRange();
        for (int i = 0; i < range.size(); i++) {
            factor.set(new int[] { i }, select.getOutcomes().get(range.get(i).getValue()));
        }
        return factor;
    }

    private static <T> Factor<Double> makeApplyFactor(ComponentCollection collection, Apply<T> apply,
            Variable<?> resultVar) {
        List<Variable<?>> argVars = new ArrayList<>();
        for (Element<?> arg : apply.getArgs()) {
            argVars.add(collection.variable(arg));
        }
        List<Variable<?>> vars = new ArrayList<>(argVars);
        vars.add(resultVar);

        Factor<Double> factor = new DenseFactor<>(vars, SEMIRING);
        Factor<Double> argTable = new DenseFactor<>(argVars, SEMIRING);
        for (int[] argTuple : argTable.getIndices()) {
            Extended<T> result = ProblemComponent.applyToTuple(apply, argVars, argTuple);
            int resultIndex = resultVar.getRange().indexOf(result);
            int[] tuple = new int[vars.size()];
            System.arraycopy(argTuple, 0, tuple, 0, argTuple.length);
            tuple[argTuple.length] = resultIndex;
            factor.set(tuple, 1.0);
        }
        return factor;
    }

    /**
     * A single selector factor over the parent, the chain and every distinct outcome variable.
     * An entry is 1 when the chain's value equals the value of the outcome its parent value
     * selects; unexpanded and star parent values select star.
     */
    private static <P, T> Factor<Double> makeChainFactor(ComponentCollection collection,
            ChainComponent<P, T> component) {
        Variable<P> parentVar = collection.variable(component.getChain().getParent());
        Variable<T> chainVar = component.getVariable();
        List<ChainComponent.Expansion<P, T>> expansions = component.getExpansions();

        List<Variable<?>> vars = new ArrayList<>();
        vars.add(parentVar);
        vars.add(chainVar);
        List<Variable<T>> outcomeVars = new ArrayList<>();
        for (ChainComponent.Expansion<P, T> expansion : expansions) {
            Variable<T> outcomeVar = expansion.isExpanded() ? collection.variable(expansion.getOutcome()) : null;
            outcomeVars.add(outcomeVar);
            if (outcomeVar != null && !vars.contains(outcomeVar)) {
                vars.add(outcomeVar);
            }
        }
        int parentPos = 0;
        int chainPos = vars.indexOf(chainVar);

        Factor<Double> factor = new DenseFactor<>(vars, SEMIRING);
        for (int[] tuple : factor.getIndices()) {
            int parentIndex = tuple[parentPos];
            Extended<T> chainValue = chainVar.getRange().get(tuple[chainPos]);
            Variable<T> outcomeVar = outcomeVars.get(parentIndex);
            boolean selected;
            if (outcomeVar == null) {
                selected = !chainValue.isRegular();
            } else {
                Extended<T> outcomeValue = outcomeVar.getRange().get(tuple[vars.indexOf(outcomeVar)]);
                selected = chainValue.equals(outcomeValue);
            }
            factor.set(tuple, selected ? 1.0 : 0.0);
        }
        return factor;
    }

    /**
     * Factors for the element's condition and constraint, if any. Star values are neither
     * ruled out nor weighted.
     */
    public static <T> List<Factor<Double>> makeConditionAndConstraintFactors(ProblemComponent<T> component) {
        Element<T> element = component.getElement();
        Variable<T> variable = component.getVariable();
        List<Factor<Double>> factors = new ArrayList<>();
        if (element.isConditioned()) {
            Factor<Double> factor = new DenseFactor<>(List.of(variable), SEMIRING);
            for (int i = 0; i < variable.size(); i++) {
                Extended<T> x = variable.getRange().get(i);
                boolean allowed = !x.isRegular() || element.conditionSatisfied(x.getValue());
                factor.set(new int[] { i }, allowed ? 1.0 : 0.0);
            }
            factors.add(factor);
        }
        if (element.isConstrained()) {
            Factor<Double> factor = new DenseFactor<>(List.of(variable), SEMIRING);
            for (int i = 0; i < variable.size(); i++) {
                Extended<T> x = variable.getRange().get(i);
                factor.set(new int[] { i }, x.isRegular() ? element.constraintValue(x.getValue()) : 1.0);
            }
            factors.add(factor);
        }
        return factors;
    }
}
