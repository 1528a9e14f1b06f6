package com.structbp.server.structured;

import com.structbp.server.factored.DenseFactor;
import com.structbp.server.factored.Extended;
import com.structbp.server.factored.Factor;
import com.structbp.server.factored.Regular;
import com.structbp.server.factored.Star;
import com.structbp.server.factored.SumProductSemiring;
import com.structbp.server.factored.Variable;
import com.structbp.server.model.Apply;
import com.structbp.server.model.Constant;
import com.structbp.server.model.Element;
import com.structbp.server.model.Flip;
import com.structbp.server.model.Select;
import com.structbp.server.structured.factory.Factory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The part of a problem belonging to one element: its variable once the range is known, and
 * the factors built from it.
 */
public class ProblemComponent<T> {

    protected final ComponentCollection collection;
    protected final Problem problem;
    protected final Element<T> element;

    private Variable<T> variable;
    private boolean generating;

    ProblemComponent(ComponentCollection collection, Problem problem, Element<T> element) {
        this.collection = collection;
        this.problem = problem;
        this.element = element;
    }

    public Element<T> getElement() {
        return element;
    }

    public Problem getProblem() {
        return problem;
    }

    public boolean hasRange() {
        return variable != null;
    }

    public Variable<T> getVariable() {
        if (variable == null) {
            throw new IllegalStateException("Range of " + element.getName() + " has not been generated");
        }
        return variable;
    }

    /**
     * Computes this component's range, generating argument ranges first. Does nothing when
     * the range already exists.
     */
    public void generateRange() {
        if (variable != null) {
            return;
        }
        if (generating) {
            throw new IllegalStateException("Cyclic dependency through element " + element.getName());
        }
        generating = true;
        try {
            variable = new Variable<>(element.getName(), computeRange());
            collection.registerVariable(variable, this);
        } finally {
            generating = false;
        }
    }

    @SuppressWarnings("unchecked")
    protected List<Extended<T>> computeRange() {
        if (element instanceof Constant) {
            return List.of(new Regular<>(((Constant<T>) element).getValue()));
        }
        if (element instanceof Flip) {
            Extended<?> no = new Regular<>(Boolean.FALSE);
            Extended<?> yes = new Regular<>(Boolean.TRUE);
            return List.of((Extended<T>) no, (Extended<T>) yes);
        }
        if (element instanceof Select) {
            List<Extended<T>> range = new ArrayList<>();
            for (T outcome : ((Select<T>) element).getOutcomes().keySet()) {
                range.add(new Regular<>(outcome));
            }
            return range;
        }
        if (element instanceof Apply) {
            return applyRange((Apply<T>) element);
        }
        throw new UnsupportedOperationException(
                "No range rule for element type " + element.getClass().getSimpleName());
    }

    private List<Extended<T>> applyRange(Apply<T> apply) {
        List<Variable<?>> argVars = new ArrayList<>();
        for (Element<?> arg : apply.getArgs()) {
            ProblemComponent<?> argComponent = collection.get(arg);
            argComponent.generateRange();
            argVars.add(argComponent.getVariable());
        }
        Set<Extended<T>> range = new LinkedHashSet<>();
        for (int[] tuple : new DenseFactor<>(argVars, SumProductSemiring.INSTANCE).getIndices()) {
            range.add(applyToTuple(apply, argVars, tuple));
        }
        return new ArrayList<>(range);
    }

    /**
     * The result of an apply for one tuple of argument range positions; star if any argument
     * value is star.
     */
    public static <T> Extended<T> applyToTuple(Apply<T> apply, List<Variable<?>> argVars, int[] tuple) {
        Object[] values = new Object[tuple.length];
        for (int i = 0; i < tuple.length; i++) {
            Extended<?> x = argVars.get(i).getRange().get(tuple[i]);
            if (!x.isRegular()) {
                return Star.star();
            }
            values[i] = x.getValue();
        }
        return new Regular<>(apply.applyTo(Arrays.asList(values)));
    }

    public List<Factor<Double>> getNonConstraintFactors() {
        return Factory.makeFactors(collection, this);
    }

    public List<Factor<Double>> getConstraintFactors() {
        return Factory.makeConditionAndConstraintFactors(this);
    }

    @Override
    public String toString() {
        return "ProblemComponent(" + element.getName() + ")";
    }
}
