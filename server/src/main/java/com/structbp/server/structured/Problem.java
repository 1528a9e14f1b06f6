package com.structbp.server.structured;

import com.structbp.server.factored.Factor;
import com.structbp.server.factored.Variable;
import com.structbp.server.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the decomposition tree. Holds the components of the elements assigned to it; the
 * nested problems created by its chains are its children. Once solved, its solution is the
 * list of factors it contributes to its parent.
 */
public class Problem {

    protected final ComponentCollection collection;
    private final Problem parent;
    private final int depth;
    private final List<Element<?>> targets;
    private final List<ProblemComponent<?>> components = new ArrayList<>();

    private List<Factor<Double>> solution = Collections.emptyList();
    private boolean solved;

    public Problem(ComponentCollection collection, List<? extends Element<?>> targets) {
        this(collection, null, targets);
    }

    protected Problem(ComponentCollection collection, Problem parent, List<? extends Element<?>> targets) {
        this.collection = collection;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        for (Element<?> target : targets) {
            add(target);
        }
    }

    /**
     * Adds the element, and transitively its unregistered arguments, to this problem. Elements
     * that already have a component anywhere are left where they are.
     */
    public void add(Element<?> element) {
        if (collection.contains(element)) {
            return;
        }
        components.add(collection.add(element, this));
        for (Element<?> arg : element.getArgs()) {
            add(arg);
        }
    }

    public ComponentCollection getCollection() {
        return collection;
    }

    public Problem getParent() {
        return parent;
    }

    public int getDepth() {
        return depth;
    }

    public List<Element<?>> getTargets() {
        return targets;
    }

    public List<ProblemComponent<?>> getComponents() {
        return Collections.unmodifiableList(components);
    }

    public void generateRanges() {
        for (ProblemComponent<?> component : new ArrayList<>(components)) {
            component.generateRange();
        }
    }

    public List<NestedProblem<?>> getSubproblems() {
        List<NestedProblem<?>> result = new ArrayList<>();
        for (ProblemComponent<?> component : components) {
            if (component instanceof ChainComponent) {
                result.addAll(((ChainComponent<?, ?>) component).getSubproblems());
            }
        }
        return result;
    }

    /**
     * Factors of this problem's components followed by the solutions of its subproblems.
     * Subproblems must be solved first.
     */
    public List<Factor<Double>> collectFactors() {
        List<Factor<Double>> factors = new ArrayList<>();
        for (ProblemComponent<?> component : components) {
            factors.addAll(component.getNonConstraintFactors());
            factors.addAll(component.getConstraintFactors());
        }
        for (Problem subproblem : getSubproblems()) {
            if (!subproblem.isSolved()) {
                throw new IllegalStateException("Subproblem at depth " + subproblem.getDepth() + " is not solved");
            }
            factors.addAll(subproblem.getSolution());
        }
        return factors;
    }

    /**
     * Whether the component lives in this problem or one of its descendants.
     */
    public boolean owns(ProblemComponent<?> component) {
        for (Problem p = component.getProblem(); p != null; p = p.parent) {
            if (p == this) {
                return true;
            }
        }
        return false;
    }

    /**
     * The variables a solution must keep: the targets' variables, then every variable of the
     * factors whose component lives outside this problem.
     */
    public Set<Variable<?>> preservedVariables(List<Factor<Double>> factors) {
        Set<Variable<?>> preserved = new LinkedHashSet<>();
        for (Element<?> target : targets) {
            preserved.add(collection.variable(target));
        }
        for (Factor<Double> factor : factors) {
            for (Variable<?> v : factor.getVariables()) {
                if (!owns(collection.componentOf(v))) {
                    preserved.add(v);
                }
            }
        }
        return preserved;
    }

    public List<Factor<Double>> getSolution() {
        return solution;
    }

    public void setSolution(List<Factor<Double>> solution) {
        this.solution = Collections.unmodifiableList(new ArrayList<>(solution));
        this.solved = true;
    }

    public boolean isSolved() {
        return solved;
    }
}
