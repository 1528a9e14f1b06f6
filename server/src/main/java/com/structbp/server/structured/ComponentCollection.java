package com.structbp.server.structured;

import com.structbp.server.factored.Variable;
import com.structbp.server.model.Chain;
import com.structbp.server.model.Element;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry from elements to the components that hold their variables and factors. One
 * collection serves exactly one algorithm run.
 */
public class ComponentCollection {

    public static final int DEFAULT_MAX_CHAIN_DEPTH = 32;

    private final Map<Element<?>, ProblemComponent<?>> components = new HashMap<>();
    private final Map<Variable<?>, ProblemComponent<?>> byVariable = new HashMap<>();
    private final int maxChainDepth;

    public ComponentCollection() {
        this(DEFAULT_MAX_CHAIN_DEPTH);
    }

    /**
     * @param maxChainDepth deepest nested problem that chain expansion may create; parent
     *                      values needing a deeper problem are left unexpanded
     */
    public ComponentCollection(int maxChainDepth) {
        if (maxChainDepth < 0) {
            throw new IllegalArgumentException("maxChainDepth must be non-negative");
        }
        this.maxChainDepth = maxChainDepth;
    }

    public int getMaxChainDepth() {
        return maxChainDepth;
    }

    public boolean contains(Element<?> element) {
        return components.containsKey(element);
    }

    @SuppressWarnings("unchecked")
    public <T> ProblemComponent<T> get(Element<T> element) {
        ProblemComponent<T> component = (ProblemComponent<T>) components.get(element);
        if (component == null) {
            throw new IllegalArgumentException("Element " + element.getName() + " has no component");
        }
        return component;
    }

    public <T> Variable<T> variable(Element<T> element) {
        return get(element).getVariable();
    }

    @SuppressWarnings("unchecked")
    <T> ProblemComponent<T> add(Element<T> element, Problem problem) {
        if (components.containsKey(element)) {
            throw new IllegalStateException("Element " + element.getName() + " already has a component");
        }
        ProblemComponent<T> component;
        if (element instanceof Chain) {
            component = chainComponent(problem, (Chain<?, T>) element);
        } else {
            component = new ProblemComponent<>(this, problem, element);
        }
        components.put(element, component);
        return component;
    }

    private <P, T> ChainComponent<P, T> chainComponent(Problem problem, Chain<P, T> chain) {
        return new ChainComponent<>(this, problem, chain);
    }

    void registerVariable(Variable<?> variable, ProblemComponent<?> component) {
        byVariable.put(variable, component);
    }

    public ProblemComponent<?> componentOf(Variable<?> variable) {
        ProblemComponent<?> component = byVariable.get(variable);
        if (component == null) {
            throw new IllegalArgumentException("Variable " + variable + " does not belong to this collection");
        }
        return component;
    }

    public int size() {
        return components.size();
    }
}
