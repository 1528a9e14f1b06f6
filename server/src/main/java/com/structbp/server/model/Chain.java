package com.structbp.server.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Element whose value is the value of another element chosen by the parent's value. The
 * chosen element is created at most once per parent value.
 */
public class Chain<P, T> extends Element<T> {

    private final Element<P> parent;
    private final Function<P, Element<T>> fn;
    private final Map<P, Element<T>> outcomes = new HashMap<>();

    public Chain(Universe universe, Element<P> parent, Function<P, Element<T>> fn) {
        this(universe, null, parent, fn);
    }

    public Chain(Universe universe, String name, Element<P> parent, Function<P, Element<T>> fn) {
        super(universe, name);
        this.parent = parent;
        this.fn = fn;
    }

    public Element<P> getParent() {
        return parent;
    }

    @Override
    public List<Element<?>> getArgs() {
        return Collections.singletonList(parent);
    }

    public Element<T> outcomeFor(P parentValue) {
        Element<T> outcome = outcomes.get(parentValue);
        if (outcome == null) {
            outcome = fn.apply(parentValue);
            if (outcome.getUniverse() != getUniverse()) {
                throw new IllegalStateException(
                        "Chain " + getName() + " produced element " + outcome.getName() + " in another universe");
            }
            outcomes.put(parentValue, outcome);
        }
        return outcome;
    }
}
