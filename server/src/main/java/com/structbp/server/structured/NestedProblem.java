package com.structbp.server.structured;

import com.structbp.server.model.Element;

import java.util.Collections;

/**
 * Problem created by a chain for one of its outcomes.
 */
public class NestedProblem<T> extends Problem {

    private final Element<T> target;

    public NestedProblem(ComponentCollection collection, Problem parent, Element<T> target) {
        super(collection, parent, Collections.singletonList(target));
        this.target = target;
    }

    public Element<T> getTarget() {
        return target;
    }
}
