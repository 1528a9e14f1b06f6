package com.structbp.server.model;

import java.util.List;

/**
 * Deterministic function of its arguments.
 */
public abstract class Apply<T> extends Element<T> {

    protected Apply(Universe universe, String name) {
        super(universe, name);
    }

    /**
     * Applies the function to argument values given in {@link #getArgs()} order.
     */
    public abstract T applyTo(List<Object> argValues);
}
