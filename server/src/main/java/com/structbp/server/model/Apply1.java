package com.structbp.server.model;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

public class Apply1<A, T> extends Apply<T> {

    private final Element<A> arg;
    private final Function<A, T> fn;

    public Apply1(Universe universe, Element<A> arg, Function<A, T> fn) {
        this(universe, null, arg, fn);
    }

    public Apply1(Universe universe, String name, Element<A> arg, Function<A, T> fn) {
        super(universe, name);
        this.arg = arg;
        this.fn = fn;
    }

    @Override
    public List<Element<?>> getArgs() {
        return Collections.singletonList(arg);
    }

    @Override
    @SuppressWarnings("unchecked")
    public T applyTo(List<Object> argValues) {
        return fn.apply((A) argValues.get(0));
    }
}
