package com.structbp.server.model;

import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;

public class Apply2<A, B, T> extends Apply<T> {

    private final Element<A> arg1;
    private final Element<B> arg2;
    private final BiFunction<A, B, T> fn;

    public Apply2(Universe universe, Element<A> arg1, Element<B> arg2, BiFunction<A, B, T> fn) {
        this(universe, null, arg1, arg2, fn);
    }

    public Apply2(Universe universe, String name, Element<A> arg1, Element<B> arg2, BiFunction<A, B, T> fn) {
        super(universe, name);
        this.arg1 = arg1;
        this.arg2 = arg2;
        this.fn = fn;
    }

    @Override
    public List<Element<?>> getArgs() {
        return Arrays.asList(arg1, arg2);
    }

    @Override
    @SuppressWarnings("unchecked")
    public T applyTo(List<Object> argValues) {
        return fn.apply((A) argValues.get(0), (B) argValues.get(1));
    }
}
