package com.structbp.server.model;

import java.util.Collections;
import java.util.List;

public class Constant<T> extends Element<T> {

    private final T value;

    public Constant(Universe universe, T value) {
        this(universe, null, value);
    }

    public Constant(Universe universe, String name, T value) {
        super(universe, name);
        this.value = value;
    }

    public T getValue() {
        return value;
    }

    @Override
    public List<Element<?>> getArgs() {
        return Collections.emptyList();
    }
}
