package com.structbp.server.factored;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A discrete variable: the ordered range of extended values a factor dimension enumerates.
 * Two variables are the same variable only if they are the same object.
 */
public class Variable<T> {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final String name;
    private final List<Extended<T>> range;

    public Variable(String name, List<Extended<T>> range) {
        if (range == null || range.isEmpty()) {
            throw new IllegalArgumentException("Variable " + name + " must have a non-empty range");
        }
        this.id = NEXT_ID.getAndIncrement();
        this.name = name;
        this.range = Collections.unmodifiableList(new ArrayList<>(range));
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<Extended<T>> getRange() {
        return range;
    }

    public int size() {
        return range.size();
    }

    public boolean hasStar() {
        for (Extended<T> x : range) {
            if (!x.isRegular()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name + "#" + id + range;
    }
}
