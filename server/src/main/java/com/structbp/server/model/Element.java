package com.structbp.server.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * A random variable of a {@link Universe}.
 *
 * Evidence comes in two forms: a hard condition, which rules out every value that fails it,
 * and a soft constraint, which weights each value.
 */
public abstract class Element<T> {

    private final Universe universe;
    private final String name;
    private Predicate<T> condition;
    private ToDoubleFunction<T> constraint;

    protected Element(Universe universe, String name) {
        this.universe = Objects.requireNonNull(universe, "universe");
        this.name = name != null ? name : universe.nextElementName();
        universe.register(this);
    }

    public Universe getUniverse() {
        return universe;
    }

    public String getName() {
        return name;
    }

    /**
     * Elements this element's value is computed from.
     */
    public abstract List<Element<?>> getArgs();

    public void observe(T value) {
        this.condition = v -> Objects.equals(v, value);
    }

    public void setCondition(Predicate<T> condition) {
        this.condition = condition;
    }

    public void unobserve() {
        this.condition = null;
    }

    public boolean isConditioned() {
        return condition != null;
    }

    public boolean conditionSatisfied(T value) {
        return condition == null || condition.test(value);
    }

    public void setConstraint(ToDoubleFunction<T> constraint) {
        this.constraint = constraint;
    }

    public void removeConstraint() {
        this.constraint = null;
    }

    public boolean isConstrained() {
        return constraint != null;
    }

    public double constraintValue(T value) {
        return constraint == null ? 1.0 : constraint.applyAsDouble(value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
