package com.structbp.server.algorithm;

import com.structbp.server.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * An algorithm that answers probability queries about fixed targets after running once.
 */
public abstract class OneTimeProbQuery extends Algorithm {

    protected final List<Element<?>> queryTargets;

    protected OneTimeProbQuery(List<? extends Element<?>> queryTargets) {
        this.queryTargets = Collections.unmodifiableList(new ArrayList<>(queryTargets));
    }

    public List<Element<?>> getQueryTargets() {
        return queryTargets;
    }

    protected abstract void run();

    @Override
    protected void doStart() {
        run();
    }

    protected abstract <T> List<WeightedValue<T>> computeDistribution(Element<T> target);

    protected abstract <T> double computeExpectation(Element<T> target, ToDoubleFunction<T> function);

    private void check(Element<?> target) {
        if (!isActive()) {
            throw new AlgorithmInactiveException();
        }
        if (!queryTargets.contains(target)) {
            throw new NotATargetException(target);
        }
    }

    public <T> List<WeightedValue<T>> distribution(Element<T> target) {
        check(target);
        return computeDistribution(target);
    }

    public <T> double expectation(Element<T> target, ToDoubleFunction<T> function) {
        check(target);
        return computeExpectation(target, function);
    }

    public <T> double probability(Element<T> target, Predicate<T> predicate) {
        return expectation(target, v -> predicate.test(v) ? 1.0 : 0.0);
    }

    public <T> double probabilityOf(Element<T> target, T value) {
        return probability(target, v -> Objects.equals(v, value));
    }

    public <T extends Number> double mean(Element<T> target) {
        return expectation(target, Number::doubleValue);
    }
}
