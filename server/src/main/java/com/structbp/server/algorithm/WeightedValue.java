package com.structbp.server.algorithm;

/**
 * One entry of a distribution.
 */
public class WeightedValue<T> {
    private final double probability;
    private final T value;

    public WeightedValue(double probability, T value) {
        this.probability = probability;
        this.value = value;
    }

    public double getProbability() {
        return probability;
    }

    public T getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "(" + probability + ", " + value + ")";
    }
}
