package com.structbp.server.model;

import java.util.Collections;
import java.util.List;

/**
 * Boolean element that is true with a fixed probability.
 */
public class Flip extends Element<Boolean> {

    private final double probability;

    public Flip(Universe universe, double probability) {
        this(universe, null, probability);
    }

    public Flip(Universe universe, String name, double probability) {
        super(universe, name);
        if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability)) {
            throw new IllegalArgumentException("Flip probability must be in [0, 1], got " + probability);
        }
        this.probability = probability;
    }

    public double getProbability() {
        return probability;
    }

    @Override
    public List<Element<?>> getArgs() {
        return Collections.emptyList();
    }
}
