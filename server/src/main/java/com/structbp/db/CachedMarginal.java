package com.structbp.db;

/**
 * One stored target marginal: the values as JSON text and their probabilities, index-aligned.
 */
public class CachedMarginal {
    private final String valuesJson;
    private final double[] probabilities;

    public CachedMarginal(String valuesJson, double[] probabilities) {
        this.valuesJson = valuesJson;
        this.probabilities = probabilities;
    }

    public String getValuesJson() {
        return valuesJson;
    }

    public double[] getProbabilities() {
        return probabilities;
    }
}
