package com.structbp.server.algorithm;

/**
 * A target's marginal has no mass to normalize, typically because the evidence is
 * contradictory.
 */
public class DegenerateNormalizationException extends ArithmeticException {

    public DegenerateNormalizationException(String message) {
        super(message);
    }
}
