package com.structbp.server.algorithm;

/**
 * An algorithm was asked to run on targets or settings it cannot accept.
 */
public class AlgorithmConfigurationException extends IllegalArgumentException {

    public AlgorithmConfigurationException(String message) {
        super(message);
    }
}
