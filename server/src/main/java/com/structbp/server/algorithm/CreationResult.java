package com.structbp.server.algorithm;

import java.util.Optional;

/**
 * Outcome of validating and constructing a {@link StructuredBP}: either the algorithm or the
 * configuration error that prevented it.
 */
public final class CreationResult {

    private final StructuredBP algorithm;
    private final AlgorithmConfigurationException error;

    private CreationResult(StructuredBP algorithm, AlgorithmConfigurationException error) {
        this.algorithm = algorithm;
        this.error = error;
    }

    static CreationResult success(StructuredBP algorithm) {
        return new CreationResult(algorithm, null);
    }

    static CreationResult failure(String message) {
        return new CreationResult(null, new AlgorithmConfigurationException(message));
    }

    public boolean isSuccess() {
        return algorithm != null;
    }

    public Optional<StructuredBP> getAlgorithm() {
        return Optional.ofNullable(algorithm);
    }

    public Optional<AlgorithmConfigurationException> getError() {
        return Optional.ofNullable(error);
    }

    public StructuredBP orElseThrow() {
        if (error != null) {
            throw error;
        }
        return algorithm;
    }
}
