package com.structbp.server.algorithm;

public class AlgorithmActiveException extends IllegalStateException {

    public AlgorithmActiveException() {
        super("Algorithm has already been started");
    }
}
