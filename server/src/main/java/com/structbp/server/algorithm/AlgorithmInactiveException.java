package com.structbp.server.algorithm;

public class AlgorithmInactiveException extends IllegalStateException {

    public AlgorithmInactiveException() {
        super("Algorithm is not active: start it before querying, and do not query after kill");
    }
}
