package com.structbp.server.spec;

public class ModelBuildException extends RuntimeException {

    public ModelBuildException(String message) {
        super(message);
    }

    public ModelBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
