package com.structbp.server.algorithm;

/**
 * A query target's variable is missing from the joint factor of the solved problem.
 */
public class UnreachableTargetException extends IllegalStateException {

    public UnreachableTargetException(String message) {
        super(message);
    }
}
