package com.structbp.server.factored;

/**
 * A value in a variable's range: either a regular value of the element or the irregular
 * star value standing for outcomes that were never expanded.
 */
public interface Extended<T> {

    boolean isRegular();

    /**
     * @throws IllegalStateException for the star value
     */
    T getValue();
}
