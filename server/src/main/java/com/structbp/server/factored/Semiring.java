package com.structbp.server.factored;

/**
 * The operations a factor's entries are combined with.
 */
public interface Semiring<T> {

    T zero();

    T one();

    T sum(T x, T y);

    T product(T x, T y);
}
