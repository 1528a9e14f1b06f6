package com.structbp.server.factored;

/**
 * The irregular value. All stars are equal regardless of their type parameter.
 */
public final class Star<T> implements Extended<T> {

    private static final Star<?> INSTANCE = new Star<>();

    private Star() {
    }

    @SuppressWarnings("unchecked")
    public static <T> Star<T> star() {
        return (Star<T>) INSTANCE;
    }

    @Override
    public boolean isRegular() {
        return false;
    }

    @Override
    public T getValue() {
        throw new IllegalStateException("The star value has no regular value");
    }

    @Override
    public String toString() {
        return "*";
    }
}
