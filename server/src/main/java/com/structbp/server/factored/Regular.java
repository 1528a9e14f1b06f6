package com.structbp.server.factored;

import java.util.Objects;

public final class Regular<T> implements Extended<T> {

    private final T value;

    public Regular(T value) {
        this.value = value;
    }

    @Override
    public boolean isRegular() {
        return true;
    }

    @Override
    public T getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Regular)) {
            return false;
        }
        return Objects.equals(value, ((Regular<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
