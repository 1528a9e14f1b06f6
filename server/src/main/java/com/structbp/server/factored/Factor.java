package com.structbp.server.factored;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * A table over the Cartesian product of its variables' ranges. Index tuples list one range
 * position per variable, in variable order; the first variable varies slowest.
 */
public interface Factor<T> {

    List<Variable<?>> getVariables();

    Semiring<T> getSemiring();

    boolean contains(Variable<?> variable);

    /**
     * Number of entries.
     */
    int size();

    T get(int[] indices);

    void set(int[] indices, T value);

    /**
     * All index tuples in enumeration order.
     */
    List<int[]> getIndices();

    Factor<T> product(Factor<T> that);

    /**
     * Sums out every variable not listed, using the given semiring's sum.
     *
     * @throws IllegalArgumentException if a listed variable is not in this factor
     */
    Factor<T> marginalizeTo(Semiring<T> semiring, Variable<?>... targets);

    <U> U foldLeft(U seed, BiFunction<U, T, U> combine);

    Factor<T> mapTo(UnaryOperator<T> fn);
}
