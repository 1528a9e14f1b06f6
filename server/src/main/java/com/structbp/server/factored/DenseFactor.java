package com.structbp.server.factored;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Factor backed by a flat array in row-major order.
 */
public class DenseFactor<T> implements Factor<T> {

    private final List<Variable<?>> variables;
    private final Semiring<T> semiring;
    private final int[] sizes;
    private final int[] strides;
    private final Object[] contents;

    public DenseFactor(List<? extends Variable<?>> variables, Semiring<T> semiring) {
        for (int i = 0; i < variables.size(); i++) {
            if (variables.indexOf(variables.get(i)) != i) {
                throw new IllegalArgumentException("Variable " + variables.get(i) + " appears twice in a factor");
            }
        }
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.semiring = semiring;
        this.sizes = new int[variables.size()];
        this.strides = new int[variables.size()];
        int total = 1;
        for (int i = variables.size() - 1; i >= 0; i--) {
            sizes[i] = variables.get(i).size();
            strides[i] = total;
            total *= sizes[i];
        }
        this.contents = new Object[total];
        Arrays.fill(contents, semiring.zero());
    }

    @Override
    public List<Variable<?>> getVariables() {
        return variables;
    }

    @Override
    public Semiring<T> getSemiring() {
        return semiring;
    }

    @Override
    public boolean contains(Variable<?> variable) {
        return variables.contains(variable);
    }

    @Override
    public int size() {
        return contents.length;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T get(int[] indices) {
        return (T) contents[offset(indices)];
    }

    @Override
    public void set(int[] indices, T value) {
        contents[offset(indices)] = value;
    }

    private int offset(int[] indices) {
        if (indices.length != sizes.length) {
            throw new IllegalArgumentException(
                    "Expected " + sizes.length + " indices but got " + indices.length);
        }
        int offset = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= sizes[i]) {
                throw new IndexOutOfBoundsException(
                        "Index " + indices[i] + " out of range for " + variables.get(i));
            }
            offset += indices[i] * strides[i];
        }
        return offset;
    }

    private int[] tupleAt(int offset) {
        int[] tuple = new int[sizes.length];
        for (int i = 0; i < sizes.length; i++) {
            tuple[i] = offset / strides[i];
            offset %= strides[i];
        }
        return tuple;
    }

    @Override
    public List<int[]> getIndices() {
        List<int[]> result = new ArrayList<>(contents.length);
        for (int k = 0; k < contents.length; k++) {
            result.add(tupleAt(k));
        }
        return result;
    }

    @Override
    public Factor<T> product(Factor<T> that) {
        List<Variable<?>> union = new ArrayList<>(variables);
        for (Variable<?> v : that.getVariables()) {
            if (!union.contains(v)) {
                union.add(v);
            }
        }
        int[] thisPositions = positionsIn(union, variables);
        int[] thatPositions = positionsIn(union, that.getVariables());

        DenseFactor<T> result = new DenseFactor<>(union, semiring);
        for (int k = 0; k < result.contents.length; k++) {
            int[] tuple = result.tupleAt(k);
            T x = get(project(tuple, thisPositions));
            T y = that.get(project(tuple, thatPositions));
            result.contents[k] = semiring.product(x, y);
        }
        return result;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Factor<T> marginalizeTo(Semiring<T> sumSemiring, Variable<?>... targets) {
        List<Variable<?>> kept = Arrays.asList(targets);
        for (Variable<?> v : kept) {
            if (!variables.contains(v)) {
                throw new IllegalArgumentException("Cannot marginalize to " + v + ": not a variable of this factor");
            }
        }
        int[] keptPositions = positionsIn(variables, kept);

        DenseFactor<T> result = new DenseFactor<>(kept, semiring);
        Arrays.fill(result.contents, sumSemiring.zero());
        for (int k = 0; k < contents.length; k++) {
            int target = result.offset(project(tupleAt(k), keptPositions));
            result.contents[target] = sumSemiring.sum((T) result.contents[target], (T) contents[k]);
        }
        return result;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <U> U foldLeft(U seed, BiFunction<U, T, U> combine) {
        U acc = seed;
        for (Object entry : contents) {
            acc = combine.apply(acc, (T) entry);
        }
        return acc;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Factor<T> mapTo(UnaryOperator<T> fn) {
        DenseFactor<T> result = new DenseFactor<>(variables, semiring);
        for (int k = 0; k < contents.length; k++) {
            result.contents[k] = fn.apply((T) contents[k]);
        }
        return result;
    }

    // positions[i] = index in `all` of sub.get(i)
    private static int[] positionsIn(List<Variable<?>> all, List<Variable<?>> sub) {
        int[] positions = new int[sub.size()];
        for (int i = 0; i < sub.size(); i++) {
            positions[i] = all.indexOf(sub.get(i));
        }
        return positions;
    }

    private static int[] project(int[] tuple, int[] positions) {
        int[] projected = new int[positions.length];
        for (int i = 0; i < positions.length; i++) {
            projected[i] = tuple[positions[i]];
        }
        return projected;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DenseFactor").append(variables).append(" {");
        for (int k = 0; k < contents.length; k++) {
            if (k > 0) {
                sb.append(", ");
            }
            sb.append(Arrays.toString(tupleAt(k))).append('=').append(contents[k]);
        }
        return sb.append('}').toString();
    }
}
