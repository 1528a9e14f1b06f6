package com.structbp.server.structured.solver;

import java.util.Arrays;

public class MathUtil {

    /**
     * Scales the array to sum to one and returns the original sum. An array summing to zero
     * is left as it is.
     */
    public static double normalizeInPlace(double[] x) {
        double sum = 0.0;
        for (double v : x) {
            sum += v;
        }
        if (sum > 0.0) {
            for (int i = 0; i < x.length; i++) {
                x[i] /= sum;
            }
        }
        return sum;
    }

    public static double[] uniform(int size) {
        double[] x = new double[size];
        Arrays.fill(x, 1.0 / size);
        return x;
    }

    /**
     * Natural-log entropy of a probability distribution.
     * H(p) = -sum(p_i * log(p_i))
     */
    public static double entropy(double[] probs) {
        double h = 0.0;
        for (double p : probs) {
            if (p > 1e-12) {
                h -= p * Math.log(p);
            }
        }
        return h;
    }

    /**
     * Computes the maximum absolute difference between two arrays.
     */
    public static double maxAbsDelta(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Arrays must have same length");
        }
        double maxDelta = 0.0;
        for (int i = 0; i < a.length; i++) {
            double delta = Math.abs(a[i] - b[i]);
            if (delta > maxDelta) {
                maxDelta = delta;
            }
        }
        return maxDelta;
    }
}
