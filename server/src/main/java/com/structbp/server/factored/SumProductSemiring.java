package com.structbp.server.factored;

/**
 * Ordinary addition and multiplication over doubles, used for marginal probabilities.
 */
public class SumProductSemiring implements Semiring<Double> {

    public static final SumProductSemiring INSTANCE = new SumProductSemiring();

    private SumProductSemiring() {
    }

    @Override
    public Double zero() {
        return 0.0;
    }

    @Override
    public Double one() {
        return 1.0;
    }

    @Override
    public Double sum(Double x, Double y) {
        return x + y;
    }

    @Override
    public Double product(Double x, Double y) {
        return x * y;
    }
}
