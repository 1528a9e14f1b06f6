package com.structbp.server.structured.solver;

import com.structbp.server.factored.DenseFactor;
import com.structbp.server.factored.Factor;
import com.structbp.server.factored.SumProductSemiring;
import com.structbp.server.factored.Variable;
import com.structbp.server.structured.Problem;
import com.structbp.server.structured.strategy.ProblemSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sum-product belief propagation over the factor graph of one problem, run for a fixed number
 * of flooding iterations. The solution holds one normalized belief per preserved variable.
 *
 * Optionally stops once no factor-to-variable message changes by more than
 * {@code stopEpsilon}, and mixes a {@code damping} share of the previous message into each
 * update. Neither is applied by default.
 */
public class BeliefPropagationSolver implements ProblemSolver {

    private static final Logger logger = LoggerFactory.getLogger(BeliefPropagationSolver.class);

    private final int iterations;
    private final Double stopEpsilon;
    private final double damping;
    private final boolean debugStats;

    public BeliefPropagationSolver(int iterations) {
        this(iterations, null, 0.0, false);
    }

    public BeliefPropagationSolver(int iterations, Double stopEpsilon, double damping, boolean debugStats) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Belief propagation needs at least one iteration, got " + iterations);
        }
        if (damping < 0.0 || damping >= 1.0) {
            throw new IllegalArgumentException("Damping must be in [0, 1), got " + damping);
        }
        this.iterations = iterations;
        this.stopEpsilon = stopEpsilon;
        this.damping = damping;
        this.debugStats = debugStats;
    }

    public int getIterations() {
        return iterations;
    }

    // One edge of the factor graph: position `pos` of factor `factor`.
    private static final class Edge {
        final int factor;
        final int pos;

        Edge(int factor, int pos) {
            this.factor = factor;
            this.pos = pos;
        }
    }

    @Override
    public List<Factor<Double>> solve(Problem problem, Set<Variable<?>> toEliminate, Set<Variable<?>> toPreserve,
            List<Factor<Double>> factors) {
        int numFactors = factors.size();
        Map<Variable<?>, List<Edge>> edges = new LinkedHashMap<>();
        List<List<int[]>> tuples = new ArrayList<>(numFactors);
        List<double[]> entries = new ArrayList<>(numFactors);
        double[][][] factorToVar = new double[numFactors][][];
        double[][][] varToFactor = new double[numFactors][][];

        for (int f = 0; f < numFactors; f++) {
            Factor<Double> factor = factors.get(f);
            List<Variable<?>> vars = factor.getVariables();
            factorToVar[f] = new double[vars.size()][];
            varToFactor[f] = new double[vars.size()][];
            for (int pos = 0; pos < vars.size(); pos++) {
                Variable<?> v = vars.get(pos);
                edges.computeIfAbsent(v, k -> new ArrayList<>()).add(new Edge(f, pos));
                factorToVar[f][pos] = MathUtil.uniform(v.size());
                varToFactor[f][pos] = MathUtil.uniform(v.size());
            }
            List<int[]> indices = factor.getIndices();
            double[] values = new double[indices.size()];
            for (int k = 0; k < values.length; k++) {
                values[k] = factor.get(indices.get(k));
            }
            tuples.add(indices);
            entries.add(values);
        }

        int performed = 0;
        double delta = 0.0;
        for (int it = 0; it < iterations; it++) {
            performed++;
            delta = 0.0;
            double[][][] next = new double[numFactors][][];
            for (int f = 0; f < numFactors; f++) {
                next[f] = factorMessages(factors.get(f), tuples.get(f), entries.get(f), varToFactor[f]);
                for (int pos = 0; pos < next[f].length; pos++) {
                    double[] msg = next[f][pos];
                    if (damping > 0.0) {
                        for (int i = 0; i < msg.length; i++) {
                            msg[i] = (1.0 - damping) * msg[i] + damping * factorToVar[f][pos][i];
                        }
                    }
                    MathUtil.normalizeInPlace(msg);
                    delta = Math.max(delta, MathUtil.maxAbsDelta(msg, factorToVar[f][pos]));
                }
            }
            factorToVar = next;

            for (Map.Entry<Variable<?>, List<Edge>> entry : edges.entrySet()) {
                for (Edge out : entry.getValue()) {
                    double[] msg = new double[entry.getKey().size()];
                    Arrays.fill(msg, 1.0);
                    for (Edge in : entry.getValue()) {
                        if (in != out) {
                            multiplyInto(msg, factorToVar[in.factor][in.pos]);
                        }
                    }
                    MathUtil.normalizeInPlace(msg);
                    varToFactor[out.factor][out.pos] = msg;
                }
            }

            if (logger.isTraceEnabled()) {
                logger.trace("BP depth {} iteration {}: max message delta {}", problem.getDepth(), performed, delta);
            }
            if (stopEpsilon != null && delta < stopEpsilon) {
                break;
            }
        }

        List<Factor<Double>> solution = new ArrayList<>();
        for (Variable<?> v : toPreserve) {
            List<Edge> incoming = edges.get(v);
            if (incoming == null) {
                logger.debug("Preserved variable {} has no factors at depth {}, no belief produced", v.getName(),
                        problem.getDepth());
                continue;
            }
            double[] belief = new double[v.size()];
            Arrays.fill(belief, 1.0);
            for (Edge in : incoming) {
                multiplyInto(belief, factorToVar[in.factor][in.pos]);
            }
            MathUtil.normalizeInPlace(belief);

            Factor<Double> factor = new DenseFactor<>(List.of(v), SumProductSemiring.INSTANCE);
            for (int i = 0; i < belief.length; i++) {
                factor.set(new int[] { i }, belief[i]);
            }
            solution.add(factor);
            if (debugStats) {
                logger.debug("BP belief for {}: entropy={}", v.getName(), MathUtil.entropy(belief));
            }
        }

        logger.debug("BP on problem at depth {}: {} factors, {} variables, {} iterations, final delta {}",
                problem.getDepth(), numFactors, edges.size(), performed, delta);
        return solution;
    }

    // Messages from one factor to each of its variables, given the incoming variable messages.
    private static double[][] factorMessages(Factor<Double> factor, List<int[]> tuples, double[] values,
            double[][] incoming) {
        List<Variable<?>> vars = factor.getVariables();
        double[][] out = new double[vars.size()][];
        for (int pos = 0; pos < vars.size(); pos++) {
            out[pos] = new double[vars.get(pos).size()];
        }
        for (int k = 0; k < values.length; k++) {
            if (values[k] == 0.0) {
                continue;
            }
            int[] tuple = tuples.get(k);
            for (int pos = 0; pos < tuple.length; pos++) {
                double product = values[k];
                for (int q = 0; q < tuple.length; q++) {
                    if (q != pos) {
                        product *= incoming[q][tuple[q]];
                    }
                }
                out[pos][tuple[pos]] += product;
            }
        }
        return out;
    }

    private static void multiplyInto(double[] target, double[] msg) {
        for (int i = 0; i < target.length; i++) {
            target[i] *= msg[i];
        }
    }
}
