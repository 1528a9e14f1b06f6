package com.structbp.server.algorithm;

import com.structbp.server.config.InferenceConfig;
import com.structbp.server.factored.Extended;
import com.structbp.server.factored.Factor;
import com.structbp.server.factored.SumProductSemiring;
import com.structbp.server.factored.Variable;
import com.structbp.server.model.Element;
import com.structbp.server.model.Universe;
import com.structbp.server.structured.ComponentCollection;
import com.structbp.server.structured.Problem;
import com.structbp.server.structured.factory.Factory;
import com.structbp.server.structured.solver.BeliefPropagationSolver;
import com.structbp.server.structured.strategy.ProblemSolver;
import com.structbp.server.structured.strategy.RecursiveSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Structured factored inference using belief propagation.
 *
 * A run builds one problem from the query targets and all evidence of the universe, solves
 * the problem tree with belief propagation at every node, multiplies the root solution into a
 * joint factor and marginalizes it onto each target.
 */
public class StructuredBP extends OneTimeProbQuery {

    private static final Logger logger = LoggerFactory.getLogger(StructuredBP.class);
    private static final SumProductSemiring SEMIRING = SumProductSemiring.INSTANCE;

    private final Universe universe;
    private final int iterations;
    private final InferenceConfig config;

    private ComponentCollection collection;
    private Problem problem;
    private Map<Element<?>, Factor<Double>> targetFactors = Collections.emptyMap();

    protected StructuredBP(Universe universe, int iterations, InferenceConfig config,
            List<? extends Element<?>> targets) {
        super(targets);
        this.universe = universe;
        this.iterations = iterations;
        this.config = config;
    }

    public Universe getUniverse() {
        return universe;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * The per-problem strategy handed to the recursive solver.
     */
    protected ProblemSolver solvingStrategy() {
        return new BeliefPropagationSolver(iterations, config.getStopEpsilon(), config.getDamping(),
                config.isDebugStats());
    }

    @Override
    protected void run() {
        collection = new ComponentCollection(config.getMaxChainDepth());
        problem = new Problem(collection, queryTargets);

        List<Element<?>> evidence = new ArrayList<>(universe.conditionedElements());
        evidence.addAll(universe.constrainedElements());
        for (Element<?> element : evidence) {
            if (!collection.contains(element)) {
                problem.add(element);
            }
        }

        new RecursiveSolver(solvingStrategy()).solve(problem);

        Factor<Double> joint = Factory.unit(SEMIRING);
        for (Factor<Double> factor : problem.getSolution()) {
            joint = joint.product(factor);
        }

        Map<Element<?>, Factor<Double>> factors = new LinkedHashMap<>();
        for (Element<?> target : queryTargets) {
            factors.put(target, marginalizeToTarget(joint, target));
        }
        targetFactors = factors;

        logger.info("Structured BP finished: {} targets, {} components, {} evidence elements, {} iterations",
                queryTargets.size(), collection.size(), evidence.size(), iterations);
    }

    private Factor<Double> marginalizeToTarget(Factor<Double> joint, Element<?> target) {
        Variable<?> targetVar = collection.variable(target);
        if (!joint.contains(targetVar)) {
            throw new UnreachableTargetException("Target " + target.getName()
                    + " does not appear in the solution of the top-level problem");
        }
        Factor<Double> unnormalized = joint.marginalizeTo(SEMIRING, targetVar);
        // z covers star entries too; computeDistribution drops them, so a target with star
        // mass has a distribution summing below one
        double z = unnormalized.foldLeft(0.0, Double::sum);
        if (!(z > 0.0) || Double.isInfinite(z)) {
            throw new DegenerateNormalizationException(
                    "Marginal of " + target.getName() + " has total mass " + z + " and cannot be normalized");
        }
        logger.debug("Target {}: normalizing constant {}", target.getName(), z);
        return unnormalized.mapTo(d -> d / z);
    }

    /**
     * Computes the normalized distribution over a single target element.
     */
    @Override
    @SuppressWarnings("unchecked")
    protected <T> List<WeightedValue<T>> computeDistribution(Element<T> target) {
        Factor<Double> factor = targetFactors.get(target);
        Variable<T> targetVar = (Variable<T>) factor.getVariables().get(0);
        List<WeightedValue<T>> dist = new ArrayList<>();
        for (int[] indices : factor.getIndices()) {
            Extended<T> x = targetVar.getRange().get(indices[0]);
            if (x.isRegular()) {
                dist.add(new WeightedValue<>(factor.get(indices), x.getValue()));
            }
        }
        return Collections.unmodifiableList(dist);
    }

    /**
     * Computes the expectation of a given function for single target element.
     */
    @Override
    protected <T> double computeExpectation(Element<T> target, ToDoubleFunction<T> function) {
        double total = 0.0;
        for (WeightedValue<T> pair : computeDistribution(target)) {
            total += pair.getProbability() * function.applyAsDouble(pair.getValue());
        }
        return total;
    }

    @Override
    protected void doKill() {
        collection = null;
        problem = null;
        targetFactors = Collections.emptyMap();
    }

    /**
     * Validates the arguments and creates the algorithm without throwing.
     *
     * @param iterations the number of belief propagation iterations for each subproblem
     * @param targets    the query targets, which will all be part of the top level problem
     */
    public static CreationResult tryCreate(InferenceConfig config, int iterations,
            List<? extends Element<?>> targets) {
        if (config == null) {
            return CreationResult.failure("No inference config");
        }
        if (targets == null || targets.isEmpty()) {
            return CreationResult.failure("Cannot run structured BP with no targets");
        }
        Set<Universe> universes = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Element<?> target : targets) {
            universes.add(target.getUniverse());
        }
        if (universes.size() > 1) {
            return CreationResult.failure("Cannot have targets in different universes");
        }
        if (iterations < 1) {
            return CreationResult.failure("Iterations must be positive, got " + iterations);
        }
        if (config.getDamping() < 0.0 || config.getDamping() >= 1.0) {
            return CreationResult.failure("Damping must be in [0, 1), got " + config.getDamping());
        }
        if (config.getMaxChainDepth() < 0) {
            return CreationResult.failure("maxChainDepth must be non-negative, got " + config.getMaxChainDepth());
        }
        return CreationResult.success(new StructuredBP(targets.get(0).getUniverse(), iterations, config, targets));
    }

    public static CreationResult tryCreate(int iterations, Element<?>... targets) {
        return tryCreate(InferenceConfig.defaults(), iterations, Arrays.asList(targets));
    }

    /**
     * @throws AlgorithmConfigurationException if there are no targets, the targets span
     *                                         several universes or iterations is not positive
     */
    public static StructuredBP create(int iterations, Element<?>... targets) {
        return tryCreate(iterations, targets).orElseThrow();
    }

    public static StructuredBP create(InferenceConfig config, int iterations, List<? extends Element<?>> targets) {
        return tryCreate(config, iterations, targets).orElseThrow();
    }

    /**
     * Use BP to compute the probability that the given element satisfies the given predicate.
     */
    public static <T> double probability(Element<T> target, Predicate<T> predicate, int iterations) {
        StructuredBP alg = create(iterations, target);
        alg.start();
        try {
            return alg.probability(target, predicate);
        } finally {
            alg.kill();
        }
    }

    /**
     * Use BP to compute the probability that the given element has the given value.
     */
    public static <T> double probabilityOfValue(Element<T> target, T value, int iterations) {
        return probability(target, t -> Objects.equals(t, value), iterations);
    }

    public static <T> double probabilityOfValue(Element<T> target, T value) {
        return probabilityOfValue(target, value, InferenceConfig.DEFAULT_ITERATIONS);
    }
}
