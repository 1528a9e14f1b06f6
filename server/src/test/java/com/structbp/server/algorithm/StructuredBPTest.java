package com.structbp.server.algorithm;

import com.structbp.server.config.InferenceConfig;
import com.structbp.server.model.Apply1;
import com.structbp.server.model.Chain;
import com.structbp.server.model.Constant;
import com.structbp.server.model.Element;
import com.structbp.server.model.Flip;
import com.structbp.server.model.Select;
import com.structbp.server.model.Universe;
import com.structbp.server.structured.strategy.ProblemSolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StructuredBPTest {

    private Universe universe;

    @BeforeEach
    public void setup() {
        universe = new Universe("test");
    }

    // 1 with probability 1/2, otherwise one more than a fresh copy of itself
    private Element<Integer> geometric() {
        return new Chain<Boolean, Integer>(universe, new Flip(universe, 0.5),
                b -> b ? new Constant<Integer>(universe, 1)
                        : new Apply1<Integer, Integer>(universe, geometric(), n -> n + 1));
    }

    @Test
    public void testCreateRejectsBadArguments() {
        Flip a = new Flip(universe, 0.3);
        Flip elsewhere = new Flip(new Universe("other"), 0.3);

        assertThrows(AlgorithmConfigurationException.class, () -> StructuredBP.create(10));
        assertThrows(AlgorithmConfigurationException.class, () -> StructuredBP.create(10, a, elsewhere));
        assertThrows(AlgorithmConfigurationException.class, () -> StructuredBP.create(0, a));

        InferenceConfig config = new InferenceConfig();
        config.damping = 1.0;
        assertThrows(AlgorithmConfigurationException.class, () -> StructuredBP.create(config, 10, List.of(a)));
    }

    @Test
    public void testTryCreateReturnsResult() {
        Flip a = new Flip(universe, 0.3);

        CreationResult ok = StructuredBP.tryCreate(10, a);
        assertTrue(ok.isSuccess());
        assertTrue(ok.getAlgorithm().isPresent());
        assertFalse(ok.getError().isPresent());
        assertEquals(10, ok.orElseThrow().getIterations());

        CreationResult failed = StructuredBP.tryCreate(10);
        assertFalse(failed.isSuccess());
        assertTrue(failed.getError().get().getMessage().contains("no targets"));
        assertThrows(AlgorithmConfigurationException.class, failed::orElseThrow);

        CreationResult noConfig = StructuredBP.tryCreate(null, 10, List.of(a));
        assertFalse(noConfig.isSuccess());
        assertTrue(noConfig.getError().get().getMessage().contains("No inference config"));
        assertThrows(AlgorithmConfigurationException.class, noConfig::orElseThrow);
    }

    @Test
    public void testSimpleApply() {
        Flip a = new Flip(universe, 0.3);
        Apply1<Boolean, Boolean> b = new Apply1<>(universe, a, x -> x);

        StructuredBP alg = StructuredBP.create(10, b);
        alg.start();
        List<WeightedValue<Boolean>> dist = alg.distribution(b);
        assertEquals(2, dist.size());
        assertEquals(0.7, dist.get(0).getProbability(), 1e-9);
        assertEquals(Boolean.FALSE, dist.get(0).getValue());
        assertEquals(0.3, dist.get(1).getProbability(), 1e-9);
        assertEquals(Boolean.TRUE, dist.get(1).getValue());

        assertEquals(1.0, alg.expectation(b, v -> 1.0), 1e-9);
        assertEquals(0.3, alg.probabilityOf(b, true), 1e-9);
        alg.kill();
    }

    @Test
    public void testStaticProbability() {
        Flip a = new Flip(universe, 0.3);
        Apply1<Boolean, Boolean> b = new Apply1<>(universe, a, x -> x);

        assertEquals(0.3, StructuredBP.probability(b, v -> v, 10), 1e-9);
        assertEquals(0.7, StructuredBP.probabilityOfValue(b, false, 10), 1e-9);
        assertEquals(0.3, StructuredBP.probabilityOfValue(b, true), 1e-9);
    }

    @Test
    public void testRunsAreIndependentAndDeterministic() {
        Flip c = new Flip(universe, 0.3);
        Chain<Boolean, Boolean> d = new Chain<>(universe, c,
                v -> v ? new Flip(universe, 0.9) : new Flip(universe, 0.2));

        StructuredBP first = StructuredBP.create(10, d);
        first.start();
        List<WeightedValue<Boolean>> firstDist = first.distribution(d);
        first.kill();

        StructuredBP second = StructuredBP.create(10, d);
        second.start();
        List<WeightedValue<Boolean>> secondDist = second.distribution(d);

        assertEquals(firstDist.size(), secondDist.size());
        for (int i = 0; i < firstDist.size(); i++) {
            assertEquals(firstDist.get(i).getValue(), secondDist.get(i).getValue());
            assertEquals(firstDist.get(i).getProbability(), secondDist.get(i).getProbability(), 0.0);
        }
        // reading twice gives the same answer
        assertEquals(second.probabilityOf(d, true), second.probabilityOf(d, true), 0.0);
        second.kill();
    }

    @Test
    public void testChainMarginal() {
        Flip c = new Flip(universe, 0.3);
        Chain<Boolean, Boolean> d = new Chain<>(universe, c,
                v -> v ? new Flip(universe, 0.9) : new Flip(universe, 0.2));

        assertEquals(0.41, StructuredBP.probabilityOfValue(d, true, 10), 1e-9);
    }

    @Test
    public void testConditionedParent() {
        Flip c = new Flip(universe, 0.3);
        Chain<Boolean, Boolean> d = new Chain<>(universe, c,
                v -> v ? new Flip(universe, 0.9) : new Flip(universe, 0.2));
        c.observe(true);

        assertEquals(0.9, StructuredBP.probabilityOfValue(d, true, 10), 1e-9);
    }

    @Test
    public void testEvidenceOnNonTargetIsCollected() {
        Flip a = new Flip(universe, 0.5);
        Apply1<Boolean, Boolean> b = new Apply1<>(universe, a, x -> !x);
        // a is not a target and only reachable as b's argument; the constraint still applies
        a.setConstraint(v -> v ? 3.0 : 1.0);

        assertEquals(0.25, StructuredBP.probabilityOfValue(b, true, 10), 1e-9);
    }

    @Test
    public void testConstrainedTarget() {
        Flip a = new Flip(universe, 0.5);
        a.setConstraint(v -> v ? 3.0 : 1.0);

        assertEquals(0.75, StructuredBP.probabilityOfValue(a, true, 10), 1e-9);
    }

    @Test
    public void testMultipleTargetsAndMean() {
        Map<Integer, Double> outcomes = new LinkedHashMap<>();
        outcomes.put(1, 0.5);
        outcomes.put(2, 0.25);
        outcomes.put(4, 0.25);
        Select<Integer> s = new Select<>(universe, outcomes);
        Flip f = new Flip(universe, 0.6);

        StructuredBP alg = StructuredBP.create(10, s, f);
        alg.start();
        assertEquals(2.0, alg.mean(s), 1e-9);
        assertEquals(0.6, alg.probabilityOf(f, true), 1e-9);
        assertEquals(List.of(s, f), alg.getQueryTargets());
        alg.kill();
    }

    @Test
    public void testRecursionDepthLeavesStarMass() {
        InferenceConfig config = new InferenceConfig();
        config.maxChainDepth = 2;
        Element<Integer> g = geometric();

        StructuredBP alg = StructuredBP.create(config, 20, List.of(g));
        alg.start();
        assertEquals(0.5, alg.probabilityOf(g, 1), 1e-9);
        assertEquals(0.25, alg.probabilityOf(g, 2), 1e-9);

        double total = 0.0;
        for (WeightedValue<Integer> wv : alg.distribution(g)) {
            total += wv.getProbability();
        }
        assertEquals(0.75, total, 1e-9);
        alg.kill();
    }

    @Test
    public void testDegenerateNormalization() {
        Constant<Boolean> c = new Constant<>(universe, false);
        c.observe(true);

        StructuredBP alg = StructuredBP.create(10, c);
        assertThrows(DegenerateNormalizationException.class, alg::start);
        assertFalse(alg.isActive());
    }

    @Test
    public void testUnreachableTarget() {
        Flip a = new Flip(universe, 0.3);
        StructuredBP alg = new StructuredBP(universe, 10, InferenceConfig.defaults(), List.of(a)) {
            @Override
            protected ProblemSolver solvingStrategy() {
                return (problem, toEliminate, toPreserve, factors) -> Collections.emptyList();
            }
        };

        assertThrows(UnreachableTargetException.class, alg::start);
        assertFalse(alg.isActive());
    }

    @Test
    public void testLifecycleChecks() {
        Flip a = new Flip(universe, 0.3);
        Flip other = new Flip(universe, 0.6);
        StructuredBP alg = StructuredBP.create(10, a);

        assertThrows(AlgorithmInactiveException.class, () -> alg.distribution(a));
        assertThrows(AlgorithmInactiveException.class, alg::kill);

        alg.start();
        assertTrue(alg.isActive());
        assertThrows(AlgorithmActiveException.class, alg::start);
        assertThrows(NotATargetException.class, () -> alg.distribution(other));

        alg.kill();
        assertFalse(alg.isActive());
        assertThrows(AlgorithmInactiveException.class, () -> alg.probabilityOf(a, true));
    }

    @Test
    public void testStopEpsilonGivesSameAnswer() {
        InferenceConfig config = new InferenceConfig();
        config.stopEpsilon = 1e-12;
        Flip c = new Flip(universe, 0.3);
        Chain<Boolean, Boolean> d = new Chain<>(universe, c,
                v -> v ? new Flip(universe, 0.9) : new Flip(universe, 0.2));

        StructuredBP alg = StructuredBP.create(config, 1000, List.of(d));
        alg.start();
        assertEquals(0.41, alg.probabilityOf(d, true), 1e-9);
        alg.kill();
    }
}
