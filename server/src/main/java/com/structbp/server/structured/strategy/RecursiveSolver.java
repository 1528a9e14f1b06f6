package com.structbp.server.structured.strategy;

import com.structbp.server.factored.Factor;
import com.structbp.server.factored.Variable;
import com.structbp.server.structured.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Solves a problem tree leaves first: every subproblem is solved before its parent collects
 * the subproblem's solution.
 */
public class RecursiveSolver {

    private static final Logger logger = LoggerFactory.getLogger(RecursiveSolver.class);

    private final ProblemSolver strategy;

    public RecursiveSolver(ProblemSolver strategy) {
        this.strategy = strategy;
    }

    public void solve(Problem problem) {
        problem.generateRanges();
        for (Problem subproblem : problem.getSubproblems()) {
            if (!subproblem.isSolved()) {
                solve(subproblem);
            }
        }

        List<Factor<Double>> factors = problem.collectFactors();
        Set<Variable<?>> toPreserve = problem.preservedVariables(factors);
        Set<Variable<?>> toEliminate = new LinkedHashSet<>();
        for (Factor<Double> factor : factors) {
            for (Variable<?> v : factor.getVariables()) {
                if (!toPreserve.contains(v)) {
                    toEliminate.add(v);
                }
            }
        }

        logger.debug("Solving problem at depth {}: {} components, {} factors, {} preserved, {} eliminated",
                problem.getDepth(), problem.getComponents().size(), factors.size(), toPreserve.size(),
                toEliminate.size());
        problem.setSolution(strategy.solve(problem, toEliminate, toPreserve, factors));
    }
}
