package com.structbp.server.structured.strategy;

import com.structbp.server.factored.Factor;
import com.structbp.server.factored.Variable;
import com.structbp.server.structured.Problem;

import java.util.List;
import java.util.Set;

/**
 * Solves a single problem from its factors.
 */
@FunctionalInterface
public interface ProblemSolver {

    /**
     * @param problem     the problem being solved
     * @param toEliminate variables internal to the problem
     * @param toPreserve  variables the solution must keep, in order
     * @param factors     the problem's factors, including the solutions of its subproblems
     * @return the factors the problem contributes to its parent
     */
    List<Factor<Double>> solve(Problem problem, Set<Variable<?>> toEliminate, Set<Variable<?>> toPreserve,
            List<Factor<Double>> factors);
}
