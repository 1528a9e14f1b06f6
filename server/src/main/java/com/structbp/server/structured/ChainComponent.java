package com.structbp.server.structured;

import com.structbp.server.factored.Extended;
import com.structbp.server.factored.Star;
import com.structbp.server.model.Chain;
import com.structbp.server.model.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Component of a chain. Generating its range expands every parent value into the element the
 * chain selects for it, creating a nested problem for outcomes not yet registered.
 */
public class ChainComponent<P, T> extends ProblemComponent<T> {

    private static final Logger logger = LoggerFactory.getLogger(ChainComponent.class);

    private final Chain<P, T> chain;
    private final List<Expansion<P, T>> expansions = new ArrayList<>();

    ChainComponent(ComponentCollection collection, Problem problem, Chain<P, T> chain) {
        super(collection, problem, chain);
        this.chain = chain;
    }

    /**
     * How one parent value of the chain was expanded.
     */
    public static class Expansion<P, T> {
        private final Extended<P> parentValue;
        private final Element<T> outcome;
        private final NestedProblem<T> subproblem;

        Expansion(Extended<P> parentValue, Element<T> outcome, NestedProblem<T> subproblem) {
            this.parentValue = parentValue;
            this.outcome = outcome;
            this.subproblem = subproblem;
        }

        public Extended<P> getParentValue() {
            return parentValue;
        }

        /**
         * The selected element, or null when the parent value was not expanded.
         */
        public Element<T> getOutcome() {
            return outcome;
        }

        /**
         * The nested problem holding the outcome, or null when the outcome was already
         * registered elsewhere or not expanded.
         */
        public NestedProblem<T> getSubproblem() {
            return subproblem;
        }

        public boolean isExpanded() {
            return outcome != null;
        }
    }

    public Chain<P, T> getChain() {
        return chain;
    }

    public List<Expansion<P, T>> getExpansions() {
        return Collections.unmodifiableList(expansions);
    }

    public List<NestedProblem<T>> getSubproblems() {
        List<NestedProblem<T>> result = new ArrayList<>();
        for (Expansion<P, T> expansion : expansions) {
            if (expansion.subproblem != null) {
                result.add(expansion.subproblem);
            }
        }
        return result;
    }

    @Override
    protected List<Extended<T>> computeRange() {
        ProblemComponent<P> parentComponent = collection.get(chain.getParent());
        parentComponent.generateRange();

        expansions.clear();
        Set<Extended<T>> range = new LinkedHashSet<>();
        int childDepth = problem.getDepth() + 1;
        for (Extended<P> parentValue : parentComponent.getVariable().getRange()) {
            if (!parentValue.isRegular()) {
                expansions.add(new Expansion<>(parentValue, null, null));
                range.add(Star.star());
                continue;
            }
            if (childDepth > collection.getMaxChainDepth()) {
                logger.debug("Chain {} not expanded for parent value {}: depth {} exceeds {}",
                        chain.getName(), parentValue, childDepth, collection.getMaxChainDepth());
                expansions.add(new Expansion<>(parentValue, null, null));
                range.add(Star.star());
                continue;
            }
            Element<T> outcome = chain.outcomeFor(parentValue.getValue());
            NestedProblem<T> subproblem = null;
            if (!collection.contains(outcome)) {
                subproblem = new NestedProblem<>(collection, problem, outcome);
                subproblem.generateRanges();
            }
            ProblemComponent<T> outcomeComponent = collection.get(outcome);
            outcomeComponent.generateRange();
            range.addAll(outcomeComponent.getVariable().getRange());
            expansions.add(new Expansion<>(parentValue, outcome, subproblem));
        }
        return new ArrayList<>(range);
    }
}
