package com.structbp.server.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses among outcomes with fixed probabilities. The outcome order of the given map is the
 * order of the element's range.
 */
public class Select<T> extends Element<T> {

    private final Map<T, Double> outcomes;

    public Select(Universe universe, Map<T, Double> outcomes) {
        this(universe, null, outcomes);
    }

    public Select(Universe universe, String name, Map<T, Double> outcomes) {
        super(universe, name);
        if (outcomes == null || outcomes.isEmpty()) {
            throw new IllegalArgumentException("Select " + getName() + " needs at least one outcome");
        }
        for (Map.Entry<T, Double> e : outcomes.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0.0) {
                throw new IllegalArgumentException(
                        "Select " + getName() + " has invalid probability for " + e.getKey() + ": " + e.getValue());
            }
        }
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public Map<T, Double> getOutcomes() {
        return outcomes;
    }

    @Override
    public List<Element<?>> getArgs() {
        return Collections.emptyList();
    }
}
