package com.structbp.server.service;

import com.structbp.server.algorithm.WeightedValue;

import java.util.List;
import java.util.Map;

public class QueryResponse {
    private final int iterations;
    private final boolean cached;
    private final Map<String, List<WeightedValue<Object>>> marginals;

    public QueryResponse(int iterations, boolean cached, Map<String, List<WeightedValue<Object>>> marginals) {
        this.iterations = iterations;
        this.cached = cached;
        this.marginals = marginals;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isCached() {
        return cached;
    }

    public Map<String, List<WeightedValue<Object>>> getMarginals() {
        return marginals;
    }
}
