package com.structbp.server.config;

import com.structbp.server.structured.ComponentCollection;

/**
 * Settings for structured belief propagation, mapped from {@code structured_bp.json}. A null
 * field means the default.
 */
public class InferenceConfig {

    public static final int DEFAULT_ITERATIONS = 100;
    public static final String DEFAULT_DB_FILE = "marginal_cache.db";

    public Integer defaultIterations;
    public Double stopEpsilon;
    public Double damping;
    public Integer maxChainDepth;
    public Boolean debugStats;
    public String data_directory;
    public CacheConfig cache;

    public static class CacheConfig {
        public Boolean enabled;
        public String dbFileName;
    }

    public static InferenceConfig defaults() {
        return new InferenceConfig();
    }

    public int getDefaultIterations() {
        return defaultIterations != null ? defaultIterations : DEFAULT_ITERATIONS;
    }

    /**
     * Convergence threshold for belief propagation, or null to always run every iteration.
     */
    public Double getStopEpsilon() {
        return stopEpsilon;
    }

    public double getDamping() {
        return damping != null ? damping : 0.0;
    }

    public int getMaxChainDepth() {
        return maxChainDepth != null ? maxChainDepth : ComponentCollection.DEFAULT_MAX_CHAIN_DEPTH;
    }

    public boolean isDebugStats() {
        return debugStats != null && debugStats;
    }

    public boolean isCacheEnabled() {
        return cache != null && Boolean.TRUE.equals(cache.enabled);
    }

    public String getCacheDbFileName() {
        return (cache != null && cache.dbFileName != null && !cache.dbFileName.isEmpty()) ? cache.dbFileName
                : DEFAULT_DB_FILE;
    }
}
