package com.structbp.server.config;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class InferenceConfigLoaderTest {

    @Test
    public void testLoadDefaultFile() {
        InferenceConfig config = InferenceConfigLoader.loadOrDefault();
        assertNotNull(config);
        // In structured_bp.json defaultIterations is 100 and the cache is off
        assertEquals(100, config.getDefaultIterations());
        assertEquals(32, config.getMaxChainDepth());
        assertNull(config.getStopEpsilon());
        assertFalse(config.isCacheEnabled());
        assertEquals("marginal_cache.db", config.getCacheDbFileName());
    }

    @Test
    public void testPartialConfigFallsBackToDefaults() throws Exception {
        String json = "{\"stopEpsilon\": 1.0e-6, \"cache\": {\"enabled\": true}}";
        InferenceConfig config = InferenceConfigLoader.load(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1.0e-6, config.getStopEpsilon(), 1e-15);
        assertEquals(InferenceConfig.DEFAULT_ITERATIONS, config.getDefaultIterations());
        assertEquals(0.0, config.getDamping(), 0.0);
        assertFalse(config.isDebugStats());
        assertTrue(config.isCacheEnabled());
        assertEquals(InferenceConfig.DEFAULT_DB_FILE, config.getCacheDbFileName());
    }

    @Test
    public void testDefaultsWithoutFile() {
        InferenceConfig config = InferenceConfig.defaults();
        assertEquals(100, config.getDefaultIterations());
        assertEquals(32, config.getMaxChainDepth());
        assertFalse(config.isCacheEnabled());
    }
}
