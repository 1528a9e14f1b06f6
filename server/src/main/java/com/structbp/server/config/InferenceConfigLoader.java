package com.structbp.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class InferenceConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(InferenceConfigLoader.class);

    public static final String CONFIG_RESOURCE = "/structured_bp.json";

    /**
     * Reads {@value #CONFIG_RESOURCE} from the classpath, falling back to defaults when the
     * resource is absent.
     */
    public static InferenceConfig loadOrDefault() {
        try (InputStream is = InferenceConfigLoader.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.info("{} not found on classpath, using default inference settings", CONFIG_RESOURCE);
                return InferenceConfig.defaults();
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }
    }

    public static InferenceConfig load(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        InferenceConfig config = mapper.readValue(jsonStream, InferenceConfig.class);
        logger.info("Loaded inference config: defaultIterations={}, stopEpsilon={}, damping={}, maxChainDepth={}",
                config.getDefaultIterations(), config.getStopEpsilon(), config.getDamping(),
                config.getMaxChainDepth());
        return config;
    }
}
