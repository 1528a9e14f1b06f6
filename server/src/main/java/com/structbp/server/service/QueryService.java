package com.structbp.server.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.structbp.db.CachedMarginal;
import com.structbp.db.MarginalResultDao;
import com.structbp.db.SqliteInitializer;
import com.structbp.server.algorithm.AlgorithmConfigurationException;
import com.structbp.server.algorithm.StructuredBP;
import com.structbp.server.algorithm.WeightedValue;
import com.structbp.server.config.InferenceConfig;
import com.structbp.server.config.InferenceConfigLoader;
import com.structbp.server.model.Element;
import com.structbp.server.spec.BuiltModel;
import com.structbp.server.spec.ModelBuildException;
import com.structbp.server.spec.ModelBuilder;
import com.structbp.server.spec.ModelSpec;
import com.structbp.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Answers marginal queries over JSON-described models, optionally backed by the SQLite
 * marginal cache.
 */
@Service
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final InferenceConfig config;
    private final ModelBuilder modelBuilder = new ModelBuilder();
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private final MarginalResultDao resultDao;

    public QueryService() {
        this(InferenceConfigLoader.loadOrDefault());
    }

    public QueryService(InferenceConfig config) {
        this.config = config;
        this.resultDao = openCache(config);
    }

    private static MarginalResultDao openCache(InferenceConfig config) {
        if (!config.isCacheEnabled()) {
            return null;
        }
        String dbPath = DataPathResolver.resolveDbPath(config);
        try {
            SqliteInitializer.initialize(dbPath);
            logger.info("Marginal cache enabled at {}", dbPath);
            return new MarginalResultDao(dbPath);
        } catch (SQLException e) {
            logger.error("Failed to initialize marginal cache at {}, continuing without cache", dbPath, e);
            return null;
        }
    }

    public boolean isCacheEnabled() {
        return resultDao != null;
    }

    public QueryResponse query(ModelSpec model, List<String> targetIds, Integer requestedIterations) {
        if (targetIds == null || targetIds.isEmpty()) {
            throw new AlgorithmConfigurationException("No targets requested");
        }
        int iterations = requestedIterations != null ? requestedIterations : config.getDefaultIterations();

        String hash = resultDao != null ? modelHash(model, targetIds) : null;
        if (hash != null) {
            Map<String, List<WeightedValue<Object>>> cached = loadCached(hash, targetIds, iterations);
            if (cached != null) {
                logger.debug("Cache HIT for model {} targets {}", hash, targetIds);
                return new QueryResponse(iterations, true, cached);
            }
            logger.debug("Cache MISS for model {} targets {}", hash, targetIds);
        }

        Map<String, List<WeightedValue<Object>>> marginals = compute(model, targetIds, iterations);
        if (hash != null) {
            store(hash, iterations, marginals);
        }
        return new QueryResponse(iterations, false, marginals);
    }

    private Map<String, List<WeightedValue<Object>>> compute(ModelSpec model, List<String> targetIds, int iterations) {
        BuiltModel built = modelBuilder.build(model);
        List<Element<?>> targets = new ArrayList<>();
        for (String id : targetIds) {
            targets.add(built.getElement(id));
        }

        StructuredBP algorithm = StructuredBP.create(config, iterations, targets);
        long start = System.currentTimeMillis();
        algorithm.start();
        try {
            Map<String, List<WeightedValue<Object>>> marginals = new LinkedHashMap<>();
            for (int i = 0; i < targetIds.size(); i++) {
                marginals.put(targetIds.get(i), toObjectDistribution(algorithm, targets.get(i)));
            }
            logger.info("Query on model {} answered for {} targets in {} ms", built.getUniverse().getName(),
                    targets.size(), System.currentTimeMillis() - start);
            return marginals;
        } finally {
            algorithm.kill();
        }
    }

    private static <T> List<WeightedValue<Object>> toObjectDistribution(StructuredBP algorithm, Element<T> target) {
        List<WeightedValue<Object>> result = new ArrayList<>();
        for (WeightedValue<T> wv : algorithm.distribution(target)) {
            result.add(new WeightedValue<>(wv.getProbability(), wv.getValue()));
        }
        return result;
    }

    private Map<String, List<WeightedValue<Object>>> loadCached(String hash, List<String> targetIds, int iterations) {
        try {
            Map<String, List<WeightedValue<Object>>> marginals = new LinkedHashMap<>();
            for (String id : targetIds) {
                Optional<CachedMarginal> cached = resultDao.load(hash, id, iterations);
                if (cached.isEmpty()) {
                    return null;
                }
                List<Object> values = mapper.readValue(cached.get().getValuesJson(),
                        new TypeReference<List<Object>>() {
                        });
                double[] probabilities = cached.get().getProbabilities();
                if (values.size() != probabilities.length) {
                    logger.warn("Cached marginal for {} in model {} is inconsistent, recomputing", id, hash);
                    return null;
                }
                List<WeightedValue<Object>> distribution = new ArrayList<>();
                for (int i = 0; i < probabilities.length; i++) {
                    distribution.add(new WeightedValue<>(probabilities[i], values.get(i)));
                }
                marginals.put(id, distribution);
            }
            return marginals;
        } catch (SQLException | JsonProcessingException | IllegalArgumentException e) {
            logger.error("Failed to read marginal cache, falling back to direct computation", e);
            return null;
        }
    }

    private void store(String hash, int iterations, Map<String, List<WeightedValue<Object>>> marginals) {
        try {
            for (Map.Entry<String, List<WeightedValue<Object>>> entry : marginals.entrySet()) {
                List<Object> values = new ArrayList<>();
                double[] probabilities = new double[entry.getValue().size()];
                for (int i = 0; i < probabilities.length; i++) {
                    values.add(entry.getValue().get(i).getValue());
                    probabilities[i] = entry.getValue().get(i).getProbability();
                }
                resultDao.upsert(hash, entry.getKey(), iterations, mapper.writeValueAsString(values), probabilities);
            }
        } catch (SQLException | JsonProcessingException e) {
            logger.error("Failed to store marginals for model {}", hash, e);
        }
    }

    /**
     * SHA-256 over the model's canonical JSON and the solver settings that change its answers.
     * The sorted target ids are part of the key: targets are global in the top level problem, so
     * one element can get different marginals under different target sets.
     */
    public String modelHash(ModelSpec model, List<String> targetIds) {
        try {
            List<String> sortedTargets = new ArrayList<>(new TreeSet<>(targetIds));
            String canonical = mapper.writeValueAsString(model) + "|eps=" + config.getStopEpsilon()
                    + "|damping=" + config.getDamping() + "|depth=" + config.getMaxChainDepth()
                    + "|targets=" + mapper.writeValueAsString(sortedTargets);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException e) {
            throw new ModelBuildException("Model cannot be serialized", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
