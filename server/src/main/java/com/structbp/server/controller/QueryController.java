package com.structbp.server.controller;

import com.structbp.server.algorithm.AlgorithmConfigurationException;
import com.structbp.server.algorithm.DegenerateNormalizationException;
import com.structbp.server.algorithm.UnreachableTargetException;
import com.structbp.server.service.QueryResponse;
import com.structbp.server.service.QueryService;
import com.structbp.server.spec.ModelBuildException;
import com.structbp.server.spec.ModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);
    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    public static class QueryRequest {
        public ModelSpec model;
        public List<String> targets;
        // Optional: falls back to defaultIterations from structured_bp.json
        public Integer iterations;
    }

    @PostMapping("/query")
    public ResponseEntity<?> query(@RequestBody QueryRequest request) {
        if (request.model == null) {
            return ResponseEntity.badRequest().body("Missing model.");
        }

        logger.info("Received query for targets {}", request.targets);

        try {
            QueryResponse response = queryService.query(request.model, request.targets, request.iterations);
            return ResponseEntity.ok(response);
        } catch (ModelBuildException | AlgorithmConfigurationException e) {
            logger.warn("Rejected query: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        } catch (UnreachableTargetException | DegenerateNormalizationException e) {
            logger.warn("Query could not be answered: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(e.getMessage());
        }
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }
}
