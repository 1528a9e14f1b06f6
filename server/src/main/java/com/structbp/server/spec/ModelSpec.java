package com.structbp.server.spec;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON description of a model: elements in dependency order, plus evidence keyed by element id.
 */
public class ModelSpec {

    public String name;
    public List<ElementSpec> elements;
    public Map<String, Object> observations;
    // element id -> (value as string -> weight); values not listed weigh 1.0
    public Map<String, Map<String, Double>> constraints;

    public static class ElementSpec {
        public String id;
        public String type;

        // Flip
        public Double probability;
        // Select
        public Map<String, Double> outcomes;
        // Constant
        public Object value;
        // Not, And, Or, Equals
        public List<String> args;
        // If
        public String test;
        public String then;
        @JsonProperty("else")
        public String elseClause;
    }
}
