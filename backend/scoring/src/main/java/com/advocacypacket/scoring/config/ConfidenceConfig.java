package com.advocacypacket.scoring.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source authority weights and decay constants for confidence scoring.
 */
public record ConfidenceConfig(
        Map<String, Double> sourceWeights,
        double fallbackWeight,
        double decayRate,
        int unknownAgeDays,
        double highThreshold,
        double mediumThreshold
) {
    public static final double DEFAULT_DECAY_RATE = 0.01;

    public ConfidenceConfig {
        sourceWeights = sourceWeights == null ? Map.of() : Map.copyOf(sourceWeights);
    }

    public static ConfidenceConfig defaults() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("congress_gov", 0.80);
        weights.put("federal_register", 0.90);
        weights.put("grants_gov", 0.85);
        weights.put("usaspending", 0.70);
        weights.put("congressional_cache", 0.75);
        weights.put("inferred", 0.50);
        return new ConfidenceConfig(weights, 0.50, DEFAULT_DECAY_RATE, 365, 0.7, 0.4);
    }

    public ConfidenceConfig withDecayRate(double rate) {
        return new ConfidenceConfig(sourceWeights, fallbackWeight, rate, unknownAgeDays, highThreshold, mediumThreshold);
    }

    public ConfidenceConfig withSourceWeights(Map<String, Double> overrides) {
        Map<String, Double> merged = new LinkedHashMap<>(sourceWeights);
        merged.putAll(overrides);
        return new ConfidenceConfig(merged, fallbackWeight, decayRate, unknownAgeDays, highThreshold, mediumThreshold);
    }
}
