package com.advocacypacket.service.config;

import com.advocacypacket.scoring.config.ConfidenceConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Map;

public record EngineSettings(
        @JsonProperty("state_dir") String stateDir,
        @JsonProperty("cache_dir") String cacheDir,
        @JsonProperty("decay_rate") Double decayRate,
        @JsonProperty("source_weights") Map<String, Double> sourceWeights
) {
    public static final String DEFAULT_STATE_DIR = "data/packet_state";
    public static final String DEFAULT_CACHE_DIR = "data/cache";

    public EngineSettings {
        stateDir = stateDir == null || stateDir.isBlank() ? DEFAULT_STATE_DIR : stateDir;
        cacheDir = cacheDir == null || cacheDir.isBlank() ? DEFAULT_CACHE_DIR : cacheDir;
        sourceWeights = sourceWeights == null ? Map.of() : Map.copyOf(sourceWeights);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, null, null, null);
    }

    public Path stateDirectory(Path baseDir) {
        return baseDir.resolve(stateDir);
    }

    public Path cacheDirectory(Path baseDir) {
        return baseDir.resolve(cacheDir);
    }

    public ConfidenceConfig confidenceConfig() {
        ConfidenceConfig config = ConfidenceConfig.defaults().withSourceWeights(sourceWeights);
        return decayRate == null ? config : config.withDecayRate(decayRate);
    }
}
