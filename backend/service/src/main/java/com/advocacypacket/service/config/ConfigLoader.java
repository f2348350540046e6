package com.advocacypacket.service.config;

import com.advocacypacket.core.model.Entity;
import com.advocacypacket.core.model.ProgramRecord;
import com.advocacypacket.core.model.RegionDefinition;
import com.advocacypacket.core.util.JsonUtils;
import com.advocacypacket.scoring.geo.GeoClassification;
import com.advocacypacket.scoring.geo.GeoClassifier;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON configuration directory. Missing or malformed files fail fast with the path in the message.
 */
public final class ConfigLoader {
    public static final String PROGRAMS_FILE = "programs.json";
    public static final String REGIONS_FILE = "regions.json";
    public static final String GEO_CLASSIFICATIONS_FILE = "geo-classifications.json";
    public static final String REGISTRY_FILE = "registry.json";
    public static final String ENGINE_FILE = "engine.json";

    private ConfigLoader() {
    }

    /**
     * Program catalog keyed by id, in file order.
     */
    public static Map<String, ProgramRecord> loadPrograms(Path configDir) {
        List<ProgramRecord> programs = read(configDir.resolve(PROGRAMS_FILE), new TypeReference<List<ProgramRecord>>() {
        });
        Map<String, ProgramRecord> catalog = new LinkedHashMap<>();
        for (ProgramRecord program : programs) {
            if (program.id() == null || program.id().isBlank()) {
                throw new IllegalStateException("Program without id in " + configDir.resolve(PROGRAMS_FILE));
            }
            catalog.put(program.id(), program);
        }
        return catalog;
    }

    public static Map<String, RegionDefinition> loadRegions(Path configDir) {
        List<RegionDefinition> regions = read(configDir.resolve(REGIONS_FILE), new TypeReference<List<RegionDefinition>>() {
        });
        Map<String, RegionDefinition> byId = new LinkedHashMap<>();
        for (RegionDefinition region : regions) {
            byId.put(region.id(), region);
        }
        return byId;
    }

    public static GeoClassifier loadGeoClassifier(Path configDir) {
        List<GeoClassification> classifications = read(configDir.resolve(GEO_CLASSIFICATIONS_FILE),
                new TypeReference<List<GeoClassification>>() {
        });
        return new GeoClassifier(classifications);
    }

    public static List<Entity> loadRegistry(Path configDir) {
        return read(configDir.resolve(REGISTRY_FILE), new TypeReference<List<Entity>>() {
        });
    }

    public static EngineSettings loadEngineSettings(Path configDir) {
        return read(configDir.resolve(ENGINE_FILE), new TypeReference<EngineSettings>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Empty config in " + path);
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
