package com.advocacypacket.service.ingest;

import com.advocacypacket.core.model.Entity;
import com.advocacypacket.core.model.EntityInputs;
import com.advocacypacket.core.util.JsonUtils;
import com.advocacypacket.service.store.EntityIds;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Assembles {@link EntityInputs} from the per-entity cache files written by the upstream fetchers:
 * {@code hazards/<id>.json}, {@code awards/<id>.json} and {@code congress/<id>.json}.
 */
public class EntityCacheReader {
    private static final Logger LOGGER = Logger.getLogger(EntityCacheReader.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    public static final String HAZARD_SOURCE = "fema_nri";
    public static final String AWARD_SOURCE = "usaspending";
    public static final String CONGRESS_SOURCE = "congressional_cache";
    public static final long DEFAULT_MAX_CACHE_BYTES = 10L * 1024 * 1024;

    private final Path cacheDir;
    private final long maxCacheBytes;
    private final HazardProfileNormalizer hazards = new HazardProfileNormalizer();
    private final AwardNormalizer awards = new AwardNormalizer();
    private final DelegationNormalizer delegation = new DelegationNormalizer();

    public EntityCacheReader(Path cacheDir) {
        this(cacheDir, DEFAULT_MAX_CACHE_BYTES);
    }

    public EntityCacheReader(Path cacheDir, long maxCacheBytes) {
        this.cacheDir = cacheDir;
        this.maxCacheBytes = maxCacheBytes;
    }

    public EntityInputs read(Entity entity) {
        String id = EntityIds.requireSafe(entity.id());
        Map<String, String> timestamps = new LinkedHashMap<>();

        JsonNode hazardDoc = readCache("hazards", id);
        JsonNode awardDoc = readCache("awards", id);
        JsonNode congressDoc = readCache("congress", id);
        recordTimestamp(timestamps, HAZARD_SOURCE, hazardDoc);
        recordTimestamp(timestamps, AWARD_SOURCE, awardDoc);
        recordTimestamp(timestamps, CONGRESS_SOURCE, congressDoc);

        return new EntityInputs(
                entity,
                hazards.normalize(hazardDoc),
                awards.normalize(awardDoc),
                delegation.normalize(congressDoc),
                delegation.districts(congressDoc),
                timestamps
        );
    }

    private JsonNode readCache(String kind, String entityId) {
        Path file = cacheDir.resolve(kind).resolve(entityId + ".json");
        if (!Files.exists(file)) {
            LOGGER.fine("No " + kind + " cache for " + entityId);
            return null;
        }
        try {
            long size = Files.size(file);
            if (size > maxCacheBytes) {
                LOGGER.warning("Skipping " + kind + " cache " + file + ": " + size + " bytes exceeds " + maxCacheBytes);
                return null;
            }
            try (InputStream in = Files.newInputStream(file)) {
                return MAPPER.readTree(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unreadable " + kind + " cache " + file + ": " + e.getMessage());
            return null;
        }
    }

    private static void recordTimestamp(Map<String, String> timestamps, String source, JsonNode document) {
        if (document == null || !document.isObject()) {
            return;
        }
        String fetchedAt = JsonFields.text(document, "fetched_at", "generated_at");
        if (fetchedAt != null) {
            timestamps.put(source, fetchedAt);
        }
    }
}
