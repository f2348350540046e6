package com.advocacypacket.scoring.geo;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Maps jurisdiction codes to geographic classifications and exposes each classification's
 * priority programs. Lookup only; no geospatial computation.
 */
public class GeoClassifier {
    private static final Logger LOGGER = Logger.getLogger(GeoClassifier.class.getName());

    private final Map<String, GeoClassification> byId = new LinkedHashMap<>();
    private final Map<String, String> classificationByJurisdiction = new HashMap<>();

    public GeoClassifier(Collection<GeoClassification> classifications) {
        for (GeoClassification classification : classifications) {
            byId.put(classification.id(), classification);
            for (String jurisdiction : classification.jurisdictions()) {
                classificationByJurisdiction.put(normalize(jurisdiction), classification.id());
            }
        }
    }

    public static GeoClassifier empty() {
        return new GeoClassifier(List.of());
    }

    /**
     * Returns the sorted, de-duplicated classification ids covering the given jurisdictions.
     */
    public List<String> classify(Collection<String> jurisdictions) {
        TreeSet<String> result = new TreeSet<>();
        for (String jurisdiction : jurisdictions) {
            if (jurisdiction == null) {
                continue;
            }
            String id = classificationByJurisdiction.get(normalize(jurisdiction));
            if (id == null) {
                LOGGER.warning("Jurisdiction '" + jurisdiction + "' not found in geographic classification mapping");
                continue;
            }
            result.add(id);
        }
        return List.copyOf(result);
    }

    public List<String> priorityPrograms(String classificationId) {
        GeoClassification classification = byId.get(classificationId);
        if (classification == null) {
            LOGGER.warning("Unknown geographic classification: '" + classificationId + "'");
            return List.of();
        }
        return classification.priorityPrograms();
    }

    public Collection<GeoClassification> all() {
        return List.copyOf(byId.values());
    }

    private static String normalize(String jurisdiction) {
        return jurisdiction.trim().toUpperCase(Locale.ROOT);
    }
}
