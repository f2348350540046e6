package com.advocacypacket.service.ingest;

import com.advocacypacket.core.model.HazardObservation;
import com.advocacypacket.core.model.HazardProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads a hazard cache document into a {@link HazardProfile}. NRI data may sit at {@code fema_nri} or
 * under {@code sources.fema_nri}; both shapes produce the same profile.
 */
public class HazardProfileNormalizer {
    private static final Logger LOGGER = Logger.getLogger(HazardProfileNormalizer.class.getName());

    public HazardProfile normalize(JsonNode document) {
        JsonNode nri = locateNri(document);
        if (nri == null) {
            return HazardProfile.empty();
        }

        List<HazardObservation> topHazards = new ArrayList<>();
        int skipped = 0;
        for (JsonNode hazard : JsonFields.elements(nri.get("top_hazards"))) {
            if (!hazard.isObject()) {
                skipped++;
                continue;
            }
            topHazards.add(new HazardObservation(
                    JsonFields.text(hazard, "code"),
                    JsonFields.text(hazard, "type"),
                    JsonFields.number(hazard.get("risk_score")),
                    JsonFields.text(hazard, "risk_rating", "rating"),
                    JsonFields.number(hazard.has("eal_total") ? hazard.get("eal_total") : hazard.get("expected_annual_loss"))
            ));
        }
        if (skipped > 0) {
            LOGGER.warning("Skipped " + skipped + " malformed hazard entr" + (skipped == 1 ? "y" : "ies"));
        }

        JsonNode composite = nri.get("composite");
        Double compositeScore = composite != null && composite.isObject()
                ? JsonFields.number(composite.get("risk_score"))
                : JsonFields.number(nri.get("risk_score"));
        Double vulnerability = composite != null && composite.isObject()
                ? JsonFields.number(composite.get("sovi_score"))
                : null;
        return new HazardProfile(topHazards, compositeScore, vulnerability);
    }

    private static JsonNode locateNri(JsonNode document) {
        if (document == null || !document.isObject()) {
            return null;
        }
        JsonNode direct = document.get("fema_nri");
        if (direct != null && direct.isObject() && !direct.isEmpty()) {
            return direct;
        }
        JsonNode sources = document.get("sources");
        if (sources != null && sources.isObject()) {
            JsonNode nested = sources.get("fema_nri");
            if (nested != null && nested.isObject() && !nested.isEmpty()) {
                return nested;
            }
        }
        return null;
    }
}
