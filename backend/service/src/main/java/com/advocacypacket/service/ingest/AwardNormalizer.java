package com.advocacypacket.service.ingest;

import com.advocacypacket.core.model.AwardRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Accepts either a bare array of awards or a document with an {@code awards} array.
 * Obligations that are neither numbers nor numeric strings become null and are ignored downstream.
 */
public class AwardNormalizer {
    public List<AwardRecord> normalize(JsonNode document) {
        if (document == null) {
            return List.of();
        }
        JsonNode array = document.isArray() ? document : document.get("awards");
        List<AwardRecord> awards = new ArrayList<>();
        for (JsonNode award : JsonFields.elements(array)) {
            if (!award.isObject()) {
                continue;
            }
            awards.add(new AwardRecord(
                    JsonFields.text(award, "program_id"),
                    JsonFields.text(award, "cfda"),
                    JsonFields.number(award.get("obligation")),
                    JsonFields.text(award, "start_date"),
                    JsonFields.text(award, "end_date")
            ));
        }
        return awards;
    }
}
