package com.advocacypacket.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stage-one output for a single entity. Rebuilt every generation and never persisted directly.
 */
public record ComputedEntityContext(
        EntityInputs inputs,
        List<String> geoClassifications,
        List<ScoredProgram> relevantPrograms,
        List<ProgramRecord> omittedPrograms,
        EconomicSummary economicSummary,
        Map<String, ConfidenceAnnotation> confidence,
        Instant generatedAt
) {
    public ComputedEntityContext {
        Objects.requireNonNull(inputs, "inputs are required");
        geoClassifications = geoClassifications == null ? List.of() : List.copyOf(geoClassifications);
        relevantPrograms = relevantPrograms == null ? List.of() : List.copyOf(relevantPrograms);
        omittedPrograms = omittedPrograms == null ? List.of() : List.copyOf(omittedPrograms);
        economicSummary = economicSummary == null ? EconomicSummary.empty(inputs.entity().id()) : economicSummary;
        confidence = confidence == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(confidence));
    }

    public Entity entity() {
        return inputs.entity();
    }

    public String entityId() {
        return inputs.entity().id();
    }

    public HazardProfile hazardProfile() {
        return inputs.hazardProfile();
    }

    public List<AwardRecord> awards() {
        return inputs.awards();
    }

    public Delegation delegation() {
        return inputs.delegation();
    }
}
