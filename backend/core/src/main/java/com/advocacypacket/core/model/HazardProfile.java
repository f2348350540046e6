package com.advocacypacket.core.model;

import java.util.List;

/**
 * Ranked hazard observations for one entity. An empty profile is a valid state.
 */
public record HazardProfile(
        List<HazardObservation> topHazards,
        Double compositeRiskScore,
        Double vulnerabilityScore
) {
    private static final HazardProfile EMPTY = new HazardProfile(List.of(), null, null);

    public HazardProfile {
        topHazards = topHazards == null ? List.of() : List.copyOf(topHazards);
    }

    public static HazardProfile empty() {
        return EMPTY;
    }

    public boolean hasCompositeScore() {
        return compositeRiskScore != null && !compositeRiskScore.isNaN() && compositeRiskScore != 0.0;
    }

    public boolean isEmpty() {
        return topHazards.isEmpty() && compositeRiskScore == null && vulnerabilityScore == null;
    }
}
