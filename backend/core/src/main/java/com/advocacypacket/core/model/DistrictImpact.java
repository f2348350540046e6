package com.advocacypacket.core.model;

public record DistrictImpact(
        double overlapPct,
        double obligation,
        double impactLow,
        double impactHigh,
        double jobsLow,
        double jobsHigh
) {
}
