package com.advocacypacket.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record EconomicSummary(
        String entityId,
        double totalObligation,
        double totalImpactLow,
        double totalImpactHigh,
        double totalJobsLow,
        double totalJobsHigh,
        List<ProgramEconomicImpact> byProgram,
        Map<String, DistrictImpact> byDistrict
) {
    public EconomicSummary {
        byProgram = byProgram == null ? List.of() : List.copyOf(byProgram);
        byDistrict = byDistrict == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byDistrict));
    }

    public static EconomicSummary empty(String entityId) {
        return new EconomicSummary(entityId, 0.0, 0.0, 0.0, 0.0, 0.0, List.of(), Map.of());
    }
}
