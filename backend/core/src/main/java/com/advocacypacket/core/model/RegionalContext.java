package com.advocacypacket.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Stage-two output: one region's synthesis over the contexts of its member entities.
 */
public record RegionalContext(
        String regionId,
        String regionName,
        String shortName,
        String coreFrame,
        List<String> priorityPrograms,
        List<String> jurisdictions,
        int entityCount,
        List<EntitySummary> entities,
        double totalAwards,
        int awardCoverage,
        int hazardCoverage,
        int congressionalCoverage,
        List<SharedHazard> topSharedHazards,
        double compositeRiskScore,
        EconomicAggregate economicImpact,
        List<DelegationOverlap> delegationOverlap,
        int totalSenators,
        int totalRepresentatives,
        CoverageGaps coverageGaps,
        Instant generatedAt
) {
    public RegionalContext {
        priorityPrograms = priorityPrograms == null ? List.of() : List.copyOf(priorityPrograms);
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        entities = entities == null ? List.of() : List.copyOf(entities);
        topSharedHazards = topSharedHazards == null ? List.of() : List.copyOf(topSharedHazards);
        delegationOverlap = delegationOverlap == null ? List.of() : List.copyOf(delegationOverlap);
    }

    public record EntitySummary(String entityId, String entityName, List<String> jurisdictions) {
        public EntitySummary {
            jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        }
    }
}
