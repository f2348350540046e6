package com.advocacypacket.core.events;

import java.time.Instant;

public record RegionAggregated(
        Instant timestamp,
        String regionId,
        int entityCount,
        int awardCoverage,
        int overlappingMembers
) implements Event {
    @Override
    public String type() {
        return "RegionAggregated";
    }
}
