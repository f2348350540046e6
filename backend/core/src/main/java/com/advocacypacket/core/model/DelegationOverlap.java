package com.advocacypacket.core.model;

import java.util.List;

public record DelegationOverlap(
        String memberName,
        String role,
        int entityCount,
        List<String> entityIds,
        List<String> committees
) {
    public DelegationOverlap {
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
        committees = committees == null ? List.of() : List.copyOf(committees);
    }
}
