package com.advocacypacket.core.model;

import java.util.List;

public record DelegationMember(
        String memberId,
        String name,
        MemberRole role,
        String state,
        List<String> committees
) {
    public DelegationMember {
        committees = committees == null ? List.of() : List.copyOf(committees);
    }

    /**
     * Stable identity across entities: the member id when present, otherwise the display name.
     */
    public String identity() {
        if (memberId != null && !memberId.isBlank()) {
            return memberId;
        }
        return name == null ? "" : name;
    }
}
