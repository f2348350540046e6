package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProgramRecord(
        String id,
        String name,
        String agency,
        PriorityTier priority,
        @JsonProperty("funding_type") String fundingType,
        @JsonProperty("cfda") List<String> cfdaNumbers,
        @JsonProperty("ci_status") String ciStatus
) {
    public ProgramRecord {
        priority = priority == null ? PriorityTier.MEDIUM : priority;
        cfdaNumbers = cfdaNumbers == null ? List.of() : List.copyOf(cfdaNumbers);
    }

    public boolean critical() {
        return priority == PriorityTier.CRITICAL;
    }
}
