package com.advocacypacket.scoring.geo;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GeoClassification(
        String id,
        String name,
        List<String> jurisdictions,
        @JsonProperty("priority_programs") List<String> priorityPrograms
) {
    public GeoClassification {
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        priorityPrograms = priorityPrograms == null ? List.of() : List.copyOf(priorityPrograms);
    }
}
