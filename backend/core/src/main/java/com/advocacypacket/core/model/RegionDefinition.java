package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Configured grouping of entities. An empty jurisdiction list matches every entity.
 */
public record RegionDefinition(
        String id,
        String name,
        @JsonProperty("short_name") String shortName,
        List<String> jurisdictions,
        @JsonProperty("priority_programs") List<String> priorityPrograms,
        @JsonProperty("core_frame") String coreFrame
) {
    public RegionDefinition {
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        priorityPrograms = priorityPrograms == null ? List.of() : List.copyOf(priorityPrograms);
        shortName = shortName == null ? name : shortName;
        coreFrame = coreFrame == null ? "" : coreFrame;
    }

    public boolean wildcard() {
        return jurisdictions.isEmpty();
    }
}
