package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record Entity(
        String id,
        String name,
        List<String> jurisdictions,
        @JsonProperty("geo_classifications") List<String> geoClassifications
) {
    public Entity {
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
        geoClassifications = geoClassifications == null ? List.of() : List.copyOf(geoClassifications);
    }
}
