package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DistrictOverlap(String district, @JsonProperty("overlap_pct") Double overlapPct) {
}
