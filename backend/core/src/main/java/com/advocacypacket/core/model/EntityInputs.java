package com.advocacypacket.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw per-entity inputs produced upstream. Absent data is represented by empty values.
 */
public record EntityInputs(
        Entity entity,
        HazardProfile hazardProfile,
        List<AwardRecord> awards,
        Delegation delegation,
        List<DistrictOverlap> districts,
        Map<String, String> sourceTimestamps
) {
    public EntityInputs {
        Objects.requireNonNull(entity, "entity is required");
        hazardProfile = hazardProfile == null ? HazardProfile.empty() : hazardProfile;
        awards = awards == null ? List.of() : List.copyOf(awards);
        delegation = delegation == null ? Delegation.empty() : delegation;
        districts = districts == null ? List.of() : List.copyOf(districts);
        sourceTimestamps = sourceTimestamps == null ? Map.of() : Map.copyOf(sourceTimestamps);
    }

    public static EntityInputs of(Entity entity) {
        return new EntityInputs(entity, null, null, null, null, null);
    }
}
