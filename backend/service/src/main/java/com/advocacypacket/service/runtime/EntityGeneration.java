package com.advocacypacket.service.runtime;

import com.advocacypacket.core.model.ChangeRecord;
import com.advocacypacket.core.model.ComputedEntityContext;
import com.advocacypacket.core.model.Snapshot;

import java.time.Instant;
import java.util.List;

/**
 * Result of one generation for an entity. {@code previousGeneratedAt} is null on first generation.
 */
public record EntityGeneration(
        ComputedEntityContext context,
        List<ChangeRecord> changes,
        Instant previousGeneratedAt,
        Snapshot snapshot
) {
    public EntityGeneration {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public boolean firstGeneration() {
        return previousGeneratedAt == null;
    }
}
