package com.advocacypacket.core.events;

import com.advocacypacket.core.model.ChangeRecord;

import java.time.Instant;
import java.util.List;

public record ChangesDetected(
        Instant timestamp,
        String entityId,
        Instant previousGeneratedAt,
        List<ChangeRecord> changes
) implements Event {
    public ChangesDetected {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    @Override
    public String type() {
        return "ChangesDetected";
    }
}
