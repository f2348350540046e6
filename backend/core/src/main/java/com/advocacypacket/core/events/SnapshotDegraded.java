package com.advocacypacket.core.events;

import java.time.Instant;

public record SnapshotDegraded(
        Instant timestamp,
        String entityId,
        String reason
) implements Event {
    @Override
    public String type() {
        return "SnapshotDegraded";
    }
}
