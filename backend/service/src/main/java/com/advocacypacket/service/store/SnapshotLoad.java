package com.advocacypacket.service.store;

import com.advocacypacket.core.model.Snapshot;

import java.util.Optional;

/**
 * Outcome of reading a stored snapshot. An unreadable file is reported separately from a missing one
 * so callers can surface degraded history.
 */
public record SnapshotLoad(Status status, Snapshot snapshot, String reason) {
    public enum Status {
        ABSENT,
        LOADED,
        UNREADABLE
    }

    public static SnapshotLoad absent() {
        return new SnapshotLoad(Status.ABSENT, null, null);
    }

    public static SnapshotLoad loaded(Snapshot snapshot) {
        return new SnapshotLoad(Status.LOADED, snapshot, null);
    }

    public static SnapshotLoad unreadable(String reason) {
        return new SnapshotLoad(Status.UNREADABLE, null, reason);
    }

    public Optional<Snapshot> asOptional() {
        return Optional.ofNullable(snapshot);
    }

    public boolean unreadable() {
        return status == Status.UNREADABLE;
    }
}
