package com.advocacypacket.core.model;

public record ChangeRecord(ChangeType type, String description) {
}
