package com.advocacypacket.core.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
