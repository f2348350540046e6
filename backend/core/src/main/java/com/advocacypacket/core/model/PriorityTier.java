package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PriorityTier {
    CRITICAL("critical"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    PriorityTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Missing labels read as {@link #MEDIUM}; labels outside the known tiers read as {@link #LOW}.
     */
    @JsonCreator
    public static PriorityTier fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (PriorityTier tier : values()) {
            if (tier.label.equals(normalized)) {
                return tier;
            }
        }
        return LOW;
    }
}
