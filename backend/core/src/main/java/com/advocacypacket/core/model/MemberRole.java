package com.advocacypacket.core.model;

public enum MemberRole {
    SENATOR("Senator"),
    REPRESENTATIVE("Representative");

    private final String displayName;

    MemberRole(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
