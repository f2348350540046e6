package com.advocacypacket.core.model;

import java.util.List;

public record Delegation(List<DelegationMember> senators, List<DelegationMember> representatives) {
    private static final Delegation EMPTY = new Delegation(List.of(), List.of());

    public Delegation {
        senators = senators == null ? List.of() : List.copyOf(senators);
        representatives = representatives == null ? List.of() : List.copyOf(representatives);
    }

    public static Delegation empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return senators.isEmpty() && representatives.isEmpty();
    }
}
