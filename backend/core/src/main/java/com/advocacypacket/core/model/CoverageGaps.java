package com.advocacypacket.core.model;

import java.util.List;

public record CoverageGaps(List<String> withoutAwards, List<String> withoutHazards, List<String> withoutDelegation) {
    public CoverageGaps {
        withoutAwards = withoutAwards == null ? List.of() : List.copyOf(withoutAwards);
        withoutHazards = withoutHazards == null ? List.of() : List.copyOf(withoutHazards);
        withoutDelegation = withoutDelegation == null ? List.of() : List.copyOf(withoutDelegation);
    }
}
