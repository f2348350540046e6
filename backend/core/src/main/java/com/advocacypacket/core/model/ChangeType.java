package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    CI_STATUS_CHANGE("ci_status_change"),
    NEW_AWARD("new_award"),
    AWARD_TOTAL_CHANGE("award_total_change"),
    ADVOCACY_GOAL_SHIFT("advocacy_goal_shift"),
    NEW_THREAT("new_threat");

    private final String tag;

    ChangeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
