package com.advocacypacket.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compact projection of one generation's computed state, persisted per entity id.
 */
public record Snapshot(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("program_states") Map<String, String> programStates,
        @JsonProperty("total_awards") int totalAwards,
        @JsonProperty("total_obligation") double totalObligation,
        @JsonProperty("top_hazards") List<String> topHazards,
        @JsonProperty("advocacy_goal") String advocacyGoal
) {
    public static final String GOAL_NEW_APPLICANT = "new_applicant";
    public static final String GOAL_RENEWAL = "renewal";

    public Snapshot {
        Map<String, String> states = new LinkedHashMap<>();
        if (programStates != null) {
            programStates.forEach((program, status) -> {
                if (program != null && status != null) {
                    states.put(program, status);
                }
            });
        }
        programStates = Collections.unmodifiableMap(states);
        topHazards = topHazards == null
                ? List.of()
                : topHazards.stream().filter(Objects::nonNull).toList();
        advocacyGoal = advocacyGoal == null ? "" : advocacyGoal;
    }
}
