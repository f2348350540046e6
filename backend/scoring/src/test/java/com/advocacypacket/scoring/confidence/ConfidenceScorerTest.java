package com.advocacypacket.scoring.confidence;

import com.advocacypacket.core.model.ConfidenceAnnotation;
import com.advocacypacket.core.model.ConfidenceLevel;
import com.advocacypacket.scoring.config.ConfidenceConfig;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfidenceScorerTest {
    private static final Instant REFERENCE = Instant.parse("2026-02-01T00:00:00Z");

    private final ConfidenceScorer scorer = new ConfidenceScorer(
            ConfidenceConfig.defaults(),
            Clock.fixed(REFERENCE, ZoneOffset.UTC)
    );

    @Test
    void freshDataKeepsFullSourceWeight() {
        assertEquals(0.85, scorer.score(0.85, "2026-02-01T00:00:00Z", 0.01, REFERENCE));
        assertEquals(0.7, scorer.score(0.7, "2026-01-31T12:00:00Z", 0.01, REFERENCE));
    }

    @Test
    void futureTimestampsCountAsZeroDaysOld() {
        assertEquals(0.9, scorer.score(0.9, "2026-03-01T00:00:00Z", 0.01, REFERENCE));
    }

    @Test
    void veryOldDataDecaysToZero() {
        assertEquals(0.0, scorer.score(0.9, "1900-01-01", 0.01, REFERENCE));
    }

    @Test
    void scoreNeverIncreasesWithAge() {
        double previous = Double.MAX_VALUE;
        for (int days = 0; days <= 400; days += 7) {
            String updated = REFERENCE.minus(days, ChronoUnit.DAYS).toString();
            double current = scorer.score(0.8, updated, 0.01, REFERENCE);
            assertTrue(current <= previous, "score rose at " + days + " days");
            previous = current;
        }
    }

    @Test
    void acceptsDateOnlyAndZonelessTimestamps() {
        assertEquals(0.724, scorer.score(0.8, "2026-01-22", 0.01, REFERENCE));
        assertEquals(0.724, scorer.score(0.8, "2026-01-22T00:00:00", 0.01, REFERENCE));
        assertEquals(0.724, scorer.score(0.8, "2026-01-21T21:00:00-03:00", 0.01, REFERENCE));
    }

    @Test
    void acceptsSpaceSeparatedTimestamps() {
        assertEquals(Optional.of(Instant.parse("2026-01-22T10:00:00Z")),
                ConfidenceScorer.parseTimestamp("2026-01-22 10:00:00"));
        assertEquals(Optional.of(Instant.parse("2026-01-22T10:00:00Z")),
                ConfidenceScorer.parseTimestamp("2026-01-22 12:00:00+02:00"));
        assertEquals(0.724, scorer.score(0.8, "2026-01-22 00:00:00", 0.01, REFERENCE));
    }

    @Test
    void unparsableOrMissingTimestampIsTreatedAsAYearStale() {
        assertEquals(0.026, scorer.score(1.0, "not-a-date", 0.01, REFERENCE));
        assertEquals(0.026, scorer.score(1.0, null, 0.01, REFERENCE));
        assertEquals(0.026, scorer.score(1.0, "  ", 0.01, REFERENCE));
    }

    @Test
    void levelsUseConfiguredThresholds() {
        assertEquals(ConfidenceLevel.HIGH, scorer.level(0.7));
        assertEquals(ConfidenceLevel.HIGH, scorer.level(1.0));
        assertEquals(ConfidenceLevel.MEDIUM, scorer.level(0.69));
        assertEquals(ConfidenceLevel.MEDIUM, scorer.level(0.4));
        assertEquals(ConfidenceLevel.LOW, scorer.level(0.399));
        assertEquals(ConfidenceLevel.LOW, scorer.level(0.0));
    }

    @Test
    void sourceWeightFallsBackForUnknownSources() {
        assertEquals(0.90, scorer.sourceWeight("federal_register"));
        assertEquals(0.70, scorer.sourceWeight("usaspending"));
        assertEquals(0.50, scorer.sourceWeight("hand_entered"));
        assertEquals(0.50, scorer.sourceWeight(null));
    }

    @Test
    void annotateCombinesWeightFreshnessAndLevel() {
        ConfidenceAnnotation fresh = scorer.annotate("federal_register", "2026-02-01");
        ConfidenceAnnotation unknown = scorer.annotate("mystery_feed", null);

        assertEquals(0.9, fresh.score());
        assertEquals(ConfidenceLevel.HIGH, fresh.level());
        assertEquals("federal_register", fresh.source());
        assertEquals(0.013, unknown.score());
        assertEquals(ConfidenceLevel.LOW, unknown.level());
    }

    @Test
    void injectedDecayRateAndWeightsOverrideDefaults() {
        ConfidenceScorer custom = new ConfidenceScorer(
                ConfidenceConfig.defaults().withDecayRate(0.0).withSourceWeights(Map.of("usaspending", 0.95)),
                Clock.fixed(REFERENCE, ZoneOffset.UTC)
        );

        ConfidenceAnnotation annotation = custom.annotate("usaspending", "2020-01-01");

        assertEquals(0.95, annotation.score());
        assertEquals(ConfidenceLevel.HIGH, annotation.level());
    }
}
