package com.advocacypacket.scoring.confidence;

import com.advocacypacket.core.model.ConfidenceAnnotation;
import com.advocacypacket.core.model.ConfidenceLevel;
import com.advocacypacket.scoring.config.ConfidenceConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Freshness- and authority-weighted trust score for a displayed data point:
 * {@code weight * e^(-decayRate * days)} where {@code days} is the whole-day age of the data.
 *
 * <p>With the default decay rate of 0.01 the half-life is roughly 69 days.
 */
public class ConfidenceScorer {
    private static final Logger LOGGER = Logger.getLogger(ConfidenceScorer.class.getName());

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            // "2026-01-22 10:00:00" style, with or without an offset
            text -> OffsetDateTime.parse(text.replace(' ', 'T')).toInstant(),
            text -> LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private final ConfidenceConfig config;
    private final Clock clock;

    public ConfidenceScorer() {
        this(ConfidenceConfig.defaults(), Clock.systemUTC());
    }

    public ConfidenceScorer(ConfidenceConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public double score(double sourceWeight, String lastUpdated) {
        return score(sourceWeight, lastUpdated, config.decayRate(), clock.instant());
    }

    public double score(double sourceWeight, String lastUpdated, double decayRate, Instant referenceTime) {
        long days = parseTimestamp(lastUpdated)
                .map(updated -> Math.max(0L, Duration.between(updated, referenceTime).toDays()))
                .orElseGet(() -> {
                    LOGGER.warning("Could not parse last-updated value '" + lastUpdated + "', assuming stale");
                    return (long) config.unknownAgeDays();
                });
        return round3(sourceWeight * Math.exp(-decayRate * days));
    }

    public ConfidenceLevel level(double score) {
        if (score >= config.highThreshold()) {
            return ConfidenceLevel.HIGH;
        }
        if (score >= config.mediumThreshold()) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    public double sourceWeight(String source) {
        if (source == null) {
            return config.fallbackWeight();
        }
        return config.sourceWeights().getOrDefault(source, config.fallbackWeight());
    }

    public ConfidenceAnnotation annotate(String source, String lastUpdated) {
        double score = score(sourceWeight(source), lastUpdated);
        return new ConfidenceAnnotation(source, lastUpdated, score, level(score));
    }

    static Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return Optional.of(parser.apply(trimmed));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Optional.empty();
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
