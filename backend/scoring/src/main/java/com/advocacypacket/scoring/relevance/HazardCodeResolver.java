package com.advocacypacket.scoring.relevance;

import com.advocacypacket.core.model.HazardObservation;
import com.advocacypacket.scoring.config.RelevanceConfig;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves a hazard observation to an NRI hazard code: by explicit code first, then by exact
 * display name, then by substring match in either direction.
 */
public class HazardCodeResolver {
    private static final Logger LOGGER = Logger.getLogger(HazardCodeResolver.class.getName());

    private final RelevanceConfig config;

    public HazardCodeResolver(RelevanceConfig config) {
        this.config = config;
    }

    public Optional<String> resolve(HazardObservation hazard) {
        String code = hazard.code();
        if (code != null && config.hazardProgramMap().containsKey(code)) {
            return Optional.of(code);
        }

        String normalized = hazard.type() == null ? "" : hazard.type().trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            LOGGER.warning("Could not resolve hazard without code or type: " + hazard);
            return Optional.empty();
        }
        String exact = config.hazardNameToCode().get(normalized);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (Map.Entry<String, String> entry : config.hazardNameToCode().entrySet()) {
            String name = entry.getKey();
            if (normalized.contains(name) || name.contains(normalized)) {
                return Optional.of(entry.getValue());
            }
        }

        LOGGER.warning("Could not resolve hazard to NRI code: " + hazard);
        return Optional.empty();
    }
}
