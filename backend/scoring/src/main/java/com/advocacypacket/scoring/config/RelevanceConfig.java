package com.advocacypacket.scoring.config;

import com.advocacypacket.core.model.PriorityTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scoring constants and size bounds for program relevance filtering.
 *
 * @param hazardProgramMap NRI hazard code to the programs that address it
 * @param hazardNameToCode lower-case hazard display name to NRI hazard code
 */
public record RelevanceConfig(
        int minPrograms,
        int maxPrograms,
        int absoluteMinPrograms,
        Map<PriorityTier, Integer> tierWeights,
        Set<String> alwaysRelevant,
        int alwaysRelevantBonus,
        int criticalBonus,
        Map<String, List<String>> hazardProgramMap,
        Map<String, String> hazardNameToCode,
        int hazardBonusTop,
        int hazardBonusStep,
        int hazardBonusFloor,
        int geoPriorityBonus
) {
    public RelevanceConfig {
        tierWeights = tierWeights == null ? Map.of() : Map.copyOf(tierWeights);
        alwaysRelevant = alwaysRelevant == null ? Set.of() : Set.copyOf(alwaysRelevant);
        hazardProgramMap = hazardProgramMap == null ? Map.of() : Map.copyOf(hazardProgramMap);
        hazardNameToCode = hazardNameToCode == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hazardNameToCode));
    }

    public static RelevanceConfig defaults() {
        Map<PriorityTier, Integer> weights = new EnumMap<>(PriorityTier.class);
        weights.put(PriorityTier.CRITICAL, 30);
        weights.put(PriorityTier.HIGH, 20);
        weights.put(PriorityTier.MEDIUM, 10);
        weights.put(PriorityTier.LOW, 5);

        Map<String, List<String>> hazards = new LinkedHashMap<>();
        hazards.put("WFIR", List.of("usda_wildfire", "fema_bric", "fema_tribal_mitigation", "bia_tcr"));
        hazards.put("CFLD", List.of("fema_bric", "fema_tribal_mitigation", "epa_stag", "usbr_watersmart"));
        hazards.put("RFLD", List.of("fema_bric", "fema_tribal_mitigation", "epa_stag", "usbr_watersmart"));
        hazards.put("DRGT", List.of("usbr_watersmart", "usbr_tap", "bia_tcr"));
        hazards.put("HRCN", List.of("fema_bric", "fema_tribal_mitigation", "hud_ihbg"));
        hazards.put("ERQK", List.of("fema_bric", "fema_tribal_mitigation"));
        hazards.put("HWAV", List.of("bia_tcr", "hud_ihbg", "doe_indian_energy"));
        hazards.put("CWAV", List.of("hud_ihbg", "doe_indian_energy", "bia_tcr"));
        hazards.put("TRND", List.of("fema_bric", "fema_tribal_mitigation", "hud_ihbg"));
        hazards.put("SWND", List.of("fema_bric", "fema_tribal_mitigation"));
        hazards.put("HAIL", List.of("fema_bric", "fema_tribal_mitigation"));
        hazards.put("WNTW", List.of("hud_ihbg", "fema_bric", "dot_protect"));
        hazards.put("ISTM", List.of("hud_ihbg", "fema_bric", "doe_indian_energy"));
        hazards.put("AVLN", List.of("fema_bric", "bia_tcr"));
        hazards.put("LNDS", List.of("fema_bric", "fema_tribal_mitigation", "dot_protect"));
        hazards.put("VLCN", List.of("fema_bric", "bia_tcr"));
        hazards.put("TSUN", List.of("fema_bric", "fema_tribal_mitigation", "noaa_tribal"));
        hazards.put("LTNG", List.of("fema_bric", "bia_tcr"));

        // Iteration order matters for substring matching.
        Map<String, String> names = new LinkedHashMap<>();
        names.put("wildfire", "WFIR");
        names.put("coastal flooding", "CFLD");
        names.put("riverine flooding", "RFLD");
        names.put("drought", "DRGT");
        names.put("hurricane", "HRCN");
        names.put("earthquake", "ERQK");
        names.put("heat wave", "HWAV");
        names.put("cold wave", "CWAV");
        names.put("tornado", "TRND");
        names.put("strong wind", "SWND");
        names.put("hail", "HAIL");
        names.put("winter weather", "WNTW");
        names.put("ice storm", "ISTM");
        names.put("avalanche", "AVLN");
        names.put("landslide", "LNDS");
        names.put("volcanic activity", "VLCN");
        names.put("tsunami", "TSUN");
        names.put("lightning", "LTNG");

        return new RelevanceConfig(
                8,
                12,
                3,
                weights,
                Set.of("bia_tcr", "irs_elective_pay", "epa_gap"),
                15,
                50,
                hazards,
                names,
                25,
                5,
                5,
                10
        );
    }

    public int weightOf(PriorityTier tier) {
        return tierWeights.getOrDefault(tier, tierWeights.getOrDefault(PriorityTier.LOW, 5));
    }

    public int hazardBonus(int rank) {
        return Math.max(hazardBonusTop - rank * hazardBonusStep, hazardBonusFloor);
    }
}
