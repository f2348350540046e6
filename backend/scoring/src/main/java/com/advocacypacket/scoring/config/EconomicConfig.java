package com.advocacypacket.scoring.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Published multiplier bounds and benchmark averages used by the economic impact calculator.
 *
 * <p>Output multipliers follow BEA RIMS II (1.8-2.4x), employment follows BLS employment
 * requirements (8-15 jobs per $1M) and the mitigation benefit-cost ratio follows FEMA/NIBS
 * MitSaves (4:1).
 */
public record EconomicConfig(
        double multiplierLow,
        double multiplierHigh,
        double jobsPerMillionLow,
        double jobsPerMillionHigh,
        double mitigationBenefitCostRatio,
        Set<String> mitigationProgramIds,
        Map<String, Double> benchmarkAverages
) {
    public EconomicConfig {
        mitigationProgramIds = mitigationProgramIds == null ? Set.of() : Set.copyOf(mitigationProgramIds);
        benchmarkAverages = benchmarkAverages == null ? Map.of() : Map.copyOf(benchmarkAverages);
    }

    public static EconomicConfig defaults() {
        Map<String, Double> benchmarks = new LinkedHashMap<>();
        benchmarks.put("bia_tcr", 150_000.0);
        benchmarks.put("fema_bric", 500_000.0);
        benchmarks.put("irs_elective_pay", 200_000.0);
        benchmarks.put("epa_stag", 100_000.0);
        benchmarks.put("epa_gap", 75_000.0);
        benchmarks.put("fema_tribal_mitigation", 300_000.0);
        benchmarks.put("dot_protect", 250_000.0);
        benchmarks.put("usda_wildfire", 350_000.0);
        benchmarks.put("doe_indian_energy", 200_000.0);
        benchmarks.put("hud_ihbg", 400_000.0);
        benchmarks.put("noaa_tribal", 150_000.0);
        benchmarks.put("fhwa_ttp_safety", 180_000.0);
        benchmarks.put("usbr_watersmart", 250_000.0);
        benchmarks.put("usbr_tap", 120_000.0);
        benchmarks.put("bia_tcr_awards", 100_000.0);
        benchmarks.put("epa_tribal_air", 80_000.0);
        return new EconomicConfig(
                1.8,
                2.4,
                8,
                15,
                4.0,
                Set.of("fema_bric", "fema_tribal_mitigation", "usda_wildfire"),
                benchmarks
        );
    }
}
