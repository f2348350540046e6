package com.advocacypacket.scoring.economic;

import com.advocacypacket.core.model.AwardRecord;
import com.advocacypacket.core.model.DistrictImpact;
import com.advocacypacket.core.model.DistrictOverlap;
import com.advocacypacket.core.model.EconomicSummary;
import com.advocacypacket.core.model.ProgramEconomicImpact;
import com.advocacypacket.core.model.ProgramRecord;
import com.advocacypacket.scoring.config.EconomicConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns observed award amounts into multiplier-range economic impact and jobs estimates.
 * Catalog programs without observed funding fall back to a labeled benchmark estimate.
 * Pure computation: no I/O.
 */
public class EconomicImpactCalculator {
    private static final Logger LOGGER = Logger.getLogger(EconomicImpactCalculator.class.getName());
    private static final String UNKNOWN_PROGRAM = "unknown";

    private final EconomicConfig config;

    public EconomicImpactCalculator() {
        this(EconomicConfig.defaults());
    }

    public EconomicImpactCalculator(EconomicConfig config) {
        this.config = config;
    }

    public EconomicSummary compute(
            String entityId,
            List<AwardRecord> awards,
            List<DistrictOverlap> districts,
            Map<String, ProgramRecord> programs
    ) {
        Map<String, Double> obligationsByProgram = groupObligations(awards);

        List<ProgramEconomicImpact> byProgram = new ArrayList<>();
        for (Map.Entry<String, Double> entry : obligationsByProgram.entrySet()) {
            byProgram.add(programImpact(entry.getKey(), entry.getValue(), false));
        }
        for (String programId : programs.keySet()) {
            if (obligationsByProgram.containsKey(programId)) {
                continue;
            }
            Double benchmark = config.benchmarkAverages().get(programId);
            if (benchmark == null) {
                continue;
            }
            byProgram.add(programImpact(programId, benchmark, true));
        }
        byProgram.sort(Comparator.comparing(ProgramEconomicImpact::benchmark)
                .thenComparing(Comparator.comparingDouble(ProgramEconomicImpact::totalObligation).reversed()));

        double totalObligation = 0.0;
        double totalImpactLow = 0.0;
        double totalImpactHigh = 0.0;
        double totalJobsLow = 0.0;
        double totalJobsHigh = 0.0;
        for (ProgramEconomicImpact impact : byProgram) {
            totalObligation += impact.totalObligation();
            totalImpactLow += impact.impactLow();
            totalImpactHigh += impact.impactHigh();
            totalJobsLow += impact.jobsLow();
            totalJobsHigh += impact.jobsHigh();
        }

        Map<String, DistrictImpact> byDistrict = new LinkedHashMap<>();
        for (DistrictOverlap district : districts == null ? List.<DistrictOverlap>of() : districts) {
            Double pct = district.overlapPct();
            if (pct == null || !(pct > 0)) {
                continue;
            }
            double fraction = pct / 100.0;
            String key = district.district() == null ? "unknown" : district.district();
            byDistrict.put(key, new DistrictImpact(
                    pct,
                    totalObligation * fraction,
                    totalImpactLow * fraction,
                    totalImpactHigh * fraction,
                    totalJobsLow * fraction,
                    totalJobsHigh * fraction
            ));
        }

        return new EconomicSummary(
                entityId,
                totalObligation,
                totalImpactLow,
                totalImpactHigh,
                totalJobsLow,
                totalJobsHigh,
                byProgram,
                byDistrict
        );
    }

    public ProgramEconomicImpact programImpact(String programId, double obligation, boolean benchmark) {
        double millions = obligation / 1_000_000.0;
        Double bcr = config.mitigationProgramIds().contains(programId) ? config.mitigationBenefitCostRatio() : null;
        return new ProgramEconomicImpact(
                programId,
                obligation,
                config.multiplierLow(),
                config.multiplierHigh(),
                obligation * config.multiplierLow(),
                obligation * config.multiplierHigh(),
                millions * config.jobsPerMillionLow(),
                millions * config.jobsPerMillionHigh(),
                bcr,
                benchmark
        );
    }

    private Map<String, Double> groupObligations(List<AwardRecord> awards) {
        Map<String, Double> grouped = new LinkedHashMap<>();
        if (awards == null) {
            return grouped;
        }
        int skipped = 0;
        for (AwardRecord award : awards) {
            if (!award.hasUsableObligation() || award.obligation() <= 0) {
                skipped++;
                continue;
            }
            grouped.merge(programKey(award), award.obligation(), Double::sum);
        }
        if (skipped > 0) {
            LOGGER.fine("Skipped " + skipped + " award(s) without a positive numeric obligation");
        }
        return grouped;
    }

    private static String programKey(AwardRecord award) {
        if (award.programId() != null && !award.programId().isBlank()) {
            return award.programId();
        }
        if (award.cfda() != null && !award.cfda().isBlank()) {
            return award.cfda();
        }
        return UNKNOWN_PROGRAM;
    }
}
