package com.advocacypacket.core.model;

public record ProgramEconomicImpact(
        String programId,
        double totalObligation,
        double multiplierLow,
        double multiplierHigh,
        double impactLow,
        double impactHigh,
        double jobsLow,
        double jobsHigh,
        Double benefitCostRatio,
        boolean benchmark
) {
}
