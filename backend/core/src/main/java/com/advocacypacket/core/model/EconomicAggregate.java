package com.advocacypacket.core.model;

public record EconomicAggregate(double totalLow, double totalHigh, double totalJobsLow, double totalJobsHigh) {
    public static final EconomicAggregate ZERO = new EconomicAggregate(0.0, 0.0, 0.0, 0.0);
}
