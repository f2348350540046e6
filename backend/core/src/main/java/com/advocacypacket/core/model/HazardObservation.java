package com.advocacypacket.core.model;

public record HazardObservation(
        String code,
        String type,
        Double riskScore,
        String rating,
        Double expectedAnnualLoss
) {
}
