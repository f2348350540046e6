package com.advocacypacket.core.model;

/**
 * One observed funding event. {@code obligation} is null when the source value was not numeric.
 */
public record AwardRecord(
        String programId,
        String cfda,
        Double obligation,
        String startDate,
        String endDate
) {
    public boolean hasUsableObligation() {
        return obligation != null && Double.isFinite(obligation);
    }
}
