package com.discharge.reconciliation.aggregate;

/**
 * Validation counters and rates for a group of stays.
 * Percentages are relative to {@code total}, rounded half-up to one decimal, and zero for an empty group.
 *
 * @param total            stays in the group
 * @param onTime           stays validated on or before the discharge day
 * @param late             stays validated after the discharge day
 * @param unmatched        stays without an attributed document
 * @param matched          on-time plus late
 * @param matchedPercent   share of matched stays
 * @param onTimePercent    share of on-time stays
 * @param latePercent      share of late stays
 * @param unmatchedPercent share of unmatched stays
 * @param meanDelayDays    mean final delay among matched stays, zero when none
 */
public record ValidationStatistics(
        long total,
        long onTime,
        long late,
        long unmatched,
        long matched,
        double matchedPercent,
        double onTimePercent,
        double latePercent,
        double unmatchedPercent,
        double meanDelayDays
) {
    public ValidationStatistics {
        if (onTime + late + unmatched != total) {
            throw new IllegalArgumentException("on-time + late + unmatched must equal total");
        }
        if (matched != onTime + late) {
            throw new IllegalArgumentException("matched must equal on-time + late");
        }
    }

    public static ValidationStatistics empty() {
        return new ValidationStatistics(0, 0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
