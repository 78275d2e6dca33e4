package com.discharge.reconciliation.aggregate;

/**
 * Dispatch statistics among matched stays.
 *
 * @param matched                 matched stays
 * @param dispatched              matched stays whose document has a dispatch delay
 * @param dispatchedPercent       share of matched stays that were dispatched
 * @param sameDayDispatched       dispatched on the validation day
 * @param sameDayPercent          share of dispatched stays dispatched on the validation day
 * @param meanDispatchDelayDays   mean dispatch delay among dispatched stays, zero when none
 */
public record DiffusionStatistics(
        long matched,
        long dispatched,
        double dispatchedPercent,
        long sameDayDispatched,
        double sameDayPercent,
        double meanDispatchDelayDays
) {
    public static DiffusionStatistics empty() {
        return new DiffusionStatistics(0, 0, 0.0, 0, 0.0, 0.0);
    }
}
