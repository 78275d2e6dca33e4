package com.discharge.reconciliation.core.model;

/**
 * Outcome assigned to every stay.
 */
public enum Classification {
    /**
     * Discharge letter validated on the day of discharge (final delay == 0).
     */
    ON_TIME("on-time"),

    /**
     * Discharge letter validated after the day of discharge (final delay > 0).
     */
    LATE("late"),

    /**
     * No validated letter could be attributed, or no specialty could be resolved.
     */
    UNMATCHED("unmatched");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isMatched() {
        return this != UNMATCHED;
    }

    /**
     * Maps a final delay to its classification. A delay at or below zero
     * counts as validated on the day of discharge.
     */
    public static Classification fromDelay(Long finalDelay) {
        if (finalDelay == null) {
            return UNMATCHED;
        }
        return finalDelay <= 0L ? ON_TIME : LATE;
    }

    public static Classification fromLabel(String label) {
        for (Classification c : values()) {
            if (c.label.equals(label)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown classification: " + label);
    }
}
