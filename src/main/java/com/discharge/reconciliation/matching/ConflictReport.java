package com.discharge.reconciliation.matching;

/**
 * Outcome of conflict resolution.
 *
 * @param contestedDocuments documents selected by more than one stay
 * @param demotedStays       stays that lost their selected document
 */
public record ConflictReport(int contestedDocuments, int demotedStays) {

    public ConflictReport {
        if (contestedDocuments < 0 || demotedStays < 0) {
            throw new IllegalArgumentException("conflict counts must be >= 0");
        }
    }

    public static ConflictReport none() {
        return new ConflictReport(0, 0);
    }

    public boolean hasConflicts() {
        return contestedDocuments > 0;
    }
}
