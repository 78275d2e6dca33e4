package com.discharge.reconciliation.report;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * An inclusive range of discharge dates covered by a report.
 *
 * @param start first day, inclusive
 * @param end   last day, inclusive
 */
public record ReportPeriod(LocalDate start, LocalDate end) {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public ReportPeriod {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("period end " + end + " is before start " + start);
        }
    }

    /**
     * The calendar month preceding the month of {@code today}; the default period of the monthly job.
     */
    public static ReportPeriod previousMonth(LocalDate today) {
        YearMonth previous = YearMonth.from(today).minusMonths(1);
        return new ReportPeriod(previous.atDay(1), previous.atEndOfMonth());
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public String label() {
        return start.format(LABEL_FORMAT) + " au " + end.format(LABEL_FORMAT);
    }
}
