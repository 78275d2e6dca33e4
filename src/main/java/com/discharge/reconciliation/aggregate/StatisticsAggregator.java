package com.discharge.reconciliation.aggregate;

import com.discharge.reconciliation.core.model.Classification;
import com.discharge.reconciliation.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summarizes match results into validation and dispatch statistics.
 * The result does not depend on the order of the input rows, and the input is never modified.
 */
public class StatisticsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatisticsAggregator.class);

    private static final Comparator<SpecialtyStatistics> SPECIALTY_ORDER =
            Comparator.comparingLong(SpecialtyStatistics::total).reversed()
                    .thenComparing(SpecialtyStatistics::specialty);

    public ValidationReport aggregate(List<MatchResult> results) {
        Map<String, List<MatchResult>> bySpecialty = new TreeMap<>();
        for (MatchResult result : results) {
            if (result.specialty() != null) {
                bySpecialty.computeIfAbsent(result.specialty(), k -> new ArrayList<>()).add(result);
            }
        }

        List<SpecialtyStatistics> rows = new ArrayList<>(bySpecialty.size());
        for (Map.Entry<String, List<MatchResult>> entry : bySpecialty.entrySet()) {
            rows.add(new SpecialtyStatistics(entry.getKey(), statistics(entry.getValue())));
        }
        rows.sort(SPECIALTY_ORDER);

        ValidationReport report = new ValidationReport(statistics(results), rows, diffusion(results));
        log.debug("aggregate.completed stays={} specialties={}", results.size(), rows.size());
        return report;
    }

    static ValidationStatistics statistics(List<MatchResult> group) {
        long total = group.size();
        if (total == 0) {
            return ValidationStatistics.empty();
        }
        long onTime = 0;
        long late = 0;
        long delaySum = 0;
        for (MatchResult result : group) {
            if (result.classification() == Classification.ON_TIME) {
                onTime++;
            } else if (result.classification() == Classification.LATE) {
                late++;
            }
            if (result.isMatched()) {
                delaySum += result.delayDays();
            }
        }
        long matched = onTime + late;
        long unmatched = total - matched;
        return new ValidationStatistics(total, onTime, late, unmatched, matched,
                percent(matched, total), percent(onTime, total), percent(late, total), percent(unmatched, total),
                mean(delaySum, matched));
    }

    static DiffusionStatistics diffusion(List<MatchResult> results) {
        long matched = 0;
        long dispatched = 0;
        long sameDay = 0;
        long delaySum = 0;
        for (MatchResult result : results) {
            if (!result.isMatched()) {
                continue;
            }
            matched++;
            if (result.dispatchDelayDays() != null) {
                dispatched++;
                delaySum += result.dispatchDelayDays();
                if (result.dispatchDelayDays() == 0) {
                    sameDay++;
                }
            }
        }
        return new DiffusionStatistics(matched, dispatched, percent(dispatched, matched),
                sameDay, percent(sameDay, dispatched), mean(delaySum, dispatched));
    }

    static double percent(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return round1(BigDecimal.valueOf(part * 100L).divide(BigDecimal.valueOf(whole), 10, RoundingMode.HALF_UP));
    }

    static double mean(long sum, long count) {
        if (count == 0) {
            return 0.0;
        }
        return round1(BigDecimal.valueOf(sum).divide(BigDecimal.valueOf(count), 10, RoundingMode.HALF_UP));
    }

    private static double round1(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
