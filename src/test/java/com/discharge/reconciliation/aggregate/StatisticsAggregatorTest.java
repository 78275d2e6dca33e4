package com.discharge.reconciliation.aggregate;

import com.discharge.reconciliation.core.model.Classification;
import com.discharge.reconciliation.core.model.MatchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatisticsAggregator Tests")
class StatisticsAggregatorTest {

    private static final LocalDate DISCHARGE = LocalDate.of(2025, 3, 10);

    private final StatisticsAggregator aggregator = new StatisticsAggregator();

    private static MatchResult result(String stayId, String specialty, Long delay, Long dispatch) {
        Classification classification = specialty == null ? Classification.UNMATCHED : Classification.fromDelay(delay);
        return new MatchResult("P1", stayId, "101", DISCHARGE, specialty, delay != null ? "D" + stayId : null,
                delay, classification, dispatch);
    }

    private List<MatchResult> sample() {
        return List.of(
                result("1", "CARDIO", 0L, 0L),
                result("2", "CARDIO", 2L, 1L),
                result("3", "CARDIO", null, null),
                result("4", "NEURO", 1L, null),
                result("5", "NEURO", 0L, 0L),
                result("6", null, null, null),
                result("7", "ONCO", 0L, null));
    }

    @Test
    @DisplayName("Global counts and rates")
    void globalStatistics() {
        ValidationStatistics global = aggregator.aggregate(sample()).global();

        assertEquals(7, global.total());
        assertEquals(3, global.onTime());
        assertEquals(2, global.late());
        assertEquals(2, global.unmatched());
        assertEquals(5, global.matched());
        assertEquals(71.4, global.matchedPercent());
        assertEquals(42.9, global.onTimePercent());
        assertEquals(28.6, global.latePercent());
        assertEquals(28.6, global.unmatchedPercent());
        assertEquals(0.6, global.meanDelayDays());
    }

    @Test
    @DisplayName("Specialty rows sorted by total then name, unmatched-without-specialty excluded")
    void specialtyRows() {
        List<SpecialtyStatistics> rows = aggregator.aggregate(sample()).bySpecialty();

        assertEquals(List.of("CARDIO", "NEURO", "ONCO"), rows.stream().map(SpecialtyStatistics::specialty).toList());
        ValidationStatistics cardio = rows.get(0).statistics();
        assertEquals(3, cardio.total());
        assertEquals(1, cardio.unmatched());
        assertEquals(66.7, cardio.matchedPercent());
        assertEquals(1.0, cardio.meanDelayDays());
        assertEquals(2, aggregator.aggregate(sample()).forSpecialty("NEURO").orElseThrow().total());
        assertTrue(aggregator.aggregate(sample()).forSpecialty("PEDIATRIE").isEmpty());
    }

    @Test
    @DisplayName("Ties on total are ordered by specialty name")
    void tieOnTotal() {
        List<MatchResult> rows = List.of(result("1", "ZETA", 0L, null), result("2", "ALPHA", 1L, null));

        assertEquals(List.of("ALPHA", "ZETA"),
                aggregator.aggregate(rows).bySpecialty().stream().map(SpecialtyStatistics::specialty).toList());
    }

    @Test
    @DisplayName("Dispatch statistics among matched stays")
    void diffusion() {
        DiffusionStatistics diffusion = aggregator.aggregate(sample()).diffusion();

        assertEquals(5, diffusion.matched());
        assertEquals(3, diffusion.dispatched());
        assertEquals(60.0, diffusion.dispatchedPercent());
        assertEquals(2, diffusion.sameDayDispatched());
        assertEquals(66.7, diffusion.sameDayPercent());
        assertEquals(0.3, diffusion.meanDispatchDelayDays());
    }

    @Nested
    @DisplayName("Robustness")
    class Robustness {

        @Test
        @DisplayName("Zero rows give zero rates")
        void emptyInput() {
            ValidationReport report = aggregator.aggregate(List.of());

            assertEquals(ValidationStatistics.empty(), report.global());
            assertTrue(report.bySpecialty().isEmpty());
            assertEquals(DiffusionStatistics.empty(), report.diffusion());
        }

        @Test
        @DisplayName("Row order does not change the report")
        void orderIndependent() {
            ValidationReport expected = aggregator.aggregate(sample());
            List<MatchResult> shuffled = new ArrayList<>(sample());
            Collections.shuffle(shuffled, new Random(11));

            assertEquals(expected, aggregator.aggregate(shuffled));
        }

        @Test
        @DisplayName("Input is not modified")
        void inputUntouched() {
            List<MatchResult> input = new ArrayList<>(sample());
            List<MatchResult> copy = List.copyOf(input);
            aggregator.aggregate(input);
            assertEquals(copy, input);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "1, 3, 33.3",
            "2, 3, 66.7",
            "1, 8, 12.5",
            "1, 16, 6.3",
            "0, 0, 0.0"
    })
    @DisplayName("Percentages round half-up to one decimal")
    void percentRounding(long part, long whole, double expected) {
        assertEquals(expected, StatisticsAggregator.percent(part, whole));
    }
}
