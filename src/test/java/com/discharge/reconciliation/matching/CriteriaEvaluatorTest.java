package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.api.ReconciliationOptions;
import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.EligibilityCriteria;
import com.discharge.reconciliation.core.model.Stay;
import com.discharge.reconciliation.rules.KeyNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.discharge.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CriteriaEvaluator Tests")
class CriteriaEvaluatorTest {

    private final KeyNormalizer normalizer = new KeyNormalizer();
    private final CriteriaEvaluator evaluator = new CriteriaEvaluator(normalizer, ReconciliationOptions.defaults());

    // Admitted 8 March, discharged 10 March.
    private final Stay stay = stay("S1", "2025-03-08", "2025-03-10");

    private EligibilityCriteria evaluate(ClinicalDocument document) {
        return evaluator.criteria(stay, document);
    }

    @Test
    @DisplayName("A document created during the stay and validated at discharge meets everything")
    void allCriteriaMet() {
        EligibilityCriteria c = evaluate(document("D1", "2025-03-09", "2025-03-10").venueNumber("S1").build());

        assertTrue(c.venueMatch());
        assertTrue(c.validationWindow());
        assertTrue(c.parentTiming());
        assertTrue(c.creationLowerBound());
        assertTrue(c.creationDuringStay());
        assertTrue(c.parentFreshness());
        assertEquals(3, c.compositeMembersMet());
        assertTrue(c.eligible());
    }

    @Nested
    @DisplayName("Validation window")
    class ValidationWindow {

        @ParameterizedTest
        @CsvSource({
                "2025-03-07, false",  // before admission
                "2025-03-08, true",   // admission day, within 3-day look-back
                "2025-03-10, true",
                "2025-03-25, true"    // no upper bound
        })
        void window(String validated, boolean expected) {
            assertEquals(expected, evaluate(document("D1", "2025-03-08", validated).build()).validationWindow());
        }

        @Test
        @DisplayName("Look-back before discharge binds on long stays")
        void lookBackOnLongStay() {
            Stay longStay = stay("S2", "2025-03-01", "2025-03-20");
            ClinicalDocument early = document("D1", "2025-03-02", "2025-03-16").build();
            ClinicalDocument onBound = document("D2", "2025-03-02", "2025-03-17").build();

            assertFalse(evaluator.criteria(longStay, early).validationWindow());
            assertTrue(evaluator.criteria(longStay, onBound).validationWindow());
        }

        @Test
        @DisplayName("Never-validated documents fail the window and are not eligible")
        void notValidated() {
            EligibilityCriteria c = evaluate(document("D1", "2025-03-09", null).build());
            assertFalse(c.validationWindow());
            assertFalse(c.eligible());
        }

        @Test
        @DisplayName("Time of day is ignored")
        void calendarDays() {
            ClinicalDocument doc = document("D1", "2025-03-09", null)
                    .validatedAt(stay.admission().toLocalDate().atStartOfDay())
                    .build();
            assertTrue(evaluate(doc).validationWindow());
        }
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @ParameterizedTest
        @CsvSource({
                "2025-03-02, false, false",
                "2025-03-03, true, false",
                "2025-03-08, true, true",
                "2025-03-10, true, true",
                "2025-03-11, true, false"
        })
        void creationBounds(String created, boolean lowerBound, boolean duringStay) {
            EligibilityCriteria c = evaluate(document("D1", created, "2025-03-11").build());
            assertEquals(lowerBound, c.creationLowerBound());
            assertEquals(duringStay, c.creationDuringStay());
        }
    }

    @Nested
    @DisplayName("Parent document")
    class Parent {

        @Test
        @DisplayName("Parent modified before discharge satisfies timing")
        void parentTiming() {
            ClinicalDocument doc = document("D1", "2025-03-09", "2025-03-10")
                    .parentCreatedAt(at("2025-03-12"))
                    .parentModifiedAt(at("2025-03-09"))
                    .build();
            assertTrue(evaluate(doc).parentTiming());
        }

        @Test
        @DisplayName("Parent created only after discharge fails timing and composite")
        void parentAfterDischarge() {
            ClinicalDocument doc = document("D1", "2025-03-09", "2025-03-10")
                    .parentCreatedAt(at("2025-03-11"))
                    .build();
            EligibilityCriteria c = evaluate(doc);
            assertFalse(c.parentTiming());
            assertEquals(2, c.compositeMembersMet());
            assertFalse(c.eligible());
        }

        @Test
        @DisplayName("Stale parent fails freshness")
        void parentFreshness() {
            ClinicalDocument stale = document("D1", "2025-03-09", "2025-03-10")
                    .parentCreatedAt(at("2025-02-01"))
                    .build();
            ClinicalDocument fresh = document("D2", "2025-03-09", "2025-03-10")
                    .parentCreatedAt(at("2025-03-03"))
                    .build();

            assertFalse(evaluate(stale).parentFreshness());
            assertTrue(evaluate(fresh).parentFreshness());
        }
    }

    @Nested
    @DisplayName("Column-absent defaults")
    class Defaults {

        @Test
        @DisplayName("Absent venue and parent use the standard defaults")
        void standardDefaults() {
            EligibilityCriteria c = evaluate(document("D1", "2025-03-09", "2025-03-10").build());
            assertFalse(c.venueMatch());
            assertTrue(c.parentTiming());
            assertTrue(c.parentFreshness());
        }

        @Test
        @DisplayName("Defaults are configurable")
        void customDefaults() {
            CriteriaEvaluator custom = new CriteriaEvaluator(normalizer, ReconciliationOptions.builder()
                    .criteriaDefaults(new CriteriaDefaults(true, false, false))
                    .build());

            EligibilityCriteria c = custom.criteria(stay, document("D1", "2025-03-09", "2025-03-10").build());
            assertTrue(c.venueMatch());
            assertFalse(c.parentTiming());
            assertFalse(c.parentFreshness());
            assertFalse(c.eligible());
        }

        @Test
        @DisplayName("Venue is compared on normalized identifiers")
        void venueNormalized() {
            assertTrue(evaluate(document("D1", "2025-03-09", "2025-03-10").venueNumber(" S1 ").build()).venueMatch());
            assertFalse(evaluate(document("D1", "2025-03-09", "2025-03-10").venueNumber("S2").build()).venueMatch());
        }
    }

    @Nested
    @DisplayName("Composite threshold")
    class Composite {

        @Test
        @DisplayName("Lowering the threshold admits two of three")
        void lowerThreshold() {
            CriteriaEvaluator lenient = new CriteriaEvaluator(normalizer, ReconciliationOptions.builder()
                    .compositeThreshold(1)
                    .build());
            ClinicalDocument doc = document("D1", "2025-03-09", "2025-03-10")
                    .parentCreatedAt(at("2025-03-11"))
                    .build();

            assertFalse(evaluate(doc).eligible());
            assertTrue(lenient.criteria(stay, doc).eligible());
        }
    }

    @Nested
    @DisplayName("Raw delay")
    class RawDelay {

        @ParameterizedTest
        @CsvSource({
                "2025-03-10, 0",
                "2025-03-12, 2",
                "2025-03-09, -1"
        })
        void rawDelayForEligible(String validated, long expected) {
            CandidatePair pair = evaluator.evaluate(CandidatePair.of(stay,
                    document("D1", "2025-03-08", validated).build(), LABEL_KEY));
            assertEquals(expected, pair.rawDelay());
        }

        @Test
        @DisplayName("Ineligible pairs carry no raw delay")
        void noDelayWhenIneligible() {
            CandidatePair pair = evaluator.evaluate(CandidatePair.of(stay,
                    document("D1", "2025-02-01", "2025-03-10").build(), LABEL_KEY));
            assertFalse(pair.isEligible());
            assertNull(pair.rawDelay());
        }
    }
}
