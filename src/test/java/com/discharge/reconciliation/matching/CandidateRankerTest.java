package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.EligibilityCriteria;
import com.discharge.reconciliation.core.model.ProvisionalMatch;
import com.discharge.reconciliation.core.model.Stay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.discharge.reconciliation.TestData.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandidateRanker Tests")
class CandidateRankerTest {

    private static final EligibilityCriteria ALL = new EligibilityCriteria(true, true, true, true, true, true, 3, true);
    private static final EligibilityCriteria NO_VENUE = new EligibilityCriteria(false, true, true, true, true, true, 3, true);
    private static final EligibilityCriteria INELIGIBLE = new EligibilityCriteria(true, false, true, true, true, true, 2, false);
    private static final EligibilityCriteria STALE_PARENT = new EligibilityCriteria(true, true, true, true, true, false, 3, true);
    private static final EligibilityCriteria CREATED_BEFORE_STAY = new EligibilityCriteria(true, true, true, true, false, true, 3, true);

    private final CandidateRanker ranker = new CandidateRanker();
    private final Stay stay = stay("S1", "2025-03-08", "2025-03-10");

    private CandidatePair pair(Stay owner, String documentId, String specialty, EligibilityCriteria criteria, Long rawDelay) {
        return CandidatePair.of(owner, document(documentId, "2025-03-09", "2025-03-10").build(), LABEL_KEY)
                .withEvaluation(criteria, rawDelay)
                .withSpecialty(specialty);
    }

    private List<String> ids(List<CandidatePair> pairs) {
        return pairs.stream().map(CandidatePair::documentId).toList();
    }

    @Nested
    @DisplayName("Selection order")
    class SelectionOrder {

        @Test
        @DisplayName("Specialty presence dominates every other key")
        void specialtyFirst() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", null, ALL, 0L),
                    pair(stay, "D2", SPECIALTY, INELIGIBLE, null)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("Venue match outranks a smaller delay")
        void venueBeforeDelay() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, NO_VENUE, 0L),
                    pair(stay, "D2", SPECIALTY, ALL, 5L)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("Eligible candidates come before ineligible ones")
        void eligibleFirst() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, INELIGIBLE, null),
                    pair(stay, "D2", SPECIALTY, ALL, 4L)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("A fresh parent outranks a smaller delay")
        void freshParentBeforeDelay() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, STALE_PARENT, 0L),
                    pair(stay, "D2", SPECIALTY, ALL, 5L)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("Creation during the stay outranks a smaller delay")
        void createdDuringStayBeforeDelay() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, CREATED_BEFORE_STAY, 0L),
                    pair(stay, "D2", SPECIALTY, ALL, 4L)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("Parent freshness outranks eligibility")
        void freshnessBeforeEligibility() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, STALE_PARENT, 0L),
                    pair(stay, "D2", SPECIALTY, INELIGIBLE, 3L)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("Eligibility outranks creation during the stay")
        void eligibilityBeforeCreationDuringStay() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, INELIGIBLE, 0L),
                    pair(stay, "D2", SPECIALTY, CREATED_BEFORE_STAY, 2L)));
            assertEquals(List.of("D2", "D1"), ids(ranked));
        }

        @Test
        @DisplayName("Raw delay ascending with nulls last, then document id")
        void delayThenDocumentId() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D4", SPECIALTY, ALL, null),
                    pair(stay, "D3", SPECIALTY, ALL, 2L),
                    pair(stay, "D2", SPECIALTY, ALL, -1L),
                    pair(stay, "D1", SPECIALTY, ALL, 2L)));
            assertEquals(List.of("D2", "D1", "D3", "D4"), ids(ranked));
        }

        @Test
        @DisplayName("Ranks are 1-based and stored on the pairs")
        void ranksAssigned() {
            List<CandidatePair> ranked = ranker.rank(List.of(
                    pair(stay, "D1", SPECIALTY, NO_VENUE, 0L),
                    pair(stay, "D2", SPECIALTY, ALL, 5L)));

            assertEquals(1, ranked.get(0).selectionRank());
            assertEquals(2, ranked.get(1).selectionRank());
            // Closeness ignores venue: D1 has the smaller delay
            assertEquals(2, ranked.get(0).closenessRank());
            assertEquals(1, ranked.get(1).closenessRank());
        }

        @Test
        @DisplayName("Arrival order does not change the ranking")
        void orderIndependent() {
            List<CandidatePair> pairs = new ArrayList<>(List.of(
                    pair(stay, "D1", SPECIALTY, ALL, 1L),
                    pair(stay, "D2", SPECIALTY, ALL, 1L),
                    pair(stay, "D3", null, ALL, 0L),
                    pair(stay, "D4", SPECIALTY, INELIGIBLE, null),
                    pair(stay, "D5", SPECIALTY, NO_VENUE, 0L)));
            List<String> expected = ids(ranker.rank(pairs));

            Random random = new Random(7);
            for (int i = 0; i < 10; i++) {
                Collections.shuffle(pairs, random);
                assertEquals(expected, ids(ranker.rank(pairs)));
            }
        }
    }

    @Nested
    @DisplayName("select()")
    class Select {

        @Test
        @DisplayName("One provisional match per stay, in stay order")
        void onePerStay() {
            Stay s2 = stay("S2", "2025-03-01", "2025-03-02");
            Stay s3 = stay("S3", "2025-03-05", "2025-03-06");
            List<CandidatePair> pairs = List.of(
                    pair(s3, "D9", SPECIALTY, ALL, 0L),
                    pair(stay, "D1", SPECIALTY, ALL, 3L),
                    pair(stay, "D2", SPECIALTY, ALL, 1L));

            List<ProvisionalMatch> matches = ranker.select(List.of(stay, s2, s3), pairs);

            assertEquals(3, matches.size());
            assertEquals("D2", matches.get(0).selectedDocumentId());
            assertEquals(1L, matches.get(0).rawDelay());
            assertFalse(matches.get(1).hasSelection());
            assertEquals("S2", matches.get(1).stay().stayId());
            assertEquals("D9", matches.get(2).selectedDocumentId());
            assertTrue(matches.stream().allMatch(ProvisionalMatch::documentFree));
        }

        @Test
        @DisplayName("Parallel ranking gives the same selection")
        void parallelMatchesSequential() {
            List<Stay> stays = new ArrayList<>();
            List<CandidatePair> pairs = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                Stay s = stay("S" + i, "2025-03-01", "2025-03-05");
                stays.add(s);
                pairs.add(pair(s, "A" + i, SPECIALTY, ALL, (long) (i % 3)));
                pairs.add(pair(s, "B" + i, SPECIALTY, ALL, (long) (i % 2)));
            }

            List<String> sequential = ranker.select(stays, pairs).stream()
                    .map(ProvisionalMatch::selectedDocumentId).toList();
            List<String> parallel = new CandidateRanker(true).select(stays, pairs).stream()
                    .map(ProvisionalMatch::selectedDocumentId).toList();

            assertEquals(sequential, parallel);
        }
    }
}
