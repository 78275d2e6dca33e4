package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.EligibilityCriteria;
import com.discharge.reconciliation.core.model.ProvisionalMatch;
import com.discharge.reconciliation.core.model.Stay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Ranks the candidates of each stay in two passes and selects the rank-1 candidate.
 *
 * <p>Pass 1 (closeness) orders by specialty presence then raw delay. Pass 2 (selection)
 * orders by specialty presence, venue match, parent freshness, composite eligibility,
 * creation during stay and raw delay. Both passes end with document id so that the
 * ranking never depends on the arrival order of documents.</p>
 */
public class CandidateRanker {
    private static final Logger log = LoggerFactory.getLogger(CandidateRanker.class);

    static final Comparator<CandidatePair> CLOSENESS_ORDER =
            trueFirst(CandidatePair::hasSpecialty)
                    .thenComparing(CandidatePair::rawDelay, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(CandidatePair::documentId);

    static final Comparator<CandidatePair> SELECTION_ORDER =
            trueFirst(CandidatePair::hasSpecialty)
                    .thenComparing(trueFirst(criterion(EligibilityCriteria::venueMatch)))
                    .thenComparing(trueFirst(criterion(EligibilityCriteria::parentFreshness)))
                    .thenComparing(trueFirst(criterion(EligibilityCriteria::eligible)))
                    .thenComparing(trueFirst(criterion(EligibilityCriteria::creationDuringStay)))
                    .thenComparing(CandidatePair::rawDelay, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(CandidatePair::documentId);

    private final boolean parallel;

    public CandidateRanker() {
        this(false);
    }

    public CandidateRanker(boolean parallel) {
        this.parallel = parallel;
    }

    /**
     * Ranks the given candidates and returns one provisional match per stay, in stay order.
     * Stays without candidates get an empty match.
     */
    public List<ProvisionalMatch> select(List<Stay> stays, List<CandidatePair> pairs) {
        Map<Stay, List<CandidatePair>> byStay = groupByStay(pairs);

        Stream<Stay> stream = parallel ? stays.parallelStream() : stays.stream();
        List<ProvisionalMatch> matches = stream
                .map(stay -> {
                    List<CandidatePair> candidates = byStay.get(stay);
                    if (candidates == null || candidates.isEmpty()) {
                        return ProvisionalMatch.empty(stay);
                    }
                    return ProvisionalMatch.of(rank(candidates).get(0));
                })
                .collect(Collectors.toList());

        log.debug("ranking.completed stays={} candidates={} parallel={}", stays.size(), pairs.size(), parallel);
        return matches;
    }

    /**
     * Ranks the candidates of a single stay. The returned list is in selection order,
     * each pair carrying its closeness and selection ranks (1-based).
     */
    public List<CandidatePair> rank(List<CandidatePair> candidates) {
        List<CandidatePair> closeness = new ArrayList<>(candidates);
        closeness.sort(CLOSENESS_ORDER);

        List<CandidatePair> withCloseness = new ArrayList<>(closeness.size());
        for (int i = 0; i < closeness.size(); i++) {
            withCloseness.add(closeness.get(i).withClosenessRank(i + 1));
        }

        withCloseness.sort(SELECTION_ORDER);

        List<CandidatePair> ranked = new ArrayList<>(withCloseness.size());
        for (int i = 0; i < withCloseness.size(); i++) {
            ranked.add(withCloseness.get(i).withSelectionRank(i + 1));
        }
        return ranked;
    }

    // Stays are grouped by instance so two stays with equal fields never share candidates.
    private static Map<Stay, List<CandidatePair>> groupByStay(List<CandidatePair> pairs) {
        Map<Stay, List<CandidatePair>> byStay = new IdentityHashMap<>();
        for (CandidatePair pair : pairs) {
            byStay.computeIfAbsent(pair.stay(), k -> new ArrayList<>()).add(pair);
        }
        return byStay;
    }

    private static Predicate<CandidatePair> criterion(Predicate<EligibilityCriteria> signal) {
        return pair -> pair.criteria() != null && signal.test(pair.criteria());
    }

    private static Comparator<CandidatePair> trueFirst(Predicate<CandidatePair> predicate) {
        return Comparator.comparing(pair -> !predicate.test(pair));
    }
}
