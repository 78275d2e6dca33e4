package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.core.model.ProvisionalMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enforces document exclusivity across stays.
 *
 * <p>Provisional matches are grouped by selected document. In a group of two or more,
 * the stay with the smallest raw delay keeps the document (null delays last); equal delays
 * go to the lowest stay id. Every other member is demoted: its raw delay is cleared and it
 * no longer holds a free document. Input matches are never modified.</p>
 */
public class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    static final Comparator<ProvisionalMatch> HOLDER_ORDER =
            Comparator.comparing(ProvisionalMatch::rawDelay, Comparator.nullsLast(Comparator.<Long>naturalOrder()))
                    .thenComparing(m -> m.stay().stayId());

    public record Resolution(List<ProvisionalMatch> matches, ConflictReport report) {
        public Resolution {
            matches = List.copyOf(matches);
        }
    }

    public Resolution resolve(List<ProvisionalMatch> provisional) {
        Map<String, List<ProvisionalMatch>> byDocument = new LinkedHashMap<>();
        for (ProvisionalMatch match : provisional) {
            if (match.hasSelection()) {
                byDocument.computeIfAbsent(match.selectedDocumentId(), k -> new ArrayList<>()).add(match);
            }
        }

        Map<ProvisionalMatch, ProvisionalMatch> replacements = new IdentityHashMap<>();
        int contested = 0;
        for (Map.Entry<String, List<ProvisionalMatch>> group : byDocument.entrySet()) {
            List<ProvisionalMatch> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            contested++;
            List<ProvisionalMatch> ordered = new ArrayList<>(members);
            ordered.sort(HOLDER_ORDER);
            for (int i = 1; i < ordered.size(); i++) {
                replacements.put(ordered.get(i), ordered.get(i).demoted());
            }
            log.debug("conflict.resolved documentId={} holder={} contenders={}",
                    group.getKey(), ordered.get(0).stay().stayId(), members.size());
        }

        List<ProvisionalMatch> resolved = new ArrayList<>(provisional.size());
        for (ProvisionalMatch match : provisional) {
            resolved.add(replacements.getOrDefault(match, match));
        }

        ConflictReport report = new ConflictReport(contested, replacements.size());
        if (report.hasConflicts()) {
            log.info("conflict.summary contestedDocuments={} demotedStays={}",
                    report.contestedDocuments(), report.demotedStays());
        }
        return new Resolution(resolved, report);
    }
}
