package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.Stay;
import com.discharge.reconciliation.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds every (stay, document) pair sharing a patient identity.
 * Output order is stay input order, then document input order.
 */
public class CandidateJoin {
    private static final Logger log = LoggerFactory.getLogger(CandidateJoin.class);

    private final KeyNormalizer normalizer;

    public CandidateJoin(KeyNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<CandidatePair> join(List<Stay> stays, List<ClinicalDocument> documents) {
        Map<String, List<ClinicalDocument>> byPatient = indexByPatient(documents);

        List<CandidatePair> pairs = new ArrayList<>();
        int staysWithoutDocument = 0;
        for (Stay stay : stays) {
            List<ClinicalDocument> patientDocuments = byPatient.get(normalizer.identifier(stay.patientId()));
            if (patientDocuments == null) {
                staysWithoutDocument++;
                continue;
            }
            for (ClinicalDocument document : patientDocuments) {
                pairs.add(CandidatePair.of(stay, document, normalizer.documentKey(document.getLabel())));
            }
        }

        log.debug("candidate.join stays={} documents={} pairs={} staysWithoutDocument={}",
                stays.size(), documents.size(), pairs.size(), staysWithoutDocument);
        return pairs;
    }

    private Map<String, List<ClinicalDocument>> indexByPatient(List<ClinicalDocument> documents) {
        Map<String, List<ClinicalDocument>> byPatient = new LinkedHashMap<>();
        for (ClinicalDocument document : documents) {
            String patientKey = normalizer.identifier(document.getPatientId());
            if (patientKey.isEmpty()) {
                continue;
            }
            byPatient.computeIfAbsent(patientKey, k -> new ArrayList<>()).add(document);
        }
        return byPatient;
    }
}
