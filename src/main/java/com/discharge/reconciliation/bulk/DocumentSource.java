package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.core.model.ClinicalDocument;

import java.util.List;

/**
 * Supplies the document table of a run.
 */
@FunctionalInterface
public interface DocumentSource {

    List<ClinicalDocument> fetch();
}
