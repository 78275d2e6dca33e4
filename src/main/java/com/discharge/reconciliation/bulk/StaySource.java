package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.core.model.Stay;

import java.util.List;

/**
 * Supplies the stay table of a run.
 */
@FunctionalInterface
public interface StaySource {

    List<Stay> fetch();
}
