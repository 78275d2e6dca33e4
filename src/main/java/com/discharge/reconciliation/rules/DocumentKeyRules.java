package com.discharge.reconciliation.rules;

import java.util.List;

/**
 * Built-in rules that reduce a discharge-document label to its matching key.
 * Boilerplate (institution name, "discharge letter" phrasing, report, day-clinic
 * and consultation markers) is removed wherever it occurs, including inside words,
 * so that keys line up with those of the reference mapping.
 */
public final class DocumentKeyRules {

    private DocumentKeyRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all built-in key rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getLabelRules());
        engine.addRules(getIdentifierRules());
        return engine;
    }

    public static List<NormalizationRule> getLabelRules() {
        return List.of(
                // Longest phrase first so "CR" is not stripped out of it
                NormalizationRule.builder()
                        .name("label-cr-discharge-letter")
                        .pattern("CR\\s+LETTRE\\s+DE\\s+LIAISON")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("label-discharge-letter")
                        .pattern("LETTRE\\s+DE\\s+LIAISON")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(20)
                        .build(),

                NormalizationRule.builder()
                        .name("label-institution")
                        .pattern("FOCH")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(30)
                        .build(),

                NormalizationRule.builder()
                        .name("label-report-marker")
                        .pattern("CR")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(40)
                        .build(),

                // Day clinic
                NormalizationRule.builder()
                        .name("label-day-clinic")
                        .pattern("HDJ")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(40)
                        .build(),

                // Consultation
                NormalizationRule.builder()
                        .name("label-consultation")
                        .pattern("CS")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(40)
                        .build(),

                NormalizationRule.builder()
                        .name("label-periods")
                        .pattern("\\.")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(50)
                        .build(),

                // Separators left dangling once boilerplate is gone
                NormalizationRule.builder()
                        .name("label-dangling-separators")
                        .pattern("^[\\s\\-_/:]+|[\\s\\-_/:]+$")
                        .applicableKinds(KeyKind.DOCUMENT_LABEL)
                        .priority(200)
                        .build()
        );
    }

    /**
     * Identifiers exported through spreadsheets often carry a float suffix ("123456789.0").
     */
    public static List<NormalizationRule> getIdentifierRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("identifier-float-suffix")
                        .pattern("\\.0+$")
                        .applicableKinds(KeyKind.IDENTIFIER)
                        .priority(10)
                        .build()
        );
    }
}
