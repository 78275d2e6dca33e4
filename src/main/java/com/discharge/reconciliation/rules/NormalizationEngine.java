package com.discharge.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Engine for turning free text into exact-match keys.
 * Input is accent-stripped and upper-cased first, then rules are applied in
 * priority order (lower priority number = higher precedence), then whitespace
 * is trimmed and collapsed.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes a value of the given kind. Never fails; null or blank input yields "".
     */
    public String normalize(String value, KeyKind kind) {
        if (value == null || value.isBlank()) {
            return "";
        }

        String result = stripAccents(value).toUpperCase(Locale.ROOT);

        for (NormalizationRule rule : rules) {
            if (kind == null || rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }

        return WHITESPACE.matcher(result.trim()).replaceAll(" ");
    }

    /**
     * Checks if two values produce the same key.
     */
    public boolean areEquivalent(String value1, String value2, KeyKind kind) {
        return normalize(value1, kind).equals(normalize(value2, kind));
    }

    static String stripAccents(String value) {
        return COMBINING_MARKS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
