package com.discharge.reconciliation.api;

import com.discharge.reconciliation.cache.CacheConfig;
import com.discharge.reconciliation.matching.CriteriaDefaults;

import java.util.Objects;

/**
 * Options for a reconciliation run.
 * Configures the eligibility windows, the composite threshold, column-absent defaults,
 * ranking parallelism and key caching.
 */
public class ReconciliationOptions {

    private static final int DEFAULT_VALIDATION_LOOKBACK_DAYS = 3;
    private static final int DEFAULT_CREATION_LOOKBACK_DAYS = 5;
    private static final int DEFAULT_PARENT_FRESHNESS_LOOKBACK_DAYS = 5;

    /**
     * Number of composite members ({@code validation window}, {@code parent timing},
     * {@code creation lower bound}) that must be <em>exceeded</em> for a pair to be eligible.
     * With three members, the default requires all of them.
     */
    public static final int DEFAULT_COMPOSITE_THRESHOLD = 2;

    private final int validationLookbackDays;
    private final int creationLookbackDays;
    private final int parentFreshnessLookbackDays;
    private final int compositeThreshold;
    private final CriteriaDefaults criteriaDefaults;
    private final boolean parallelRanking;
    private final CacheConfig cacheConfig;

    private ReconciliationOptions(Builder builder) {
        this.validationLookbackDays = builder.validationLookbackDays;
        this.creationLookbackDays = builder.creationLookbackDays;
        this.parentFreshnessLookbackDays = builder.parentFreshnessLookbackDays;
        this.compositeThreshold = builder.compositeThreshold;
        this.criteriaDefaults = builder.criteriaDefaults;
        this.parallelRanking = builder.parallelRanking;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getValidationLookbackDays() {
        return validationLookbackDays;
    }

    public int getCreationLookbackDays() {
        return creationLookbackDays;
    }

    public int getParentFreshnessLookbackDays() {
        return parentFreshnessLookbackDays;
    }

    public int getCompositeThreshold() {
        return compositeThreshold;
    }

    public CriteriaDefaults getCriteriaDefaults() {
        return criteriaDefaults;
    }

    public boolean isParallelRanking() {
        return parallelRanking;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int validationLookbackDays = DEFAULT_VALIDATION_LOOKBACK_DAYS;
        private int creationLookbackDays = DEFAULT_CREATION_LOOKBACK_DAYS;
        private int parentFreshnessLookbackDays = DEFAULT_PARENT_FRESHNESS_LOOKBACK_DAYS;
        private int compositeThreshold = DEFAULT_COMPOSITE_THRESHOLD;
        private CriteriaDefaults criteriaDefaults = CriteriaDefaults.standard();
        private boolean parallelRanking = false;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder validationLookbackDays(int days) {
            validateDays(days, "validationLookbackDays");
            this.validationLookbackDays = days;
            return this;
        }

        public Builder creationLookbackDays(int days) {
            validateDays(days, "creationLookbackDays");
            this.creationLookbackDays = days;
            return this;
        }

        public Builder parentFreshnessLookbackDays(int days) {
            validateDays(days, "parentFreshnessLookbackDays");
            this.parentFreshnessLookbackDays = days;
            return this;
        }

        public Builder compositeThreshold(int compositeThreshold) {
            if (compositeThreshold < 0 || compositeThreshold > 2) {
                throw new IllegalArgumentException("compositeThreshold must be between 0 and 2");
            }
            this.compositeThreshold = compositeThreshold;
            return this;
        }

        public Builder criteriaDefaults(CriteriaDefaults criteriaDefaults) {
            this.criteriaDefaults = Objects.requireNonNull(criteriaDefaults, "criteriaDefaults");
            return this;
        }

        public Builder parallelRanking(boolean parallelRanking) {
            this.parallelRanking = parallelRanking;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig");
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }

        private void validateDays(int value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "validationLookbackDays=" + validationLookbackDays +
                ", creationLookbackDays=" + creationLookbackDays +
                ", parentFreshnessLookbackDays=" + parentFreshnessLookbackDays +
                ", compositeThreshold=" + compositeThreshold +
                ", criteriaDefaults=" + criteriaDefaults +
                ", parallelRanking=" + parallelRanking +
                ", cacheConfig=" + cacheConfig +
                '}';
    }
}
