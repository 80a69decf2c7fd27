package com.repo.coupling.core;

import java.util.Locale;

/**
 * Metric used to rank a file's neighbours during sparsification.
 */
public enum CouplingMetric {
    JACCARD,
    WEIGHTED_JACCARD,
    /** p(neighbour | file), read from the ranking file's side. */
    CONDITIONAL_PROBABILITY;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CouplingMetric fromKey(String key) {
        for (CouplingMetric metric : values()) {
            if (metric.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown primary_metric: " + key);
    }
}
