package com.repo.coupling.model;

import com.repo.coupling.core.CouplingMetric;

/**
 * Read view of the co-change statistics of one file pair, oriented as (a, b).
 * Derived metrics are computed on read.
 */
public record CouplingStat(
        int fileA,
        int fileB,
        int pairCount,
        double weightedPairCount,
        int aTotal,
        int bTotal,
        double aWeightedTotal,
        double bWeightedTotal) {

    public double jaccard() {
        return pairCount / (double) (aTotal + bTotal - pairCount);
    }

    public double weightedJaccard() {
        return weightedPairCount / (aWeightedTotal + bWeightedTotal - weightedPairCount);
    }

    /**
     * p(b | a): share of a's changesets that also touched b.
     */
    public double probabilityBGivenA() {
        return pairCount / (double) aTotal;
    }

    /**
     * p(a | b): share of b's changesets that also touched a.
     */
    public double probabilityAGivenB() {
        return pairCount / (double) bTotal;
    }

    /**
     * Metric value as seen from file a.
     */
    public double metric(CouplingMetric metric) {
        return switch (metric) {
            case JACCARD -> jaccard();
            case WEIGHTED_JACCARD -> weightedJaccard();
            case CONDITIONAL_PROBABILITY -> probabilityBGivenA();
        };
    }

    /**
     * Same statistics oriented as (b, a).
     */
    public CouplingStat reversed() {
        return new CouplingStat(fileB, fileA, pairCount, weightedPairCount,
                bTotal, aTotal, bWeightedTotal, aWeightedTotal);
    }
}
