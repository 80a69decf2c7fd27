package com.repo.coupling.model;

/**
 * Aggregate activity of one file identity over the processed range.
 *
 * @param couplingTotal  non-excluded changesets containing the file
 * @param weightedTotal  sum of 1/|F| over those changesets
 */
public record FileStatistics(
        int fileId,
        String latestPath,
        boolean alive,
        int commitCount,
        int changesetCount,
        int couplingTotal,
        double weightedTotal,
        int authorCount,
        long firstCommitTs,
        long lastCommitTs) {
}
