package com.repo.coupling.model;

import java.util.List;

/**
 * A unit of co-change evidence.
 *
 * @param key                  commit oid, or {@code author:startTs} for author/time groups
 * @param files                distinct file ids in ascending order
 * @param commitOids           commits merged into this changeset, in processing order
 * @param excludedFromCoupling true when the changeset is too large to count as evidence
 */
public record Changeset(
        String key,
        List<Integer> files,
        List<String> commitOids,
        String authorEmail,
        long startTs,
        long endTs,
        boolean excludedFromCoupling) {

    public Changeset {
        files = List.copyOf(files);
        commitOids = List.copyOf(commitOids);
    }

    public int size() {
        return files.size();
    }
}
