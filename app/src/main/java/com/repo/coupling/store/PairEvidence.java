package com.repo.coupling.store;

import com.repo.coupling.store.Rows.ChangesetRow;
import com.repo.coupling.store.Rows.CommitRow;

import java.util.List;

/**
 * Why two files are coupled: the changesets that touched both and their commits.
 * Excluded changesets are listed too; only the others count as evidence.
 */
public record PairEvidence(int fileA, int fileB, List<ChangesetRow> changesets, List<CommitRow> commits) {

    public PairEvidence {
        changesets = List.copyOf(changesets);
        commits = List.copyOf(commits);
    }

    public long countedChangesets() {
        return changesets.stream().filter(c -> !c.excludedFromCoupling()).count();
    }
}
