package com.repo.coupling.pipeline;

import com.repo.coupling.coupling.CouplingComputer;
import com.repo.coupling.model.Changeset;
import com.repo.coupling.model.Commit;
import com.repo.coupling.model.FileIdentity;
import com.repo.coupling.model.FileStatistics;

import java.util.*;

/**
 * Per-file activity counters gathered alongside coupling accumulation.
 */
class FileActivity {

    private final Map<Integer, Counters> byFile = new HashMap<>();

    void onCommit(Commit commit, Collection<Integer> fileIds) {
        for (int fileId : fileIds) {
            Counters c = byFile.computeIfAbsent(fileId, id -> new Counters());
            c.commits++;
            c.authors.add(commit.authorEmail());
            c.firstTs = Math.min(c.firstTs, commit.committerTs());
            c.lastTs = Math.max(c.lastTs, commit.committerTs());
        }
    }

    void onChangeset(Changeset changeset) {
        for (int fileId : changeset.files()) {
            byFile.computeIfAbsent(fileId, id -> new Counters()).changesets++;
        }
    }

    FileStatistics statistics(FileIdentity identity, CouplingComputer computer) {
        Counters c = byFile.getOrDefault(identity.fileId(), Counters.EMPTY);
        boolean seen = c.commits > 0;
        return new FileStatistics(identity.fileId(), identity.latestPath(), identity.isAlive(),
                c.commits, c.changesets, computer.total(identity.fileId()), computer.weightedTotal(identity.fileId()),
                c.authors.size(), seen ? c.firstTs : 0, seen ? c.lastTs : 0);
    }

    private static final class Counters {
        static final Counters EMPTY = new Counters();

        int commits;
        int changesets;
        final Set<String> authors = new HashSet<>();
        long firstTs = Long.MAX_VALUE;
        long lastTs = Long.MIN_VALUE;
    }
}
