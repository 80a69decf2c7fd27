package com.repo.coupling.store;

import com.repo.coupling.store.Rows.FileStatsRow;
import com.repo.coupling.store.Rows.LineageRow;

import java.util.List;
import java.util.Optional;

/**
 * Current and historical identity of one file, as read back from an artifact set.
 *
 * @param history lineage intervals, oldest first
 * @param stats   activity counters, null when the file never entered a changeset
 */
public record FileRecord(int fileId, List<LineageRow> history, FileStatsRow stats) {

    public FileRecord {
        history = List.copyOf(history);
    }

    public Optional<String> currentPath() {
        return history.stream().filter(FileRecord::isOpen).map(LineageRow::path).findFirst();
    }

    public String latestPath() {
        return history.get(history.size() - 1).path();
    }

    static boolean isOpen(LineageRow row) {
        return row.validToCommit() == null || row.validToCommit().isEmpty();
    }
}
