package com.repo.coupling.store;

import com.repo.coupling.store.Rows.*;

import java.util.List;

/**
 * A named artifact table and the row type stored in it.
 */
public record Table<R>(String name, Class<R> rowType) {

    public static final Table<CommitRow> COMMITS = new Table<>("commits", CommitRow.class);
    public static final Table<ChangeRow> CHANGES = new Table<>("changes", ChangeRow.class);
    public static final Table<ChangesetRow> CHANGESETS = new Table<>("changesets", ChangesetRow.class);
    public static final Table<FileStatsRow> FILE_STATS = new Table<>("file_stats", FileStatsRow.class);
    public static final Table<LineageRow> FILE_LINEAGE = new Table<>("file_lineage", LineageRow.class);
    public static final Table<EdgeRow> EDGES = new Table<>("edges", EdgeRow.class);
    public static final Table<FolderEdgeRow> FOLDER_EDGES = new Table<>("folder_edges", FolderEdgeRow.class);
    public static final Table<PathIndexRow> PATH_INDEX = new Table<>("path_index", PathIndexRow.class);

    public static final List<Table<?>> ALL = List.of(COMMITS, CHANGES, CHANGESETS, FILE_STATS, FILE_LINEAGE,
            EDGES, FOLDER_EDGES, PATH_INDEX);

    public String fileName() {
        return name + ".csv";
    }
}
