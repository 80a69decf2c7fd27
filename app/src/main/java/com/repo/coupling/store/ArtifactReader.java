package com.repo.coupling.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.repo.coupling.core.ArtifactReadException;
import com.repo.coupling.core.CouplingException;
import com.repo.coupling.store.Rows.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Read-only access to a published artifact set.
 * Identity and edge tables are loaded on open; changesets and commits are scanned on demand.
 */
public class ArtifactReader {

    private final Path dir;
    private final RunManifest manifest;
    private final CsvMapper csvMapper = new CsvMapper();
    private final Map<Integer, List<LineageRow>> lineage = new TreeMap<>();
    private final Map<Integer, FileStatsRow> stats = new HashMap<>();
    private final Map<String, List<PathIndexRow>> pathIndex = new HashMap<>();
    private final Map<Integer, List<EdgeRow>> edgesBySource = new HashMap<>();

    private ArtifactReader(Path dir, RunManifest manifest) {
        this.dir = dir;
        this.manifest = manifest;
    }

    /**
     * @throws ArtifactReadException when {@code dir} holds no complete run
     */
    public static ArtifactReader open(Path dir) {
        Path manifestFile = dir.resolve(ArtifactStore.MANIFEST);
        if (!Files.isRegularFile(manifestFile)) {
            throw new ArtifactReadException("No complete run in " + dir + " (manifest missing)");
        }
        RunManifest manifest;
        try {
            Map<String, Object> json = new ObjectMapper().readValue(manifestFile.toFile(),
                    new TypeReference<Map<String, Object>>() { });
            manifest = RunManifest.fromMap(json);
        } catch (IOException | RuntimeException e) {
            throw new ArtifactReadException("Unreadable manifest " + manifestFile, e);
        }
        ArtifactReader reader = new ArtifactReader(dir, manifest);
        reader.load();
        return reader;
    }

    private void load() {
        scan(Table.FILE_LINEAGE, row -> lineage.computeIfAbsent(row.fileId(), id -> new ArrayList<>()).add(row));
        lineage.values().forEach(rows -> rows.sort(Comparator.comparingInt(LineageRow::seq)));
        scan(Table.FILE_STATS, row -> stats.put(row.fileId(), row));
        scan(Table.PATH_INDEX, row -> pathIndex.computeIfAbsent(row.path(), p -> new ArrayList<>()).add(row));
        scan(Table.EDGES, row -> edgesBySource.computeIfAbsent(row.srcFileId(), id -> new ArrayList<>()).add(row));
        edgesBySource.values().forEach(rows -> rows.sort(Comparator.comparingInt(EdgeRow::rank)));
    }

    public RunManifest manifest() {
        return manifest;
    }

    /**
     * Recompute every table digest and compare it with the manifest.
     */
    public void verify() {
        for (Table<?> table : Table.ALL) {
            RunManifest.TableDigest expected = manifest.tables().get(table.name());
            if (expected == null) {
                throw new ArtifactReadException("Manifest in " + dir + " lists no " + table.name() + " table");
            }
            String actual;
            try {
                actual = ArtifactRun.sha256(dir.resolve(table.fileName()));
            } catch (CouplingException e) {
                throw new ArtifactReadException("Could not digest " + table.fileName(), e);
            }
            if (!actual.equals(expected.sha256())) {
                throw new ArtifactReadException(table.fileName() + " does not match the manifest digest");
            }
        }
    }

    public Optional<FileRecord> lookup(int fileId) {
        List<LineageRow> rows = lineage.get(fileId);
        if (rows == null) {
            return Optional.empty();
        }
        return Optional.of(new FileRecord(fileId, rows, stats.get(fileId)));
    }

    /**
     * The identity currently at {@code path}, or the one that held it most recently.
     */
    public Optional<FileRecord> lookup(String path) {
        List<PathIndexRow> rows = pathIndex.get(path);
        if (rows == null || rows.isEmpty()) {
            return Optional.empty();
        }
        PathIndexRow best = rows.stream()
                .filter(PathIndexRow::current)
                .findFirst()
                .orElseGet(() -> lastHolder(path, rows));
        return lookup(best.fileId());
    }

    /**
     * The former holder whose interval at {@code path} closed last, in commit order.
     */
    private PathIndexRow lastHolder(String path, List<PathIndexRow> rows) {
        Map<Integer, String> closedAt = new HashMap<>();
        for (PathIndexRow row : rows) {
            for (LineageRow interval : lineage.getOrDefault(row.fileId(), List.of())) {
                if (interval.path().equals(path) && !FileRecord.isOpen(interval)) {
                    closedAt.put(row.fileId(), interval.validToCommit());
                }
            }
        }
        Set<String> wanted = new HashSet<>(closedAt.values());
        Map<String, Long> ordinals = new HashMap<>();
        AtomicLong position = new AtomicLong();
        scan(Table.COMMITS, row -> {
            long ordinal = position.getAndIncrement();
            if (wanted.contains(row.commitOid())) {
                ordinals.put(row.commitOid(), ordinal);
            }
        });
        Comparator<PathIndexRow> byClosingCommit = Comparator.comparingLong(
                row -> ordinals.getOrDefault(closedAt.get(row.fileId()), -1L));
        return rows.stream().max(byClosingCommit.thenComparingInt(PathIndexRow::fileId)).orElseThrow();
    }

    /**
     * Retained neighbours of a file in rank order, at most {@code k}.
     */
    public List<EdgeRow> neighbours(int fileId, int k) {
        List<EdgeRow> rows = edgesBySource.getOrDefault(fileId, List.of());
        return List.copyOf(rows.subList(0, Math.min(k, rows.size())));
    }

    public PairEvidence evidence(int fileA, int fileB) {
        String a = String.valueOf(fileA);
        String b = String.valueOf(fileB);
        List<ChangesetRow> changesets = new ArrayList<>();
        Set<String> oids = new HashSet<>();
        scan(Table.CHANGESETS, row -> {
            List<String> ids = Arrays.asList(row.fileIds().split(ChangesetRow.LIST_SEPARATOR));
            if (ids.contains(a) && ids.contains(b)) {
                changesets.add(row);
                oids.addAll(Arrays.asList(row.commitOids().split(ChangesetRow.LIST_SEPARATOR)));
            }
        });
        List<CommitRow> commits = new ArrayList<>();
        scan(Table.COMMITS, row -> {
            if (oids.contains(row.commitOid())) {
                commits.add(row);
            }
        });
        return new PairEvidence(fileA, fileB, changesets, commits);
    }

    private <R> void scan(Table<R> table, Consumer<R> consumer) {
        Path file = dir.resolve(table.fileName());
        if (!Files.isRegularFile(file)) {
            throw new ArtifactReadException("Table " + table.fileName() + " missing from " + dir);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<R> rows = csvMapper.readerFor(table.rowType()).with(schema).readValues(file.toFile())) {
            while (rows.hasNextValue()) {
                consumer.accept(rows.nextValue());
            }
        } catch (IOException e) {
            throw new ArtifactReadException("Could not read " + file, e);
        }
    }
}
