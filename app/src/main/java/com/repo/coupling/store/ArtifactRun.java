package com.repo.coupling.store;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.repo.coupling.core.ArtifactWriteException;
import com.repo.coupling.model.ValidationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One run's tables, staged until {@link #publish(RunManifest)}.
 * Closing a run that was neither published nor preserved discards it.
 */
public class ArtifactRun implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactRun.class);

    private enum State { OPEN, PUBLISHED, PRESERVED, ABORTED }

    private final ArtifactStore store;
    private final String runId;
    private final Path staging;
    private final Map<Table<?>, TableWriter<?>> writers = new LinkedHashMap<>();
    private State state = State.OPEN;

    ArtifactRun(ArtifactStore store, String runId, Path staging) {
        this.store = store;
        this.runId = runId;
        this.staging = staging;
    }

    public String runId() {
        return runId;
    }

    /**
     * Where the run is published.
     */
    public Path target() {
        return store.target();
    }

    Path staging() {
        return staging;
    }

    /**
     * Open a table for streaming. Each table can be opened once per run.
     */
    public <R> TableWriter<R> open(Table<R> table) {
        ensureOpen();
        if (writers.containsKey(table)) {
            throw new IllegalStateException("Table " + table.name() + " already opened in run " + runId);
        }
        Path file = staging.resolve(table.fileName());
        CsvSchema schema = store.csvMapper().schemaFor(table.rowType()).withHeader();
        try {
            TableWriter<R> writer = new TableWriter<>(table, file,
                    store.csvMapper().writer(schema).writeValues(file.toFile()));
            writers.put(table, writer);
            return writer;
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not create " + file, e);
        }
    }

    public <R> void writeAll(Table<R> table, Iterable<R> rows) {
        try (TableWriter<R> writer = open(table)) {
            for (R row : rows) {
                writer.write(row);
            }
        }
    }

    public void writeValidationSummary(ValidationSummary summary) {
        ensureOpen();
        writeJson(staging.resolve(ArtifactStore.VALIDATION_SUMMARY), summary.toMap());
    }

    /**
     * Close all tables, write the manifest last and move the run into place.
     * Tables never opened are written empty so every published set has the full layout.
     *
     * @return the manifest as written, with table digests
     */
    public RunManifest publish(RunManifest manifest) {
        ensureOpen();
        for (Table<?> table : Table.ALL) {
            if (!writers.containsKey(table)) {
                open(table).close();
            }
        }
        Map<String, RunManifest.TableDigest> digests = new LinkedHashMap<>();
        for (TableWriter<?> writer : writers.values()) {
            writer.close();
            digests.put(writer.table().name(), new RunManifest.TableDigest(writer.rowCount(), sha256(writer.file())));
        }
        RunManifest complete = manifest.withTables(digests);
        writeJson(staging.resolve(ArtifactStore.MANIFEST), complete.toMap());

        Path target = store.target();
        Path previous = store.sibling("previous", runId);
        try {
            if (Files.exists(target)) {
                move(target, previous);
            }
            move(staging, target);
            ArtifactStore.deleteRecursively(previous);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not publish run " + runId + " to " + target, e);
        }
        state = State.PUBLISHED;
        LOG.info("Published run {} to {}", runId, target);
        return complete;
    }

    /**
     * Keep what was written so far for diagnosis, under a name no reader accepts.
     * No manifest is written.
     */
    public Path preservePartial(Map<String, Object> details) {
        ensureOpen();
        writers.values().forEach(TableWriter::close);
        Path partial = store.sibling("partial", runId);
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("run_id", runId);
        Map<String, Object> rowCounts = new LinkedHashMap<>();
        writers.values().forEach(w -> rowCounts.put(w.table().name(), w.rowCount()));
        marker.put("rows", rowCounts);
        marker.putAll(details);
        writeJson(staging.resolve(ArtifactStore.PARTIAL_MARKER), marker);
        try {
            ArtifactStore.deleteRecursively(partial);
            move(staging, partial);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not preserve partial run " + runId, e);
        }
        state = State.PRESERVED;
        LOG.warn("Run {} incomplete, processed prefix kept in {}", runId, partial);
        return partial;
    }

    /**
     * Drop the staging directory. Safe to call more than once.
     */
    public void abort() {
        if (state != State.OPEN) {
            return;
        }
        state = State.ABORTED;
        for (TableWriter<?> writer : writers.values()) {
            try {
                writer.close();
            } catch (ArtifactWriteException e) {
                LOG.debug("Ignoring close failure while aborting: {}", e.getMessage());
            }
        }
        try {
            ArtifactStore.deleteRecursively(staging);
            LOG.info("Discarded run {}", runId);
        } catch (IOException e) {
            LOG.warn("Could not delete staging directory {}: {}", staging, e.getMessage());
        }
    }

    @Override
    public void close() {
        abort();
    }

    private void ensureOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("Run " + runId + " is " + state.name().toLowerCase(Locale.ROOT));
        }
    }

    private void writeJson(Path file, Map<String, Object> json) {
        try {
            store.jsonMapper().writeValue(file.toFile(), json);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not write " + file, e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic move not supported for {}, falling back to a plain move", to);
            Files.move(from, to);
        }
    }

    static String sha256(Path file) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not digest " + file, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
