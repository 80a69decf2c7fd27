package com.repo.coupling.git;

import java.io.Closeable;
import java.io.InputStream;
import java.util.Optional;

/**
 * Producer of the raw, NUL-separated commit log consumed by {@link CommitStream}.
 */
public interface HistorySource extends Closeable {

    /**
     * Marker token that opens every commit record. The control characters keep it
     * distinct from anything git prints for metadata.
     */
    String COMMIT_MARKER = "\u0001LC-COMMIT\u0001";

    /**
     * Start the export and return its output. May be called once.
     *
     * @throws com.repo.coupling.core.RepositoryUnavailableException if the location is not a readable repository
     * @throws com.repo.coupling.core.HistoryExportFailedException   if the export cannot be started
     */
    InputStream open();

    /**
     * Wait for the export to finish after its output has been drained.
     *
     * @throws com.repo.coupling.core.HistoryExportFailedException if it exited non-zero or timed out
     */
    void awaitCompletion();

    /**
     * Human-readable origin for logs and the run manifest.
     */
    String describe();

    /**
     * The commit the selected range ends at, when the source can tell.
     */
    default Optional<String> headCommit() {
        return Optional.empty();
    }

    /**
     * Release the export, killing it if it is still running.
     */
    @Override
    void close();
}
