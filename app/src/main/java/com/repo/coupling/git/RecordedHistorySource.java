package com.repo.coupling.git;

import com.repo.coupling.core.HistoryExportFailedException;
import com.repo.coupling.core.RepositoryUnavailableException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays a previously exported log, for reproducible re-analysis and for tests.
 */
public class RecordedHistorySource implements HistorySource {

    private final String origin;
    private final IoSupplier supplier;
    private InputStream stream;

    @FunctionalInterface
    private interface IoSupplier {
        InputStream get() throws IOException;
    }

    private RecordedHistorySource(String origin, IoSupplier supplier) {
        this.origin = origin;
        this.supplier = supplier;
    }

    public static RecordedHistorySource ofBytes(byte[] log) {
        return new RecordedHistorySource("memory", () -> new ByteArrayInputStream(log));
    }

    public static RecordedHistorySource ofFile(Path logFile) {
        return new RecordedHistorySource(logFile.toString(), () -> {
            if (!Files.isReadable(logFile)) {
                throw new RepositoryUnavailableException("Recorded log not readable: " + logFile);
            }
            return Files.newInputStream(logFile);
        });
    }

    /**
     * Join tokens with NUL separators, the layout git produces with {@code -z}.
     */
    public static RecordedHistorySource ofTokens(List<String> tokens) {
        return ofBytes(String.join("\0", tokens).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public InputStream open() {
        if (stream != null) {
            throw new IllegalStateException("History already opened: " + origin);
        }
        try {
            stream = supplier.get();
            return stream;
        } catch (IOException e) {
            throw new HistoryExportFailedException("Could not open recorded log " + origin, e);
        }
    }

    @Override
    public void awaitCompletion() {
        // Nothing runs in the background
    }

    @Override
    public String describe() {
        return "recorded:" + origin;
    }

    @Override
    public void close() {
        if (stream != null) {
            try {
                stream.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
