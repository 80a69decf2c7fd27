package com.repo.coupling.git;

import com.repo.coupling.core.HistoryExportFailedException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy sequence of raw commit records read from a {@link HistorySource}.
 * <p>
 * Single pass: {@link #iterator()} may be called once, and the history is read as
 * the iterator is pulled, one record at a time. Re-processing requires a new stream
 * over a new source from the start of the range.
 */
public class CommitStream implements Iterable<RawRecord>, Closeable {

    private final HistorySource source;
    private boolean consumed;

    public CommitStream(HistorySource source) {
        this.source = source;
    }

    @Override
    public Iterator<RawRecord> iterator() {
        if (consumed) {
            throw new IllegalStateException("Commit stream is single-pass; re-open the history source to re-read "
                    + source.describe());
        }
        consumed = true;
        return new RecordIterator(new BufferedInputStream(source.open(), 1 << 16));
    }

    public String describe() {
        return source.describe();
    }

    @Override
    public void close() {
        source.close();
    }

    private final class RecordIterator implements Iterator<RawRecord> {

        private final InputStream in;
        private final ByteArrayOutputStream token = new ByteArrayOutputStream(256);
        private long position;
        private boolean eof;
        private boolean markerPending;
        private boolean finished;
        private RawRecord next;

        RecordIterator(InputStream in) {
            this.in = in;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = readRecord();
            }
            return next != null;
        }

        @Override
        public RawRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            RawRecord record = next;
            next = null;
            return record;
        }

        private RawRecord readRecord() {
            boolean hasMarker = markerPending;
            markerPending = false;
            long first = position;
            List<String> tokens = new ArrayList<>();

            while (true) {
                String t = readToken();
                if (t == null) {
                    finish();
                    // A stream may end right after a marker: that is still a (truncated) record
                    if (!hasMarker && tokens.isEmpty()) {
                        return null;
                    }
                    return new RawRecord(first, hasMarker, tokens);
                }
                if (isMarker(t)) {
                    if (!hasMarker && tokens.isEmpty()) {
                        hasMarker = true;
                        first = position;
                        continue;
                    }
                    markerPending = true;
                    return new RawRecord(first, hasMarker, tokens);
                }
                tokens.add(t);
            }
        }

        private String readToken() {
            if (eof) {
                return null;
            }
            token.reset();
            try {
                int b;
                while ((b = in.read()) != -1) {
                    if (b == 0) {
                        position++;
                        return token.toString(StandardCharsets.UTF_8);
                    }
                    token.write(b);
                }
            } catch (IOException e) {
                throw new HistoryExportFailedException("Reading history from " + source.describe() + " failed", e);
            }
            eof = true;
            if (token.size() == 0) {
                return null;
            }
            position++;
            return token.toString(StandardCharsets.UTF_8);
        }

        private void finish() {
            if (!finished) {
                finished = true;
                source.awaitCompletion();
            }
        }
    }

    static boolean isMarker(String token) {
        return stripNewlines(token).equals(HistorySource.COMMIT_MARKER);
    }

    /**
     * Git separates the header from the file list with a newline that ends up glued to
     * the neighbouring token. Only used for markers and status letters, never for paths.
     */
    public static String stripNewlines(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && (token.charAt(start) == '\n' || token.charAt(start) == '\r')) {
            start++;
        }
        while (end > start && (token.charAt(end - 1) == '\n' || token.charAt(end - 1) == '\r')) {
            end--;
        }
        return token.substring(start, end);
    }
}
