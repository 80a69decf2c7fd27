package com.repo.coupling.store;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.repo.coupling.core.ArtifactWriteException;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Streams rows of one table into its CSV file.
 */
public class TableWriter<R> implements Closeable {

    private final Table<R> table;
    private final Path file;
    private final SequenceWriter writer;
    private long rows;
    private boolean closed;

    TableWriter(Table<R> table, Path file, SequenceWriter writer) {
        this.table = table;
        this.file = file;
        this.writer = writer;
    }

    public void write(R row) {
        if (closed) {
            throw new IllegalStateException("Table " + table.name() + " already closed");
        }
        try {
            writer.write(row);
            rows++;
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not write a row to " + file, e);
        }
    }

    public long rowCount() {
        return rows;
    }

    Table<R> table() {
        return table;
    }

    Path file() {
        return file;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not close " + file, e);
        }
    }
}
