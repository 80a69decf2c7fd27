package com.repo.coupling.core;

/**
 * The history export process failed, exited non-zero or exceeded its wall-clock limit.
 */
public class HistoryExportFailedException extends CouplingException {

    private final int exitCode;

    public HistoryExportFailedException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public HistoryExportFailedException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    public int exitCode() {
        return exitCode;
    }
}
