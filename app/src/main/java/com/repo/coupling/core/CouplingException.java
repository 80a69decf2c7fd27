package com.repo.coupling.core;

import java.util.Optional;

/**
 * Root of the failures that end a coupling run.
 * Unchecked because most of them surface from pull-based iteration.
 */
public class CouplingException extends RuntimeException {

    private String lastCommitOid;

    public CouplingException(String message) {
        super(message);
    }

    public CouplingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The last commit that was fully processed before the failure, if any.
     */
    public Optional<String> lastCommitOid() {
        return Optional.ofNullable(lastCommitOid);
    }

    /**
     * Records the processed commit boundary. Only the first call has an effect.
     */
    public CouplingException withLastCommitOid(String oid) {
        if (lastCommitOid == null) {
            lastCommitOid = oid;
        }
        return this;
    }
}
