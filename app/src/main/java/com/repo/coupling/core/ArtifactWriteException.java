package com.repo.coupling.core;

/**
 * Derived tables could not be written or published.
 */
public class ArtifactWriteException extends CouplingException {

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArtifactWriteException(String message) {
        super(message);
    }
}
