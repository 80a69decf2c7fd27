package com.repo.coupling.core;

/**
 * A published artifact set is missing, incomplete or does not match its manifest.
 */
public class ArtifactReadException extends CouplingException {

    public ArtifactReadException(String message) {
        super(message);
    }

    public ArtifactReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
