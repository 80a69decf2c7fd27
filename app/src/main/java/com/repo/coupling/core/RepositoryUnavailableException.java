package com.repo.coupling.core;

/**
 * The given location is not a readable repository.
 */
public class RepositoryUnavailableException extends CouplingException {

    public RepositoryUnavailableException(String message) {
        super(message);
    }

    public RepositoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
