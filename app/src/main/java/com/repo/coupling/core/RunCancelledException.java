package com.repo.coupling.core;

/**
 * The run was cancelled between commits. Nothing is published.
 */
public class RunCancelledException extends CouplingException {

    public RunCancelledException(String message) {
        super(message);
    }
}
