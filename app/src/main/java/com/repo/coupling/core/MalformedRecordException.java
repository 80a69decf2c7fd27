package com.repo.coupling.core;

import com.repo.coupling.model.ValidationIssue;

/**
 * A malformed log record promoted to a fatal failure by strict validation.
 */
public class MalformedRecordException extends CouplingException {

    private final transient ValidationIssue issue;

    public MalformedRecordException(ValidationIssue issue) {
        super("Malformed record (" + issue.reason().key() + ") at token " + issue.cursorPosition()
                + ": " + issue.rawToken());
        this.issue = issue;
    }

    public ValidationIssue issue() {
        return issue;
    }
}
