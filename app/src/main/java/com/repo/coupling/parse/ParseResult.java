package com.repo.coupling.parse;

import com.repo.coupling.model.ChangeEntry;
import com.repo.coupling.model.Commit;
import com.repo.coupling.model.ValidationIssue;

import java.util.List;

/**
 * Outcome of parsing one raw record.
 *
 * @param commit     null when the record's metadata was unusable and the whole record was rejected
 * @param tokenCount non-blank tokens seen, including metadata
 */
public record ParseResult(Commit commit, List<ChangeEntry> entries, List<ValidationIssue> issues, int tokenCount) {

    public ParseResult {
        entries = List.copyOf(entries);
        issues = List.copyOf(issues);
    }

    public boolean isRejected() {
        return commit == null;
    }
}
