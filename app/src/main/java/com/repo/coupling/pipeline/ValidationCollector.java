package com.repo.coupling.pipeline;

import com.repo.coupling.identity.IdentityConflict;
import com.repo.coupling.model.IssueReason;
import com.repo.coupling.model.ValidationIssue;
import com.repo.coupling.model.ValidationSummary;
import com.repo.coupling.parse.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts rejected tokens by reason and keeps the first issues as samples.
 */
class ValidationCollector {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationCollector.class);

    private final int sampleLimit;
    private final Map<IssueReason, Long> counts = new EnumMap<>(IssueReason.class);
    private final List<ValidationIssue> samples = new ArrayList<>();
    private long totalTokens;
    private long invalidTokens;
    private int rejectedRecords;
    private int identityConflicts;

    ValidationCollector(int sampleLimit) {
        this.sampleLimit = sampleLimit;
    }

    void record(ParseResult result) {
        totalTokens += result.tokenCount();
        if (result.isRejected()) {
            rejectedRecords++;
        }
        result.issues().forEach(this::add);
    }

    void record(IdentityConflict conflict) {
        identityConflicts++;
        add(new ValidationIssue(conflict.commitOid(), conflict.oldPath() + " -> " + conflict.newPath(), -1,
                "file " + conflict.renamedFileId() + " renamed onto file " + conflict.holderFileId(),
                IssueReason.IDENTITY_CONFLICT));
    }

    private void add(ValidationIssue issue) {
        invalidTokens++;
        counts.merge(issue.reason(), 1L, Long::sum);
        if (samples.size() < sampleLimit) {
            samples.add(issue);
            LOG.debug("Rejected {} at token {} in {}: {}", issue.reason().key(), issue.cursorPosition(),
                    issue.commitOid(), issue.surroundingContext());
        }
    }

    long invalidTokens() {
        return invalidTokens;
    }

    ValidationSummary summary() {
        Map<String, Long> byKey = new LinkedHashMap<>();
        counts.forEach((reason, n) -> byKey.put(reason.key(), n));
        return new ValidationSummary(totalTokens, invalidTokens, rejectedRecords, identityConflicts,
                byKey, samples, sampleLimit);
    }
}
