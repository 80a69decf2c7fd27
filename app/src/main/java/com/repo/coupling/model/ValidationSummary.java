package com.repo.coupling.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-quality account of one run.
 *
 * @param invalidTokens   rejected tokens plus identity conflicts
 * @param countsByReason  rejections per reason key, in reason order
 * @param samples         the first issues seen, up to the configured cap
 */
public record ValidationSummary(
        long totalTokens,
        long invalidTokens,
        int rejectedRecords,
        int identityConflicts,
        Map<String, Long> countsByReason,
        List<ValidationIssue> samples,
        int sampleLimit) {

    public ValidationSummary {
        countsByReason = Map.copyOf(countsByReason);
        samples = List.copyOf(samples);
    }

    /**
     * {@code 1 - invalid/total}, 1.0 when nothing was read.
     */
    public double qualityScore() {
        if (totalTokens == 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - invalidTokens / (double) totalTokens);
    }

    public long count(IssueReason reason) {
        return countsByReason.getOrDefault(reason.key(), 0L);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("total_tokens", totalTokens);
        json.put("invalid_tokens", invalidTokens);
        json.put("quality_score", qualityScore());
        json.put("rejected_records", rejectedRecords);
        json.put("identity_conflicts", identityConflicts);

        Map<String, Long> counts = new LinkedHashMap<>();
        for (IssueReason reason : IssueReason.values()) {
            long n = count(reason);
            if (n > 0) {
                counts.put(reason.key(), n);
            }
        }
        json.put("counts_by_reason", counts);
        json.put("sample_limit", sampleLimit);

        List<Map<String, Object>> sampleMaps = new ArrayList<>();
        for (ValidationIssue issue : samples) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("reason", issue.reason().key());
            entry.put("commit_oid", issue.commitOid());
            entry.put("cursor_position", issue.cursorPosition());
            entry.put("raw_token", issue.rawToken());
            entry.put("context", issue.surroundingContext());
            sampleMaps.add(entry);
        }
        json.put("samples", sampleMaps);
        return json;
    }
}
