package com.repo.coupling.model;

/**
 * Evidence of malformed input.
 *
 * @param commitOid          commit being parsed, null when the metadata itself was unusable
 * @param cursorPosition     zero-based index of the offending token in the whole log stream
 * @param surroundingContext neighbouring tokens, for diagnosis
 */
public record ValidationIssue(
        String commitOid,
        String rawToken,
        long cursorPosition,
        String surroundingContext,
        IssueReason reason) {
}
