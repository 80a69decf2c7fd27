package com.repo.coupling.model;

/**
 * Metadata of one observed commit. Timestamps are Unix epoch seconds.
 */
public record Commit(
        String oid,
        String author,
        String authorEmail,
        long authoredTs,
        long committerTs,
        String subject,
        int parentCount) {

    public boolean isMerge() {
        return parentCount > 1;
    }
}
