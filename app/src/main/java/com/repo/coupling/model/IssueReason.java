package com.repo.coupling.model;

import java.util.Locale;

/**
 * Why a token or record was rejected.
 */
public enum IssueReason {
    MISSING_COMMIT_MARKER,
    TRUNCATED_METADATA,
    INVALID_COMMIT_OID,
    INVALID_TIMESTAMP,
    INVALID_STATUS,
    MISSING_PATH,
    INVALID_PATH,
    INCOMPLETE_CHANGE,
    IDENTITY_CONFLICT;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
