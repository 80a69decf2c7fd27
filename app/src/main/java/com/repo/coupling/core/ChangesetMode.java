package com.repo.coupling.core;

import java.util.Locale;

/**
 * How change entries are grouped into units of co-change evidence.
 */
public enum ChangesetMode {
    /** One changeset per physical commit. */
    BY_COMMIT,
    /** Commits by the same author within a time window merge into one changeset. */
    BY_AUTHOR_TIME;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangesetMode fromKey(String key) {
        for (ChangesetMode mode : values()) {
            if (mode.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown changeset_mode: " + key);
    }
}
