package com.repo.coupling.core;

import java.util.Locale;

/**
 * Severity applied to malformed log input.
 */
public enum ValidationMode {
    /** Abort the run on the first issue. */
    STRICT,
    /** Log the issue, drop the malformed entry and continue. */
    SOFT,
    /** Accept borderline paths and tag them as suspect. */
    PERMISSIVE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ValidationMode fromKey(String key) {
        for (ValidationMode mode : values()) {
            if (mode.key().equals(key.trim().toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown validation_mode: " + key);
    }
}
