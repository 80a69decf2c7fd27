package com.repo.coupling.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Grouping strategy with its payload. The window is only meaningful for
 * {@link ChangesetMode#BY_AUTHOR_TIME} and is {@link Duration#ZERO} otherwise.
 */
public record ChangesetGrouping(ChangesetMode mode, Duration window) {

    public ChangesetGrouping {
        Objects.requireNonNull(mode);
        Objects.requireNonNull(window);
        if (mode == ChangesetMode.BY_AUTHOR_TIME && (window.isNegative() || window.isZero())) {
            throw new IllegalArgumentException("author time window must be positive: " + window);
        }
    }

    public static ChangesetGrouping byCommit() {
        return new ChangesetGrouping(ChangesetMode.BY_COMMIT, Duration.ZERO);
    }

    public static ChangesetGrouping byAuthorTime(Duration window) {
        return new ChangesetGrouping(ChangesetMode.BY_AUTHOR_TIME, window);
    }
}
