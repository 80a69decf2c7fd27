package com.repo.coupling.model;

import java.util.Locale;
import java.util.Optional;

/**
 * File status letters as emitted by {@code git log --name-status}.
 */
public enum ChangeStatus {
    ADDED('A'),
    MODIFIED('M'),
    DELETED('D'),
    RENAMED('R'),
    COPIED('C'),
    TYPE_CHANGED('T'),
    UNMERGED('U'),
    UNKNOWN('X'),
    BROKEN('B');

    private final char code;

    ChangeStatus(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    /**
     * Renames and copies carry a similarity score and two paths.
     */
    public boolean hasSourcePath() {
        return this == RENAMED || this == COPIED;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ChangeStatus> fromCode(char code) {
        for (ChangeStatus status : values()) {
            if (status.code == code) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
