package com.repo.coupling.model;

/**
 * A span of history during which a file identity lived at {@code path}.
 * {@code validToCommit} is null while the interval is open.
 */
public record LineageInterval(String path, String validFromCommit, String validToCommit) {

    public boolean isOpen() {
        return validToCommit == null;
    }

    public LineageInterval closeAt(String commitOid) {
        return new LineageInterval(path, validFromCommit, commitOid);
    }
}
