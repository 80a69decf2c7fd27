package com.repo.coupling.model;

import java.util.List;
import java.util.Optional;

/**
 * A stable file identity and the ordered paths it has lived at.
 */
public record FileIdentity(int fileId, List<LineageInterval> lineage) {

    public FileIdentity {
        lineage = List.copyOf(lineage);
    }

    /**
     * The open interval's path, empty once the file has been deleted.
     */
    public Optional<String> currentPath() {
        return lineage.stream().filter(LineageInterval::isOpen).map(LineageInterval::path).findFirst();
    }

    /**
     * The most recent path, whether or not the file still exists.
     */
    public String latestPath() {
        return lineage.get(lineage.size() - 1).path();
    }

    public boolean isAlive() {
        return currentPath().isPresent();
    }
}
