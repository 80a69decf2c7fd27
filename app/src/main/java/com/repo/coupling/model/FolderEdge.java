package com.repo.coupling.model;

/**
 * Folder-level rollup of file edges. Folders are ordered so {@code srcFolder < dstFolder}.
 */
public record FolderEdge(
        String srcFolder,
        String dstFolder,
        int filePairCount,
        long pairCount,
        double weightedPairCount,
        double weight) {
}
