package com.repo.coupling.model;

/**
 * A retained neighbour of {@code srcFileId}; {@code rank} starts at 1 within the source file.
 */
public record Edge(
        int srcFileId,
        int dstFileId,
        int pairCount,
        double weightedPairCount,
        double jaccard,
        double weightedJaccard,
        double pDstGivenSrc,
        double pSrcGivenDst,
        int rank) {
}
