package com.repo.coupling.sparsify;

import com.repo.coupling.model.Edge;
import com.repo.coupling.model.FolderEdge;

import java.util.*;
import java.util.function.IntFunction;

/**
 * Aggregates retained file edges into edges between folders cut at a fixed depth.
 * Each undirected file pair counts once even when both directions were retained.
 * Pairs inside the same folder are dropped. {@code weight} is the mean Jaccard.
 */
public class FolderRollup {

    public static final String ROOT = ".";

    private final int depth;

    public FolderRollup(int depth) {
        if (depth <= 0) {
            throw new IllegalArgumentException("depth must be positive: " + depth);
        }
        this.depth = depth;
    }

    /**
     * @param pathOf latest path of a file id
     */
    public List<FolderEdge> rollup(List<Edge> edges, IntFunction<String> pathOf) {
        Set<Long> seenPairs = new HashSet<>();
        Map<String, Map<String, Totals>> folders = new TreeMap<>();
        for (Edge edge : edges) {
            int lo = Math.min(edge.srcFileId(), edge.dstFileId());
            int hi = Math.max(edge.srcFileId(), edge.dstFileId());
            if (!seenPairs.add(((long) lo << 32) | hi)) {
                continue;
            }
            String a = folderOf(pathOf.apply(lo));
            String b = folderOf(pathOf.apply(hi));
            if (a.equals(b)) {
                continue;
            }
            String src = a.compareTo(b) < 0 ? a : b;
            String dst = a.compareTo(b) < 0 ? b : a;
            Totals totals = folders.computeIfAbsent(src, k -> new TreeMap<>()).computeIfAbsent(dst, k -> new Totals());
            totals.filePairs++;
            totals.pairCount += edge.pairCount();
            totals.weighted += edge.weightedPairCount();
            totals.jaccardSum += edge.jaccard();
        }

        List<FolderEdge> result = new ArrayList<>();
        folders.forEach((src, row) -> row.forEach((dst, t) -> result.add(new FolderEdge(
                src, dst, t.filePairs, t.pairCount, t.weighted, t.jaccardSum / t.filePairs))));
        return result;
    }

    /**
     * The first {@code depth} directories of a path, or {@value #ROOT} for top-level files.
     */
    public String folderOf(String path) {
        String[] parts = path.split("/");
        int dirs = parts.length - 1;
        if (dirs <= 0) {
            return ROOT;
        }
        return String.join("/", Arrays.copyOfRange(parts, 0, Math.min(depth, dirs)));
    }

    private static final class Totals {
        int filePairs;
        long pairCount;
        double weighted;
        double jaccardSum;
    }
}
