package com.repo.coupling.sparsify;

import com.repo.coupling.core.CouplingMetric;
import com.repo.coupling.coupling.CouplingComputer;
import com.repo.coupling.model.CouplingStat;
import com.repo.coupling.model.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Keeps, for every file, its top-k neighbours by the primary metric.
 * <p>
 * Selection is per source file, so the result is directed: a may keep b without b
 * keeping a. Ties break on pair count (higher first), then on the neighbour's id (lower
 * first), which makes the output independent of accumulation order.
 */
public class Sparsifier {

    private static final Logger LOG = LoggerFactory.getLogger(Sparsifier.class);

    private final int topk;
    private final int minCooccurrence;
    private final CouplingMetric metric;
    private final Comparator<CouplingStat> ranking;

    public Sparsifier(int topk, int minCooccurrence, CouplingMetric metric) {
        if (topk <= 0) {
            throw new IllegalArgumentException("topk must be positive: " + topk);
        }
        this.topk = topk;
        this.minCooccurrence = minCooccurrence;
        this.metric = metric;
        this.ranking = Comparator.<CouplingStat>comparingDouble(s -> -s.metric(metric))
                .thenComparing(Comparator.comparingInt(CouplingStat::pairCount).reversed())
                .thenComparingInt(CouplingStat::fileB);
    }

    /**
     * Edges ordered by source id, then rank.
     */
    public List<Edge> sparsify(CouplingComputer computer) {
        // Bounded heaps keep the worst retained candidate on top
        Map<Integer, PriorityQueue<CouplingStat>> candidates = new TreeMap<>();
        int[] considered = new int[1];
        computer.forEachPair(stat -> {
            if (stat.pairCount() < minCooccurrence) {
                return;
            }
            considered[0]++;
            offer(candidates, stat);
            offer(candidates, stat.reversed());
        });

        List<Edge> edges = new ArrayList<>();
        for (Map.Entry<Integer, PriorityQueue<CouplingStat>> entry : candidates.entrySet()) {
            List<CouplingStat> kept = new ArrayList<>(entry.getValue());
            kept.sort(ranking);
            int rank = 1;
            for (CouplingStat stat : kept) {
                edges.add(toEdge(stat, rank++));
            }
        }
        LOG.info("Sparsified {} pairs (min co-occurrence {}) into {} edges, top {} by {}",
                considered[0], minCooccurrence, edges.size(), topk, metric.key());
        return edges;
    }

    private void offer(Map<Integer, PriorityQueue<CouplingStat>> candidates, CouplingStat stat) {
        PriorityQueue<CouplingStat> heap = candidates.computeIfAbsent(stat.fileA(),
                id -> new PriorityQueue<>(ranking.reversed()));
        heap.offer(stat);
        if (heap.size() > topk) {
            heap.poll();
        }
    }

    private static Edge toEdge(CouplingStat stat, int rank) {
        return new Edge(stat.fileA(), stat.fileB(), stat.pairCount(), stat.weightedPairCount(),
                stat.jaccard(), stat.weightedJaccard(),
                stat.probabilityBGivenA(), stat.probabilityAGivenB(), rank);
    }
}
