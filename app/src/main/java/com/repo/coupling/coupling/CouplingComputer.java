package com.repo.coupling.coupling;

import com.repo.coupling.model.Changeset;
import com.repo.coupling.model.CouplingStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;

/**
 * Accumulates pairwise co-change counts and per-file totals over non-excluded changesets.
 * <p>
 * Pairs are keyed by the ordered id pair, so (a, b) and (b, a) share one accumulator.
 * Accumulation is commutative; shards built over disjoint changesets can be combined
 * with {@link #merge(CouplingComputer)}.
 */
public class CouplingComputer {

    private static final Logger LOG = LoggerFactory.getLogger(CouplingComputer.class);

    private final Map<Long, PairCounts> pairs = new HashMap<>();
    private final Map<Integer, FileTotals> totals = new HashMap<>();
    private int changesetsCounted;
    private int changesetsSkipped;

    public void accept(Changeset changeset) {
        if (changeset.excludedFromCoupling()) {
            changesetsSkipped++;
            return;
        }
        changesetsCounted++;
        List<Integer> files = changeset.files();
        int size = files.size();
        double weight = 1.0 / size;
        for (int file : files) {
            FileTotals t = totals.computeIfAbsent(file, id -> new FileTotals());
            t.count++;
            t.weighted += weight;
        }
        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                PairCounts counts = pairs.computeIfAbsent(pairKey(files.get(i), files.get(j)), k -> new PairCounts());
                counts.count++;
                counts.weighted += weight;
            }
        }
    }

    /**
     * Fold another shard into this one.
     */
    public CouplingComputer merge(CouplingComputer other) {
        other.pairs.forEach((key, counts) -> {
            PairCounts mine = pairs.computeIfAbsent(key, k -> new PairCounts());
            mine.count += counts.count;
            mine.weighted += counts.weighted;
        });
        other.totals.forEach((file, t) -> {
            FileTotals mine = totals.computeIfAbsent(file, id -> new FileTotals());
            mine.count += t.count;
            mine.weighted += t.weighted;
        });
        changesetsCounted += other.changesetsCounted;
        changesetsSkipped += other.changesetsSkipped;
        LOG.debug("Merged shard with {} pairs, now {} pairs", other.pairs.size(), pairs.size());
        return this;
    }

    /**
     * Statistics oriented as (a, b), empty when the pair never co-changed.
     */
    public Optional<CouplingStat> stat(int a, int b) {
        if (a == b) {
            return Optional.empty();
        }
        PairCounts counts = pairs.get(pairKey(a, b));
        if (counts == null) {
            return Optional.empty();
        }
        return Optional.of(toStat(a, b, counts));
    }

    /**
     * Visit every co-changed pair once, oriented with the lower id first.
     */
    public void forEachPair(Consumer<CouplingStat> visitor) {
        pairs.forEach((key, counts) -> visitor.accept(toStat(low(key), high(key), counts)));
    }

    public int total(int file) {
        FileTotals t = totals.get(file);
        return t == null ? 0 : t.count;
    }

    public double weightedTotal(int file) {
        FileTotals t = totals.get(file);
        return t == null ? 0.0 : t.weighted;
    }

    public int pairCount() {
        return pairs.size();
    }

    public int changesetsCounted() {
        return changesetsCounted;
    }

    public int changesetsSkipped() {
        return changesetsSkipped;
    }

    private CouplingStat toStat(int a, int b, PairCounts counts) {
        return new CouplingStat(a, b, counts.count, counts.weighted,
                total(a), total(b), weightedTotal(a), weightedTotal(b));
    }

    static long pairKey(int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    private static int low(long key) {
        return (int) (key >>> 32);
    }

    private static int high(long key) {
        return (int) key;
    }

    private static final class PairCounts {
        int count;
        double weighted;
    }

    private static final class FileTotals {
        int count;
        double weighted;
    }
}
