package com.repo.coupling.changeset;

import com.repo.coupling.core.ChangesetGrouping;
import com.repo.coupling.model.Changeset;
import com.repo.coupling.model.Commit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Consumer;

/**
 * Groups resolved file ids into changesets and hands each finished one to a sink.
 * <p>
 * {@code by_commit} emits one changeset per commit as soon as it is accepted.
 * {@code by_author_time} keeps one open bucket per author; a commit joins its author's
 * bucket while it lies within the window of the bucket's first commit. Buckets whose
 * window has passed the newest timestamp seen are emitted oldest first, so output order
 * depends only on commit order.
 */
public class ChangesetBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ChangesetBuilder.class);

    private static final Comparator<Bucket> EMIT_ORDER =
            Comparator.<Bucket>comparingLong(b -> b.startTs).thenComparing(b -> b.author);

    private final ChangesetGrouping grouping;
    private final int maxChangesetSize;
    private final Consumer<Changeset> sink;
    private final long windowSeconds;
    private final Map<String, Bucket> openBuckets = new HashMap<>();
    private long watermark = Long.MIN_VALUE;
    private int emitted;
    private int excluded;

    public ChangesetBuilder(ChangesetGrouping grouping, int maxChangesetSize, Consumer<Changeset> sink) {
        this.grouping = grouping;
        this.maxChangesetSize = maxChangesetSize;
        this.sink = sink;
        this.windowSeconds = grouping.window().toSeconds();
    }

    /**
     * Add one commit's in-scope files. Commits without files still advance the window.
     */
    public void accept(Commit commit, Collection<Integer> fileIds) {
        switch (grouping.mode()) {
            case BY_COMMIT -> {
                if (!fileIds.isEmpty()) {
                    Bucket single = new Bucket(commit.oid(), commit.authorEmail(), commit.committerTs());
                    single.add(commit, fileIds);
                    emit(single);
                }
            }
            case BY_AUTHOR_TIME -> acceptTimed(commit, fileIds);
        }
    }

    private void acceptTimed(Commit commit, Collection<Integer> fileIds) {
        long ts = commit.committerTs();
        watermark = Math.max(watermark, ts);
        String author = commit.authorEmail();
        Bucket bucket = openBuckets.get(author);
        if (bucket != null && (ts - bucket.startTs > windowSeconds || ts < bucket.startTs)) {
            openBuckets.remove(author);
            emit(bucket);
            bucket = null;
        }
        if (!fileIds.isEmpty()) {
            if (bucket == null) {
                bucket = new Bucket(author + ":" + ts, author, ts);
                openBuckets.put(author, bucket);
            }
            bucket.add(commit, fileIds);
        }
        expireBefore(watermark - windowSeconds);
    }

    private void expireBefore(long cutoff) {
        List<Bucket> expired = new ArrayList<>();
        for (Bucket open : openBuckets.values()) {
            if (open.startTs < cutoff) {
                expired.add(open);
            }
        }
        if (expired.isEmpty()) {
            return;
        }
        expired.sort(EMIT_ORDER);
        for (Bucket bucket : expired) {
            openBuckets.remove(bucket.author);
            emit(bucket);
        }
    }

    /**
     * Emit every open bucket. Call once the commit stream is exhausted.
     */
    public void flush() {
        List<Bucket> remaining = new ArrayList<>(openBuckets.values());
        remaining.sort(EMIT_ORDER);
        openBuckets.clear();
        remaining.forEach(this::emit);
        LOG.info("Built {} changesets ({} excluded above {} files)", emitted, excluded, maxChangesetSize);
    }

    private void emit(Bucket bucket) {
        boolean tooLarge = bucket.files.size() > maxChangesetSize;
        if (tooLarge) {
            excluded++;
            LOG.debug("Changeset {} touches {} files, excluded from coupling", bucket.key, bucket.files.size());
        }
        emitted++;
        sink.accept(new Changeset(bucket.key, new ArrayList<>(bucket.files), bucket.commitOids,
                bucket.author, bucket.startTs, bucket.endTs, tooLarge));
    }

    public int emittedCount() {
        return emitted;
    }

    public int excludedCount() {
        return excluded;
    }

    private static final class Bucket {
        final String key;
        final String author;
        final long startTs;
        long endTs;
        final SortedSet<Integer> files = new TreeSet<>();
        final List<String> commitOids = new ArrayList<>();

        Bucket(String key, String author, long startTs) {
            this.key = key;
            this.author = author;
            this.startTs = startTs;
            this.endTs = startTs;
        }

        void add(Commit commit, Collection<Integer> fileIds) {
            files.addAll(fileIds);
            commitOids.add(commit.oid());
            endTs = Math.max(endTs, commit.committerTs());
        }
    }
}
