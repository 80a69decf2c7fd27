package com.repo.coupling.identity;

import com.repo.coupling.model.ChangeEntry;
import com.repo.coupling.model.FileIdentity;
import com.repo.coupling.model.LineageInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Assigns stable file ids while commits are replayed oldest first.
 * <p>
 * A path is owned by at most one live identity at a time. Renames move an identity to
 * its new path, deletions close it, and a path added again after deletion takes back
 * the identity it had before. Copies start a new identity at the destination.
 */
public class FileIdentityResolver {

    private static final Logger LOG = LoggerFactory.getLogger(FileIdentityResolver.class);

    private final Map<Integer, Lineage> identities = new LinkedHashMap<>();
    private final Map<String, Integer> currentOwner = new HashMap<>();
    private final Map<String, Integer> lastOwner = new HashMap<>();
    private final List<IdentityConflict> conflicts = new ArrayList<>();
    private int nextId = 1;
    // Ordinal of the commit being applied; commits arrive oldest first
    private long sequence;
    private String sequenceOid;

    /**
     * Resolve one parsed entry and return it with its file id filled in.
     */
    public ChangeEntry apply(ChangeEntry entry) {
        int fileId = switch (entry.status()) {
            case RENAMED -> recordRename(entry.oldPath(), entry.newPath(), entry.commitOid());
            case COPIED -> recordCopy(entry.oldPath(), entry.newPath(), entry.commitOid());
            case DELETED -> recordDeletion(entry.newPath(), entry.commitOid());
            default -> resolve(entry.newPath(), entry.commitOid());
        };
        return entry.withFileId(fileId);
    }

    /**
     * The identity currently living at {@code path}, reviving or creating one when none does.
     */
    public int resolve(String path, String commitOid) {
        observe(commitOid);
        Integer owner = currentOwner.get(path);
        if (owner != null) {
            return owner;
        }
        Integer previous = lastOwner.get(path);
        if (previous != null && !identities.get(previous).isAlive()) {
            identities.get(previous).open(path, commitOid, sequence);
            currentOwner.put(path, previous);
            LOG.debug("Path {} re-added at {}, reusing file id {}", path, commitOid, previous);
            return previous;
        }
        return create(path, commitOid);
    }

    public int recordRename(String oldPath, String newPath, String commitOid) {
        observe(commitOid);
        if (oldPath.equals(newPath)) {
            return resolve(newPath, commitOid);
        }
        Integer moving = currentOwner.get(oldPath);
        Integer holder = currentOwner.get(newPath);

        if (moving == null) {
            if (holder != null) {
                return holder;
            }
            Integer previous = lastOwner.get(oldPath);
            if (previous != null && !identities.get(previous).isAlive()) {
                return open(previous, newPath, commitOid);
            }
            // Rename source outside the observed range
            return create(newPath, commitOid);
        }

        if (holder != null && !holder.equals(moving)) {
            IdentityConflict conflict = new IdentityConflict(commitOid, oldPath, newPath, moving, holder);
            conflicts.add(conflict);
            LOG.warn("Rename {} -> {} at {} targets a path held by file id {}; file id {} ends here",
                    oldPath, newPath, commitOid, holder, moving);
            close(moving, oldPath, commitOid);
            return holder;
        }

        identities.get(moving).close(commitOid, sequence);
        currentOwner.remove(oldPath);
        return open(moving, newPath, commitOid);
    }

    /**
     * A copy leaves the source untouched; the destination gets a fresh identity
     * unless the path is already live.
     */
    public int recordCopy(String sourcePath, String targetPath, String commitOid) {
        observe(commitOid);
        Integer holder = currentOwner.get(targetPath);
        if (holder != null) {
            return holder;
        }
        LOG.debug("Copy {} -> {} at {}", sourcePath, targetPath, commitOid);
        return create(targetPath, commitOid);
    }

    public int recordDeletion(String path, String commitOid) {
        int fileId = resolve(path, commitOid);
        close(fileId, path, commitOid);
        return fileId;
    }

    private void close(int fileId, String path, String commitOid) {
        identities.get(fileId).close(commitOid, sequence);
        currentOwner.remove(path);
    }

    private int create(String path, String commitOid) {
        int fileId = nextId++;
        identities.put(fileId, new Lineage(fileId));
        return open(fileId, path, commitOid);
    }

    private int open(int fileId, String path, String commitOid) {
        identities.get(fileId).open(path, commitOid, sequence);
        currentOwner.put(path, fileId);
        lastOwner.put(path, fileId);
        return fileId;
    }

    private void observe(String commitOid) {
        if (!commitOid.equals(sequenceOid)) {
            sequence++;
            sequenceOid = commitOid;
        }
    }

    // === Queries ===

    public Optional<FileIdentity> lookup(int fileId) {
        Lineage lineage = identities.get(fileId);
        return lineage == null ? Optional.empty() : Optional.of(lineage.snapshot());
    }

    /**
     * The live identity at {@code path}, if any.
     */
    public OptionalInt currentOwner(String path) {
        Integer owner = currentOwner.get(path);
        return owner == null ? OptionalInt.empty() : OptionalInt.of(owner);
    }

    /**
     * Every identity in id order.
     */
    public List<FileIdentity> identities() {
        return identities.values().stream().map(Lineage::snapshot).toList();
    }

    public int identityCount() {
        return identities.size();
    }

    public List<IdentityConflict> conflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    /**
     * Checks that no two intervals on the same path overlap, across all identities.
     *
     * @throws IllegalStateException naming the first overlapping path
     */
    public void verifyNoOverlap() {
        List<Span> spans = new ArrayList<>();
        identities.values().forEach(lineage -> spans.addAll(lineage.spans));
        verifyNoOverlap(spans);
    }

    static void verifyNoOverlap(List<Span> spans) {
        Map<String, List<Span>> byPath = new HashMap<>();
        for (Span span : spans) {
            byPath.computeIfAbsent(span.path(), p -> new ArrayList<>()).add(span);
        }
        for (Map.Entry<String, List<Span>> entry : byPath.entrySet()) {
            List<Span> onPath = entry.getValue();
            onPath.sort(Comparator.comparingLong(Span::from).thenComparingLong(Span::to));
            for (int i = 1; i < onPath.size(); i++) {
                // Half-open: an interval closed at commit c may be followed by one opened at c
                if (onPath.get(i).from() < onPath.get(i - 1).to()) {
                    throw new IllegalStateException("Overlapping lineage on " + entry.getKey()
                            + " between file ids " + onPath.get(i - 1).fileId() + " and " + onPath.get(i).fileId());
                }
            }
        }
    }

    /**
     * A lineage interval in commit ordinals; {@code to} is {@link Long#MAX_VALUE} while open.
     */
    record Span(String path, int fileId, long from, long to) {
    }

    /**
     * Mutable lineage of one identity. At most the last interval is open.
     */
    private static final class Lineage {

        private final int fileId;
        private final List<LineageInterval> intervals = new ArrayList<>();
        private final List<Span> spans = new ArrayList<>();

        Lineage(int fileId) {
            this.fileId = fileId;
        }

        boolean isAlive() {
            return !intervals.isEmpty() && intervals.get(intervals.size() - 1).isOpen();
        }

        void open(String path, String commitOid, long ordinal) {
            if (isAlive()) {
                throw new IllegalStateException("File id " + fileId + " is already live at "
                        + intervals.get(intervals.size() - 1).path());
            }
            intervals.add(new LineageInterval(path, commitOid, null));
            spans.add(new Span(path, fileId, ordinal, Long.MAX_VALUE));
        }

        void close(String commitOid, long ordinal) {
            int last = intervals.size() - 1;
            if (last >= 0 && intervals.get(last).isOpen()) {
                intervals.set(last, intervals.get(last).closeAt(commitOid));
                Span open = spans.get(last);
                spans.set(last, new Span(open.path(), fileId, open.from(), ordinal));
            }
        }

        FileIdentity snapshot() {
            return new FileIdentity(fileId, intervals);
        }
    }
}
