package com.repo.coupling.pipeline;

import com.repo.coupling.changeset.ChangesetBuilder;
import com.repo.coupling.core.*;
import com.repo.coupling.coupling.CouplingComputer;
import com.repo.coupling.git.CommitStream;
import com.repo.coupling.git.GitLogSource;
import com.repo.coupling.git.HistorySource;
import com.repo.coupling.git.RawRecord;
import com.repo.coupling.identity.FileIdentityResolver;
import com.repo.coupling.model.*;
import com.repo.coupling.parse.ParseResult;
import com.repo.coupling.parse.RecordParser;
import com.repo.coupling.sparsify.FolderRollup;
import com.repo.coupling.sparsify.Sparsifier;
import com.repo.coupling.store.*;
import com.repo.coupling.store.Rows.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * Runs the whole mining pass: stream, parse, resolve identities, build changesets,
 * accumulate coupling, sparsify and publish.
 * <p>
 * Single pass over the history. Commit, change and changeset rows are streamed to the
 * store as they are produced; everything derived from the full history is written at
 * the end. The artifact set is published only when every stage completed.
 */
public class CouplingPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(CouplingPipeline.class);

    static final int PROGRESS_INTERVAL = 1000;

    private static final DateTimeFormatter RUN_ID_TIME =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final CouplingConfig config;
    private BooleanSupplier cancelled = () -> false;

    public CouplingPipeline(CouplingConfig config) {
        this.config = config;
    }

    /**
     * Checked before every commit; returning true aborts the run and discards its output.
     */
    public CouplingPipeline withCancellation(BooleanSupplier cancelled) {
        this.cancelled = Objects.requireNonNull(cancelled);
        return this;
    }

    /**
     * Analyze a git working copy and publish into {@code outputDir}.
     */
    public RunResult analyze(Path repoRoot, Path outputDir) {
        try (HistorySource source = new GitLogSource(repoRoot, config)) {
            return run(source, new FileScope(config, repoRoot), new ArtifactStore(outputDir), newRunId());
        }
    }

    public RunResult run(HistorySource source, FileScope scope, ArtifactStore store, String runId) {
        LOG.info("Run {}: mining {} into {}", runId, source.describe(), store.target());
        Pass pass = new Pass(source, scope, store.begin(runId));
        try {
            return pass.execute();
        } catch (HistoryExportFailedException e) {
            e.withLastCommitOid(pass.lastCommitOid);
            pass.preservePrefix(e);
            LOG.error("Run {} failed after commit {}: {}", runId, pass.lastCommitOid, e.getMessage());
            throw e;
        } catch (CouplingException e) {
            e.withLastCommitOid(pass.lastCommitOid);
            LOG.error("Run {} failed after commit {}: {}", runId, pass.lastCommitOid, e.getMessage());
            throw e;
        } finally {
            pass.run.close();
        }
    }

    static String newRunId() {
        return RUN_ID_TIME.format(Instant.now()) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * State of one run.
     */
    private final class Pass {

        private final HistorySource source;
        private final FileScope scope;
        private final ArtifactRun run;
        private final RecordParser parser = new RecordParser(config.getValidationMode());
        private final FileIdentityResolver resolver = new FileIdentityResolver();
        private final ValidationCollector validation = new ValidationCollector(config.getMaxValidationIssues());
        private final CouplingComputer computer = new CouplingComputer();
        private final FileActivity activity = new FileActivity();
        private final ChangesetBuilder builder;
        private TableWriter<CommitRow> commits;
        private TableWriter<ChangeRow> changes;
        private TableWriter<ChangesetRow> changesets;
        private String firstCommitOid;
        private String lastCommitOid;
        private long commitCount;
        private int skippedMerges;

        Pass(HistorySource source, FileScope scope, ArtifactRun run) {
            this.source = source;
            this.scope = scope;
            this.run = run;
            this.builder = new ChangesetBuilder(config.grouping(), config.getMaxChangesetSize(), this::onChangeset);
        }

        RunResult execute() {
            commits = run.open(Table.COMMITS);
            changes = run.open(Table.CHANGES);
            changesets = run.open(Table.CHANGESETS);

            CommitStream stream = new CommitStream(source);
            for (RawRecord record : stream) {
                if (cancelled.getAsBoolean()) {
                    throw new RunCancelledException("Run " + run.runId() + " cancelled after " + commitCount + " commits");
                }
                onRecord(record);
            }
            builder.flush();
            commits.close();
            changes.close();
            changesets.close();
            LOG.info("Read {} commits ({} merges skipped), {} file identities, {} co-changed pairs",
                    commitCount, skippedMerges, resolver.identityCount(), computer.pairCount());

            resolver.verifyNoOverlap();
            return finish();
        }

        private void onRecord(RawRecord record) {
            ParseResult result = parser.parse(record);
            validation.record(result);
            if (result.isRejected()) {
                return;
            }
            Commit commit = result.commit();
            if (config.isSkipMergeCommits() && commit.isMerge()) {
                skippedMerges++;
                return;
            }
            commits.write(new CommitRow(commit.oid(), commit.author(), commit.authorEmail(), commit.authoredTs(),
                    commit.committerTs(), commit.parentCount(), commit.subject()));

            Set<Integer> touched = new LinkedHashSet<>();
            Set<Integer> inScope = new LinkedHashSet<>();
            for (ChangeEntry entry : result.entries()) {
                int conflictsBefore = resolver.conflicts().size();
                ChangeEntry resolved = resolver.apply(entry);
                if (resolver.conflicts().size() > conflictsBefore) {
                    validation.record(resolver.conflicts().get(conflictsBefore));
                }
                boolean counted = scope.isInScope(resolved.newPath());
                changes.write(new ChangeRow(commit.oid(), resolved.fileId(), String.valueOf(resolved.status().code()),
                        resolved.similarity(), resolved.newPath(), resolved.oldPath(), counted, resolved.suspect()));
                touched.add(resolved.fileId());
                if (counted) {
                    inScope.add(resolved.fileId());
                }
            }
            activity.onCommit(commit, touched);
            builder.accept(commit, inScope);

            if (firstCommitOid == null) {
                firstCommitOid = commit.oid();
            }
            lastCommitOid = commit.oid();
            commitCount++;
            if (commitCount % PROGRESS_INTERVAL == 0) {
                LOG.info("Processed {} commits, {} changesets, {} rejected tokens",
                        commitCount, builder.emittedCount(), validation.invalidTokens());
            }
        }

        private void onChangeset(Changeset changeset) {
            changesets.write(new ChangesetRow(changeset.key(), changeset.size(), changeset.excludedFromCoupling(),
                    changeset.authorEmail(), changeset.startTs(), changeset.endTs(),
                    join(changeset.files()), String.join(ChangesetRow.LIST_SEPARATOR, changeset.commitOids())));
            computer.accept(changeset);
            activity.onChangeset(changeset);
        }

        private RunResult finish() {
            List<FileIdentity> identities = resolver.identities();
            Map<Integer, String> latestPaths = new HashMap<>();
            for (FileIdentity identity : identities) {
                latestPaths.put(identity.fileId(), identity.latestPath());
            }

            List<FileStatsRow> statsRows = new ArrayList<>();
            List<LineageRow> lineageRows = new ArrayList<>();
            List<PathIndexRow> indexRows = new ArrayList<>();
            for (FileIdentity identity : identities) {
                FileStatistics s = activity.statistics(identity, computer);
                statsRows.add(new FileStatsRow(s.fileId(), s.latestPath(), s.alive(), s.commitCount(),
                        s.changesetCount(), s.couplingTotal(), s.weightedTotal(), s.authorCount(),
                        s.firstCommitTs(), s.lastCommitTs()));
                int seq = 0;
                for (LineageInterval interval : identity.lineage()) {
                    lineageRows.add(new LineageRow(identity.fileId(), seq++, interval.path(),
                            interval.validFromCommit(), interval.validToCommit()));
                }
            }
            indexRows.addAll(pathIndex(identities));
            run.writeAll(Table.FILE_STATS, statsRows);
            run.writeAll(Table.FILE_LINEAGE, lineageRows);
            run.writeAll(Table.PATH_INDEX, indexRows);

            List<Edge> edges = new Sparsifier(config.getTopkEdges(), config.getMinCooccurrence(),
                    config.getPrimaryMetric()).sparsify(computer);
            run.writeAll(Table.EDGES, edges.stream().map(e -> new EdgeRow(e.srcFileId(), e.dstFileId(), e.rank(),
                    latestPaths.get(e.srcFileId()), latestPaths.get(e.dstFileId()), e.pairCount(),
                    e.weightedPairCount(), e.jaccard(), e.weightedJaccard(), e.pDstGivenSrc(), e.pSrcGivenDst()))
                    .toList());

            List<FolderEdge> folderEdges = new FolderRollup(config.getFolderDepth()).rollup(edges, latestPaths::get);
            run.writeAll(Table.FOLDER_EDGES, folderEdges.stream().map(f -> new FolderEdgeRow(f.srcFolder(),
                    f.dstFolder(), config.getFolderDepth(), f.filePairCount(), f.pairCount(), f.weightedPairCount(),
                    f.weight())).toList());

            ValidationSummary summary = validation.summary();
            run.writeValidationSummary(summary);
            if (summary.invalidTokens() > 0) {
                LOG.warn("{} invalid tokens out of {}, quality score {}", summary.invalidTokens(),
                        summary.totalTokens(), String.format("%.4f", summary.qualityScore()));
            }

            RunManifest manifest = new RunManifest(RunManifest.FORMAT_VERSION, run.runId(), source.describe(),
                    source.headCommit().orElse(null), firstCommitOid, lastCommitOid, commitCount,
                    summary.qualityScore(), Instant.now().toString(), config.toMap(), Map.of());
            RunManifest published = run.publish(manifest);
            return new RunResult(run.target(), published, summary, commitCount,
                    builder.emittedCount(), identities.size(), edges.size(), folderEdges.size());
        }

        void preservePrefix(HistoryExportFailedException failure) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", failure.getMessage());
            details.put("exit_code", failure.exitCode());
            details.put("last_commit_oid", lastCommitOid);
            details.put("commit_count", commitCount);
            try {
                run.preservePartial(details);
            } catch (CouplingException e) {
                failure.addSuppressed(e);
            }
        }
    }

    private static List<PathIndexRow> pathIndex(List<FileIdentity> identities) {
        // One row per (path, identity); the open interval marks the current owner
        Map<String, Map<Integer, Boolean>> index = new TreeMap<>();
        for (FileIdentity identity : identities) {
            for (LineageInterval interval : identity.lineage()) {
                index.computeIfAbsent(interval.path(), p -> new TreeMap<>())
                        .merge(identity.fileId(), interval.isOpen(), Boolean::logicalOr);
            }
        }
        List<PathIndexRow> rows = new ArrayList<>();
        index.forEach((path, owners) -> owners.forEach((fileId, current) ->
                rows.add(new PathIndexRow(path, fileId, current))));
        return rows;
    }

    private static String join(List<Integer> fileIds) {
        StringJoiner joiner = new StringJoiner(ChangesetRow.LIST_SEPARATOR);
        fileIds.forEach(id -> joiner.add(String.valueOf(id)));
        return joiner.toString();
    }
}
