package com.repo.coupling.pipeline;

import com.repo.coupling.core.*;
import com.repo.coupling.git.HistoryLog;
import com.repo.coupling.git.HistorySource;
import com.repo.coupling.git.RecordedHistorySource;
import com.repo.coupling.model.IssueReason;
import com.repo.coupling.store.*;
import com.repo.coupling.store.Rows.EdgeRow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CouplingPipelineTest {

    private static final double EPS = 1e-9;

    @TempDir
    Path tempDir;

    private final CouplingConfig config = CouplingConfig.defaults().withMinCooccurrence(1);

    @Test
    void testThreeCommitScenario() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "A.py")
                .commit(2, "ann@example.com", 2000).change("M", "A.py").change("A", "B.py")
                .commit(3, "bob@example.com", 3000).change("M", "A.py").change("M", "B.py");

        RunResult result = run(log, config);

        assertEquals(3, result.commitCount());
        assertEquals(3, result.changesetCount());
        assertEquals(2, result.identityCount());
        assertEquals(1.0, result.qualityScore(), EPS);
        assertEquals(HistoryLog.oid(3), result.manifest().lastCommit());

        ArtifactReader reader = ArtifactReader.open(result.publishedDir());
        int a = reader.lookup("A.py").orElseThrow().fileId();
        int b = reader.lookup("B.py").orElseThrow().fileId();

        EdgeRow ab = reader.neighbours(a, 10).get(0);
        assertEquals(b, ab.dstFileId());
        assertEquals(2, ab.pairCount());
        assertEquals(2.0 / 3.0, ab.jaccard(), EPS);
        assertEquals(2.0 / 3.0, ab.pDstGivenSrc(), EPS);
        assertEquals(1.0, ab.pSrcGivenDst(), EPS);

        EdgeRow ba = reader.neighbours(b, 10).get(0);
        assertEquals(a, ba.dstFileId());
        assertEquals(1.0, ba.pDstGivenSrc(), EPS);

        assertEquals(3, reader.lookup(a).orElseThrow().stats().couplingTotal());
        assertEquals(2, reader.lookup(b).orElseThrow().stats().couplingTotal());
        assertEquals(2, reader.lookup(a).orElseThrow().stats().authorCount());

        PairEvidence evidence = reader.evidence(a, b);
        assertEquals(2, evidence.changesets().size());
        assertEquals(2, evidence.countedChangesets());
        assertEquals(List.of(HistoryLog.oid(2), HistoryLog.oid(3)),
                evidence.commits().stream().map(Rows.CommitRow::commitOid).toList());
    }

    @Test
    void testRenameKeepsCouplingOnOneIdentity() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "a.py").change("A", "b.py")
                .commit(2, "ann@example.com", 2000).change("M", "a.py").change("M", "b.py")
                .commit(3, "ann@example.com", 3000).change("R100", "a.py", "src/a.py").change("M", "b.py")
                .commit(4, "ann@example.com", 4000).change("M", "src/a.py").change("M", "b.py");

        RunResult result = run(log, config);
        ArtifactReader reader = ArtifactReader.open(result.publishedDir());

        FileRecord moved = reader.lookup("src/a.py").orElseThrow();
        assertEquals(moved.fileId(), reader.lookup("a.py").orElseThrow().fileId(),
                "The old path resolves to the same identity");
        assertEquals("src/a.py", moved.currentPath().orElseThrow());
        assertEquals(2, moved.history().size());
        assertEquals(2, result.identityCount());

        EdgeRow edge = reader.neighbours(moved.fileId(), 1).get(0);
        assertEquals(4, edge.pairCount(), "Co-changes before and after the rename accumulate together");
        assertEquals("src/a.py", edge.srcPath());
    }

    @Test
    void testVacatedPathResolvesToItsLastHolder() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "y.py").change("A", "x.py")
                .commit(2, "ann@example.com", 2000).change("R100", "x.py", "z.py")
                .commit(3, "ann@example.com", 3000).change("R100", "y.py", "x.py")
                .commit(4, "ann@example.com", 4000).change("R100", "x.py", "w.py");

        RunResult result = run(log, config);
        ArtifactReader reader = ArtifactReader.open(result.publishedDir());

        FileRecord former = reader.lookup("x.py").orElseThrow();
        assertEquals(reader.lookup("w.py").orElseThrow().fileId(), former.fileId(),
                "The file that left x.py last, not the one with the highest id");
        assertNotEquals(reader.lookup("z.py").orElseThrow().fileId(), former.fileId());
        assertEquals("w.py", former.currentPath().orElseThrow());
    }

    @Test
    void testOversizedCommitIsRecordedButNotCoupled() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "a.py").change("A", "b.py").change("A", "c.py");

        RunResult result = run(log, CouplingConfig.defaults().withMinCooccurrence(1).withMaxChangesetSize(2));

        assertEquals(1, result.changesetCount());
        assertEquals(0, result.edgeCount());
        ArtifactReader reader = ArtifactReader.open(result.publishedDir());
        FileRecord a = reader.lookup("a.py").orElseThrow();
        assertEquals(1, a.stats().changesetCount());
        assertEquals(0, a.stats().couplingTotal());
        PairEvidence evidence = reader.evidence(a.fileId(), reader.lookup("b.py").orElseThrow().fileId());
        assertEquals(1, evidence.changesets().size());
        assertEquals(0, evidence.countedChangesets());
    }

    @Test
    void testIgnoredFilesAreRecordedButNotCoupled() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("M", "a.py").change("M", "b.py").change("M", "docs/x.md");

        RunResult result = run(log, CouplingConfig.defaults().withMinCooccurrence(1)
                .withIgnorePatterns(List.of("docs/**")));

        ArtifactReader reader = ArtifactReader.open(result.publishedDir());
        FileRecord docs = reader.lookup("docs/x.md").orElseThrow();
        assertEquals(1, docs.stats().commitCount());
        assertEquals(0, docs.stats().changesetCount());
        assertTrue(reader.neighbours(docs.fileId(), 10).isEmpty());
        assertEquals(2, result.edgeCount(), "a.py and b.py keep each other");
    }

    @Test
    void testMergeCommitsSkipped() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "a.py")
                .commit(HistoryLog.oid(2), HistoryLog.oid(1) + " " + HistoryLog.oid(9), "ann@example.com", 2000, "Merge")
                .change("M", "a.py").change("M", "b.py");

        RunResult result = run(log, config);

        assertEquals(1, result.commitCount());
        assertEquals(1, result.identityCount());
    }

    @Test
    void testMalformedTokensLowerQualityScore() throws IOException {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("M", "a.py").raw("Q").change("M", "b.py");

        RunResult result = run(log, config);

        assertEquals(1, result.validation().count(IssueReason.INVALID_STATUS));
        assertTrue(result.qualityScore() < 1.0);
        assertTrue(result.qualityScore() > 0.5);
        assertEquals(result.qualityScore(), result.manifest().qualityScore(), EPS);
        assertEquals(2, result.edgeCount(), "Damage is contained to the bad token");
        String summary = Files.readString(result.publishedDir().resolve(ArtifactStore.VALIDATION_SUMMARY));
        assertTrue(summary.contains("invalid_status"));
    }

    @Test
    void testStrictModePublishesNothing() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("M", "a.py")
                .commit(2, "ann@example.com", 2000).change("M", "a.py").raw("Q");
        ArtifactStore store = new ArtifactStore(tempDir.resolve("out"));

        MalformedRecordException e = assertThrows(MalformedRecordException.class, () ->
                new CouplingPipeline(CouplingConfig.defaults().withValidationMode(ValidationMode.STRICT))
                        .run(log.source(), FileScope.of(config), store, "run1"));

        assertEquals(HistoryLog.oid(1), e.lastCommitOid().orElseThrow());
        assertTrue(listTempDir().isEmpty(), "Staging is discarded and nothing is published");
    }

    @Test
    void testCancellationDiscardsRun() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("M", "a.py")
                .commit(2, "ann@example.com", 2000).change("M", "a.py");
        AtomicInteger checks = new AtomicInteger();
        ArtifactStore store = new ArtifactStore(tempDir.resolve("out"));

        RunCancelledException e = assertThrows(RunCancelledException.class, () ->
                new CouplingPipeline(config).withCancellation(() -> checks.incrementAndGet() > 1)
                        .run(log.source(), FileScope.of(config), store, "run1"));

        assertEquals(HistoryLog.oid(1), e.lastCommitOid().orElseThrow());
        assertTrue(listTempDir().isEmpty());
    }

    @Test
    void testExportFailureKeepsPrefixWithoutPublishing() throws IOException {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("M", "a.py")
                .commit(2, "ann@example.com", 2000).change("M", "a.py");
        ArtifactStore store = new ArtifactStore(tempDir.resolve("out"));

        HistoryExportFailedException e = assertThrows(HistoryExportFailedException.class, () ->
                new CouplingPipeline(config).run(failingAtEnd(log), FileScope.of(config), store, "run1"));

        assertEquals(HistoryLog.oid(2), e.lastCommitOid().orElseThrow());
        assertFalse(Files.exists(store.target()));
        Path partial = tempDir.resolve(".out.partial-run1");
        assertTrue(Files.isRegularFile(partial.resolve(ArtifactStore.PARTIAL_MARKER)));
        assertFalse(Files.exists(partial.resolve(ArtifactStore.MANIFEST)));
        assertEquals(3, Files.readAllLines(partial.resolve(Table.COMMITS.fileName())).size(), "Header and two commits");
    }

    @Test
    void testUnchangedInputYieldsIdenticalTables() throws IOException {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "a.py").change("A", "lib/b.py")
                .commit(2, "bob@example.com", 2000).change("M", "a.py").change("M", "lib/b.py").change("A", "c.py")
                .commit(3, "ann@example.com", 3000).change("R090", "c.py", "lib/c.py").change("M", "a.py");

        ArtifactStore first = new ArtifactStore(tempDir.resolve("first"));
        ArtifactStore second = new ArtifactStore(tempDir.resolve("second"));
        RunResult one = new CouplingPipeline(config).run(log.source(), FileScope.of(config), first, "run1");
        RunResult two = new CouplingPipeline(config).run(log.source(), FileScope.of(config), second, "run2");

        for (Table<?> table : Table.ALL) {
            assertArrayEquals(Files.readAllBytes(first.target().resolve(table.fileName())),
                    Files.readAllBytes(second.target().resolve(table.fileName())), table.fileName());
        }
        assertEquals(one.manifest().tables(), two.manifest().tables());
        assertTrue(one.folderEdgeCount() > 0);
    }

    @Test
    void testReplaysRecordedLogFile() throws IOException {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000).change("A", "a.py").change("A", "b.py")
                .commit(2, "ann@example.com", 2000).change("D", "b.py").change("M", "a.py");
        Path logFile = tempDir.resolve("history.log");
        Files.write(logFile, String.join("\0", log.tokens()).getBytes(StandardCharsets.UTF_8));

        RunResult result = new CouplingPipeline(config).run(RecordedHistorySource.ofFile(logFile),
                FileScope.of(config), new ArtifactStore(tempDir.resolve("out")), "run1");

        ArtifactReader reader = ArtifactReader.open(result.publishedDir());
        FileRecord deleted = reader.lookup("b.py").orElseThrow();
        assertTrue(deleted.currentPath().isEmpty());
        assertEquals("b.py", deleted.latestPath());
        assertFalse(deleted.stats().alive());
        EdgeRow edge = reader.neighbours(reader.lookup("a.py").orElseThrow().fileId(), 5).get(0);
        assertEquals(deleted.fileId(), edge.dstFileId());
        assertEquals(2, edge.pairCount(), "The deleting commit still counts as a co-change");
        reader.verify();
    }

    @Test
    void testAnalyzesGitRepository() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        Path repo = Files.createDirectories(tempDir.resolve("repo"));
        Files.writeString(repo.resolve("a.py"), "print('a')\n".repeat(20));
        Files.writeString(repo.resolve("b.py"), "print('b')\n");
        git(repo, "init", "-q");
        git(repo, "add", "-A");
        git(repo, "commit", "-q", "-m", "first");
        Files.createDirectories(repo.resolve("pkg"));
        git(repo, "mv", "a.py", "pkg/a.py");
        Files.writeString(repo.resolve("b.py"), "print('b2')\n");
        git(repo, "add", "-A");
        git(repo, "commit", "-q", "-m", "move a");

        RunResult result = new CouplingPipeline(config).analyze(repo, tempDir.resolve("out"));

        assertEquals(2, result.commitCount());
        assertEquals(2, result.identityCount(), "The moved file keeps its identity");
        assertEquals(1.0, result.qualityScore(), EPS);
        assertNotNull(result.manifest().headCommit());
        assertEquals(result.manifest().headCommit(), result.manifest().lastCommit());

        ArtifactReader reader = ArtifactReader.open(result.publishedDir());
        FileRecord moved = reader.lookup("a.py").orElseThrow();
        assertEquals("pkg/a.py", moved.currentPath().orElseThrow());
        assertEquals(2, reader.neighbours(moved.fileId(), 1).get(0).pairCount());
    }

    private RunResult run(HistoryLog log, CouplingConfig runConfig) {
        return new CouplingPipeline(runConfig).run(log.source(), FileScope.of(runConfig),
                new ArtifactStore(tempDir.resolve("out")), "run1");
    }

    private List<Path> listTempDir() {
        try (Stream<Path> entries = Files.list(tempDir)) {
            return entries.toList();
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    private static HistorySource failingAtEnd(HistoryLog log) {
        RecordedHistorySource delegate = log.source();
        return new HistorySource() {
            @Override
            public InputStream open() {
                return delegate.open();
            }

            @Override
            public void awaitCompletion() {
                throw new HistoryExportFailedException("git log exited with 128: fatal: bad object", 128);
            }

            @Override
            public String describe() {
                return "failing";
            }

            @Override
            public void close() {
                delegate.close();
            }
        };
    }

    private static void git(Path repo, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(List.of("git", "-C", repo.toString(),
                "-c", "user.name=Test", "-c", "user.email=test@example.com", "-c", "commit.gpgsign=false"));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        process.getInputStream().readAllBytes();
        assertTrue(process.waitFor(30, TimeUnit.SECONDS));
        assertEquals(0, process.exitValue(), "git " + String.join(" ", args));
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
