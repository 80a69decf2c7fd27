package com.repo.coupling.parse;

import com.repo.coupling.core.MalformedRecordException;
import com.repo.coupling.core.ValidationMode;
import com.repo.coupling.git.CommitStream;
import com.repo.coupling.git.HistoryLog;
import com.repo.coupling.git.HistorySource;
import com.repo.coupling.git.RawRecord;
import com.repo.coupling.model.ChangeEntry;
import com.repo.coupling.model.ChangeStatus;
import com.repo.coupling.model.Commit;
import com.repo.coupling.model.IssueReason;
import com.repo.coupling.model.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordParserTest {

    @Test
    void testParsesCommitAndEntries() {
        HistoryLog log = new HistoryLog()
                .commit(HistoryLog.oid(1), HistoryLog.oid(7) + " " + HistoryLog.oid(8), "ann@example.com", 1700000000L, "Add parser")
                .change("M", "src/a.py")
                .change("R087", "old/b.py", "new/b.py")
                .change("C075", "c.py", "c_copy.py")
                .change("D", "gone.py");

        ParseResult result = parseAll(log, ValidationMode.SOFT).get(0);

        Commit commit = result.commit();
        assertEquals(HistoryLog.oid(1), commit.oid());
        assertEquals("ann", commit.author());
        assertEquals("ann@example.com", commit.authorEmail());
        assertEquals(1700000000L, commit.committerTs());
        assertEquals("Add parser", commit.subject());
        assertEquals(2, commit.parentCount());
        assertTrue(commit.isMerge());

        List<ChangeEntry> entries = result.entries();
        assertEquals(4, entries.size());
        assertEquals(ChangeStatus.MODIFIED, entries.get(0).status());
        assertEquals("src/a.py", entries.get(0).newPath());

        ChangeEntry rename = entries.get(1);
        assertTrue(rename.isRename());
        assertEquals(87, rename.similarity());
        assertEquals("old/b.py", rename.oldPath());
        assertEquals("new/b.py", rename.newPath());

        assertEquals(ChangeStatus.COPIED, entries.get(2).status());
        assertEquals("c.py", entries.get(2).oldPath());
        assertEquals(ChangeStatus.DELETED, entries.get(3).status());
        assertTrue(result.issues().isEmpty());
        assertEquals(17, result.tokenCount(), "Seven metadata tokens plus ten change tokens");
    }

    @Test
    void testInvalidStatusResynchronizes() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", "a.py")
                .raw("Q", "junk.py")
                .change("A", "b.py");

        ParseResult result = parseAll(log, ValidationMode.SOFT).get(0);

        assertEquals(List.of("a.py", "b.py"), paths(result));
        assertEquals(2, result.issues().size());
        assertTrue(result.issues().stream().allMatch(i -> i.reason() == IssueReason.INVALID_STATUS));
    }

    @Test
    void testIssueCarriesPositionAndContext() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", "a.py")
                .raw("Q");

        ValidationIssue issue = parseAll(log, ValidationMode.SOFT).get(0).issues().get(0);

        assertEquals(HistoryLog.oid(1), issue.commitOid());
        assertEquals("Q", issue.rawToken());
        assertEquals(10, issue.cursorPosition(), "Marker is token 0, the bad status token 10");
        assertTrue(issue.surroundingContext().contains("[Q]"), issue.surroundingContext());
        assertTrue(issue.surroundingContext().contains("a.py"));
    }

    @Test
    void testBorderlinePathRejectedInSoftMode() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", HistoryLog.oid(99))
                .change("M", "1700000000")
                .change("M", "someone@example.com")
                .change("A", "ok.py");

        ParseResult result = parseAll(log, ValidationMode.SOFT).get(0);

        assertEquals(List.of("ok.py"), paths(result));
        assertEquals(3, result.issues().size());
        assertTrue(result.issues().stream().allMatch(i -> i.reason() == IssueReason.INVALID_PATH));
    }

    @Test
    void testBorderlinePathTaggedInPermissiveMode() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", "1700000000")
                .change("A", "ok.py");

        ParseResult result = parseAll(log, ValidationMode.PERMISSIVE).get(0);

        assertEquals(List.of("1700000000", "ok.py"), paths(result));
        assertTrue(result.entries().get(0).suspect());
        assertFalse(result.entries().get(1).suspect());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void testStatusInPathPositionStartsNextEntry() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .raw("\nM")
                .change("A", "x.py");

        ParseResult result = parseAll(log, ValidationMode.SOFT).get(0);

        assertEquals(1, result.entries().size());
        assertEquals(ChangeStatus.ADDED, result.entries().get(0).status());
        assertEquals("x.py", result.entries().get(0).newPath());
        assertEquals(IssueReason.INVALID_PATH, result.issues().get(0).reason());
    }

    @Test
    void testStatusInPathPositionStartsNextEntryInPermissiveMode() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .raw("\nM")
                .change("A", "x.py")
                .change("R090", "C075", "y.py")
                .change("M", "z.py");

        ParseResult result = parseAll(log, ValidationMode.PERMISSIVE).get(0);

        assertEquals(List.of("x.py", "z.py"), paths(result));
        assertEquals(ChangeStatus.ADDED, result.entries().get(0).status());
        assertTrue(result.entries().stream().noneMatch(ChangeEntry::suspect));
        assertEquals(List.of("A", "C075", "M"), result.issues().stream().map(ValidationIssue::rawToken).toList());
        assertTrue(result.issues().stream().allMatch(i -> i.reason() == IssueReason.INVALID_PATH));
    }

    @Test
    void testMissingPath() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", "")
                .change("M", "a.py");

        ParseResult result = parseAll(log, ValidationMode.SOFT).get(0);

        assertEquals(List.of("a.py"), paths(result));
        assertEquals(IssueReason.MISSING_PATH, result.issues().get(0).reason());
    }

    @Test
    void testIncompleteChangeDoesNotLeakIntoNextRecord() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", "a.py")
                .raw("R100", "old.py")
                .commit(2, "ann@example.com", 2000)
                .change("M", "b.py");

        List<ParseResult> results = parseAll(log, ValidationMode.SOFT);

        assertEquals(List.of("a.py"), paths(results.get(0)));
        assertEquals(IssueReason.INCOMPLETE_CHANGE, results.get(0).issues().get(0).reason());
        assertEquals(List.of("b.py"), paths(results.get(1)));
        assertTrue(results.get(1).issues().isEmpty());
    }

    @Test
    void testTruncatedMetadataRejectsRecord() {
        HistoryLog log = new HistoryLog()
                .raw(HistorySource.COMMIT_MARKER, HistoryLog.oid(1), "")
                .commit(2, "ann@example.com", 2000)
                .change("A", "b.py");

        List<ParseResult> results = parseAll(log, ValidationMode.SOFT);

        assertTrue(results.get(0).isRejected());
        assertEquals(IssueReason.TRUNCATED_METADATA, results.get(0).issues().get(0).reason());
        assertFalse(results.get(1).isRejected());
    }

    @Test
    void testInvalidOidRejectsRecord() {
        HistoryLog log = new HistoryLog()
                .commit("not-an-oid", "", "ann@example.com", 1000, "broken")
                .change("M", "a.py")
                .commit(2, "ann@example.com", 2000)
                .change("M", "a.py");

        List<ParseResult> results = parseAll(log, ValidationMode.SOFT);

        assertTrue(results.get(0).isRejected());
        assertTrue(results.get(0).entries().isEmpty());
        assertEquals(IssueReason.INVALID_COMMIT_OID, results.get(0).issues().get(0).reason());
        assertEquals(8, results.get(0).tokenCount(), "Tokens of a rejected record still count, blank ones do not");
        assertEquals(1, results.get(0).issues().get(0).cursorPosition(), "The oid follows the marker");
        assertEquals(HistoryLog.oid(2), results.get(1).commit().oid());
    }

    @Test
    void testInvalidTimestamp() {
        HistoryLog log = new HistoryLog()
                .raw(HistorySource.COMMIT_MARKER, HistoryLog.oid(1), "", "ann", "ann@example.com",
                        "yesterday", "1000", "subject");

        ParseResult result = parseAll(log, ValidationMode.SOFT).get(0);

        assertTrue(result.isRejected());
        assertEquals(IssueReason.INVALID_TIMESTAMP, result.issues().get(0).reason());
        assertEquals(HistoryLog.oid(1), result.issues().get(0).commitOid());
    }

    @Test
    void testPreambleWithoutMarker() {
        HistoryLog log = new HistoryLog().raw("garbage", "", "more")
                .commit(1, "ann@example.com", 1000).change("A", "a.py");

        List<ParseResult> results = parseAll(log, ValidationMode.SOFT);

        assertTrue(results.get(0).isRejected());
        assertEquals(2, results.get(0).issues().size());
        assertEquals(IssueReason.MISSING_COMMIT_MARKER, results.get(0).issues().get(0).reason());
        assertFalse(results.get(1).isRejected());
    }

    @Test
    void testStrictModeFailsOnFirstIssue() {
        HistoryLog log = new HistoryLog()
                .commit(1, "ann@example.com", 1000)
                .change("M", "a.py")
                .raw("Q");

        MalformedRecordException e = assertThrows(MalformedRecordException.class,
                () -> parseAll(log, ValidationMode.STRICT));
        assertEquals(IssueReason.INVALID_STATUS, e.issue().reason());
        assertTrue(e.getMessage().contains("invalid_status"));
    }

    @Test
    void testRenameWithoutScoreIsInvalid() {
        assertTrue(StatusToken.parse("R").isEmpty());
        assertEquals(100, StatusToken.parse("R100").orElseThrow().score());
        assertTrue(StatusToken.parse("R101").isEmpty());
        assertEquals(-1, StatusToken.parse("M").orElseThrow().score());
        assertTrue(StatusToken.parse("MM").isEmpty());
    }

    private static List<ParseResult> parseAll(HistoryLog log, ValidationMode mode) {
        RecordParser parser = new RecordParser(mode);
        List<ParseResult> results = new ArrayList<>();
        for (RawRecord record : new CommitStream(log.source())) {
            results.add(parser.parse(record));
        }
        return results;
    }

    private static List<String> paths(ParseResult result) {
        return result.entries().stream().map(ChangeEntry::newPath).toList();
    }
}
