package com.repo.coupling.parse;

import com.repo.coupling.core.MalformedRecordException;
import com.repo.coupling.core.ValidationMode;
import com.repo.coupling.git.CommitStream;
import com.repo.coupling.git.RawRecord;
import com.repo.coupling.model.ChangeEntry;
import com.repo.coupling.model.Commit;
import com.repo.coupling.model.IssueReason;
import com.repo.coupling.model.ValidationIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns one raw commit record into a {@link Commit} and its {@link ChangeEntry} list.
 * <p>
 * Explicit state machine over a single cursor. A malformed entry is reported and
 * dropped; the machine then waits for the next status token, and the record boundary
 * (the next commit marker) is a hard reset, so damage never leaks into later records.
 * Unusable metadata rejects the whole record.
 */
public class RecordParser {

    // Metadata fields, in the order of the log format
    private static final int OID = 0;
    private static final int PARENTS = 1;
    private static final int AUTHOR = 2;
    private static final int AUTHOR_EMAIL = 3;
    private static final int AUTHORED_TS = 4;
    private static final int COMMITTED_TS = 5;
    static final int METADATA_FIELDS = 7;

    private static final Pattern OBJECT_ID = Pattern.compile("^(?:[0-9a-f]{40}|[0-9a-f]{64})$");
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^-?\\d{1,18}$");
    private static final Pattern TIMESTAMP_LIKE = Pattern.compile("^\\d{9,10}$");

    private final ValidationMode mode;

    public RecordParser(ValidationMode mode) {
        this.mode = mode;
    }

    /**
     * @throws MalformedRecordException on the first issue when validation is strict
     */
    public ParseResult parse(RawRecord record) {
        return new Run(record).execute();
    }

    /**
     * Mutable state of one record's parse.
     */
    private final class Run {

        private final RawRecord record;
        private final TokenCursor cursor;
        private final List<String> metadata = new ArrayList<>(METADATA_FIELDS);
        private final List<ChangeEntry> entries = new ArrayList<>();
        private final List<ValidationIssue> issues = new ArrayList<>();
        private ParseState state = ParseState.EXPECT_METADATA;
        private Commit commit;
        private boolean rejected;
        private int tokenCount;
        private StatusToken pendingStatus;
        private String pendingOldPath;
        private boolean pendingSuspect;
        private boolean exhausted;

        Run(RawRecord record) {
            this.record = record;
            this.cursor = new TokenCursor(record.tokens(), record.firstTokenPosition());
        }

        ParseResult execute() {
            if (!record.hasMarker()) {
                return rejectPreamble();
            }
            while (cursor.hasNext() && !rejected) {
                String token = cursor.advance();
                if (!token.isBlank()) {
                    tokenCount++;
                }
                state = step(state, token);
            }
            if (rejected) {
                // The rest of a rejected record still counts towards the token total
                while (cursor.hasNext()) {
                    if (!cursor.advance().isBlank()) {
                        tokenCount++;
                    }
                }
            } else {
                atEndOfRecord();
            }
            return new ParseResult(rejected ? null : commit, rejected ? List.of() : entries, issues, tokenCount);
        }

        private ParseResult rejectPreamble() {
            while (cursor.hasNext()) {
                String token = cursor.advance();
                if (!token.isBlank()) {
                    tokenCount++;
                    report(IssueReason.MISSING_COMMIT_MARKER, token);
                }
            }
            return new ParseResult(null, List.of(), issues, tokenCount);
        }

        private ParseState step(ParseState current, String token) {
            return switch (current) {
                case EXPECT_METADATA -> onMetadata(token);
                case EXPECT_STATUS -> onStatus(token);
                case EXPECT_PATH -> onPath(token);
                case EXPECT_OLD_PATH -> onOldPath(token);
                case EXPECT_NEW_PATH -> onNewPath(token);
            };
        }

        private ParseState onMetadata(String token) {
            metadata.add(token);
            if (metadata.size() < METADATA_FIELDS) {
                return ParseState.EXPECT_METADATA;
            }
            commit = buildCommit(token);
            if (commit == null) {
                rejected = true;
            }
            return ParseState.EXPECT_STATUS;
        }

        private Commit buildCommit(String lastToken) {
            String oid = metadata.get(OID).trim();
            if (!OBJECT_ID.matcher(oid).matches()) {
                reportAt(OID, null, IssueReason.INVALID_COMMIT_OID);
                return null;
            }
            String parents = metadata.get(PARENTS).trim();
            for (int field : new int[]{AUTHORED_TS, COMMITTED_TS}) {
                if (!EPOCH_SECONDS.matcher(metadata.get(field).trim()).matches()) {
                    reportAt(field, oid, IssueReason.INVALID_TIMESTAMP);
                    return null;
                }
            }
            int parentCount = parents.isEmpty() ? 0 : parents.split("\\s+").length;
            return new Commit(oid, metadata.get(AUTHOR), metadata.get(AUTHOR_EMAIL),
                    Long.parseLong(metadata.get(AUTHORED_TS).trim()), Long.parseLong(metadata.get(COMMITTED_TS).trim()),
                    CommitStream.stripNewlines(lastToken), parentCount);
        }

        private ParseState onStatus(String token) {
            String candidate = CommitStream.stripNewlines(token);
            if (candidate.isEmpty()) {
                return ParseState.EXPECT_STATUS;
            }
            Optional<StatusToken> status = StatusToken.parse(candidate);
            if (status.isEmpty()) {
                report(IssueReason.INVALID_STATUS, token);
                // Skip until something that is a status
                return ParseState.EXPECT_STATUS;
            }
            return beginEntry(status.get());
        }

        private ParseState beginEntry(StatusToken status) {
            pendingStatus = status;
            pendingOldPath = null;
            pendingSuspect = false;
            return status.status().hasSourcePath() ? ParseState.EXPECT_OLD_PATH : ParseState.EXPECT_PATH;
        }

        private ParseState onPath(String token) {
            if (!acceptPath(token)) {
                return recoverFrom(token);
            }
            entries.add(ChangeEntry.single(commit.oid(), pendingStatus.status(), token, pendingSuspect));
            return clearPending();
        }

        private ParseState onOldPath(String token) {
            if (!acceptPath(token)) {
                return recoverFrom(token);
            }
            pendingOldPath = token;
            return ParseState.EXPECT_NEW_PATH;
        }

        private ParseState onNewPath(String token) {
            boolean oldSuspect = pendingSuspect;
            if (!acceptPath(token)) {
                return recoverFrom(token);
            }
            entries.add(ChangeEntry.withSource(commit.oid(), pendingStatus.status(), pendingStatus.score(),
                    pendingOldPath, token, oldSuspect || pendingSuspect));
            return clearPending();
        }

        /**
         * Syntactic check plus borderline heuristics. Permissive mode keeps borderline
         * paths and tags the entry instead of rejecting it. A status token is never a
         * path in any mode: it starts the next entry.
         */
        private boolean acceptPath(String token) {
            if (token.isEmpty()) {
                report(IssueReason.MISSING_PATH, token);
                return false;
            }
            if (StatusToken.looksLikeStatus(CommitStream.stripNewlines(token))) {
                report(IssueReason.INVALID_PATH, token);
                return false;
            }
            if (isBorderlinePath(token)) {
                if (mode == ValidationMode.PERMISSIVE) {
                    pendingSuspect = true;
                    return true;
                }
                report(IssueReason.INVALID_PATH, token);
                return false;
            }
            return true;
        }

        /**
         * The pending entry is dropped. A status token where a path was expected starts
         * the next entry instead of being lost.
         */
        private ParseState recoverFrom(String token) {
            clearPending();
            Optional<StatusToken> status = StatusToken.parse(CommitStream.stripNewlines(token));
            return status.map(this::beginEntry).orElse(ParseState.EXPECT_STATUS);
        }

        private ParseState clearPending() {
            pendingStatus = null;
            pendingOldPath = null;
            pendingSuspect = false;
            return ParseState.EXPECT_STATUS;
        }

        private void atEndOfRecord() {
            exhausted = true;
            switch (state) {
                case EXPECT_METADATA -> {
                    report(IssueReason.TRUNCATED_METADATA,
                            metadata.isEmpty() ? "" : metadata.get(metadata.size() - 1));
                    rejected = true;
                }
                case EXPECT_PATH, EXPECT_OLD_PATH, EXPECT_NEW_PATH -> {
                    String pending = pendingOldPath != null ? pendingOldPath : renderStatus(pendingStatus);
                    report(IssueReason.INCOMPLETE_CHANGE, pending);
                    clearPending();
                }
                case EXPECT_STATUS -> {
                    // Clean end
                }
            }
        }

        private void report(IssueReason reason, String token) {
            report(commit != null ? commit.oid() : null, reason, token);
        }

        private void report(String commitOid, IssueReason reason, String token) {
            raise(new ValidationIssue(commitOid, TokenCursor.printable(token),
                    exhausted ? cursor.endPosition() : cursor.position(), cursor.context(), reason));
        }

        /**
         * Report a metadata field. Metadata always starts the record, so the field index
         * is also the token index.
         */
        private void reportAt(int field, String commitOid, IssueReason reason) {
            raise(new ValidationIssue(commitOid, TokenCursor.printable(metadata.get(field)),
                    cursor.positionOf(field), cursor.contextAt(field), reason));
        }

        private void raise(ValidationIssue issue) {
            issues.add(issue);
            if (mode == ValidationMode.STRICT) {
                throw new MalformedRecordException(issue);
            }
        }
    }

    private static String renderStatus(StatusToken status) {
        if (status == null) {
            return "";
        }
        return status.score() >= 0
                ? status.status().code() + String.format("%03d", status.score())
                : String.valueOf(status.status().code());
    }

    /**
     * Tokens that are far more likely to be misaligned metadata than a real path.
     * Status tokens are handled before this check.
     */
    static boolean isBorderlinePath(String path) {
        if (OBJECT_ID.matcher(path).matches() || TIMESTAMP_LIKE.matcher(path).matches()) {
            return true;
        }
        if (path.contains("@") && !path.contains("/")) {
            return true;
        }
        return path.indexOf('\u0001') >= 0;
    }
}
