package com.repo.coupling.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Row layouts of the artifact tables. Column order is part of the format.
 */
public final class Rows {

    private Rows() {
    }

    @JsonPropertyOrder({"commit_oid", "author", "author_email", "authored_ts", "committer_ts", "parent_count",
            "subject"})
    public record CommitRow(
            @JsonProperty("commit_oid") String commitOid,
            @JsonProperty("author") String author,
            @JsonProperty("author_email") String authorEmail,
            @JsonProperty("authored_ts") long authoredTs,
            @JsonProperty("committer_ts") long committerTs,
            @JsonProperty("parent_count") int parentCount,
            @JsonProperty("subject") String subject) {
    }

    @JsonPropertyOrder({"commit_oid", "file_id", "status", "similarity", "path", "old_path", "in_scope", "suspect"})
    public record ChangeRow(
            @JsonProperty("commit_oid") String commitOid,
            @JsonProperty("file_id") int fileId,
            @JsonProperty("status") String status,
            @JsonProperty("similarity") int similarity,
            @JsonProperty("path") String path,
            @JsonProperty("old_path") String oldPath,
            @JsonProperty("in_scope") boolean inScope,
            @JsonProperty("suspect") boolean suspect) {
    }

    /**
     * File ids and commit oids are joined with {@value #LIST_SEPARATOR}.
     */
    @JsonPropertyOrder({"changeset_key", "size", "excluded_from_coupling", "author_email", "start_ts", "end_ts",
            "file_ids", "commit_oids"})
    public record ChangesetRow(
            @JsonProperty("changeset_key") String changesetKey,
            @JsonProperty("size") int size,
            @JsonProperty("excluded_from_coupling") boolean excludedFromCoupling,
            @JsonProperty("author_email") String authorEmail,
            @JsonProperty("start_ts") long startTs,
            @JsonProperty("end_ts") long endTs,
            @JsonProperty("file_ids") String fileIds,
            @JsonProperty("commit_oids") String commitOids) {

        public static final String LIST_SEPARATOR = ";";
    }

    @JsonPropertyOrder({"file_id", "path", "alive", "commit_count", "changeset_count", "coupling_total",
            "weighted_total", "author_count", "first_commit_ts", "last_commit_ts"})
    public record FileStatsRow(
            @JsonProperty("file_id") int fileId,
            @JsonProperty("path") String path,
            @JsonProperty("alive") boolean alive,
            @JsonProperty("commit_count") int commitCount,
            @JsonProperty("changeset_count") int changesetCount,
            @JsonProperty("coupling_total") int couplingTotal,
            @JsonProperty("weighted_total") double weightedTotal,
            @JsonProperty("author_count") int authorCount,
            @JsonProperty("first_commit_ts") long firstCommitTs,
            @JsonProperty("last_commit_ts") long lastCommitTs) {
    }

    /**
     * {@code valid_to_commit} is empty while the interval is open.
     */
    @JsonPropertyOrder({"file_id", "seq", "path", "valid_from_commit", "valid_to_commit"})
    public record LineageRow(
            @JsonProperty("file_id") int fileId,
            @JsonProperty("seq") int seq,
            @JsonProperty("path") String path,
            @JsonProperty("valid_from_commit") String validFromCommit,
            @JsonProperty("valid_to_commit") String validToCommit) {
    }

    @JsonPropertyOrder({"src_file_id", "dst_file_id", "rank", "src_path", "dst_path", "pair_count",
            "weighted_pair_count", "jaccard", "weighted_jaccard", "p_dst_given_src", "p_src_given_dst"})
    public record EdgeRow(
            @JsonProperty("src_file_id") int srcFileId,
            @JsonProperty("dst_file_id") int dstFileId,
            @JsonProperty("rank") int rank,
            @JsonProperty("src_path") String srcPath,
            @JsonProperty("dst_path") String dstPath,
            @JsonProperty("pair_count") int pairCount,
            @JsonProperty("weighted_pair_count") double weightedPairCount,
            @JsonProperty("jaccard") double jaccard,
            @JsonProperty("weighted_jaccard") double weightedJaccard,
            @JsonProperty("p_dst_given_src") double pDstGivenSrc,
            @JsonProperty("p_src_given_dst") double pSrcGivenDst) {
    }

    @JsonPropertyOrder({"src_folder", "dst_folder", "depth", "file_pair_count", "pair_count", "weighted_pair_count",
            "weight"})
    public record FolderEdgeRow(
            @JsonProperty("src_folder") String srcFolder,
            @JsonProperty("dst_folder") String dstFolder,
            @JsonProperty("depth") int depth,
            @JsonProperty("file_pair_count") int filePairCount,
            @JsonProperty("pair_count") long pairCount,
            @JsonProperty("weighted_pair_count") double weightedPairCount,
            @JsonProperty("weight") double weight) {
    }

    @JsonPropertyOrder({"path", "file_id", "current"})
    public record PathIndexRow(
            @JsonProperty("path") String path,
            @JsonProperty("file_id") int fileId,
            @JsonProperty("current") boolean current) {
    }
}
