package com.repo.coupling.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Completion marker of a published artifact set. Written last; its presence is what
 * makes a directory a complete dataset.
 *
 * @param tables row count and SHA-256 of every table, by table name
 */
public record RunManifest(
        int formatVersion,
        String runId,
        String repository,
        String headCommit,
        String firstCommit,
        String lastCommit,
        long commitCount,
        double qualityScore,
        String completedAt,
        Map<String, Object> config,
        Map<String, TableDigest> tables) {

    public static final int FORMAT_VERSION = 1;

    public record TableDigest(long rows, String sha256) {
    }

    public RunManifest withTables(Map<String, TableDigest> digests) {
        return new RunManifest(formatVersion, runId, repository, headCommit, firstCommit, lastCommit,
                commitCount, qualityScore, completedAt, config, new TreeMap<>(digests));
    }

    Map<String, Object> toMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("format_version", formatVersion);
        json.put("run_id", runId);
        json.put("repository", repository);
        json.put("head_commit", headCommit);
        json.put("first_commit", firstCommit);
        json.put("last_commit", lastCommit);
        json.put("commit_count", commitCount);
        json.put("quality_score", qualityScore);
        json.put("completed_at", completedAt);
        json.put("config", config);
        Map<String, Object> tableMap = new LinkedHashMap<>();
        tables.forEach((name, digest) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rows", digest.rows());
            entry.put("sha256", digest.sha256());
            tableMap.put(name, entry);
        });
        json.put("tables", tableMap);
        return json;
    }

    @SuppressWarnings("unchecked")
    static RunManifest fromMap(Map<String, Object> json) {
        Map<String, TableDigest> tables = new TreeMap<>();
        Map<String, Object> tableMap = (Map<String, Object>) json.getOrDefault("tables", Map.of());
        tableMap.forEach((name, value) -> {
            Map<String, Object> entry = (Map<String, Object>) value;
            tables.put(name, new TableDigest(((Number) entry.get("rows")).longValue(), (String) entry.get("sha256")));
        });
        return new RunManifest(
                ((Number) json.get("format_version")).intValue(),
                (String) json.get("run_id"),
                (String) json.get("repository"),
                (String) json.get("head_commit"),
                (String) json.get("first_commit"),
                (String) json.get("last_commit"),
                ((Number) json.getOrDefault("commit_count", 0)).longValue(),
                ((Number) json.getOrDefault("quality_score", 1.0)).doubleValue(),
                (String) json.get("completed_at"),
                (Map<String, Object>) json.getOrDefault("config", Map.of()),
                tables);
    }
}
