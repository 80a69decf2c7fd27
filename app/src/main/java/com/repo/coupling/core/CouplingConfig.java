package com.repo.coupling.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

/**
 * Configuration for a coupling analysis run.
 * Loaded from coupling.yaml in a config directory or uses sensible defaults.
 * One instance is built per run and handed to every stage.
 */
public class CouplingConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CouplingConfig.class);

    public static final String FILE_NAME = "coupling.yaml";

    // Changeset defaults
    private int maxChangesetSize = 50;
    private ChangesetMode changesetMode = ChangesetMode.BY_COMMIT;
    private double authorTimeHours = 24.0;

    // Edge defaults
    private int minCooccurrence = 3;
    private int topkEdges = 50;
    private CouplingMetric primaryMetric = CouplingMetric.WEIGHTED_JACCARD;
    private int folderDepth = 2;

    // Validation
    private ValidationMode validationMode = ValidationMode.SOFT;
    private int maxValidationIssues = 200;

    // File filters
    private int minLoc = 0;
    private long minFileSize = 0;
    private List<String> ignorePatterns = List.of();
    private Set<String> includeExtensions = Set.of();

    // History selection
    private String ref = "HEAD";
    private boolean allRefs = false;
    private String since = null;
    private String until = null;
    private boolean skipMergeCommits = true;
    private boolean firstParentOnly = false;
    private int findRenamesThreshold = 60;
    private Duration exportTimeout = Duration.ofMinutes(60);

    /**
     * Load configuration from YAML file or return defaults.
     */
    public static CouplingConfig load(Path configDir) {
        CouplingConfig config = new CouplingConfig();
        Path configFile = configDir.resolve(FILE_NAME);

        if (Files.exists(configFile)) {
            try (InputStream is = Files.newInputStream(configFile)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                if (data != null) {
                    config.parseYaml(data);
                }
                LOG.info("Loaded configuration from: {}", configFile);
            } catch (IOException e) {
                LOG.warn("Could not read config file, using defaults: {}", e.getMessage());
            }
        }
        return config;
    }

    /**
     * Default configuration.
     */
    public static CouplingConfig defaults() {
        return new CouplingConfig();
    }

    private void parseYaml(Map<String, Object> data) {
        maxChangesetSize = positive("max_changeset_size", getInt(data, "max_changeset_size", maxChangesetSize));
        if (data.containsKey("changeset_mode")) {
            changesetMode = ChangesetMode.fromKey(String.valueOf(data.get("changeset_mode")));
        }
        authorTimeHours = getDouble(data, "author_time_hours", authorTimeHours);
        if (authorTimeHours <= 0) {
            throw new IllegalArgumentException("author_time_hours must be positive: " + authorTimeHours);
        }

        minCooccurrence = positive("min_cooccurrence", getInt(data, "min_cooccurrence", minCooccurrence));
        topkEdges = positive("topk_edges", getInt(data, "topk_edges", topkEdges));
        if (data.containsKey("primary_metric")) {
            primaryMetric = CouplingMetric.fromKey(String.valueOf(data.get("primary_metric")));
        }
        folderDepth = positive("folder_depth", getInt(data, "folder_depth", folderDepth));

        if (data.containsKey("validation_mode")) {
            validationMode = ValidationMode.fromKey(String.valueOf(data.get("validation_mode")));
        }
        maxValidationIssues = positive("max_validation_issues",
                getInt(data, "max_validation_issues", maxValidationIssues));

        minLoc = getInt(data, "min_loc", minLoc);
        minFileSize = getLong(data, "min_file_size", minFileSize);

        if (data.containsKey("ignore_patterns")) {
            ignorePatterns = List.copyOf(stringList("ignore_patterns", data.get("ignore_patterns")));
        }
        if (data.containsKey("include_extensions")) {
            includeExtensions = normalizeExtensions(stringList("include_extensions", data.get("include_extensions")));
        }

        ref = getString(data, "ref", ref);
        allRefs = getBool(data, "all_refs", allRefs);
        since = getString(data, "since", since);
        until = getString(data, "until", until);
        skipMergeCommits = getBool(data, "skip_merge_commits", skipMergeCommits);
        firstParentOnly = getBool(data, "first_parent_only", firstParentOnly);
        findRenamesThreshold = getInt(data, "find_renames_threshold", findRenamesThreshold);
        if (findRenamesThreshold < 1 || findRenamesThreshold > 100) {
            throw new IllegalArgumentException("find_renames_threshold must be within 1..100: " + findRenamesThreshold);
        }
        exportTimeout = Duration.ofMinutes(positive("export_timeout_minutes",
                getInt(data, "export_timeout_minutes", (int) exportTimeout.toMinutes())));
    }

    private static int positive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return value;
    }

    private static Set<String> normalizeExtensions(Collection<String> exts) {
        Set<String> result = new LinkedHashSet<>();
        for (String ext : exts) {
            String lower = ext.trim().toLowerCase(Locale.ROOT);
            if (!lower.isEmpty()) {
                result.add(lower.startsWith(".") ? lower : "." + lower);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    private int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        return number(key, val).intValue();
    }

    private long getLong(Map<String, Object> map, String key, long defaultVal) {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        return number(key, val).longValue();
    }

    private double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        return number(key, val).doubleValue();
    }

    private boolean getBool(Map<String, Object> map, String key, boolean defaultVal) {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        if (val instanceof Boolean)
            return (Boolean) val;
        throw new IllegalArgumentException(key + " must be true or false: " + val);
    }

    private static Number number(String key, Object val) {
        if (val instanceof Number)
            return (Number) val;
        throw new IllegalArgumentException(key + " must be a number: " + val);
    }

    private static List<String> stringList(String key, Object val) {
        if (val == null)
            return List.of();
        if (!(val instanceof List))
            throw new IllegalArgumentException(key + " must be a list: " + val);
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) val) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    private String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        if (val == null)
            return defaultVal;
        String s = val.toString().trim();
        return s.isEmpty() ? defaultVal : s;
    }

    // === Getters ===

    public int getMaxChangesetSize() {
        return maxChangesetSize;
    }

    public ChangesetMode getChangesetMode() {
        return changesetMode;
    }

    public double getAuthorTimeHours() {
        return authorTimeHours;
    }

    /**
     * The grouping strategy derived from mode and window.
     */
    public ChangesetGrouping grouping() {
        return switch (changesetMode) {
            case BY_COMMIT -> ChangesetGrouping.byCommit();
            case BY_AUTHOR_TIME -> ChangesetGrouping.byAuthorTime(
                    Duration.ofSeconds(Math.round(authorTimeHours * 3600)));
        };
    }

    public int getMinCooccurrence() {
        return minCooccurrence;
    }

    public int getTopkEdges() {
        return topkEdges;
    }

    public CouplingMetric getPrimaryMetric() {
        return primaryMetric;
    }

    public int getFolderDepth() {
        return folderDepth;
    }

    public ValidationMode getValidationMode() {
        return validationMode;
    }

    public int getMaxValidationIssues() {
        return maxValidationIssues;
    }

    public int getMinLoc() {
        return minLoc;
    }

    public long getMinFileSize() {
        return minFileSize;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public Set<String> getIncludeExtensions() {
        return includeExtensions;
    }

    public String getRef() {
        return ref;
    }

    public boolean isAllRefs() {
        return allRefs;
    }

    public String getSince() {
        return since;
    }

    public String getUntil() {
        return until;
    }

    public boolean isSkipMergeCommits() {
        return skipMergeCommits;
    }

    public boolean isFirstParentOnly() {
        return firstParentOnly;
    }

    public int getFindRenamesThreshold() {
        return findRenamesThreshold;
    }

    public Duration getExportTimeout() {
        return exportTimeout;
    }

    /**
     * Flat snake_case snapshot, recorded in the run manifest.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("max_changeset_size", maxChangesetSize);
        map.put("changeset_mode", changesetMode.key());
        map.put("author_time_hours", authorTimeHours);
        map.put("min_cooccurrence", minCooccurrence);
        map.put("topk_edges", topkEdges);
        map.put("primary_metric", primaryMetric.key());
        map.put("folder_depth", folderDepth);
        map.put("validation_mode", validationMode.key());
        map.put("max_validation_issues", maxValidationIssues);
        map.put("min_loc", minLoc);
        map.put("min_file_size", minFileSize);
        map.put("ignore_patterns", ignorePatterns);
        map.put("include_extensions", new ArrayList<>(includeExtensions));
        map.put("ref", ref);
        map.put("all_refs", allRefs);
        map.put("since", since);
        map.put("until", until);
        map.put("skip_merge_commits", skipMergeCommits);
        map.put("first_parent_only", firstParentOnly);
        map.put("find_renames_threshold", findRenamesThreshold);
        map.put("export_timeout_minutes", exportTimeout.toMinutes());
        return map;
    }

    // === Programmatic overrides ===

    public CouplingConfig withMaxChangesetSize(int size) {
        this.maxChangesetSize = positive("max_changeset_size", size);
        return this;
    }

    public CouplingConfig withChangesetMode(ChangesetMode mode) {
        this.changesetMode = Objects.requireNonNull(mode);
        return this;
    }

    public CouplingConfig withAuthorTimeHours(double hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("author_time_hours must be positive: " + hours);
        }
        this.authorTimeHours = hours;
        return this;
    }

    public CouplingConfig withMinCooccurrence(int min) {
        this.minCooccurrence = positive("min_cooccurrence", min);
        return this;
    }

    public CouplingConfig withTopkEdges(int k) {
        this.topkEdges = positive("topk_edges", k);
        return this;
    }

    public CouplingConfig withPrimaryMetric(CouplingMetric metric) {
        this.primaryMetric = Objects.requireNonNull(metric);
        return this;
    }

    public CouplingConfig withFolderDepth(int depth) {
        this.folderDepth = positive("folder_depth", depth);
        return this;
    }

    public CouplingConfig withValidationMode(ValidationMode mode) {
        this.validationMode = Objects.requireNonNull(mode);
        return this;
    }

    public CouplingConfig withMaxValidationIssues(int max) {
        this.maxValidationIssues = positive("max_validation_issues", max);
        return this;
    }

    public CouplingConfig withMinLoc(int minLoc) {
        this.minLoc = minLoc;
        return this;
    }

    public CouplingConfig withMinFileSize(long minFileSize) {
        this.minFileSize = minFileSize;
        return this;
    }

    public CouplingConfig withIgnorePatterns(List<String> patterns) {
        this.ignorePatterns = List.copyOf(patterns);
        return this;
    }

    public CouplingConfig withIncludeExtensions(Collection<String> extensions) {
        this.includeExtensions = normalizeExtensions(extensions);
        return this;
    }

    public CouplingConfig withRef(String ref) {
        this.ref = Objects.requireNonNull(ref);
        return this;
    }

    public CouplingConfig withSince(String since) {
        this.since = since;
        return this;
    }

    public CouplingConfig withUntil(String until) {
        this.until = until;
        return this;
    }

    public CouplingConfig withSkipMergeCommits(boolean skip) {
        this.skipMergeCommits = skip;
        return this;
    }
}
