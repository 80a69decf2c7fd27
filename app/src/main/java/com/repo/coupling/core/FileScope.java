package com.repo.coupling.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Decides which repository paths take part in coupling.
 * Combines ignore globs, extension allow-list and working-tree size thresholds.
 */
public class FileScope {

    private static final Logger LOG = LoggerFactory.getLogger(FileScope.class);

    private final List<Pattern> ignored;
    private final Set<String> includeExtensions;
    private final Path workingTree;
    private final int minLoc;
    private final long minFileSize;
    private final Map<String, Boolean> sizeVerdicts = new HashMap<>();

    public FileScope(CouplingConfig config, Path workingTree) {
        this.ignored = config.getIgnorePatterns().stream().map(FileScope::compileGlob).toList();
        this.includeExtensions = config.getIncludeExtensions();
        this.workingTree = workingTree;
        this.minLoc = config.getMinLoc();
        this.minFileSize = config.getMinFileSize();
    }

    /**
     * Scope without working-tree checks.
     */
    public static FileScope of(CouplingConfig config) {
        return new FileScope(config, null);
    }

    public boolean isInScope(String path) {
        if (isIgnored(path)) {
            return false;
        }
        if (!includeExtensions.isEmpty() && !includeExtensions.contains(extension(path))) {
            return false;
        }
        return meetsSizeThresholds(path);
    }

    public boolean isIgnored(String path) {
        for (Pattern pattern : ignored) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean meetsSizeThresholds(String path) {
        if (workingTree == null || (minLoc <= 0 && minFileSize <= 0)) {
            return true;
        }
        return sizeVerdicts.computeIfAbsent(path, this::checkWorkingTreeFile);
    }

    private boolean checkWorkingTreeFile(String path) {
        Path file = workingTree.resolve(path);
        if (!Files.isRegularFile(file)) {
            // Deleted or never checked out: thresholds do not apply
            return true;
        }
        try {
            if (minFileSize > 0 && Files.size(file) < minFileSize) {
                LOG.debug("Excluding {}: below min_file_size", path);
                return false;
            }
            if (minLoc > 0 && countNonBlankLines(file) < minLoc) {
                LOG.debug("Excluding {}: below min_loc", path);
                return false;
            }
            return true;
        } catch (IOException e) {
            LOG.warn("Could not inspect {}, keeping it in scope: {}", path, e.getMessage());
            return true;
        }
    }

    private static long countNonBlankLines(Path file) throws IOException {
        // Latin-1 never fails to decode, so binary files count without error
        try (Stream<String> lines = Files.lines(file, StandardCharsets.ISO_8859_1)) {
            return lines.filter(line -> !line.trim().isEmpty()).count();
        }
    }

    static String extension(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash + 1 ? path.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Glob to anchored regex. {@code **} crosses directories, {@code *} and {@code ?} do not.
     */
    static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                boolean doubleStar = i + 1 < glob.length() && glob.charAt(i + 1) == '*';
                if (doubleStar) {
                    boolean slashFollows = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                    regex.append(slashFollows ? "(?:.*/)?" : ".*");
                    i += slashFollows ? 3 : 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
