package com.repo.coupling.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.repo.coupling.core.ArtifactWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Owns the published artifact directory of one repository.
 * <p>
 * Runs are written into a sibling staging directory and moved into place in one step
 * once the manifest is written, so readers see either the previous complete dataset or
 * the new one.
 */
public class ArtifactStore {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String MANIFEST = "manifest.json";
    public static final String VALIDATION_SUMMARY = "validation_summary.json";
    public static final String PARTIAL_MARKER = "partial.json";

    private final Path target;
    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper;

    public ArtifactStore(Path target) {
        this.target = target.toAbsolutePath().normalize();
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path target() {
        return target;
    }

    /**
     * Start a run in a fresh staging directory.
     */
    public ArtifactRun begin(String runId) {
        Path staging = sibling("staging", runId);
        try {
            Files.createDirectories(target.getParent());
            if (Files.exists(staging)) {
                deleteRecursively(staging);
            }
            Files.createDirectory(staging);
        } catch (IOException e) {
            throw new ArtifactWriteException("Could not create staging directory " + staging, e);
        }
        LOG.debug("Staging run {} in {}", runId, staging);
        return new ArtifactRun(this, runId, staging);
    }

    public boolean hasPublishedRun() {
        return Files.isRegularFile(target.resolve(MANIFEST));
    }

    Path sibling(String kind, String runId) {
        return target.resolveSibling("." + target.getFileName() + "." + kind + "-" + runId);
    }

    CsvMapper csvMapper() {
        return csvMapper;
    }

    ObjectMapper jsonMapper() {
        return jsonMapper;
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
