package com.repo.coupling.pipeline;

import com.repo.coupling.model.ValidationSummary;
import com.repo.coupling.store.RunManifest;

import java.nio.file.Path;

/**
 * A published run.
 */
public record RunResult(
        Path publishedDir,
        RunManifest manifest,
        ValidationSummary validation,
        long commitCount,
        int changesetCount,
        int identityCount,
        int edgeCount,
        int folderEdgeCount) {

    public double qualityScore() {
        return validation.qualityScore();
    }

    public String runId() {
        return manifest.runId();
    }
}
