package com.repo.coupling.git;

import com.repo.coupling.core.CouplingConfig;
import com.repo.coupling.core.HistoryExportFailedException;
import com.repo.coupling.core.RepositoryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs {@code git log} and exposes its NUL-separated output.
 * Commits come oldest first so identities can be resolved in commit order.
 */
public class GitLogSource implements HistorySource {

    private static final Logger LOG = LoggerFactory.getLogger(GitLogSource.class);

    private static final String PRETTY_FORMAT = String.join("%x00",
            "%x01LC-COMMIT%x01", "%H", "%P", "%an", "%ae", "%at", "%ct", "%s") + "%x00";

    private final Path repoRoot;
    private final CouplingConfig config;
    private final AtomicBoolean timedOut = new AtomicBoolean();
    private Process process;
    private File stderrFile;
    private CompletableFuture<Void> watchdog;

    public GitLogSource(Path repoRoot, CouplingConfig config) {
        this.repoRoot = repoRoot;
        this.config = config;
    }

    /**
     * Arguments of the export command, without the leading {@code git -C <repo>}.
     */
    List<String> logArguments() {
        List<String> args = new ArrayList<>(List.of(
                "log", "--name-status", "-z", "--no-color", "--date-order", "--reverse",
                "--find-renames=" + config.getFindRenamesThreshold() + "%"));
        if (config.isSkipMergeCommits()) {
            args.add("--no-merges");
        }
        if (config.isFirstParentOnly()) {
            args.add("--first-parent");
        }
        if (config.getSince() != null) {
            args.add("--since=" + config.getSince());
        }
        if (config.getUntil() != null) {
            args.add("--until=" + config.getUntil());
        }
        args.add("--pretty=format:" + PRETTY_FORMAT);
        if (config.isAllRefs()) {
            args.add("--all");
        } else {
            args.add(config.getRef());
        }
        args.add("--");
        return args;
    }

    @Override
    public InputStream open() {
        if (process != null) {
            throw new IllegalStateException("History already opened for " + repoRoot);
        }
        verifyRepository();

        List<String> command = new ArrayList<>(List.of("git", "-C", repoRoot.toString()));
        command.addAll(logArguments());
        LOG.info("Exporting history: {}", String.join(" ", command));

        try {
            stderrFile = File.createTempFile("coupling-git-", ".err");
            stderrFile.deleteOnExit();
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(repoRoot.toFile());
            builder.redirectError(stderrFile);
            process = builder.start();
        } catch (IOException e) {
            throw new HistoryExportFailedException("Could not start git log in " + repoRoot, e);
        }

        Duration timeout = config.getExportTimeout();
        Process running = process;
        watchdog = CompletableFuture.runAsync(() -> {
            if (running.isAlive()) {
                LOG.error("git log exceeded {} minutes, terminating", timeout.toMinutes());
                timedOut.set(true);
                running.destroyForcibly();
            }
        }, CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));

        return process.getInputStream();
    }

    private void verifyRepository() {
        if (!Files.isDirectory(repoRoot)) {
            throw new RepositoryUnavailableException("Not a directory: " + repoRoot);
        }
        try {
            Process check = new ProcessBuilder("git", "-C", repoRoot.toString(), "rev-parse", "--git-dir")
                    .redirectErrorStream(true)
                    .start();
            String output = readAll(check.getInputStream());
            if (!check.waitFor(1, TimeUnit.MINUTES)) {
                check.destroyForcibly();
                throw new RepositoryUnavailableException("git rev-parse timed out in " + repoRoot);
            }
            if (check.exitValue() != 0) {
                throw new RepositoryUnavailableException("Not a git repository: " + repoRoot + " (" + output.trim() + ")");
            }
        } catch (IOException e) {
            throw new RepositoryUnavailableException("Could not run git in " + repoRoot, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryUnavailableException("Interrupted while checking " + repoRoot, e);
        }
    }

    /**
     * Resolve the configured ref to a commit oid, for run bookkeeping.
     */
    @Override
    public Optional<String> headCommit() {
        try {
            Process revParse = new ProcessBuilder("git", "-C", repoRoot.toString(), "rev-parse", "--verify", "-q",
                    config.getRef() + "^{commit}").start();
            String output = readAll(revParse.getInputStream()).trim();
            if (revParse.waitFor(1, TimeUnit.MINUTES) && revParse.exitValue() == 0 && !output.isEmpty()) {
                return Optional.of(output);
            }
            return Optional.empty();
        } catch (IOException e) {
            LOG.warn("Could not resolve {}: {}", config.getRef(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void awaitCompletion() {
        if (process == null) {
            throw new IllegalStateException("History was never opened");
        }
        try {
            int exit = process.waitFor();
            watchdog.cancel(false);
            if (timedOut.get()) {
                throw new HistoryExportFailedException("git log timed out after "
                        + config.getExportTimeout().toMinutes() + " minutes", exit);
            }
            if (exit != 0) {
                throw new HistoryExportFailedException("git log exited with " + exit + ": " + stderrTail(), exit);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HistoryExportFailedException("Interrupted while waiting for git log", e);
        }
    }

    private String stderrTail() {
        try {
            String err = Files.readString(stderrFile.toPath(), StandardCharsets.UTF_8).trim();
            return err.length() > 500 ? err.substring(err.length() - 500) : err;
        } catch (IOException e) {
            return "<stderr unavailable: " + e.getMessage() + ">";
        }
    }

    @Override
    public String describe() {
        return repoRoot.toAbsolutePath().normalize().toString();
    }

    @Override
    public void close() {
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        if (process != null && process.isAlive()) {
            process.destroyForcibly();
        }
        if (stderrFile != null && !stderrFile.delete()) {
            LOG.debug("Could not delete {}", stderrFile);
        }
    }

    private static String readAll(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
