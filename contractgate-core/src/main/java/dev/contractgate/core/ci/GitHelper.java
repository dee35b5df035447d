package dev.contractgate.core.ci;

import dev.contractgate.core.exception.GitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the few git queries a CI run needs.
 */
public class GitHelper {

    private static final Logger logger = LoggerFactory.getLogger(GitHelper.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Path repoRoot;
    private final Duration timeout;

    public GitHelper(Path repoRoot) {
        this(repoRoot, DEFAULT_TIMEOUT);
    }

    public GitHelper(Path repoRoot, Duration timeout) {
        this.repoRoot = repoRoot;
        this.timeout = timeout;
    }

    /**
     * Files changed between the merge base of two refs and the head ref.
     */
    public List<String> getChangedFiles(String baseRef, String headRef) {
        String output = git("diff", "--name-only", baseRef + "..." + (headRef == null ? "HEAD" : headRef));
        List<String> files = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (!line.isBlank()) {
                files.add(line.trim());
            }
        }
        logger.debug("{} files changed between {} and {}", files.size(), baseRef, headRef);
        return files;
    }

    public String getMergeBase(String ref1, String ref2) {
        return git("merge-base", ref1, ref2 == null ? "HEAD" : ref2).trim();
    }

    public String getCurrentSha() {
        return git("rev-parse", "HEAD").trim();
    }

    public String getCurrentBranch() {
        return git("rev-parse", "--abbrev-ref", "HEAD").trim();
    }

    public boolean isGitRepo() {
        try {
            git("rev-parse", "--git-dir");
            return true;
        } catch (GitException e) {
            logger.debug("{} is not a git repository: {}", repoRoot, e.getMessage());
            return false;
        }
    }

    /**
     * @throws GitException when git cannot be started, exits non-zero or times out
     */
    private String git(String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(repoRoot.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new GitException("Cannot run git: " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitException("git " + String.join(" ", args) + " timed out after " + timeout.toSeconds() + "s");
            }
            String text = output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0) {
                throw new GitException("git " + String.join(" ", args) + " failed: " + text.strip());
            }
            return text;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new GitException("Interrupted while running git", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new GitException("Cannot read git output: " + e.getMessage(), e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("git output stream closed early: {}", e.getMessage());
            return "";
        }
    }
}
