package dev.contractgate.core.check;

import dev.contractgate.core.contract.PathScope;
import dev.contractgate.core.util.GlobMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * The candidate files of one run, relative to the repository root.
 * <p>
 * Either every file under the root (full scan) or an explicit list (incremental and PR runs).
 * Paths under the global exclude directories never appear.
 */
public final class FileIndex {

    private static final Logger logger = LoggerFactory.getLogger(FileIndex.class);

    public static final List<String> GLOBAL_EXCLUDES = List.of(
            ".git/**", "**/.git/**", "node_modules/**", "**/node_modules/**", "**/__pycache__/**",
            ".venv/**", "venv/**", "target/**", "build/**", ".contractgate/**", "**/*.pyc");

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", "node_modules", "__pycache__", ".venv", "venv", ".contractgate");

    private final Path root;
    private final List<String> files;
    private final boolean fullScan;

    private FileIndex(Path root, List<String> files, boolean fullScan) {
        this.root = root;
        this.files = files;
        this.fullScan = fullScan;
    }

    /**
     * Index every file under the root.
     */
    public static FileIndex scan(Path root) {
        List<String> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && SKIPPED_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String relative = GlobMatcher.normalize(root.relativize(file).toString());
                    if (!GlobMatcher.matchesAny(GLOBAL_EXCLUDES, relative)) {
                        found.add(relative);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.warn("Cannot read {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
        Collections.sort(found);
        logger.debug("Indexed {} files under {}", found.size(), root);
        return new FileIndex(root, List.copyOf(found), true);
    }

    /**
     * Index an explicit candidate list; entries that no longer exist are dropped.
     */
    public static FileIndex of(Path root, List<String> candidates) {
        List<String> kept = candidates.stream()
                .map(GlobMatcher::normalize)
                .filter(p -> !GlobMatcher.matchesAny(GLOBAL_EXCLUDES, p))
                .filter(p -> Files.isRegularFile(root.resolve(p)))
                .distinct()
                .sorted()
                .toList();
        return new FileIndex(root, kept, false);
    }

    /**
     * Files within a check's scope.
     */
    public List<String> select(PathScope scope) {
        return files.stream().filter(scope::includes).toList();
    }

    public Path root() {
        return root;
    }

    public List<String> files() {
        return files;
    }

    public boolean isFullScan() {
        return fullScan;
    }
}
