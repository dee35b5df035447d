package dev.contractgate.core.ci;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contractgate.core.util.AtomicFileWriter;
import dev.contractgate.core.util.Hashing;
import dev.contractgate.core.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File cache of per-check outcomes keyed by check id and the content of the checked files.
 * <p>
 * An entry keeps the failing results and the number of passing ones.
 * <p>
 * Entries older than the TTL are treated as misses and deleted. No locking: one run at a time.
 */
public class CheckCache {

    private static final Logger logger = LoggerFactory.getLogger(CheckCache.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper json = Mappers.json();

    public CheckCache(Path directory, Duration ttl) {
        this(directory, ttl, Clock.systemUTC());
    }

    public CheckCache(Path directory, Duration ttl, Clock clock) {
        this.directory = directory;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Cache key over the check id and the sorted {@code path:sha256[:8]} of every existing file.
     */
    public static String key(String checkId, Path repoRoot, Collection<String> files) {
        List<String> parts = new ArrayList<>();
        for (String file : files.stream().sorted().toList()) {
            Path path = repoRoot.resolve(file);
            if (Files.isRegularFile(path)) {
                try {
                    parts.add(file + ":" + Hashing.sha256Hex(Files.readAllBytes(path)).substring(0, 8));
                } catch (IOException e) {
                    logger.debug("Cannot hash {} for cache key: {}", file, e.getMessage());
                }
            }
        }
        return Hashing.shortSha256(checkId + ":" + String.join("|", parts), 16);
    }

    public Optional<CachedResult> get(String key) {
        Path file = fileFor(key);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            CacheEntry entry = json.readValue(file.toFile(), CacheEntry.class);
            if (isExpired(entry)) {
                Files.deleteIfExists(file);
                return Optional.empty();
            }
            List<CIViolation> violations = entry.violations() == null ? List.of() : entry.violations();
            int passed = entry.passed() != null ? entry.passed() : violations.isEmpty() ? 1 : 0;
            return Optional.of(new CachedResult(violations, passed));
        } catch (IOException e) {
            logger.warn("Ignoring unreadable cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String key, List<CIViolation> violations, int passed) {
        try {
            AtomicFileWriter.write(fileFor(key),
                    json.writeValueAsString(new CacheEntry(clock.instant(), violations, passed)));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize cache entry " + key, e);
        }
    }

    /**
     * @return the number of entries removed
     */
    public int clear() {
        int count = 0;
        for (Path file : entries()) {
            if (delete(file)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Remove expired and unreadable entries.
     *
     * @return the number of entries removed
     */
    public int pruneExpired() {
        int count = 0;
        for (Path file : entries()) {
            boolean remove;
            try {
                remove = isExpired(json.readValue(file.toFile(), CacheEntry.class));
            } catch (IOException e) {
                logger.debug("Removing unreadable cache entry {}: {}", file, e.getMessage());
                remove = true;
            }
            if (remove && delete(file)) {
                count++;
            }
        }
        return count;
    }

    public Path getDirectory() {
        return directory;
    }

    private boolean isExpired(CacheEntry entry) {
        return entry.cachedAt() == null || Duration.between(entry.cachedAt(), clock.instant()).compareTo(ttl) > 0;
    }

    private List<Path> entries() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX)).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }

    private static boolean delete(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Cannot delete cache entry {}: {}", file, e.getMessage());
            return false;
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(key + SUFFIX);
    }

    /**
     * Cached outcome of one check.
     *
     * @param violations failing results
     * @param passed number of passing results
     */
    public record CachedResult(List<CIViolation> violations, int passed) {
    }

    // entries written before the pass count was stored hold only violations
    record CacheEntry(Instant cachedAt, List<CIViolation> violations, Integer passed) {
    }
}
