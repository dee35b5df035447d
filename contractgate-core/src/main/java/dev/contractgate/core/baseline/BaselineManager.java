package dev.contractgate.core.baseline;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contractgate.core.ci.CIViolation;
import dev.contractgate.core.exception.BaselineException;
import dev.contractgate.core.util.AtomicFileWriter;
import dev.contractgate.core.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Loads, saves and compares the violation baseline file.
 * <p>
 * The file is JSON unless its name ends in {@code .yaml} or {@code .yml}.
 */
public class BaselineManager {

    private static final Logger logger = LoggerFactory.getLogger(BaselineManager.class);

    public static final String DEFAULT_PATH = ".contractgate/baseline.json";

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;

    public BaselineManager(Path path) {
        this(path, Clock.systemUTC());
    }

    public BaselineManager(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        String name = path.getFileName().toString();
        this.mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? Mappers.yaml() : Mappers.json();
    }

    /**
     * @return the baseline, empty when the file does not exist
     * @throws BaselineException when the file exists but cannot be read
     */
    public Optional<Baseline> load() {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            Baseline baseline = mapper.readValue(path.toFile(), Baseline.class);
            if (baseline == null) {
                throw new BaselineException("Failed to load baseline: " + path + " is empty");
            }
            return Optional.of(baseline);
        } catch (IOException e) {
            throw new BaselineException("Failed to load baseline: " + e.getMessage(), e);
        }
    }

    public void save(Baseline baseline) {
        try {
            AtomicFileWriter.write(path, mapper.writeValueAsString(baseline));
        } catch (IOException e) {
            throw new BaselineException("Failed to save baseline: " + e.getMessage(), e);
        }
        logger.info("Saved baseline with {} entries to {}", baseline.size(), path);
    }

    public Baseline createFromViolations(List<CIViolation> violations, String commitSha) {
        Instant now = clock.instant();
        Baseline baseline = Baseline.empty(commitSha, now);
        violations.forEach(v -> baseline.add(v, now));
        return baseline;
    }

    /**
     * Merge the current violations into the stored baseline, dropping entries no longer present.
     * The result is not saved.
     */
    public BaselineUpdate update(List<CIViolation> violations, String commitSha) {
        Optional<Baseline> existing = load();
        if (existing.isEmpty()) {
            Baseline created = createFromViolations(violations, commitSha);
            return new BaselineUpdate(created, created.size(), 0);
        }

        Instant now = clock.instant();
        Baseline baseline = existing.get();
        Set<String> current = new HashSet<>();
        int added = 0;
        for (CIViolation violation : violations) {
            current.add(violation.hash());
            if (baseline.add(violation, now)) {
                added++;
            }
        }
        List<String> stale = baseline.getEntries().keySet().stream().filter(h -> !current.contains(h)).toList();
        stale.forEach(h -> baseline.remove(h, now));
        baseline.setCommitSha(commitSha);
        baseline.setUpdatedAt(now);
        return new BaselineUpdate(baseline, added, stale.size());
    }

    /**
     * @throws BaselineException when there is no baseline to compare against
     */
    public BaselineComparison compare(List<CIViolation> violations) {
        Baseline baseline = load().orElseThrow(() ->
                new BaselineException("Baseline not found at " + path + ". Save a baseline first."));
        return BaselineComparison.compare(violations, baseline);
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    public Optional<BaselineStats> getStats() {
        return load().map(baseline -> {
            Map<String, Integer> byCheck = new TreeMap<>();
            Map<String, Integer> byFile = new TreeMap<>();
            for (BaselineEntry entry : baseline.getEntries().values()) {
                byCheck.merge(entry.checkId(), 1, Integer::sum);
                byFile.merge(entry.filePath(), 1, Integer::sum);
            }
            Instant oldest = baseline.getEntries().values().stream()
                    .map(BaselineEntry::firstSeen).min(Comparator.naturalOrder()).orElse(null);
            Instant newest = baseline.getEntries().values().stream()
                    .map(BaselineEntry::lastSeen).max(Comparator.naturalOrder()).orElse(null);
            return new BaselineStats(baseline.size(), baseline.getCreatedAt(), baseline.getUpdatedAt(),
                    baseline.getCommitSha(), byCheck, byFile, oldest, newest);
        });
    }

    public Path getPath() {
        return path;
    }
}
