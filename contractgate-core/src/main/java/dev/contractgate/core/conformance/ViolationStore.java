package dev.contractgate.core.conformance;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.contractgate.core.util.AtomicFileWriter;
import dev.contractgate.core.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File-per-violation store: {@code violations/V-xxxxxxxxxxxx.yaml}.
 * <p>
 * Single writer at a time; files are replaced atomically.
 */
public class ViolationStore {

    private static final Logger logger = LoggerFactory.getLogger(ViolationStore.class);

    private static final String SUFFIX = ".yaml";

    /**
     * Most severe first, then file and line.
     */
    public static final Comparator<Violation> SEVERITY_ORDER = Comparator
            .comparingInt((Violation v) -> -v.getSeverity().weight())
            .thenComparing(Violation::getFile, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Violation::getLine, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Violation::getId);

    private final Path directory;
    private final ObjectMapper yaml = Mappers.yaml();

    public ViolationStore(Path directory) {
        this.directory = directory;
    }

    public Optional<Violation> get(String id) {
        Path file = fileFor(id);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.ofNullable(read(file));
    }

    /**
     * Every readable violation; unreadable files are skipped with a warning.
     */
    public List<Violation> loadAll() {
        if (!Files.isDirectory(directory)) {
            return new ArrayList<>();
        }
        List<Violation> violations = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().startsWith(ViolationIds.PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted()
                    .forEach(p -> {
                        Violation violation = read(p);
                        if (violation != null) {
                            violations.add(violation);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
        return violations;
    }

    public void save(Violation violation) {
        try {
            AtomicFileWriter.write(fileFor(violation.getId()), yaml.writeValueAsString(violation));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize violation " + violation.getId(), e);
        }
    }

    public boolean delete(String id) {
        try {
            return Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete violation " + id, e);
        }
    }

    public List<Violation> findByContract(String contractId) {
        return loadAll().stream().filter(v -> contractId.equals(v.getContractId())).toList();
    }

    public List<Violation> findByStatus(ViolationStatus status) {
        return loadAll().stream().filter(v -> v.getStatus() == status).toList();
    }

    public Map<ViolationStatus, Integer> countByStatus() {
        Map<ViolationStatus, Integer> counts = new EnumMap<>(ViolationStatus.class);
        for (ViolationStatus status : ViolationStatus.values()) {
            counts.put(status, 0);
        }
        loadAll().forEach(v -> counts.merge(v.getStatus(), 1, Integer::sum));
        return counts;
    }

    /**
     * Counts of active violations per severity.
     */
    public Map<ViolationSeverity, Integer> countBySeverity() {
        Map<ViolationSeverity, Integer> counts = new EnumMap<>(ViolationSeverity.class);
        for (ViolationSeverity severity : ViolationSeverity.values()) {
            counts.put(severity, 0);
        }
        loadAll().stream()
                .filter(v -> v.getStatus().isActive())
                .forEach(v -> counts.merge(v.getSeverity(), 1, Integer::sum));
        return counts;
    }

    public Path getDirectory() {
        return directory;
    }

    private Violation read(Path file) {
        try {
            return yaml.readValue(file.toFile(), Violation.class);
        } catch (IOException e) {
            logger.warn("Skipping unreadable violation file {}: {}", file, e.getMessage());
            return null;
        }
    }

    private Path fileFor(String id) {
        return directory.resolve(id + SUFFIX);
    }
}
