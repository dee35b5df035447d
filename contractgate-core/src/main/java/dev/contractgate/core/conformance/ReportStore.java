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
import java.util.Optional;

/**
 * Reads and writes {@code conformance_report.yaml}.
 */
public class ReportStore {

    private static final Logger logger = LoggerFactory.getLogger(ReportStore.class);

    private final Path file;
    private final ObjectMapper yaml = Mappers.yaml();

    public ReportStore(Path file) {
        this.file = file;
    }

    public Optional<ConformanceReport> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(yaml.readValue(file.toFile(), ConformanceReport.class));
        } catch (IOException e) {
            logger.warn("Ignoring unreadable report {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(ConformanceReport report) {
        try {
            AtomicFileWriter.write(file, yaml.writeValueAsString(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize report", e);
        }
    }
}
