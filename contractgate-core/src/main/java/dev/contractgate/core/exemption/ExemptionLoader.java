package dev.contractgate.core.exemption;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.exception.ConfigException;
import dev.contractgate.core.util.AtomicFileWriter;
import dev.contractgate.core.util.DocumentSchema;
import dev.contractgate.core.util.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads and updates {@code *.exemptions.yaml} files.
 */
public class ExemptionLoader {

    private static final Logger logger = LoggerFactory.getLogger(ExemptionLoader.class);

    public static final String FILE_SUFFIX = ".exemptions.yaml";

    private final ObjectMapper yaml;
    private final DocumentSchema schema;

    public ExemptionLoader() {
        this.yaml = Mappers.yaml();
        this.schema = DocumentSchema.fromClasspath(DocumentSchema.EXEMPTIONS);
    }

    /**
     * Load every exemption file below the given directories, in directory order and then
     * file name order. Malformed files are skipped with a warning.
     *
     * @param directories directories to scan, missing ones are ignored
     * @return exemptions in load order
     */
    public List<Exemption> loadAll(List<Path> directories) {
        List<Exemption> exemptions = new ArrayList<>();
        for (Path dir : directories) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            for (Path file : listFiles(dir)) {
                try {
                    exemptions.addAll(load(file));
                } catch (ConfigException e) {
                    logger.warn("Skipping malformed exemption file: {}", e.getMessage());
                }
            }
        }
        logger.debug("Loaded {} exemptions from {}", exemptions.size(), directories);
        return exemptions;
    }

    /**
     * Load one exemption file.
     *
     * @throws ConfigException when the file is unreadable or malformed
     */
    public List<Exemption> load(Path file) {
        JsonNode document = read(file);
        schema.validate(document, file);

        List<Exemption> exemptions = new ArrayList<>();
        for (JsonNode node : document.get("exemptions")) {
            exemptions.add(toExemption(node, file));
        }
        return exemptions;
    }

    /**
     * Rewrite the status of an exemption in the file it came from.
     *
     * @param exemption the exemption, must have a source file
     * @param status the new status
     */
    public void updateStatus(Exemption exemption, ExemptionStatus status) {
        exemption.setStatus(status);
        Path file = exemption.getSource();
        if (file == null) {
            return;
        }
        JsonNode document = read(file);
        for (JsonNode node : document.path("exemptions")) {
            if (exemption.getId().equals(node.path("id").asText())) {
                ((ObjectNode) node).put("status", status.value());
            }
        }
        try {
            AtomicFileWriter.write(file, yaml.writeValueAsString(document));
        } catch (IOException e) {
            throw new ConfigException("Cannot write exemption file: " + e.getMessage(), file, e);
        }
        logger.info("Exemption {} marked {}", exemption.getId(), status.value());
    }

    private JsonNode read(Path file) {
        try {
            JsonNode document = yaml.readTree(file.toFile());
            if (document == null || !document.isObject()) {
                throw new ConfigException("Exemption document must be a mapping", file);
            }
            return document;
        } catch (IOException e) {
            throw new ConfigException("Cannot read exemption file: " + e.getMessage(), file, e);
        }
    }

    private Exemption toExemption(JsonNode node, Path file) {
        JsonNode scopeNode = node.path("scope");
        ExemptionScope scope;
        if (scopeNode.path("global").asBoolean(false)) {
            scope = ExemptionScope.globalScope();
        } else if (scopeNode.has("violation_ids")) {
            scope = ExemptionScope.violations(CheckDefinition.stringList(scopeNode.get("violation_ids")));
        } else {
            scope = ExemptionScope.files(CheckDefinition.stringList(scopeNode.path("files")), lineRange(scopeNode.path("lines")));
        }

        String id = node.get("id").asText();
        if (!scope.global() && scope.files().isEmpty() && scope.violationIds().isEmpty()) {
            logger.warn("Exemption {} in {} has an empty scope and will never match", id, file);
        }

        try {
            return new Exemption(
                    id,
                    node.get("contract").asText(),
                    CheckDefinition.stringList(node.get("check")),
                    node.path("reason").asText(""),
                    node.path("approved_by").asText(null),
                    date(node.get("approved_date")),
                    date(node.get("expires")),
                    date(node.get("review_date")),
                    node.path("ticket").asText(null),
                    ExemptionStatus.fromValue(node.path("status").asText(null)),
                    scope,
                    file
            );
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new ConfigException("Invalid exemption " + id + ": " + e.getMessage(), file, e);
        }
    }

    private static LineRange lineRange(JsonNode node) {
        if (node.isArray() && node.size() == 2) {
            return new LineRange(node.get(0).asInt(), node.get(1).asInt());
        }
        if (node.isObject()) {
            int start = node.path("start").asInt(1);
            return new LineRange(start, node.path("end").asInt(start));
        }
        return null;
    }

    private static LocalDate date(JsonNode node) {
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        return LocalDate.parse(node.asText().trim());
    }

    private static List<Path> listFiles(Path dir) {
        try (Stream<Path> stream = Files.walk(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            logger.warn("Cannot list exemption directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }
}
