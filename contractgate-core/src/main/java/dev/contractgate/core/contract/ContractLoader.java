package dev.contractgate.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contractgate.core.exception.ConfigException;
import dev.contractgate.core.util.DocumentSchema;
import dev.contractgate.core.util.Mappers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code *.contract.yaml} documents into {@link Contract} instances.
 */
public class ContractLoader {

    public static final String FILE_SUFFIX = ".contract.yaml";

    private final ObjectMapper yaml;
    private final DocumentSchema schema;

    public ContractLoader() {
        this.yaml = Mappers.yaml();
        this.schema = DocumentSchema.fromClasspath(DocumentSchema.CONTRACT);
    }

    /**
     * Load a contract file.
     *
     * @param file the contract file
     * @param tier the tier it belongs to
     * @return the parsed, unresolved contract
     * @throws ConfigException when the file is unreadable or malformed
     */
    public Contract load(Path file, ContractTier tier) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, tier, file);
        } catch (IOException e) {
            throw new ConfigException("Cannot read contract file: " + e.getMessage(), file, e);
        }
    }

    /**
     * Parse a contract document from a stream.
     *
     * @param in the YAML stream
     * @param tier the tier it belongs to
     * @param source the origin, null for classpath contracts
     * @return the parsed contract
     */
    public Contract parse(InputStream in, ContractTier tier, Path source) {
        JsonNode document;
        try {
            document = yaml.readTree(in);
        } catch (IOException e) {
            throw new ConfigException("Invalid YAML: " + e.getMessage(), source, e);
        }
        if (document == null || !document.isObject()) {
            throw new ConfigException("Contract document must be a mapping", source);
        }
        schema.validate(document, source);

        JsonNode header = document.get("contract");
        List<CheckDefinition> checks = new ArrayList<>();
        for (JsonNode checkNode : document.path("checks")) {
            checks.add(CheckDefinition.fromNode((ObjectNode) checkNode));
        }

        JsonNode appliesTo = header.path("applies_to");
        return new Contract(
                header.get("name").asText(),
                header.path("type").asText("custom"),
                header.path("description").asText(""),
                header.path("version").asText("1.0.0"),
                header.path("enabled").asBoolean(true),
                CheckDefinition.stringList(header.get("extends")),
                new ContractAppliesTo(
                        CheckDefinition.stringList(appliesTo.path("languages")),
                        CheckDefinition.stringList(appliesTo.path("repo_types"))),
                CheckDefinition.stringList(header.path("tags")),
                checks,
                tier,
                source
        );
    }
}
