package dev.contractgate.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.contractgate.core.exception.ConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON Schema (Draft 2020-12) gate for contract and exemption documents.
 */
public final class DocumentSchema {

    public static final String CONTRACT = "/contractgate/schema/contract.schema.json";
    public static final String EXEMPTIONS = "/contractgate/schema/exemptions.schema.json";

    private final String name;
    private final JsonSchema schema;

    private DocumentSchema(String name, JsonSchema schema) {
        this.name = name;
        this.schema = schema;
    }

    /**
     * Load a schema bundled on the classpath.
     *
     * @param resource the classpath resource
     * @return the schema
     */
    public static DocumentSchema fromClasspath(String resource) {
        try (InputStream in = DocumentSchema.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + resource);
            }
            JsonNode schemaNode = new ObjectMapper().readTree(in);
            JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
            return new DocumentSchema(resource, factory.getSchema(schemaNode));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema " + resource, e);
        }
    }

    /**
     * Validate a document, throwing when it does not conform.
     *
     * @param document the parsed document
     * @param source the file it was read from, for error messages
     * @throws ConfigException listing every schema violation
     */
    public void validate(JsonNode document, Path source) {
        Set<ValidationMessage> messages = schema.validate(document);
        if (!messages.isEmpty()) {
            String details = messages.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigException("Document does not match " + name + ": " + details, source);
        }
    }
}
