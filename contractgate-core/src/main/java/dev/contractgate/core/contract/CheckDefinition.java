package dev.contractgate.core.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single rule definition belonging to a contract.
 * <p>
 * Type-specific settings may be declared either under {@code config} or directly on the
 * check; both end up in {@link #config()}.
 *
 * @param id check id, unique within a contract
 * @param name display name
 * @param type normalized check type
 * @param declaredType the type exactly as written in the contract file
 * @param severity declared severity
 * @param enabled whether the check runs
 * @param scope include and exclude globs
 * @param config type-specific settings
 * @param fixHint optional remediation hint
 * @param description optional description
 * @param source the raw node the definition was built from, used for inheritance merging
 */
public record CheckDefinition(
        String id,
        String name,
        String type,
        String declaredType,
        CheckSeverity severity,
        boolean enabled,
        PathScope scope,
        ObjectNode config,
        String fixHint,
        String description,
        ObjectNode source
) {

    private static final Set<String> STANDARD_FIELDS = Set.of(
            "id", "name", "type", "severity", "enabled", "applies_to", "fix_hint", "description", "config");

    /**
     * Build a definition from a check node of a contract file.
     *
     * @param node the check node
     * @return the definition
     */
    public static CheckDefinition fromNode(ObjectNode node) {
        String id = node.path("id").asText("");
        String declaredType = node.path("type").asText("");

        ObjectNode config = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!STANDARD_FIELDS.contains(field.getKey())) {
                config.set(field.getKey(), field.getValue());
            }
        }
        if (node.path("config").isObject()) {
            config.setAll((ObjectNode) node.get("config"));
        }

        JsonNode appliesTo = node.path("applies_to");
        PathScope scope = new PathScope(
                stringList(appliesTo.path("paths")),
                stringList(appliesTo.path("exclude_paths")));

        return new CheckDefinition(
                id,
                node.path("name").asText(id),
                CheckTypes.normalize(declaredType),
                declaredType,
                CheckSeverity.fromValue(node.path("severity").asText(null)),
                node.path("enabled").asBoolean(true),
                scope,
                config,
                node.hasNonNull("fix_hint") ? node.get("fix_hint").asText() : null,
                node.hasNonNull("description") ? node.get("description").asText() : null,
                node.deepCopy()
        );
    }

    /**
     * Overlay a child's definition of the same check onto this one, field by field.
     * Config maps are merged shallowly, the child's keys winning.
     *
     * @param child the overriding definition
     * @return the merged definition
     */
    public CheckDefinition overriddenBy(CheckDefinition child) {
        ObjectNode merged = source.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = child.source().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = merged.get(field.getKey());
            if (field.getKey().equals("config") && existing != null && existing.isObject() && field.getValue().isObject()) {
                ((ObjectNode) existing).setAll((ObjectNode) field.getValue().deepCopy());
            } else {
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return fromNode(merged);
    }

    /**
     * Read a node that may be a single string or a list of strings.
     */
    public static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isMissingNode() || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }
}
