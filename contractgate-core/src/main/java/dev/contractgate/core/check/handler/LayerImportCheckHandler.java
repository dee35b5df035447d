package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.source.ImportRef;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.util.GlobMatcher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enforces import direction between architecture layers.
 * <p>
 * {@code layer_detection} maps path globs to layer names, first match winning. An import
 * belongs to a layer when its module path contains the literal directory names of that
 * layer's glob (source roots such as {@code src/main/java} aside), so standard-library and
 * third-party imports never match.
 */
public class LayerImportCheckHandler extends SourceCheckHandler {

    // leading directories that never appear in module names
    private static final Set<String> SOURCE_ROOTS = Set.of("src", "main", "java", "python", "lib");

    public LayerImportCheckHandler(SourceAdapters adapters) {
        super(adapters);
    }

    @Override
    public String type() {
        return CheckTypes.LAYER_IMPORT;
    }

    @Override
    protected List<CheckResult> analyze(CheckDefinition check, List<SourceUnit> units) {
        Map<String, String> detection = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = check.config().path("layer_detection").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            detection.put(entry.getKey(), entry.getValue().asText());
        }
        JsonNode rules = check.config().path("layer_rules");

        List<CheckResult> results = new ArrayList<>();
        for (SourceUnit unit : units) {
            String layer = layerOfFile(detection, unit.path());
            if (layer == null || !rules.has(layer)) {
                continue;
            }
            JsonNode rule = rules.get(layer);
            List<String> forbidden = CheckDefinition.stringList(rule.get("forbidden"));
            for (ImportRef ref : unit.imports()) {
                String target = layerOfModule(detection, ref.module());
                if (target != null && !target.equals(layer) && forbidden.contains(target)) {
                    String message = rule.hasNonNull("message")
                            ? rule.get("message").asText() + " (imports '" + ref.module() + "')"
                            : "Layer '" + layer + "' must not import from layer '" + target + "' ('" + ref.module() + "')";
                    results.add(CheckResult.failure(check, unit.path(), ref.line(), message, layer + "->" + target));
                }
            }
        }
        return results;
    }

    static String layerOfFile(Map<String, String> detection, String path) {
        for (Map.Entry<String, String> entry : detection.entrySet()) {
            if (GlobMatcher.matches(entry.getKey(), path)) {
                return entry.getValue();
            }
        }
        return null;
    }

    static String layerOfModule(Map<String, String> detection, String module) {
        List<String> segments = Arrays.asList(module.split("\\."));
        for (Map.Entry<String, String> entry : detection.entrySet()) {
            List<String> literals = literalSegments(entry.getKey());
            if (!literals.isEmpty() && segments.containsAll(literals)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static List<String> literalSegments(String glob) {
        List<String> literals = Arrays.stream(glob.split("/"))
                .filter(s -> !s.isEmpty() && !s.contains("*") && !s.contains("?") && !s.contains("{") && !s.contains("."))
                .toList();
        int start = 0;
        while (start < literals.size() - 1 && SOURCE_ROOTS.contains(literals.get(start))) {
            start++;
        }
        return literals.subList(start, literals.size());
    }
}
