package dev.contractgate.core.check.handler;

import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.source.ImportRef;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckTypes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects import cycles between modules of the project.
 * <p>
 * Only imports that resolve to a module among the scanned files are edges. Each cycle is
 * reported once, keyed by its set of modules, at line 1 of the first module on the cycle.
 */
public class CircularImportCheckHandler extends SourceCheckHandler {

    static final int DEFAULT_MAX_DEPTH = 5;
    static final String DEFAULT_FIX_HINT =
            "Break the cycle by moving shared code into a separate module or importing inside the function that needs it";

    public CircularImportCheckHandler(SourceAdapters adapters) {
        super(adapters);
    }

    @Override
    public String type() {
        return CheckTypes.CIRCULAR_IMPORT;
    }

    @Override
    protected List<CheckResult> analyze(CheckDefinition check, List<SourceUnit> units) {
        boolean ignoreTypeChecking = check.config().path("ignore_type_checking").asBoolean(true);
        int maxDepth = check.config().path("max_depth").asInt(DEFAULT_MAX_DEPTH);

        Map<String, SourceUnit> modules = new LinkedHashMap<>();
        units.forEach(unit -> modules.put(unit.moduleName(), unit));
        Map<String, Set<String>> graph = buildGraph(modules, ignoreTypeChecking);

        List<List<String>> cycles = new ArrayList<>();
        Set<Set<String>> seen = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String module : graph.keySet()) {
            if (!visited.contains(module)) {
                search(module, graph, visited, new ArrayList<>(), new HashSet<>(), maxDepth, cycles, seen);
            }
        }

        List<CheckResult> results = new ArrayList<>();
        String fixHint = check.fixHint() != null ? check.fixHint() : DEFAULT_FIX_HINT;
        for (List<String> cycle : cycles) {
            List<String> display = new ArrayList<>(cycle);
            display.add(cycle.get(0));
            SourceUnit first = modules.get(cycle.get(0));
            results.add(new CheckResult(null, check.id(), first.path(), 1, check.severity(), false,
                    "Circular import: " + String.join(" -> ", display), fixHint,
                    String.join(",", new TreeSet<>(cycle))));
        }
        return results;
    }

    static Map<String, Set<String>> buildGraph(Map<String, SourceUnit> modules, boolean ignoreTypeChecking) {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (SourceUnit unit : modules.values()) {
            Set<String> edges = new LinkedHashSet<>();
            for (ImportRef ref : unit.imports()) {
                if (ignoreTypeChecking && ref.typeCheckingOnly()) {
                    continue;
                }
                for (String candidate : ref.candidates()) {
                    if (candidate.endsWith(".*")) {
                        String prefix = candidate.substring(0, candidate.length() - 1);
                        modules.keySet().stream()
                                .filter(m -> m.startsWith(prefix) && m.indexOf('.', prefix.length()) < 0)
                                .forEach(edges::add);
                    } else if (modules.containsKey(candidate)) {
                        edges.add(candidate);
                    }
                }
            }
            edges.remove(unit.moduleName());
            graph.put(unit.moduleName(), edges);
        }
        return graph;
    }

    private static void search(String module, Map<String, Set<String>> graph, Set<String> visited, List<String> path,
                               Set<String> onPath, int maxDepth, List<List<String>> cycles, Set<Set<String>> seen) {
        if (path.size() >= maxDepth) {
            return;
        }
        visited.add(module);
        path.add(module);
        onPath.add(module);
        for (String next : graph.getOrDefault(module, Set.of())) {
            if (onPath.contains(next)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                if (seen.add(new HashSet<>(cycle))) {
                    cycles.add(cycle);
                }
            } else if (!visited.contains(next)) {
                search(next, graph, visited, path, onPath, maxDepth, cycles, seen);
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(module);
    }
}
