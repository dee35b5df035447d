package dev.contractgate.core.check.source;

import java.util.ArrayList;
import java.util.List;

/**
 * An import statement.
 *
 * @param module the imported module, already made absolute for relative imports
 * @param names names imported from the module, empty for plain module imports
 * @param line line of the statement
 * @param typeCheckingOnly whether the import sits inside a type-checking-only guard
 */
public record ImportRef(String module, List<String> names, int line, boolean typeCheckingOnly) {

    public ImportRef {
        names = names == null ? List.of() : List.copyOf(names);
    }

    /**
     * Number of bindings the statement contributes to the file's import count.
     */
    public int bindingCount() {
        return Math.max(1, names.size());
    }

    /**
     * The module plus every {@code module.name} candidate, for resolving against local modules.
     */
    public List<String> candidates() {
        if (names.isEmpty()) {
            return List.of(module);
        }
        List<String> result = new ArrayList<>();
        result.add(module);
        for (String name : names) {
            result.add(module.isEmpty() ? name : module + "." + name);
        }
        return result;
    }
}
