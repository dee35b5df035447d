package dev.contractgate.core.contract;

import java.util.List;
import java.util.Locale;

/**
 * Language and repository-type filters of a contract. An empty list matches anything.
 */
public record ContractAppliesTo(List<String> languages, List<String> repoTypes) {

    public ContractAppliesTo {
        languages = languages == null ? List.of() : languages.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
        repoTypes = repoTypes == null ? List.of() : repoTypes.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }

    public static ContractAppliesTo any() {
        return new ContractAppliesTo(List.of(), List.of());
    }

    /**
     * Check the filters. A null argument means "not filtering on this dimension".
     */
    public boolean matches(String language, String repoType) {
        return matches(languages, language) && matches(repoTypes, repoType);
    }

    private static boolean matches(List<String> allowed, String value) {
        return allowed.isEmpty() || value == null || allowed.contains(value.toLowerCase(Locale.ROOT));
    }
}
