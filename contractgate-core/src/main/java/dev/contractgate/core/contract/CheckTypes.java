package dev.contractgate.core.contract;

import java.util.Locale;
import java.util.Map;

/**
 * Canonical check type names and the aliases accepted in contract files.
 */
public final class CheckTypes {

    public static final String PATTERN = "pattern";
    public static final String COMMAND = "command";
    public static final String FILE_EXISTS = "file-exists";
    public static final String STRUCTURAL_METRIC = "structural-metric";
    public static final String CUSTOM = "custom";
    public static final String LAYER_IMPORT = "layer-import";
    public static final String CONSTRUCTOR_INJECTION = "constructor-injection";
    public static final String DOMAIN_PURITY = "domain-purity";
    public static final String CIRCULAR_IMPORT = "circular-import";
    public static final String NESTED_CONTRACT = "nested-contract";

    private static final Map<String, String> ALIASES = Map.of(
            "regex", PATTERN,
            "ast", STRUCTURAL_METRIC,
            "ast-check", STRUCTURAL_METRIC,
            "metric", STRUCTURAL_METRIC,
            "file-exist", FILE_EXISTS,
            "contracts", NESTED_CONTRACT,
            "contract", NESTED_CONTRACT
    );

    private CheckTypes() {
    }

    /**
     * Normalize a declared type: lowercase, underscores to dashes, aliases resolved.
     * Unknown names are returned normalized but otherwise untouched.
     */
    public static String normalize(String type) {
        if (type == null) {
            return "";
        }
        String normalized = type.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return ALIASES.getOrDefault(normalized, normalized);
    }
}
