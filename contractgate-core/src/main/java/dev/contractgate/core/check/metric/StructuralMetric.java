package dev.contractgate.core.check.metric;

import java.util.Locale;
import java.util.Optional;

/**
 * Metrics a structural-metric check can enforce.
 */
public enum StructuralMetric {
    CYCLOMATIC_COMPLEXITY(Target.FUNCTION, "Function '%s' has complexity %d (max: %d)"),
    FUNCTION_LENGTH(Target.FUNCTION, "Function '%s' has %d lines (max: %d)"),
    NESTING_DEPTH(Target.FUNCTION, "Function '%s' has nesting depth %d (max: %d)"),
    PARAMETER_COUNT(Target.FUNCTION, "Function '%s' has %d parameters (max: %d)"),
    CLASS_SIZE(Target.CLASS, "Class '%s' has %d methods (max: %d)"),
    IMPORT_COUNT(Target.FILE, "File '%s' has %d imports (max: %d)");

    /**
     * What a metric is measured on.
     */
    public enum Target {
        FUNCTION,
        CLASS,
        FILE
    }

    private final Target target;
    private final String messageFormat;

    StructuralMetric(Target target, String messageFormat) {
        this.target = target;
        this.messageFormat = messageFormat;
    }

    /**
     * Parse a metric name as written in contract files, accepting the short aliases.
     */
    public static Optional<StructuralMetric> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Optional.ofNullable(switch (key) {
            case "cyclomatic_complexity", "complexity", "max_complexity" -> CYCLOMATIC_COMPLEXITY;
            case "function_length", "method_length", "max_function_length" -> FUNCTION_LENGTH;
            case "nesting_depth", "nesting", "max_nesting_depth" -> NESTING_DEPTH;
            case "parameter_count", "param_count", "parameters", "max_parameters" -> PARAMETER_COUNT;
            case "class_size", "method_count", "max_methods" -> CLASS_SIZE;
            case "import_count", "imports", "max_imports" -> IMPORT_COUNT;
            default -> null;
        });
    }

    public Target target() {
        return target;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String message(String subject, int value, int max) {
        return String.format(messageFormat, subject, value, max);
    }
}
