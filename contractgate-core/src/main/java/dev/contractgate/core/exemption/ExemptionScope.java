package dev.contractgate.core.exemption;

import dev.contractgate.core.util.GlobMatcher;

import java.util.List;

/**
 * Where an exemption applies.
 *
 * @param global whether it covers every file
 * @param files glob patterns of covered files
 * @param lines optional line range, only meaningful together with {@code files}
 * @param violationIds explicit violation ids
 */
public record ExemptionScope(boolean global, List<String> files, LineRange lines, List<String> violationIds) {

    public ExemptionScope {
        files = files == null ? List.of() : List.copyOf(files);
        violationIds = violationIds == null ? List.of() : List.copyOf(violationIds);
    }

    public static ExemptionScope globalScope() {
        return new ExemptionScope(true, List.of(), null, List.of());
    }

    public static ExemptionScope files(List<String> patterns, LineRange lines) {
        return new ExemptionScope(false, patterns, lines, List.of());
    }

    public static ExemptionScope violations(List<String> ids) {
        return new ExemptionScope(false, List.of(), null, ids);
    }

    public boolean coversViolationId(String violationId) {
        return violationId != null && violationIds.contains(violationId);
    }

    /**
     * File-pattern match plus line containment. A violation without a line number
     * matches any line range.
     */
    public boolean coversFile(String file, Integer line) {
        if (file == null || files.isEmpty() || !GlobMatcher.matchesAny(files, file)) {
            return false;
        }
        return lines == null || line == null || lines.contains(line);
    }
}
