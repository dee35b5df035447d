package dev.contractgate.core.check;

import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;

import java.util.Comparator;

/**
 * Normalized outcome of a check at one location.
 *
 * @param contractId owning contract, filled in by the executor
 * @param checkId check id
 * @param file repository-relative file, null for repository-level results
 * @param line 1-based line, null for file-level results
 * @param severity result severity
 * @param passed whether this result records a pass
 * @param message human-readable message
 * @param fixHint optional remediation hint
 * @param rule optional rule id within the check (pattern name, metric, layer)
 */
public record CheckResult(
        String contractId,
        String checkId,
        String file,
        Integer line,
        CheckSeverity severity,
        boolean passed,
        String message,
        String fixHint,
        String rule
) {

    /**
     * Deterministic report order: severity, then check id, file and line.
     */
    public static final Comparator<CheckResult> REPORT_ORDER = Comparator
            .comparing((CheckResult r) -> r.severity().rank())
            .thenComparing(CheckResult::checkId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CheckResult::file, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CheckResult::line, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static CheckResult failure(CheckDefinition check, String file, Integer line, String message) {
        return new CheckResult(null, check.id(), file, line, check.severity(), false, message, check.fixHint(), null);
    }

    public static CheckResult failure(CheckDefinition check, String file, Integer line, String message, String rule) {
        return new CheckResult(null, check.id(), file, line, check.severity(), false, message, check.fixHint(), rule);
    }

    public static CheckResult warning(CheckDefinition check, String file, Integer line, String message) {
        return new CheckResult(null, check.id(), file, line, CheckSeverity.WARNING, false, message, check.fixHint(), null);
    }

    public static CheckResult error(String contractId, String checkId, String message) {
        return new CheckResult(contractId, checkId, null, null, CheckSeverity.ERROR, false, message, null, null);
    }

    public static CheckResult passed(String contractId, CheckDefinition check) {
        return new CheckResult(contractId, check.id(), null, null, check.severity(), true, "Check passed", null, null);
    }

    public CheckResult withContract(String contract) {
        return new CheckResult(contract, checkId, file, line, severity, passed, message, fixHint, rule);
    }

    public CheckResult withCheck(String newCheckId) {
        return new CheckResult(contractId, newCheckId, file, line, severity, passed, message, fixHint, rule);
    }

    public boolean failed() {
        return !passed;
    }
}
