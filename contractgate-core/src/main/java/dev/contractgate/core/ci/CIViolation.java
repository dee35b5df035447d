package dev.contractgate.core.ci;

import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.util.Hashing;

/**
 * A failing check result as seen by the CI layer.
 *
 * @param checkId check id
 * @param filePath repository-relative file, empty for repository-level results
 * @param line 1-based line, null when unknown
 * @param message result message
 * @param severity result severity
 * @param ruleId rule within the check, defaults to the check id in reports
 * @param contractId owning contract
 * @param fixHint optional remediation hint
 */
public record CIViolation(
        String checkId,
        String filePath,
        Integer line,
        String message,
        CheckSeverity severity,
        String ruleId,
        String contractId,
        String fixHint
) {

    private static final int HASH_LENGTH = 16;

    public static CIViolation from(CheckResult result) {
        return new CIViolation(result.checkId(), result.file() == null ? "" : result.file(), result.line(),
                result.message(), result.severity(), result.rule(), result.contractId(), result.fixHint());
    }

    /**
     * Baseline fingerprint over check, file, line and message.
     * <p>
     * Unlike the tracking id of a stored violation this includes the message, so a reworded
     * message counts as a new violation against the baseline.
     */
    public String hash() {
        String lineText = line == null || line == 0 ? "0" : Integer.toString(line);
        return Hashing.shortSha256(checkId + ":" + filePath + ":" + lineText + ":" + message, HASH_LENGTH);
    }

    /**
     * Back to a failing check result, for violations served from the cache.
     */
    public CheckResult toCheckResult() {
        return new CheckResult(contractId, checkId, filePath.isEmpty() ? null : filePath, line, severity, false,
                message, fixHint, ruleId);
    }

    public boolean isError() {
        return severity == CheckSeverity.ERROR;
    }

    public boolean isWarning() {
        return severity == CheckSeverity.WARNING;
    }

    /**
     * {@code file:line}, or just the file when there is no line.
     */
    public String location() {
        return line == null || line == 0 ? filePath : filePath + ":" + line;
    }
}
