package dev.contractgate.core.ci;

import dev.contractgate.core.baseline.BaselineComparison;
import dev.contractgate.core.check.CheckResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Outcome of a CI run.
 *
 * @param mode run mode
 * @param exitCode process exit code
 * @param violations gating violations, sorted by severity then check id
 * @param comparison baseline comparison, present in PR and ratchet runs
 * @param passedChecks passing check results, used for JUnit output
 * @param exemptedCount violations removed from gating by an exemption
 * @param filesChecked files in the checked index
 * @param checksRun number of checks executed
 * @param startedAt run start
 * @param completedAt run end
 * @param commitSha HEAD commit when known
 * @param baseRef diff base ref when configured
 * @param headRef diff head ref when configured
 * @param errors runtime error messages
 */
public record CIResult(
        CIMode mode,
        ExitCode exitCode,
        List<CIViolation> violations,
        BaselineComparison comparison,
        List<CheckResult> passedChecks,
        int exemptedCount,
        int filesChecked,
        int checksRun,
        Instant startedAt,
        Instant completedAt,
        String commitSha,
        String baseRef,
        String headRef,
        List<String> errors
) {

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    public int totalViolations() {
        return violations.size();
    }

    public long errorCount() {
        return violations.stream().filter(CIViolation::isError).count();
    }

    public long warningCount() {
        return violations.stream().filter(CIViolation::isWarning).count();
    }

    public long infoCount() {
        return violations.size() - errorCount() - warningCount();
    }

    public boolean isSuccess() {
        return exitCode == ExitCode.SUCCESS;
    }

    public Map<String, List<CIViolation>> violationsByFile() {
        Map<String, List<CIViolation>> byFile = new TreeMap<>();
        violations.forEach(v -> byFile.computeIfAbsent(v.filePath(), k -> new ArrayList<>()).add(v));
        return byFile;
    }

    public Map<String, List<CIViolation>> violationsByCheck() {
        Map<String, List<CIViolation>> byCheck = new TreeMap<>();
        violations.forEach(v -> byCheck.computeIfAbsent(v.checkId(), k -> new ArrayList<>()).add(v));
        return byCheck;
    }

    /**
     * Flat summary for logs and machine-readable status output.
     */
    public Map<String, Object> toSummaryMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("mode", mode.value());
        summary.put("exit_code", exitCode.code());
        summary.put("exit_code_description", exitCode.description());
        summary.put("total_violations", totalViolations());
        summary.put("errors", errorCount());
        summary.put("warnings", warningCount());
        summary.put("info", infoCount());
        summary.put("exempted", exemptedCount);
        summary.put("files_checked", filesChecked);
        summary.put("checks_run", checksRun);
        summary.put("duration_seconds", duration().toMillis() / 1000.0);
        if (comparison != null) {
            Map<String, Object> baseline = new LinkedHashMap<>();
            baseline.put("new_violations", comparison.newViolations().size());
            baseline.put("fixed_violations", comparison.fixedViolations().size());
            baseline.put("existing_violations", comparison.existingViolations().size());
            baseline.put("net_change", comparison.netChange());
            summary.put("baseline_comparison", baseline);
        }
        if (commitSha != null) {
            summary.put("commit_sha", commitSha);
        }
        if (!errors.isEmpty()) {
            summary.put("runtime_errors", errors);
        }
        return summary;
    }
}
