package dev.contractgate.core.conformance;

import dev.contractgate.core.util.GlobMatcher;

/**
 * Filter for {@link ConformanceManager#listViolations(ViolationQuery)}; null fields match anything.
 *
 * @param status required status
 * @param severity required severity
 * @param contractId required contract
 * @param filePattern glob the file must match; {@code *} stays within a directory, use {@code **} to descend
 * @param limit maximum number of results, {@value #DEFAULT_LIMIT} when null
 */
public record ViolationQuery(
        ViolationStatus status,
        ViolationSeverity severity,
        String contractId,
        String filePattern,
        Integer limit
) {

    public static final int DEFAULT_LIMIT = 50;

    public static ViolationQuery all() {
        return new ViolationQuery(null, null, null, null, null);
    }

    public ViolationQuery withStatus(ViolationStatus value) {
        return new ViolationQuery(value, severity, contractId, filePattern, limit);
    }

    public ViolationQuery withSeverity(ViolationSeverity value) {
        return new ViolationQuery(status, value, contractId, filePattern, limit);
    }

    public ViolationQuery withContract(String value) {
        return new ViolationQuery(status, severity, value, filePattern, limit);
    }

    public ViolationQuery withFilePattern(String value) {
        return new ViolationQuery(status, severity, contractId, value, limit);
    }

    public ViolationQuery withLimit(int value) {
        return new ViolationQuery(status, severity, contractId, filePattern, value);
    }

    public int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }

    public boolean matches(Violation violation) {
        return (status == null || violation.getStatus() == status)
                && (severity == null || violation.getSeverity() == severity)
                && (contractId == null || contractId.equals(violation.getContractId()))
                && (filePattern == null || (violation.getFile() != null && GlobMatcher.matches(filePattern, violation.getFile())));
    }
}
