package dev.contractgate.core.conformance;

/**
 * Aggregate counts of one conformance run.
 *
 * @param total passed + failed + exempted + stale
 * @param passed passing check results
 * @param failed active violations without a covering exemption
 * @param exempted active violations covered by an exemption
 * @param stale violations not re-detected by an incremental run
 * @param complianceRate passed / total, 1.0 when total is 0
 */
public record ConformanceSummary(int total, int passed, int failed, int exempted, int stale, double complianceRate) {

    public static ConformanceSummary of(int passed, int failed, int exempted, int stale) {
        int total = passed + failed + exempted + stale;
        double rate = total == 0 ? 1.0 : (double) passed / total;
        return new ConformanceSummary(total, passed, failed, exempted, stale, rate);
    }

    public static ConformanceSummary empty() {
        return of(0, 0, 0, 0);
    }
}
