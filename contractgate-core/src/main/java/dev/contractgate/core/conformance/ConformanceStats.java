package dev.contractgate.core.conformance;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the stored conformance state for dashboards and status output.
 */
public record ConformanceStats(
        int total,
        int open,
        int resolved,
        int stale,
        int exemptionExpired,
        Map<String, Integer> bySeverity,
        int activeExemptions,
        int expiredExemptions,
        int exemptionsNeedingReview,
        Instant lastRun,
        double complianceRate
) {
}
