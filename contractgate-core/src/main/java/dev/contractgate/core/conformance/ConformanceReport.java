package dev.contractgate.core.conformance;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted outcome of the latest conformance run.
 *
 * @param schemaVersion report format version
 * @param generatedAt time the run finished
 * @param runId unique run id
 * @param runType full or incremental
 * @param summary aggregate counts
 * @param bySeverity failing violations per severity
 * @param byContract failing violations per contract
 * @param contractsChecked contracts executed in this run
 * @param filesChecked number of files checked
 * @param trend delta against the previous report, null on the first run
 */
public record ConformanceReport(
        String schemaVersion,
        Instant generatedAt,
        String runId,
        RunType runType,
        ConformanceSummary summary,
        Map<String, Integer> bySeverity,
        Map<String, Integer> byContract,
        List<String> contractsChecked,
        int filesChecked,
        TrendDelta trend
) {

    public static final String SCHEMA_VERSION = "1.0";

    /**
     * The report written by {@code initialize}, before any run.
     */
    public static ConformanceReport initial(Instant now) {
        return new ConformanceReport(SCHEMA_VERSION, now, null, null, ConformanceSummary.empty(),
                Map.of(), Map.of(), List.of(), 0, null);
    }
}
