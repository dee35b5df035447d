package dev.contractgate.core.history;

import dev.contractgate.core.conformance.ConformanceSummary;
import dev.contractgate.core.conformance.TrendDelta;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Conformance state recorded for one day; a later run on the same day replaces it.
 */
public record HistorySnapshot(
        LocalDate date,
        Instant recordedAt,
        String runId,
        ConformanceSummary summary,
        Map<String, Integer> bySeverity,
        Map<String, Integer> byContract
) {

    /**
     * Per-field change from an older snapshot to this one.
     */
    public TrendDelta deltaFrom(HistorySnapshot older) {
        return TrendDelta.between(summary, older.summary());
    }
}
