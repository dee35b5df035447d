package dev.contractgate.core.baseline;

import java.time.Instant;
import java.util.Map;

public record BaselineStats(
        int totalEntries,
        Instant createdAt,
        Instant updatedAt,
        String commitSha,
        Map<String, Integer> byCheck,
        Map<String, Integer> byFile,
        Instant oldestEntry,
        Instant newestEntry
) {
}
