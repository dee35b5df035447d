package dev.contractgate.core.conformance;

/**
 * Change of the summary counts between two runs, current minus previous.
 */
public record TrendDelta(int passed, int failed, int exempted, int stale, double complianceRate) {

    public static TrendDelta between(ConformanceSummary current, ConformanceSummary previous) {
        return new TrendDelta(
                current.passed() - previous.passed(),
                current.failed() - previous.failed(),
                current.exempted() - previous.exempted(),
                current.stale() - previous.stale(),
                current.complianceRate() - previous.complianceRate());
    }

    /**
     * Whether fewer violations fail now than before.
     */
    public boolean isImproving() {
        return failed < 0;
    }
}
