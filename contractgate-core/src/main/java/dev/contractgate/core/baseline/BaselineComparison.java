package dev.contractgate.core.baseline;

import dev.contractgate.core.ci.CIViolation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Current violations split against a baseline.
 *
 * @param newViolations current violations absent from the baseline
 * @param fixedViolations baseline entries absent from the current run
 * @param existingViolations current violations already in the baseline
 */
public record BaselineComparison(
        List<CIViolation> newViolations,
        List<BaselineEntry> fixedViolations,
        List<CIViolation> existingViolations
) {

    public static BaselineComparison compare(List<CIViolation> violations, Baseline baseline) {
        Set<String> current = new HashSet<>();
        List<CIViolation> introduced = new ArrayList<>();
        List<CIViolation> existing = new ArrayList<>();
        for (CIViolation violation : violations) {
            current.add(violation.hash());
            if (baseline.contains(violation)) {
                existing.add(violation);
            } else {
                introduced.add(violation);
            }
        }
        List<BaselineEntry> fixed = baseline.getEntries().entrySet().stream()
                .filter(entry -> !current.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .toList();
        return new BaselineComparison(List.copyOf(introduced), fixed, List.copyOf(existing));
    }

    /**
     * New minus fixed: positive is a regression, negative an improvement.
     */
    public int netChange() {
        return newViolations.size() - fixedViolations.size();
    }

    public boolean introducesViolations() {
        return !newViolations.isEmpty();
    }

    public boolean hasImprovements() {
        return !fixedViolations.isEmpty();
    }

    public List<CIViolation> newErrors() {
        return newViolations.stream().filter(CIViolation::isError).toList();
    }

    public List<CIViolation> newWarnings() {
        return newViolations.stream().filter(CIViolation::isWarning).toList();
    }

    public boolean shouldFail(boolean failOnNewErrors, boolean failOnNewWarnings) {
        if (failOnNewErrors && !newErrors().isEmpty()) {
            return true;
        }
        return failOnNewWarnings && !newWarnings().isEmpty();
    }

    /**
     * Ratchet policy: fail only when more violations were introduced than fixed.
     */
    public boolean shouldFailRatchet() {
        return netChange() > 0;
    }
}
