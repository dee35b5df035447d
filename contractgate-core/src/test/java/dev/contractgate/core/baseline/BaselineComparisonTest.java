package dev.contractgate.core.baseline;

import dev.contractgate.core.ci.CIViolation;
import dev.contractgate.core.contract.CheckSeverity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BaselineComparisonTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private final CIViolation h1 = violation("no-print", "src/a.py", 1, CheckSeverity.ERROR);
    private final CIViolation h2 = violation("no-print", "src/b.py", 2, CheckSeverity.ERROR);
    private final CIViolation h3 = violation("no-eval", "src/c.py", 3, CheckSeverity.WARNING);

    @Test
    void splitsCurrentViolationsIntoNewFixedAndExisting() {
        Baseline baseline = Baseline.empty("abc123", NOW);
        baseline.add(h1, NOW);
        baseline.add(h2, NOW);

        BaselineComparison comparison = BaselineComparison.compare(List.of(h1, h3), baseline);

        assertThat(comparison.newViolations()).containsExactly(h3);
        assertThat(comparison.fixedViolations()).extracting(BaselineEntry::hash).containsExactly(h2.hash());
        assertThat(comparison.existingViolations()).containsExactly(h1);
        assertThat(comparison.netChange()).isZero();
        assertThat(comparison.introducesViolations()).isTrue();
        assertThat(comparison.hasImprovements()).isTrue();
        assertThat(comparison.shouldFailRatchet()).isFalse();
    }

    @Test
    void newWarningsOnlyFailWhenConfigured() {
        BaselineComparison comparison = BaselineComparison.compare(List.of(h3), Baseline.empty(null, NOW));

        assertThat(comparison.newErrors()).isEmpty();
        assertThat(comparison.newWarnings()).containsExactly(h3);
        assertThat(comparison.shouldFail(true, false)).isFalse();
        assertThat(comparison.shouldFail(true, true)).isTrue();
    }

    @Test
    void rewordedMessageIsANewBaselineViolation() {
        Baseline baseline = Baseline.empty(null, NOW);
        baseline.add(h1, NOW);
        CIViolation reworded = new CIViolation(h1.checkId(), h1.filePath(), h1.line(), "different text",
                h1.severity(), null, "api", null);

        BaselineComparison comparison = BaselineComparison.compare(List.of(reworded), baseline);

        assertThat(comparison.newViolations()).containsExactly(reworded);
        assertThat(comparison.fixedViolations()).hasSize(1);
    }

    @Test
    void missingLineAndLineZeroShareAFingerprint() {
        CIViolation noLine = new CIViolation("readme", "README.md", null, "missing", CheckSeverity.ERROR, null, "api", null);
        CIViolation lineZero = new CIViolation("readme", "README.md", 0, "missing", CheckSeverity.ERROR, null, "api", null);

        assertThat(noLine.hash()).isEqualTo(lineZero.hash()).hasSize(16);
        assertThat(noLine.location()).isEqualTo("README.md");
    }

    static CIViolation violation(String check, String file, int line, CheckSeverity severity) {
        return new CIViolation(check, file, line, check + " at " + file, severity, null, "api", null);
    }
}
