package dev.contractgate.core.conformance;

import dev.contractgate.core.MutableClock;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.exception.ConformanceStateException;
import dev.contractgate.core.exemption.Exemption;
import dev.contractgate.core.exemption.ExemptionResolver;
import dev.contractgate.core.exemption.ExemptionScope;
import dev.contractgate.core.exemption.ExemptionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static dev.contractgate.core.Fixtures.failure;
import static dev.contractgate.core.Fixtures.pass;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConformanceManagerTest {

    @TempDir
    Path repo;

    private MutableClock clock;
    private List<Exemption> exemptions;
    private ConformanceManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        exemptions = new ArrayList<>();
        manager = new ConformanceManager(repo, () -> new ExemptionResolver(exemptions, null, clock), 90, clock);
    }

    @Test
    void initializeCreatesLayoutAndIgnoreRule() throws IOException {
        Files.writeString(repo.resolve(".gitignore"), "target/");

        manager.initialize(false);

        assertThat(manager.isInitialized()).isTrue();
        assertThat(repo.resolve(".contractgate/violations/.gitkeep")).exists();
        assertThat(repo.resolve(".contractgate/exemptions")).isDirectory();
        assertThat(repo.resolve(".contractgate/history")).isDirectory();
        assertThat(Files.readString(repo.resolve(".gitignore"))).isEqualTo("target/\n.contractgate/local.yaml\n");
        assertThat(manager.getLatestReport()).hasValueSatisfying(report -> {
            assertThat(report.runId()).isNull();
            assertThat(report.summary()).isEqualTo(ConformanceSummary.empty());
        });
    }

    @Test
    void initializeTwiceRequiresForce() throws IOException {
        manager.initialize(false);

        assertThatThrownBy(() -> manager.initialize(false))
                .isInstanceOf(ConformanceStateException.class)
                .hasMessageContaining("already initialized");

        manager.initialize(true);
        String gitignore = Files.readString(repo.resolve(".gitignore"));
        assertThat(gitignore.lines().filter(".contractgate/local.yaml"::equals)).hasSize(1);
    }

    @Test
    void sameFindingKeepsItsIdAcrossRuns() {
        CheckResult first = failure("api", "no-print", "src/app.py", 12, CheckSeverity.ERROR, "print found");
        CheckResult reworded = failure("api", "no-print", "src\\app.py", 12, CheckSeverity.ERROR, "print() call found");

        assertThat(ViolationIds.of(first)).isEqualTo(ViolationIds.of(reworded)).startsWith("V-").hasSize(14);

        manager.runConformanceCheck(List.of(first), Set.of("api"), 1, true);
        clock.advance(Duration.ofHours(1));
        manager.runConformanceCheck(List.of(reworded), Set.of("api"), 1, true);

        List<Violation> stored = manager.listViolations(ViolationQuery.all());
        assertThat(stored).hasSize(1);
        Violation violation = stored.get(0);
        assertThat(violation.getMessage()).isEqualTo("print() call found");
        assertThat(violation.getFirstDetected()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
        assertThat(violation.getLastSeen()).isEqualTo(Instant.parse("2026-03-01T11:00:00Z"));
    }

    @Test
    void fullRunResolvesViolationsNoLongerDetected() {
        CheckResult finding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.ERROR, "print found");
        manager.runConformanceCheck(List.of(finding), Set.of("api"), 1, true);
        String id = ViolationIds.of(finding);

        ConformanceReport report = manager.runConformanceCheck(List.of(pass("api", "no-print")), Set.of("api"), 1, true);

        Violation violation = manager.getViolation(id).orElseThrow();
        assertThat(violation.getStatus()).isEqualTo(ViolationStatus.RESOLVED);
        assertThat(violation.getResolution().resolvedBy()).isEqualTo("contractgate");
        assertThat(violation.getResolution().reason()).isEqualTo("Not detected in full run");
        assertThat(report.summary().failed()).isZero();
        assertThat(report.summary().passed()).isEqualTo(1);
        assertThat(report.summary().complianceRate()).isEqualTo(1.0);
    }

    @Test
    void incrementalRunMarksUnseenViolationsStaleAndRedetectionReopens() {
        CheckResult finding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.WARNING, "print found");
        String id = ViolationIds.of(finding);
        manager.runConformanceCheck(List.of(finding), Set.of("api"), 10, true);

        ConformanceReport incremental = manager.runConformanceCheck(List.of(), Set.of("api"), 2, false);
        assertThat(manager.getViolation(id).orElseThrow().getStatus()).isEqualTo(ViolationStatus.STALE);
        assertThat(incremental.runType()).isEqualTo(RunType.INCREMENTAL);
        assertThat(incremental.summary().stale()).isEqualTo(1);
        assertThat(incremental.summary().failed()).isZero();

        manager.runConformanceCheck(List.of(finding), Set.of("api"), 2, false);
        Violation reopened = manager.getViolation(id).orElseThrow();
        assertThat(reopened.getStatus()).isEqualTo(ViolationStatus.OPEN);
        assertThat(reopened.getResolution()).isNull();
    }

    @Test
    void redetectionReopensManuallyResolvedViolation() {
        CheckResult finding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.ERROR, "print found");
        String id = ViolationIds.of(finding);
        manager.runConformanceCheck(List.of(finding), Set.of("api"), 1, true);

        Violation resolved = manager.resolveViolation(id, "fixed upstream", "alice");
        assertThat(resolved.getStatus()).isEqualTo(ViolationStatus.RESOLVED);
        assertThat(resolved.getResolution().resolvedBy()).isEqualTo("alice");

        manager.runConformanceCheck(List.of(finding), Set.of("api"), 1, true);
        assertThat(manager.getViolation(id).orElseThrow().getStatus()).isEqualTo(ViolationStatus.OPEN);
    }

    @Test
    void violationsOfContractsNotCheckedAreLeftAlone() {
        CheckResult apiFinding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.ERROR, "print found");
        CheckResult webFinding = failure("web", "no-eval", "web/app.js", 8, CheckSeverity.ERROR, "eval found");
        manager.runConformanceCheck(List.of(apiFinding, webFinding), Set.of(), 2, true);

        manager.runConformanceCheck(List.of(), Set.of("api"), 2, true);

        assertThat(manager.getViolation(ViolationIds.of(apiFinding)).orElseThrow().getStatus())
                .isEqualTo(ViolationStatus.RESOLVED);
        assertThat(manager.getViolation(ViolationIds.of(webFinding)).orElseThrow().getStatus())
                .isEqualTo(ViolationStatus.OPEN);
    }

    @Test
    void globalExemptionCountsViolationAsExempted() {
        exemptions.add(new Exemption("EX-1", "api", List.of("*"), "legacy module", "bob",
                LocalDate.parse("2026-02-01"), null, null, null, ExemptionStatus.ACTIVE,
                ExemptionScope.globalScope(), null));
        CheckResult finding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.ERROR, "print found");

        ConformanceReport report = manager.runConformanceCheck(List.of(finding), Set.of("api"), 1, true);

        assertThat(report.summary().exempted()).isEqualTo(1);
        assertThat(report.summary().failed()).isZero();
        Violation violation = manager.getViolation(ViolationIds.of(finding)).orElseThrow();
        assertThat(violation.isExempted()).isTrue();
        assertThat(violation.getExemptionId()).isEqualTo("EX-1");
        assertThat(violation.getStatus()).isEqualTo(ViolationStatus.OPEN);
    }

    @Test
    void expiredExemptionMovesViolationToExemptionExpired() {
        Exemption exemption = new Exemption("EX-2", "api", List.of("no-print"), "temporary", "bob",
                LocalDate.parse("2026-02-01"), LocalDate.parse("2026-03-10"), null, null, ExemptionStatus.ACTIVE,
                ExemptionScope.files(List.of("src/**"), null), null);
        exemptions.add(exemption);
        CheckResult finding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.ERROR, "print found");
        manager.runConformanceCheck(List.of(finding), Set.of("api"), 1, true);

        clock.set(Instant.parse("2026-03-20T10:00:00Z"));
        ConformanceReport report = manager.runConformanceCheck(List.of(finding), Set.of("api"), 1, true);

        assertThat(exemption.getStatus()).isEqualTo(ExemptionStatus.EXPIRED);
        Violation violation = manager.getViolation(ViolationIds.of(finding)).orElseThrow();
        assertThat(violation.getStatus()).isEqualTo(ViolationStatus.EXEMPTION_EXPIRED);
        assertThat(violation.isExempted()).isFalse();
        assertThat(report.summary().failed()).isEqualTo(1);
        assertThat(report.summary().exempted()).isZero();
    }

    @Test
    void secondRunCarriesTrendAgainstPreviousReport() {
        CheckResult a = failure("api", "no-print", "src/a.py", 1, CheckSeverity.ERROR, "print found");
        CheckResult b = failure("api", "no-print", "src/b.py", 1, CheckSeverity.ERROR, "print found");
        ConformanceReport first = manager.runConformanceCheck(List.of(a, b), Set.of("api"), 2, true);
        assertThat(first.trend()).isNull();

        clock.advance(Duration.ofDays(1));
        ConformanceReport second = manager.runConformanceCheck(List.of(a, pass("api", "other")), Set.of("api"), 2, true);

        assertThat(second.trend()).isNotNull();
        assertThat(second.trend().failed()).isEqualTo(-1);
        assertThat(second.trend().passed()).isEqualTo(1);
        assertThat(second.trend().isImproving()).isTrue();
        assertThat(second.bySeverity()).containsEntry("blocker", 1).containsEntry("info", 0);
        assertThat(second.byContract()).containsEntry("api", 1);
        assertThat(manager.getHistory().getLatest(10)).hasSize(2);
    }

    @Test
    void duplicateResultsInOneRunAreCountedOnce() {
        CheckResult finding = failure("api", "no-print", "src/app.py", 3, CheckSeverity.ERROR, "print found");

        ConformanceReport report = manager.runConformanceCheck(List.of(finding, finding), Set.of("api"), 1, true);

        assertThat(report.summary().failed()).isEqualTo(1);
        assertThat(manager.listViolations(ViolationQuery.all())).hasSize(1);
    }

    @Test
    void pruneDeletesOnlyOldClosedViolations() {
        ViolationStore store = new ViolationStore(manager.getLayout().violationsDir());
        Instant old = Instant.parse("2025-12-01T00:00:00Z");
        Instant recent = Instant.parse("2026-02-25T00:00:00Z");
        store.save(stored("src/a.py", ViolationStatus.RESOLVED, old));
        store.save(stored("src/b.py", ViolationStatus.STALE, old));
        store.save(stored("src/c.py", ViolationStatus.OPEN, old));
        store.save(stored("src/d.py", ViolationStatus.RESOLVED, recent));

        assertThat(manager.pruneViolations(30, true)).isEqualTo(2);
        assertThat(store.loadAll()).hasSize(4);

        assertThat(manager.pruneViolations(30, false)).isEqualTo(2);
        assertThat(store.loadAll())
                .extracting(Violation::getFile)
                .containsExactlyInAnyOrder("src/c.py", "src/d.py");
    }

    @Test
    void listViolationsFiltersAndOrdersBySeverity() {
        manager.runConformanceCheck(List.of(
                failure("api", "style", "src/a.py", 1, CheckSeverity.INFO, "minor"),
                failure("api", "no-print", "src/b.py", 1, CheckSeverity.ERROR, "blocker"),
                failure("web", "no-eval", "web/c.js", 1, CheckSeverity.WARNING, "major")), Set.of(), 3, true);

        assertThat(manager.listViolations(ViolationQuery.all()))
                .extracting(Violation::getSeverity)
                .containsExactly(ViolationSeverity.BLOCKER, ViolationSeverity.MAJOR, ViolationSeverity.MINOR);
        assertThat(manager.listViolations(ViolationQuery.all().withContract("api"))).hasSize(2);
        assertThat(manager.listViolations(ViolationQuery.all().withFilePattern("web/**"))).hasSize(1);
        assertThat(manager.listViolations(ViolationQuery.all().withSeverity(ViolationSeverity.MINOR)))
                .extracting(Violation::getFile).containsExactly("src/a.py");
        assertThat(manager.listViolations(ViolationQuery.all().withLimit(1))).hasSize(1);
    }

    @Test
    void filePatternsUseTheSameGlobsAsCheckScopes() {
        manager.runConformanceCheck(List.of(
                failure("api", "no-print", "src/app.py", 1, CheckSeverity.ERROR, "top"),
                failure("api", "no-print", "src/pkg/deep.py", 1, CheckSeverity.ERROR, "nested")), Set.of(), 2, true);

        assertThat(manager.listViolations(ViolationQuery.all().withFilePattern("src/*")))
                .extracting(Violation::getFile).containsExactly("src/app.py");
        assertThat(manager.listViolations(ViolationQuery.all().withFilePattern("src/**")))
                .extracting(Violation::getFile).containsExactlyInAnyOrder("src/app.py", "src/pkg/deep.py");
        assertThat(manager.listViolations(ViolationQuery.all().withFilePattern("*.py"))).hasSize(2);
    }

    @Test
    void resolvingUnknownViolationFails() {
        assertThatThrownBy(() -> manager.resolveViolation("V-000000000000", "gone", "alice"))
                .isInstanceOf(ConformanceStateException.class)
                .hasMessage("Unknown violation: V-000000000000");
    }

    @Test
    void summaryStatsCountStatusesAndExemptions() {
        exemptions.add(new Exemption("EX-3", "*", List.of("*"), "review soon", "bob",
                LocalDate.parse("2026-01-01"), null, LocalDate.parse("2026-02-01"), null, ExemptionStatus.ACTIVE,
                ExemptionScope.files(List.of("docs/**"), null), null));
        CheckResult a = failure("api", "no-print", "src/a.py", 1, CheckSeverity.ERROR, "print found");
        CheckResult b = failure("api", "no-print", "src/b.py", 1, CheckSeverity.WARNING, "print found");
        manager.runConformanceCheck(List.of(a, b), Set.of("api"), 2, true);
        manager.runConformanceCheck(List.of(a, pass("api", "other")), Set.of("api"), 2, true);

        ConformanceStats stats = manager.getSummaryStats();

        assertThat(stats.total()).isEqualTo(2);
        assertThat(stats.open()).isEqualTo(1);
        assertThat(stats.resolved()).isEqualTo(1);
        assertThat(stats.bySeverity()).containsEntry("blocker", 1);
        assertThat(stats.activeExemptions()).isEqualTo(1);
        assertThat(stats.exemptionsNeedingReview()).isEqualTo(1);
        assertThat(stats.lastRun()).isEqualTo(clock.instant());
        assertThat(stats.complianceRate()).isEqualTo(0.5);
    }

    private static Violation stored(String file, ViolationStatus status, Instant lastSeen) {
        CheckResult result = failure("api", "no-print", file, 1, CheckSeverity.ERROR, "print found");
        Violation violation = Violation.detected(ViolationIds.of(result), result, lastSeen);
        violation.setStatus(status);
        return violation;
    }
}
