package dev.contractgate.core.conformance;

import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.exception.ConformanceStateException;
import dev.contractgate.core.exemption.Exemption;
import dev.contractgate.core.exemption.ExemptionResolver;
import dev.contractgate.core.exemption.ExemptionStatus;
import dev.contractgate.core.history.HistorySnapshot;
import dev.contractgate.core.history.HistoryStore;
import dev.contractgate.core.util.AtomicFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs the violation lifecycle over the results of a check run and persists the outcome.
 * <p>
 * A violation that is not re-detected becomes RESOLVED after a full run and STALE after an
 * incremental one. Re-detection reopens it. Only {@link #pruneViolations(int, boolean)}
 * deletes violations.
 */
public class ConformanceManager {

    private static final Logger logger = LoggerFactory.getLogger(ConformanceManager.class);

    static final String SYSTEM_RESOLVER = "contractgate";
    private static final String GITIGNORE_ENTRY = ".contractgate/" + ConformanceLayout.LOCAL_FILE;

    private final ConformanceLayout layout;
    private final ViolationStore violations;
    private final ReportStore reports;
    private final HistoryStore history;
    private final Supplier<ExemptionResolver> exemptions;
    private final Clock clock;

    public ConformanceManager(Path repoRoot, ExemptionResolver exemptions) {
        this(repoRoot, () -> exemptions, HistoryStore.DEFAULT_RETENTION_DAYS, Clock.systemDefaultZone());
    }

    public ConformanceManager(Path repoRoot, Supplier<ExemptionResolver> exemptions, int historyRetentionDays, Clock clock) {
        this.layout = new ConformanceLayout(repoRoot);
        this.violations = new ViolationStore(layout.violationsDir());
        this.reports = new ReportStore(layout.reportFile());
        this.history = new HistoryStore(layout.historyDir(), historyRetentionDays, clock);
        this.exemptions = exemptions;
        this.clock = clock;
    }

    public boolean isInitialized() {
        return Files.isDirectory(layout.violationsDir()) && Files.isRegularFile(layout.reportFile());
    }

    /**
     * Create the state directories, the ignore rule for local-only state and an empty report.
     *
     * @param force re-initialize an existing layout
     * @throws ConformanceStateException when already initialized and not forced
     */
    public void initialize(boolean force) {
        if (isInitialized() && !force) {
            throw new ConformanceStateException("Conformance state already initialized at " + layout.stateDir());
        }
        try {
            for (Path dir : List.of(layout.violationsDir(), layout.exemptionsDir(), layout.historyDir())) {
                Files.createDirectories(dir);
            }
            Path keep = layout.violationsDir().resolve(".gitkeep");
            if (!Files.exists(keep)) {
                Files.createFile(keep);
            }
            addIgnoreRule();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot initialize " + layout.stateDir(), e);
        }
        reports.save(ConformanceReport.initial(clock.instant()));
        logger.info("Initialized conformance state at {}", layout.stateDir());
    }

    /**
     * Apply the results of one check run to the stored violations.
     *
     * @param results every result of the run, passing and failing
     * @param contractsChecked contracts that were executed; only their violations can be closed
     * @param filesChecked number of files the run covered
     * @param fullRun whether the whole repository was scanned
     * @return the persisted report
     */
    public ConformanceReport runConformanceCheck(List<CheckResult> results, Collection<String> contractsChecked,
                                                 int filesChecked, boolean fullRun) {
        Instant now = clock.instant();
        Map<String, Violation> stored = new LinkedHashMap<>();
        violations.loadAll().forEach(v -> stored.put(v.getId(), v));
        Set<String> dirty = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();

        int passed = 0;
        int created = 0;
        for (CheckResult result : results) {
            if (result.passed()) {
                passed++;
                continue;
            }
            String id = ViolationIds.of(result);
            if (!seen.add(id)) {
                continue;
            }
            Violation existing = stored.get(id);
            if (existing != null) {
                existing.refresh(result, now);
            } else {
                stored.put(id, Violation.detected(id, result, now));
                created++;
            }
            dirty.add(id);
        }

        Set<String> scope = new HashSet<>(contractsChecked);
        for (Violation violation : stored.values()) {
            if (seen.contains(violation.getId()) || !inScope(violation, scope)) {
                continue;
            }
            ViolationStatus status = violation.getStatus();
            if (fullRun && status != ViolationStatus.RESOLVED) {
                violation.resolve(new Resolution(now, SYSTEM_RESOLVER, "Not detected in full run"));
                dirty.add(violation.getId());
            } else if (!fullRun && status.isActive()) {
                violation.markStale();
                dirty.add(violation.getId());
            }
        }

        applyExemptions(stored.values(), dirty);
        dirty.forEach(id -> violations.save(stored.get(id)));

        ConformanceReport report = buildReport(stored.values(), passed, contractsChecked, filesChecked, fullRun, now);
        reports.save(report);
        history.record(new HistorySnapshot(LocalDate.now(clock), now, report.runId(), report.summary(),
                report.bySeverity(), report.byContract()));
        history.pruneOldSnapshots();

        ConformanceSummary summary = report.summary();
        logger.info("Conformance run {} ({}): {} new, {} failed, {} exempted, {} stale, {} passed",
                report.runId(), report.runType().value(), created, summary.failed(), summary.exempted(),
                summary.stale(), summary.passed());
        return report;
    }

    /**
     * Stored violations matching the query, most severe first.
     */
    public List<Violation> listViolations(ViolationQuery query) {
        return violations.loadAll().stream()
                .filter(query::matches)
                .sorted(ViolationStore.SEVERITY_ORDER)
                .limit(query.effectiveLimit())
                .toList();
    }

    public List<Violation> listViolations(ViolationStatus status, ViolationSeverity severity, String contractId,
                                          String filePattern, Integer limit) {
        return listViolations(new ViolationQuery(status, severity, contractId, filePattern, limit));
    }

    public Optional<Violation> getViolation(String id) {
        return violations.get(id);
    }

    /**
     * Mark a violation as resolved by hand.
     *
     * @throws ConformanceStateException when no violation has this id
     */
    public Violation resolveViolation(String id, String reason, String resolvedBy) {
        Violation violation = violations.get(id)
                .orElseThrow(() -> new ConformanceStateException("Unknown violation: " + id));
        violation.resolve(new Resolution(clock.instant(), resolvedBy, reason));
        violations.save(violation);
        logger.info("Violation {} resolved by {}: {}", id, resolvedBy, reason);
        return violation;
    }

    public Violation resolveViolation(String id, String reason) {
        return resolveViolation(id, reason, System.getProperty("user.name", "unknown"));
    }

    /**
     * Delete resolved and stale violations last seen more than {@code olderThanDays} days ago.
     * Open violations are never pruned.
     *
     * @return the number of violations deleted, or that would be deleted on a dry run
     */
    public int pruneViolations(int olderThanDays, boolean dryRun) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
        List<Violation> candidates = violations.loadAll().stream()
                .filter(v -> v.getStatus() == ViolationStatus.RESOLVED || v.getStatus() == ViolationStatus.STALE)
                .filter(v -> v.getLastSeen() != null && v.getLastSeen().isBefore(cutoff))
                .toList();
        if (!dryRun) {
            candidates.forEach(v -> violations.delete(v.getId()));
        }
        logger.info("{} {} violations last seen before {}", dryRun ? "Would prune" : "Pruned", candidates.size(), cutoff);
        return candidates.size();
    }

    public ConformanceStats getSummaryStats() {
        Map<ViolationStatus, Integer> byStatus = violations.countByStatus();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        violations.countBySeverity().forEach((severity, count) -> bySeverity.put(severity.value(), count));
        int total = byStatus.values().stream().mapToInt(Integer::intValue).sum();

        ExemptionResolver resolver = exemptions.get();
        Optional<ConformanceReport> last = reports.load().filter(r -> r.runId() != null);
        return new ConformanceStats(
                total,
                byStatus.get(ViolationStatus.OPEN),
                byStatus.get(ViolationStatus.RESOLVED),
                byStatus.get(ViolationStatus.STALE),
                byStatus.get(ViolationStatus.EXEMPTION_EXPIRED),
                bySeverity,
                resolver.getActive().size(),
                resolver.getExpired().size(),
                resolver.getNeedsReview().size(),
                last.map(ConformanceReport::generatedAt).orElse(null),
                last.map(r -> r.summary().complianceRate()).orElse(1.0));
    }

    public Optional<ConformanceReport> getLatestReport() {
        return reports.load();
    }

    public HistoryStore getHistory() {
        return history;
    }

    public ConformanceLayout getLayout() {
        return layout;
    }

    private void applyExemptions(Collection<Violation> all, Set<String> dirty) {
        ExemptionResolver resolver = exemptions.get();
        Set<String> expired = resolver.audit().stream().map(Exemption::getId).collect(Collectors.toSet());

        for (Violation violation : all) {
            if (!violation.getStatus().isActive()) {
                continue;
            }
            String before = violation.getStatus() + "/" + violation.getExemptionId() + "/" + violation.isExempted();
            Optional<Exemption> match = resolver.find(violation.getContractId(), violation.getCheckId(),
                    violation.getFile(), violation.getLine(), violation.getId());
            if (match.isPresent()) {
                violation.setStatus(ViolationStatus.OPEN);
                violation.exemptBy(match.get().getId());
            } else if (violation.getExemptionId() != null && exemptionExpired(resolver, violation.getExemptionId(), expired)) {
                violation.setStatus(ViolationStatus.EXEMPTION_EXPIRED);
                violation.setExempted(false);
            } else if (violation.getStatus() == ViolationStatus.OPEN) {
                violation.clearExemption();
            }
            String after = violation.getStatus() + "/" + violation.getExemptionId() + "/" + violation.isExempted();
            if (!before.equals(after)) {
                dirty.add(violation.getId());
            }
        }
    }

    private static boolean exemptionExpired(ExemptionResolver resolver, String exemptionId, Set<String> justExpired) {
        if (justExpired.contains(exemptionId)) {
            return true;
        }
        return resolver.get(exemptionId).map(e -> e.getStatus() == ExemptionStatus.EXPIRED).orElse(false);
    }

    private ConformanceReport buildReport(Collection<Violation> all, int passed, Collection<String> contractsChecked,
                                          int filesChecked, boolean fullRun, Instant now) {
        int failed = 0;
        int exempted = 0;
        int stale = 0;
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (ViolationSeverity severity : ViolationSeverity.values()) {
            bySeverity.put(severity.value(), 0);
        }
        Map<String, Integer> byContract = new TreeMap<>();
        for (Violation violation : all) {
            if (violation.isFailing()) {
                failed++;
                bySeverity.merge(violation.getSeverity().value(), 1, Integer::sum);
                byContract.merge(violation.getContractId(), 1, Integer::sum);
            } else if (violation.getStatus() == ViolationStatus.OPEN && violation.isExempted()) {
                exempted++;
            } else if (violation.getStatus() == ViolationStatus.STALE) {
                stale++;
            }
        }
        ConformanceSummary summary = ConformanceSummary.of(passed, failed, exempted, stale);
        TrendDelta trend = reports.load()
                .filter(previous -> previous.runId() != null)
                .map(previous -> TrendDelta.between(summary, previous.summary()))
                .orElse(null);
        List<String> contracts = contractsChecked.stream().distinct().sorted().toList();
        return new ConformanceReport(ConformanceReport.SCHEMA_VERSION, now, newRunId(now), RunType.of(fullRun),
                summary, bySeverity, byContract, contracts, filesChecked, trend);
    }

    private static String newRunId(Instant now) {
        return "run-" + now.getEpochSecond() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static boolean inScope(Violation violation, Set<String> contractsChecked) {
        return contractsChecked.isEmpty() || contractsChecked.contains(violation.getContractId());
    }

    private void addIgnoreRule() throws IOException {
        Path gitignore = layout.gitignore();
        String existing = Files.isRegularFile(gitignore) ? Files.readString(gitignore, StandardCharsets.UTF_8) : "";
        if (existing.lines().anyMatch(line -> line.trim().equals(GITIGNORE_ENTRY))) {
            return;
        }
        String prefix = existing.isEmpty() || existing.endsWith("\n") ? existing : existing + "\n";
        AtomicFileWriter.write(gitignore, prefix + GITIGNORE_ENTRY + "\n");
    }
}
