package dev.contractgate.core.ci;

import dev.contractgate.core.baseline.BaselineComparison;
import dev.contractgate.core.baseline.BaselineManager;
import dev.contractgate.core.check.CheckExecutor;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.FileIndex;
import dev.contractgate.core.conformance.ConformanceManager;
import dev.contractgate.core.conformance.ViolationIds;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.contract.Contract;
import dev.contractgate.core.exception.BaselineException;
import dev.contractgate.core.exception.ConfigException;
import dev.contractgate.core.exception.GitException;
import dev.contractgate.core.exemption.ExemptionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs contracts for CI and turns the outcome into an exit code.
 * <p>
 * Exit code policy, first match wins:
 * <ol>
 *   <li>error count above {@code total_errors_exceed}: violations found</li>
 *   <li>ratchet mode with a baseline comparison: fail only on a positive net change</li>
 *   <li>baseline comparison: fail on new errors (and new warnings when configured)</li>
 *   <li>otherwise: fail on any violation at or above {@code min_severity}</li>
 * </ol>
 */
public class CIRunner {

    private static final Logger logger = LoggerFactory.getLogger(CIRunner.class);

    static final String RUNTIME_FILE = "<runtime>";

    private static final Comparator<CIViolation> VIOLATION_ORDER = Comparator
            .comparing((CIViolation v) -> v.severity().rank())
            .thenComparing(CIViolation::checkId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CIViolation::filePath, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CIViolation::line, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CIViolation::message, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Path repoRoot;
    private final CIConfig config;
    private final CheckExecutor executor;
    private final BaselineManager baselineManager;
    private final CheckCache cache;
    private final GitHelper git;
    private final Clock clock;
    private ExemptionResolver exemptions;
    private ConformanceManager conformanceManager;

    /**
     * Create a runner whose baseline, cache and git helper follow the config.
     */
    public CIRunner(Path repoRoot, CIConfig config, CheckExecutor executor) {
        this(repoRoot, config, executor,
                new BaselineManager(repoRoot.resolve(config.getBaselinePath())),
                config.isCacheEnabled()
                        ? new CheckCache(repoRoot.resolve(config.getCachePath()), Duration.ofHours(config.getCacheTtlHours()))
                        : null,
                new GitHelper(repoRoot),
                Clock.systemUTC());
    }

    /**
     * @param cache check cache, null to disable caching
     */
    public CIRunner(Path repoRoot, CIConfig config, CheckExecutor executor, BaselineManager baselineManager,
                    CheckCache cache, GitHelper git, Clock clock) {
        this.repoRoot = repoRoot;
        this.config = config;
        this.executor = executor;
        this.baselineManager = baselineManager;
        this.cache = cache;
        this.git = git;
        this.clock = clock;
    }

    /**
     * Drop violations covered by an active exemption from the gating set.
     */
    public CIRunner withExemptions(ExemptionResolver resolver) {
        this.exemptions = resolver;
        return this;
    }

    /**
     * Also feed every run into the violation lifecycle; a FULL run counts as a full run.
     */
    public CIRunner withConformanceManager(ConformanceManager manager) {
        this.conformanceManager = manager;
        return this;
    }

    /**
     * Run the given (resolved) contracts. Never throws: failures surface as an exit code.
     */
    public CIResult run(List<Contract> contracts) {
        Instant startedAt = clock.instant();
        try {
            List<String> candidates = getFilesToCheck();
            List<Contract> applicable = filterContracts(contracts, candidates);
            FileIndex index = candidates == null ? FileIndex.scan(repoRoot) : FileIndex.of(repoRoot, candidates);

            List<CheckTask> tasks = new ArrayList<>();
            for (Contract contract : applicable) {
                contract.enabledChecks().forEach(check -> tasks.add(new CheckTask(contract, check)));
            }
            logger.info("CI run ({}): {} contracts, {} checks, {} files", config.getMode().value(),
                    applicable.size(), tasks.size(), index.files().size());

            List<CheckResult> results = executeChecks(tasks, index);

            List<CIViolation> violations = new ArrayList<>();
            List<CheckResult> passed = new ArrayList<>();
            int exempted = 0;
            for (CheckResult result : results) {
                if (result.passed()) {
                    passed.add(result);
                } else if (isExempted(result)) {
                    exempted++;
                } else {
                    violations.add(CIViolation.from(result));
                }
            }
            violations.sort(VIOLATION_ORDER);

            if (conformanceManager != null) {
                List<String> names = applicable.stream().map(Contract::name).toList();
                conformanceManager.runConformanceCheck(results, names, index.files().size(), config.getMode() == CIMode.FULL);
            }

            BaselineComparison comparison = null;
            if (config.getMode() == CIMode.PR || config.isRatchetEnabled()) {
                comparison = baselineManager.compare(violations);
            }
            ExitCode exitCode = determineExitCode(violations, comparison);

            CIResult result = new CIResult(config.getMode(), exitCode, List.copyOf(violations), comparison,
                    List.copyOf(passed), exempted, index.files().size(), tasks.size(), startedAt, clock.instant(),
                    currentSha(), config.getBaseRef(), config.getHeadRef(), List.of());
            logger.info("CI run finished with exit code {} ({} violations, {} exempted)",
                    exitCode.code(), violations.size(), exempted);
            return result;
        } catch (BaselineException e) {
            logger.warn("CI run aborted: {}", e.getMessage());
            return errorResult(ExitCode.BASELINE_NOT_FOUND, e, startedAt);
        } catch (ConfigException e) {
            logger.warn("CI run aborted: {}", e.getMessage());
            return errorResult(ExitCode.CONFIG_ERROR, e, startedAt);
        } catch (RuntimeException e) {
            logger.warn("CI run failed", e);
            return errorResult(ExitCode.RUNTIME_ERROR, e, startedAt);
        }
    }

    /**
     * Candidate files for the configured mode.
     *
     * @return the files to check, or null to scan the whole repository
     */
    public List<String> getFilesToCheck() {
        if (config.getMode() == CIMode.FULL) {
            return null;
        }
        if (config.getIncrementalPaths() != null && !config.getIncrementalPaths().isEmpty()) {
            return List.copyOf(new LinkedHashSet<>(config.getIncrementalPaths()));
        }
        if (config.getBaseRef() != null) {
            try {
                return git.getChangedFiles(config.getBaseRef(), config.getHeadRef() == null ? "HEAD" : config.getHeadRef());
            } catch (GitException e) {
                logger.warn("Cannot diff {}...{}, falling back to a full scan: {}", config.getBaseRef(),
                        config.getHeadRef(), e.getMessage());
                return null;
            }
        }
        return null;
    }

    /**
     * Exit code for a set of gating violations.
     */
    public ExitCode determineExitCode(List<CIViolation> violations, BaselineComparison comparison) {
        Integer threshold = config.getTotalErrorsThreshold();
        if (threshold != null && violations.stream().filter(CIViolation::isError).count() > threshold) {
            return ExitCode.VIOLATIONS_FOUND;
        }
        if (config.isRatchetEnabled() && comparison != null) {
            return comparison.shouldFailRatchet() ? ExitCode.VIOLATIONS_FOUND : ExitCode.SUCCESS;
        }
        if (comparison != null) {
            return comparison.shouldFail(config.isFailOnNewErrors(), config.isFailOnNewWarnings())
                    ? ExitCode.VIOLATIONS_FOUND : ExitCode.SUCCESS;
        }
        CheckSeverity minimum = config.getMinSeverity();
        boolean failing = violations.stream().anyMatch(v -> v.severity().rank() <= minimum.rank());
        return failing ? ExitCode.VIOLATIONS_FOUND : ExitCode.SUCCESS;
    }

    public CIConfig getConfig() {
        return config;
    }

    public Path getRepoRoot() {
        return repoRoot;
    }

    private List<Contract> filterContracts(List<Contract> contracts, List<String> candidates) {
        if (candidates == null) {
            return contracts;
        }
        return contracts.stream()
                .filter(contract -> contract.enabledChecks().stream()
                        .anyMatch(check -> candidates.stream().anyMatch(check.scope()::includes)))
                .toList();
    }

    private List<CheckResult> executeChecks(List<CheckTask> tasks, FileIndex index) {
        if (!config.isParallelEnabled() || tasks.size() < 2) {
            List<CheckResult> results = new ArrayList<>();
            for (CheckTask task : tasks) {
                results.addAll(runGuarded(task, index));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getMaxWorkers(), tasks.size()));
        try {
            List<Future<List<CheckResult>>> futures = new ArrayList<>();
            for (CheckTask task : tasks) {
                futures.add(pool.submit(() -> runCheck(task, index)));
            }
            List<CheckResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.addAll(futures.get(i).get());
                } catch (ExecutionException e) {
                    results.add(runtimeFailure(tasks.get(i), e.getCause()));
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for checks", e);
        } finally {
            pool.shutdownNow();
        }
    }

    // same conversion the pool applies to a crashed task
    private List<CheckResult> runGuarded(CheckTask task, FileIndex index) {
        try {
            return runCheck(task, index);
        } catch (RuntimeException | Error e) {
            return List.of(runtimeFailure(task, e));
        }
    }

    private List<CheckResult> runCheck(CheckTask task, FileIndex index) {
        boolean cacheable = cache != null && config.getMode() != CIMode.FULL && !index.isFullScan();
        String key = null;
        if (cacheable) {
            key = CheckCache.key(task.contract().name() + "/" + task.check().id(), repoRoot,
                    index.select(task.check().scope()));
            Optional<CheckCache.CachedResult> cached = cache.get(key);
            if (cached.isPresent()) {
                logger.debug("Cache hit for {}/{}", task.contract().name(), task.check().id());
                List<CheckResult> results = new ArrayList<>();
                cached.get().violations().forEach(v -> results.add(v.toCheckResult()));
                for (int i = 0; i < cached.get().passed(); i++) {
                    results.add(CheckResult.passed(task.contract().name(), task.check()));
                }
                return results;
            }
        }

        List<CheckResult> results = executor.execute(task.contract(), task.check(), index);
        if (cacheable) {
            cache.put(key, results.stream().filter(CheckResult::failed).map(CIViolation::from).toList(),
                    (int) results.stream().filter(CheckResult::passed).count());
        }
        return results;
    }

    private CheckResult runtimeFailure(CheckTask task, Throwable cause) {
        logger.warn("Check {}/{} crashed", task.contract().name(), task.check().id(), cause);
        return new CheckResult(task.contract().name(), task.check().id(), RUNTIME_FILE, null, CheckSeverity.ERROR,
                false, "Check execution failed: " + cause, null, null);
    }

    private boolean isExempted(CheckResult result) {
        if (exemptions == null) {
            return false;
        }
        return exemptions.find(result.contractId(), result.checkId(), result.file(), result.line(),
                ViolationIds.of(result)).isPresent();
    }

    private String currentSha() {
        try {
            return git.getCurrentSha();
        } catch (GitException e) {
            logger.debug("No commit sha available: {}", e.getMessage());
            return null;
        }
    }

    private CIResult errorResult(ExitCode exitCode, RuntimeException error, Instant startedAt) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return new CIResult(config.getMode(), exitCode, List.of(), null, List.of(), 0, 0, 0, startedAt,
                clock.instant(), null, config.getBaseRef(), config.getHeadRef(), List.of(message));
    }

    private record CheckTask(Contract contract, CheckDefinition check) {
    }
}
