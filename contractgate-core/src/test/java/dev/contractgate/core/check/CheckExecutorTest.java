package dev.contractgate.core.check;

import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.contract.Contract;
import dev.contractgate.core.exception.CheckExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static dev.contractgate.core.Fixtures.check;
import static dev.contractgate.core.Fixtures.contract;
import static dev.contractgate.core.Fixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class CheckExecutorTest {

    @TempDir
    Path root;

    @Test
    void defaultHandlersCoverTheBuiltInTypes() {
        CheckExecutor executor = CheckExecutor.withDefaultHandlers();

        assertThat(executor.supportedTypes()).containsExactly(
                "circular-import", "command", "constructor-injection", "custom", "domain-purity",
                "file-exists", "layer-import", "pattern", "structural-metric");
        assertThat(executor.handlerFor("regex")).isPresent();
        assertThat(executor.handlerFor("ast_check")).isPresent();
        assertThat(executor.handlerFor("nested-contract")).isEmpty();
    }

    @Test
    void unknownTypeBecomesAnErrorResult() {
        CheckDefinition check = check("id: odd", "type: mystery", "severity: info");

        List<CheckResult> results = CheckExecutor.withDefaultHandlers()
                .execute(contract("team"), check, FileIndex.of(root, List.of()));

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.contractId()).isEqualTo("team");
            assertThat(r.checkId()).isEqualTo("odd");
            assertThat(r.severity()).isEqualTo(CheckSeverity.ERROR);
            assertThat(r.message()).isEqualTo("Unknown check type: 'mystery'");
        });
    }

    @Test
    void cleanCheckYieldsOnePassingResult() {
        write(root, "app.py", "x = 1\n");
        CheckDefinition check = check("id: no-todo", "type: pattern", "pattern: TODO");

        List<CheckResult> results = CheckExecutor.withDefaultHandlers()
                .execute(contract("team", check), check, root, null);

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.passed()).isTrue();
            assertThat(r.contractId()).isEqualTo("team");
            assertThat(r.message()).isEqualTo("Check passed");
        });
    }

    @Test
    void handlerFaultsAreContainedToTheirCheck() {
        CheckExecutor executor = new CheckExecutor()
                .register(stub("declared-failure", (check, repoRoot, files) -> {
                    throw new CheckExecutionException(check.id(), "tool missing");
                }))
                .register(stub("crashing", (check, repoRoot, files) -> {
                    throw new IllegalStateException("boom");
                }));
        Contract contract = contract("team",
                check("id: a", "type: declared-failure"),
                check("id: b", "type: crashing"));

        List<CheckResult> results = executor.executeContract(contract, FileIndex.of(root, List.of()));

        assertThat(results)
                .extracting(CheckResult::checkId, CheckResult::message)
                .containsExactly(
                        tuple("a", "Check execution failed: tool missing"),
                        tuple("b", "Check execution failed: java.lang.IllegalStateException: boom"));
    }

    @Test
    void stackOverflowIsContainedButOtherVirtualMachineErrorsPropagate() {
        CheckExecutor executor = new CheckExecutor()
                .register(stub("recursive", (check, repoRoot, files) -> {
                    throw new StackOverflowError();
                }))
                .register(stub("hungry", (check, repoRoot, files) -> {
                    throw new OutOfMemoryError("heap");
                }));
        CheckDefinition recursive = check("id: deep", "type: recursive", "severity: info");
        CheckDefinition hungry = check("id: big", "type: hungry");
        FileIndex index = FileIndex.of(root, List.of());

        assertThat(executor.execute(contract("team", recursive), recursive, index)).singleElement().satisfies(r -> {
            assertThat(r.severity()).isEqualTo(CheckSeverity.ERROR);
            assertThat(r.message()).isEqualTo("Check execution failed: java.lang.StackOverflowError");
        });
        assertThatThrownBy(() -> executor.execute(contract("team", hungry), hungry, index))
                .isInstanceOf(OutOfMemoryError.class);
    }

    @Test
    void deeplyNestedSourceBecomesAnErrorResult() throws InterruptedException {
        StringBuilder source = new StringBuilder("def deep(x):\n");
        for (int level = 1; level <= 2000; level++) {
            source.append(" ".repeat(level)).append("if x:\n");
        }
        source.append(" ".repeat(2001)).append("pass\n");
        write(root, "deep.py", source.toString());
        CheckDefinition check = check("id: branches", "type: structural-metric",
                "metric: cyclomatic_complexity", "max: 4");
        CheckExecutor executor = CheckExecutor.withDefaultHandlers();
        Contract contract = contract("team", check);
        executor.execute(contract, check, FileIndex.of(root, List.of()));
        AtomicReference<Object> outcome = new AtomicReference<>();

        // small stack so the tree walk overflows regardless of the JVM default
        Thread worker = new Thread(null, () -> {
            try {
                outcome.set(executor.execute(contract, check, root, null));
            } catch (Throwable t) {
                outcome.set(t);
            }
        }, "small-stack", 256 * 1024);
        worker.start();
        worker.join();

        assertThat(outcome.get()).isInstanceOf(List.class);
        assertThat((List<?>) outcome.get()).singleElement()
                .isInstanceOfSatisfying(CheckResult.class, r -> {
                    assertThat(r.severity()).isEqualTo(CheckSeverity.ERROR);
                    assertThat(r.message()).isEqualTo("Check execution failed: java.lang.StackOverflowError");
                });
    }

    @Test
    void resultsAreOwnedByContractAndCheck() {
        CheckExecutor executor = new CheckExecutor().register(stub("anonymous", (check, repoRoot, files) ->
                List.of(new CheckResult(null, null, "a.py", 3, CheckSeverity.WARNING, false, "found", null, null))));
        CheckDefinition check = check("id: anon", "type: anonymous");

        assertThat(executor.execute(contract("team", check), check, FileIndex.of(root, List.of())))
                .extracting(CheckResult::contractId, CheckResult::checkId)
                .containsExactly(tuple("team", "anon"));
    }

    @Test
    void handlersOnlySeeFilesInScope() {
        write(root, "src/app.py", "");
        write(root, "src/gen/models.py", "");
        write(root, "docs/index.md", "");
        CheckExecutor executor = new CheckExecutor().register(stub("listing", (check, repoRoot, files) ->
                files.stream().map(f -> CheckResult.failure(check, f, null, "seen")).toList()));
        CheckDefinition check = check(
                "id: list",
                "type: listing",
                "applies_to:",
                "  paths: ['src/**']",
                "  exclude_paths: ['src/gen/**']");

        assertThat(executor.execute(contract("team", check), check, root, null))
                .extracting(CheckResult::file)
                .containsExactly("src/app.py");
    }

    @Test
    void executeAllSortsBySeverityThenCheck() {
        CheckExecutor executor = new CheckExecutor().register(stub("fixed", (check, repoRoot, files) ->
                List.of(CheckResult.failure(check, "f.py", 1, check.id()))));
        Contract first = contract("first",
                check("id: z-info", "type: fixed", "severity: info"),
                check("id: b-warning", "type: fixed", "severity: warning"));
        Contract second = contract("second",
                check("id: a-warning", "type: fixed", "severity: warning"),
                check("id: c-error", "type: fixed", "severity: error"));

        assertThat(executor.executeAll(List.of(first, second), FileIndex.of(root, List.of())))
                .extracting(CheckResult::checkId)
                .containsExactly("c-error", "a-warning", "b-warning", "z-info");
    }

    @Test
    void disabledChecksAreSkipped() {
        CheckExecutor executor = CheckExecutor.withDefaultHandlers();
        Contract contract = contract("team",
                check("id: off", "type: pattern", "enabled: false", "pattern: x"),
                check("id: on", "type: file-exists"));

        assertThat(executor.executeContract(contract, FileIndex.of(root, List.of())))
                .extracting(CheckResult::checkId)
                .containsExactly("on");
    }

    private interface Behaviour {
        List<CheckResult> run(CheckDefinition check, Path repoRoot, List<String> files);
    }

    private static CheckHandler stub(String type, Behaviour behaviour) {
        return new CheckHandler() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
                return behaviour.run(check, repoRoot, files);
            }
        };
    }
}
