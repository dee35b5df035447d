package dev.contractgate.core.check.handler;

import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.exception.CheckExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static dev.contractgate.core.Fixtures.check;
import static dev.contractgate.core.Fixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@DisabledOnOs(OS.WINDOWS)
class CommandCheckHandlerTest {

    @TempDir
    Path root;

    private final CommandCheckHandler handler = new CommandCheckHandler();

    @Test
    void zeroExitPasses() {
        assertThat(handler.execute(check("id: ok", "type: command", "command: 'true'"), root, List.of())).isEmpty();
    }

    @Test
    void nonZeroExitFailsWithOutputTail() {
        CheckDefinition check = check(
                "id: lint",
                "type: command",
                "severity: error",
                "fix_hint: Run the linter locally",
                "command: 'echo boom; exit 3'");

        List<CheckResult> results = handler.execute(check, root, List.of());

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.message()).isEqualTo("Command failed with exit code 3\nboom");
            assertThat(r.severity()).isEqualTo(CheckSeverity.ERROR);
            assertThat(r.fixHint()).isEqualTo("Run the linter locally");
            assertThat(r.file()).isNull();
        });
    }

    @Test
    void expectedExitCodeAndArgsAreHonoured() {
        CheckDefinition check = check(
                "id: custom-exit",
                "type: command",
                "command: exit",
                "args: ['2']",
                "expected_exit_code: 2");

        assertThat(handler.execute(check, root, List.of())).isEmpty();
    }

    @Test
    void runsInTheWorkingDirectory() {
        write(root, "tools/marker.txt", "here");
        CheckDefinition check = check(
                "id: in-dir",
                "type: command",
                "working_dir: tools",
                "command: 'test -f marker.txt'");

        assertThat(handler.execute(check, root, List.of())).isEmpty();
    }

    @Test
    void indicatorsOverrideTheExitCode() {
        CheckDefinition failing = check(
                "id: tests",
                "type: command",
                "command: 'echo 3 FAILED'",
                "failure_indicators: [FAILED]");
        CheckDefinition passing = check(
                "id: flaky",
                "type: command",
                "command: 'echo all good; exit 1'",
                "success_indicators: [all good]",
                "message: Tool reported problems");

        assertThat(handler.execute(failing, root, List.of())).singleElement()
                .extracting(CheckResult::message).asString().startsWith("Command failed with exit code 0");
        assertThat(handler.execute(passing, root, List.of())).isEmpty();
    }

    @Test
    void errorParserTurnsOutputIntoLocatedResults() {
        CheckDefinition check = check(
                "id: typecheck",
                "type: command",
                "command: \"echo 'src/a.py:12: bad thing'; echo 'src/b.py:3: worse'; exit 1\"",
                "error_parser:",
                "  pattern: '(?<file>[^:\\s]+):(?<line>\\d+): (?<message>.*)'");

        List<CheckResult> results = handler.execute(check, root, List.of());

        assertThat(results)
                .extracting(CheckResult::file, CheckResult::line, CheckResult::message)
                .containsExactly(
                        tuple("src/a.py", 12, "bad thing"),
                        tuple("src/b.py", 3, "worse"));
    }

    @Test
    void timeoutYieldsAnErrorResult() {
        CheckDefinition check = check(
                "id: slow",
                "type: command",
                "severity: info",
                "command: 'sleep 5'",
                "timeout: 1");

        assertThat(handler.execute(check, root, List.of())).singleElement().satisfies(r -> {
            assertThat(r.message()).isEqualTo("Command timed out after 1s");
            assertThat(r.severity()).isEqualTo(CheckSeverity.ERROR);
        });
    }

    @Test
    void timeoutKillsProcessesSpawnedByTheShell() throws InterruptedException {
        CheckDefinition check = check(
                "id: hung",
                "type: command",
                "command: 'sleep 41.75; true'",
                "timeout: 1");

        assertThat(handler.execute(check, root, List.of())).singleElement()
                .extracting(CheckResult::message).isEqualTo("Command timed out after 1s");

        long deadline = System.currentTimeMillis() + 5000;
        while (runningWith("sleep 41.75") > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        assertThat(runningWith("sleep 41.75")).isZero();
    }

    @Test
    void outputLargerThanThePipeBufferIsDrained() {
        CheckDefinition check = check(
                "id: chatty",
                "type: command",
                "command: 'seq 1 50000; exit 4'",
                "timeout: 20");

        assertThat(handler.execute(check, root, List.of())).singleElement()
                .extracting(CheckResult::message).asString()
                .startsWith("Command failed with exit code 4\n")
                .endsWith("49999\n50000");
    }

    @Test
    void missingExecutableYieldsAnErrorResult() {
        CheckDefinition check = check(
                "id: missing",
                "type: command",
                "command: [/nonexistent/contractgate-tool, --version]");

        assertThat(handler.execute(check, root, List.of())).singleElement()
                .extracting(CheckResult::message)
                .isEqualTo("Command not found or not executable: /nonexistent/contractgate-tool");
    }

    @Test
    void missingCommandAbortsTheCheck() {
        assertThatThrownBy(() -> handler.execute(check("id: none", "type: command"), root, List.of()))
                .isInstanceOf(CheckExecutionException.class)
                .hasMessage("Command check declares no command");
    }

    // zombies report no command line, so only live processes count
    private static long runningWith(String marker) {
        return ProcessHandle.allProcesses()
                .filter(p -> p.info().commandLine().map(line -> line.contains(marker)).orElse(false))
                .count();
    }

    @Test
    void judgeCombinesExitCodeAndIndicators() {
        assertThat(CommandCheckHandler.judge(true, "ok", List.of(), List.of("ERROR"))).isTrue();
        assertThat(CommandCheckHandler.judge(true, "1 ERROR", List.of(), List.of("ERROR"))).isFalse();
        assertThat(CommandCheckHandler.judge(false, "PASSED", List.of("PASSED"), List.of())).isTrue();
        assertThat(CommandCheckHandler.judge(false, "nope", List.of("PASSED"), List.of())).isFalse();
    }
}
