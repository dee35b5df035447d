package dev.contractgate.core.check.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.contractgate.core.check.CheckHandler;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.contract.CheckSeverity;
import dev.contractgate.core.contract.CheckTypes;
import dev.contractgate.core.exception.CheckExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runs an external command and judges it by exit code and output.
 * <p>
 * A string {@code command} runs through the platform shell; a list runs directly with
 * {@code args} appended. A timeout or a command that cannot be started yields an ERROR
 * result for this check only.
 */
public class CommandCheckHandler implements CheckHandler {

    private static final Logger logger = LoggerFactory.getLogger(CommandCheckHandler.class);

    static final int DEFAULT_TIMEOUT_SECONDS = 60;
    private static final int OUTPUT_TAIL = 2000;

    @Override
    public String type() {
        return CheckTypes.COMMAND;
    }

    @Override
    public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
        JsonNode config = check.config();
        List<String> command = commandLine(check);
        Path workingDir = config.hasNonNull("working_dir")
                ? repoRoot.resolve(config.get("working_dir").asText()).normalize()
                : repoRoot;
        int timeout = config.path("timeout").asInt(DEFAULT_TIMEOUT_SECONDS);
        int expectedExit = config.path("expected_exit_code").asInt(0);

        logger.debug("Running command check {}: {}", check.id(), command);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            return List.of(error(check, "Command not found or not executable: " + command.get(0)));
        }

        // dedicated reader thread, shut down with this call
        ExecutorService reader = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "contractgate-command-" + check.id());
            thread.setDaemon(true);
            return thread;
        });
        String text;
        int exitCode;
        try {
            Future<String> output = reader.submit(() -> readAll(process.getInputStream()));
            try {
                if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                    destroyTree(process);
                    return List.of(error(check, "Command timed out after " + timeout + "s"));
                }
                exitCode = process.exitValue();
            } catch (InterruptedException e) {
                destroyTree(process);
                Thread.currentThread().interrupt();
                throw new CheckExecutionException(check.id(), "Interrupted while waiting for command", e);
            }

            try {
                text = output.get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CheckExecutionException(check.id(), "Interrupted while reading command output", e);
            } catch (ExecutionException | TimeoutException e) {
                logger.warn("Output of command check {} unavailable: {}", check.id(), e.getMessage());
                text = "";
            }
        } finally {
            reader.shutdownNow();
        }

        boolean passed = judge(exitCode == expectedExit, text,
                CheckDefinition.stringList(config.get("success_indicators")),
                CheckDefinition.stringList(config.get("failure_indicators")));
        if (passed) {
            return List.of();
        }

        List<CheckResult> parsed = parseErrors(check, text);
        if (!parsed.isEmpty()) {
            return parsed;
        }
        String message = config.hasNonNull("message")
                ? config.get("message").asText()
                : "Command failed with exit code " + exitCode + tail(text);
        return List.of(CheckResult.failure(check, null, null, message));
    }

    /**
     * Failure indicators can fail a zero exit code; success indicators can pass a non-zero one.
     */
    static boolean judge(boolean exitOk, String output, List<String> successIndicators, List<String> failureIndicators) {
        if (exitOk) {
            return failureIndicators.stream().noneMatch(output::contains);
        }
        return successIndicators.stream().anyMatch(output::contains);
    }

    private static List<CheckResult> parseErrors(CheckDefinition check, String output) {
        JsonNode parser = check.config().path("error_parser");
        if (!parser.hasNonNull("pattern")) {
            return List.of();
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(parser.get("pattern").asText(), Pattern.MULTILINE);
        } catch (PatternSyntaxException e) {
            throw new CheckExecutionException(check.id(), "Invalid error_parser pattern: " + e.getDescription(), e);
        }
        List<CheckResult> results = new ArrayList<>();
        Matcher matcher = pattern.matcher(output);
        while (matcher.find()) {
            String file = group(matcher, "file");
            String line = group(matcher, "line");
            String message = group(matcher, "message");
            results.add(CheckResult.failure(check,
                    file,
                    line != null && line.matches("\\d+") ? Integer.valueOf(line) : null,
                    message != null ? message.trim() : matcher.group().trim()));
        }
        return results;
    }

    private static String group(Matcher matcher, String name) {
        try {
            return matcher.group(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static List<String> commandLine(CheckDefinition check) {
        JsonNode config = check.config();
        JsonNode command = config.get("command");
        if (command == null || command.isNull() || command.asText().isBlank() && !command.isArray()) {
            throw new CheckExecutionException(check.id(), "Command check declares no command");
        }
        List<String> args = CheckDefinition.stringList(config.get("args"));
        List<String> line = new ArrayList<>();
        if (command.isArray()) {
            line.addAll(CheckDefinition.stringList(command));
            line.addAll(args);
            return line;
        }
        String script = args.isEmpty() ? command.asText() : command.asText() + " " + String.join(" ", args);
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")) {
            line.addAll(List.of("cmd.exe", "/c", script));
        } else {
            line.addAll(List.of("sh", "-c", script));
        }
        return line;
    }

    /**
     * Kill the process and every descendant still holding the output pipe.
     */
    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static CheckResult error(CheckDefinition check, String message) {
        return new CheckResult(null, check.id(), null, null, CheckSeverity.ERROR, false, message, check.fixHint(), null);
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Command output stream closed early: {}", e.getMessage());
            return "";
        }
    }

    private static String tail(String output) {
        String trimmed = output.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return "\n" + (trimmed.length() > OUTPUT_TAIL ? trimmed.substring(trimmed.length() - OUTPUT_TAIL) : trimmed);
    }
}
