package dev.contractgate.core.check;

import dev.contractgate.core.contract.CheckDefinition;

import java.nio.file.Path;
import java.util.List;

/**
 * Evaluates one check type.
 * <p>
 * Handlers report findings through their return value and must not throw for expected
 * conditions; a {@link dev.contractgate.core.exception.CheckExecutionException} or any other
 * runtime exception is turned into an ERROR result by the {@link CheckExecutor}.
 */
public interface CheckHandler {

    /**
     * The normalized type name this handler serves.
     */
    String type();

    /**
     * Run the check.
     *
     * @param check the definition
     * @param repoRoot repository root
     * @param files repository-relative files in the check's scope
     * @return failing results, or passing results for handlers that report them; empty when clean
     */
    List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files);
}
