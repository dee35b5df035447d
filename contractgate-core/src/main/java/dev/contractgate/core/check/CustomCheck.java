package dev.contractgate.core.check;

import dev.contractgate.core.contract.CheckDefinition;

import java.nio.file.Path;
import java.util.List;

/**
 * User-supplied check logic for the {@code custom} check type.
 * <p>
 * Implementations are found by {@link #name()} when registered programmatically or through
 * {@code META-INF/services/dev.contractgate.core.check.CustomCheck}, or instantiated directly
 * from the {@code class} setting of a check (public no-argument constructor required).
 * Parameters declared under {@code params} are available via {@code check.config().path("params")}.
 */
public interface CustomCheck {

    String name();

    List<CheckResult> run(CheckDefinition check, Path repoRoot, List<String> files);
}
