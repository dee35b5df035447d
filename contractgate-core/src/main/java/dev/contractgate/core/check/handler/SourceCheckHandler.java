package dev.contractgate.core.check.handler;

import dev.contractgate.core.check.CheckHandler;
import dev.contractgate.core.check.CheckResult;
import dev.contractgate.core.check.source.SourceAdapters;
import dev.contractgate.core.check.source.SourceUnit;
import dev.contractgate.core.contract.CheckDefinition;
import dev.contractgate.core.exception.SourceParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for handlers that work on parsed source files.
 * <p>
 * Files without an adapter are ignored. A file that fails to parse contributes a WARNING
 * result and is left out of the analysis.
 */
public abstract class SourceCheckHandler implements CheckHandler {

    private static final Logger logger = LoggerFactory.getLogger(SourceCheckHandler.class);

    protected final SourceAdapters adapters;

    protected SourceCheckHandler(SourceAdapters adapters) {
        this.adapters = adapters;
    }

    @Override
    public List<CheckResult> execute(CheckDefinition check, Path repoRoot, List<String> files) {
        List<CheckResult> results = new ArrayList<>();
        List<SourceUnit> units = new ArrayList<>();
        for (String file : files) {
            if (!adapters.supports(file)) {
                continue;
            }
            try {
                units.add(adapters.parse(repoRoot, file));
            } catch (SourceParseException e) {
                results.add(CheckResult.warning(check, file, e.getLine() > 0 ? e.getLine() : null,
                        "Syntax error: " + e.getMessage()));
            } catch (IOException e) {
                logger.warn("Cannot read {} for check {}: {}", file, check.id(), e.getMessage());
            }
        }
        results.addAll(analyze(check, units));
        return results;
    }

    /**
     * Analyze the successfully parsed files.
     *
     * @param check the definition
     * @param units parsed files, in path order
     * @return failing results
     */
    protected abstract List<CheckResult> analyze(CheckDefinition check, List<SourceUnit> units);
}
