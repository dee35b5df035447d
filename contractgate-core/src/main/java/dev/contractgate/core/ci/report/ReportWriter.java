package dev.contractgate.core.ci.report;

import dev.contractgate.core.ci.CIResult;
import dev.contractgate.core.util.AtomicFileWriter;

import java.nio.file.Path;

/**
 * Renders a CI result into one output format.
 */
public interface ReportWriter {

    String format();

    String render(CIResult result);

    default void write(CIResult result, Path target) {
        AtomicFileWriter.write(target, render(result));
    }
}
