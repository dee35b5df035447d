package dev.contractgate.core.ci.report;

import dev.contractgate.core.ci.CIConfig;
import dev.contractgate.core.ci.CIResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the outputs enabled in a {@link CIConfig}.
 */
public final class CIReports {

    private static final Logger logger = LoggerFactory.getLogger(CIReports.class);

    private CIReports() {
    }

    /**
     * @return the files written, in SARIF, JUnit, Markdown order
     */
    public static List<Path> writeConfigured(CIResult result, CIConfig config, Path repoRoot) {
        List<Path> written = new ArrayList<>();
        if (config.isOutputSarif()) {
            written.add(write(new SarifReportWriter(), result, repoRoot.resolve(config.getSarifPath())));
        }
        if (config.isOutputJunit()) {
            written.add(write(new JUnitReportWriter(), result, repoRoot.resolve(config.getJunitPath())));
        }
        if (config.isOutputMarkdown()) {
            written.add(write(new MarkdownReportWriter(), result, repoRoot.resolve(config.getMarkdownPath())));
        }
        return written;
    }

    private static Path write(ReportWriter writer, CIResult result, Path target) {
        writer.write(result, target);
        logger.info("Wrote {} report to {}", writer.format(), target);
        return target;
    }
}
