package dev.contractgate.core.ci.report;

import dev.contractgate.core.baseline.BaselineComparison;
import dev.contractgate.core.baseline.BaselineEntry;
import dev.contractgate.core.ci.CIResult;
import dev.contractgate.core.ci.CIViolation;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Markdown summary for pull request comments and job summaries.
 */
public class MarkdownReportWriter implements ReportWriter {

    private static final int FIXED_SHOWN = 5;
    private static final int EXISTING_SHOWN = 20;
    private static final int COLLAPSE_FILES_ABOVE = 3;
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final String title;

    public MarkdownReportWriter() {
        this("ContractGate Conformance Report");
    }

    public MarkdownReportWriter(String title) {
        this.title = title;
    }

    @Override
    public String format() {
        return "markdown";
    }

    @Override
    public String render(CIResult result) {
        StringBuilder md = new StringBuilder();
        md.append("## ").append(result.isSuccess() ? "✅ " : "❌ ").append(title).append("\n\n");
        summary(md, result);
        if (result.comparison() != null) {
            comparison(md, result.comparison());
        }
        if (!result.violations().isEmpty()) {
            violations(md, result);
        }
        footer(md, result);
        return md.toString();
    }

    private static void summary(StringBuilder md, CIResult result) {
        md.append("### Summary\n\n")
                .append("| Metric | Value |\n")
                .append("|--------|-------|\n")
                .append("| Mode | ").append(result.mode().value()).append(" |\n")
                .append("| Files Checked | ").append(result.filesChecked()).append(" |\n")
                .append("| Checks Run | ").append(result.checksRun()).append(" |\n")
                .append("| Total Violations | ").append(result.totalViolations()).append(" |\n")
                .append("| Errors | ").append(result.errorCount()).append(" |\n")
                .append("| Warnings | ").append(result.warningCount()).append(" |\n");
        if (result.exemptedCount() > 0) {
            md.append("| Exempted | ").append(result.exemptedCount()).append(" |\n");
        }
        md.append("| Duration | ")
                .append(String.format(Locale.ROOT, "%.2fs", result.duration().toMillis() / 1000.0))
                .append(" |\n\n");
    }

    private static void comparison(StringBuilder md, BaselineComparison comparison) {
        md.append("### Baseline Comparison\n\n");
        int net = comparison.netChange();
        if (net < 0) {
            md.append("📉 **Net improvement:** ").append(-net).append(" fewer violations\n\n");
        } else if (net > 0) {
            md.append("📈 **Net regression:** ").append(net).append(" more violations\n\n");
        } else {
            md.append("➡️ **No net change** in violation count\n\n");
        }

        List<CIViolation> introduced = comparison.newViolations();
        if (!introduced.isEmpty()) {
            md.append("#### ⚠️ New Violations (").append(introduced.size()).append(")\n\n")
                    .append("These violations were introduced in this change and should be fixed:\n\n");
            introduced.forEach(v -> item(md, v));
            md.append('\n');
        }

        List<BaselineEntry> fixed = comparison.fixedViolations();
        if (!fixed.isEmpty()) {
            md.append("#### 🎉 Fixed Violations (").append(fixed.size()).append(")\n\n");
            fixed.stream().limit(FIXED_SHOWN).forEach(entry -> md.append("- ~~`").append(entry.checkId())
                    .append("` in `").append(entry.filePath()).append("`~~\n"));
            if (fixed.size() > FIXED_SHOWN) {
                md.append("- *...and ").append(fixed.size() - FIXED_SHOWN).append(" more*\n");
            }
            md.append('\n');
        }

        List<CIViolation> existing = comparison.existingViolations();
        if (!existing.isEmpty()) {
            md.append("<details>\n<summary>📋 Existing Violations (").append(existing.size())
                    .append(") - pre-existing tech debt</summary>\n\n");
            existing.stream().limit(EXISTING_SHOWN).forEach(v -> md.append("- ").append(icon(v)).append(" `")
                    .append(v.checkId()).append("` at `").append(v.filePath()).append(':').append(lineLabel(v))
                    .append("`\n"));
            if (existing.size() > EXISTING_SHOWN) {
                md.append("\n*...and ").append(existing.size() - EXISTING_SHOWN).append(" more*\n");
            }
            md.append("\n</details>\n\n");
        }
    }

    private static void violations(StringBuilder md, CIResult result) {
        md.append("### All Violations\n\n");
        Map<String, List<CIViolation>> byFile = result.violationsByFile();
        boolean collapse = byFile.size() > COLLAPSE_FILES_ABOVE;
        if (collapse) {
            md.append("<details>\n<summary>View all ").append(result.totalViolations()).append(" violations in ")
                    .append(byFile.size()).append(" files</summary>\n\n");
        }
        byFile.forEach((file, list) -> {
            md.append("**`").append(file).append("`** (").append(list.size()).append(" violations)\n\n");
            list.forEach(v -> item(md, v));
            md.append('\n');
        });
        if (collapse) {
            md.append("</details>\n\n");
        }
    }

    private static void footer(StringBuilder md, CIResult result) {
        md.append("---\n*Generated at ").append(TIMESTAMP.format(result.completedAt())).append(" UTC*\n");
        if (result.commitSha() != null) {
            String sha = result.commitSha();
            md.append("*Commit: `").append(sha, 0, Math.min(8, sha.length())).append("`*\n");
        }
        if (!result.errors().isEmpty()) {
            md.append("\n⚠️ **Runtime Errors:**\n");
            result.errors().forEach(error -> md.append("- ").append(error).append('\n'));
        }
    }

    private static void item(StringBuilder md, CIViolation violation) {
        md.append("- ").append(icon(violation)).append(" **").append(violation.checkId()).append("** at `")
                .append(lineLabel(violation)).append("`\n")
                .append("  - ").append(violation.message()).append('\n');
        if (violation.fixHint() != null) {
            md.append("  - 💡 *").append(violation.fixHint()).append("*\n");
        }
    }

    private static String icon(CIViolation violation) {
        return switch (violation.severity()) {
            case ERROR -> "🔴";
            case WARNING -> "🟡";
            case INFO -> "🔵";
        };
    }

    private static String lineLabel(CIViolation violation) {
        return violation.line() == null || violation.line() == 0 ? "file" : "L" + violation.line();
    }
}
