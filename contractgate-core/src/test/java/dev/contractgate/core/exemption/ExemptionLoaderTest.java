package dev.contractgate.core.exemption;

import dev.contractgate.core.MutableClock;
import dev.contractgate.core.exception.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static dev.contractgate.core.Fixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExemptionLoaderTest {

    @TempDir
    Path dir;

    private final ExemptionLoader loader = new ExemptionLoader();

    @Test
    void parsesEveryScopeKind() {
        Path file = write(dir, "team.exemptions.yaml", String.join("\n",
                "exemptions:",
                "  - id: EX-1",
                "    contract: api",
                "    check: [no-print, no-eval]",
                "    reason: Legacy module",
                "    approved_by: alice",
                "    approved_date: 2026-01-15",
                "    expires: 2026-06-30",
                "    review_date: 2026-04-01",
                "    ticket: OPS-12",
                "    scope:",
                "      files: ['legacy/**']",
                "      lines: [10, 40]",
                "  - id: EX-2",
                "    contract: '*'",
                "    check: '*'",
                "    scope:",
                "      global: true",
                "  - id: EX-3",
                "    contract: api",
                "    check: no-print",
                "    status: under_review",
                "    scope:",
                "      violation_ids: [V-0123456789ab]",
                ""));

        List<Exemption> exemptions = loader.load(file);

        assertThat(exemptions).extracting(Exemption::getId).containsExactly("EX-1", "EX-2", "EX-3");
        Exemption first = exemptions.get(0);
        assertThat(first.getChecks()).containsExactly("no-print", "no-eval");
        assertThat(first.getApprovedBy()).isEqualTo("alice");
        assertThat(first.getExpires()).isEqualTo(LocalDate.parse("2026-06-30"));
        assertThat(first.getReviewDate()).isEqualTo(LocalDate.parse("2026-04-01"));
        assertThat(first.getTicket()).isEqualTo("OPS-12");
        assertThat(first.getScope().files()).containsExactly("legacy/**");
        assertThat(first.getScope().lines()).isEqualTo(new LineRange(10, 40));
        assertThat(first.getSource()).isEqualTo(file);
        assertThat(exemptions.get(1).getScope().global()).isTrue();
        assertThat(exemptions.get(2).getStatus()).isEqualTo(ExemptionStatus.UNDER_REVIEW);
        assertThat(exemptions.get(2).getScope().violationIds()).containsExactly("V-0123456789ab");
    }

    @Test
    void invalidDateIsAConfigError() {
        Path file = write(dir, "bad.exemptions.yaml", String.join("\n",
                "exemptions:",
                "  - id: EX-1",
                "    contract: api",
                "    check: no-print",
                "    expires: next-week",
                ""));

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("EX-1");
    }

    @Test
    void loadAllSkipsMalformedFilesAndMissingDirectories() {
        write(dir, "a/one.exemptions.yaml", "exemptions:\n  - id: EX-1\n    contract: api\n    check: x\n");
        write(dir, "a/broken.exemptions.yaml", "exemptions:\n  - contract: api\n");
        write(dir, "a/ignored.yaml", "exemptions: []\n");

        List<Exemption> loaded = loader.loadAll(List.of(dir.resolve("a"), dir.resolve("missing")));

        assertThat(loaded).extracting(Exemption::getId).containsExactly("EX-1");
    }

    @Test
    void auditWritesExpiredStatusBackToFile() throws IOException {
        Path file = write(dir, "team.exemptions.yaml", String.join("\n",
                "exemptions:",
                "  - id: EX-1",
                "    contract: api",
                "    check: no-print",
                "    expires: 2026-02-01",
                "    scope:",
                "      global: true",
                "  - id: EX-2",
                "    contract: api",
                "    check: no-eval",
                "    scope:",
                "      global: true",
                ""));
        ExemptionResolver resolver = new ExemptionResolver(loader.load(file), loader, MutableClock.at("2026-03-01T00:00:00Z"));

        assertThat(resolver.audit()).extracting(Exemption::getId).containsExactly("EX-1");

        List<Exemption> reloaded = loader.load(file);
        assertThat(reloaded.get(0).getStatus()).isEqualTo(ExemptionStatus.EXPIRED);
        assertThat(reloaded.get(1).getStatus()).isEqualTo(ExemptionStatus.ACTIVE);
        assertThat(Files.readString(file)).contains("status: expired");
    }
}
