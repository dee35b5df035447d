package dev.contractgate.core.exemption;

import dev.contractgate.core.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExemptionResolverTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T00:00:00Z");

    @Test
    void violationIdScopeWinsOverFileAndGlobalScopes() {
        Exemption global = exemption("EX-G", "*", List.of("*"), null, ExemptionScope.globalScope());
        Exemption files = exemption("EX-F", "api", List.of("no-print"), null, ExemptionScope.files(List.of("src/**"), null));
        Exemption byId = exemption("EX-V", "api", List.of("no-print"), null, ExemptionScope.violations(List.of("V-aaaaaaaaaaaa")));
        ExemptionResolver resolver = new ExemptionResolver(List.of(global, files, byId), null, clock);

        assertThat(resolver.find("api", "no-print", "src/a.py", 3, "V-aaaaaaaaaaaa")).containsSame(byId);
        assertThat(resolver.find("api", "no-print", "src/a.py", 3, "V-bbbbbbbbbbbb")).containsSame(files);
        assertThat(resolver.find("api", "no-print", "lib/a.py", 3)).containsSame(global);
        assertThat(resolver.find("web", "no-eval", null, null)).containsSame(global);
    }

    @Test
    void lineRangeLimitsFileScope() {
        Exemption ranged = exemption("EX-L", "api", List.of("no-print"), null,
                ExemptionScope.files(List.of("src/a.py"), new LineRange(10, 20)));
        ExemptionResolver resolver = new ExemptionResolver(List.of(ranged), null, clock);

        assertThat(resolver.find("api", "no-print", "src/a.py", 15)).isPresent();
        assertThat(resolver.find("api", "no-print", "src/a.py", 21)).isEmpty();
        assertThat(resolver.find("api", "no-print", "src/a.py", null)).isPresent();
        assertThat(resolver.find("api", "no-print", "src/b.py", 15)).isEmpty();
    }

    @Test
    void contractAndCheckMustMatch() {
        Exemption exemption = exemption("EX-1", "api", List.of("no-print", "no-eval"), null, ExemptionScope.globalScope());
        ExemptionResolver resolver = new ExemptionResolver(List.of(exemption), null, clock);

        assertThat(resolver.find("api", "no-eval", "x.py", 1)).isPresent();
        assertThat(resolver.find("api", "no-exec", "x.py", 1)).isEmpty();
        assertThat(resolver.find("web", "no-print", "x.py", 1)).isEmpty();
    }

    @Test
    void expiredExemptionsNoLongerMatch() {
        Exemption exemption = exemption("EX-1", "api", List.of("*"), LocalDate.parse("2026-03-01"), ExemptionScope.globalScope());
        ExemptionResolver resolver = new ExemptionResolver(List.of(exemption), null, clock);

        assertThat(resolver.find("api", "no-print", "x.py", 1)).isPresent();
        assertThat(resolver.audit()).isEmpty();

        clock.set(Instant.parse("2026-03-02T00:00:00Z"));
        assertThat(resolver.find("api", "no-print", "x.py", 1)).isEmpty();
        assertThat(resolver.getExpired()).containsExactly(exemption);
        assertThat(resolver.audit()).containsExactly(exemption);
        assertThat(exemption.getStatus()).isEqualTo(ExemptionStatus.EXPIRED);
        assertThat(resolver.audit()).isEmpty();
    }

    @Test
    void inactiveStatusesNeverMatch() {
        Exemption underReview = new Exemption("EX-R", "api", List.of("*"), "pending", null, null, null, null, null,
                ExemptionStatus.UNDER_REVIEW, ExemptionScope.globalScope(), null);
        ExemptionResolver resolver = new ExemptionResolver(List.of(underReview), null, clock);

        assertThat(resolver.find("api", "no-print", "x.py", 1)).isEmpty();
        assertThat(resolver.getActive()).isEmpty();
        assertThat(resolver.get("EX-R")).containsSame(underReview);
    }

    @Test
    void reviewDateFlagsExemptionForReview() {
        Exemption due = new Exemption("EX-1", "api", List.of("*"), "r", null, null, null, LocalDate.parse("2026-03-01"),
                null, ExemptionStatus.ACTIVE, ExemptionScope.globalScope(), null);
        Exemption later = new Exemption("EX-2", "api", List.of("*"), "r", null, null, null, LocalDate.parse("2026-06-01"),
                null, ExemptionStatus.ACTIVE, ExemptionScope.globalScope(), null);

        assertThat(new ExemptionResolver(List.of(due, later), null, clock).getNeedsReview()).containsExactly(due);
    }

    @Test
    void lineRangeRejectsInvertedBounds() {
        assertThatThrownBy(() -> new LineRange(5, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Exemption exemption(String id, String contract, List<String> checks, LocalDate expires,
                                       ExemptionScope scope) {
        return new Exemption(id, contract, checks, "reason", "bob", LocalDate.parse("2026-01-01"), expires, null, null,
                ExemptionStatus.ACTIVE, scope, null);
    }
}
