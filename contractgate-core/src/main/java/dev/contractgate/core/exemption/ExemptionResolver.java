package dev.contractgate.core.exemption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides whether an active exemption covers a violation.
 * <p>
 * Matching order:
 * <ol>
 *   <li>explicit violation-id scope</li>
 *   <li>file-pattern scope (with optional line range)</li>
 *   <li>global scope</li>
 * </ol>
 * Within each step the first exemption in load order wins.
 */
public class ExemptionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ExemptionResolver.class);

    private final List<Exemption> exemptions;
    private final ExemptionLoader loader;
    private final Clock clock;

    public ExemptionResolver(List<Exemption> exemptions, ExemptionLoader loader, Clock clock) {
        this.exemptions = List.copyOf(exemptions);
        this.loader = loader;
        this.clock = clock;
    }

    public static ExemptionResolver empty() {
        return new ExemptionResolver(List.of(), null, Clock.systemDefaultZone());
    }

    /**
     * Find the exemption covering a violation location.
     *
     * @param contractId contract of the violation
     * @param checkId check of the violation
     * @param file repository-relative file, may be null
     * @param line line number, may be null
     * @param violationId tracking id of the violation, may be null
     * @return the covering active exemption
     */
    public Optional<Exemption> find(String contractId, String checkId, String file, Integer line, String violationId) {
        LocalDate today = today();
        List<Exemption> candidates = exemptions.stream()
                .filter(e -> e.isActive(today))
                .filter(e -> e.coversContract(contractId) && e.coversCheck(checkId))
                .toList();

        Optional<Exemption> match = first(candidates, e -> e.getScope().coversViolationId(violationId));
        if (match.isEmpty()) {
            match = first(candidates, e -> e.getScope().coversFile(file, line));
        }
        if (match.isEmpty()) {
            match = first(candidates, e -> e.getScope().global());
        }
        return match;
    }

    public Optional<Exemption> find(String contractId, String checkId, String file, Integer line) {
        return find(contractId, checkId, file, line, null);
    }

    /**
     * Move every active exemption whose expiry has passed to EXPIRED, persisting the change
     * to its source file when it has one.
     *
     * @return the exemptions that expired during this audit
     */
    public List<Exemption> audit() {
        LocalDate today = today();
        List<Exemption> expired = new ArrayList<>();
        for (Exemption exemption : exemptions) {
            if (exemption.getStatus() == ExemptionStatus.ACTIVE && exemption.isExpired(today)) {
                if (loader != null) {
                    loader.updateStatus(exemption, ExemptionStatus.EXPIRED);
                } else {
                    exemption.setStatus(ExemptionStatus.EXPIRED);
                }
                logger.info("Exemption {} expired on {}", exemption.getId(), exemption.getExpires());
                expired.add(exemption);
            }
        }
        return expired;
    }

    public Optional<Exemption> get(String id) {
        return exemptions.stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    public List<Exemption> getAll() {
        return exemptions;
    }

    public List<Exemption> getActive() {
        LocalDate today = today();
        return exemptions.stream().filter(e -> e.isActive(today)).toList();
    }

    public List<Exemption> getExpired() {
        LocalDate today = today();
        return exemptions.stream()
                .filter(e -> e.getStatus() == ExemptionStatus.EXPIRED || e.isExpired(today))
                .toList();
    }

    public List<Exemption> getNeedsReview() {
        LocalDate today = today();
        return exemptions.stream()
                .filter(e -> e.getStatus() == ExemptionStatus.ACTIVE && e.needsReview(today))
                .toList();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static Optional<Exemption> first(List<Exemption> candidates, Predicate<Exemption> test) {
        return candidates.stream().filter(test).findFirst();
    }
}
