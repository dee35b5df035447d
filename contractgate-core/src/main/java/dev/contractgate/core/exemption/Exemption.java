package dev.contractgate.core.exemption;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * A documented, scoped and optionally time-limited waiver for checks of a contract.
 * <p>
 * Expiry is never swept eagerly: callers pass the current date to {@link #isActive(LocalDate)}
 * or run an explicit audit through {@link ExemptionResolver#audit()}.
 */
public class Exemption {

    private final String id;
    private final String contract;
    private final List<String> checks;
    private final String reason;
    private final String approvedBy;
    private final LocalDate approvedDate;
    private final LocalDate expires;
    private final LocalDate reviewDate;
    private final String ticket;
    private final ExemptionScope scope;
    private final Path source;
    private volatile ExemptionStatus status;

    public Exemption(String id, String contract, List<String> checks, String reason, String approvedBy,
                     LocalDate approvedDate, LocalDate expires, LocalDate reviewDate, String ticket,
                     ExemptionStatus status, ExemptionScope scope, Path source) {
        this.id = id;
        this.contract = contract;
        this.checks = checks == null ? List.of() : List.copyOf(checks);
        this.reason = reason;
        this.approvedBy = approvedBy;
        this.approvedDate = approvedDate;
        this.expires = expires;
        this.reviewDate = reviewDate;
        this.ticket = ticket;
        this.status = status == null ? ExemptionStatus.ACTIVE : status;
        this.scope = scope;
        this.source = source;
    }

    public boolean isExpired(LocalDate today) {
        return expires != null && today.isAfter(expires);
    }

    public boolean isActive(LocalDate today) {
        return status == ExemptionStatus.ACTIVE && !isExpired(today);
    }

    public boolean needsReview(LocalDate today) {
        return reviewDate != null && !today.isBefore(reviewDate);
    }

    public boolean coversContract(String contractId) {
        return "*".equals(contract) || contract.equals(contractId);
    }

    public boolean coversCheck(String checkId) {
        return checks.contains("*") || checks.contains(checkId);
    }

    public String getId() {
        return id;
    }

    public String getContract() {
        return contract;
    }

    public List<String> getChecks() {
        return checks;
    }

    public String getReason() {
        return reason;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public LocalDate getApprovedDate() {
        return approvedDate;
    }

    public LocalDate getExpires() {
        return expires;
    }

    public LocalDate getReviewDate() {
        return reviewDate;
    }

    public String getTicket() {
        return ticket;
    }

    public ExemptionScope getScope() {
        return scope;
    }

    public Path getSource() {
        return source;
    }

    public ExemptionStatus getStatus() {
        return status;
    }

    public void setStatus(ExemptionStatus status) {
        this.status = status;
    }

    @Override
    public String toString() {
        return "Exemption{" + id + ", contract=" + contract + ", checks=" + checks + ", status=" + status.value() + "}";
    }
}
