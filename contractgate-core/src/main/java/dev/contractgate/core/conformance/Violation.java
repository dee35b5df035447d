package dev.contractgate.core.conformance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.contractgate.core.check.CheckResult;

import java.time.Instant;

/**
 * Persisted record of one check failing at one location, tracked across runs by its id.
 */
public class Violation {

    private String id;
    private String contractId;
    private String checkId;
    private ViolationSeverity severity;
    private String file;
    private Integer line;
    private String message;
    private String fixHint;
    private String rule;
    private ViolationStatus status = ViolationStatus.OPEN;
    private Instant firstDetected;
    private Instant lastSeen;
    private String exemptionId;
    private boolean exempted;
    private Resolution resolution;

    public Violation() {
    }

    /**
     * Create an open violation from a failing check result.
     */
    public static Violation detected(String id, CheckResult result, Instant now) {
        Violation violation = new Violation();
        violation.id = id;
        violation.contractId = result.contractId();
        violation.checkId = result.checkId();
        violation.rule = result.rule();
        violation.firstDetected = now;
        violation.refresh(result, now);
        return violation;
    }

    /**
     * Apply a re-detection: refresh the mutable attributes and reopen if it had been closed.
     */
    public void refresh(CheckResult result, Instant now) {
        severity = ViolationSeverity.fromCheckSeverity(result.severity());
        file = result.file();
        line = result.line();
        message = result.message();
        fixHint = result.fixHint();
        lastSeen = now;
        if (status == ViolationStatus.RESOLVED || status == ViolationStatus.STALE) {
            status = ViolationStatus.OPEN;
            resolution = null;
        }
    }

    public void resolve(Resolution resolution) {
        this.status = ViolationStatus.RESOLVED;
        this.resolution = resolution;
        this.exempted = false;
    }

    public void markStale() {
        this.status = ViolationStatus.STALE;
        this.exempted = false;
    }

    public void exemptBy(String exemptionId) {
        this.exemptionId = exemptionId;
        this.exempted = true;
    }

    public void clearExemption() {
        this.exemptionId = null;
        this.exempted = false;
    }

    /**
     * Whether this violation counts as a failure: active and not covered by an exemption.
     */
    @JsonIgnore
    public boolean isFailing() {
        return status == ViolationStatus.EXEMPTION_EXPIRED || (status == ViolationStatus.OPEN && !exempted);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getContractId() {
        return contractId;
    }

    public void setContractId(String contractId) {
        this.contractId = contractId;
    }

    public String getCheckId() {
        return checkId;
    }

    public void setCheckId(String checkId) {
        this.checkId = checkId;
    }

    public ViolationSeverity getSeverity() {
        return severity;
    }

    public void setSeverity(ViolationSeverity severity) {
        this.severity = severity;
    }

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public Integer getLine() {
        return line;
    }

    public void setLine(Integer line) {
        this.line = line;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getFixHint() {
        return fixHint;
    }

    public void setFixHint(String fixHint) {
        this.fixHint = fixHint;
    }

    public String getRule() {
        return rule;
    }

    public void setRule(String rule) {
        this.rule = rule;
    }

    public ViolationStatus getStatus() {
        return status;
    }

    public void setStatus(ViolationStatus status) {
        this.status = status;
    }

    public Instant getFirstDetected() {
        return firstDetected;
    }

    public void setFirstDetected(Instant firstDetected) {
        this.firstDetected = firstDetected;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(Instant lastSeen) {
        this.lastSeen = lastSeen;
    }

    public String getExemptionId() {
        return exemptionId;
    }

    public void setExemptionId(String exemptionId) {
        this.exemptionId = exemptionId;
    }

    public boolean isExempted() {
        return exempted;
    }

    public void setExempted(boolean exempted) {
        this.exempted = exempted;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    @Override
    public String toString() {
        return id + " [" + status.value() + "] " + contractId + "/" + checkId + " " + file + ":" + line;
    }
}
