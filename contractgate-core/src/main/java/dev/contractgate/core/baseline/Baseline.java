package dev.contractgate.core.baseline;

import dev.contractgate.core.ci.CIViolation;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Set of known violations, keyed by fingerprint, recorded on the main line.
 */
public class Baseline {

    public static final String SCHEMA_VERSION = "1.0";

    private String schemaVersion = SCHEMA_VERSION;
    private Instant createdAt;
    private Instant updatedAt;
    private String commitSha;
    private Map<String, BaselineEntry> entries = new LinkedHashMap<>();

    public Baseline() {
    }

    public static Baseline empty(String commitSha, Instant now) {
        Baseline baseline = new Baseline();
        baseline.createdAt = now;
        baseline.updatedAt = now;
        baseline.commitSha = commitSha;
        return baseline;
    }

    public boolean contains(CIViolation violation) {
        return entries.containsKey(violation.hash());
    }

    public boolean containsHash(String hash) {
        return entries.containsKey(hash);
    }

    /**
     * Add a violation, or refresh its last-seen time when already known.
     *
     * @return true when the violation was not in the baseline before
     */
    public boolean add(CIViolation violation, Instant now) {
        String hash = violation.hash();
        BaselineEntry existing = entries.get(hash);
        entries.put(hash, existing == null ? BaselineEntry.from(violation, now) : existing.seenAt(now));
        updatedAt = now;
        return existing == null;
    }

    public boolean remove(String hash, Instant now) {
        if (entries.remove(hash) != null) {
            updatedAt = now;
            return true;
        }
        return false;
    }

    public int size() {
        return entries.size();
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getCommitSha() {
        return commitSha;
    }

    public void setCommitSha(String commitSha) {
        this.commitSha = commitSha;
    }

    public Map<String, BaselineEntry> getEntries() {
        return entries;
    }

    public void setEntries(Map<String, BaselineEntry> entries) {
        this.entries = entries == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entries);
    }
}
