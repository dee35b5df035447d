package dev.contractgate.core.baseline;

import dev.contractgate.core.ci.CIViolation;

import java.time.Instant;

/**
 * One known violation in a baseline, identified by its fingerprint.
 */
public record BaselineEntry(
        String hash,
        String checkId,
        String filePath,
        Integer line,
        String messagePreview,
        Instant firstSeen,
        Instant lastSeen
) {

    static final int PREVIEW_LENGTH = 100;

    public static BaselineEntry from(CIViolation violation, Instant now) {
        String message = violation.message() == null ? "" : violation.message();
        String preview = message.length() > PREVIEW_LENGTH ? message.substring(0, PREVIEW_LENGTH) : message;
        return new BaselineEntry(violation.hash(), violation.checkId(), violation.filePath(), violation.line(),
                preview, now, now);
    }

    public BaselineEntry seenAt(Instant now) {
        return new BaselineEntry(hash, checkId, filePath, line, messagePreview, firstSeen, now);
    }
}
