package dev.contractgate.core.conformance;

import java.time.Instant;

/**
 * Who resolved a violation, when, and why.
 */
public record Resolution(Instant resolvedAt, String resolvedBy, String reason) {
}
