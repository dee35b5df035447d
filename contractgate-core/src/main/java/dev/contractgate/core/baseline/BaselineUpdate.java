package dev.contractgate.core.baseline;

/**
 * Outcome of {@link BaselineManager#update}.
 */
public record BaselineUpdate(Baseline baseline, int added, int removed) {
}
