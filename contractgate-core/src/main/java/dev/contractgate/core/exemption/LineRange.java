package dev.contractgate.core.exemption;

/**
 * Inclusive line range.
 */
public record LineRange(int start, int end) {

    public LineRange {
        if (end < start) {
            throw new IllegalArgumentException("Line range end " + end + " is before start " + start);
        }
    }

    public boolean contains(int line) {
        return line >= start && line <= end;
    }
}
