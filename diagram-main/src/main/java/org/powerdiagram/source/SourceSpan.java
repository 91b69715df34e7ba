package org.powerdiagram.source;

import org.powerdiagram.InvalidSpanException;

/**
 * A half-open character range {@code [start, end)} into a source text.
 *
 * @param start the first character offset (inclusive)
 * @param end   one past the last character offset (exclusive)
 */
public record SourceSpan(int start, int end) {

    public SourceSpan {
        if (start < 0) {
            throw new InvalidSpanException("Span starts before the text: [" + start + ", " + end + ")", start, end);
        }
        if (end < start) {
            throw new InvalidSpanException("Span ends before it begins: [" + start + ", " + end + ")", start, end);
        }
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public int length() {
        return end - start;
    }
}
