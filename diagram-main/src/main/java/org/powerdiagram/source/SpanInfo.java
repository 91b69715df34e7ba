package org.powerdiagram.source;

/**
 * Line and column coordinates of a {@link SourceSpan}. All values are zero-based; the end
 * coordinate points one past the last character, like the span itself.
 */
public record SpanInfo(int startLine, int startColumn, int endLine, int endColumn) {
}
