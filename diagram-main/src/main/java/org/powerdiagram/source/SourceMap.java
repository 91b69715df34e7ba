package org.powerdiagram.source;

/**
 * Resolves {@link SourceSpan}s against the text that holds the parsed code.
 */
public interface SourceMap {

    /**
     * Line and column coordinates of the span.
     *
     * @throws org.powerdiagram.InvalidSpanException if the span lies outside the text
     */
    SpanInfo resolve(SourceSpan span);

    /**
     * The source text covered by the span.
     *
     * @throws org.powerdiagram.InvalidSpanException if the span lies outside the text
     */
    String slice(SourceSpan span);
}
