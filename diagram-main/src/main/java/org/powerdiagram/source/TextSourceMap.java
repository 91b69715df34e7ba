package org.powerdiagram.source;

import java.util.Arrays;
import java.util.Objects;

import org.powerdiagram.InvalidSpanException;

/**
 * {@link SourceMap} over an in-memory {@link String}.
 * <p>
 * Line starts are computed once; lookups binary search them. Only {@code '\n'} terminates a line,
 * and a line break belongs to the line it terminates. Instances are immutable and may be shared
 * across threads.
 */
public final class TextSourceMap implements SourceMap {

    private final String text;
    private final int[] lineStarts;

    public TextSourceMap(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = computeLineStarts(text);
    }

    private static int[] computeLineStarts(String text) {
        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    @Override
    public SpanInfo resolve(SourceSpan span) {
        checkBounds(span);
        int startLine = lineOf(span.start());
        int endLine = lineOf(span.end());
        return new SpanInfo(startLine, span.start() - lineStarts[startLine],
                            endLine, span.end() - lineStarts[endLine]);
    }

    @Override
    public String slice(SourceSpan span) {
        checkBounds(span);
        return text.substring(span.start(), span.end());
    }

    /**
     * Zero-based line containing the offset. An offset equal to the text length maps to the last line.
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside text of length " + text.length());
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }

    /**
     * Character offset of a zero-based (line, column) position.
     *
     * @throws IndexOutOfBoundsException if the position is not inside the text
     */
    public int offsetOf(int line, int column) {
        if (line < 0 || line >= lineStarts.length) {
            throw new IndexOutOfBoundsException("Line " + line + " outside text with " + lineStarts.length + " line(s)");
        }
        int lineEnd = line + 1 < lineStarts.length ? lineStarts[line + 1] : text.length();
        int offset = lineStarts[line] + column;
        if (column < 0 || offset > lineEnd) {
            throw new IndexOutOfBoundsException("Column " + column + " outside line " + line);
        }
        return offset;
    }

    private void checkBounds(SourceSpan span) {
        Objects.requireNonNull(span, "span");
        if (span.end() > text.length()) {
            throw new InvalidSpanException("Span [" + span.start() + ", " + span.end()
                                           + ") exceeds text of length " + text.length(),
                                           span.start(), span.end(), text.length());
        }
    }
}
