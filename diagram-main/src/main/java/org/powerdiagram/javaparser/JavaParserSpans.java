package org.powerdiagram.javaparser;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import org.powerdiagram.InvalidSpanException;
import org.powerdiagram.layout.CapturedValue;
import org.powerdiagram.source.SourceSpan;
import org.powerdiagram.source.TextSourceMap;

/**
 * Bridges JavaParser node positions to {@link SourceSpan}s.
 * <p>
 * JavaParser ranges are 1-based and inclusive at both ends; spans are 0-based and half-open. The
 * text must be the one the node was parsed from, with {@code '\n'} line breaks and the parser's
 * default tab size of 1.
 */
public final class JavaParserSpans {

    private JavaParserSpans() {
    }

    public static SourceSpan spanOf(Node node, TextSourceMap sourceMap) {
        Range range = node.getRange().orElseThrow(() -> new InvalidSpanException(
                "No position recorded for " + node.getClass().getSimpleName() + " '" + node + "'", -1, -1));
        try {
            int start = sourceMap.offsetOf(range.begin.line - 1, range.begin.column - 1);
            int end = sourceMap.offsetOf(range.end.line - 1, range.end.column - 1) + 1;
            return new SourceSpan(start, end);
        } catch (IndexOutOfBoundsException e) {
            throw new InvalidSpanException("Range " + range + " of '" + node + "' lies outside the source text",
                                           -1, -1, e);
        }
    }

    public static <V> CapturedValue<V> capture(Expression expression, TextSourceMap sourceMap, V value) {
        return CapturedValue.of(spanOf(expression, sourceMap), value, JavaParserOperators.operatorKind(expression));
    }
}
