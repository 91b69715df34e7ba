package org.powerdiagram.layout;

import java.util.Objects;

import org.powerdiagram.source.SourceSpan;

/**
 * A subexpression selected for display, together with a reference to the value it produced.
 *
 * @param span     where the subexpression sits in the source
 * @param value    opaque value reference, stringified only when the message is rendered; may be {@code null}
 * @param operator how to anchor the value under the subexpression
 * @param <V>      the value reference type
 */
public record CapturedValue<V>(SourceSpan span, V value, OperatorKind operator) {

    public CapturedValue {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(operator, "operator");
    }

    public static <V> CapturedValue<V> of(SourceSpan span, V value) {
        return new CapturedValue<>(span, value, OperatorKind.NONE);
    }

    public static <V> CapturedValue<V> of(SourceSpan span, V value, OperatorKind operator) {
        return new CapturedValue<>(span, value, operator);
    }
}
