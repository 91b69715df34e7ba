package org.powerdiagram.message;

import java.util.Objects;

/**
 * One unit of a diagram message: either literal text or a slot for a value that is stringified at
 * render time.
 *
 * @param <V> the type of the value references carried by slots
 */
public sealed interface Segment<V> permits Segment.Literal, Segment.ValueSlot {

    static <V> Literal<V> literal(String text) {
        return new Literal<>(text);
    }

    static <V> ValueSlot<V> slot(V value) {
        return new ValueSlot<>(value);
    }

    record Literal<V>(String text) implements Segment<V> {

        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The value may be {@code null}; a null value is a legitimate evaluation result.
     */
    record ValueSlot<V>(V value) implements Segment<V> {
    }
}
