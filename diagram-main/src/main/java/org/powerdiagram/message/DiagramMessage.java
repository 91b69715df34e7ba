package org.powerdiagram.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable, ordered sequence of {@link Segment}s making up a diagram. Adjacent literals are merged
 * while the message is built, so a message never holds two literals in a row.
 *
 * @param <V> the type of the value references carried by slots
 */
public final class DiagramMessage<V> {

    private final List<Segment<V>> segments;

    private DiagramMessage(List<Segment<V>> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    public List<Segment<V>> segments() {
        return segments;
    }

    /**
     * Values referenced by the slots, in message order.
     */
    public List<V> values() {
        List<V> values = new ArrayList<>();
        for (Segment<V> segment : segments) {
            if (segment instanceof Segment.ValueSlot<V> slot) {
                values.add(slot.value());
            }
        }
        return values;
    }

    /**
     * Concatenates the segments, calling {@code stringify} once per slot in order.
     */
    public String render(Function<? super V, String> stringify) {
        Objects.requireNonNull(stringify, "stringify");
        StringBuilder sb = new StringBuilder();
        for (Segment<V> segment : segments) {
            if (segment instanceof Segment.Literal<V> literal) {
                sb.append(literal.text());
            } else if (segment instanceof Segment.ValueSlot<V> slot) {
                sb.append(stringify.apply(slot.value()));
            }
        }
        return sb.toString();
    }

    public String render() {
        return render(String::valueOf);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiagramMessage<?> that)) {
            return false;
        }
        return segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return "DiagramMessage" + segments;
    }

    public static final class Builder<V> {

        private final List<Segment<V>> segments = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();
        private boolean built;

        private Builder() {
        }

        public Builder<V> literal(CharSequence text) {
            checkNotBuilt();
            pending.append(text);
            return this;
        }

        public Builder<V> slot(V value) {
            checkNotBuilt();
            flush();
            segments.add(Segment.slot(value));
            return this;
        }

        public DiagramMessage<V> build() {
            checkNotBuilt();
            flush();
            built = true;
            return new DiagramMessage<>(segments);
        }

        private void flush() {
            if (pending.length() > 0) {
                segments.add(Segment.literal(pending.toString()));
                pending.setLength(0);
            }
        }

        private void checkNotBuilt() {
            if (built) {
                throw new IllegalStateException("Message already built");
            }
        }
    }
}
