package org.powerdiagram.layout;

/**
 * Strips the indentation of the first line from every following line, so that a call which starts
 * at column {@code n} reads as if it started at column 0. Lines indented by fewer than {@code n}
 * spaces are left alone.
 */
public final class IndentationNormalizer {

    private IndentationNormalizer() {
    }

    public static String normalize(String source, int baseIndent) {
        if (baseIndent < 0) {
            throw new IllegalArgumentException("Base indent must not be negative: " + baseIndent);
        }
        if (baseIndent == 0 || source.indexOf('\n') < 0) {
            return source;
        }
        return source.replace("\n" + " ".repeat(baseIndent), "\n");
    }
}
