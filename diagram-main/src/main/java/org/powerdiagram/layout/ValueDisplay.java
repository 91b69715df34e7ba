package org.powerdiagram.layout;

/**
 * Where a captured value is drawn, relative to the start of the call: {@code row} counts lines
 * below the call's first line, {@code indent} counts columns from the call's first column.
 *
 * @param source the subexpression's normalized source
 */
public record ValueDisplay<V>(V value, int row, int indent, String source) {
}
