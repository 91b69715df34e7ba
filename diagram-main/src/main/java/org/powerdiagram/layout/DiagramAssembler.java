package org.powerdiagram.layout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.powerdiagram.message.DiagramMessage;

/**
 * Lays out the diagram: every line of the call source, and below each line that has captured
 * values a bar line marking their columns followed by one line per value, rightmost value first.
 * <pre>
 * check(a == b)
 *       | |  |
 *       | |  2
 *       | false
 *       1
 * </pre>
 * Values whose indents are equal keep the order they were captured in.
 */
public final class DiagramAssembler {

    private static final Logger LOG = Logger.getLogger(DiagramAssembler.class.getName());

    private static final Comparator<ValueDisplay<?>> BY_INDENT = Comparator.comparingInt(ValueDisplay::indent);

    private DiagramAssembler() {
    }

    /**
     * @param title      first literal of the message
     * @param callSource the call's normalized source
     * @param displays   projected values, in capture order
     */
    public static <V> DiagramMessage<V> assemble(String title, String callSource, List<ValueDisplay<V>> displays) {
        Map<Integer, List<ValueDisplay<V>>> valuesByRow = new TreeMap<>();
        for (ValueDisplay<V> display : displays) {
            valuesByRow.computeIfAbsent(display.row(), row -> new ArrayList<>()).add(display);
        }

        String[] rows = callSource.split("\n", -1);
        DiagramMessage.Builder<V> message = DiagramMessage.<V>builder().literal(title);

        for (int row = 0; row < rows.length; row++) {
            List<ValueDisplay<V>> rowValues = valuesByRow.getOrDefault(row, List.of());

            message.literal("\n").literal(rows[row]);
            if (rowValues.isEmpty()) {
                continue;
            }

            List<ValueDisplay<V>> ascending = new ArrayList<>(rowValues);
            ascending.sort(BY_INDENT);
            int[] indents = ascending.stream().mapToInt(ValueDisplay::indent).toArray();

            message.literal("\n").literal(barLine(indents, Integer.MAX_VALUE));

            List<ValueDisplay<V>> descending = new ArrayList<>(rowValues);
            descending.sort(BY_INDENT.reversed());
            for (ValueDisplay<V> display : descending) {
                StringBuilder line = barLine(indents, display.indent());
                int last = lastMarkerBefore(indents, display.indent());
                pad(line, display.indent() - last - 1);
                message.literal("\n").literal(line).slot(display.value());
            }
        }

        if (LOG.isLoggable(Level.FINE)) {
            for (int row : valuesByRow.keySet()) {
                if (row < 0 || row >= rows.length) {
                    LOG.fine("Dropping " + valuesByRow.get(row).size() + " value(s) on row " + row
                             + " outside the call's " + rows.length + " line(s)");
                }
            }
        }
        return message.build();
    }

    /**
     * A {@code |} under every distinct indent below {@code limit}, in ascending order.
     */
    static StringBuilder barLine(int[] indents, int limit) {
        StringBuilder line = new StringBuilder();
        int last = -1;
        for (int indent : indents) {
            if (indent >= limit) {
                break;
            }
            if (indent > last) {
                pad(line, indent - last - 1).append('|');
            }
            last = indent;
        }
        return line;
    }

    private static int lastMarkerBefore(int[] indents, int limit) {
        int last = -1;
        for (int indent : indents) {
            if (indent >= limit) {
                break;
            }
            last = indent;
        }
        return last;
    }

    private static StringBuilder pad(StringBuilder line, int width) {
        for (int i = 0; i < width; i++) {
            line.append(' ');
        }
        return line;
    }
}
