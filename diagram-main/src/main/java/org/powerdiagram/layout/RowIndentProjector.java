package org.powerdiagram.layout;

import org.powerdiagram.source.SpanInfo;

/**
 * Converts a subexpression's absolute position into a (row, indent) pair relative to the call,
 * moved onto the subexpression's anchor. An anchor that sits on a later line than the subexpression
 * start moves the value down to that line, at the anchor's column on it.
 */
public final class RowIndentProjector {

    private RowIndentProjector() {
    }

    /**
     * @param call             resolved position of the whole call
     * @param subexpression    resolved position of the captured subexpression
     * @param normalizedSource the subexpression's source after indentation normalization
     * @param anchorOffset     offset of the anchor within {@code normalizedSource}
     */
    public static <V> ValueDisplay<V> project(SpanInfo call, SpanInfo subexpression, String normalizedSource,
                                              int anchorOffset, V value) {
        if (anchorOffset < 0 || anchorOffset > normalizedSource.length()) {
            throw new IllegalArgumentException("Anchor offset " + anchorOffset + " outside source of length "
                                               + normalizedSource.length());
        }
        int row = subexpression.startLine() - call.startLine();
        int indent = subexpression.startColumn() - call.startColumn();

        String prefix = normalizedSource.substring(0, anchorOffset);
        int rowShift = countLineBreaks(prefix);
        if (rowShift == 0) {
            indent += anchorOffset;
        } else {
            row += rowShift;
            indent = anchorOffset - (prefix.lastIndexOf('\n') + 1);
        }
        return new ValueDisplay<>(value, row, indent, normalizedSource);
    }

    static int countLineBreaks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
