package org.powerdiagram;

public class InvalidSpanException extends DiagramException {

    private final int start;
    private final int end;
    private final int textLength;

    public InvalidSpanException(String message, int start, int end) {
        this(message, start, end, -1);
    }

    public InvalidSpanException(String message, int start, int end, int textLength) {
        super(message);
        this.start = start;
        this.end = end;
        this.textLength = textLength;
    }

    public InvalidSpanException(String message, int start, int end, Throwable cause) {
        super(message, cause);
        this.start = start;
        this.end = end;
        this.textLength = -1;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Length of the text the span was checked against, or -1 when the span was rejected on its own.
     */
    public int getTextLength() {
        return textLength;
    }
}
