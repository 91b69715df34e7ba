package org.powerdiagram;

public class DiagramException extends RuntimeException {

    public DiagramException(String message) {
        super(message);
    }

    public DiagramException(String message, Throwable cause) {
        super(message, cause);
    }

    public DiagramException(Throwable cause) {
        super(cause);
    }
}
