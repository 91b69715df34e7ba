package org.powerdiagram;

public class AnchorNotFoundException extends DiagramException {

    private final String source;
    private final String token;

    public AnchorNotFoundException(String source, String token) {
        super("Operator token '" + token + "' not found in '" + source + "'");
        this.source = source;
        this.token = token;
    }

    public String getSource() {
        return source;
    }

    public String getToken() {
        return token;
    }
}
