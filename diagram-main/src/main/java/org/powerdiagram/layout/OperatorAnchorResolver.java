package org.powerdiagram.layout;

import java.util.logging.Logger;

import org.powerdiagram.AnchorNotFoundException;
import org.powerdiagram.DiagramSettings;

/**
 * Finds the column, within a subexpression's own source, that its value is displayed under.
 * Operator expressions anchor on the first occurrence of their operator token; everything else
 * anchors on the first character.
 */
public final class OperatorAnchorResolver {

    private static final Logger LOG = Logger.getLogger(OperatorAnchorResolver.class.getName());

    private final DiagramSettings settings;

    public OperatorAnchorResolver(DiagramSettings settings) {
        this.settings = settings;
    }

    /**
     * @return a zero-based offset into {@code source}; 0 if the operator token does not occur
     * @throws AnchorNotFoundException if the token is missing and strict anchoring is enabled
     */
    public int anchorOffset(String source, OperatorKind operator) {
        String token = switch (operator.tag()) {
            case NONE -> null;
            case INFIX, EQ, NOT_EQ, LT, GT, LT_EQ, GT_EQ -> operator.token();
        };
        if (token == null) {
            return 0;
        }

        int offset = source.indexOf(token);
        if (offset >= 0) {
            return offset;
        }
        if (settings.isStrictAnchors()) {
            throw new AnchorNotFoundException(source, token);
        }
        LOG.warning(() -> "Operator " + operator + " not found in '" + source + "', anchoring value at column 0");
        return 0;
    }
}
