package org.powerdiagram.layout;

import java.util.Objects;

/**
 * Syntactic kind of a captured subexpression, as far as value anchoring cares. Binary operators
 * carry the token the displayed value is aligned under; {@link #infix(String)} covers a named
 * function invoked in operator position.
 */
public final class OperatorKind {

    public enum Tag {
        NONE,
        INFIX,
        EQ,
        NOT_EQ,
        LT,
        GT,
        LT_EQ,
        GT_EQ
    }

    public static final OperatorKind NONE = new OperatorKind(Tag.NONE, null);
    public static final OperatorKind EQ = new OperatorKind(Tag.EQ, "==");
    public static final OperatorKind NOT_EQ = new OperatorKind(Tag.NOT_EQ, "!=");
    public static final OperatorKind LT = new OperatorKind(Tag.LT, "<");
    public static final OperatorKind GT = new OperatorKind(Tag.GT, ">");
    public static final OperatorKind LT_EQ = new OperatorKind(Tag.LT_EQ, "<=");
    public static final OperatorKind GT_EQ = new OperatorKind(Tag.GT_EQ, ">=");

    private final Tag tag;
    private final String token;

    private OperatorKind(Tag tag, String token) {
        this.tag = tag;
        this.token = token;
    }

    public static OperatorKind infix(String functionName) {
        Objects.requireNonNull(functionName, "functionName");
        if (functionName.isEmpty()) {
            throw new IllegalArgumentException("Infix function name must not be empty");
        }
        return new OperatorKind(Tag.INFIX, functionName);
    }

    public Tag tag() {
        return tag;
    }

    /**
     * The source token to anchor on, or {@code null} for {@link #NONE}.
     */
    public String token() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OperatorKind that)) {
            return false;
        }
        return tag == that.tag && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, token);
    }

    @Override
    public String toString() {
        return tag == Tag.INFIX ? "INFIX(" + token + ")" : tag.name();
    }
}
