package org.powerdiagram.javaparser;

import java.util.EnumMap;
import java.util.Map;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import org.powerdiagram.layout.OperatorKind;

public final class JavaParserOperators {

    private static final Map<BinaryExpr.Operator, OperatorKind> OPERATOR_MAP = new EnumMap<>(Map.of(
            BinaryExpr.Operator.EQUALS, OperatorKind.EQ,
            BinaryExpr.Operator.NOT_EQUALS, OperatorKind.NOT_EQ,
            BinaryExpr.Operator.LESS, OperatorKind.LT,
            BinaryExpr.Operator.GREATER, OperatorKind.GT,
            BinaryExpr.Operator.LESS_EQUALS, OperatorKind.LT_EQ,
            BinaryExpr.Operator.GREATER_EQUALS, OperatorKind.GT_EQ
    ));

    private JavaParserOperators() {
    }

    /**
     * Anchoring kind of a JavaParser expression. Only equality and relational binary expressions
     * anchor on their operator; Java has no infix function calls.
     */
    public static OperatorKind operatorKind(Expression expression) {
        if (!expression.isBinaryExpr()) {
            return OperatorKind.NONE;
        }
        return OPERATOR_MAP.getOrDefault(expression.asBinaryExpr().getOperator(), OperatorKind.NONE);
    }
}
