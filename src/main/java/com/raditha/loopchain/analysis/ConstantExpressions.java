package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.UnaryExpr;

/**
 * Recognizes expressions whose value is fixed at compile time.
 */
public class ConstantExpressions {

    private ConstantExpressions() {
        /* this is only a utility class */
    }

    /**
     * Literals, {@code null}, signed numeric literals and parenthesized constants.
     */
    public static boolean isConstant(Expression expression) {
        if (expression.isLiteralExpr()) {
            return true;
        }
        if (expression.isEnclosedExpr()) {
            return isConstant(expression.asEnclosedExpr().getInner());
        }
        if (expression.isUnaryExpr()) {
            UnaryExpr unary = expression.asUnaryExpr();
            return (unary.getOperator() == UnaryExpr.Operator.MINUS || unary.getOperator() == UnaryExpr.Operator.PLUS)
                    && isNumericLiteral(unary.getExpression());
        }
        return false;
    }

    public static boolean isTrueConstant(Expression expression) {
        return expression.isBooleanLiteralExpr() && expression.asBooleanLiteralExpr().getValue();
    }

    public static boolean isFalseConstant(Expression expression) {
        return expression.isBooleanLiteralExpr() && !expression.asBooleanLiteralExpr().getValue();
    }

    private static boolean isNumericLiteral(Expression expression) {
        return expression.isIntegerLiteralExpr()
                || expression.isLongLiteralExpr()
                || expression.isDoubleLiteralExpr();
    }
}
