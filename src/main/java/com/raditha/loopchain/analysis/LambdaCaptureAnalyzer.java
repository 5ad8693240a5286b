package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.raditha.loopchain.util.ASTUtility;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks that an expression can be moved into a lambda body.
 * <p>
 * A lambda may only capture local variables that are effectively final. Any local of the
 * enclosing method referenced by the expression must therefore never be reassigned, incremented
 * or decremented in that method.
 */
public class LambdaCaptureAnalyzer {

    /**
     * @param body             the expression that would become the lambda body
     * @param lambdaParameters names bound by the lambda itself
     * @param context          a node of the method the lambda will live in (normally the loop)
     */
    public boolean canCaptureInLambda(Expression body, Set<String> lambdaParameters, Node context) {
        Node enclosingBody = ASTUtility.enclosingBody(context);
        Set<String> locals = VariableUsages.declaredNames(enclosingBody);
        Set<String> reassigned = findReassignedNames(enclosingBody);

        for (String captured : findCapturedNames(body, lambdaParameters)) {
            if (locals.contains(captured) && reassigned.contains(captured)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Simple names referenced by the expression that are neither lambda parameters nor bound by
     * a lambda nested inside the expression.
     */
    Set<String> findCapturedNames(Expression body, Set<String> lambdaParameters) {
        Set<String> captured = new HashSet<>();
        for (NameExpr name : body.findAll(NameExpr.class)) {
            String identifier = name.getNameAsString();
            if (!lambdaParameters.contains(identifier) && !isBoundByNestedLambda(name, identifier, body)) {
                captured.add(identifier);
            }
        }
        return captured;
    }

    private boolean isBoundByNestedLambda(NameExpr name, String identifier, Expression root) {
        Node current = name.getParentNode().orElse(null);
        while (current != null && current != root.getParentNode().orElse(null)) {
            if (current instanceof LambdaExpr lambda
                    && lambda.getParameters().stream().anyMatch(p -> p.getNameAsString().equals(identifier))) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private Set<String> findReassignedNames(Node scope) {
        Set<String> reassigned = new HashSet<>();
        scope.findAll(AssignExpr.class).forEach(assign -> {
            if (assign.getTarget().isNameExpr()) {
                reassigned.add(assign.getTarget().asNameExpr().getNameAsString());
            }
        });
        scope.findAll(UnaryExpr.class).forEach(unary -> {
            if (isIncrementOrDecrement(unary) && unary.getExpression().isNameExpr()) {
                reassigned.add(unary.getExpression().asNameExpr().getNameAsString());
            }
        });
        return reassigned;
    }

    static boolean isIncrementOrDecrement(UnaryExpr unary) {
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }
}
