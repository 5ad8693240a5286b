package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.util.ASTUtility;

import java.util.HashSet;
import java.util.Set;

/**
 * Loop invariance judged from the shape of the expression alone.
 * <p>
 * An expression is stable when it is built only from literals, names, field accesses,
 * {@code this}, class literals and side-effect free operators, and none of its names is
 * declared or written inside the loop. Method calls are never considered stable.
 */
public class SyntacticLoopInvarianceOracle implements LoopInvarianceOracle {

    @Override
    public boolean isStableInLoop(Expression expression, Statement loop) {
        Statement scope = ASTUtility.withLabels(loop);
        Set<String> declaredInLoop = VariableUsages.declaredNames(scope);
        Set<String> writtenInLoop = findWrittenNames(scope);
        return isStable(expression, declaredInLoop, writtenInLoop);
    }

    private boolean isStable(Expression expression, Set<String> declaredInLoop, Set<String> writtenInLoop) {
        if (expression.isLiteralExpr() || expression.isThisExpr() || expression.isClassExpr()) {
            return true;
        }
        if (expression.isNameExpr()) {
            String name = expression.asNameExpr().getNameAsString();
            return !declaredInLoop.contains(name) && !writtenInLoop.contains(name);
        }
        if (expression.isFieldAccessExpr()) {
            FieldAccessExpr access = expression.asFieldAccessExpr();
            return !writtenInLoop.contains(access.getNameAsString())
                    && isStable(access.getScope(), declaredInLoop, writtenInLoop);
        }
        if (expression.isEnclosedExpr()) {
            return isStable(expression.asEnclosedExpr().getInner(), declaredInLoop, writtenInLoop);
        }
        if (expression.isUnaryExpr()) {
            UnaryExpr unary = expression.asUnaryExpr();
            return !LambdaCaptureAnalyzer.isIncrementOrDecrement(unary)
                    && isStable(unary.getExpression(), declaredInLoop, writtenInLoop);
        }
        if (expression.isBinaryExpr()) {
            return isStable(expression.asBinaryExpr().getLeft(), declaredInLoop, writtenInLoop)
                    && isStable(expression.asBinaryExpr().getRight(), declaredInLoop, writtenInLoop);
        }
        if (expression.isCastExpr()) {
            return isStable(expression.asCastExpr().getExpression(), declaredInLoop, writtenInLoop);
        }
        if (expression.isConditionalExpr()) {
            return isStable(expression.asConditionalExpr().getCondition(), declaredInLoop, writtenInLoop)
                    && isStable(expression.asConditionalExpr().getThenExpr(), declaredInLoop, writtenInLoop)
                    && isStable(expression.asConditionalExpr().getElseExpr(), declaredInLoop, writtenInLoop);
        }
        return false;
    }

    /**
     * Names of variables and fields assigned, incremented or decremented anywhere in the loop.
     */
    private Set<String> findWrittenNames(Node scope) {
        Set<String> written = new HashSet<>();
        scope.findAll(AssignExpr.class).forEach(assign -> addTargetName(assign.getTarget(), written));
        scope.findAll(UnaryExpr.class).stream()
                .filter(LambdaCaptureAnalyzer::isIncrementOrDecrement)
                .forEach(unary -> addTargetName(unary.getExpression(), written));
        return written;
    }

    private void addTargetName(Expression target, Set<String> written) {
        if (target.isNameExpr()) {
            written.add(target.asNameExpr().getNameAsString());
        } else if (target.isFieldAccessExpr()) {
            written.add(target.asFieldAccessExpr().getNameAsString());
        }
    }
}
