package com.raditha.loopchain.model;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;

/**
 * A loop body statement tagged with its {@link StatementKind}.
 *
 * @param kind      the classified shape
 * @param statement the statement node, still attached to the loop body
 */
public record LoopStatement(StatementKind kind, Statement statement) {

    /**
     * Classify a statement once.
     */
    public static LoopStatement classify(Statement statement) {
        if (statement.isExpressionStmt() && statement.asExpressionStmt().getExpression().isAssignExpr()) {
            return new LoopStatement(StatementKind.ASSIGNMENT, statement);
        }
        if (statement.isBreakStmt()) {
            return new LoopStatement(StatementKind.BREAK, statement);
        }
        if (statement.isReturnStmt()) {
            return new LoopStatement(StatementKind.RETURN, statement);
        }
        return new LoopStatement(StatementKind.OTHER, statement);
    }

    public AssignExpr asAssignment() {
        requireKind(StatementKind.ASSIGNMENT);
        return statement.asExpressionStmt().getExpression().asAssignExpr();
    }

    public BreakStmt asBreak() {
        requireKind(StatementKind.BREAK);
        return statement.asBreakStmt();
    }

    public ReturnStmt asReturn() {
        requireKind(StatementKind.RETURN);
        return statement.asReturnStmt();
    }

    private void requireKind(StatementKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " statement but was " + kind + ": " + statement);
        }
    }
}
