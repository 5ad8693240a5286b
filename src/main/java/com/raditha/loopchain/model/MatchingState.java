package com.raditha.loopchain.model;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Normalized view of a loop handed to the result matchers.
 *
 * @param outerLoop     the {@code for} or enhanced {@code for} statement (never its label)
 * @param statements    body statements left after the leading filter was peeled off
 * @param iterable      the collection the loop scans
 * @param inputVariable the element variable
 * @param indexVariable the index variable of an indexed loop, null for enhanced for loops
 */
public record MatchingState(
        Statement outerLoop,
        List<LoopStatement> statements,
        Expression iterable,
        VariableDeclarator inputVariable,
        @Nullable VariableDeclarator indexVariable) {

    public MatchingState {
        if (statements == null || statements.isEmpty()) {
            throw new IllegalArgumentException("statements cannot be empty");
        }
        if (!outerLoop.isForEachStmt() && !outerLoop.isForStmt()) {
            throw new IllegalArgumentException("outerLoop must be a for statement: " + outerLoop);
        }
        statements = List.copyOf(statements);
    }
}
