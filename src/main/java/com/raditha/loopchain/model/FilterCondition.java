package com.raditha.loopchain.model;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import org.jspecify.annotations.Nullable;

/**
 * Filtering predicate peeled from the head of a loop body.
 *
 * @param condition     side-effect free boolean expression over the loop variables
 * @param indexVariable the loop index when the condition references it, otherwise null
 */
public record FilterCondition(Expression condition, @Nullable VariableDeclarator indexVariable) {

    /**
     * The predicate an element has to satisfy to reach the rest of the body.
     */
    public Expression effectiveCondition() {
        return condition;
    }
}
