package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

/**
 * Decides whether an expression evaluates to the same value on every iteration of a loop
 * and can be evaluated once before it without side effects.
 */
public interface LoopInvarianceOracle {

    boolean isStableInLoop(Expression expression, Statement loop);
}
