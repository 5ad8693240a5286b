package com.raditha.loopchain.refactoring;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

/**
 * Outcome of converting one loop.
 *
 * @param presentation    short name of the operation, for example {@code firstOrNull{}}
 * @param chainCallCount  number of chained calls in the replacement
 * @param resultStatement the statement that now holds the call chain
 * @param callChain       the call chain that replaced the loop
 */
public record ConversionResult(
        String presentation,
        int chainCallCount,
        Statement resultStatement,
        Expression callChain) {
}
