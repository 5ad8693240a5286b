package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.body.VariableDeclarator;

/**
 * Answers nullability questions about loop variables.
 */
public interface NullabilityOracle {

    TypeNullability nullability(VariableDeclarator variable);

    default boolean canHoldNull(VariableDeclarator variable) {
        return nullability(variable) != TypeNullability.NOT_NULL;
    }
}
