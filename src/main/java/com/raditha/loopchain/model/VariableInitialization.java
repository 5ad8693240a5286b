package com.raditha.loopchain.model;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

/**
 * The last initialization of a local variable before a loop.
 *
 * @param variable                the declaration of the variable
 * @param initializationStatement the declaration statement or the {@code x = ...;} statement
 * @param initializer             the value assigned there
 */
public record VariableInitialization(
        VariableDeclarator variable,
        Statement initializationStatement,
        Expression initializer) {
}
