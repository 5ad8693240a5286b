package com.raditha.loopchain.generation;

import com.github.javaparser.ast.expr.Expression;

/**
 * Emits call chains on top of the collection a loop iterates over.
 * <p>
 * Patterns are Java source fragments with positional placeholders {@code $0}, {@code $1}, ...
 * that are replaced by the printed argument expressions, for example
 * {@code "stream().filter($0).findFirst()"}.
 */
public interface ChainedCallGenerator {

    /**
     * The expression the chain starts from.
     */
    Expression getReceiver();

    /**
     * Render {@code <receiver>.<pattern>}.
     */
    Expression generate(String pattern, Expression... arguments);

    /**
     * Render {@code <receiver>.<pattern>} on an explicit receiver.
     */
    Expression generateOn(Expression receiver, String pattern, Expression... arguments);
}
