package com.raditha.loopchain.generation;

import com.github.javaparser.ast.expr.Expression;

import java.util.Arrays;

/**
 * {@link ChainedCallGenerator} that renders patterns as Java source and parses them back.
 */
public class JavaChainedCallGenerator implements ChainedCallGenerator {

    private final Expression receiver;

    /**
     * @param receiver the collection expression of the loop; it is copied, never moved
     */
    public JavaChainedCallGenerator(Expression receiver) {
        this.receiver = receiver;
    }

    @Override
    public Expression getReceiver() {
        return receiver;
    }

    @Override
    public Expression generate(String pattern, Expression... arguments) {
        return generateOn(receiver, pattern, arguments);
    }

    @Override
    public Expression generateOn(Expression explicitReceiver, String pattern, Expression... arguments) {
        Expression[] all = Arrays.copyOf(arguments, arguments.length + 1);
        all[arguments.length] = ExpressionPatterns.parenthesizeIfNeeded(explicitReceiver);
        return ExpressionPatterns.createExpressionByPattern("$" + arguments.length + "." + pattern, all);
    }
}
