package com.raditha.loopchain.result;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.generation.ChainedCallGenerator;
import com.raditha.loopchain.model.CommentSavingRange;

/**
 * Replaces a matched loop with the statement that consumes its call chain.
 * <p>
 * Callers generate the chain with {@link #generateCode} first and then hand it to
 * {@link #convertLoop}, which is the only step that modifies the tree.
 */
public interface ResultTransformation {

    /**
     * The loop statement without its label.
     */
    Statement getLoop();

    String getPresentation();

    int getChainCallCount();

    /**
     * Statements whose comments the rewritten code should keep.
     */
    CommentSavingRange getCommentSavingRange();

    Expression generateCode(ChainedCallGenerator chainedCallGenerator);

    /**
     * The expression that {@link #convertLoop} will overwrite with the call chain.
     */
    Expression getExpressionToBeReplacedByResultCallChain();

    /**
     * Put the call chain in place and remove the loop.
     *
     * @param resultCallChain the chain produced by {@link #generateCode}
     * @return the statement now holding the call chain
     */
    Statement convertLoop(Expression resultCallChain);
}
