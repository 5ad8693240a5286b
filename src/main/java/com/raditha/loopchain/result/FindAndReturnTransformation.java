package com.raditha.loopchain.result;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.generation.ChainedCallGenerator;
import com.raditha.loopchain.model.CommentSavingRange;
import com.raditha.loopchain.util.ASTUtility;

/**
 * A loop that returns from inside the body, followed by a return of the fallback value.
 * <pre>
 * for (String s : names) {
 *     if (s.isEmpty()) return s;
 * }
 * return null;
 * </pre>
 * The trailing return takes the call chain and the loop is deleted.
 */
public class FindAndReturnTransformation implements ResultTransformation {

    private final Statement loop;
    private final ReturnStmt endReturn;
    private final FindOperationGenerator generator;

    public FindAndReturnTransformation(Statement loop, ReturnStmt endReturn, FindOperationGenerator generator) {
        this.loop = loop;
        this.endReturn = endReturn;
        this.generator = generator;
    }

    @Override
    public Statement getLoop() {
        return loop;
    }

    @Override
    public String getPresentation() {
        return generator.getPresentation();
    }

    @Override
    public int getChainCallCount() {
        return generator.getChainCallCount();
    }

    @Override
    public CommentSavingRange getCommentSavingRange() {
        return new CommentSavingRange(ASTUtility.withLabels(loop), endReturn);
    }

    @Override
    public Expression generateCode(ChainedCallGenerator chainedCallGenerator) {
        return generator.generate(chainedCallGenerator);
    }

    @Override
    public Expression getExpressionToBeReplacedByResultCallChain() {
        return endReturn.getExpression()
                .orElseThrow(() -> new IllegalStateException("Return after the loop has no value: " + endReturn));
    }

    @Override
    public Statement convertLoop(Expression resultCallChain) {
        endReturn.setExpression(resultCallChain);
        ASTUtility.deleteWithLabels(loop);
        return endReturn;
    }

    FindOperationGenerator getGenerator() {
        return generator;
    }
}
