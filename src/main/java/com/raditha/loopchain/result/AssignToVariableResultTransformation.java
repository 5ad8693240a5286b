package com.raditha.loopchain.result;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.model.CommentSavingRange;
import com.raditha.loopchain.model.VariableInitialization;
import com.raditha.loopchain.util.ASTUtility;

/**
 * Base for loops whose outcome lands in a local variable initialized before the loop.
 * The call chain becomes the new initializer and the loop goes away.
 */
public abstract class AssignToVariableResultTransformation implements ResultTransformation {

    protected final Statement loop;
    protected final VariableInitialization initialization;

    protected AssignToVariableResultTransformation(Statement loop, VariableInitialization initialization) {
        this.loop = loop;
        this.initialization = initialization;
    }

    @Override
    public Statement getLoop() {
        return loop;
    }

    public VariableInitialization getInitialization() {
        return initialization;
    }

    @Override
    public CommentSavingRange getCommentSavingRange() {
        return new CommentSavingRange(initialization.initializationStatement(), ASTUtility.withLabels(loop));
    }

    @Override
    public Expression getExpressionToBeReplacedByResultCallChain() {
        return initialization.initializer();
    }

    @Override
    public Statement convertLoop(Expression resultCallChain) {
        Statement initializationStatement = initialization.initializationStatement();
        Expression initializer = initialization.initializer();
        if (!initializer.replace(resultCallChain)) {
            throw new IllegalStateException("Could not replace initializer " + initializer);
        }

        Statement outer = ASTUtility.withLabels(loop);
        boolean adjacent = ASTUtility.nextStatement(initializationStatement)
                .filter(next -> next == outer)
                .isPresent();
        if (adjacent) {
            ASTUtility.deleteWithLabels(loop);
        } else {
            // the chain reads the collection at the loop's position, not at the declaration
            initializationStatement.remove();
            outer.replace(initializationStatement);
        }
        return initializationStatement;
    }
}
