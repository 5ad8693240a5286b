package com.raditha.loopchain.result;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.generation.ChainedCallGenerator;
import com.raditha.loopchain.model.VariableInitialization;

/**
 * A loop that assigns a local declared before it, then optionally breaks.
 * <pre>
 * String found = null;
 * for (String s : names) {
 *     if (s.isEmpty()) { found = s; break; }
 * }
 * </pre>
 */
public class FindAndAssignTransformation extends AssignToVariableResultTransformation {

    private final FindOperationGenerator generator;

    public FindAndAssignTransformation(Statement loop, VariableInitialization initialization,
                                       FindOperationGenerator generator) {
        super(loop, initialization);
        this.generator = generator;
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
    public Expression generateCode(ChainedCallGenerator chainedCallGenerator) {
        return generator.generate(chainedCallGenerator);
    }

    FindOperationGenerator getGenerator() {
        return generator;
    }
}
