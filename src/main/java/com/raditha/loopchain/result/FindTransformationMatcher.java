package com.raditha.loopchain.result;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.analysis.ConstantExpressions;
import com.raditha.loopchain.analysis.VariableUsages;
import com.raditha.loopchain.model.FilterCondition;
import com.raditha.loopchain.model.LoopStatement;
import com.raditha.loopchain.model.MatchingState;
import com.raditha.loopchain.model.StatementKind;
import com.raditha.loopchain.model.VariableInitialization;
import com.raditha.loopchain.util.ASTUtility;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Matches loops that search a collection and deliver the element, a flag or an index through a
 * return statement or a local variable.
 */
public class FindTransformationMatcher implements TransformationMatcher {

    private static final Logger logger = LoggerFactory.getLogger(FindTransformationMatcher.class);

    private final FindOperationSelector selector;

    public FindTransformationMatcher(FindOperationSelector selector) {
        this.selector = selector;
    }

    @Override
    public Optional<TransformationMatch.Result> match(MatchingState state) {
        return matchWithFilterBefore(state, null);
    }

    /**
     * Match a loop whose leading filter has already been peeled off.
     *
     * @param state  the loop, with the statements that remain after the filter
     * @param filter the peeled filter, null when the body is unconditional
     */
    public Optional<TransformationMatch.Result> matchWithFilterBefore(MatchingState state,
                                                                     @Nullable FilterCondition filter) {
        Optional<TransformationMatch.Result> returnMatch = matchReturn(state, filter);
        if (returnMatch.isPresent()) {
            return returnMatch;
        }

        List<LoopStatement> statements = state.statements();
        boolean findFirst;
        switch (statements.size()) {
            case 1 -> findFirst = false;
            case 2 -> {
                LoopStatement second = statements.get(1);
                if (second.kind() != StatementKind.BREAK || !breaksOutOf(second.asBreak(), state.outerLoop())) {
                    return Optional.empty();
                }
                findFirst = true;
            }
            default -> {
                return Optional.empty();
            }
        }

        LoopStatement first = statements.get(0);
        if (first.kind() != StatementKind.ASSIGNMENT) {
            return Optional.empty();
        }
        AssignExpr assignment = first.asAssignment();
        if (assignment.getOperator() != AssignExpr.Operator.ASSIGN) {
            return Optional.empty();
        }

        VariableInitialization initialization = VariableUsages.findVariableInitializationBeforeLoop(
                assignment.getTarget(), state.outerLoop(), true);
        if (initialization == null) {
            logger.debug("'{}' is not a local initialized before the loop", assignment.getTarget());
            return Optional.empty();
        }
        if (!ConstantExpressions.isConstant(initialization.initializer())) {
            logger.debug("Initializer '{}' is not a constant", initialization.initializer());
            return Optional.empty();
        }

        FindOperationGenerator generator = selector.buildFindOperationGenerator(
                state, filter, assignment.getValue(), initialization.initializer(), findFirst);
        if (generator == null) {
            return Optional.empty();
        }
        return Optional.of(new TransformationMatch.Result(
                new FindAndAssignTransformation(state.outerLoop(), initialization, generator)));
    }

    /**
     * {@code for (...) { return x; } return y;}
     */
    Optional<TransformationMatch.Result> matchReturn(MatchingState state, @Nullable FilterCondition filter) {
        List<LoopStatement> statements = state.statements();
        if (statements.size() != 1 || statements.get(0).kind() != StatementKind.RETURN) {
            return Optional.empty();
        }
        Statement next = ASTUtility.nextStatement(state.outerLoop()).orElse(null);
        if (next == null || !next.isReturnStmt()) {
            return Optional.empty();
        }

        ReturnStmt inLoopReturn = statements.get(0).asReturn();
        ReturnStmt endReturn = next.asReturnStmt();
        Optional<Expression> valueIfFound = inLoopReturn.getExpression();
        Optional<Expression> valueIfNotFound = endReturn.getExpression();
        if (valueIfFound.isEmpty() || valueIfNotFound.isEmpty()) {
            return Optional.empty();
        }

        FindOperationGenerator generator = selector.buildFindOperationGenerator(
                state, filter, valueIfFound.get(), valueIfNotFound.get(), true);
        if (generator == null) {
            return Optional.empty();
        }
        return Optional.of(new TransformationMatch.Result(
                new FindAndReturnTransformation(state.outerLoop(), endReturn, generator)));
    }

    private static boolean breaksOutOf(BreakStmt breakStmt, Statement loop) {
        return breakStmt.getLabel()
                .map(label -> ASTUtility.labelsOf(loop).contains(label.asString()))
                .orElse(true);
    }
}
