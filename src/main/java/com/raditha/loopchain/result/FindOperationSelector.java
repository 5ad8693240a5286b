package com.raditha.loopchain.result;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.raditha.loopchain.analysis.ConstantExpressions;
import com.raditha.loopchain.analysis.LambdaCaptureAnalyzer;
import com.raditha.loopchain.analysis.LoopInvarianceOracle;
import com.raditha.loopchain.analysis.NullabilityOracle;
import com.raditha.loopchain.analysis.VariableUsages;
import com.raditha.loopchain.generation.ExpressionPatterns;
import com.raditha.loopchain.model.FilterCondition;
import com.raditha.loopchain.model.MatchingState;
import com.raditha.loopchain.util.ASTUtility;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the operation that reproduces a find loop, given what the loop yields when an element
 * matches and when none does.
 */
public class FindOperationSelector {

    private static final Logger logger = LoggerFactory.getLogger(FindOperationSelector.class);

    private final NullabilityOracle nullabilityOracle;
    private final LoopInvarianceOracle invarianceOracle;
    private final LambdaCaptureAnalyzer captureAnalyzer;
    private final boolean useMethodReferences;

    public FindOperationSelector(NullabilityOracle nullabilityOracle,
                                 LoopInvarianceOracle invarianceOracle,
                                 LambdaCaptureAnalyzer captureAnalyzer,
                                 boolean useMethodReferences) {
        this.nullabilityOracle = nullabilityOracle;
        this.invarianceOracle = invarianceOracle;
        this.captureAnalyzer = captureAnalyzer;
        this.useMethodReferences = useMethodReferences;
    }

    /**
     * Build the generator for a find loop.
     *
     * @param state           the loop
     * @param filterCondition the filter peeled off the loop body, if any
     * @param valueIfFound    what the loop produces for a matching element
     * @param valueIfNotFound what the code produces when no element matches
     * @param findFirst       whether the first match wins (otherwise the last one does)
     * @return the generator, or null when no operation reproduces the loop
     * @throws IllegalStateException if one of the values is not part of a source tree
     */
    public @Nullable FindOperationGenerator buildFindOperationGenerator(
            MatchingState state,
            @Nullable FilterCondition filterCondition,
            Expression valueIfFound,
            Expression valueIfNotFound,
            boolean findFirst) {
        requireAttached(valueIfFound);
        requireAttached(valueIfNotFound);

        Statement loop = state.outerLoop();
        VariableDeclarator inputVariable = state.inputVariable();
        VariableDeclarator indexVariable = state.indexVariable();
        Expression filter = filterCondition == null ? null : filterCondition.effectiveCondition();

        if (filter != null && !captureAnalyzer.canCaptureInLambda(filter, lambdaParameters(state), loop)) {
            logger.debug("Filter '{}' captures a local that is not effectively final", filter);
            return null;
        }

        if (indexVariable != null) {
            if (filterCondition == null) {
                return null;
            }
            // indexOfFirst/indexOfLast cannot hand the index to the predicate
            if (filterCondition.indexVariable() != null) {
                return null;
            }

            // only -1 is recognized as the "not found" index
            if (VariableUsages.isVariableReference(valueIfFound, indexVariable)
                    && ExpressionPatterns.print(valueIfNotFound).equals("-1")) {
                Expression containsArgument = isFilterForContainsOperation(filter, inputVariable, loop);
                if (containsArgument != null) {
                    FindOperation operation = findFirst ? FindOperation.INDEX_OF : FindOperation.LAST_INDEX_OF;
                    return simple(operation, state, null, containsArgument);
                }
                // the predicate reads elements through the collection
                if (!captureAnalyzer.canCaptureInLambda(state.iterable(), Set.of(), loop)) {
                    return null;
                }
                FindOperation operation = findFirst ? FindOperation.INDEX_OF_FIRST : FindOperation.INDEX_OF_LAST;
                return simple(operation, state, filter, null);
            }
            return null;
        }

        boolean inputVariableCanHoldNull = nullabilityOracle.canHoldNull(inputVariable);

        if (VariableUsages.isVariableReference(valueIfFound, inputVariable)) {
            // findFirst() and reduce() throw on a null element
            if (inputVariableCanHoldNull) {
                logger.debug("Element '{}' may be null", inputVariable.getNameAsString());
                return null;
            }
            FindOperation operation = findFirst ? FindOperation.FIRST_OR_NULL : FindOperation.LAST_OR_NULL;
            return useElvisOperatorIfNeeded(simple(operation, state, filter, null), valueIfNotFound, loop);
        }

        if (ConstantExpressions.isTrueConstant(valueIfFound) && ConstantExpressions.isFalseConstant(valueIfNotFound)) {
            return buildFoundFlagGenerator(state, filter, false);
        }

        if (ConstantExpressions.isFalseConstant(valueIfFound) && ConstantExpressions.isTrueConstant(valueIfNotFound)) {
            return buildFoundFlagGenerator(state, filter, true);
        }

        if (VariableUsages.hasUsages(inputVariable, valueIfFound)) {
            // a later match would evaluate valueIfFound again; its side effects cannot be dropped
            if (!findFirst) {
                return null;
            }
            // firstOrNull cannot tell "nothing found" from "found null", and findFirst() rejects null
            if (inputVariableCanHoldNull) {
                logger.debug("Element '{}' may be null", inputVariable.getNameAsString());
                return null;
            }
            if (!captureAnalyzer.canCaptureInLambda(valueIfFound, Set.of(inputVariable.getNameAsString()), loop)) {
                return null;
            }

            FindOperationGenerator findFirstCall = simple(FindOperation.FIRST_OR_NULL, state, filter, null);
            FindOperationGenerator mapped = isSelectorOnInputVariable(valueIfFound, inputVariable)
                    ? new FindOperationGenerator.SafeCallChain(findFirstCall, inputVariable, valueIfFound,
                            useMethodReferences)
                    : new FindOperationGenerator.LetBinding(findFirstCall, inputVariable, valueIfFound);
            // a null mapping result falls back to valueIfNotFound, like ?. followed by ?:
            return useElvisOperatorIfNeeded(mapped, valueIfNotFound, loop);
        }

        FindOperationGenerator foundFlag = buildFoundFlagGenerator(state, filter, false);
        return new FindOperationGenerator.Conditional(foundFlag, valueIfFound, valueIfNotFound);
    }

    /**
     * Generator for a loop that only reports whether a matching element exists.
     *
     * @param negated produce {@code true} when nothing matches
     */
    public FindOperationGenerator buildFoundFlagGenerator(MatchingState state, @Nullable Expression filter, boolean negated) {
        if (filter == null) {
            return simple(negated ? FindOperation.NONE : FindOperation.ANY, state, null, null);
        }

        Expression containsArgument = isFilterForContainsOperation(filter, state.inputVariable(), state.outerLoop());
        if (containsArgument != null) {
            FindOperationGenerator generator = simple(FindOperation.CONTAINS, state, null, containsArgument);
            return negated ? new FindOperationGenerator.Negated(generator) : generator;
        }

        return simple(negated ? FindOperation.NONE : FindOperation.ANY, state, filter, null);
    }

    /**
     * If the filter tests the element for equality with a loop-invariant value, return that value.
     * <p>
     * Recognized: {@code e.equals(x)}, {@code x.equals(e)}, {@code Objects.equals(e, x)},
     * {@code Objects.equals(x, e)}, and {@code e == x} / {@code x == e} for primitive elements
     * whose boxed {@code equals} agrees with {@code ==}.
     */
    public @Nullable Expression isFilterForContainsOperation(Expression filter, VariableDeclarator inputVariable,
                                                             Statement loop) {
        Expression condition = filter;
        while (condition.isEnclosedExpr()) {
            condition = condition.asEnclosedExpr().getInner();
        }

        Expression candidate = null;
        if (condition.isMethodCallExpr()) {
            candidate = equalsCallArgument(condition.asMethodCallExpr(), inputVariable);
        } else if (condition.isBinaryExpr() && condition.asBinaryExpr().getOperator() == BinaryExpr.Operator.EQUALS) {
            BinaryExpr binary = condition.asBinaryExpr();
            Expression other = otherOperand(binary.getLeft(), binary.getRight(), inputVariable);
            if (other != null && primitiveEqualityMatchesEquals(inputVariable.getType(), other, loop)) {
                candidate = other;
            }
        }

        if (candidate == null
                || VariableUsages.hasUsages(inputVariable, candidate)
                || !invarianceOracle.isStableInLoop(candidate, loop)) {
            return null;
        }
        return candidate;
    }

    private @Nullable FindOperationGenerator useElvisOperatorIfNeeded(FindOperationGenerator generator,
                                                                     Expression valueIfNotFound,
                                                                     Statement loop) {
        if (valueIfNotFound.isNullLiteralExpr()) {
            return generator;
        }

        boolean lazy = !isCheapValue(valueIfNotFound);
        if (lazy && !captureAnalyzer.canCaptureInLambda(valueIfNotFound, Set.of(), loop)) {
            return null;
        }
        return new FindOperationGenerator.Elvis(generator, valueIfNotFound, lazy);
    }

    private FindOperationGenerator.Simple simple(FindOperation operation, MatchingState state,
                                                 @Nullable Expression filter, @Nullable Expression argument) {
        Set<String> reservedNames = VariableUsages.declaredNames(ASTUtility.enclosingBody(state.outerLoop()));
        return new FindOperationGenerator.Simple(operation, state.inputVariable(), filter, argument,
                state.indexVariable(), reservedNames);
    }

    private static Set<String> lambdaParameters(MatchingState state) {
        Set<String> names = new HashSet<>();
        names.add(state.inputVariable().getNameAsString());
        if (state.indexVariable() != null) {
            names.add(state.indexVariable().getNameAsString());
        }
        return names;
    }

    private static void requireAttached(Expression expression) {
        if (expression.getParentNode().isEmpty()) {
            throw new IllegalStateException("Expression is not part of a source tree: " + expression);
        }
    }

    /**
     * {@code e.method(args)} or {@code e.field} where only the receiver mentions the element.
     */
    private static boolean isSelectorOnInputVariable(Expression value, VariableDeclarator inputVariable) {
        if (value.isFieldAccessExpr()) {
            return VariableUsages.isVariableReference(value.asFieldAccessExpr().getScope(), inputVariable);
        }
        if (value.isMethodCallExpr()) {
            MethodCallExpr call = value.asMethodCallExpr();
            return call.getScope().filter(scope -> VariableUsages.isVariableReference(scope, inputVariable)).isPresent()
                    && call.getArguments().stream().noneMatch(a -> VariableUsages.hasUsages(inputVariable, a));
        }
        return false;
    }

    /**
     * Literals, names and field accesses: evaluating them early is indistinguishable from
     * evaluating them after the loop.
     */
    private static boolean isCheapValue(Expression value) {
        if (ConstantExpressions.isConstant(value) || value.isNameExpr() || value.isThisExpr()) {
            return true;
        }
        if (value.isFieldAccessExpr()) {
            return isCheapValue(value.asFieldAccessExpr().getScope());
        }
        return false;
    }

    private static @Nullable Expression equalsCallArgument(MethodCallExpr call, VariableDeclarator inputVariable) {
        if (!call.getNameAsString().equals("equals")) {
            return null;
        }
        Optional<Expression> scope = call.getScope();
        if (call.getArguments().size() == 1 && scope.isPresent()) {
            return otherOperand(scope.get(), call.getArgument(0), inputVariable);
        }
        if (call.getArguments().size() == 2 && scope.isPresent() && isObjectsClass(scope.get())) {
            return otherOperand(call.getArgument(0), call.getArgument(1), inputVariable);
        }
        return null;
    }

    private static boolean isObjectsClass(Expression scope) {
        String name = ExpressionPatterns.print(scope);
        return name.equals("Objects") || name.equals("java.util.Objects");
    }

    private static @Nullable Expression otherOperand(Expression left, Expression right, VariableDeclarator inputVariable) {
        if (VariableUsages.isVariableReference(left, inputVariable)) {
            return right;
        }
        if (VariableUsages.isVariableReference(right, inputVariable)) {
            return left;
        }
        return null;
    }

    /**
     * {@code ==} on primitives agrees with {@code equals} on the boxed collection elements only
     * when the other operand boxes to the same wrapper type, and never for floating point.
     */
    private static boolean primitiveEqualityMatchesEquals(Type elementType, Expression other, Statement loop) {
        if (!elementType.isPrimitiveType()) {
            return false;
        }
        PrimitiveType.Primitive primitive = elementType.asPrimitiveType().getType();
        if (primitive == PrimitiveType.Primitive.FLOAT || primitive == PrimitiveType.Primitive.DOUBLE) {
            return false;
        }
        return switch (primitive) {
            case INT -> other.isIntegerLiteralExpr() || declaredAs(other, elementType, loop);
            case LONG -> other.isLongLiteralExpr() || declaredAs(other, elementType, loop);
            case CHAR -> other.isCharLiteralExpr() || declaredAs(other, elementType, loop);
            case BOOLEAN -> other.isBooleanLiteralExpr() || declaredAs(other, elementType, loop);
            default -> declaredAs(other, elementType, loop);
        };
    }

    private static boolean declaredAs(Expression other, Type elementType, Statement loop) {
        if (!other.isNameExpr()) {
            return false;
        }
        return VariableUsages.findLocalDeclarationType(other.asNameExpr().getNameAsString(), loop)
                .map(type -> type.equals(elementType))
                .orElse(false);
    }
}
