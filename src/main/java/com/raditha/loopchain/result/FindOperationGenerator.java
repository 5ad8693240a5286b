package com.raditha.loopchain.result;

import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.Type;
import com.raditha.loopchain.analysis.VariableUsages;
import com.raditha.loopchain.generation.ChainedCallGenerator;
import com.raditha.loopchain.generation.ExpressionPatterns;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Produces the call chain that replaces a find loop.
 * <p>
 * Generators form a small tree: a {@link Simple} leaf renders one operation on the loop's
 * collection and the decorators wrap the output of the generator they own. A tree is built once
 * per match and {@link #generate} is called on its root exactly once; calling it again is not
 * supported.
 */
public abstract class FindOperationGenerator {

    private final String functionName;
    private final boolean hasFilter;
    private final int chainCallCount;

    protected FindOperationGenerator(String functionName, boolean hasFilter, int chainCallCount) {
        this.functionName = functionName;
        this.hasFilter = hasFilter;
        this.chainCallCount = chainCallCount;
    }

    /**
     * Decorators that do not add a call stage describe themselves like the generator they wrap.
     */
    protected FindOperationGenerator(FindOperationGenerator other) {
        this(other.functionName, other.hasFilter, other.chainCallCount);
    }

    public String getFunctionName() {
        return functionName;
    }

    public boolean hasFilter() {
        return hasFilter;
    }

    /**
     * Number of chained call stages in the generated expression.
     */
    public int getChainCallCount() {
        return chainCallCount;
    }

    /**
     * Short description such as {@code firstOrNull{}} (with a filter lambda) or {@code any()}.
     */
    public String getPresentation() {
        return functionName + (hasFilter ? "{}" : "()");
    }

    public abstract Expression generate(ChainedCallGenerator chainedCallGenerator);

    /**
     * The trailing {@code .orElse(null)} of a chain produced by a nullable-element operation.
     *
     * @throws IllegalStateException if the chain does not end that way
     */
    static MethodCallExpr requireNullableUnwrap(Expression generated) {
        if (generated.isMethodCallExpr()) {
            MethodCallExpr call = generated.asMethodCallExpr();
            if (call.getNameAsString().equals("orElse")
                    && call.getScope().isPresent()
                    && call.getArguments().size() == 1
                    && call.getArgument(0).isNullLiteralExpr()) {
                return call;
            }
        }
        throw new IllegalStateException("Expected a chain ending in orElse(null) but got: " + generated);
    }

    /**
     * One operation applied directly to the loop's collection.
     */
    public static final class Simple extends FindOperationGenerator {
        private final FindOperation operation;
        private final VariableDeclarator inputVariable;
        private final @Nullable Expression filter;
        private final @Nullable Expression argument;
        private final @Nullable VariableDeclarator indexVariable;
        private final Set<String> reservedNames;

        /**
         * @param operation     what to render
         * @param inputVariable the loop element variable, used as lambda parameter
         * @param filter        the filter condition, null when the operation takes no lambda
         * @param argument      the argument of {@code contains}/{@code indexOf}
         * @param indexVariable the loop index, required for {@code indexOfFirst}/{@code indexOfLast}
         * @param reservedNames names in scope that helper lambda parameters must not reuse
         */
        Simple(FindOperation operation,
               VariableDeclarator inputVariable,
               @Nullable Expression filter,
               @Nullable Expression argument,
               @Nullable VariableDeclarator indexVariable,
               Set<String> reservedNames) {
            super(operation.functionName(), filter != null, 1);
            this.operation = operation;
            this.inputVariable = inputVariable;
            this.filter = filter;
            this.argument = argument;
            this.indexVariable = indexVariable;
            this.reservedNames = reservedNames;
        }

        public FindOperation getOperation() {
            return operation;
        }

        @Override
        public Expression generate(ChainedCallGenerator chainedCallGenerator) {
            return switch (operation) {
                case FIRST_OR_NULL -> filter == null
                        ? chainedCallGenerator.generate("stream().findFirst().orElse(null)")
                        : chainedCallGenerator.generate("stream().filter($0).findFirst().orElse(null)", filterLambda());
                case LAST_OR_NULL -> {
                    String first = VariableUsages.freshName("first", reservedNames);
                    String second = VariableUsages.freshName("second", reservedNames);
                    LambdaExpr keepLast = ExpressionPatterns.lambda(List.of(first, second), new NameExpr(second));
                    yield filter == null
                            ? chainedCallGenerator.generate("stream().reduce($0).orElse(null)", keepLast)
                            : chainedCallGenerator.generate("stream().filter($0).reduce($1).orElse(null)",
                                    filterLambda(), keepLast);
                }
                case ANY -> filter == null
                        ? ExpressionPatterns.negate(chainedCallGenerator.generate("isEmpty()"))
                        : chainedCallGenerator.generate("stream().anyMatch($0)", filterLambda());
                case NONE -> filter == null
                        ? chainedCallGenerator.generate("isEmpty()")
                        : chainedCallGenerator.generate("stream().noneMatch($0)", filterLambda());
                case CONTAINS -> chainedCallGenerator.generate("contains($0)", requireArgument());
                case INDEX_OF -> chainedCallGenerator.generate("indexOf($0)", requireArgument());
                case LAST_INDEX_OF -> chainedCallGenerator.generate("lastIndexOf($0)", requireArgument());
                case INDEX_OF_FIRST -> {
                    Expression indices = ExpressionPatterns.createExpressionByPattern(
                            "IntStream.range(0, $0.size())",
                            ExpressionPatterns.parenthesizeIfNeeded(chainedCallGenerator.getReceiver()));
                    yield chainedCallGenerator.generateOn(indices, "filter($0).findFirst().orElse(-1)",
                            indexLambda(chainedCallGenerator));
                }
                case INDEX_OF_LAST -> {
                    NameExpr index = new NameExpr(requireIndexVariable().getNameAsString());
                    Expression indices = ExpressionPatterns.createExpressionByPattern(
                            "IntStream.iterate($0.size() - 1, $1 -> $1 >= 0, $1 -> $1 - 1)",
                            ExpressionPatterns.parenthesizeIfNeeded(chainedCallGenerator.getReceiver()), index);
                    yield chainedCallGenerator.generateOn(indices, "filter($0).findFirst().orElse(-1)",
                            indexLambda(chainedCallGenerator));
                }
            };
        }

        private LambdaExpr filterLambda() {
            if (filter == null) {
                throw new IllegalStateException(operation + " needs a filter");
            }
            return ExpressionPatterns.lambda(inputVariable.getNameAsString(), filter);
        }

        /**
         * The filter as a predicate over indices: every reference to the element variable becomes
         * {@code <collection>.get(<index>)}.
         */
        private LambdaExpr indexLambda(ChainedCallGenerator chainedCallGenerator) {
            if (filter == null) {
                throw new IllegalStateException(operation + " needs a filter");
            }
            String index = requireIndexVariable().getNameAsString();
            Expression element = chainedCallGenerator.generate("get($0)", new NameExpr(index));
            return ExpressionPatterns.lambda(index, replaceReferences(filter, inputVariable, element));
        }

        private Expression requireArgument() {
            if (argument == null) {
                throw new IllegalStateException(operation + " needs an argument");
            }
            return argument;
        }

        private VariableDeclarator requireIndexVariable() {
            if (indexVariable == null) {
                throw new IllegalStateException(operation + " needs an index variable");
            }
            return indexVariable;
        }

        private static Expression replaceReferences(Expression expression, VariableDeclarator variable,
                                                    Expression replacement) {
            if (VariableUsages.isVariableReference(expression, variable)) {
                return replacement.clone();
            }
            Expression copy = expression.clone();
            copy.findAll(NameExpr.class).stream()
                    .filter(n -> VariableUsages.isVariableReference(n, variable))
                    .toList()
                    .forEach(n -> n.replace(replacement.clone()));
            return copy;
        }
    }

    /**
     * Supplies the value to use when nothing was found, {@code ?:} in spirit: the trailing
     * {@code orElse(null)} becomes {@code orElse(value)}, or {@code orElseGet(() -> value)} when
     * evaluating the value eagerly could differ from the loop.
     */
    public static final class Elvis extends FindOperationGenerator {
        private final FindOperationGenerator inner;
        private final Expression valueIfNotFound;
        private final boolean lazy;

        Elvis(FindOperationGenerator inner, Expression valueIfNotFound, boolean lazy) {
            super(inner);
            this.inner = inner;
            this.valueIfNotFound = valueIfNotFound;
            this.lazy = lazy;
        }

        public FindOperationGenerator getInner() {
            return inner;
        }

        public boolean isLazy() {
            return lazy;
        }

        @Override
        public Expression generate(ChainedCallGenerator chainedCallGenerator) {
            MethodCallExpr unwrap = requireNullableUnwrap(inner.generate(chainedCallGenerator));
            Expression optional = unwrap.getScope().orElseThrow();
            return lazy
                    ? chainedCallGenerator.generateOn(optional, "orElseGet(() -> $0)", valueIfNotFound)
                    : chainedCallGenerator.generateOn(optional, "orElse($0)", valueIfNotFound);
        }
    }

    /**
     * Chooses between the two loop outcomes with a conditional expression on a found flag.
     */
    public static final class Conditional extends FindOperationGenerator {
        private final FindOperationGenerator inner;
        private final Expression valueIfFound;
        private final Expression valueIfNotFound;

        Conditional(FindOperationGenerator inner, Expression valueIfFound, Expression valueIfNotFound) {
            super(inner);
            this.inner = inner;
            this.valueIfFound = valueIfFound;
            this.valueIfNotFound = valueIfNotFound;
        }

        public FindOperationGenerator getInner() {
            return inner;
        }

        @Override
        public Expression generate(ChainedCallGenerator chainedCallGenerator) {
            Expression condition = inner.generate(chainedCallGenerator);
            return ExpressionPatterns.createExpressionByPattern("$0 ? $1 : $2",
                    condition, branch(valueIfFound), branch(valueIfNotFound));
        }

        private static Expression branch(Expression value) {
            return value.isAssignExpr() || value.isLambdaExpr() ? ExpressionPatterns.parenthesizeIfNeeded(value) : value;
        }
    }

    /**
     * Maps the found element through a member of the element, {@code element.member(...)}.
     * Renders a method reference when the member is a no-argument method and the element type
     * is declared.
     */
    public static final class SafeCallChain extends FindOperationGenerator {
        private final FindOperationGenerator inner;
        private final VariableDeclarator inputVariable;
        private final Expression selectorExpression;
        private final boolean useMethodReference;

        SafeCallChain(FindOperationGenerator inner, VariableDeclarator inputVariable,
                      Expression selectorExpression, boolean useMethodReference) {
            super(inner.getFunctionName(), inner.hasFilter(), inner.getChainCallCount() + 1);
            this.inner = inner;
            this.inputVariable = inputVariable;
            this.selectorExpression = selectorExpression;
            this.useMethodReference = useMethodReference;
        }

        public FindOperationGenerator getInner() {
            return inner;
        }

        @Override
        public Expression generate(ChainedCallGenerator chainedCallGenerator) {
            MethodCallExpr unwrap = requireNullableUnwrap(inner.generate(chainedCallGenerator));
            Expression mapper = methodReference()
                    .orElseGet(() -> ExpressionPatterns.lambda(inputVariable.getNameAsString(), selectorExpression));
            Expression mapped = chainedCallGenerator.generateOn(unwrap.getScope().orElseThrow(), "map($0)", mapper);
            return chainedCallGenerator.generateOn(mapped, "orElse(null)");
        }

        private Optional<Expression> methodReference() {
            if (!useMethodReference || !selectorExpression.isMethodCallExpr()) {
                return Optional.empty();
            }
            MethodCallExpr call = selectorExpression.asMethodCallExpr();
            Type type = inputVariable.getType();
            if (!call.getArguments().isEmpty() || call.getTypeArguments().isPresent()
                    || !type.isClassOrInterfaceType()) {
                return Optional.empty();
            }
            return Optional.of(ExpressionPatterns.methodReference(type.asClassOrInterfaceType(), call.getNameAsString()));
        }
    }

    /**
     * Maps the found element through an arbitrary expression over it.
     */
    public static final class LetBinding extends FindOperationGenerator {
        private final FindOperationGenerator inner;
        private final VariableDeclarator inputVariable;
        private final Expression body;

        LetBinding(FindOperationGenerator inner, VariableDeclarator inputVariable, Expression body) {
            super(inner.getFunctionName(), inner.hasFilter(), inner.getChainCallCount() + 1);
            this.inner = inner;
            this.inputVariable = inputVariable;
            this.body = body;
        }

        public FindOperationGenerator getInner() {
            return inner;
        }

        @Override
        public Expression generate(ChainedCallGenerator chainedCallGenerator) {
            MethodCallExpr unwrap = requireNullableUnwrap(inner.generate(chainedCallGenerator));
            LambdaExpr mapper = ExpressionPatterns.lambda(inputVariable.getNameAsString(), body);
            Expression mapped = chainedCallGenerator.generateOn(unwrap.getScope().orElseThrow(), "map($0)", mapper);
            return chainedCallGenerator.generateOn(mapped, "orElse(null)");
        }
    }

    /**
     * Boolean negation of the wrapped generator's result.
     */
    public static final class Negated extends FindOperationGenerator {
        private final FindOperationGenerator inner;

        Negated(FindOperationGenerator inner) {
            super(inner);
            this.inner = inner;
        }

        public FindOperationGenerator getInner() {
            return inner;
        }

        @Override
        public Expression generate(ChainedCallGenerator chainedCallGenerator) {
            return ExpressionPatterns.negate(inner.generate(chainedCallGenerator));
        }
    }
}
