package com.raditha.loopchain.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import com.raditha.loopchain.analysis.VariableUsages;
import com.raditha.loopchain.generation.ExpressionPatterns;
import com.raditha.loopchain.model.FilterCondition;
import com.raditha.loopchain.model.LoopStatement;
import com.raditha.loopchain.model.MatchingState;
import com.raditha.loopchain.util.ASTUtility;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a single loop statement into a {@link MatchingState}.
 * <p>
 * Two loop shapes are understood:
 * <ul>
 *     <li>{@code for (T e : xs) body}</li>
 *     <li>{@code for (int i = 0; i < xs.size(); i++) { T e = xs.get(i); body }}</li>
 * </ul>
 * Leading {@code if (c) { ... }} (as the only statement, without else) and
 * {@code if (c) continue;} statements are peeled off the body and combined into one filter.
 * The collection is assumed to be a {@link java.util.Collection}; loops over arrays are skipped.
 */
public class LoopStateExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LoopStateExtractor.class);

    /**
     * @param statement the loop, or a label wrapping it
     * @return the normalized loop, or empty when the loop has neither supported shape
     */
    public Optional<LoopMatchInput> extract(Statement statement) {
        Statement loop = statement;
        while (loop.isLabeledStmt()) {
            loop = loop.asLabeledStmt().getStatement();
        }

        if (loop.isForEachStmt()) {
            return extractForEach(loop.asForEachStmt());
        }
        if (loop.isForStmt()) {
            return extractIndexed(loop.asForStmt());
        }
        logger.debug("Not a for loop: {}", firstLine(statement));
        return Optional.empty();
    }

    private Optional<LoopMatchInput> extractForEach(ForEachStmt loop) {
        NodeList<VariableDeclarator> variables = loop.getVariable().getVariables();
        if (variables.size() != 1) {
            return Optional.empty();
        }
        Expression iterable = loop.getIterable();
        if (isArray(iterable, loop)) {
            logger.debug("Loop iterates over an array: {}", iterable);
            return Optional.empty();
        }
        return build(loop, bodyStatements(loop.getBody()), iterable, variables.get(0), null);
    }

    private Optional<LoopMatchInput> extractIndexed(ForStmt loop) {
        VariableDeclarator index = indexVariable(loop);
        if (index == null) {
            return Optional.empty();
        }
        String indexName = index.getNameAsString();

        Expression collection = sizeBound(loop, indexName);
        if (collection == null || !hasUnitIncrement(loop, indexName) || isArray(collection, loop)) {
            return Optional.empty();
        }

        List<Statement> body = bodyStatements(loop.getBody());
        if (body.isEmpty()) {
            return Optional.empty();
        }
        VariableDeclarator element = elementDeclaration(body.get(0), collection, indexName);
        if (element == null) {
            logger.debug("Indexed loop does not start with an element declaration: {}", firstLine(loop));
            return Optional.empty();
        }
        if (isWritten(loop.getBody(), indexName)) {
            return Optional.empty();
        }
        return build(loop, body.subList(1, body.size()), collection, element, index);
    }

    private Optional<LoopMatchInput> build(Statement loop, List<Statement> body, Expression iterable,
                                           VariableDeclarator inputVariable, @Nullable VariableDeclarator indexVariable) {
        List<Statement> remaining = body;
        List<Expression> conditions = new ArrayList<>();

        while (true) {
            if (remaining.size() == 1 && isPlainIf(remaining.get(0))) {
                IfStmt ifStmt = remaining.get(0).asIfStmt();
                if (!isSideEffectFree(ifStmt.getCondition())) {
                    return Optional.empty();
                }
                conditions.add(ifStmt.getCondition());
                remaining = bodyStatements(ifStmt.getThenStmt());
            } else if (remaining.size() >= 2 && isPlainIf(remaining.get(0))
                    && continuesLoop(remaining.get(0).asIfStmt().getThenStmt(), loop)) {
                IfStmt ifStmt = remaining.get(0).asIfStmt();
                if (!isSideEffectFree(ifStmt.getCondition())) {
                    return Optional.empty();
                }
                conditions.add(ExpressionPatterns.negate(ifStmt.getCondition()));
                remaining = remaining.subList(1, remaining.size());
            } else {
                break;
            }
        }

        if (remaining.isEmpty()) {
            return Optional.empty();
        }

        FilterCondition filter = null;
        if (!conditions.isEmpty()) {
            Expression combined = conditions.get(0);
            for (int i = 1; i < conditions.size(); i++) {
                combined = ExpressionPatterns.and(combined, conditions.get(i));
            }
            VariableDeclarator filterIndex = indexVariable != null && VariableUsages.hasUsages(indexVariable, combined)
                    ? indexVariable : null;
            filter = new FilterCondition(combined, filterIndex);
        }

        List<LoopStatement> statements = remaining.stream().map(LoopStatement::classify).toList();
        MatchingState state = new MatchingState(loop, statements, iterable, inputVariable, indexVariable);
        return Optional.of(new LoopMatchInput(state, filter));
    }

    private static List<Statement> bodyStatements(Statement body) {
        if (body.isBlockStmt()) {
            return new ArrayList<>(body.asBlockStmt().getStatements());
        }
        return List.of(body);
    }

    private static boolean isPlainIf(Statement statement) {
        return statement.isIfStmt() && statement.asIfStmt().getElseStmt().isEmpty();
    }

    private static boolean continuesLoop(Statement thenStmt, Statement loop) {
        List<Statement> statements = bodyStatements(thenStmt);
        if (statements.size() != 1 || !statements.get(0).isContinueStmt()) {
            return false;
        }
        ContinueStmt continueStmt = statements.get(0).asContinueStmt();
        return continueStmt.getLabel()
                .map(label -> ASTUtility.labelsOf(loop).contains(label.asString()))
                .orElse(true);
    }

    private static boolean isSideEffectFree(Expression condition) {
        if (condition.isAssignExpr() || !condition.findAll(AssignExpr.class).isEmpty()) {
            return false;
        }
        return condition.findAll(UnaryExpr.class).stream()
                .noneMatch(unary -> switch (unary.getOperator()) {
                    case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
                    default -> false;
                });
    }

    /**
     * {@code int i = 0}
     */
    private static @Nullable VariableDeclarator indexVariable(ForStmt loop) {
        if (loop.getInitialization().size() != 1 || !loop.getInitialization().get(0).isVariableDeclarationExpr()) {
            return null;
        }
        VariableDeclarationExpr declaration = loop.getInitialization().get(0).asVariableDeclarationExpr();
        if (declaration.getVariables().size() != 1) {
            return null;
        }
        VariableDeclarator variable = declaration.getVariable(0);
        boolean startsAtZero = variable.getInitializer()
                .filter(Expression::isIntegerLiteralExpr)
                .map(init -> init.asIntegerLiteralExpr().getValue().equals("0"))
                .orElse(false);
        if (!startsAtZero || !variable.getType().isPrimitiveType()
                || !variable.getType().asString().equals("int")) {
            return null;
        }
        return variable;
    }

    /**
     * The {@code xs} of {@code i < xs.size()}.
     */
    private static @Nullable Expression sizeBound(ForStmt loop, String indexName) {
        Optional<Expression> compare = loop.getCompare();
        if (compare.isEmpty() || !compare.get().isBinaryExpr()) {
            return null;
        }
        BinaryExpr binary = compare.get().asBinaryExpr();
        if (binary.getOperator() != BinaryExpr.Operator.LESS || !isName(binary.getLeft(), indexName)
                || !binary.getRight().isMethodCallExpr()) {
            return null;
        }
        MethodCallExpr size = binary.getRight().asMethodCallExpr();
        if (!size.getNameAsString().equals("size") || !size.getArguments().isEmpty() || size.getScope().isEmpty()) {
            return null;
        }
        Expression collection = size.getScope().get();
        if (!collection.isNameExpr() && !collection.isFieldAccessExpr()) {
            return null;
        }
        return collection;
    }

    /**
     * {@code i++}, {@code ++i} or {@code i += 1}
     */
    private static boolean hasUnitIncrement(ForStmt loop, String indexName) {
        if (loop.getUpdate().size() != 1) {
            return false;
        }
        Expression update = loop.getUpdate().get(0);
        if (update.isUnaryExpr()) {
            UnaryExpr unary = update.asUnaryExpr();
            return (unary.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT
                    || unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT)
                    && isName(unary.getExpression(), indexName);
        }
        if (update.isAssignExpr()) {
            AssignExpr assign = update.asAssignExpr();
            return assign.getOperator() == AssignExpr.Operator.PLUS
                    && isName(assign.getTarget(), indexName)
                    && assign.getValue() instanceof IntegerLiteralExpr literal
                    && literal.getValue().equals("1");
        }
        return false;
    }

    /**
     * {@code T e = xs.get(i);}
     */
    private static @Nullable VariableDeclarator elementDeclaration(Statement statement, Expression collection,
                                                                 String indexName) {
        if (!statement.isExpressionStmt() || !statement.asExpressionStmt().getExpression().isVariableDeclarationExpr()) {
            return null;
        }
        VariableDeclarationExpr declaration = statement.asExpressionStmt().getExpression().asVariableDeclarationExpr();
        if (declaration.getVariables().size() != 1) {
            return null;
        }
        VariableDeclarator variable = declaration.getVariable(0);
        Expression initializer = variable.getInitializer().orElse(null);
        if (initializer == null || !initializer.isMethodCallExpr()) {
            return null;
        }
        MethodCallExpr get = initializer.asMethodCallExpr();
        boolean matches = get.getNameAsString().equals("get")
                && get.getArguments().size() == 1
                && isName(get.getArgument(0), indexName)
                && get.getScope().filter(scope -> scope.equals(collection)).isPresent();
        return matches ? variable : null;
    }

    private static boolean isWritten(Node scope, String name) {
        boolean assigned = scope.findAll(AssignExpr.class).stream()
                .anyMatch(assign -> isName(assign.getTarget(), name));
        boolean stepped = scope.findAll(UnaryExpr.class).stream()
                .anyMatch(unary -> unary.getOperator() != UnaryExpr.Operator.LOGICAL_COMPLEMENT
                        && unary.getOperator() != UnaryExpr.Operator.MINUS
                        && unary.getOperator() != UnaryExpr.Operator.PLUS
                        && unary.getOperator() != UnaryExpr.Operator.BITWISE_COMPLEMENT
                        && isName(unary.getExpression(), name));
        return assigned || stepped;
    }

    private static boolean isName(Expression expression, String name) {
        return expression instanceof NameExpr nameExpr && nameExpr.getNameAsString().equals(name);
    }

    /**
     * True when the expression is known to be an array: an array literal, or a name whose local
     * or field declaration has an array type.
     */
    private static boolean isArray(Expression iterable, Statement loop) {
        if (iterable.isArrayCreationExpr() || iterable.isArrayInitializerExpr()) {
            return true;
        }
        String name;
        if (iterable.isNameExpr()) {
            name = iterable.asNameExpr().getNameAsString();
            Optional<Type> local = VariableUsages.findLocalDeclarationType(name, loop);
            if (local.isPresent()) {
                return local.get().isArrayType();
            }
        } else if (iterable.isFieldAccessExpr() && iterable.asFieldAccessExpr().getScope().isThisExpr()) {
            name = iterable.asFieldAccessExpr().getNameAsString();
        } else {
            return false;
        }
        Optional<ClassOrInterfaceDeclaration> type = loop.findAncestor(ClassOrInterfaceDeclaration.class);
        if (type.isEmpty()) {
            return false;
        }
        for (FieldDeclaration field : type.get().getFields()) {
            for (VariableDeclarator variable : field.getVariables()) {
                if (variable.getNameAsString().equals(name)) {
                    return variable.getType().isArrayType();
                }
            }
        }
        return false;
    }

    private static String firstLine(Statement statement) {
        String text = statement.toString();
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
