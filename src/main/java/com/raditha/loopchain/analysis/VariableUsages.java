package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import com.raditha.loopchain.model.VariableInitialization;
import com.raditha.loopchain.util.ASTUtility;
import org.jspecify.annotations.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Name based usage queries for local variables.
 * <p>
 * Locals cannot be shadowed by other locals in Java, so within one method body a simple name
 * identifies a local variable.
 */
public class VariableUsages {

    private VariableUsages() {
        /* this is only a utility class */
    }

    /**
     * Check if the expression is exactly a reference to the variable.
     */
    public static boolean isVariableReference(@Nullable Expression expression, VariableDeclarator variable) {
        return expression != null
                && expression.isNameExpr()
                && expression.asNameExpr().getNameAsString().equals(variable.getNameAsString());
    }

    /**
     * Check if the variable is referenced anywhere in the node, the node itself included.
     */
    public static boolean hasUsages(VariableDeclarator variable, Node scope) {
        return countUsages(variable, scope) > 0;
    }

    /**
     * Count references to the variable in the node. Assignment targets count as usages.
     */
    public static int countUsages(VariableDeclarator variable, Node scope) {
        String name = variable.getNameAsString();
        return (int) scope.findAll(NameExpr.class).stream()
                .filter(n -> n.getNameAsString().equals(name))
                .count();
    }

    /**
     * Find where the assigned variable was last initialized before the loop.
     * <p>
     * The statements preceding the loop are scanned backwards. The scan stops at the first
     * statement that declares the variable with an initializer or assigns it with {@code =}; any
     * other statement referencing the variable on the way ends the search.
     *
     * @param target                    the assignment target inside the loop
     * @param loop                      the loop statement
     * @param checkNoOtherUsagesInLoop  also require the target to be the only usage inside the loop
     * @return the initialization, or null when the variable is not a local initialized right before the loop
     */
    public static @Nullable VariableInitialization findVariableInitializationBeforeLoop(
            Expression target, Statement loop, boolean checkNoOtherUsagesInLoop) {
        if (!target.isNameExpr()) {
            return null;
        }
        String name = target.asNameExpr().getNameAsString();
        List<Statement> before = ASTUtility.statementsBefore(loop);

        for (int i = 0; i < before.size(); i++) {
            Statement statement = before.get(i);
            Optional<VariableDeclarator> declared = declaredIn(statement, name);
            if (declared.isPresent()) {
                VariableDeclarator variable = declared.get();
                if (variable.getInitializer().isEmpty() || declarationCount(statement) != 1) {
                    return null;
                }
                return checked(new VariableInitialization(variable, statement, variable.getInitializer().get()),
                        loop, checkNoOtherUsagesInLoop);
            }

            AssignExpr assignment = simpleAssignmentTo(statement, name);
            if (assignment != null) {
                VariableDeclarator variable = findDeclarationAmong(before.subList(i + 1, before.size()), name);
                if (variable == null) {
                    return null;
                }
                return checked(new VariableInitialization(variable, statement, assignment.getValue()),
                        loop, checkNoOtherUsagesInLoop);
            }

            if (statement.findAll(NameExpr.class).stream().anyMatch(n -> n.getNameAsString().equals(name))) {
                return null;
            }
        }
        return null;
    }

    /**
     * Names of every local variable and parameter declared in the node.
     */
    public static Set<String> declaredNames(Node scope) {
        Set<String> names = new HashSet<>();
        scope.findAll(VariableDeclarator.class).forEach(v -> names.add(v.getNameAsString()));
        scope.findAll(Parameter.class).forEach(p -> names.add(p.getNameAsString()));
        return names;
    }

    /**
     * A name based on {@code base} that does not clash with any of the taken names.
     */
    public static String freshName(String base, Set<String> taken) {
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 1;
        while (taken.contains(base + suffix)) {
            suffix++;
        }
        return base + suffix;
    }

    /**
     * Declared type of the local variable or parameter with the given name in the body enclosing
     * the node, if there is exactly one such declaration.
     */
    public static Optional<Type> findLocalDeclarationType(String name, Node context) {
        Node body = ASTUtility.enclosingBody(context);
        List<Type> types = body.findAll(VariableDeclarator.class).stream()
                .filter(v -> v.getNameAsString().equals(name))
                .map(VariableDeclarator::getType)
                .toList();
        List<Type> parameterTypes = body.findAll(Parameter.class).stream()
                .filter(p -> p.getNameAsString().equals(name))
                .map(Parameter::getType)
                .toList();
        if (types.size() + parameterTypes.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(types.isEmpty() ? parameterTypes.get(0) : types.get(0));
    }

    private static @Nullable VariableInitialization checked(
            VariableInitialization initialization, Statement loop, boolean checkNoOtherUsagesInLoop) {
        if (checkNoOtherUsagesInLoop
                && countUsages(initialization.variable(), ASTUtility.withLabels(loop)) != 1) {
            return null;
        }
        return initialization;
    }

    private static Optional<VariableDeclarator> declaredIn(Statement statement, String name) {
        if (!statement.isExpressionStmt()
                || !statement.asExpressionStmt().getExpression().isVariableDeclarationExpr()) {
            return Optional.empty();
        }
        return statement.asExpressionStmt().getExpression().asVariableDeclarationExpr().getVariables().stream()
                .filter(v -> v.getNameAsString().equals(name))
                .findFirst();
    }

    private static int declarationCount(Statement statement) {
        VariableDeclarationExpr declaration = statement.asExpressionStmt().getExpression().asVariableDeclarationExpr();
        return declaration.getVariables().size();
    }

    private static @Nullable AssignExpr simpleAssignmentTo(Statement statement, String name) {
        if (!statement.isExpressionStmt() || !statement.asExpressionStmt().getExpression().isAssignExpr()) {
            return null;
        }
        AssignExpr assignment = statement.asExpressionStmt().getExpression().asAssignExpr();
        if (assignment.getOperator() != AssignExpr.Operator.ASSIGN
                || !assignment.getTarget().isNameExpr()
                || !assignment.getTarget().asNameExpr().getNameAsString().equals(name)) {
            return null;
        }
        // x = x + 1 reads the old value and is not a plain initialization
        if (assignment.getValue().findAll(NameExpr.class).stream().anyMatch(n -> n.getNameAsString().equals(name))) {
            return null;
        }
        return assignment;
    }

    private static @Nullable VariableDeclarator findDeclarationAmong(List<Statement> statements, String name) {
        for (Statement statement : statements) {
            Optional<VariableDeclarator> declared = declaredIn(statement, name);
            if (declared.isPresent()) {
                return declared.get();
            }
        }
        return null;
    }
}
