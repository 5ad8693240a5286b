package com.raditha.loopchain.generation;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.UnknownType;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.PrinterConfiguration;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds expressions from source patterns with positional placeholders.
 */
public class ExpressionPatterns {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\d+)");

    private static final PrinterConfiguration PRINTER = new DefaultPrinterConfiguration()
            .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS));

    private ExpressionPatterns() {
        /* this is only a utility class */
    }

    /**
     * Substitute the arguments into the pattern and parse the result.
     *
     * @throws IllegalArgumentException if a placeholder has no matching argument
     * @throws IllegalStateException    if the substituted text is not a valid expression
     */
    public static Expression createExpressionByPattern(String pattern, Expression... arguments) {
        String source = substitute(pattern, arguments);
        try {
            return StaticJavaParser.parseExpression(source);
        } catch (ParseProblemException e) {
            throw new IllegalStateException("Pattern '" + pattern + "' produced an invalid expression: " + source, e);
        }
    }

    /**
     * A single parameter lambda, {@code name -> body}.
     */
    public static LambdaExpr lambda(String parameterName, Expression body) {
        return lambda(List.of(parameterName), body);
    }

    /**
     * A lambda with several parameters, {@code (a, b) -> body}.
     * <p>
     * Identifiers may contain {@code $1}, so the lambda is built as nodes and never goes through
     * placeholder substitution.
     */
    public static LambdaExpr lambda(List<String> parameterNames, Expression body) {
        NodeList<Parameter> parameters = new NodeList<>();
        for (String name : parameterNames) {
            parameters.add(new Parameter(new UnknownType(), name));
        }
        LambdaExpr lambda = new LambdaExpr(parameters, body.clone());
        lambda.setEnclosingParameters(parameters.size() != 1);
        return lambda;
    }

    /**
     * {@code Type::method} for a no-argument instance method of a declared class type.
     * Type arguments and annotations of the declaration are left out.
     */
    public static MethodReferenceExpr methodReference(ClassOrInterfaceType type, String methodName) {
        ClassOrInterfaceType target = type.clone();
        target.removeTypeArguments();
        target.getAnnotations().clear();
        return new MethodReferenceExpr(new TypeExpr(target), null, methodName);
    }

    /**
     * Logical negation, simplified where the operand allows it.
     */
    public static Expression negate(Expression expression) {
        Expression inner = expression.isEnclosedExpr() ? expression.asEnclosedExpr().getInner() : expression;
        if (inner.isUnaryExpr() && inner.asUnaryExpr().getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) {
            Expression operand = inner.asUnaryExpr().getExpression();
            return (operand.isEnclosedExpr() ? operand.asEnclosedExpr().getInner() : operand).clone();
        }
        if (inner.isBinaryExpr()) {
            BinaryExpr binary = inner.asBinaryExpr();
            if (binary.getOperator() == BinaryExpr.Operator.EQUALS) {
                return new BinaryExpr(binary.getLeft().clone(), binary.getRight().clone(), BinaryExpr.Operator.NOT_EQUALS);
            }
            if (binary.getOperator() == BinaryExpr.Operator.NOT_EQUALS) {
                return new BinaryExpr(binary.getLeft().clone(), binary.getRight().clone(), BinaryExpr.Operator.EQUALS);
            }
        }
        return new UnaryExpr(parenthesizeIfNeeded(inner), UnaryExpr.Operator.LOGICAL_COMPLEMENT);
    }

    /**
     * Conjunction of two conditions.
     */
    public static Expression and(Expression left, Expression right) {
        return new BinaryExpr(conjunctionOperand(left), conjunctionOperand(right), BinaryExpr.Operator.AND);
    }

    /**
     * A copy of the expression wrapped in parentheses unless it is a primary expression that can
     * be used as an operand or a call receiver as is.
     */
    public static Expression parenthesizeIfNeeded(Expression expression) {
        if (isPrimary(expression)) {
            return expression.clone();
        }
        return new EnclosedExpr(expression.clone());
    }

    public static String print(Expression expression) {
        return expression.toString(PRINTER);
    }

    static String substitute(String pattern, Expression... arguments) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            if (index >= arguments.length) {
                throw new IllegalArgumentException("Pattern '" + pattern + "' references missing argument $" + index);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(print(arguments[index])));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Operands binding looser than {@code &&} need parentheses.
     */
    private static Expression conjunctionOperand(Expression expression) {
        boolean looser = expression.isConditionalExpr()
                || expression.isAssignExpr()
                || expression.isLambdaExpr()
                || expression.isBinaryExpr() && expression.asBinaryExpr().getOperator() == BinaryExpr.Operator.OR;
        return looser ? new EnclosedExpr(expression.clone()) : expression.clone();
    }

    private static boolean isPrimary(Expression expression) {
        return expression.isNameExpr()
                || expression.isLiteralExpr()
                || expression.isMethodCallExpr()
                || expression.isFieldAccessExpr()
                || expression.isArrayAccessExpr()
                || expression.isObjectCreationExpr()
                || expression.isThisExpr()
                || expression.isSuperExpr()
                || expression.isClassExpr()
                || expression.isEnclosedExpr();
    }
}
