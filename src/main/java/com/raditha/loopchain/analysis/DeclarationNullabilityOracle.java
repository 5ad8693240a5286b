package com.raditha.loopchain.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads nullability from the declaration of a variable: its type, its nullness annotations and
 * any {@code @NullMarked} / {@code @NullUnmarked} scope around it.
 * <p>
 * Annotations are matched by simple name, so jspecify, JetBrains, Checker Framework and
 * JSR-305 annotations all count.
 */
public class DeclarationNullabilityOracle implements NullabilityOracle {

    private static final Set<String> NULLABLE_ANNOTATIONS = Set.of("Nullable", "CheckForNull");
    private static final Set<String> NOT_NULL_ANNOTATIONS = Set.of("NonNull", "NotNull", "Nonnull");

    private final boolean assumeNonNull;

    /**
     * @param assumeNonNull treat unannotated reference types as non-null everywhere
     */
    public DeclarationNullabilityOracle(boolean assumeNonNull) {
        this.assumeNonNull = assumeNonNull;
    }

    @Override
    public TypeNullability nullability(VariableDeclarator variable) {
        Type type = variable.getType();
        if (type.isPrimitiveType()) {
            return TypeNullability.NOT_NULL;
        }

        List<AnnotationExpr> annotations = new ArrayList<>(type.getAnnotations());
        variable.getParentNode()
                .filter(VariableDeclarationExpr.class::isInstance)
                .map(VariableDeclarationExpr.class::cast)
                .ifPresent(declaration -> annotations.addAll(declaration.getAnnotations()));

        for (AnnotationExpr annotation : annotations) {
            String name = annotation.getName().getIdentifier();
            if (NULLABLE_ANNOTATIONS.contains(name)) {
                return TypeNullability.NULLABLE;
            }
            if (NOT_NULL_ANNOTATIONS.contains(name)) {
                return TypeNullability.NOT_NULL;
            }
        }

        // an inferred type carries no information of its own
        if (type.isVarType()) {
            return TypeNullability.FLEXIBLE;
        }
        if (assumeNonNull || isInNullMarkedScope(variable)) {
            return TypeNullability.NOT_NULL;
        }
        return TypeNullability.FLEXIBLE;
    }

    private boolean isInNullMarkedScope(Node node) {
        Node current = node.getParentNode().orElse(null);
        while (current != null) {
            if (current instanceof NodeWithAnnotations<?> annotated) {
                if (annotated.isAnnotationPresent("NullUnmarked")) {
                    return false;
                }
                if (annotated.isAnnotationPresent("NullMarked")) {
                    return true;
                }
            }
            if (current instanceof CompilationUnit cu) {
                return cu.getPackageDeclaration()
                        .map(p -> hasAnnotation(p.getAnnotations(), "NullMarked"))
                        .orElse(false);
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private static boolean hasAnnotation(NodeList<AnnotationExpr> annotations, String name) {
        return annotations.stream().anyMatch(a -> a.getName().getIdentifier().equals(name));
    }
}
