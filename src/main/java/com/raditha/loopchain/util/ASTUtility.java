package com.raditha.loopchain.util;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Utility class for statement level AST operations around loops.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    /**
     * The outermost statement that represents the loop in its block: the loop itself or the
     * label wrapping it.
     */
    public static Statement withLabels(Statement loop) {
        Statement current = loop;
        while (current.getParentNode().orElse(null) instanceof LabeledStmt labeled) {
            current = labeled;
        }
        return current;
    }

    /**
     * Names of all labels attached to the loop.
     */
    public static Set<String> labelsOf(Statement loop) {
        Set<String> labels = new HashSet<>();
        Node current = loop;
        while (current.getParentNode().orElse(null) instanceof LabeledStmt labeled) {
            labels.add(labeled.getLabel().asString());
            current = labeled;
        }
        return labels;
    }

    /**
     * Statement that follows the loop (or its label) in the enclosing block.
     */
    public static Optional<Statement> nextStatement(Statement loop) {
        Statement outer = withLabels(loop);
        if (!(outer.getParentNode().orElse(null) instanceof BlockStmt block)) {
            return Optional.empty();
        }
        List<Statement> siblings = block.getStatements();
        int index = indexOf(siblings, outer);
        if (index < 0 || index + 1 >= siblings.size()) {
            return Optional.empty();
        }
        return Optional.of(siblings.get(index + 1));
    }

    /**
     * Statements preceding the loop in its block, nearest first.
     */
    public static List<Statement> statementsBefore(Statement loop) {
        Statement outer = withLabels(loop);
        List<Statement> before = new ArrayList<>();
        if (outer.getParentNode().orElse(null) instanceof BlockStmt block) {
            List<Statement> siblings = block.getStatements();
            for (int i = indexOf(siblings, outer) - 1; i >= 0; i--) {
                before.add(siblings.get(i));
            }
        }
        return before;
    }

    /**
     * Remove the loop together with any label wrapping it.
     */
    public static void deleteWithLabels(Statement loop) {
        Statement outer = withLabels(loop);
        if (!outer.remove()) {
            throw new IllegalStateException("Could not remove loop from its parent: " + loop);
        }
    }

    /**
     * The method, constructor or initializer that contains the node, or the tree root when the
     * node is not inside one.
     */
    public static Node enclosingBody(Node node) {
        Node current = node;
        while (current.getParentNode().isPresent()) {
            current = current.getParentNode().get();
            if (current instanceof MethodDeclaration
                    || current instanceof ConstructorDeclaration
                    || current instanceof InitializerDeclaration) {
                return current;
            }
        }
        return current;
    }

    /**
     * Identity based index lookup; {@link List#indexOf} would use structural equality.
     */
    private static int indexOf(List<Statement> statements, Statement target) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == target) {
                return i;
            }
        }
        return -1;
    }
}
