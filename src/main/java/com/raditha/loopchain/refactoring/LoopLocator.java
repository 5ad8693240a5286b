package com.raditha.loopchain.refactoring;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Optional;

/**
 * Finds the loop a user points at.
 */
public class LoopLocator {

    private LoopLocator() {
        /* this is only a utility class */
    }

    /**
     * The outermost {@code for} loop (or label wrapping one) that begins on the given line.
     *
     * @param cu   the parsed file
     * @param line 1-based line number
     */
    public static Optional<Statement> findLoopAtLine(CompilationUnit cu, int line) {
        return cu.findFirst(Statement.class, statement -> isLoopOrLabeledLoop(statement)
                && statement.getBegin().map(begin -> begin.line == line).orElse(false));
    }

    private static boolean isLoopOrLabeledLoop(Statement statement) {
        Statement current = statement;
        while (current.isLabeledStmt()) {
            current = current.asLabeledStmt().getStatement();
        }
        return current.isForEachStmt() || current.isForStmt();
    }
}
