package com.raditha.loopchain.analysis;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.TestSources;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntacticLoopInvarianceOracleTest {

    private final SyntacticLoopInvarianceOracle oracle = new SyntacticLoopInvarianceOracle();

    private Statement loop;

    @BeforeEach
    void setUp() {
        CompilationUnit cu = TestSources.method("""
                int counter = 0;
                for (String s : names) {
                    String local = s.trim();
                    counter++;
                    this.seen = s;
                    if (local.equals(target)) { return s; }
                }
                return null;
                """);
        loop = TestSources.firstLoop(cu);
    }

    private boolean stable(String expression) {
        return oracle.isStableInLoop(StaticJavaParser.parseExpression(expression), loop);
    }

    @Test
    void testStableExpressions() {
        assertTrue(stable("target"));
        assertTrue(stable("\"literal\""));
        assertTrue(stable("limit + 1"));
        assertTrue(stable("(String) target"));
        assertTrue(stable("this.name"));
        assertTrue(stable("Sample.class"));
        assertTrue(stable("limit > 0 ? target : null"));
        assertTrue(stable("-limit"));
    }

    @Test
    void testUnstableExpressions() {
        // Declared in the loop
        assertFalse(stable("s"));
        assertFalse(stable("local"));
        // Written in the loop
        assertFalse(stable("counter"));
        assertFalse(stable("this.seen"));
        // Calls may have side effects or change results
        assertFalse(stable("target.trim()"));
        assertFalse(stable("limit++"));
        assertFalse(stable("new String()"));
    }
}
