package com.raditha.loopchain.analysis;

import com.github.javaparser.StaticJavaParser;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstantExpressionsTest {

    @ParameterizedTest
    @ValueSource(strings = {"null", "0", "-1", "+2", "3L", "-4.5", "'c'", "\"text\"", "true", "(false)", "((-1))"})
    void testIsConstant_Constants(String source) {
        assertTrue(ConstantExpressions.isConstant(StaticJavaParser.parseExpression(source)), source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"x", "-x", "!true", "a.b", "compute()", "1 + 2", "new Object()", "Integer.MAX_VALUE"})
    void testIsConstant_NonConstants(String source) {
        assertFalse(ConstantExpressions.isConstant(StaticJavaParser.parseExpression(source)), source);
    }

    @Test
    void testBooleanConstants() {
        assertTrue(ConstantExpressions.isTrueConstant(StaticJavaParser.parseExpression("true")));
        assertFalse(ConstantExpressions.isTrueConstant(StaticJavaParser.parseExpression("false")));
        assertTrue(ConstantExpressions.isFalseConstant(StaticJavaParser.parseExpression("false")));
        assertFalse(ConstantExpressions.isFalseConstant(StaticJavaParser.parseExpression("null")));
        assertFalse(ConstantExpressions.isTrueConstant(StaticJavaParser.parseExpression("!false")));
    }
}
