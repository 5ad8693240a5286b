package com.raditha.loopchain.refactoring;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.TestSources;
import com.raditha.loopchain.analysis.LoopInvarianceOracle;
import com.raditha.loopchain.analysis.NullabilityOracle;
import com.raditha.loopchain.analysis.SyntacticLoopInvarianceOracle;
import com.raditha.loopchain.analysis.TypeNullability;
import com.raditha.loopchain.config.LoopChainConfig;
import com.raditha.loopchain.result.ResultTransformation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LoopToCallChainConverterTest {

    private static final String FIRST_BLANK = """
            for (String s : names) {
                if (s.isEmpty()) return s;
            }
            return null;
            """;

    private LoopToCallChainConverter converter;

    @BeforeEach
    void setUp() {
        converter = new LoopToCallChainConverter(new LoopChainConfig(3, true, true));
    }

    @Test
    void testConvert_ReturnIdiom() {
        CompilationUnit cu = TestSources.method(FIRST_BLANK);

        ConversionResult result = converter.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals("firstOrNull{}", result.presentation());
        assertEquals(1, result.chainCallCount());
        assertEquals("names.stream().filter(s -> s.isEmpty()).findFirst().orElse(null)", result.callChain().toString());
        assertEquals("return names.stream().filter(s -> s.isEmpty()).findFirst().orElse(null);",
                result.resultStatement().toString());
        assertTrue(cu.findAll(ForEachStmt.class).isEmpty());
    }

    @Test
    void testConvert_DollarInElementName() {
        CompilationUnit cu = TestSources.method("""
                for (String s$1 : names) {
                    if (s$1.isEmpty()) return s$1;
                }
                return null;
                """);

        ConversionResult result = converter.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals("return names.stream().filter(s$1 -> s$1.isEmpty()).findFirst().orElse(null);",
                result.resultStatement().toString());
    }

    @Test
    void testAnalyze_LeavesTreeUntouched() {
        CompilationUnit cu = TestSources.method(FIRST_BLANK);
        String before = cu.toString();

        Optional<ResultTransformation> transformation = converter.analyze(TestSources.firstLoop(cu));

        assertTrue(transformation.isPresent());
        assertEquals("firstOrNull{}", transformation.get().getPresentation());
        assertEquals(before, cu.toString());
    }

    @Test
    void testChainLimit() {
        String body = """
                for (String s : names) {
                    if (s.startsWith(target)) return s.trim();
                }
                return null;
                """;
        CompilationUnit limited = TestSources.method(body);
        String before = limited.toString();
        LoopToCallChainConverter strict = new LoopToCallChainConverter(new LoopChainConfig(1, true, true));

        assertTrue(strict.convert(TestSources.firstLoop(limited)).isEmpty());
        assertEquals(before, limited.toString());

        CompilationUnit allowed = TestSources.method(body);
        ConversionResult result = converter.convert(TestSources.firstLoop(allowed)).orElseThrow();
        assertEquals(2, result.chainCallCount());
        assertEquals("names.stream().filter(s -> s.startsWith(target)).findFirst().map(String::trim).orElse(null)",
                result.callChain().toString());
    }

    @Test
    void testMethodReferencesCanBeTurnedOff() {
        LoopToCallChainConverter lambdas = new LoopToCallChainConverter(new LoopChainConfig(3, true, false));
        CompilationUnit cu = TestSources.method("""
                for (String s : names) {
                    if (s.startsWith(target)) return s.trim();
                }
                return null;
                """);

        ConversionResult result = lambdas.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals("names.stream().filter(s -> s.startsWith(target)).findFirst().map(s -> s.trim()).orElse(null)",
                result.callChain().toString());
    }

    @Test
    void testNullableElementsAreLeftAlone() {
        LoopToCallChainConverter cautious = new LoopToCallChainConverter(LoopChainConfig.defaults());
        CompilationUnit cu = TestSources.method(FIRST_BLANK);

        assertTrue(cautious.convert(TestSources.firstLoop(cu)).isEmpty());
        assertEquals(1, cu.findAll(ForEachStmt.class).size());
    }

    @Test
    void testCustomOracles() {
        NullabilityOracle nullability = mock(NullabilityOracle.class);
        when(nullability.nullability(any())).thenReturn(TypeNullability.NULLABLE);
        when(nullability.canHoldNull(any())).thenCallRealMethod();
        LoopInvarianceOracle invariance = new SyntacticLoopInvarianceOracle();
        LoopToCallChainConverter custom = new LoopToCallChainConverter(new LoopChainConfig(3, true, true),
                nullability, invariance);

        assertTrue(custom.analyze(TestSources.firstLoop(TestSources.method(FIRST_BLANK))).isEmpty());
        assertTrue(custom.analyze(TestSources.firstLoop(TestSources.method("""
                for (String s : names) {
                    if (s.isEmpty()) return true;
                }
                return false;
                """))).isPresent());
    }

    @Test
    void testLabeledLoop() {
        CompilationUnit cu = TestSources.method("""
                boolean found = false;
                search:
                for (String s : names) {
                    if (s.length() > limit) {
                        found = true;
                        break search;
                    }
                }
                return found;
                """);
        Statement labeled = TestSources.firstMethod(cu).getBody().orElseThrow().getStatement(1);

        ConversionResult result = converter.convert(labeled).orElseThrow();

        assertEquals("boolean found = names.stream().anyMatch(s -> s.length() > limit);",
                result.resultStatement().toString());
        assertEquals(2, TestSources.firstMethod(cu).getBody().orElseThrow().getStatements().size());
    }

    @Test
    void testLoopCommentIsKept() {
        CompilationUnit cu = TestSources.method("""
                // first blank name
                for (String s : names) {
                    if (s.isEmpty()) return s;
                }
                return null;
                """);

        ConversionResult result = converter.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals(" first blank name", result.resultStatement().getComment().map(Comment::getContent).orElseThrow());
    }

    @Test
    void testIntStreamImportAdded() {
        CompilationUnit cu = TestSources.method("""
                for (int i = 0; i < names.size(); i++) {
                    String s = names.get(i);
                    if (s.length() > limit) return i;
                }
                return -1;
                """);

        ConversionResult result = converter.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals("indexOfFirst{}", result.presentation());
        assertTrue(cu.getImports().stream().map(ImportDeclaration::getNameAsString)
                .anyMatch("java.util.stream.IntStream"::equals));
    }

    @Test
    void testIntStreamImportNotDuplicated() {
        CompilationUnit cu = TestSources.parse("""
                import java.util.*;
                import java.util.stream.*;

                class Sample {
                    int sample(List<String> names) {
                        for (int i = 0; i < names.size(); i++) {
                            String s = names.get(i);
                            if (s.isEmpty()) return i;
                        }
                        return -1;
                    }
                }
                """);

        converter.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals(2, cu.getImports().size());
    }

    @Test
    void testContainsNeedsNoImport() {
        CompilationUnit cu = TestSources.method("""
                for (String s : names) {
                    if (s.equals(target)) return true;
                }
                return false;
                """);

        ConversionResult result = converter.convert(TestSources.firstLoop(cu)).orElseThrow();

        assertEquals("contains()", result.presentation());
        assertEquals(1, cu.getImports().size());
    }

    @Test
    void testNotALoop() {
        CompilationUnit cu = TestSources.method("""
                while (names.isEmpty()) {
                    names.add(target);
                }
                return null;
                """);
        Statement whileLoop = TestSources.firstMethod(cu).getBody().orElseThrow().getStatement(0);

        assertTrue(converter.convert(whileLoop).isEmpty());
    }
}
