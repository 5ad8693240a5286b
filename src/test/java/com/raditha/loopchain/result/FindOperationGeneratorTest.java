package com.raditha.loopchain.result;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.raditha.loopchain.generation.JavaChainedCallGenerator;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FindOperationGeneratorTest {

    private static final VariableDeclarator S = new VariableDeclarator(StaticJavaParser.parseType("String"), "s");
    private static final VariableDeclarator I = new VariableDeclarator(StaticJavaParser.parseType("int"), "i");
    private static final VariableDeclarator P = new VariableDeclarator(StaticJavaParser.parseType("Person"), "p");

    private static Expression expr(String source) {
        return StaticJavaParser.parseExpression(source);
    }

    private static String render(FindOperationGenerator generator, String receiver) {
        return generator.generate(new JavaChainedCallGenerator(expr(receiver))).toString();
    }

    private static FindOperationGenerator.Simple simple(FindOperation operation, String filter) {
        return new FindOperationGenerator.Simple(operation, S, filter == null ? null : expr(filter), null, null, Set.of());
    }

    @Test
    void testFirstOrNull() {
        FindOperationGenerator withFilter = simple(FindOperation.FIRST_OR_NULL, "s.isEmpty()");
        FindOperationGenerator withoutFilter = simple(FindOperation.FIRST_OR_NULL, null);

        assertEquals("names.stream().filter(s -> s.isEmpty()).findFirst().orElse(null)", render(withFilter, "names"));
        assertEquals("names.stream().findFirst().orElse(null)", render(withoutFilter, "names"));
        assertEquals("firstOrNull{}", withFilter.getPresentation());
        assertEquals("firstOrNull()", withoutFilter.getPresentation());
        assertEquals(1, withFilter.getChainCallCount());
    }

    @Test
    void testFirstOrNull_DollarInElementName() {
        VariableDeclarator element = new VariableDeclarator(StaticJavaParser.parseType("String"), "s$1");
        FindOperationGenerator generator = new FindOperationGenerator.Simple(
                FindOperation.FIRST_OR_NULL, element, expr("s$1.isEmpty()"), null, null, Set.of());

        assertEquals("names.stream().filter(s$1 -> s$1.isEmpty()).findFirst().orElse(null)", render(generator, "names"));
    }

    @Test
    void testLastOrNull_AvoidsTakenNames() {
        FindOperationGenerator generator = new FindOperationGenerator.Simple(
                FindOperation.LAST_OR_NULL, S, expr("s.isEmpty()"), null, null, Set.of("first", "s"));

        assertEquals("names.stream().filter(s -> s.isEmpty()).reduce((first1, second) -> second).orElse(null)",
                render(generator, "names"));
        assertEquals("lastOrNull{}", generator.getPresentation());
    }

    @Test
    void testAnyAndNone() {
        assertEquals("!names.isEmpty()", render(simple(FindOperation.ANY, null), "names"));
        assertEquals("names.isEmpty()", render(simple(FindOperation.NONE, null), "names"));
        assertEquals("names.stream().anyMatch(s -> s.isEmpty())", render(simple(FindOperation.ANY, "s.isEmpty()"), "names"));
        assertEquals("names.stream().noneMatch(s -> s.isEmpty())", render(simple(FindOperation.NONE, "s.isEmpty()"), "names"));
        assertEquals("any()", simple(FindOperation.ANY, null).getPresentation());
    }

    @Test
    void testContainsAndIndexOf() {
        FindOperationGenerator contains = new FindOperationGenerator.Simple(
                FindOperation.CONTAINS, S, null, expr("target"), null, Set.of());
        FindOperationGenerator indexOf = new FindOperationGenerator.Simple(
                FindOperation.INDEX_OF, S, null, expr("target"), I, Set.of());
        FindOperationGenerator lastIndexOf = new FindOperationGenerator.Simple(
                FindOperation.LAST_INDEX_OF, S, null, expr("target"), I, Set.of());

        assertEquals("names.contains(target)", render(contains, "names"));
        assertEquals("names.indexOf(target)", render(indexOf, "names"));
        assertEquals("names.lastIndexOf(target)", render(lastIndexOf, "names"));
        assertEquals("contains()", contains.getPresentation());
    }

    @Test
    void testIndexOfFirstAndLast() {
        FindOperationGenerator first = new FindOperationGenerator.Simple(
                FindOperation.INDEX_OF_FIRST, S, expr("s.length() > limit"), null, I, Set.of());
        FindOperationGenerator last = new FindOperationGenerator.Simple(
                FindOperation.INDEX_OF_LAST, S, expr("s.isEmpty()"), null, I, Set.of());

        assertEquals("IntStream.range(0, names.size()).filter(i -> names.get(i).length() > limit).findFirst().orElse(-1)",
                render(first, "names"));
        assertEquals("IntStream.iterate(names.size() - 1, i -> i >= 0, i -> i - 1)"
                        + ".filter(i -> names.get(i).isEmpty()).findFirst().orElse(-1)",
                render(last, "names"));
        assertEquals("indexOfFirst{}", first.getPresentation());
    }

    @Test
    void testIndexOfFirst_BareElementFilter() {
        VariableDeclarator flag = new VariableDeclarator(StaticJavaParser.parseType("Boolean"), "flag");
        FindOperationGenerator generator = new FindOperationGenerator.Simple(
                FindOperation.INDEX_OF_FIRST, flag, expr("flag"), null, I, Set.of());

        assertEquals("IntStream.range(0, flags.size()).filter(i -> flags.get(i)).findFirst().orElse(-1)",
                render(generator, "flags"));
    }

    @Test
    void testElvis() {
        FindOperationGenerator eager = new FindOperationGenerator.Elvis(
                simple(FindOperation.FIRST_OR_NULL, null), expr("\"none\""), false);
        FindOperationGenerator lazy = new FindOperationGenerator.Elvis(
                simple(FindOperation.LAST_OR_NULL, "s.isEmpty()"), expr("fallback()"), true);

        assertEquals("names.stream().findFirst().orElse(\"none\")", render(eager, "names"));
        assertEquals("names.stream().filter(s -> s.isEmpty()).reduce((first, second) -> second).orElseGet(() -> fallback())",
                render(lazy, "names"));
        assertEquals("lastOrNull{}", lazy.getPresentation());
        assertEquals(1, lazy.getChainCallCount());
    }

    @Test
    void testElvis_RequiresNullableChain() {
        FindOperationGenerator generator = new FindOperationGenerator.Elvis(
                simple(FindOperation.ANY, null), expr("true"), false);

        assertThrows(IllegalStateException.class, () -> render(generator, "names"));
    }

    @Test
    void testSafeCallChain() {
        FindOperationGenerator inner = new FindOperationGenerator.Simple(
                FindOperation.FIRST_OR_NULL, P, expr("p.isActive()"), null, null, Set.of());

        FindOperationGenerator reference = new FindOperationGenerator.SafeCallChain(inner, P, expr("p.getName()"), true);
        FindOperationGenerator lambda = new FindOperationGenerator.SafeCallChain(inner, P, expr("p.getName()"), false);
        FindOperationGenerator field = new FindOperationGenerator.SafeCallChain(inner, P, expr("p.name"), true);
        FindOperationGenerator withArgument = new FindOperationGenerator.SafeCallChain(inner, P, expr("p.get(0)"), true);

        assertEquals("people.stream().filter(p -> p.isActive()).findFirst().map(Person::getName).orElse(null)",
                render(reference, "people"));
        assertEquals("people.stream().filter(p -> p.isActive()).findFirst().map(p -> p.getName()).orElse(null)",
                render(lambda, "people"));
        assertEquals("people.stream().filter(p -> p.isActive()).findFirst().map(p -> p.name).orElse(null)",
                render(field, "people"));
        assertEquals("people.stream().filter(p -> p.isActive()).findFirst().map(p -> p.get(0)).orElse(null)",
                render(withArgument, "people"));
        assertEquals(2, reference.getChainCallCount());
        assertEquals("firstOrNull{}", reference.getPresentation());
    }

    @Test
    void testSafeCallChain_WithFallbackAndDollarTypeName() {
        VariableDeclarator q = new VariableDeclarator(StaticJavaParser.parseType("Person$1"), "q");
        FindOperationGenerator inner = new FindOperationGenerator.Simple(
                FindOperation.FIRST_OR_NULL, q, expr("q.isActive()"), null, null, Set.of());
        FindOperationGenerator mapped = new FindOperationGenerator.SafeCallChain(inner, q, expr("q.getName()"), true);
        FindOperationGenerator withFallback = new FindOperationGenerator.Elvis(mapped, expr("\"none\""), false);

        assertEquals("people.stream().filter(q -> q.isActive()).findFirst().map(Person$1::getName).orElse(\"none\")",
                render(withFallback, "people"));
        assertEquals(2, withFallback.getChainCallCount());
    }

    @Test
    void testLetBinding() {
        FindOperationGenerator generator = new FindOperationGenerator.LetBinding(
                simple(FindOperation.FIRST_OR_NULL, null), S, expr("s + target"));

        assertEquals("names.stream().findFirst().map(s -> s + target).orElse(null)", render(generator, "names"));
        assertEquals(2, generator.getChainCallCount());
    }

    @Test
    void testConditionalAndNegated() {
        FindOperationGenerator conditional = new FindOperationGenerator.Conditional(
                simple(FindOperation.ANY, "s.isEmpty()"), expr("\"yes\""), expr("\"no\""));
        FindOperationGenerator negated = new FindOperationGenerator.Negated(new FindOperationGenerator.Simple(
                FindOperation.CONTAINS, S, null, expr("target"), null, Set.of()));

        assertEquals("names.stream().anyMatch(s -> s.isEmpty()) ? \"yes\" : \"no\"", render(conditional, "names"));
        assertEquals("any{}", conditional.getPresentation());
        assertEquals("!names.contains(target)", render(negated, "names"));
        assertEquals("contains()", negated.getPresentation());
    }

    @Test
    void testSimple_MissingInputsThrow() {
        FindOperationGenerator noArgument = new FindOperationGenerator.Simple(
                FindOperation.CONTAINS, S, null, null, null, Set.of());
        FindOperationGenerator noIndex = new FindOperationGenerator.Simple(
                FindOperation.INDEX_OF_FIRST, S, expr("s.isEmpty()"), null, null, Set.of());

        assertThrows(IllegalStateException.class, () -> render(noArgument, "names"));
        assertThrows(IllegalStateException.class, () -> render(noIndex, "names"));
    }
}
