package com.raditha.loopchain.refactoring;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.loopchain.analysis.DeclarationNullabilityOracle;
import com.raditha.loopchain.analysis.LambdaCaptureAnalyzer;
import com.raditha.loopchain.analysis.LoopInvarianceOracle;
import com.raditha.loopchain.analysis.NullabilityOracle;
import com.raditha.loopchain.analysis.SyntacticLoopInvarianceOracle;
import com.raditha.loopchain.config.LoopChainConfig;
import com.raditha.loopchain.extraction.LoopMatchInput;
import com.raditha.loopchain.extraction.LoopStateExtractor;
import com.raditha.loopchain.generation.JavaChainedCallGenerator;
import com.raditha.loopchain.result.FindOperationSelector;
import com.raditha.loopchain.result.FindTransformationMatcher;
import com.raditha.loopchain.result.ResultTransformation;
import com.raditha.loopchain.result.TransformationMatch;
import com.raditha.loopchain.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Replaces a single find loop with an equivalent call chain.
 * <p>
 * The loop is normalized, matched, checked against the configured chain length and only then
 * rewritten. When any step declines, the tree is left untouched.
 */
public class LoopToCallChainConverter {

    private static final Logger logger = LoggerFactory.getLogger(LoopToCallChainConverter.class);

    private static final String INT_STREAM_PACKAGE = "java.util.stream";
    private static final String INT_STREAM = "IntStream";

    private final LoopChainConfig config;
    private final LoopStateExtractor extractor;
    private final FindTransformationMatcher matcher;

    public LoopToCallChainConverter(LoopChainConfig config) {
        this(config, new DeclarationNullabilityOracle(config.assumeNonNull()), new SyntacticLoopInvarianceOracle());
    }

    public LoopToCallChainConverter(LoopChainConfig config, NullabilityOracle nullabilityOracle,
                                    LoopInvarianceOracle invarianceOracle) {
        this.config = config;
        this.extractor = new LoopStateExtractor();
        this.matcher = new FindTransformationMatcher(new FindOperationSelector(
                nullabilityOracle, invarianceOracle, new LambdaCaptureAnalyzer(), config.useMethodReferences()));
    }

    /**
     * Match the loop without changing anything.
     *
     * @param loop the loop statement or the label wrapping it
     */
    public Optional<ResultTransformation> analyze(Statement loop) {
        return match(loop).map(Match::transformation);
    }

    private Optional<Match> match(Statement loop) {
        Optional<LoopMatchInput> input = extractor.extract(loop);
        if (input.isEmpty()) {
            return Optional.empty();
        }
        Optional<TransformationMatch.Result> result =
                matcher.matchWithFilterBefore(input.get().state(), input.get().filter());
        if (result.isEmpty()) {
            logger.debug("No find idiom at line {}", line(loop));
            return Optional.empty();
        }

        ResultTransformation transformation = result.get().resultTransformation();
        if (transformation.getChainCallCount() > config.maxChainCallCount()) {
            logger.debug("{} needs {} chained calls, limit is {}", transformation.getPresentation(),
                    transformation.getChainCallCount(), config.maxChainCallCount());
            return Optional.empty();
        }
        return Optional.of(new Match(input.get(), transformation));
    }

    /**
     * Convert the loop in place.
     *
     * @param loop the loop statement or the label wrapping it
     * @return the conversion, or empty when the loop was left as it is
     */
    public Optional<ConversionResult> convert(Statement loop) {
        Optional<Match> match = match(loop);
        if (match.isEmpty()) {
            return Optional.empty();
        }
        ResultTransformation transformation = match.get().transformation();
        Statement outer = ASTUtility.withLabels(transformation.getLoop());
        Optional<Comment> loopComment = outer.getComment();
        Optional<CompilationUnit> cu = outer.findCompilationUnit();
        int line = line(outer);

        // the chain is generated while the loop is still attached
        Expression callChain = transformation.generateCode(
                new JavaChainedCallGenerator(match.get().input().state().iterable()));
        Statement resultStatement = transformation.convertLoop(callChain);

        if (resultStatement.getComment().isEmpty()) {
            loopComment.ifPresent(comment -> resultStatement.setComment(comment.clone()));
        }
        if (usesIntStream(callChain)) {
            cu.ifPresent(LoopToCallChainConverter::addIntStreamImport);
        }

        logger.info("Converted loop at line {} to {}", line, transformation.getPresentation());
        return Optional.of(new ConversionResult(transformation.getPresentation(),
                transformation.getChainCallCount(), resultStatement, callChain));
    }

    private static boolean usesIntStream(Expression callChain) {
        return callChain.findAll(NameExpr.class).stream()
                .anyMatch(name -> name.getNameAsString().equals(INT_STREAM));
    }

    private static void addIntStreamImport(CompilationUnit cu) {
        boolean imported = cu.getImports().stream()
                .filter(i -> !i.isStatic())
                .anyMatch(LoopToCallChainConverter::isIntStreamImport);
        if (!imported) {
            cu.addImport(INT_STREAM_PACKAGE + "." + INT_STREAM);
        }
    }

    private static boolean isIntStreamImport(ImportDeclaration declaration) {
        String name = declaration.getNameAsString();
        return declaration.isAsterisk()
                ? name.equals(INT_STREAM_PACKAGE)
                : name.equals(INT_STREAM_PACKAGE + "." + INT_STREAM);
    }

    private record Match(LoopMatchInput input, ResultTransformation transformation) {
    }

    private static int line(Statement statement) {
        return statement.getBegin().map(position -> position.line).orElse(-1);
    }
}
