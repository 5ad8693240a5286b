package com.raditha.loopchain.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.raditha.loopchain.config.LoopChainConfig;
import com.raditha.loopchain.config.LoopChainSettings;
import com.raditha.loopchain.generation.ExpressionPatterns;
import com.raditha.loopchain.refactoring.ConversionResult;
import com.raditha.loopchain.refactoring.DiffGenerator;
import com.raditha.loopchain.refactoring.LoopLocator;
import com.raditha.loopchain.refactoring.LoopToCallChainConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the loop to call chain converter.
 * <p>
 * Usage:
 * java -jar loopchain.jar --line &lt;n&gt; [options] &lt;file&gt;
 * <p>
 * Configuration priority: CLI arguments > loopchain.yml > defaults
 */
@Command(name = "loopchain", mixinStandardHelpOptions = true, version = "loopchain v1.0.0",
        description = "Replaces a find loop with a Stream or Collection call chain",
        footer = {
                "",
                "Null elements: findFirst() and reduce() throw on a null element.",
                "A loop that returns or assigns the element itself is converted only",
                "when the element is known to be non-null. By default",
                "an unannotated element type counts as nullable and the loop is kept.",
                "Annotate the type with @NonNull, use a @NullMarked scope, or pass",
                "--assume-non-null (assume_non_null: true in loopchain.yml).",
                "",
                "Exit codes: 0 converted, 1 not converted or unexpected error,",
                "2 invalid options or configuration, 3 I/O error,",
                "4 the source file does not parse."
        })
public class LoopChainCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(LoopChainCLI.class);

    private static final String DEFAULT_CONFIG_FILE = "loopchain.yml";

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Java source file", paramLabel = "<file>")
    private Path file;

    @Option(names = "--line", required = true, description = "Line where the loop (or its label) starts", paramLabel = "<n>")
    private int line;

    @Option(names = "--mode", description = "Mode: dry-run or apply (default: dry-run)", paramLabel = "<mode>", converter = ApplyModeConverter.class)
    private ApplyMode mode = ApplyMode.DRY_RUN;

    @Option(names = "--json", description = "Output the result in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--max-chain-calls", description = "Longest call chain to produce (default: 3)", paramLabel = "<n>")
    private int maxChainCalls = 0; // 0 = use YAML/default

    @Option(names = "--assume-non-null", description = {
            "Treat unannotated declarations as non-null (default: false).",
            "Needed to convert loops that return or assign the element itself, unless it is annotated."})
    private Boolean assumeNonNull; // null = use YAML/default

    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Path effectiveConfig = configFile != null ? configFile : Path.of(DEFAULT_CONFIG_FILE);
        LoopChainConfig config = LoopChainSettings.loadConfig(effectiveConfig, maxChainCalls, assumeNonNull);

        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        CompilationUnit cu = parse(file);
        LexicalPreservingPrinter.setup(cu);

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Optional<Statement> loop = LoopLocator.findLoopAtLine(cu, line);
        if (loop.isEmpty()) {
            err.println("No for loop starts at line " + line + " of " + file);
            return 1;
        }

        Optional<ConversionResult> result = new LoopToCallChainConverter(config).convert(loop.get());
        if (result.isEmpty()) {
            err.println("The loop at line " + line + " cannot be replaced by a call chain");
            if (!config.assumeNonNull()) {
                err.println("Unannotated elements count as nullable. See --assume-non-null in --help.");
            }
            return 1;
        }

        String converted = LexicalPreservingPrinter.print(cu);
        String diff = new DiffGenerator().generateUnifiedDiff(file, converted);
        boolean applied = mode == ApplyMode.APPLY;
        if (applied) {
            Files.writeString(file, converted);
            logger.info("Wrote {}", file);
        }

        ConversionResult conversion = result.get();
        if (jsonOutput) {
            ConversionReport report = new ConversionReport(file.toString(), line, conversion.presentation(),
                    conversion.chainCallCount(), ExpressionPatterns.print(conversion.callChain()),
                    mode.toCliString(), applied, diff);
            out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } else if (applied) {
            out.printf("Converted loop at line %d to %s%n", line, conversion.presentation());
        } else {
            out.println(diff);
        }
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The command line with the exit code mapping used by {@link #main}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new LoopChainCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof SourceParseException) {
                commandLine.getErr().println("Parse error: " + ex.getMessage());
                return 4;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (line < 1) {
            throw new IllegalArgumentException("Line must be positive, got: " + line);
        }
        if (maxChainCalls != 0 && maxChainCalls < 1) {
            throw new IllegalArgumentException("Max-chain-calls must be positive, got: " + maxChainCalls);
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
    }

    /**
     * @throws SourceParseException if the file is not valid Java 17
     */
    private static CompilationUnit parse(Path source) throws IOException {
        ParserConfiguration configuration = new ParserConfiguration();
        configuration.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> parsed = new JavaParser(configuration).parse(source);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw new SourceParseException(source, parsed.getProblems());
        }
        return parsed.getResult().get();
    }

    /**
     * Custom converter for ApplyMode enum to handle CLI string values.
     */
    public static class ApplyModeConverter implements ITypeConverter<ApplyMode> {
        @Override
        public ApplyMode convert(String value) throws Exception {
            return ApplyMode.fromString(value);
        }
    }
}
