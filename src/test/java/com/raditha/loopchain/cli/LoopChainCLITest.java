package com.raditha.loopchain.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoopChainCLITest {

    private static final String SOURCE = """
            import java.util.List;

            class Finder {
                String firstBlank(List<String> names) {
                    for (String s : names) {
                        if (s.isEmpty()) {
                            return s;
                        }
                    }
                    return null;
                }

                int firstLong(List<String> names, int limit) {
                    for (int i = 0; i < names.size(); i++) {
                        String s = names.get(i);
                        if (s.length() > limit) return i;
                    }
                    return -1;
                }
            }
            """;

    @TempDir
    Path tempDir;

    private Path source;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        source = tempDir.resolve("Finder.java");
        Files.writeString(source, SOURCE);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = LoopChainCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testDryRunPrintsDiff() throws IOException {
        int exitCode = run("--line", "5", "--assume-non-null", source.toString());

        assertEquals(0, exitCode, err.toString());
        String diff = out.toString();
        assertTrue(diff.contains("--- a/Finder.java"), diff);
        assertTrue(diff.contains("-        for (String s : names) {"), diff);
        assertTrue(diff.contains("return names.stream().filter(s -> s.isEmpty()).findFirst().orElse(null);"), diff);
        assertEquals(SOURCE, Files.readString(source), "Dry run must not touch the file");
    }

    @Test
    void testApplyWritesFile() throws IOException {
        int exitCode = run("--line", "14", "--mode", "apply", source.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("Converted loop at line 14 to indexOfFirst{}"), out.toString());
        String converted = Files.readString(source);
        assertTrue(converted.contains(
                "return IntStream.range(0, names.size()).filter(i -> names.get(i).length() > limit).findFirst().orElse(-1);"),
                converted);
        assertTrue(converted.contains("import java.util.stream.IntStream;"), converted);
        // the other method keeps its loop
        assertTrue(converted.contains("for (String s : names) {"));
    }

    @Test
    void testJsonOutput() throws IOException {
        int exitCode = run("--line", "14", "--json", source.toString());

        assertEquals(0, exitCode, err.toString());
        JsonNode report = new ObjectMapper().readTree(out.toString());
        assertEquals(14, report.get("line").asInt());
        assertEquals("indexOfFirst{}", report.get("operation").asText());
        assertEquals(1, report.get("chainCallCount").asInt());
        assertEquals("dry-run", report.get("mode").asText());
        assertFalse(report.get("applied").asBoolean());
        assertTrue(report.get("replacement").asText().startsWith("IntStream.range(0, names.size())"));
        assertTrue(report.get("diff").asText().contains("@@"));
    }

    @Test
    void testConfigFileSettings() throws IOException {
        Path config = tempDir.resolve("loopchain.yml");
        Files.writeString(config, """
                loop_to_call_chain:
                  assume_non_null: true
                """);

        int exitCode = run("--line", "5", "--config-file", config.toString(), source.toString());

        assertEquals(0, exitCode, err.toString());
        assertTrue(out.toString().contains("findFirst().orElse(null)"));
    }

    @Test
    void testNotConvertible() {
        // element may be null without an annotation or --assume-non-null
        int exitCode = run("--line", "5", source.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("cannot be replaced by a call chain"), err.toString());
        assertTrue(err.toString().contains("See --assume-non-null"), err.toString());
    }

    @Test
    void testNoLoopOnLine() {
        int exitCode = run("--line", "3", source.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("No for loop starts at line 3"), err.toString());
    }

    @Test
    void testMissingFile() {
        int exitCode = run("--line", "5", tempDir.resolve("Missing.java").toString());

        assertEquals(3, exitCode);
        assertTrue(err.toString().contains("I/O error"), err.toString());
    }

    @Test
    void testInvalidConfiguration() {
        assertEquals(2, run("--line", "0", source.toString()));
        assertTrue(err.toString().contains("Line must be positive"), err.toString());

        assertEquals(2, run("--line", "5", "--config-file", tempDir.resolve("none.yml").toString(), source.toString()));
        assertEquals(2, run("--line", "5", "--max-chain-calls=-1", source.toString()));
    }

    @Test
    void testUnparsableSource() throws IOException {
        Files.writeString(source, "class Broken {");

        assertEquals(4, run("--line", "1", source.toString()));
        assertTrue(err.toString().startsWith("Parse error: Cannot parse"), err.toString());
        assertTrue(err.toString().contains("Finder.java"), err.toString());
        assertFalse(err.toString().contains("Configuration error"), err.toString());
    }

    @Test
    void testHelpExplainsNullElements() {
        assertEquals(0, run("--help"));

        String help = out.toString();
        assertTrue(help.contains("--assume-non-null"), help);
        assertTrue(help.contains("an unannotated element type counts as nullable"), help);
        assertTrue(help.contains("4 the source file does not parse"), help);
    }

    @Test
    void testParameterErrors() {
        assertEquals(2, run(source.toString()));
        assertEquals(2, run("--line", "5", "--mode", "preview", source.toString()));
        assertEquals(2, run("--line", "five", source.toString()));
    }

    /**
     * Every combination of valid options parses.
     */
    @Property(tries = 50)
    void validOptionsParse(
            @ForAll @IntRange(min = 1, max = 500) int line,
            @ForAll @IntRange(min = 0, max = 10) int maxChainCalls,
            @ForAll boolean jsonOutput,
            @ForAll boolean assumeNonNull,
            @ForAll("applyModes") ApplyMode mode) {
        List<String> args = new ArrayList<>();
        args.add("--line");
        args.add(String.valueOf(line));
        args.add("--mode");
        args.add(mode.toCliString());
        if (maxChainCalls > 0) {
            args.add("--max-chain-calls");
            args.add(String.valueOf(maxChainCalls));
        }
        if (jsonOutput) {
            args.add("--json");
        }
        if (assumeNonNull) {
            args.add("--assume-non-null");
        }
        args.add("Sample.java");

        CommandLine.ParseResult parsed = new CommandLine(new LoopChainCLI()).parseArgs(args.toArray(new String[0]));

        assertEquals(line, (int) parsed.matchedOptionValue("--line", 0));
        assertEquals(mode, parsed.matchedOptionValue("--mode", ApplyMode.DRY_RUN));
        assertEquals(jsonOutput, parsed.hasMatchedOption("--json"));
        assertEquals(Path.of("Sample.java"), parsed.matchedPositionalValue(0, null));
    }

    @Provide
    Arbitrary<ApplyMode> applyModes() {
        return Arbitraries.of(ApplyMode.values());
    }
}
