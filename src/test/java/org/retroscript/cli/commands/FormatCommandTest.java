package org.retroscript.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.retroscript.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the format command.
 */
@Tag("unit")
public class FormatCommandTest {

    private static final String CANONICAL = "flow main {\n  click(100, 200);\n}\n";

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testCommandIsRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("format", "check", "ir", "help");
    }

    @Test
    void testPrintsFormattedScript() throws Exception {
        Path script = tempDir.resolve("main.rscript");
        Files.writeString(script, "FLOW main{click(100,200);}");

        int exitCode = run("format", "-f", script.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).isEqualTo(CANONICAL);
        assertThat(Files.readString(script)).isEqualTo("FLOW main{click(100,200);}");
    }

    @Test
    void testWriteRewritesFile() throws Exception {
        Path script = tempDir.resolve("main.rscript");
        Files.writeString(script, "flow main{ click(100,200); }");

        int exitCode = run("format", "-f", script.toString(), "--write");

        assertThat(exitCode).isEqualTo(0);
        assertThat(Files.readString(script)).isEqualTo(CANONICAL);
    }

    @Test
    void testCheckReportsUnformattedFile() throws Exception {
        Path messy = tempDir.resolve("messy.rscript");
        Files.writeString(messy, "flow main{click(100,200);}");
        Path clean = tempDir.resolve("clean.rscript");
        Files.writeString(clean, CANONICAL);

        assertThat(run("format", "-f", messy.toString(), "--check")).isEqualTo(1);
        assertThat(run("format", "-f", clean.toString(), "--check")).isEqualTo(0);
        assertThat(out.toString()).contains("is not formatted", "is formatted");
    }

    @Test
    void testSyntaxErrorsAreReported() throws Exception {
        Path script = tempDir.resolve("broken.rscript");
        Files.writeString(script, "flow main { click(1 }");

        int exitCode = run("format", "-f", script.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("syntax error");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testNonexistentFileReturnsError() {
        int exitCode = run("format", "-f", tempDir.resolve("missing.rscript").toString());

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("File not found");
    }

    @Test
    void testMissingRequiredFileOption() {
        int exitCode = run("format");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--file");
    }
}
