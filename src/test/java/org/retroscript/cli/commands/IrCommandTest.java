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
 * Smoke tests for the ir command.
 */
@Tag("unit")
public class IrCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testPrintsIrAsJson() throws Exception {
        Path script = tempDir.resolve("main.rscript");
        Files.writeString(script, "flow main { click(100, 200); sleep(1s); }");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("ir", "-f", script.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(0);
        assertThat(out.toString()).contains("\"flows\"", "\"actionType\": \"click\"", "\"kind\": \"duration\"");
    }

    @Test
    void testParseErrorsFail() throws Exception {
        Path script = tempDir.resolve("broken.rscript");
        Files.writeString(script, "flow main { click(1 }");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("ir", "-f", script.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).isNotEmpty();
        assertThat(out.toString()).isEmpty();
    }
}
