package org.retroscript.cli.commands;

import org.retroscript.cli.CommandLineInterface;
import org.retroscript.compiler.api.RetroScriptCompiler;
import org.retroscript.compiler.frontend.parser.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "format",
    description = "Print a script in canonical formatting"
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Script file to format"
    )
    private Path file;

    @Option(
        names = {"-w", "--write"},
        description = "Rewrite the file in place instead of printing it"
    )
    private boolean write;

    @Option(
        names = {"--check"},
        description = "Only check; exit with 1 if the file is not canonically formatted"
    )
    private boolean check;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source = ScriptFileSupport.read(file, err);
        if (source == null) {
            return 1;
        }
        RetroScriptCompiler compiler = new RetroScriptCompiler();
        ParseResult parsed = compiler.parse(source);
        if (!parsed.isClean()) {
            err.println(file + " has " + parsed.diagnostics().size() + " syntax error(s); not formatted");
            parsed.diagnostics().forEach(err::println);
            return 1;
        }
        String formatted = compiler.formatCode(source);

        if (check) {
            if (formatted.equals(source)) {
                out.println(file + " is formatted");
                return 0;
            }
            out.println(file + " is not formatted");
            return 1;
        }
        if (write) {
            try {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to write " + file + ": " + e.getMessage());
                return 1;
            }
            log.info("Formatted {}", file);
            return 0;
        }
        out.print(formatted);
        out.flush();
        return 0;
    }
}
