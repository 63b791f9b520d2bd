package org.retroscript.cli.commands;

import org.retroscript.cli.CommandLineInterface;
import org.retroscript.compiler.api.RetroScriptCompiler;
import org.retroscript.compiler.ir.IrJson;
import org.retroscript.compiler.ir.IrParseResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "ir",
    description = "Print the intermediate representation of a script as JSON"
)
public class IrCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Script file to map"
    )
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
        PrintWriter err = spec.commandLine().getErr();

        String source = ScriptFileSupport.read(file, err);
        if (source == null) {
            return 1;
        }
        IrParseResult result = new RetroScriptCompiler().parseToIr(source);
        if (result.hasErrors()) {
            result.errors().forEach(err::println);
            err.flush();
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(IrJson.toJson(result.ir()));
        out.flush();
        return 0;
    }
}
