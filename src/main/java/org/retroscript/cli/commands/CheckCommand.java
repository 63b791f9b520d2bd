package org.retroscript.cli.commands;

import com.typesafe.config.Config;
import org.retroscript.cli.CommandLineInterface;
import org.retroscript.compiler.api.RetroScriptCompiler;
import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.document.RecoveryHints;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Report syntax and semantic diagnostics of a script"
)
public class CheckCommand implements Callable<Integer> {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Script file to check"
    )
    private Path file;

    @Option(
        names = {"-a", "--asset"},
        description = "Known asset id; repeat for several (added to retroscript.analyzer.known-assets)"
    )
    private List<String> assets = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();

        String source = ScriptFileSupport.read(file, spec.commandLine().getErr());
        if (source == null) {
            return 1;
        }

        Set<String> knownAssets = new LinkedHashSet<>(config.getStringList("retroscript.analyzer.known-assets"));
        knownAssets.addAll(assets);

        List<Diagnostic> diagnostics = new RecoveryHints().attach(
                new RetroScriptCompiler().check(source, knownAssets), source);
        for (Diagnostic diagnostic : diagnostics) {
            out.println(file.getFileName() + ":" + diagnostic.line() + ":" + diagnostic.column() + ": " + diagnostic);
            diagnostic.quickFixes().forEach(fix -> out.println("  fix: " + fix.title()));
        }
        long errors = diagnostics.stream().filter(Diagnostic::isError).count();
        out.println(errors + " error(s), " + (diagnostics.size() - errors) + " other diagnostic(s)");
        out.flush();
        return errors > 0 ? 1 : 0;
    }
}
