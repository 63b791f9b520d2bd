package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.frontend.parser.ast.Program;
import org.retroscript.compiler.model.Token;

import java.util.List;

/**
 * Output of {@link Parser#parse()}. The program is always present, even when diagnostics
 * were reported; it then contains every statement that could be recovered.
 */
public record ParseResult(Program program, List<Diagnostic> diagnostics, List<Token> comments) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
        comments = List.copyOf(comments);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
