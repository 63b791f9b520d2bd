package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.diagnostics.Diagnostic;

/**
 * Unwinds the parser to the nearest statement or declaration boundary.
 * Never escapes {@link Parser#parse()}; the carried diagnostic is recorded there.
 */
public class ParseException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    public ParseException(Diagnostic diagnostic) {
        super(diagnostic.message(), null, false, false);
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
