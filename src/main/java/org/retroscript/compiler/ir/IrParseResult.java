package org.retroscript.compiler.ir;

import org.retroscript.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Result of parsing text into IR. On errors the IR is empty and marked invalid.
 *
 * @param ir          the IR, never null
 * @param diagnostics all parse diagnostics
 */
public record IrParseResult(ScriptIR ir, List<Diagnostic> diagnostics) {

    public IrParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return the diagnostics rendered as messages.
     */
    public List<String> errors() {
        return diagnostics.stream().map(Diagnostic::toString).toList();
    }
}
