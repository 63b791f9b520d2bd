package org.retroscript.compiler.diagnostics;

import org.retroscript.compiler.diagnostics.Diagnostic.Severity;
import org.retroscript.compiler.model.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics over one compilation run. Diagnostics are kept in report order.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportAll(List<Diagnostic> all) {
        diagnostics.addAll(all);
    }

    public void reportError(String code, String message, Span span) {
        report(new Diagnostic(code, Severity.ERROR, message, span));
    }

    public void reportWarning(String code, String message, Span span) {
        report(new Diagnostic(code, Severity.WARNING, message, span));
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public int errorCount() {
        return (int) diagnostics.stream().filter(Diagnostic::isError).count();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return all diagnostics, one per line, for log output and error messages.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            if (sb.length() > 0) sb.append(System.lineSeparator());
            sb.append(d);
        }
        return sb.toString();
    }
}
