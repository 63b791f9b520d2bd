package org.retroscript.compiler.diagnostics;

import org.retroscript.compiler.model.Span;

import java.util.List;

/**
 * A diagnostic message produced by the lexer, parser or semantic analyzer.
 *
 * @param code        stable code such as {@code E1101}
 * @param severity    how serious the finding is
 * @param message     human readable message
 * @param span        the offending source range
 * @param hint        optional hint, may be null
 * @param relatedSpan original declaration for duplicate definitions, may be null
 * @param quickFixes  suggested fixes, never null
 */
public record Diagnostic(String code, Severity severity, String message, Span span,
                         String hint, Span relatedSpan, List<QuickFix> quickFixes) {

    public enum Severity {
        ERROR, WARNING, INFO, HINT
    }

    public Diagnostic {
        quickFixes = quickFixes == null ? List.of() : List.copyOf(quickFixes);
    }

    public Diagnostic(String code, Severity severity, String message, Span span) {
        this(code, severity, message, span, null, null, List.of());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public int line() {
        return span.startLine();
    }

    public int column() {
        return span.startColumn();
    }

    public Diagnostic withQuickFixes(List<QuickFix> fixes) {
        return new Diagnostic(code, severity, message, span, hint, relatedSpan, fixes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code).append("] ")
                .append(severity.name().toLowerCase()).append(": ")
                .append(message).append(" at ").append(span);
        if (hint != null) {
            sb.append(System.lineSeparator()).append("  Hint: ").append(hint);
        }
        return sb.toString();
    }
}
