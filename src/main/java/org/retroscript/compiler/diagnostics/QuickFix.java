package org.retroscript.compiler.diagnostics;

import org.retroscript.compiler.model.Span;

/**
 * A suggested fix attached to a {@link Diagnostic}. Either replaces {@code targetSpan} with
 * {@code replacement} or names an editor action (for example {@code capture_asset}) that a
 * host application performs.
 */
public record QuickFix(String title, String replacement, Span targetSpan, String action) {

    public static final String CAPTURE_ASSET = "capture_asset";

    public static QuickFix replace(String title, String replacement, Span targetSpan) {
        return new QuickFix(title, replacement, targetSpan, null);
    }

    public static QuickFix action(String title, String action) {
        return new QuickFix(title, null, null, action);
    }

    public boolean isAction() {
        return action != null;
    }
}
