package org.retroscript.document;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.QuickFix;
import org.retroscript.compiler.diagnostics.QuickFixProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * Attaches quick fixes to parse diagnostics so an editor can offer them while the document is
 * in the {@link DocumentState#ERROR} state.
 */
public class RecoveryHints {

    private final QuickFixProvider provider;

    public RecoveryHints() {
        this(new QuickFixProvider());
    }

    public RecoveryHints(QuickFixProvider provider) {
        this.provider = provider;
    }

    public List<Diagnostic> attach(List<Diagnostic> diagnostics, String text) {
        String[] lines = text.split("\n", -1);
        List<Diagnostic> result = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            int index = diagnostic.line() - 1;
            String sourceLine = index >= 0 && index < lines.length ? lines[index] : "";
            List<QuickFix> fixes = provider.getFixes(diagnostic, sourceLine);
            if (fixes.isEmpty()) {
                result.add(diagnostic);
            } else {
                List<QuickFix> merged = new ArrayList<>(diagnostic.quickFixes());
                merged.addAll(fixes);
                result.add(diagnostic.withQuickFixes(merged));
            }
        }
        return result;
    }
}
