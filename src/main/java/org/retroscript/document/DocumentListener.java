package org.retroscript.document;

import org.retroscript.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Observer of {@link ScriptDocument} events. All methods default to no-ops.
 */
public interface DocumentListener {

    /**
     * @param changeType what changed, for example {@code code_editor}, {@code gui} or {@code flow_added}
     */
    default void onIrChanged(String changeType) {
    }

    /**
     * Called after the document regenerated its text from the IR.
     *
     * @param source the origin of the change, {@code gui} or {@code new}
     */
    default void onCodeChanged(String source) {
    }

    default void onErrors(List<Diagnostic> errors) {
    }

    default void onStateChanged(DocumentState oldState, DocumentState newState) {
    }
}
