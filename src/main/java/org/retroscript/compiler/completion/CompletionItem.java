package org.retroscript.compiler.completion;

import java.util.Objects;

/**
 * A single completion suggestion.
 *
 * @param label         the text shown in the completion list and matched against the prefix
 * @param kind          what the suggestion refers to
 * @param detail        a one-line description, may be empty
 * @param insertText    the text to insert; {@code $1}, {@code $2}... mark tab stops and
 *                      {@code $0} the final cursor position
 * @param documentation longer help text, may be empty
 */
public record CompletionItem(String label, CompletionKind kind, String detail, String insertText,
                             String documentation) {

    public CompletionItem {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
        insertText = insertText == null || insertText.isEmpty() ? label : insertText;
        documentation = documentation == null ? "" : documentation;
    }

    public CompletionItem(String label, CompletionKind kind, String detail) {
        this(label, kind, detail, label, "");
    }
}
