package org.retroscript.compiler.completion;

/**
 * What a {@link CompletionItem} refers to.
 */
public enum CompletionKind {
    KEYWORD,
    FUNCTION,
    ASSET,
    FLOW,
    VARIABLE,
    SNIPPET
}
