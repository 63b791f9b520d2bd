package org.retroscript.compiler.frontend.parser.ast;

import org.retroscript.compiler.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Metadata shared by every AST node: source span, a parse-local id and attached comments.
 * Comments are attached after parsing, so they are the only mutable part of a node.
 */
public final class NodeMeta {

    private final Span span;
    private final String id;
    private final List<String> leadingComments = new ArrayList<>();
    private String trailingComment;

    public NodeMeta(Span span, String id) {
        this.span = span;
        this.id = id;
    }

    /**
     * Metadata for nodes synthesized outside the parser, for example by the IR mapper.
     */
    public static NodeMeta synthetic(Span span) {
        return new NodeMeta(span, "synthetic");
    }

    public Span span() {
        return span;
    }

    public String id() {
        return id;
    }

    public List<String> leadingComments() {
        return leadingComments;
    }

    public String trailingComment() {
        return trailingComment;
    }

    public void setTrailingComment(String trailingComment) {
        this.trailingComment = trailingComment;
    }

    @Override
    public String toString() {
        return id + "@" + span;
    }
}
