package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.FlowDecl;
import org.retroscript.compiler.frontend.parser.ast.HotkeysDecl;
import org.retroscript.compiler.frontend.parser.ast.InterruptDecl;
import org.retroscript.compiler.frontend.parser.ast.Program;
import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.model.Span;
import org.retroscript.compiler.model.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Attaches comments from the lexer side channel to statements and declarations.
 * <ul>
 *   <li>A comment that starts on the line where a node ends, after its end, is that node's
 *       trailing comment. The node ending closest to the comment wins, ties go to the innermost.</li>
 *   <li>Any other comment leads the first node that starts after it.</li>
 *   <li>Comments after the last node lead the {@link Program} itself and are printed at the end.</li>
 * </ul>
 */
final class CommentAttacher {

    private CommentAttacher() {
    }

    static void attach(Program program, List<Token> comments) {
        if (comments.isEmpty()) {
            return;
        }
        List<AstNode> anchors = new ArrayList<>();
        collectAnchors(program, anchors);
        anchors.sort(Comparator.comparingInt((AstNode n) -> n.span().startLine())
                .thenComparingInt(n -> n.span().startColumn()));

        for (Token comment : comments) {
            AstNode trailingOwner = findTrailingOwner(anchors, comment);
            if (trailingOwner != null) {
                String existing = trailingOwner.meta().trailingComment();
                trailingOwner.meta().setTrailingComment(existing == null ? comment.text() : existing + " " + comment.text());
                continue;
            }
            AstNode next = findNext(anchors, comment);
            if (next != null) {
                next.meta().leadingComments().add(comment.text());
            } else {
                program.meta().leadingComments().add(comment.text());
            }
        }
    }

    private static void collectAnchors(AstNode node, List<AstNode> anchors) {
        if (isAnchor(node)) {
            anchors.add(node);
        }
        for (AstNode child : node.getChildren()) {
            collectAnchors(child, anchors);
        }
    }

    private static boolean isAnchor(AstNode node) {
        if (node instanceof BlockStmt) {
            return false;
        }
        return node instanceof Statement || node instanceof FlowDecl
                || node instanceof InterruptDecl || node instanceof HotkeysDecl;
    }

    private static AstNode findTrailingOwner(List<AstNode> anchors, Token comment) {
        AstNode owner = null;
        for (AstNode anchor : anchors) {
            Span span = anchor.span();
            if (span.endLine() == comment.line() && span.endColumn() <= comment.column()
                    && (owner == null || span.endColumn() >= owner.span().endColumn())) {
                owner = anchor;
            }
        }
        return owner;
    }

    private static AstNode findNext(List<AstNode> anchors, Token comment) {
        for (AstNode anchor : anchors) {
            Span span = anchor.span();
            if (span.startLine() > comment.endLine()
                    || (span.startLine() == comment.endLine() && span.startColumn() >= comment.endColumn())) {
                return anchor;
            }
        }
        return null;
    }
}
