package org.retroscript.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code try { } [catch [NAME] { }]}. Also the lowering target of {@code retry}.
 *
 * @param catchClause the handler, or null
 * @param retryCount  attempt count for a lowered {@code retry}, null for a plain try
 */
public record TryStmt(NodeMeta meta, BlockStmt tryBlock, CatchClause catchClause, Integer retryCount)
        implements Statement {

    /** Catch variable bound by a lowered {@code retry}. */
    public static final String RETRY_ERROR_VARIABLE = "_retry_err";

    public boolean isRetry() {
        return retryCount != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(tryBlock);
        if (catchClause != null) children.add(catchClause);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTry(this);
    }
}
