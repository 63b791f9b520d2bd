package org.retroscript.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if cond { } [elif cond { }]* [else { }]}
 *
 * @param elseBlock the else branch, or null
 */
public record IfStmt(NodeMeta meta, Expression condition, BlockStmt thenBlock,
                     List<ElifBranch> elifs, BlockStmt elseBlock) implements Statement {

    /**
     * One {@code elif} branch. Not a node of its own; its parts are children of the if.
     */
    public record ElifBranch(Expression condition, BlockStmt block) {
    }

    public IfStmt {
        elifs = List.copyOf(elifs);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBlock);
        for (ElifBranch elif : elifs) {
            children.add(elif.condition());
            children.add(elif.block());
        }
        if (elseBlock != null) children.add(elseBlock);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
