package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code flow NAME { ... }}
 */
public record FlowDecl(NodeMeta meta, String name, BlockStmt body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFlow(this);
    }
}
