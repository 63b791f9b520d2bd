package org.retroscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code interrupt { priority N when image "ASSET" { ... } }}
 */
public record InterruptDecl(NodeMeta meta, int priority, String whenAsset, BlockStmt body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitInterrupt(this);
    }
}
