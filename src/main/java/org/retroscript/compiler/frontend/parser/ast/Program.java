package org.retroscript.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed script.
 *
 * @param meta       node metadata
 * @param hotkeys    the hotkeys block, or null when absent
 * @param flows      flow declarations in source order
 * @param interrupts interrupt declarations in source order
 * @param constants  top-level constants in source order
 */
public record Program(NodeMeta meta, HotkeysDecl hotkeys, List<FlowDecl> flows,
                      List<InterruptDecl> interrupts, List<ConstStmt> constants) implements AstNode {

    public Program {
        flows = List.copyOf(flows);
        interrupts = List.copyOf(interrupts);
        constants = List.copyOf(constants);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (hotkeys != null) children.add(hotkeys);
        children.addAll(constants);
        children.addAll(flows);
        children.addAll(interrupts);
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
