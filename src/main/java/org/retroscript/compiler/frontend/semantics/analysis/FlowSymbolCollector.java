package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.FlowDecl;
import org.retroscript.compiler.frontend.semantics.Symbol;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Defines the flow symbol and opens the flow's label namespace for its body.
 */
public class FlowSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        FlowDecl flow = (FlowDecl) node;
        symbolTable.defineFlow(Symbol.of(flow.name(), Symbol.Type.FLOW, flow))
                .ifPresent(previous -> diagnostics.report(
                        Diagnostics.duplicateFlow(flow.name(), flow.span(), previous.span())));
        symbolTable.enterContainer(flow.meta().id());
    }

    @Override
    public void collectAfterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.leaveContainer();
    }
}
