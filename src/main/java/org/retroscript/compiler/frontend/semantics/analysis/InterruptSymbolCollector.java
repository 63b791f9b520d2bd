package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.InterruptDecl;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Checks the trigger asset of an interrupt and gives the interrupt its own label namespace.
 */
public class InterruptSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        InterruptDecl interrupt = (InterruptDecl) node;
        String asset = interrupt.whenAsset();
        if (asset != null && !asset.isEmpty() && !symbolTable.isKnownAsset(asset)) {
            diagnostics.report(Diagnostics.unknownAsset(asset, interrupt.span()));
        }
        symbolTable.enterContainer(interrupt.meta().id());
    }

    @Override
    public void collectAfterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.leaveContainer();
    }
}
