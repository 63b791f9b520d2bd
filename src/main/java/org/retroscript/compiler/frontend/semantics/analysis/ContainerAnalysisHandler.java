package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Switches the label namespace when entering a flow or interrupt.
 */
public class ContainerAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.enterContainer(node.meta().id());
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.leaveContainer();
    }
}
