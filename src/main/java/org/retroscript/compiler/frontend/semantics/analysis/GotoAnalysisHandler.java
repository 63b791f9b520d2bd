package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.GotoStmt;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Verifies that a goto targets a label of the same flow or interrupt.
 */
public class GotoAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        GotoStmt jump = (GotoStmt) node;
        if (symbolTable.resolveLabel(jump.label()).isEmpty()) {
            diagnostics.report(Diagnostics.unknownLabel(jump.label(), jump.span()));
        }
    }
}
