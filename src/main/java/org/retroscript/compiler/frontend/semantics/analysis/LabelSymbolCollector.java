package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.LabelStmt;
import org.retroscript.compiler.frontend.semantics.Symbol;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Collects label symbols during pass 1 into the namespace of the enclosing flow or interrupt.
 */
public class LabelSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        LabelStmt label = (LabelStmt) node;
        symbolTable.defineLabel(Symbol.of(label.name(), Symbol.Type.LABEL, label))
                .ifPresent(previous -> diagnostics.report(
                        Diagnostics.duplicateLabel(label.name(), label.span(), previous.span())));
    }
}
