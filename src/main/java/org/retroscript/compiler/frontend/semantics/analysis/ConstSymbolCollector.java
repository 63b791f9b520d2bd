package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.ConstStmt;
import org.retroscript.compiler.frontend.semantics.Symbol;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Defines constants. A redefinition is a warning and the later value wins.
 */
public class ConstSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        ConstStmt constant = (ConstStmt) node;
        symbolTable.defineConstant(Symbol.of(constant.name(), Symbol.Type.CONSTANT, constant))
                .ifPresent(previous -> diagnostics.report(
                        Diagnostics.duplicateConstant(constant.name(), constant.span(), previous.span())));
    }
}
