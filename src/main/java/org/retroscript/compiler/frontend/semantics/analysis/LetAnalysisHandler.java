package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.LetStmt;
import org.retroscript.compiler.frontend.semantics.Symbol;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Binds a let-variable in the current scope once its initializer has been analyzed.
 */
public class LetAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // bound in afterChildren so the initializer cannot see the new binding
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        LetStmt let = (LetStmt) node;
        symbolTable.define(Symbol.of(let.name(), Symbol.Type.VARIABLE, let));
    }
}
