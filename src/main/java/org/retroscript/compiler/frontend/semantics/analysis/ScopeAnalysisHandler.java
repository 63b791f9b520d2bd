package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.CatchClause;
import org.retroscript.compiler.frontend.parser.ast.ForStmt;
import org.retroscript.compiler.frontend.semantics.Symbol;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Opens a lexical scope for blocks, loops and catch clauses. Loops bind their loop variable
 * and catch clauses their error variable in the new scope.
 */
public class ScopeAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.enterScope();
        if (node instanceof ForStmt loop) {
            symbolTable.define(Symbol.of(loop.variable(), Symbol.Type.VARIABLE, loop));
        } else if (node instanceof CatchClause clause && clause.variable() != null) {
            symbolTable.define(Symbol.of(clause.variable(), Symbol.Type.VARIABLE, clause));
        }
    }

    @Override
    public void afterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.leaveScope();
    }
}
