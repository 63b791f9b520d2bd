package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for pass-1 symbol collection handlers.
 * Each collector registers declarations (flows, labels, constants) into the symbol table
 * before the validation pass, so that forward references resolve.
 */
public interface ISymbolCollector {
    /**
     * Collects symbols from a single AST node before its children are visited.
     * @param node The node to collect symbols from.
     * @param symbolTable The symbol table to register symbols in.
     * @param diagnostics The engine for reporting errors.
     */
    void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);

    /**
     * Called after all children of the node have been visited during symbol collection.
     * @param node The node whose children have been visited.
     * @param symbolTable The symbol table.
     * @param diagnostics The engine for reporting errors.
     */
    default void collectAfterChildren(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {}
}
