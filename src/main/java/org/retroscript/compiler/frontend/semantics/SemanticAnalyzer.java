package org.retroscript.compiler.frontend.semantics;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.Program;
import org.retroscript.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.retroscript.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Performs semantic analysis on the AST: duplicate declarations, unresolved flow, label and
 * asset references, and built-in call arity. It operates by traversing the AST and dispatching
 * nodes to the handlers of an {@link AnalysisHandlerRegistry}.
 * <p>
 * Analysis never modifies the AST and never aborts; every finding becomes a diagnostic.
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final AnalysisHandlerRegistry registry;

    /**
     * Constructs a semantic analyzer.
     *
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to use for analysis, pre-populated with known assets.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.registry = AnalysisHandlerRegistry.initializeWithDefaults();
    }

    /**
     * Analyzes a program against a set of known asset ids.
     *
     * @param program     The parsed program.
     * @param knownAssets Asset ids managed outside the script.
     * @return All semantic diagnostics in traversal order.
     */
    public static List<Diagnostic> analyze(Program program, Collection<String> knownAssets) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        new SemanticAnalyzer(diagnostics, new SymbolTable(knownAssets)).analyze(program);
        return diagnostics.getDiagnostics();
    }

    /**
     * Analyzes the given program. This is the main entry point for the semantic analysis phase.
     * It performs two passes: one to collect declarations (flows, labels, constants), and a
     * second to validate references and calls.
     *
     * @param program The program to analyze.
     */
    public void analyze(Program program) {
        collectSymbols(program.getChildren());
        symbolTable.resetScope();
        traverseAndAnalyze(program.getChildren());
        log.debug("Semantic analysis finished with {} diagnostics", diagnostics.getDiagnostics().size());
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    private void collectSymbols(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<ISymbolCollector> collector = registry.resolveCollector(node.getClass());
            collector.ifPresent(c -> c.collect(node, symbolTable, diagnostics));
            collectSymbols(node.getChildren());
            collector.ifPresent(c -> c.collectAfterChildren(node, symbolTable, diagnostics));
        }
    }

    private void traverseAndAnalyze(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<IAnalysisHandler> handler = registry.resolveHandler(node.getClass());
            handler.ifPresent(h -> h.analyze(node, symbolTable, diagnostics));
            traverseAndAnalyze(node.getChildren());
            handler.ifPresent(h -> h.afterChildren(node, symbolTable, diagnostics));
        }
    }
}
