package org.retroscript.compiler.frontend.semantics;

import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.CallExpr;
import org.retroscript.compiler.frontend.parser.ast.CatchClause;
import org.retroscript.compiler.frontend.parser.ast.ConstStmt;
import org.retroscript.compiler.frontend.parser.ast.FlowDecl;
import org.retroscript.compiler.frontend.parser.ast.ForStmt;
import org.retroscript.compiler.frontend.parser.ast.GotoStmt;
import org.retroscript.compiler.frontend.parser.ast.InterruptDecl;
import org.retroscript.compiler.frontend.parser.ast.LabelStmt;
import org.retroscript.compiler.frontend.parser.ast.LetStmt;
import org.retroscript.compiler.frontend.semantics.analysis.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to analysis handlers (pass 2) and symbol collectors (pass 1).
 * Follows the same pattern as {@link org.retroscript.compiler.ir.irgen.IrConverterRegistry}.
 */
public final class AnalysisHandlerRegistry {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Map<Class<? extends AstNode>, ISymbolCollector> collectors = new HashMap<>();

    /**
     * Registers a pass-2 analysis handler for the given AST node class.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Registers a pass-1 symbol collector for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param collector The collector instance.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void registerCollector(Class<T> nodeType, ISymbolCollector collector) {
        collectors.put(nodeType, collector);
    }

    public Optional<IAnalysisHandler> resolveHandler(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    public Optional<ISymbolCollector> resolveCollector(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(collectors.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with the default handlers and collectors.
     *
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults() {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();

        // Pass-1 collectors
        registry.registerCollector(FlowDecl.class, new FlowSymbolCollector());
        registry.registerCollector(InterruptDecl.class, new InterruptSymbolCollector());
        registry.registerCollector(ConstStmt.class, new ConstSymbolCollector());
        registry.registerCollector(LabelStmt.class, new LabelSymbolCollector());

        // Pass-2 handlers
        ContainerAnalysisHandler container = new ContainerAnalysisHandler();
        ScopeAnalysisHandler scope = new ScopeAnalysisHandler();
        registry.register(FlowDecl.class, container);
        registry.register(InterruptDecl.class, container);
        registry.register(BlockStmt.class, scope);
        registry.register(ForStmt.class, scope);
        registry.register(CatchClause.class, scope);
        registry.register(LetStmt.class, new LetAnalysisHandler());
        registry.register(GotoStmt.class, new GotoAnalysisHandler());
        registry.register(CallExpr.class, new CallAnalysisHandler());

        return registry;
    }
}
