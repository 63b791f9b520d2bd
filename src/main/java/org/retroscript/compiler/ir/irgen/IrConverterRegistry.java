package org.retroscript.compiler.ir.irgen;

import org.retroscript.compiler.frontend.parser.ast.AssignStmt;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.BlockStmt;
import org.retroscript.compiler.frontend.parser.ast.BreakStmt;
import org.retroscript.compiler.frontend.parser.ast.ConstStmt;
import org.retroscript.compiler.frontend.parser.ast.ContinueStmt;
import org.retroscript.compiler.frontend.parser.ast.ExprStmt;
import org.retroscript.compiler.frontend.parser.ast.ForStmt;
import org.retroscript.compiler.frontend.parser.ast.GotoStmt;
import org.retroscript.compiler.frontend.parser.ast.IfStmt;
import org.retroscript.compiler.frontend.parser.ast.LabelStmt;
import org.retroscript.compiler.frontend.parser.ast.LetStmt;
import org.retroscript.compiler.frontend.parser.ast.ReturnStmt;
import org.retroscript.compiler.frontend.parser.ast.TryStmt;
import org.retroscript.compiler.frontend.parser.ast.WhileStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.converters.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping statement classes to their IR converters.
 */
public final class IrConverterRegistry {

    private final Map<Class<? extends AstNode>, IAstNodeToIrConverter<? extends AstNode>> converters = new HashMap<>();

    public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToIrConverter<T> converter) {
        converters.put(nodeType, converter);
    }

    public Optional<IAstNodeToIrConverter<? extends AstNode>> resolve(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(converters.get(nodeType));
    }

    /**
     * Converts a node with the converter registered for its class.
     *
     * @throws IllegalStateException if no converter is registered for the node's class
     */
    @SuppressWarnings("unchecked")
    public <T extends AstNode> void convert(T node, IrGenContext ctx) {
        IAstNodeToIrConverter<T> converter = (IAstNodeToIrConverter<T>) resolve(node.getClass())
                .orElseThrow(() -> new IllegalStateException("No IR converter for " + node.getClass().getSimpleName()));
        converter.convert(node, ctx);
    }

    /**
     * Creates a registry covering every statement type.
     *
     * @return A fully initialized registry.
     */
    public static IrConverterRegistry initializeWithDefaults() {
        IrConverterRegistry registry = new IrConverterRegistry();

        registry.register(ExprStmt.class, new ExpressionStatementConverter());
        registry.register(LabelStmt.class, new LabelConverter());
        registry.register(GotoStmt.class, new GotoConverter());
        registry.register(BreakStmt.class, new MarkerConverter<>(ActionIR.BREAK));
        registry.register(ContinueStmt.class, new MarkerConverter<>(ActionIR.CONTINUE));
        registry.register(ReturnStmt.class, new ReturnConverter());
        registry.register(LetStmt.class, new LetConverter());
        registry.register(AssignStmt.class, new AssignConverter());

        // Compound statements keep their nested bodies as verbatim source
        registry.register(IfStmt.class, new IfConverter());
        registry.register(ForStmt.class, new ForConverter());
        registry.register(TryStmt.class, new TryConverter());
        registry.register(WhileStmt.class, new VerbatimConverter<>(ActionIR.WHILE));
        registry.register(BlockStmt.class, new VerbatimConverter<>(ActionIR.BLOCK));
        registry.register(ConstStmt.class, new VerbatimConverter<>(ActionIR.CONST));

        return registry;
    }
}
