package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

/**
 * Emits a parameterless action, used for {@code break} and {@code continue}.
 */
public class MarkerConverter<T extends Statement> implements IAstNodeToIrConverter<T> {

    private final String actionType;

    public MarkerConverter(String actionType) {
        this.actionType = actionType;
    }

    @Override
    public void convert(T node, IrGenContext ctx) {
        ctx.emit(ctx.action(actionType, node));
    }
}
