package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

/**
 * Emits a marker action carrying the statement's canonical source and no parameters.
 */
public class VerbatimConverter<T extends Statement> implements IAstNodeToIrConverter<T> {

    private final String actionType;

    public VerbatimConverter(String actionType) {
        this.actionType = actionType;
    }

    @Override
    public void convert(T node, IrGenContext ctx) {
        ctx.emit(ctx.verbatim(actionType, node));
    }
}
