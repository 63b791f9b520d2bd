package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.TryStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

/**
 * Marker for {@code try}; a lowered {@code retry} additionally carries its attempt count.
 */
public class TryConverter implements IAstNodeToIrConverter<TryStmt> {

    @Override
    public void convert(TryStmt node, IrGenContext ctx) {
        ActionIR action = ctx.verbatim(ActionIR.TRY, node);
        if (node.isRetry()) {
            action.setParam("retry_count", (long) node.retryCount());
        }
        ctx.emit(action);
    }
}
