package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.IfStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

/**
 * Marker for an if chain. {@code branches} counts the conditional branches (the if plus
 * each elif); the nested bodies stay in the verbatim source.
 */
public class IfConverter implements IAstNodeToIrConverter<IfStmt> {

    @Override
    public void convert(IfStmt node, IrGenContext ctx) {
        ActionIR action = ctx.verbatim(ActionIR.IF, node);
        action.setParam("has_else", node.elseBlock() != null);
        action.setParam("branches", (long) (1 + node.elifs().size()));
        ctx.emit(action);
    }
}
