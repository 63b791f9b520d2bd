package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.ReturnStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

public class ReturnConverter implements IAstNodeToIrConverter<ReturnStmt> {

    @Override
    public void convert(ReturnStmt node, IrGenContext ctx) {
        ActionIR action = ctx.action(ActionIR.RETURN, node);
        if (node.value() != null) {
            action.setParam("value", ctx.value(node.value()));
        }
        ctx.emit(action);
    }
}
