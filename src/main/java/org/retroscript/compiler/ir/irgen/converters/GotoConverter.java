package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.GotoStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

public class GotoConverter implements IAstNodeToIrConverter<GotoStmt> {

    @Override
    public void convert(GotoStmt node, IrGenContext ctx) {
        ActionIR action = ctx.action(ActionIR.GOTO, node);
        action.setParam("target", node.label());
        ctx.emit(action);
    }
}
