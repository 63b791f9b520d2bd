package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.AssignStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

public class AssignConverter implements IAstNodeToIrConverter<AssignStmt> {

    @Override
    public void convert(AssignStmt node, IrGenContext ctx) {
        ActionIR action = ctx.action(ActionIR.ASSIGN, node);
        action.setParam("target", node.target());
        action.setParam("value", ctx.value(node.value()));
        ctx.emit(action);
    }
}
