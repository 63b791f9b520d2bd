package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.LabelStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

public class LabelConverter implements IAstNodeToIrConverter<LabelStmt> {

    @Override
    public void convert(LabelStmt node, IrGenContext ctx) {
        ActionIR action = ctx.action(ActionIR.LABEL, node);
        action.setParam("name", node.name());
        ctx.emit(action);
    }
}
