package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.ForStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

public class ForConverter implements IAstNodeToIrConverter<ForStmt> {

    @Override
    public void convert(ForStmt node, IrGenContext ctx) {
        ActionIR action = ctx.verbatim(ActionIR.FOR, node);
        action.setParam("variable", node.variable());
        ctx.emit(action);
    }
}
