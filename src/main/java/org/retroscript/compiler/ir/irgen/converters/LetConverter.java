package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.LetStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

/**
 * {@code let x = v;} becomes {@code let{name, value}}; the value is omitted for a bare declaration.
 */
public class LetConverter implements IAstNodeToIrConverter<LetStmt> {

    @Override
    public void convert(LetStmt node, IrGenContext ctx) {
        ActionIR action = ctx.action(ActionIR.LET, node);
        action.setParam("name", node.name());
        if (node.value() != null) {
            action.setParam("value", ctx.value(node.value()));
        }
        ctx.emit(action);
    }
}
