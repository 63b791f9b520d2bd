package org.retroscript.compiler.ir.irgen.converters;

import org.retroscript.compiler.frontend.parser.ast.CallExpr;
import org.retroscript.compiler.frontend.parser.ast.ExprStmt;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.IrValue;
import org.retroscript.compiler.ir.irgen.IAstNodeToIrConverter;
import org.retroscript.compiler.ir.irgen.IrGenContext;

import java.util.TreeMap;

/**
 * Converts a call statement into an action named after the callee, with positional arguments
 * {@code arg0, arg1, ...} followed by the keyword arguments in name order. Any other expression
 * statement becomes an {@code expr} action holding the expression source, as does a call whose
 * shape a call action cannot hold: a callee named like a statement tag ({@code expr(1)}) or a
 * keyword argument named like a positional key.
 */
public class ExpressionStatementConverter implements IAstNodeToIrConverter<ExprStmt> {

    @Override
    public void convert(ExprStmt node, IrGenContext ctx) {
        CallExpr call = node.call();
        if (call == null || call.calleeName() == null || ActionIR.isStatementTag(call.calleeName())
                || hasPositionalLikeKeyword(call)) {
            ActionIR action = ctx.action(ActionIR.EXPR, node);
            action.setParam("expression", new IrValue.RawExpression(
                    ctx.source(node.expression())));
            ctx.emit(action);
            return;
        }
        ActionIR action = ctx.action(call.calleeName(), node);
        for (int i = 0; i < call.args().size(); i++) {
            action.setParam(ActionIR.positional(i), ctx.value(call.args().get(i)));
        }
        new TreeMap<>(call.kwargs()).forEach((key, value) -> action.setParam(key, ctx.value(value)));
        ctx.emit(action);
    }

    private static boolean hasPositionalLikeKeyword(CallExpr call) {
        return call.kwargs().keySet().stream().anyMatch(ActionIR::isPositional);
    }
}
