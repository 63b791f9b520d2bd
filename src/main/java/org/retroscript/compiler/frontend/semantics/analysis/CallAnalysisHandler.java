package org.retroscript.compiler.frontend.semantics.analysis;

import org.retroscript.compiler.diagnostics.Diagnostics;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.parser.ast.ArrayExpr;
import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.frontend.parser.ast.CallExpr;
import org.retroscript.compiler.frontend.parser.ast.ConstStmt;
import org.retroscript.compiler.frontend.parser.ast.Expression;
import org.retroscript.compiler.frontend.parser.ast.Identifier;
import org.retroscript.compiler.frontend.parser.ast.Literal;
import org.retroscript.compiler.frontend.semantics.BuiltinSignatures;
import org.retroscript.compiler.frontend.semantics.FunctionSignature;
import org.retroscript.compiler.frontend.semantics.Symbol;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

import java.util.Map;
import java.util.Optional;

/**
 * Validates calls to built-in functions:
 * <ul>
 *   <li>asset references of the image functions and {@code wait_any} must be known assets,</li>
 *   <li>{@code run_flow} must name a declared flow,</li>
 *   <li>required arguments must be present, keyword arguments must exist and literal
 *       keyword values must fit the declared parameter type.</li>
 * </ul>
 * Asset and flow names are checked when given as string literals or as constants bound to one.
 */
public class CallAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        CallExpr call = (CallExpr) node;
        String name = call.calleeName();
        if (name == null) {
            return;
        }

        if (BuiltinSignatures.RUN_FLOW.equals(name)) {
            argument(call, 0, "flow_name").ifPresent(arg -> {
                String flow = staticString(arg, symbolTable);
                if (flow != null && symbolTable.resolveFlow(flow).isEmpty()) {
                    diagnostics.report(Diagnostics.unknownFlow(flow, arg.span()));
                }
            });
        } else if (BuiltinSignatures.IMAGE_FUNCTIONS.contains(name)) {
            argument(call, 0, "asset").ifPresent(arg -> checkAsset(arg, symbolTable, diagnostics));
        } else if (BuiltinSignatures.WAIT_ANY.equals(name)) {
            argument(call, 0, "assets").ifPresent(arg -> {
                if (arg instanceof ArrayExpr array) {
                    array.elements().forEach(element -> checkAsset(element, symbolTable, diagnostics));
                }
            });
        }

        BuiltinSignatures.get(name).ifPresent(signature -> checkArguments(call, signature, diagnostics));
    }

    private static void checkAsset(Expression arg, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        String asset = staticString(arg, symbolTable);
        if (asset != null && !symbolTable.isKnownAsset(asset)) {
            diagnostics.report(Diagnostics.unknownAsset(asset, arg.span()));
        }
    }

    private static void checkArguments(CallExpr call, FunctionSignature signature, DiagnosticsEngine diagnostics) {
        if (signature.variadic()) {
            return;
        }
        for (int i = 0; i < signature.required().size(); i++) {
            FunctionSignature.Parameter parameter = signature.required().get(i);
            if (i >= call.args().size() && !call.kwargs().containsKey(parameter.name())) {
                diagnostics.report(Diagnostics.missingArgument(signature.name(), parameter.name(), call.span()));
            }
        }
        for (Map.Entry<String, Expression> kwarg : call.kwargs().entrySet()) {
            Optional<FunctionSignature.ParamType> type = signature.typeOf(kwarg.getKey());
            if (type.isEmpty()) {
                diagnostics.report(Diagnostics.invalidArgument(signature.name(), kwarg.getKey(),
                        "unknown keyword argument", kwarg.getValue().span()));
            } else if (kwarg.getValue() instanceof Literal literal && !type.get().accepts(literal.kind())) {
                diagnostics.report(Diagnostics.typeMismatch(signature.name(), kwarg.getKey(),
                        type.get().displayName(), literal.kind().name().toLowerCase(), literal.span()));
            }
        }
    }

    private static Optional<Expression> argument(CallExpr call, int position, String keyword) {
        if (call.args().size() > position) {
            return Optional.of(call.args().get(position));
        }
        return Optional.ofNullable(call.kwargs().get(keyword));
    }

    /**
     * Returns the string value of a string literal, or of an identifier that resolves to a
     * constant initialized with one. Anything else is not statically known.
     */
    private static String staticString(Expression expr, SymbolTable symbolTable) {
        if (expr instanceof Literal literal) {
            return literal.isString() ? (String) literal.value() : null;
        }
        if (expr instanceof Identifier identifier) {
            Optional<Symbol> symbol = symbolTable.resolve(identifier.name());
            if (symbol.isPresent() && symbol.get().declaration() instanceof ConstStmt constant
                    && constant.value() instanceof Literal value && value.isString()) {
                return (String) value.value();
            }
        }
        return null;
    }
}
