package org.retroscript.compiler.ir;

import org.retroscript.compiler.format.Formatter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link ScriptIR} back into RetroScript source. The output is not yet canonical;
 * {@link IrMapper#irToCode(ScriptIR)} runs it through the formatter.
 */
public class IrCodeGenerator {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();

    public String generate(ScriptIR ir) {
        out.setLength(0);
        if (ir.getHotkeys() != null) {
            line(0, "hotkeys {");
            ir.getHotkeys().getBindings().forEach((key, value) -> line(1, key + " = " + Formatter.quote(value)));
            line(0, "}");
        }
        for (ConstantIR constant : ir.getConstants()) {
            line(0, "const " + constant.name() + " = " + render(constant.value()) + ";");
        }
        for (FlowIR flow : ir.getFlows()) {
            line(0, "flow " + flow.getName() + " {");
            flow.getActions().forEach(action -> action(1, action));
            line(0, "}");
        }
        for (InterruptIR interrupt : ir.getInterrupts()) {
            line(0, "interrupt {");
            line(1, "priority " + interrupt.getPriority());
            if (interrupt.getWhenAsset().isEmpty()) {
                line(1, "{");
            } else {
                line(1, "when image " + Formatter.quote(interrupt.getWhenAsset()) + " {");
            }
            interrupt.getActions().forEach(action -> action(2, action));
            line(1, "}");
            line(0, "}");
        }
        return out.toString();
    }

    private void action(int depth, ActionIR action) {
        if (action.hasVerbatim()) {
            action.getVerbatim().lines().forEach(text -> line(depth, text));
            return;
        }
        action.getLeadingComments().forEach(comment -> line(depth, comment));
        String text = statement(action);
        if (action.getTrailingComment() != null) {
            text += "  " + action.getTrailingComment();
        }
        line(depth, text);
    }

    /**
     * Renders a single action without verbatim source as one statement.
     */
    static String statement(ActionIR action) {
        Map<String, Object> params = action.getParams();
        return switch (action.getActionType()) {
            case ActionIR.LABEL -> "label " + params.get("name") + ":";
            case ActionIR.GOTO -> "goto " + params.get("target") + ";";
            case ActionIR.BREAK -> "break;";
            case ActionIR.CONTINUE -> "continue;";
            case ActionIR.RETURN -> params.containsKey("value") ? "return " + render(params.get("value")) + ";" : "return;";
            case ActionIR.LET -> "let " + params.get("name")
                    + (params.containsKey("value") ? " = " + render(params.get("value")) : "") + ";";
            case ActionIR.ASSIGN -> params.get("target") + " = " + render(params.get("value")) + ";";
            case ActionIR.EXPR -> render(params.get("expression")) + ";";
            default -> call(action) + ";";
        };
    }

    private static String call(ActionIR action) {
        List<Map.Entry<String, Object>> positional = new ArrayList<>();
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, Object> param : action.getParams().entrySet()) {
            if (ActionIR.isPositional(param.getKey())) {
                positional.add(param);
            }
        }
        positional.sort(Comparator.comparingInt(param -> Integer.parseInt(param.getKey().substring(3))));
        positional.forEach(param -> parts.add(render(param.getValue())));
        action.getParams().forEach((key, value) -> {
            if (!ActionIR.isPositional(key)) {
                parts.add(key + "=" + render(value));
            }
        });
        return action.getActionType() + "(" + String.join(", ", parts) + ")";
    }

    /**
     * Renders a parameter value as source text.
     */
    public static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return Formatter.quote(s);
        }
        if (value instanceof Double d) {
            return Formatter.formatFloat(d);
        }
        if (value instanceof Float f) {
            return Formatter.formatFloat(f);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof IrValue.Reference reference) {
            return reference.name();
        }
        if (value instanceof IrValue.Duration duration) {
            return duration.text();
        }
        if (value instanceof IrValue.RawExpression raw) {
            return raw.source();
        }
        if (value instanceof IrValue.ListValue list) {
            List<String> elements = new ArrayList<>();
            list.elements().forEach(element -> elements.add(render(element)));
            return "[" + String.join(", ", elements) + "]";
        }
        return Formatter.quote(value.toString());
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
