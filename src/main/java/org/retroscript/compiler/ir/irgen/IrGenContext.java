package org.retroscript.compiler.ir.irgen;

import org.retroscript.compiler.format.Formatter;
import org.retroscript.compiler.frontend.parser.ast.ArrayExpr;
import org.retroscript.compiler.frontend.parser.ast.Expression;
import org.retroscript.compiler.frontend.parser.ast.Identifier;
import org.retroscript.compiler.frontend.parser.ast.Literal;
import org.retroscript.compiler.frontend.parser.ast.Statement;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one IR generation run: the action list currently being filled and the
 * formatter used to render expressions and compound statements.
 */
public final class IrGenContext {

    private final Formatter formatter = new Formatter();
    private List<ActionIR> target = new ArrayList<>();

    /**
     * Directs subsequent {@link #emit(ActionIR)} calls to the given list.
     */
    public void beginBody(List<ActionIR> actions) {
        this.target = Objects.requireNonNull(actions, "actions");
    }

    public void emit(ActionIR action) {
        target.add(action);
    }

    /**
     * Creates an action for a simple statement, carrying over its source line and comments.
     */
    public ActionIR action(String actionType, Statement statement) {
        ActionIR action = new ActionIR(actionType);
        action.setSourceLine(statement.span().startLine());
        action.getLeadingComments().addAll(statement.meta().leadingComments());
        action.setTrailingComment(statement.meta().trailingComment());
        return action;
    }

    /**
     * Creates a marker action for a compound statement. Its verbatim text is the canonical
     * source of the whole statement, comments included.
     */
    public ActionIR verbatim(String actionType, Statement statement) {
        ActionIR action = new ActionIR(actionType);
        action.setSourceLine(statement.span().startLine());
        action.setVerbatim(formatter.formatNode(statement));
        return action;
    }

    /**
     * Converts an expression into an IR parameter value.
     */
    public Object value(Expression expression) {
        if (expression instanceof Literal literal) {
            return switch (literal.kind()) {
                case DURATION -> new IrValue.Duration(literal.text());
                case INTEGER, FLOAT, STRING, BOOLEAN, NULL -> literal.value();
            };
        }
        if (expression instanceof Identifier identifier) {
            return new IrValue.Reference(identifier.name());
        }
        if (expression instanceof ArrayExpr array) {
            List<Object> elements = new ArrayList<>();
            array.elements().forEach(element -> elements.add(value(element)));
            return new IrValue.ListValue(elements);
        }
        return new IrValue.RawExpression(source(expression));
    }

    /**
     * @return the canonical source text of an expression.
     */
    public String source(Expression expression) {
        return formatter.formatNode(expression);
    }
}
