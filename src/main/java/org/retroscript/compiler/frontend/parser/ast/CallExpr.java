package org.retroscript.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code callee(arg, ..., name = value, ...)}. Keyword arguments keep source order.
 */
public record CallExpr(NodeMeta meta, Expression callee, List<Expression> args,
                       Map<String, Expression> kwargs) implements Expression {

    public CallExpr {
        args = List.copyOf(args);
        kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /**
     * @return the callee name, or null when the callee is not a plain identifier.
     */
    public String calleeName() {
        return callee instanceof Identifier id ? id.name() : null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(args);
        children.addAll(kwargs.values());
        return children;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
