package org.retroscript.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code hotkeys { start = "F5" ... }}. Bindings keep source order.
 */
public record HotkeysDecl(NodeMeta meta, Map<String, String> bindings) implements AstNode {

    public HotkeysDecl {
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitHotkeys(this);
    }
}
