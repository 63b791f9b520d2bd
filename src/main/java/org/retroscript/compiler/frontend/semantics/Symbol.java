package org.retroscript.compiler.frontend.semantics;

import org.retroscript.compiler.frontend.parser.ast.AstNode;
import org.retroscript.compiler.model.Span;

/**
 * A named declaration known to the analyzer.
 *
 * @param name        the declared name
 * @param type        what kind of symbol this is
 * @param span        the declaration site, {@link Span#NONE} for externally supplied assets
 * @param declaration the declaring node, null for externally supplied assets
 */
public record Symbol(String name, Type type, Span span, AstNode declaration) {

    public enum Type {
        ASSET,
        FLOW,
        LABEL,
        CONSTANT,
        VARIABLE
    }

    public static Symbol of(String name, Type type, AstNode declaration) {
        return new Symbol(name, type, declaration.span(), declaration);
    }
}
