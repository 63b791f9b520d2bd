package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.frontend.parser.ast.Statement;

/**
 * Handler for keyword-introduced statements that are lowered to core AST nodes
 * while parsing (for example {@code repeat} and {@code retry}).
 */
public interface IParserStatementHandler {

    /**
     * Parses the statement starting at the current keyword token.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The lowered statement, never {@code null}.
     * @throws ParseException if the statement is malformed.
     */
    Statement parse(ParsingContext context);
}
