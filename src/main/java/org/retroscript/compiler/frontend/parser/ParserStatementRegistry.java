package org.retroscript.compiler.frontend.parser;

import org.retroscript.compiler.frontend.parser.features.match.MatchStatementHandler;
import org.retroscript.compiler.frontend.parser.features.repeat.RepeatStatementHandler;
import org.retroscript.compiler.frontend.parser.features.retry.RetryStatementHandler;
import org.retroscript.compiler.model.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for statement handlers, keyed by the keyword that introduces the statement.
 */
public class ParserStatementRegistry {

    private final Map<TokenType, IParserStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a keyword.
     * @param keyword The keyword token type.
     * @param handler The handler for statements starting with this keyword.
     */
    public void register(TokenType keyword, IParserStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a keyword.
     * @param keyword The keyword token type.
     * @return The handler, or empty if none is registered.
     */
    public Optional<IParserStatementHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Creates a registry with all built-in statement handlers.
     * @return A new registry instance.
     */
    public static ParserStatementRegistry initialize() {
        ParserStatementRegistry registry = new ParserStatementRegistry();
        registry.register(TokenType.REPEAT, new RepeatStatementHandler());
        registry.register(TokenType.RETRY, new RetryStatementHandler());
        registry.register(TokenType.MATCH, new MatchStatementHandler());
        return registry;
    }
}
