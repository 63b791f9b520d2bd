package org.retroscript.compiler.api;

import org.retroscript.compiler.completion.CompletionItem;
import org.retroscript.compiler.completion.CompletionProvider;
import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.format.Formatter;
import org.retroscript.compiler.frontend.lexer.LexResult;
import org.retroscript.compiler.frontend.lexer.Lexer;
import org.retroscript.compiler.frontend.parser.ParseResult;
import org.retroscript.compiler.frontend.parser.Parser;
import org.retroscript.compiler.frontend.parser.ast.Program;
import org.retroscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.retroscript.compiler.frontend.semantics.SymbolTable;
import org.retroscript.compiler.ir.IrMapper;
import org.retroscript.compiler.ir.IrParseResult;
import org.retroscript.compiler.ir.ScriptIR;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Entry point to the compiler front-end for editors and tools. All operations are synchronous
 * and never throw for malformed input; problems are reported as {@link Diagnostic}s.
 */
public class RetroScriptCompiler {

    private final IrMapper irMapper = new IrMapper();

    public LexResult tokenize(String text) {
        return new Lexer(requireText(text)).tokenize();
    }

    public ParseResult parse(String text) {
        return new Parser(requireText(text)).parse();
    }

    /**
     * Runs semantic analysis on a parsed program.
     *
     * @param program     the program to analyze
     * @param knownAssets ids of the assets the script may reference
     * @return the semantic diagnostics
     */
    public List<Diagnostic> analyze(Program program, Collection<String> knownAssets) {
        Objects.requireNonNull(program, "program");
        return SemanticAnalyzer.analyze(program, knownAssets == null ? List.of() : knownAssets);
    }

    /**
     * Parses and analyzes text, returning parse diagnostics followed by semantic ones.
     */
    public List<Diagnostic> check(String text, Collection<String> knownAssets) {
        ParseResult result = parse(text);
        List<Diagnostic> all = new ArrayList<>(result.diagnostics());
        all.addAll(analyze(result.program(), knownAssets));
        return all;
    }

    /**
     * @return canonical text, or the input unchanged when it does not parse cleanly
     */
    public String formatCode(String text) {
        return Formatter.formatCode(requireText(text));
    }

    /**
     * Completes {@code prefix} against the assets, flows and variables of {@code text}. The text
     * may contain errors; whatever the parser recovers contributes to the context.
     *
     * @param text        the current document text
     * @param prefix      the word being typed
     * @param inString    true when the cursor is inside a string literal
     * @param knownAssets ids of the assets the script may reference
     * @return the matching suggestions
     */
    public List<CompletionItem> complete(String text, String prefix, boolean inString, Collection<String> knownAssets) {
        ParseResult result = parse(text);
        SymbolTable symbols = new SymbolTable(knownAssets == null ? List.of() : knownAssets);
        new SemanticAnalyzer(new DiagnosticsEngine(), symbols).analyze(result.program());
        CompletionProvider provider = new CompletionProvider();
        provider.updateFrom(symbols);
        return provider.complete(prefix, inString);
    }

    public IrParseResult parseToIr(String text) {
        return irMapper.parseToIr(requireText(text));
    }

    public String irToCode(ScriptIR ir) {
        return irMapper.irToCode(Objects.requireNonNull(ir, "ir"));
    }

    private static String requireText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Source text must not be null");
        }
        return text;
    }
}
