package org.retroscript.compiler.completion;

import org.retroscript.compiler.frontend.lexer.Lexer;
import org.retroscript.compiler.frontend.semantics.BuiltinSignatures;
import org.retroscript.compiler.frontend.semantics.FunctionSignature;
import org.retroscript.compiler.frontend.semantics.FunctionSignature.ParamType;
import org.retroscript.compiler.frontend.semantics.FunctionSignature.Parameter;
import org.retroscript.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Suggests keywords, built-in functions, variables, snippets and, inside string literals,
 * asset and flow names for a typed prefix.
 * <p>
 * Keywords come from the lexer's keyword table and functions from {@link BuiltinSignatures},
 * so the suggestions always match what the parser and analyzer accept. The asset, flow and
 * variable context is supplied by the caller, typically from the {@link SymbolTable} of the
 * last analysis via {@link #updateFrom(SymbolTable)}.
 * <p>
 * Usage:
 * <pre>{@code
 * CompletionProvider provider = new CompletionProvider();
 * provider.setContext(List.of("btn_ok", "img_error"), List.of("main", "login"), null);
 * List<CompletionItem> items = provider.complete("wait_", false);
 * }</pre>
 */
public class CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(CompletionProvider.class);

    /** Snippets are only offered while the prefix is at most this long. */
    public static final int SNIPPET_PREFIX_LIMIT = 3;

    private static final Map<String, String> KEYWORD_DETAILS = Map.ofEntries(
            Map.entry("flow", "Flow definition"),
            Map.entry("interrupt", "Interrupt handler"),
            Map.entry("priority", "Interrupt priority"),
            Map.entry("when", "Interrupt trigger"),
            Map.entry("image", "Image trigger"),
            Map.entry("const", "Constant definition"),
            Map.entry("let", "Variable binding"),
            Map.entry("if", "Conditional statement"),
            Map.entry("elif", "Else if clause"),
            Map.entry("else", "Else clause"),
            Map.entry("while", "While loop"),
            Map.entry("for", "For loop"),
            Map.entry("in", "In keyword"),
            Map.entry("label", "Label definition"),
            Map.entry("goto", "Jump to label"),
            Map.entry("try", "Try block"),
            Map.entry("catch", "Catch clause"),
            Map.entry("break", "Break loop"),
            Map.entry("continue", "Continue loop"),
            Map.entry("return", "Return statement"),
            Map.entry("hotkeys", "Hotkey configuration"),
            Map.entry("repeat", "Repeat a block N times"),
            Map.entry("retry", "Retry a block on failure"),
            Map.entry("match", "Match on a value"),
            Map.entry("true", "Boolean true"),
            Map.entry("false", "Boolean false"),
            Map.entry("null", "Null value"));

    private static final Map<String, String> FUNCTION_DETAILS = Map.ofEntries(
            Map.entry("wait_image", "Wait for image to appear/disappear"),
            Map.entry("find_image", "Find image on screen"),
            Map.entry("image_exists", "Check if image exists"),
            Map.entry("wait_any", "Wait for any of several images"),
            Map.entry("click", "Click at position"),
            Map.entry("move", "Move mouse to position"),
            Map.entry("hotkey", "Press keyboard shortcut"),
            Map.entry("type_text", "Type text"),
            Map.entry("sleep", "Wait for duration"),
            Map.entry("run_flow", "Run another flow"),
            Map.entry("log", "Log a message"),
            Map.entry("assert", "Fail when a condition is false"),
            Map.entry("range", "Number range"));

    private static final List<CompletionItem> KEYWORDS;
    private static final List<CompletionItem> FUNCTIONS;
    private static final List<CompletionItem> SNIPPETS = List.of(
            snippet("flow_new", "New flow definition", "flow $1 {\n  $0\n}", "Create a new flow."),
            snippet("if_block", "If block", "if $1 {\n  $0\n}", "Create an if statement."),
            snippet("if_else", "If-else block", "if $1 {\n  $2\n} else {\n  $0\n}", "Create an if-else statement."),
            snippet("while_loop", "While loop", "while $1 {\n  $0\n}", "Create a while loop."),
            snippet("for_loop", "For loop", "for $1 in range($2) {\n  $0\n}", "Create a for loop with range."),
            snippet("label_goto", "Label and goto", "label $1:\n$0\ngoto $1;", "Create a label with goto jump."),
            snippet("repeat_block", "Repeat block", "repeat $1 times {\n  $0\n}", "Run a block a fixed number of times."),
            snippet("retry_block", "Retry block", "retry $1 {\n  $2\n} else {\n  $0\n}",
                    "Retry a block and run the else block when every attempt fails."),
            snippet("wait_find", "Wait and find image", "wait_image(\"$1\");\nfind_image(\"$1\");",
                    "Wait for an image to appear, then locate it."),
            snippet("interrupt_block", "Interrupt handler",
                    "interrupt {\n  priority $1\n  when image \"$2\"\n  {\n    $0\n  }\n}", "Create an interrupt handler."));

    static {
        List<CompletionItem> keywords = new ArrayList<>();
        for (String keyword : Lexer.keywords().stream().sorted().collect(Collectors.toList())) {
            keywords.add(new CompletionItem(keyword, CompletionKind.KEYWORD,
                    KEYWORD_DETAILS.getOrDefault(keyword, "Keyword")));
        }
        KEYWORDS = List.copyOf(keywords);

        List<CompletionItem> functions = new ArrayList<>();
        for (String name : BuiltinSignatures.names()) {
            FunctionSignature signature = BuiltinSignatures.get(name).orElseThrow();
            functions.add(new CompletionItem(name, CompletionKind.FUNCTION,
                    FUNCTION_DETAILS.getOrDefault(name, "Built-in function"),
                    insertText(signature), signatureText(signature)));
        }
        FUNCTIONS = List.copyOf(functions);
    }

    private List<String> assets = List.of();
    private List<String> flows = List.of();
    private List<String> variables = List.of();

    /**
     * Replaces parts of the completion context. A null argument leaves that part unchanged.
     *
     * @param assets    asset ids offered inside strings
     * @param flows     flow names offered inside strings
     * @param variables variable and constant names offered in code
     */
    public void setContext(Collection<String> assets, Collection<String> flows, Collection<String> variables) {
        if (assets != null) {
            this.assets = List.copyOf(assets);
        }
        if (flows != null) {
            this.flows = List.copyOf(flows);
        }
        if (variables != null) {
            this.variables = List.copyOf(variables);
        }
    }

    /**
     * Takes the whole context from an analyzed symbol table: known assets, declared flows, and
     * constants followed by local bindings. Names the parser synthesizes for sugar are skipped.
     */
    public void updateFrom(SymbolTable symbolTable) {
        List<String> names = new ArrayList<>(symbolTable.getConstantNames());
        for (String name : symbolTable.getScopedVariableNames()) {
            if (!name.startsWith("_") && !names.contains(name)) {
                names.add(name);
            }
        }
        setContext(symbolTable.getAssetIds(), symbolTable.getFlowNames(), names);
        log.debug("Completion context: {} assets, {} flows, {} variables", assets.size(), flows.size(), variables.size());
    }

    /**
     * Returns the suggestions whose label starts with {@code prefix}, ignoring case.
     *
     * @param prefix   the text typed so far, may be empty
     * @param inString true when the cursor is inside a string literal; only assets and flows
     *                 are suggested there
     * @return matching items: keywords, functions, variables, then snippets for short prefixes
     */
    public List<CompletionItem> complete(String prefix, boolean inString) {
        String lower = prefix == null ? "" : prefix.toLowerCase(Locale.ROOT);
        List<CompletionItem> results = new ArrayList<>();
        if (inString) {
            addNames(results, assets, lower, CompletionKind.ASSET, "Image asset");
            addNames(results, flows, lower, CompletionKind.FLOW, "Flow");
            return results;
        }
        addMatching(results, KEYWORDS, lower);
        addMatching(results, FUNCTIONS, lower);
        addNames(results, variables, lower, CompletionKind.VARIABLE, "Variable");
        if (lower.length() <= SNIPPET_PREFIX_LIMIT) {
            addMatching(results, SNIPPETS, lower);
        }
        return results;
    }

    /**
     * @return the signature of a built-in, such as {@code sleep(duration: duration)}, or empty
     *         for an unknown name
     */
    public Optional<String> getFunctionSignature(String name) {
        return BuiltinSignatures.get(name).map(CompletionProvider::signatureText);
    }

    public List<CompletionItem> getAllFunctions() {
        return FUNCTIONS;
    }

    public List<CompletionItem> getAllKeywords() {
        return KEYWORDS;
    }

    public List<CompletionItem> getAllSnippets() {
        return SNIPPETS;
    }

    private static void addMatching(List<CompletionItem> results, List<CompletionItem> items, String lowerPrefix) {
        for (CompletionItem item : items) {
            if (item.label().toLowerCase(Locale.ROOT).startsWith(lowerPrefix)) {
                results.add(item);
            }
        }
    }

    private static void addNames(List<CompletionItem> results, List<String> names, String lowerPrefix,
                                 CompletionKind kind, String detail) {
        for (String name : names) {
            if (name.toLowerCase(Locale.ROOT).startsWith(lowerPrefix)) {
                results.add(new CompletionItem(name, kind, detail));
            }
        }
    }

    private static CompletionItem snippet(String label, String detail, String body, String documentation) {
        return new CompletionItem(label, CompletionKind.SNIPPET, detail, body, documentation);
    }

    static String insertText(FunctionSignature signature) {
        if (signature.variadic()) {
            return signature.name() + "(\"$1\")";
        }
        List<String> stops = new ArrayList<>();
        int stop = 1;
        for (Parameter parameter : signature.required()) {
            stops.add(parameter.type() == ParamType.STRING ? "\"$" + stop + "\"" : "$" + stop);
            stop++;
        }
        return signature.name() + "(" + String.join(", ", stops) + ")";
    }

    static String signatureText(FunctionSignature signature) {
        List<String> parts = new ArrayList<>();
        for (Parameter parameter : signature.required()) {
            parts.add(parameter.name() + ": " + parameter.type().displayName());
        }
        parts.addAll(signature.optional().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue().displayName())
                .collect(Collectors.toList()));
        if (signature.variadic()) {
            parts.add("keys...");
        }
        return signature.name() + "(" + String.join(", ", parts) + ")";
    }
}
