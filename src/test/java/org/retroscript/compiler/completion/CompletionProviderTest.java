package org.retroscript.compiler.completion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.frontend.lexer.Lexer;
import org.retroscript.compiler.frontend.parser.Parser;
import org.retroscript.compiler.frontend.semantics.BuiltinSignatures;
import org.retroscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.retroscript.compiler.frontend.semantics.SymbolTable;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompletionProviderTest {

    private CompletionProvider provider;

    @BeforeEach
    void setUp() {
        provider = new CompletionProvider();
        provider.setContext(List.of("btn_ok", "img_error"), List.of("main", "login"), List.of("counter"));
    }

    @Test
    void completesFunctionsByPrefix() {
        List<CompletionItem> items = provider.complete("wait_", false);

        assertThat(items).extracting(CompletionItem::label).containsExactly("wait_image", "wait_any");
        assertThat(items).allMatch(item -> item.kind() == CompletionKind.FUNCTION);
    }

    @Test
    void matchingIgnoresCase() {
        assertThat(provider.complete("WHI", false)).extracting(CompletionItem::label).contains("while", "while_loop");
        assertThat(provider.complete("BTN", true)).extracting(CompletionItem::label).containsExactly("btn_ok");
    }

    @Test
    @DisplayName("Inside a string only assets and flows are offered")
    void stringContextOffersAssetsAndFlows() {
        List<CompletionItem> items = provider.complete("", true);

        assertThat(items).extracting(CompletionItem::label).containsExactly("btn_ok", "img_error", "main", "login");
        assertThat(items).extracting(CompletionItem::kind).containsExactly(
                CompletionKind.ASSET, CompletionKind.ASSET, CompletionKind.FLOW, CompletionKind.FLOW);
    }

    @Test
    void codeContextOffersKeywordsFunctionsVariablesAndSnippets() {
        List<CompletionItem> items = provider.complete("", false);

        assertThat(items).extracting(CompletionItem::kind).contains(CompletionKind.KEYWORD, CompletionKind.FUNCTION,
                CompletionKind.VARIABLE, CompletionKind.SNIPPET);
        assertThat(items).extracting(CompletionItem::kind).doesNotContain(CompletionKind.ASSET, CompletionKind.FLOW);
        assertThat(provider.complete("co", false)).extracting(CompletionItem::label)
                .containsExactly("const", "continue", "counter");
    }

    @Test
    void snippetsOnlyForShortPrefixes() {
        assertThat(provider.complete("for", false)).extracting(CompletionItem::label).containsExactly("for", "for_loop");
        assertThat(provider.complete("for_", false)).isEmpty();
    }

    @Test
    void nullArgumentsKeepExistingContext() {
        provider.setContext(null, List.of("cleanup"), null);

        assertThat(provider.complete("", true)).extracting(CompletionItem::label)
                .containsExactly("btn_ok", "img_error", "cleanup");
        assertThat(provider.complete("cou", false)).extracting(CompletionItem::label).containsExactly("counter");
    }

    @Test
    void everyKeywordAndBuiltinIsListed() {
        assertThat(provider.getAllKeywords()).extracting(CompletionItem::label)
                .containsExactlyInAnyOrderElementsOf(Lexer.keywords());
        assertThat(provider.getAllFunctions()).extracting(CompletionItem::label)
                .containsExactlyElementsOf(BuiltinSignatures.names());
        assertThat(provider.getAllSnippets()).allMatch(item -> item.kind() == CompletionKind.SNIPPET);
    }

    @Test
    void functionInsertTextQuotesStringParameters() {
        assertThat(insertTextOf("wait_image")).isEqualTo("wait_image(\"$1\")");
        assertThat(insertTextOf("click")).isEqualTo("click($1, $2)");
        assertThat(insertTextOf("hotkey")).isEqualTo("hotkey(\"$1\")");
    }

    @Test
    void signatureListsRequiredThenSortedKeywordParameters() {
        assertThat(provider.getFunctionSignature("click"))
                .contains("click(x: any, y: any, button=string, clicks=int, interval=duration)");
        assertThat(provider.getFunctionSignature("hotkey")).contains("hotkey(keys...)");
        assertThat(provider.getFunctionSignature("nope")).isEmpty();
    }

    @Test
    void itemWithoutInsertTextInsertsLabel() {
        CompletionItem item = new CompletionItem("main", CompletionKind.FLOW, "Flow", "", null);

        assertThat(item.insertText()).isEqualTo("main");
        assertThat(item.documentation()).isEmpty();
    }

    @Test
    void contextFromAnalyzedProgramSkipsSynthesizedNames() {
        SymbolTable symbols = new SymbolTable(Set.of("btn_ok"));
        new SemanticAnalyzer(new DiagnosticsEngine(), symbols).analyze(new Parser(
                "const DELAY = 2s;\n"
                        + "flow main { let total = 0; retry 3 { click(1, 2); } }\n"
                        + "flow other { for row in range(2) { let cell = row; } repeat { sleep(1); } }\n").parse().program());

        provider.updateFrom(symbols);

        assertThat(provider.complete("", false)).filteredOn(item -> item.kind() == CompletionKind.VARIABLE)
                .extracting(CompletionItem::label).containsExactly("DELAY", "total", "row", "cell");
        assertThat(provider.complete("", true)).extracting(CompletionItem::label)
                .containsExactly("btn_ok", "main", "other");
    }

    private String insertTextOf(String function) {
        return provider.getAllFunctions().stream()
                .filter(item -> item.label().equals(function))
                .findFirst().orElseThrow().insertText();
    }
}
