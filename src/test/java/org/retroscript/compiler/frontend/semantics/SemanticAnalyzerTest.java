package org.retroscript.compiler.frontend.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.DiagnosticCodes;
import org.retroscript.compiler.diagnostics.DiagnosticsEngine;
import org.retroscript.compiler.diagnostics.QuickFix;
import org.retroscript.compiler.frontend.parser.ParseResult;
import org.retroscript.compiler.frontend.parser.Parser;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SemanticAnalyzer}.
 */
@Tag("unit")
class SemanticAnalyzerTest {

    private static List<Diagnostic> analyze(String source, Collection<String> knownAssets) {
        ParseResult result = new Parser(source).parse();
        assertThat(result.diagnostics()).as("parse diagnostics").isEmpty();
        return SemanticAnalyzer.analyze(result.program(), knownAssets);
    }

    private static List<Diagnostic> analyze(String source) {
        return analyze(source, Set.of());
    }

    @Test
    @DisplayName("Labels are scoped to their flow")
    void labelsAreScopedPerFlow() {
        List<Diagnostic> diagnostics = analyze("flow a { goto x; } flow b { label x: }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.UNKNOWN_LABEL);
        assertThat(diagnostics.get(0).message()).contains("x");
    }

    @Test
    void gotoToLabelInSameFlowIsValid() {
        assertThat(analyze("flow a { label x: goto x; }")).isEmpty();
    }

    @Test
    void forwardGotoIsValid() {
        assertThat(analyze("flow a { goto done; click(1, 2); label done: }")).isEmpty();
    }

    @Test
    void labelInsideNestedBlockIsVisibleInFlow() {
        assertThat(analyze("flow a { if ready { label inner: } goto inner; }")).isEmpty();
    }

    @Test
    void duplicateLabelPointsToOriginal() {
        List<Diagnostic> diagnostics = analyze("flow a {\n  label x:\n  label x:\n}");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.DUPLICATE_LABEL);
        assertThat(diagnostics.get(0).relatedSpan().startLine()).isEqualTo(2);
        assertThat(diagnostics.get(0).span().startLine()).isEqualTo(3);
    }

    @Test
    @DisplayName("Unknown asset yields exactly one diagnostic with a capture quick fix")
    void unknownAssetHasCaptureQuickFix() {
        List<Diagnostic> diagnostics = analyze("flow main { wait_image(\"btn\"); }");

        assertThat(diagnostics).hasSize(1);
        Diagnostic diagnostic = diagnostics.get(0);
        assertThat(diagnostic.code()).isEqualTo(DiagnosticCodes.UNKNOWN_ASSET);
        assertThat(diagnostic.message()).contains("btn");
        assertThat(diagnostic.isError()).isTrue();
        assertThat(diagnostic.quickFixes()).extracting(QuickFix::action).containsExactly(QuickFix.CAPTURE_ASSET);
    }

    @Test
    void knownAssetIsAccepted() {
        assertThat(analyze("flow main { wait_image(\"btn\", timeout=5s); click(1, 2); }", Set.of("btn"))).isEmpty();
    }

    @Test
    void assetGivenByConstantIsChecked() {
        List<Diagnostic> diagnostics = analyze("const BTN = \"btn\";\nflow main { find_image(BTN); }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.UNKNOWN_ASSET);
        assertThat(diagnostics.get(0).message()).contains("btn");
    }

    @Test
    void waitAnyChecksEveryElement() {
        List<Diagnostic> diagnostics = analyze("flow main { wait_any([\"a\", \"b\"]); }", Set.of("a"));

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0).message()).contains("\"b\"");
    }

    @Test
    void interruptAssetMustBeKnown() {
        List<Diagnostic> diagnostics = analyze("interrupt { priority 1 when image \"popup\" { click(1, 2); } }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.UNKNOWN_ASSET);
    }

    @Test
    void runFlowRequiresDeclaredFlow() {
        assertThat(analyze("flow main { run_flow(\"helper\"); } flow helper { }")).isEmpty();

        List<Diagnostic> diagnostics = analyze("flow main { run_flow(\"missing\"); }");
        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.UNKNOWN_FLOW);
    }

    @Test
    void duplicateFlow() {
        List<Diagnostic> diagnostics = analyze("flow a { }\nflow a { }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.DUPLICATE_FLOW);
        assertThat(diagnostics.get(0).relatedSpan()).isNotNull();
    }

    @Test
    void duplicateConstantIsAWarning() {
        List<Diagnostic> diagnostics = analyze("const A = 1;\nconst A = 2;\nflow main { }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.DUPLICATE_CONSTANT);
        assertThat(diagnostics.get(0).severity()).isEqualTo(Diagnostic.Severity.WARNING);
    }

    @Test
    void missingRequiredArgument() {
        List<Diagnostic> diagnostics = analyze("flow main { click(100); }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.MISSING_ARGUMENT);
        assertThat(diagnostics.get(0).message()).contains("'y'");
    }

    @Test
    void requiredArgumentMayBeGivenByKeyword() {
        assertThat(analyze("flow main { click(100, y=200); }")).isEmpty();
    }

    @Test
    void unknownKeywordArgumentIsInvalid() {
        List<Diagnostic> diagnostics = analyze("flow main { click(1, 2, force=true); }");

        assertThat(diagnostics).extracting(Diagnostic::code).containsExactly(DiagnosticCodes.INVALID_ARGUMENT);
    }

    @Test
    void literalKeywordTypeMismatch() {
        List<Diagnostic> diagnostics = analyze("flow main { click(1, 2, button=5, clicks=\"two\"); }");

        assertThat(diagnostics).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCodes.TYPE_MISMATCH, DiagnosticCodes.TYPE_MISMATCH);
    }

    @Test
    void durationParametersAcceptPlainNumbers() {
        assertThat(analyze("flow main { click(1, 2, interval=100); click(1, 2, interval=250ms); }")).isEmpty();
    }

    @Test
    void variadicAndUnknownFunctionsAreNotChecked() {
        assertThat(analyze("flow main { hotkey(\"ctrl\", \"c\"); my_helper(1, 2, 3); }")).isEmpty();
    }

    @Test
    void unknownIdentifiersAreTolerated() {
        assertThat(analyze("flow main { let $a = undefined_thing; log($a); }")).isEmpty();
    }

    @Test
    void analyzerExposesCollectedSymbols() {
        ParseResult result = new Parser("const LIMIT = 3;\nflow main { } flow other { }").parse();
        SymbolTable table = new SymbolTable(Set.of("btn"));
        new SemanticAnalyzer(new DiagnosticsEngine(), table).analyze(result.program());

        assertThat(table.resolveFlow("main")).isPresent();
        assertThat(table.resolveFlow("other")).isPresent();
        assertThat(table.resolveConstant("LIMIT")).isPresent();
        assertThat(table.isKnownAsset("btn")).isTrue();
    }
}
