package org.retroscript.compiler.diagnostics;

import org.retroscript.compiler.diagnostics.Diagnostic.Severity;
import org.retroscript.compiler.model.Span;

import java.util.List;

import static org.retroscript.compiler.diagnostics.DiagnosticCodes.*;

/**
 * Factory methods for the diagnostics the front-end emits, so that messages stay consistent.
 */
public final class Diagnostics {

    private Diagnostics() {
    }

    public static Diagnostic unexpectedToken(String text, Span span) {
        return new Diagnostic(UNEXPECTED_TOKEN, Severity.ERROR, "Unexpected token '" + text + "'", span,
                "Check for typos or missing semicolons", null, List.of());
    }

    public static Diagnostic unexpectedCharacter(String text, Span span) {
        return new Diagnostic(UNEXPECTED_TOKEN, Severity.ERROR, "Unexpected character '" + text + "'", span);
    }

    public static Diagnostic expectedToken(String expected, String got, Span span) {
        return new Diagnostic(EXPECTED_TOKEN, Severity.ERROR, "Expected '" + expected + "', got '" + got + "'", span);
    }

    public static Diagnostic missingSemicolon(Span span) {
        return new Diagnostic(EXPECTED_TOKEN, Severity.ERROR, "Expected ';' after statement", span,
                "Add ';' at the end of the statement", null, List.of());
    }

    public static Diagnostic unterminatedString(Span span) {
        return new Diagnostic(UNTERMINATED_STRING, Severity.ERROR, "Unterminated string", span,
                "Close the string with a matching quote", null, List.of());
    }

    public static Diagnostic unterminatedComment(Span span) {
        return new Diagnostic(UNTERMINATED_COMMENT, Severity.ERROR, "Unterminated block comment", span,
                "Close the comment with '*/'", null, List.of());
    }

    public static Diagnostic invalidNumber(String text, Span span) {
        return new Diagnostic(INVALID_NUMBER, Severity.ERROR, "Invalid number '" + text + "'", span);
    }

    public static Diagnostic expectedExpression(String got, Span span) {
        return new Diagnostic(EXPECTED_EXPRESSION, Severity.ERROR, "Expected expression, got '" + got + "'", span);
    }

    public static Diagnostic expectedFunctionName(Span span) {
        return new Diagnostic(EXPECTED_EXPRESSION, Severity.ERROR, "Expected function name", span);
    }

    public static Diagnostic expectedDeclaration(String got, Span span) {
        return new Diagnostic(EXPECTED_STATEMENT, Severity.ERROR, "Expected declaration, got '" + got + "'", span,
                "Top level only allows flow, interrupt, hotkeys and const", null, List.of());
    }

    public static Diagnostic expectedBlock(String got, Span span) {
        return new Diagnostic(EXPECTED_BLOCK, Severity.ERROR, "Expected '{' to start block, got '" + got + "'", span);
    }

    public static Diagnostic invalidAssignmentTarget(Span span) {
        return new Diagnostic(INVALID_ASSIGNMENT, Severity.ERROR, "Invalid assignment target", span);
    }

    public static Diagnostic unknownAsset(String assetId, Span span) {
        return new Diagnostic(UNKNOWN_ASSET, Severity.ERROR, "Unknown asset \"" + assetId + "\"", span,
                "Asset \"" + assetId + "\" is not defined. Capture it first.", null,
                List.of(QuickFix.action("Capture new asset \"" + assetId + "\"", QuickFix.CAPTURE_ASSET)));
    }

    public static Diagnostic unknownFlow(String flowName, Span span) {
        return new Diagnostic(UNKNOWN_FLOW, Severity.ERROR, "Unknown flow '" + flowName + "'", span,
                "Define the flow or check the name spelling", null, List.of());
    }

    public static Diagnostic unknownLabel(String labelName, Span span) {
        return new Diagnostic(UNKNOWN_LABEL, Severity.ERROR, "Unknown label '" + labelName + "'", span,
                "Define the label in the same flow before using goto", null, List.of());
    }

    public static Diagnostic duplicateLabel(String labelName, Span span, Span original) {
        return new Diagnostic(DUPLICATE_LABEL, Severity.ERROR, "Duplicate label '" + labelName + "'", span,
                "Label was first defined at line " + original.startLine(), original, List.of());
    }

    public static Diagnostic duplicateFlow(String flowName, Span span, Span original) {
        return new Diagnostic(DUPLICATE_FLOW, Severity.ERROR, "Duplicate flow '" + flowName + "'", span,
                "Flow was first defined at line " + original.startLine(), original, List.of());
    }

    public static Diagnostic duplicateConstant(String name, Span span, Span original) {
        return new Diagnostic(DUPLICATE_CONSTANT, Severity.WARNING, "Duplicate constant '" + name + "'", span,
                "Constant was first defined at line " + original.startLine(), original, List.of());
    }

    public static Diagnostic typeMismatch(String function, String argument, String expected, String got, Span span) {
        return new Diagnostic(TYPE_MISMATCH, Severity.WARNING,
                "Type mismatch for '" + argument + "' of " + function + ": expected " + expected + ", got " + got,
                span);
    }

    public static Diagnostic invalidArgument(String function, String argument, String reason, Span span) {
        return new Diagnostic(INVALID_ARGUMENT, Severity.WARNING,
                "Invalid argument '" + argument + "' for " + function + ": " + reason, span);
    }

    public static Diagnostic missingArgument(String function, String argument, Span span) {
        return new Diagnostic(MISSING_ARGUMENT, Severity.ERROR,
                "Missing required argument '" + argument + "' for " + function, span);
    }
}
