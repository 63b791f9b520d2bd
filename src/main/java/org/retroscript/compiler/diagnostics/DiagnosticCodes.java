package org.retroscript.compiler.diagnostics;

/**
 * Stable diagnostic codes. E100x are lexical and syntactic, E110x are semantic.
 * Codes are never renumbered.
 */
public final class DiagnosticCodes {

    public static final String UNEXPECTED_TOKEN = "E1001";
    public static final String EXPECTED_TOKEN = "E1002";
    public static final String UNTERMINATED_STRING = "E1003";
    public static final String UNTERMINATED_COMMENT = "E1004";
    public static final String INVALID_NUMBER = "E1005";
    public static final String EXPECTED_EXPRESSION = "E1006";
    public static final String EXPECTED_STATEMENT = "E1007";
    public static final String EXPECTED_BLOCK = "E1008";
    public static final String INVALID_ASSIGNMENT = "E1009";

    public static final String UNKNOWN_ASSET = "E1101";
    public static final String UNKNOWN_FLOW = "E1102";
    public static final String UNKNOWN_LABEL = "E1103";
    public static final String DUPLICATE_LABEL = "E1104";
    public static final String DUPLICATE_FLOW = "E1105";
    /** Reserved. Unknown identifiers are tolerated. */
    public static final String UNKNOWN_VARIABLE = "E1106";
    public static final String TYPE_MISMATCH = "E1107";
    public static final String INVALID_ARGUMENT = "E1108";
    public static final String MISSING_ARGUMENT = "E1109";
    public static final String DUPLICATE_CONSTANT = "E1110";

    private DiagnosticCodes() {
    }
}
