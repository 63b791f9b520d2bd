package org.retroscript.compiler.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One entry of a flow's action list. A call statement becomes an action named after the
 * callee with positional arguments {@code arg0, arg1, ...} and keyword arguments by name.
 * Simple statements become tagged actions described by their parameters. Compound statements
 * ({@code if}, loops, {@code try}, nested blocks) carry their canonical source in
 * {@link #getVerbatim()}; their nested statements are not part of the action list.
 */
public class ActionIR {

    public static final String LABEL = "label";
    public static final String GOTO = "goto";
    public static final String BREAK = "break";
    public static final String CONTINUE = "continue";
    public static final String RETURN = "return";
    public static final String IF = "if";
    public static final String WHILE = "while";
    public static final String FOR = "for";
    public static final String TRY = "try";
    public static final String LET = "let";
    public static final String ASSIGN = "assign";
    public static final String EXPR = "expr";
    public static final String BLOCK = "block";
    public static final String CONST = "const";

    /**
     * Tags that {@link IrCodeGenerator} renders as statements rather than calls. A call whose
     * callee has one of these names cannot be stored as a call action.
     */
    public static final Set<String> STATEMENT_TAGS = Set.of(
            LABEL, GOTO, BREAK, CONTINUE, RETURN, LET, ASSIGN, EXPR);

    private String actionType;
    private final Map<String, Object> params = new LinkedHashMap<>();
    private int sourceLine;
    private String verbatim;
    private final List<String> leadingComments = new ArrayList<>();
    private String trailingComment;

    public ActionIR(String actionType) {
        this(actionType, Map.of(), 0);
    }

    public ActionIR(String actionType, Map<String, Object> params, int sourceLine) {
        this.actionType = Objects.requireNonNull(actionType, "actionType");
        this.params.putAll(params);
        this.sourceLine = sourceLine;
    }

    /**
     * @return the positional argument key for index {@code i}.
     */
    public static String positional(int i) {
        return "arg" + i;
    }

    public static boolean isStatementTag(String actionType) {
        return STATEMENT_TAGS.contains(actionType);
    }

    public static boolean isPositional(String key) {
        return key.length() > 3 && key.startsWith("arg") && key.substring(3).chars().allMatch(Character::isDigit);
    }

    public String getActionType() {
        return actionType;
    }

    public void setActionType(String actionType) {
        this.actionType = Objects.requireNonNull(actionType, "actionType");
    }

    /**
     * @return the live, ordered parameter map.
     */
    public Map<String, Object> getParams() {
        return params;
    }

    public Object getParam(String key) {
        return params.get(key);
    }

    public void setParam(String key, Object value) {
        params.put(key, value);
    }

    public int getSourceLine() {
        return sourceLine;
    }

    public void setSourceLine(int sourceLine) {
        this.sourceLine = sourceLine;
    }

    public String getVerbatim() {
        return verbatim;
    }

    public void setVerbatim(String verbatim) {
        this.verbatim = verbatim;
    }

    public boolean hasVerbatim() {
        return verbatim != null;
    }

    public List<String> getLeadingComments() {
        return leadingComments;
    }

    public String getTrailingComment() {
        return trailingComment;
    }

    public void setTrailingComment(String trailingComment) {
        this.trailingComment = trailingComment;
    }

    public ActionIR deepCopy() {
        ActionIR copy = new ActionIR(actionType, Map.of(), sourceLine);
        params.forEach((key, value) -> copy.params.put(key, value));
        copy.verbatim = verbatim;
        copy.leadingComments.addAll(leadingComments);
        copy.trailingComment = trailingComment;
        return copy;
    }

    @Override
    public String toString() {
        return actionType + params;
    }
}
