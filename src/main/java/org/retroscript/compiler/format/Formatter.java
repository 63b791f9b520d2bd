package org.retroscript.compiler.format;

import org.retroscript.compiler.frontend.parser.ParseResult;
import org.retroscript.compiler.frontend.parser.Parser;
import org.retroscript.compiler.frontend.parser.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical pretty printer for RetroScript.
 * <ul>
 *   <li>2-space indentation, opening braces on the statement line</li>
 *   <li>strings in double quotes, keyword arguments sorted by name</li>
 *   <li>layout order: hotkeys, constants, flows, interrupts; one blank line between them</li>
 *   <li>leading comments on their own lines, trailing comments after two spaces</li>
 * </ul>
 * Output always ends with exactly one newline. Formatting a formatted program yields the same text.
 * <p>
 * Every visit method returns the rendering of its node: statements and declarations as complete
 * lines at the current indentation, expressions inline.
 */
public class Formatter implements AstVisitor<String> {

    private static final Logger log = LoggerFactory.getLogger(Formatter.class);

    private static final String INDENT = "  ";
    private static final Map<String, String> BLOCK_END_KEYWORDS = Map.of(
            "end_if", "endif",
            "end_loop", "endloop",
            "end_while", "endwhile");

    private int indent = 0;

    /**
     * Formats source text. Returns the input unchanged if it does not parse cleanly.
     *
     * @param source the script text
     * @return the canonical text, or {@code source} itself on any parse diagnostic
     */
    public static String formatCode(String source) {
        if (source == null) {
            return null;
        }
        ParseResult result = new Parser(source).parse();
        if (!result.isClean()) {
            log.debug("Not formatting: {} parse diagnostics", result.diagnostics().size());
            return source;
        }
        return new Formatter().format(result.program());
    }

    /**
     * Formats a parsed program.
     */
    public String format(Program program) {
        indent = 0;
        return program.accept(this);
    }

    /**
     * Formats a single statement or expression at indentation level zero, including the
     * statement's own comments, without a final newline.
     */
    public String formatNode(AstNode node) {
        indent = 0;
        String text = node.accept(this);
        return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    }

    // ---------------------------------------------------------------------------------------------
    // Declarations

    @Override
    public String visitProgram(Program node) {
        List<String> sections = new ArrayList<>();
        if (node.hotkeys() != null) {
            sections.add(node.hotkeys().accept(this));
        }
        if (!node.constants().isEmpty()) {
            StringBuilder constants = new StringBuilder();
            node.constants().forEach(c -> constants.append(c.accept(this)));
            sections.add(constants.toString());
        }
        node.flows().forEach(flow -> sections.add(flow.accept(this)));
        node.interrupts().forEach(interrupt -> sections.add(interrupt.accept(this)));
        if (!node.meta().leadingComments().isEmpty()) {
            // comments after the last declaration
            sections.add(comments(node.meta()));
        }
        return String.join("\n", sections).stripTrailing() + "\n";
    }

    @Override
    public String visitHotkeys(HotkeysDecl node) {
        StringBuilder sb = new StringBuilder(comments(node.meta()));
        sb.append(line("hotkeys {"));
        indent++;
        new TreeMap<>(node.bindings()).forEach((key, value) -> sb.append(line(key + " = " + quote(value))));
        indent--;
        sb.append(trailing(line("}"), node.meta()));
        return sb.toString();
    }

    @Override
    public String visitFlow(FlowDecl node) {
        return comments(node.meta()) + trailing(line("flow " + node.name() + " " + block(node.body())), node.meta());
    }

    @Override
    public String visitInterrupt(InterruptDecl node) {
        StringBuilder sb = new StringBuilder(comments(node.meta()));
        sb.append(line("interrupt {"));
        indent++;
        sb.append(line("priority " + node.priority()));
        if (node.whenAsset() != null && !node.whenAsset().isEmpty()) {
            sb.append(line("when image " + quote(node.whenAsset()) + " " + block(node.body())));
        } else {
            sb.append(line(block(node.body())));
        }
        indent--;
        sb.append(trailing(line("}"), node.meta()));
        return sb.toString();
    }

    @Override
    public String visitConst(ConstStmt node) {
        return statement(node.meta(), "const " + node.name() + " = " + node.value().accept(this) + ";");
    }

    // ---------------------------------------------------------------------------------------------
    // Statements

    @Override
    public String visitBlock(BlockStmt node) {
        return statement(node.meta(), block(node));
    }

    @Override
    public String visitIf(IfStmt node) {
        StringBuilder sb = new StringBuilder("if ").append(node.condition().accept(this))
                .append(' ').append(block(node.thenBlock()));
        for (IfStmt.ElifBranch elif : node.elifs()) {
            sb.append(" elif ").append(elif.condition().accept(this)).append(' ').append(block(elif.block()));
        }
        if (node.elseBlock() != null) {
            sb.append(" else ").append(block(node.elseBlock()));
        }
        return statement(node.meta(), sb.toString());
    }

    @Override
    public String visitWhile(WhileStmt node) {
        return statement(node.meta(), "while " + node.condition().accept(this) + " " + block(node.body()));
    }

    @Override
    public String visitFor(ForStmt node) {
        return statement(node.meta(),
                "for " + node.variable() + " in " + node.iterable().accept(this) + " " + block(node.body()));
    }

    @Override
    public String visitLabel(LabelStmt node) {
        return statement(node.meta(), "label " + node.name() + ":");
    }

    @Override
    public String visitGoto(GotoStmt node) {
        return statement(node.meta(), "goto " + node.label() + ";");
    }

    @Override
    public String visitLet(LetStmt node) {
        String init = node.value() == null ? "" : " = " + node.value().accept(this);
        return statement(node.meta(), "let " + node.name() + init + ";");
    }

    @Override
    public String visitAssign(AssignStmt node) {
        return statement(node.meta(), node.target() + " = " + node.value().accept(this) + ";");
    }

    @Override
    public String visitBreak(BreakStmt node) {
        return statement(node.meta(), "break;");
    }

    @Override
    public String visitContinue(ContinueStmt node) {
        return statement(node.meta(), "continue;");
    }

    @Override
    public String visitReturn(ReturnStmt node) {
        return statement(node.meta(), node.value() == null ? "return;" : "return " + node.value().accept(this) + ";");
    }

    @Override
    public String visitTry(TryStmt node) {
        StringBuilder sb = new StringBuilder();
        if (node.isRetry()) {
            sb.append("retry ").append(node.retryCount()).append(' ').append(block(node.tryBlock()));
            CatchClause fallback = node.catchClause();
            if (fallback != null && !fallback.body().statements().isEmpty()) {
                sb.append(" else ").append(block(fallback.body()));
            }
        } else {
            sb.append("try ").append(block(node.tryBlock()));
            if (node.catchClause() != null) {
                sb.append(node.catchClause().accept(this));
            }
        }
        return statement(node.meta(), sb.toString());
    }

    @Override
    public String visitCatch(CatchClause node) {
        String variable = node.variable() == null ? "" : " " + node.variable();
        return " catch" + variable + " " + block(node.body());
    }

    @Override
    public String visitExprStmt(ExprStmt node) {
        return statement(node.meta(), node.expression().accept(this) + ";");
    }

    // ---------------------------------------------------------------------------------------------
    // Expressions

    @Override
    public String visitLiteral(Literal node) {
        return switch (node.kind()) {
            case STRING -> quote((String) node.value());
            case INTEGER -> String.valueOf(node.value());
            case FLOAT -> formatFloat((Double) node.value());
            case DURATION -> node.text();
            case BOOLEAN -> Boolean.TRUE.equals(node.value()) ? "true" : "false";
            case NULL -> "null";
        };
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitBinary(BinaryExpr node) {
        return operand(node.left()) + " " + node.operator() + " " + operand(node.right());
    }

    @Override
    public String visitUnary(UnaryExpr node) {
        return node.operator() + operand(node.operand());
    }

    @Override
    public String visitCall(CallExpr node) {
        String name = node.calleeName();
        if (name != null && BLOCK_END_KEYWORDS.containsKey(name)) {
            return BLOCK_END_KEYWORDS.get(name);
        }
        List<String> parts = new ArrayList<>();
        node.args().forEach(arg -> parts.add(arg.accept(this)));
        new TreeMap<>(node.kwargs()).forEach((key, value) -> parts.add(key + "=" + value.accept(this)));
        return node.callee().accept(this) + "(" + String.join(", ", parts) + ")";
    }

    @Override
    public String visitArray(ArrayExpr node) {
        List<String> parts = new ArrayList<>();
        node.elements().forEach(element -> parts.add(element.accept(this)));
        return "[" + String.join(", ", parts) + "]";
    }

    // ---------------------------------------------------------------------------------------------
    // Helpers

    /**
     * Renders a block starting with its opening brace and ending with its closing brace,
     * without trailing newline. The closing brace is indented at the current level.
     */
    private String block(BlockStmt block) {
        StringBuilder sb = new StringBuilder("{\n");
        indent++;
        for (Statement statement : block.statements()) {
            sb.append(statement.accept(this));
        }
        indent--;
        sb.append(INDENT.repeat(indent)).append('}');
        return sb.toString();
    }

    private String statement(NodeMeta meta, String text) {
        return comments(meta) + trailing(line(text), meta);
    }

    private String comments(NodeMeta meta) {
        StringBuilder sb = new StringBuilder();
        for (String comment : meta.leadingComments()) {
            sb.append(line(comment));
        }
        return sb.toString();
    }

    private static String trailing(String rendered, NodeMeta meta) {
        if (meta.trailingComment() == null) {
            return rendered;
        }
        return rendered.substring(0, rendered.length() - 1) + "  " + meta.trailingComment() + "\n";
    }

    private String line(String text) {
        return INDENT.repeat(indent) + text + "\n";
    }

    private String operand(Expression expr) {
        String text = expr.accept(this);
        return expr instanceof BinaryExpr ? "(" + text + ")" : text;
    }

    /**
     * Renders a string as a double-quoted RetroScript literal.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    public static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0.0";
        }
        String text = BigDecimal.valueOf(value).toPlainString();
        return text.contains(".") ? text : text + ".0";
    }
}
