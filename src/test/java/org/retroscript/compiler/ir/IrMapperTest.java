package org.retroscript.compiler.ir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class IrMapperTest {

    private final IrMapper mapper = new IrMapper();

    private ScriptIR map(String source) {
        IrParseResult result = mapper.parseToIr(source);
        assertThat(result.hasErrors()).describedAs("parse errors: %s", result.errors()).isFalse();
        return result.ir();
    }

    private static List<ActionIR> actions(ScriptIR ir, String flow) {
        return ir.getFlow(flow).orElseThrow().getActions();
    }

    @Test
    void callBecomesActionWithPositionalAndKeywordParams() {
        ScriptIR ir = map("flow main { click(100, 200, interval=50ms, button=\"right\"); }");

        ActionIR click = actions(ir, "main").get(0);
        assertThat(click.getActionType()).isEqualTo("click");
        assertThat(click.getParams()).containsExactly(
                java.util.Map.entry("arg0", 100L),
                java.util.Map.entry("arg1", 200L),
                java.util.Map.entry("button", "right"),
                java.util.Map.entry("interval", new IrValue.Duration("50ms")));
        assertThat(click.hasVerbatim()).isFalse();
        assertThat(click.getSourceLine()).isEqualTo(1);
    }

    @Test
    void argumentValuesKeepTheirKind() {
        ScriptIR ir = map("const DELAY = 2s; flow main { wait_any([\"a\", \"b\"], timeout=DELAY); log(1 + 2); sleep(0.5); }");

        List<ActionIR> body = actions(ir, "main");
        assertThat(body.get(0).getParam("arg0")).isEqualTo(new IrValue.ListValue(List.of("a", "b")));
        assertThat(body.get(0).getParam("timeout")).isEqualTo(new IrValue.Reference("DELAY"));
        assertThat(body.get(1).getParam("arg0")).isEqualTo(new IrValue.RawExpression("1 + 2"));
        assertThat(body.get(2).getParam("arg0")).isEqualTo(0.5);
        assertThat(ir.getConstants()).containsExactly(new ConstantIR("DELAY", new IrValue.Duration("2s")));
    }

    @Test
    void simpleStatementsBecomeStructuredActions() {
        ScriptIR ir = map("""
                flow main {
                  label top:
                  let $n = 0;
                  $n = $n + 1;
                  goto top;
                  break;
                  continue;
                  return;
                }
                """);

        List<ActionIR> body = actions(ir, "main");
        assertThat(body).extracting(ActionIR::getActionType).containsExactly(
                ActionIR.LABEL, ActionIR.LET, ActionIR.ASSIGN, ActionIR.GOTO,
                ActionIR.BREAK, ActionIR.CONTINUE, ActionIR.RETURN);
        assertThat(body.get(0).getParam("name")).isEqualTo("top");
        assertThat(body.get(1).getParam("name")).isEqualTo("$n");
        assertThat(body.get(1).getParam("value")).isEqualTo(0L);
        assertThat(body.get(2).getParam("target")).isEqualTo("$n");
        assertThat(body.get(2).getParam("value")).isEqualTo(new IrValue.RawExpression("$n + 1"));
        assertThat(body.get(3).getParam("target")).isEqualTo("top");
        assertThat(body.get(6).getParams()).isEmpty();
        assertThat(body).noneMatch(ActionIR::hasVerbatim);
    }

    @Test
    @DisplayName("Compound statements are single markers carrying verbatim source")
    void compoundStatementsAreVerbatimMarkers() {
        ScriptIR ir = map("""
                flow main {
                  if ready { click(1, 2); } elif other { log("x"); } else { return; }
                  for i in range(3) { click(i, i); }
                  retry 2 { find_image("x"); }
                }
                """);

        List<ActionIR> body = actions(ir, "main");
        assertThat(body).hasSize(3);
        ActionIR branch = body.get(0);
        assertThat(branch.getActionType()).isEqualTo(ActionIR.IF);
        assertThat(branch.getParam("has_else")).isEqualTo(true);
        assertThat(branch.getParam("branches")).isEqualTo(2L);
        assertThat(branch.getVerbatim()).startsWith("if ready {").contains("click(1, 2);").endsWith("}");
        assertThat(body.get(1).getParam("variable")).isEqualTo("i");
        assertThat(body.get(2).getActionType()).isEqualTo(ActionIR.TRY);
        assertThat(body.get(2).getParam("retry_count")).isEqualTo(2L);
        assertThat(body.get(2).getVerbatim()).startsWith("retry 2 {");
    }

    @Test
    void hotkeysAndInterruptsAreMapped() {
        ScriptIR ir = map("""
                hotkeys { start = "F1" }
                flow main { click(1, 2); }
                interrupt { priority 3 when image "popup" { click(5, 5); } }
                """);

        assertThat(ir.getHotkeys().getStart()).isEqualTo("F1");
        assertThat(ir.getHotkeys().getStop()).isEqualTo("F6");
        InterruptIR interrupt = ir.getInterrupts().get(0);
        assertThat(interrupt.getPriority()).isEqualTo(3);
        assertThat(interrupt.getWhenAsset()).isEqualTo("popup");
        assertThat(interrupt.getActions()).extracting(ActionIR::getActionType).containsExactly("click");
    }

    @Test
    void missingHotkeysBlockLeavesHotkeysUnset() {
        assertThat(map("flow main { }").getHotkeys()).isNull();
    }

    @Test
    void commentsTravelWithActions() {
        ScriptIR ir = map("""
                flow main {
                  // go
                  click(1, 2);  // corner
                }
                """);

        ActionIR click = actions(ir, "main").get(0);
        assertThat(click.getLeadingComments()).containsExactly("// go");
        assertThat(click.getTrailingComment()).isEqualTo("// corner");
    }

    @Test
    @DisplayName("Calls named like statement tags are kept as expressions")
    void callsNamedLikeStatementTagsSurviveRoundTrip() {
        String source = "flow main {\n  expr(1);\n  assign(1, 2);\n  block(4);\n}\n";

        ScriptIR ir = map(source);
        String code = mapper.irToCode(ir);

        List<ActionIR> body = actions(ir, "main");
        assertThat(body).extracting(ActionIR::getActionType)
                .containsExactly(ActionIR.EXPR, ActionIR.EXPR, "block");
        assertThat(body.get(0).getParam("expression")).isEqualTo(new IrValue.RawExpression("expr(1)"));
        assertThat(body.get(1).getParam("expression")).isEqualTo(new IrValue.RawExpression("assign(1, 2)"));
        assertThat(code).isEqualTo(source);
        assertThat(actions(map(code), "main")).extracting(ActionIR::getParams)
                .isEqualTo(body.stream().map(ActionIR::getParams).toList());
    }

    @Test
    void parseErrorsYieldInvalidEmptyIr() {
        IrParseResult result = mapper.parseToIr("flow main { click(1 }");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.errors()).isNotEmpty();
        assertThat(result.ir().isValid()).isFalse();
        assertThat(result.ir().getFlows()).isEmpty();
        assertThat(result.ir().getParseErrors()).hasSameSizeAs(result.diagnostics());
    }

    @Test
    void generatedCodeIsCanonical() {
        ScriptIR ir = new ScriptIR();
        FlowIR flow = new FlowIR("main");
        ActionIR click = new ActionIR("click");
        click.setParam("arg1", 200L);
        click.setParam("arg0", 100L);
        flow.getActions().add(click);
        ir.getFlows().add(flow);

        assertThat(mapper.irToCode(ir)).isEqualTo("flow main {\n  click(100, 200);\n}\n");
    }

    @Test
    @DisplayName("Code regenerated from IR maps back to the same IR")
    void irSurvivesRoundTrip() {
        String source = """
                hotkeys { pause = "F9" }
                const LIMIT = 3;
                flow main {
                  // start
                  let $n = 0;
                  while $n < LIMIT { $n = $n + 1; }
                  click(1, 2, button="left");
                  label done:
                  if $n > 1 { goto done; }
                  type_text("a\\"b");
                }
                interrupt { priority 1 { log("tick"); } }
                """;
        ScriptIR first = map(source);

        ScriptIR second = map(mapper.irToCode(first));

        assertThat(second.getHotkeys().getBindings()).isEqualTo(first.getHotkeys().getBindings());
        assertThat(second.getConstants()).isEqualTo(first.getConstants());
        assertThat(actions(second, "main")).extracting(ActionIR::getActionType)
                .isEqualTo(actions(first, "main").stream().map(ActionIR::getActionType).toList());
        for (int i = 0; i < actions(first, "main").size(); i++) {
            assertThat(actions(second, "main").get(i).getParams()).isEqualTo(actions(first, "main").get(i).getParams());
            assertThat(actions(second, "main").get(i).getVerbatim()).isEqualTo(actions(first, "main").get(i).getVerbatim());
        }
        assertThat(second.getInterrupts().get(0).getWhenAsset()).isEmpty();
    }

    @Test
    void jsonNamesValueKinds() {
        ScriptIR ir = map("flow main { wait_image(\"btn\", timeout=5s); click(X, 2); }");

        String json = IrJson.toJson(ir);

        assertThat(json).contains("\"kind\": \"duration\"", "\"kind\": \"reference\"", "\"click\"", "\"btn\"");
    }

    @Test
    void deepCopyIsIndependent() {
        ScriptIR ir = map("flow main { click(1, 2); }");

        ScriptIR copy = ir.deepCopy();
        copy.getFlows().get(0).getActions().get(0).setParam("arg0", 9L);

        assertThat(actions(ir, "main").get(0).getParam("arg0")).isEqualTo(1L);
    }
}
