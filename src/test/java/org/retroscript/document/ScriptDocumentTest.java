package org.retroscript.document;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.diagnostics.DiagnosticCodes;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.AssetIR;
import org.retroscript.compiler.ir.ScriptIR;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the code/IR synchronization of {@link ScriptDocument}.
 */
@Tag("unit")
class ScriptDocumentTest {

    private static final String VALID = "flow main {\n  click(100, 200);\n}\n";

    private ScriptDocument document;
    private DocumentListener listener;

    @BeforeEach
    void setUp() {
        document = new ScriptDocument(new DocumentOptions(false, Duration.ofMillis(500), "main", "F5", "F6", "F7"));
        listener = mock(DocumentListener.class);
        document.addListener(listener);
    }

    @Test
    void validCodeProducesIr() {
        document.updateFromCode(VALID, "editor");

        assertThat(document.getState()).isEqualTo(DocumentState.VALID);
        assertThat(document.isValid()).isTrue();
        assertThat(document.getIr().getFlow("main")).isPresent();
        assertThat(document.getCode()).isEqualTo(VALID);
        assertThat(document.isDirty()).isTrue();
        verify(listener).onIrChanged("code_editor");
    }

    @Test
    @DisplayName("A parse error keeps the last good IR and marks it invalid")
    void parseErrorKeepsLastGoodIr() {
        document.updateFromCode(VALID, "editor");

        document.updateFromCode("flow main {\n  click(100, 200)\n  click(1, 2);\n}\n", "editor");

        assertThat(document.getState()).isEqualTo(DocumentState.ERROR);
        assertThat(document.isValid()).isFalse();
        assertThat(document.getIr().getFlow("main").orElseThrow().getActions()).hasSize(1);
        assertThat(document.getIr().getParseErrors()).isNotEmpty();
        assertThat(document.getDiagnostics()).isNotEmpty();
        assertThat(document.getDiagnostics().get(0).quickFixes())
                .extracting(fix -> fix.replacement()).contains(";");
        verify(listener).onStateChanged(DocumentState.VALID, DocumentState.ERROR);
        verify(listener).onErrors(anyList());
    }

    @Test
    void fixingTheErrorReturnsToValid() {
        document.updateFromCode("flow main { click(1 }", "editor");

        document.updateFromCode(VALID, "editor");

        InOrder order = inOrder(listener);
        order.verify(listener).onStateChanged(DocumentState.VALID, DocumentState.ERROR);
        order.verify(listener).onStateChanged(DocumentState.ERROR, DocumentState.VALID);
        assertThat(document.isValid()).isTrue();
        assertThat(document.getIr().getParseErrors()).isEmpty();
    }

    @Test
    void incompleteInputIsPartialWhenDetectionIsEnabled() {
        ScriptDocument detecting = new ScriptDocument();
        detecting.addListener(listener);
        detecting.updateFromCode(VALID, "editor");

        detecting.updateFromCode("flow main {\n  click(", "editor");

        assertThat(detecting.getState()).isEqualTo(DocumentState.PARTIAL);
        assertThat(detecting.isValid()).isTrue();
        verify(listener).onStateChanged(DocumentState.VALID, DocumentState.PARTIAL);
        verify(listener, never()).onErrors(anyList());
    }

    @Test
    void semanticDiagnosticsUseDocumentAssets() {
        document.addAsset(new AssetIR("login", "assets/login.png"));

        document.updateFromCode("flow main { wait_image(\"login\"); wait_image(\"other\"); }", "editor");

        assertThat(document.getState()).isEqualTo(DocumentState.VALID);
        assertThat(document.getDiagnostics()).extracting(Diagnostic::code)
                .containsExactly(DiagnosticCodes.UNKNOWN_ASSET);
        assertThat(document.validate()).hasSize(1);
    }

    @Test
    void assetsAndMetadataSurviveReparse() {
        document.updateFromCode(VALID, "editor");
        document.addAsset(new AssetIR("btn", "btn.png"));
        document.updateFromGui(new IrLocation.ScriptName(), "Farm bot");

        document.updateFromCode("flow other { click(1, 2); }", "editor");

        assertThat(document.getIr().getAssetIds()).containsExactly("btn");
        assertThat(document.getIr().getName()).isEqualTo("Farm bot");
        assertThat(document.getIr().getFlow("other")).isPresent();
    }

    @Test
    void guiEditRegeneratesCode() {
        document.updateFromCode(VALID, "editor");

        boolean applied = document.updateFromGui(new IrLocation.ActionParam(0, 0, "arg0"), 5L);

        assertThat(applied).isTrue();
        assertThat(document.getCode()).isEqualTo("flow main {\n  click(5, 200);\n}\n");
        verify(listener).onCodeChanged("gui");
        verify(listener).onIrChanged("gui");
    }

    @Test
    void guiEditIsRefusedInErrorState() {
        document.updateFromCode(VALID, "editor");
        document.updateFromCode("flow main { click(1 }", "editor");

        boolean applied = document.updateFromGui(new IrLocation.ActionParam(0, 0, "arg0"), 5L);

        assertThat(applied).isFalse();
        assertThat(document.getCode()).isEqualTo("flow main { click(1 }");
        assertThat(document.getIr().getFlows().get(0).getActions().get(0).getParam("arg0")).isEqualTo(100L);
        verify(listener, never()).onCodeChanged(anyString());
    }

    @Test
    void structuralEditsRequireValidState() {
        document.updateFromCode("flow main { click(1 }", "editor");

        assertThatThrownBy(() -> document.addFlow("second")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Text echoed back by a listener during regeneration is ignored")
    void regenerationDoesNotLoop() {
        document.updateFromCode(VALID, "editor");
        doAnswer(invocation -> {
            document.updateFromCode("flow echoed { }", "editor");
            return null;
        }).when(listener).onCodeChanged(anyString());

        document.addFlow("second");

        assertThat(document.getIr().getFlow("echoed")).isEmpty();
        assertThat(document.getCode()).contains("flow second {");
    }

    @Test
    void flowAndActionOperations() {
        document.updateFromCode(VALID, "editor");

        document.addFlow("helper");
        ActionIR log = new ActionIR("log");
        log.setParam("arg0", "hi");
        document.addActionToFlow("helper", log);
        ActionIR sleep = new ActionIR("sleep");
        sleep.setParam("arg0", 1L);
        document.addActionToFlow("helper", sleep, 0);
        document.moveAction("helper", 0, 1);

        assertThat(document.getCode()).contains("flow helper {\n  log(\"hi\");\n  sleep(1);\n}");
        assertThat(document.addActionToFlow("missing", new ActionIR("break"))).isFalse();
        assertThatThrownBy(() -> document.addFlow("helper")).isInstanceOf(IllegalArgumentException.class);

        document.replaceAction("helper", 1, new ActionIR(ActionIR.BREAK));
        document.removeAction("helper", 0);
        assertThat(document.getCode()).contains("flow helper {\n  break;\n}");

        assertThat(document.removeFlow("helper")).isTrue();
        assertThat(document.getCode()).doesNotContain("helper");
        verify(listener).onIrChanged("flow_added");
        verify(listener).onIrChanged("action_moved");
        verify(listener).onIrChanged("flow_removed");
    }

    @Test
    void newDocumentHasDefaultFlowAndHotkeys() {
        document.newDocument();

        assertThat(document.getCode()).isEqualTo("""
                hotkeys {
                  pause = "F7"
                  start = "F5"
                  stop = "F6"
                }

                flow main {
                }
                """);
        assertThat(document.isDirty()).isFalse();
        verify(listener).onCodeChanged("new");
    }

    @Test
    void invalidGuiValueIsRejected() {
        document.updateFromCode(VALID, "editor");

        assertThatThrownBy(() -> document.updateFromGui(new IrLocation.FlowName(0), 42))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("GUI names that would not parse are rejected and leave the text intact")
    void nonIdentifierNamesAreRejected() {
        document.updateFromCode(VALID, "editor");

        assertThatThrownBy(() -> document.updateFromGui(new IrLocation.FlowName(0), "my flow"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> document.updateFromGui(new IrLocation.FlowName(0), "while"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> document.updateFromGui(new IrLocation.ActionType(0, 0), "expr"))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(document.getCode()).isEqualTo(VALID);
        assertThat(document.getState()).isEqualTo(DocumentState.VALID);
    }

    @Test
    void actionTypeCanBeRenamed() {
        document.updateFromCode(VALID, "editor");

        document.updateFromGui(new IrLocation.ActionType(0, 0), "move");

        assertThat(document.getCode()).isEqualTo("flow main {\n  move(100, 200);\n}\n");
    }

    @Test
    void snapshotIsIndependentOfDocument() {
        document.updateFromCode(VALID, "editor");

        ScriptIR snapshot = document.snapshot();
        document.updateFromGui(new IrLocation.FlowName(0), "renamed");

        assertThat(snapshot.getFlows().get(0).getName()).isEqualTo("main");
        assertThat(document.getIr().getFlows().get(0).getName()).isEqualTo("renamed");
    }

    @Test
    void markSavedClearsDirtyFlag() {
        document.updateFromCode(VALID, "editor");

        document.markSaved();

        assertThat(document.isDirty()).isFalse();
        verify(listener, never()).onErrors(any());
    }
}
