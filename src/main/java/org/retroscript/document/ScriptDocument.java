package org.retroscript.document;

import org.retroscript.compiler.diagnostics.Diagnostic;
import org.retroscript.compiler.frontend.parser.ParseResult;
import org.retroscript.compiler.frontend.parser.Parser;
import org.retroscript.compiler.frontend.semantics.SemanticAnalyzer;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.AssetIR;
import org.retroscript.compiler.ir.FlowIR;
import org.retroscript.compiler.ir.HotkeysIR;
import org.retroscript.compiler.ir.IrMapper;
import org.retroscript.compiler.ir.ScriptIR;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns one script's text and IR and keeps them in sync.
 * <p>
 * Code edits arrive through {@link #updateFromCode(String, String)} and drive the state machine
 * {@link DocumentState#VALID} / {@link DocumentState#ERROR} / {@link DocumentState#PARTIAL}.
 * On a parse failure the last good IR is kept and marked invalid. GUI edits arrive through
 * {@link #updateFromGui(IrLocation, Object)} and the structural operations; they change the IR
 * and regenerate canonical text. While the text is regenerated, code updates are ignored so a
 * listener echoing the new text back does not loop.
 * <p>
 * Not thread-safe. Drive it from one thread and hand {@link #snapshot()} copies to others.
 */
public class ScriptDocument {

    private static final Logger log = LoggerFactory.getLogger(ScriptDocument.class);

    private final DocumentOptions options;
    private final IrMapper mapper;
    private final PartialInputDetector partialInputDetector = new PartialInputDetector();
    private final RecoveryHints recoveryHints = new RecoveryHints();
    private final List<DocumentListener> listeners = new ArrayList<>();

    private ScriptIR ir = new ScriptIR();
    private String code = "";
    private DocumentState state = DocumentState.VALID;
    private List<Diagnostic> diagnostics = List.of();
    private boolean syncEnabled = true;
    private boolean dirty;

    public ScriptDocument() {
        this(DocumentOptions.defaults());
    }

    public ScriptDocument(DocumentOptions options) {
        this(options, new IrMapper());
    }

    public ScriptDocument(DocumentOptions options, IrMapper mapper) {
        this.options = Objects.requireNonNull(options, "options");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void addListener(DocumentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(DocumentListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------------------------------------
    // Code -> IR

    /**
     * Applies edited text.
     *
     * @param text      the full new text
     * @param sourceTag origin of the edit, reported to listeners as {@code code_<sourceTag>}
     */
    public void updateFromCode(String text, String sourceTag) {
        if (!syncEnabled) {
            log.debug("Ignoring code update from '{}' during regeneration", sourceTag);
            return;
        }
        Objects.requireNonNull(text, "text");
        String previous = code;
        code = text;
        dirty = true;

        if (options.partialInputDetection() && partialInputDetector.isPartial(text, previous)) {
            transition(DocumentState.PARTIAL);
            return;
        }

        ParseResult result = new Parser(text).parse();
        if (!result.diagnostics().isEmpty()) {
            ir.setValid(false);
            ir.getParseErrors().clear();
            result.diagnostics().forEach(d -> ir.getParseErrors().add(d.toString()));
            diagnostics = recoveryHints.attach(result.diagnostics(), text);
            log.debug("Code update from '{}' has {} parse errors, keeping last good IR", sourceTag, diagnostics.size());
            transition(DocumentState.ERROR);
            listeners.forEach(l -> l.onErrors(diagnostics));
            return;
        }

        ScriptIR next = mapper.astToIr(result.program());
        carryOverExternalState(ir, next);
        diagnostics = SemanticAnalyzer.analyze(result.program(), next.getAssetIds());
        ir = next;
        transition(DocumentState.VALID);
        notifyIrChanged("code_" + sourceTag);
    }

    /**
     * Assets and script metadata are not part of the text and survive a reparse.
     */
    private static void carryOverExternalState(ScriptIR previous, ScriptIR next) {
        next.setName(previous.getName());
        next.setVersion(previous.getVersion());
        next.setAuthor(previous.getAuthor());
        previous.getAssets().forEach(asset -> next.getAssets().add(asset.deepCopy()));
    }

    // ---------------------------------------------------------------------------------------------
    // GUI -> IR -> Code

    /**
     * Applies a GUI edit to the IR and regenerates the text.
     *
     * @return false if the edit was refused because the text is not in a valid state
     */
    public boolean updateFromGui(IrLocation location, Object value) {
        Objects.requireNonNull(location, "location");
        if (state != DocumentState.VALID) {
            log.warn("Refusing GUI edit of {} while document is {}", location, state);
            return false;
        }
        location.apply(ir, value);
        dirty = true;
        regenerateCode("gui");
        notifyIrChanged("gui");
        return true;
    }

    /**
     * Replaces the document with a fresh script holding one empty flow.
     */
    public void newDocument() {
        ir = new ScriptIR();
        ir.setHotkeys(new HotkeysIR(options.startKey(), options.stopKey(), options.pauseKey()));
        ir.getFlows().add(new FlowIR(options.defaultFlowName()));
        diagnostics = List.of();
        regenerateCode("new");
        dirty = false;
        transition(DocumentState.VALID);
        notifyIrChanged("new");
    }

    public FlowIR addFlow(String name) {
        requireEditable();
        if (ir.getFlow(name).isPresent()) {
            throw new IllegalArgumentException("Flow already exists: " + name);
        }
        FlowIR flow = new FlowIR(name);
        ir.getFlows().add(flow);
        structureChanged("flow_added");
        return flow;
    }

    public boolean removeFlow(String name) {
        requireEditable();
        boolean removed = ir.getFlows().removeIf(f -> f.getName().equals(name));
        if (removed) {
            structureChanged("flow_removed");
        }
        return removed;
    }

    public boolean addActionToFlow(String flowName, ActionIR action) {
        return addActionToFlow(flowName, action, -1);
    }

    /**
     * Inserts an action into a flow.
     *
     * @param index position to insert at; negative or past the end appends
     * @return false if the flow does not exist
     */
    public boolean addActionToFlow(String flowName, ActionIR action, int index) {
        requireEditable();
        Objects.requireNonNull(action, "action");
        FlowIR flow = ir.getFlow(flowName).orElse(null);
        if (flow == null) {
            return false;
        }
        if (index < 0 || index >= flow.getActions().size()) {
            flow.getActions().add(action);
        } else {
            flow.getActions().add(index, action);
        }
        structureChanged("action_added");
        return true;
    }

    public boolean replaceAction(String flowName, int index, ActionIR action) {
        requireEditable();
        Objects.requireNonNull(action, "action");
        FlowIR flow = ir.getFlow(flowName).orElse(null);
        if (flow == null) {
            return false;
        }
        flow.getActions().set(index, action);
        structureChanged("action_changed");
        return true;
    }

    public boolean removeAction(String flowName, int index) {
        requireEditable();
        FlowIR flow = ir.getFlow(flowName).orElse(null);
        if (flow == null) {
            return false;
        }
        flow.getActions().remove(index);
        structureChanged("action_removed");
        return true;
    }

    public boolean moveAction(String flowName, int from, int to) {
        requireEditable();
        FlowIR flow = ir.getFlow(flowName).orElse(null);
        if (flow == null) {
            return false;
        }
        if (to < 0 || to >= flow.getActions().size()) {
            throw new IndexOutOfBoundsException("Target index " + to + " out of range");
        }
        ActionIR action = flow.getActions().remove(from);
        flow.getActions().add(to, action);
        structureChanged("action_moved");
        return true;
    }

    /**
     * Adds or replaces an asset. Assets are not part of the text, so no code is regenerated.
     */
    public void addAsset(AssetIR asset) {
        ir.addAsset(Objects.requireNonNull(asset, "asset"));
        dirty = true;
        notifyIrChanged("asset_added");
    }

    public boolean removeAsset(String assetId) {
        boolean removed = ir.removeAsset(assetId);
        if (removed) {
            dirty = true;
            notifyIrChanged("asset_removed");
        }
        return removed;
    }

    // ---------------------------------------------------------------------------------------------
    // Queries

    /**
     * Parses the current text and runs semantic analysis against the document's assets.
     *
     * @return parse diagnostics, or semantic diagnostics when the text parses
     */
    public List<Diagnostic> validate() {
        ParseResult result = new Parser(code).parse();
        if (!result.diagnostics().isEmpty()) {
            return recoveryHints.attach(result.diagnostics(), code);
        }
        return SemanticAnalyzer.analyze(result.program(), ir.getAssetIds());
    }

    /**
     * @return an independent copy of the current IR
     */
    public ScriptIR snapshot() {
        return ir.deepCopy();
    }

    /**
     * @return the live IR. Mutating it directly bypasses code regeneration.
     */
    public ScriptIR getIr() {
        return ir;
    }

    public String getCode() {
        return code;
    }

    public DocumentState getState() {
        return state;
    }

    /**
     * @return parse diagnostics in the ERROR state, semantic diagnostics otherwise
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean isValid() {
        return ir.isValid();
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markSaved() {
        dirty = false;
    }

    public DocumentOptions getOptions() {
        return options;
    }

    // ---------------------------------------------------------------------------------------------
    // Internals

    private void requireEditable() {
        if (state != DocumentState.VALID) {
            throw new IllegalStateException("Document cannot be edited while " + state);
        }
    }

    private void structureChanged(String changeType) {
        dirty = true;
        regenerateCode("gui");
        notifyIrChanged(changeType);
    }

    private void regenerateCode(String source) {
        if (!ir.isValid()) {
            return;
        }
        syncEnabled = false;
        try {
            code = mapper.irToCode(ir);
            listeners.forEach(l -> l.onCodeChanged(source));
        } finally {
            syncEnabled = true;
        }
    }

    private void transition(DocumentState next) {
        if (next == state) {
            return;
        }
        DocumentState previous = state;
        state = next;
        log.debug("Document state {} -> {}", previous, next);
        listeners.forEach(l -> l.onStateChanged(previous, next));
    }

    private void notifyIrChanged(String changeType) {
        listeners.forEach(l -> l.onIrChanged(changeType));
    }
}
