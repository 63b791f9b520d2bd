package org.retroscript.document;

import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.FlowIR;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Routes editor and GUI edits into a {@link ScriptDocument}.
 * <p>
 * Code edits are debounced: {@link #onCodeChanged(String)} only records the text, and the
 * owner's event loop calls {@link #poll()} which syncs once the quiet period has passed.
 * GUI edits are applied immediately. A sync lock makes edits arriving while a sync is running
 * no-ops.
 */
public class DocumentSyncManager {

    private static final Logger log = LoggerFactory.getLogger(DocumentSyncManager.class);

    private final ScriptDocument document;
    private final Duration debounce;
    private final Clock clock;

    private String pendingCode;
    private Instant deadline;
    private boolean syncLock;

    public DocumentSyncManager(ScriptDocument document) {
        this(document, document.getOptions().debounce(), Clock.systemUTC());
    }

    public DocumentSyncManager(ScriptDocument document, Duration debounce, Clock clock) {
        this.document = Objects.requireNonNull(document, "document");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScriptDocument getDocument() {
        return document;
    }

    /**
     * Records edited text; restarts the quiet period.
     */
    public void onCodeChanged(String code) {
        if (syncLock) {
            return;
        }
        pendingCode = Objects.requireNonNull(code, "code");
        deadline = clock.instant().plus(debounce);
    }

    /**
     * Syncs the pending text if its quiet period has elapsed.
     *
     * @return true if a sync ran
     */
    public boolean poll() {
        if (pendingCode == null || syncLock || clock.instant().isBefore(deadline)) {
            return false;
        }
        String code = pendingCode;
        cancelPending();
        sync(code);
        return true;
    }

    /**
     * Syncs immediately, discarding any pending edit. Used on explicit save.
     */
    public void flushNow(String code) {
        if (syncLock) {
            log.warn("Sync already in progress, skipping immediate sync");
            return;
        }
        cancelPending();
        log.debug("Immediate sync of {} characters", code.length());
        sync(code);
    }

    public void cancelPending() {
        pendingCode = null;
        deadline = null;
    }

    public boolean hasPending() {
        return pendingCode != null;
    }

    public boolean onActionChanged(String flowName, int index, ActionIR action) {
        return locked(() -> document.replaceAction(flowName, index, action));
    }

    public boolean onActionAdded(String flowName, ActionIR action, int index) {
        return locked(() -> document.addActionToFlow(flowName, action, index));
    }

    public boolean onActionRemoved(String flowName, int index) {
        return locked(() -> document.removeAction(flowName, index));
    }

    public boolean onActionsReordered(String flowName, int from, int to) {
        return locked(() -> document.moveAction(flowName, from, to));
    }

    public List<String> getFlowNames() {
        return document.getIr().getFlows().stream().map(FlowIR::getName).toList();
    }

    private void sync(String code) {
        syncLock = true;
        try {
            document.updateFromCode(code, "editor");
        } finally {
            syncLock = false;
        }
    }

    private boolean locked(Supplier<Boolean> edit) {
        if (syncLock) {
            return false;
        }
        syncLock = true;
        try {
            return edit.get();
        } finally {
            syncLock = false;
        }
    }
}
