package org.retroscript.document;

/**
 * Sync state of a {@link ScriptDocument}.
 */
public enum DocumentState {
    /** The text parsed cleanly and the IR reflects it. */
    VALID,
    /** The text has parse errors; the IR is the last good one. */
    ERROR,
    /** The text looks like it is still being typed and was not parsed. */
    PARTIAL
}
