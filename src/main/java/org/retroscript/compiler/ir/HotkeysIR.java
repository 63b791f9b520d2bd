package org.retroscript.compiler.ir;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hotkey bindings. {@code start}, {@code stop} and {@code pause} always exist; a script may
 * declare further bindings.
 */
public class HotkeysIR {

    public static final String START = "start";
    public static final String STOP = "stop";
    public static final String PAUSE = "pause";

    private final Map<String, String> bindings = new LinkedHashMap<>();

    public HotkeysIR() {
        this("F5", "F6", "F7");
    }

    public HotkeysIR(String start, String stop, String pause) {
        bindings.put(START, start);
        bindings.put(STOP, stop);
        bindings.put(PAUSE, pause);
    }

    public String getStart() {
        return bindings.get(START);
    }

    public String getStop() {
        return bindings.get(STOP);
    }

    public String getPause() {
        return bindings.get(PAUSE);
    }

    public void setBinding(String name, String key) {
        bindings.put(name, key);
    }

    public Map<String, String> getBindings() {
        return bindings;
    }

    public HotkeysIR deepCopy() {
        HotkeysIR copy = new HotkeysIR();
        copy.bindings.putAll(bindings);
        return copy;
    }
}
