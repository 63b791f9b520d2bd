package org.retroscript.compiler.ir;

import java.util.ArrayList;
import java.util.List;

public class InterruptIR {

    private int priority;
    private String whenAsset;
    private final List<ActionIR> actions = new ArrayList<>();

    public InterruptIR(int priority, String whenAsset) {
        this.priority = priority;
        this.whenAsset = whenAsset == null ? "" : whenAsset;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public String getWhenAsset() {
        return whenAsset;
    }

    public void setWhenAsset(String whenAsset) {
        this.whenAsset = whenAsset == null ? "" : whenAsset;
    }

    public List<ActionIR> getActions() {
        return actions;
    }

    public InterruptIR deepCopy() {
        InterruptIR copy = new InterruptIR(priority, whenAsset);
        actions.forEach(a -> copy.actions.add(a.deepCopy()));
        return copy;
    }
}
