package org.retroscript.compiler.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class FlowIR {

    private String name;
    private final List<ActionIR> actions = new ArrayList<>();

    public FlowIR(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public List<ActionIR> getActions() {
        return actions;
    }

    public FlowIR deepCopy() {
        FlowIR copy = new FlowIR(name);
        actions.forEach(a -> copy.actions.add(a.deepCopy()));
        return copy;
    }
}
