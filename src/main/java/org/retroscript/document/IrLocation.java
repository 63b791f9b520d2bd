package org.retroscript.document;

import org.retroscript.compiler.frontend.lexer.Lexer;
import org.retroscript.compiler.ir.ActionIR;
import org.retroscript.compiler.ir.AssetIR;
import org.retroscript.compiler.ir.HotkeysIR;
import org.retroscript.compiler.ir.InterruptIR;
import org.retroscript.compiler.ir.ScriptIR;

/**
 * An editable place in a {@link ScriptIR}, addressed the way GUI panels address it: flows,
 * actions, interrupts and assets by index. Indices out of range raise
 * {@link IndexOutOfBoundsException}; values of the wrong type raise {@link IllegalArgumentException},
 * as do flow names and action types that are not plain identifiers.
 */
public sealed interface IrLocation {

    /**
     * Writes {@code value} to this location.
     */
    void apply(ScriptIR ir, Object value);

    record FlowName(int flow) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            ir.getFlows().get(flow).setName(identifier(value));
        }
    }

    record ActionType(int flow, int action) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            String actionType = identifier(value);
            if (ActionIR.isStatementTag(actionType)) {
                throw new IllegalArgumentException("Action type is reserved: " + actionType);
            }
            ir.getFlows().get(flow).getActions().get(action).setActionType(actionType);
        }
    }

    record ActionParam(int flow, int action, String key) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            ir.getFlows().get(flow).getActions().get(action).setParam(key, value);
        }
    }

    record InterruptPriority(int interrupt) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            InterruptIR target = ir.getInterrupts().get(interrupt);
            target.setPriority(number(value).intValue());
        }
    }

    record InterruptAsset(int interrupt) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            ir.getInterrupts().get(interrupt).setWhenAsset(text(value));
        }
    }

    record HotkeyBinding(String name) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            if (ir.getHotkeys() == null) {
                ir.setHotkeys(new HotkeysIR());
            }
            ir.getHotkeys().setBinding(name, text(value));
        }
    }

    record AssetThreshold(int asset) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            AssetIR target = ir.getAssets().get(asset);
            target.setThreshold(number(value).doubleValue());
        }
    }

    record AssetPath(int asset) implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            ir.getAssets().get(asset).setPath(text(value));
        }
    }

    record ScriptName() implements IrLocation {
        @Override
        public void apply(ScriptIR ir, Object value) {
            ir.setName(text(value));
        }
    }

    private static String text(Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("Expected a string value but got: " + value);
    }

    private static String identifier(Object value) {
        String name = text(value);
        if (!Lexer.isIdentifier(name)) {
            throw new IllegalArgumentException("Expected an identifier but got: '" + name + "'");
        }
        return name;
    }

    private static Number number(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("Expected a numeric value but got: " + value);
    }
}
