package org.retroscript.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Typed IR parameter values that have no plain JSON counterpart. Plain values are
 * {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code null}.
 */
public sealed interface IrValue permits IrValue.Reference, IrValue.Duration, IrValue.RawExpression, IrValue.ListValue {

    /** A bare name: a variable, constant or flow reference. */
    record Reference(String name) implements IrValue {
    }

    /** A duration literal such as {@code 500ms}, kept as written. */
    record Duration(String text) implements IrValue {
    }

    /** Any expression the IR does not model, kept as canonical source text. */
    record RawExpression(String source) implements IrValue {
    }

    /** An array literal of IR values. */
    record ListValue(List<Object> elements) implements IrValue {
        public ListValue {
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }
}
