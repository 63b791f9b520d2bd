package org.retroscript.compiler.ir;

/**
 * A top-level constant. The value uses the same representation as action parameters.
 */
public record ConstantIR(String name, Object value) {
}
