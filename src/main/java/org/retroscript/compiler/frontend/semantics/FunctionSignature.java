package org.retroscript.compiler.frontend.semantics;

import org.retroscript.compiler.frontend.parser.ast.Literal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Signature of a built-in function: required positional parameters, optional keyword
 * parameters and whether extra arguments are accepted.
 */
public record FunctionSignature(String name, List<Parameter> required, Map<String, ParamType> optional,
                                boolean variadic) {

    /**
     * Declared parameter kinds. Only literal arguments are checked against them.
     */
    public enum ParamType {
        ANY, STRING, INT, FLOAT, BOOL, DURATION, ROI, ARRAY;

        /**
         * @return true if a literal of the given kind may be passed for this parameter.
         */
        public boolean accepts(Literal.Kind kind) {
            if (kind == Literal.Kind.NULL) return true;
            return switch (this) {
                case ANY -> true;
                case STRING -> kind == Literal.Kind.STRING;
                case INT -> kind == Literal.Kind.INTEGER;
                case FLOAT -> kind == Literal.Kind.INTEGER || kind == Literal.Kind.FLOAT;
                case BOOL -> kind == Literal.Kind.BOOLEAN;
                case DURATION -> kind == Literal.Kind.DURATION || kind == Literal.Kind.INTEGER
                        || kind == Literal.Kind.FLOAT;
                case ROI, ARRAY -> false;
            };
        }

        public String displayName() {
            return name().toLowerCase();
        }
    }

    public record Parameter(String name, ParamType type) {
    }

    public FunctionSignature {
        required = List.copyOf(required);
        optional = Collections.unmodifiableMap(new LinkedHashMap<>(optional));
    }

    /**
     * Looks up the declared type of a parameter by name, required or optional.
     * @param parameter the parameter name.
     * @return the declared type, or empty for an unknown parameter.
     */
    public Optional<ParamType> typeOf(String parameter) {
        for (Parameter p : required) {
            if (p.name().equals(parameter)) return Optional.of(p.type());
        }
        return Optional.ofNullable(optional.get(parameter));
    }
}
