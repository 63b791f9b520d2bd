package org.retroscript.compiler.frontend.semantics;

import org.retroscript.compiler.frontend.semantics.FunctionSignature.ParamType;
import org.retroscript.compiler.frontend.semantics.FunctionSignature.Parameter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The built-in function table.
 */
public final class BuiltinSignatures {

    /** Built-ins whose first argument names an image asset. */
    public static final Set<String> IMAGE_FUNCTIONS = Set.of("wait_image", "find_image", "image_exists");
    public static final String WAIT_ANY = "wait_any";
    public static final String RUN_FLOW = "run_flow";

    private static final Map<String, FunctionSignature> SIGNATURES = new LinkedHashMap<>();

    static {
        add("wait_image", List.of(p("asset", ParamType.STRING)), Map.of(
                "appear", ParamType.BOOL,
                "timeout", ParamType.DURATION,
                "poll", ParamType.DURATION,
                "roi", ParamType.ROI,
                "threshold", ParamType.FLOAT));
        add("find_image", List.of(p("asset", ParamType.STRING)), Map.of(
                "roi", ParamType.ROI,
                "threshold", ParamType.FLOAT));
        add("image_exists", List.of(p("asset", ParamType.STRING)), Map.of(
                "roi", ParamType.ROI,
                "threshold", ParamType.FLOAT));
        add("wait_any", List.of(p("assets", ParamType.ARRAY)), Map.of(
                "timeout", ParamType.DURATION,
                "poll", ParamType.DURATION));
        add("click", List.of(p("x", ParamType.ANY), p("y", ParamType.ANY)), Map.of(
                "button", ParamType.STRING,
                "clicks", ParamType.INT,
                "interval", ParamType.DURATION));
        add("move", List.of(p("x", ParamType.ANY), p("y", ParamType.ANY)), Map.of());
        SIGNATURES.put("hotkey", new FunctionSignature("hotkey", List.of(), Map.of(), true));
        add("type_text", List.of(p("text", ParamType.STRING)), Map.of(
                "paste", ParamType.BOOL,
                "enter", ParamType.BOOL));
        add("sleep", List.of(p("duration", ParamType.DURATION)), Map.of());
        add("run_flow", List.of(p("flow_name", ParamType.STRING)), Map.of());
        add("log", List.of(p("message", ParamType.ANY)), Map.of("level", ParamType.STRING));
        add("assert", List.of(p("condition", ParamType.ANY)), Map.of("message", ParamType.STRING));
        add("range", List.of(p("end", ParamType.INT)), Map.of(
                "start", ParamType.INT,
                "step", ParamType.INT));
    }

    private BuiltinSignatures() {
    }

    public static Optional<FunctionSignature> get(String name) {
        return Optional.ofNullable(SIGNATURES.get(name));
    }

    public static Set<String> names() {
        return SIGNATURES.keySet();
    }

    private static void add(String name, List<Parameter> required, Map<String, ParamType> optional) {
        SIGNATURES.put(name, new FunctionSignature(name, required, optional, false));
    }

    private static Parameter p(String name, ParamType type) {
        return new Parameter(name, type);
    }
}
