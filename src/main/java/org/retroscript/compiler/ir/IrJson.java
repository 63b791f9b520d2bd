package org.retroscript.compiler.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import java.lang.reflect.Type;

/**
 * JSON rendering of the IR for tooling and the {@code ir} command. Typed values are written as
 * objects with a {@code kind} discriminator.
 */
public final class IrJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .registerTypeHierarchyAdapter(IrValue.class, new IrValueSerializer())
            .create();

    private IrJson() {
    }

    public static String toJson(ScriptIR ir) {
        return GSON.toJson(ir);
    }

    private static final class IrValueSerializer implements JsonSerializer<IrValue> {

        @Override
        public JsonElement serialize(IrValue value, Type type, JsonSerializationContext context) {
            JsonObject json = new JsonObject();
            if (value instanceof IrValue.Reference reference) {
                json.addProperty("kind", "reference");
                json.addProperty("name", reference.name());
            } else if (value instanceof IrValue.Duration duration) {
                json.addProperty("kind", "duration");
                json.addProperty("text", duration.text());
            } else if (value instanceof IrValue.RawExpression raw) {
                json.addProperty("kind", "expression");
                json.addProperty("source", raw.source());
            } else if (value instanceof IrValue.ListValue list) {
                json.addProperty("kind", "list");
                JsonArray elements = new JsonArray();
                list.elements().forEach(element -> elements.add(context.serialize(element)));
                json.add("elements", elements);
            }
            return json;
        }
    }
}
