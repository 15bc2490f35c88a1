package ir;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * JSON form of a {@link Plan}. Field order is fixed: {@code version, function,
 * ops, outputs, settings}; ops are {@code id, op, deps, args, dep_labels,
 * awaited}. {@code settings} is left out when empty.
 */
public final class PlanSerializer {
    private static final Gson PRETTY = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .create();
    private static final Gson COMPACT = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .create();

    private PlanSerializer() {
    }

    public static String toJson(Plan plan) {
        return PRETTY.toJson(toJsonTree(plan));
    }

    public static String toCompactJson(Plan plan) {
        return COMPACT.toJson(toJsonTree(plan));
    }

    public static JsonObject toJsonTree(Plan plan) {
        JsonObject root = new JsonObject();
        root.addProperty("version", plan.getVersion());
        root.add("function", plan.getFunction() == null ? JsonNull.INSTANCE : new JsonPrimitive(plan.getFunction()));

        JsonArray ops = new JsonArray();
        for (Operation op : plan.getOps()) {
            ops.add(toJsonTree(op));
        }
        root.add("ops", ops);

        JsonArray outputs = new JsonArray();
        for (Output output : plan.getOutputs()) {
            JsonObject out = new JsonObject();
            out.addProperty("from", output.getFrom());
            out.addProperty("as", output.getAs());
            outputs.add(out);
        }
        root.add("outputs", outputs);

        if (!plan.getSettings().isEmpty()) {
            root.add("settings", toJsonValue(plan.getSettings()));
        }
        return root;
    }

    public static JsonObject toJsonTree(Operation op) {
        JsonObject obj = new JsonObject();
        obj.addProperty("id", op.getId());
        obj.addProperty("op", op.getOp());
        obj.add("deps", stringArray(op.getDeps()));
        obj.add("args", toJsonValue(op.getArgs()));
        obj.add("dep_labels", stringArray(op.getDepLabels()));
        obj.addProperty("awaited", op.isAwaited());
        return obj;
    }

    /** Compact JSON text of a literal value, as used by the pretty-printer. */
    public static String literalToJson(Object value) {
        return COMPACT.toJson(toJsonValue(value));
    }

    public static JsonElement toJsonValue(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Boolean b) {
            return new JsonPrimitive(b);
        }
        if (value instanceof BigInteger big) {
            return new JsonPrimitive(new BigDecimal(big));
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        if (value instanceof String s) {
            return new JsonPrimitive(s);
        }
        if (value instanceof List<?> list) {
            JsonArray array = new JsonArray();
            for (Object element : list) {
                array.add(toJsonValue(element));
            }
            return array;
        }
        if (value instanceof Map<?, ?> map) {
            JsonObject obj = new JsonObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                obj.add(String.valueOf(entry.getKey()), toJsonValue(entry.getValue()));
            }
            return obj;
        }
        throw new IllegalArgumentException("not a literal value: " + value.getClass().getName());
    }

    private static JsonArray stringArray(List<String> values) {
        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }
}
