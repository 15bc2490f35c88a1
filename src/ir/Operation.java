package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of the plan. Immutable; {@code deps} and {@code depLabels} are
 * parallel lists, a label being {@code ""} (positional), a keyword name,
 * {@code "*"} or {@code "**"}.
 *
 * Args values are plain literal trees: null, Boolean, Number, String,
 * List and Map with String keys.
 */
public final class Operation {
    public static final String POSITIONAL = "";
    public static final String SPLAT = "*";
    public static final String DOUBLE_SPLAT = "**";

    private final String id;
    private final String op;
    private final List<String> deps;
    private final Map<String, Object> args;
    private final List<String> depLabels;
    private final boolean awaited;

    public Operation(String id, String op, List<String> deps, Map<String, Object> args, List<String> depLabels,
            boolean awaited) {
        this.id = Objects.requireNonNull(id, "id");
        this.op = Objects.requireNonNull(op, "op");
        if (deps.size() != depLabels.size()) {
            throw new IllegalArgumentException(
                    "deps and dep_labels differ in length for " + id + ": " + deps + " / " + depLabels);
        }
        this.deps = Collections.unmodifiableList(new ArrayList<>(deps));
        this.depLabels = Collections.unmodifiableList(new ArrayList<>(depLabels));
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.awaited = awaited;
    }

    public String getId() {
        return id;
    }

    public String getOp() {
        return op;
    }

    /** Built-in opcode, or null for a user call. */
    public Opcode getOpcode() {
        return Opcode.fromOpName(op);
    }

    public boolean is(Opcode opcode) {
        return opcode.getOpName().equals(op);
    }

    public List<String> getDeps() {
        return deps;
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public Object getArg(String key) {
        return args.get(key);
    }

    public List<String> getDepLabels() {
        return depLabels;
    }

    public boolean isAwaited() {
        return awaited;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operation other)) {
            return false;
        }
        return awaited == other.awaited
                && id.equals(other.id)
                && op.equals(other.op)
                && deps.equals(other.deps)
                && args.equals(other.args)
                && depLabels.equals(other.depLabels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, op, deps, args, depLabels, awaited);
    }

    @Override
    public String toString() {
        return id + " = " + op + deps + (args.isEmpty() ? "" : " " + args) + (awaited ? " (awaited)" : "");
    }
}
