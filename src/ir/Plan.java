package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The compiler's result: ops in emission order, outputs and settings.
 * Immutable once built; renderers and exporters only read it.
 */
public final class Plan {
    public static final int VERSION = 2;

    private final int version;
    private final String function;
    private final List<Operation> ops;
    private final List<Output> outputs;
    private final Map<String, Object> settings;

    public Plan(String function, List<Operation> ops, List<Output> outputs, Map<String, Object> settings) {
        this(VERSION, function, ops, outputs, settings);
    }

    public Plan(int version, String function, List<Operation> ops, List<Output> outputs,
            Map<String, Object> settings) {
        this.version = version;
        this.function = function;
        this.ops = Collections.unmodifiableList(new ArrayList<>(ops));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    public int getVersion() {
        return version;
    }

    /** Name of the compiled function; may be null. */
    public String getFunction() {
        return function;
    }

    public List<Operation> getOps() {
        return ops;
    }

    public List<Output> getOutputs() {
        return outputs;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    /** @return the op with this id, or null */
    public Operation getOp(String id) {
        for (Operation op : ops) {
            if (op.getId().equals(id)) {
                return op;
            }
        }
        return null;
    }

    public List<Operation> getOpsNamed(String opName) {
        List<Operation> found = new ArrayList<>();
        for (Operation op : ops) {
            if (op.getOp().equals(opName)) {
                found.add(op);
            }
        }
        return found;
    }

    public List<Operation> getOps(Opcode opcode) {
        return getOpsNamed(opcode.getOpName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Plan other)) {
            return false;
        }
        return version == other.version
                && Objects.equals(function, other.function)
                && ops.equals(other.ops)
                && outputs.equals(other.outputs)
                && settings.equals(other.settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, function, ops, outputs, settings);
    }

    @Override
    public String toString() {
        return "Plan{function=" + function + ", ops=" + ops.size() + ", outputs=" + outputs + "}";
    }
}
