package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exception.DslViolation;

/**
 * Append-only operation list of one compilation attempt.
 *
 * Every dependency must name an id appended earlier, and the total number of
 * operations is capped. A control anchor can be armed: the next appended
 * operation then also depends on the anchor (positional label), which is how
 * the first node of a branch or loop body is tied to its condition.
 */
public class PlanBuilder {
    private final List<Operation> ops = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private final int maxOps;

    private String pendingAnchor = null;

    public PlanBuilder(int maxOps) {
        this.maxOps = maxOps;
    }

    public Operation emit(String id, Opcode opcode, List<String> deps, List<String> labels,
            Map<String, Object> args) {
        return emit(id, opcode.getOpName(), deps, labels, args, false);
    }

    public Operation emit(String id, String op, List<String> deps, List<String> labels, Map<String, Object> args,
            boolean awaited) {
        if (ops.size() >= maxOps) {
            throw DslViolation.planTooLarge(maxOps);
        }
        if (ids.contains(id)) {
            throw new IllegalStateException("SSA id emitted twice: " + id);
        }
        for (String dep : deps) {
            if (!ids.contains(dep)) {
                throw new IllegalStateException("dependency " + dep + " of " + id + " was never emitted");
            }
        }

        List<String> finalDeps = deps;
        List<String> finalLabels = labels;
        if (pendingAnchor != null) {
            if (!deps.contains(pendingAnchor)) {
                finalDeps = new ArrayList<>(deps);
                finalLabels = new ArrayList<>(labels);
                finalDeps.add(pendingAnchor);
                finalLabels.add(Operation.POSITIONAL);
            }
            pendingAnchor = null;
        }

        Operation operation = new Operation(id, op, finalDeps, args, finalLabels, awaited);
        ops.add(operation);
        ids.add(id);
        return operation;
    }

    /** Shorthand for an operation without dependencies. */
    public Operation emitLeaf(String id, Opcode opcode, Map<String, Object> args) {
        return emit(id, opcode, List.of(), List.of(), args);
    }

    public Operation emitConst(String id, Object value) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("value", value);
        return emitLeaf(id, Opcode.CONST, args);
    }

    /**
     * Tie the next emitted operation to {@code anchorId}.
     */
    public void armAnchor(String anchorId) {
        if (pendingAnchor != null) {
            throw new IllegalStateException("Anchor " + pendingAnchor + " was never consumed");
        }
        pendingAnchor = anchorId;
    }

    /**
     * Drop an anchor nobody consumed, e.g. after an empty branch.
     */
    public void disarmAnchor() {
        pendingAnchor = null;
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    /** @return the op with this id, or null */
    public Operation get(String id) {
        if (!ids.contains(id)) {
            return null;
        }
        for (int i = ops.size() - 1; i >= 0; i--) {
            if (ops.get(i).getId().equals(id)) {
                return ops.get(i);
            }
        }
        return null;
    }

    public int size() {
        return ops.size();
    }

    public int getMaxOps() {
        return maxOps;
    }

    public List<Operation> getOps() {
        return Collections.unmodifiableList(ops);
    }
}
