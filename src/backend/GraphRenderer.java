package backend;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ir.Opcode;
import ir.Operation;
import ir.Output;
import ir.Plan;

/**
 * Plan to {@link PresentationGraph}.
 *
 * Edge labels, in order of preference: the explicit dep label; the key of a
 * {@code PACK.dict} value; {@code then} / {@code else} / {@code cond} out of a
 * condition node; the loop target out of an iterator node; the dependency id.
 */
public class GraphRenderer {
    private static final GraphRenderer instance = new GraphRenderer();

    private GraphRenderer() {
    }

    public static GraphRenderer getInstance() {
        return instance;
    }

    public PresentationGraph render(Plan plan) {
        PresentationGraph graph = new PresentationGraph();
        Map<String, Operation> byId = new HashMap<>();

        for (Operation op : plan.getOps()) {
            byId.put(op.getId(), op);
            graph.addNode(new PresentationGraph.Node(op.getId(), op.getOp(), nodeLabel(op),
                    isNote(op) ? "note" : "op", NodeColors.colorFor(op.getOp()), false));
        }

        for (Operation op : plan.getOps()) {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < op.getDeps().size(); i++) {
                String dep = op.getDeps().get(i);
                if (!seen.add(dep)) {
                    continue;
                }
                graph.addEdge(new PresentationGraph.Edge(dep, op.getId(), edgeLabel(op, i, byId.get(dep))));
            }
        }

        for (Output output : plan.getOutputs()) {
            String id = outputNodeId(output);
            graph.addNode(new PresentationGraph.Node(id, NodeColors.OUTPUT, output.getAs(), "note",
                    NodeColors.colorFor(NodeColors.OUTPUT), true));
            graph.addEdge(new PresentationGraph.Edge(output.getFrom(), id, ""));
        }
        return graph;
    }

    public static String outputNodeId(Output output) {
        return "out:" + output.getAs();
    }

    private static boolean isNote(Operation op) {
        return op.is(Opcode.COND_EVAL) || op.is(Opcode.ITER_EVAL) || op.is(Opcode.PHI);
    }

    static String nodeLabel(Operation op) {
        Opcode opcode = op.getOpcode();
        if (opcode == null) {
            return op.getOp();
        }
        return switch (opcode) {
            case COND_EVAL -> {
                Object kind = op.getArg("kind");
                yield (kind == null ? "if" : kind.toString()).toUpperCase() + " " + argText(op, "expr");
            }
            case ITER_EVAL -> "FOR " + argText(op, "expr");
            case PHI -> op.getArg("var") == null ? "PHI" : "PHI (" + op.getArg("var") + ")";
            default -> op.getOp();
        };
    }

    private static String argText(Operation op, String key) {
        Object value = op.getArg(key);
        return value == null ? "" : value.toString();
    }

    static String edgeLabel(Operation op, int index, Operation source) {
        List<String> labels = op.getDepLabels();
        String label = index < labels.size() ? labels.get(index) : "";
        if (!label.isEmpty()) {
            return label;
        }
        if (op.is(Opcode.PACK_DICT)) {
            if (op.getArg("keys") instanceof List<?> keys && index < keys.size() && keys.get(index) != null) {
                return keys.get(index).toString();
            }
            return "";
        } else if (source != null && source.is(Opcode.COND_EVAL)) {
            if (!"if".equals(source.getArg("kind"))) {
                return "cond";
            }
            if (op.getId().contains("@then")) {
                return "then";
            }
            if (op.getId().contains("@else")) {
                return "else";
            }
            return "cond";
        } else if (source != null && source.is(Opcode.ITER_EVAL)) {
            Object target = source.getArg("target");
            return target == null || target.toString().isEmpty() ? "iter" : target.toString();
        }
        return op.getDeps().get(index);
    }
}
