package backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Layout-ready view of a plan: labelled nodes and de-duplicated, labelled
 * edges. Holds no plan semantics of its own.
 */
public class PresentationGraph {

    public static final class Node {
        private final String id;
        private final String op;
        private final String label;
        private final String cssClass;
        private final String color;
        private final boolean output;

        public Node(String id, String op, String label, String cssClass, String color, boolean output) {
            this.id = id;
            this.op = op;
            this.label = label;
            this.cssClass = cssClass;
            this.color = color;
            this.output = output;
        }

        public String getId() {
            return id;
        }

        /** Operation name, or {@code output} for output nodes. */
        public String getOp() {
            return op;
        }

        public String getLabel() {
            return label;
        }

        /** {@code note} for control and output nodes, {@code op} otherwise. */
        public String getCssClass() {
            return cssClass;
        }

        public String getColor() {
            return color;
        }

        public boolean isOutput() {
            return output;
        }
    }

    public static final class Edge {
        private final String from;
        private final String to;
        private final String label;

        public Edge(String from, String to, String label) {
            this.from = from;
            this.to = to;
            this.label = label;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }

        public String getLabel() {
            return label;
        }

        @Override
        public String toString() {
            return from + " -[" + label + "]-> " + to;
        }
    }

    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();

    void addNode(Node node) {
        nodes.add(node);
    }

    void addEdge(Edge edge) {
        edges.add(edge);
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public Node getNode(String id) {
        for (Node node : nodes) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }

    public List<Edge> edgesInto(String id) {
        List<Edge> found = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getTo().equals(id)) {
                found.add(edge);
            }
        }
        return found;
    }

    public JsonObject toJsonTree() {
        JsonArray nodeArray = new JsonArray();
        for (Node node : nodes) {
            JsonObject obj = new JsonObject();
            obj.addProperty("id", node.getId());
            obj.addProperty("op", node.getOp());
            obj.addProperty("label", node.getLabel());
            obj.addProperty("class", node.getCssClass());
            obj.addProperty("color", node.getColor());
            nodeArray.add(obj);
        }
        JsonArray edgeArray = new JsonArray();
        for (Edge edge : edges) {
            JsonObject obj = new JsonObject();
            obj.addProperty("from", edge.getFrom());
            obj.addProperty("to", edge.getTo());
            obj.addProperty("label", edge.getLabel());
            edgeArray.add(obj);
        }
        JsonObject root = new JsonObject();
        root.add("nodes", nodeArray);
        root.add("edges", edgeArray);
        return root;
    }
}
