package backend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import exception.CompileException;
import ir.Plan;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Graphviz DOT text of a plan, built from the {@link PresentationGraph}.
 * Op nodes are labelled with the op name, outputs are drawn as notes.
 */
public class DotExporter {
    private static final Logger logger = LogManager.getLogger(DotExporter.class);
    private static final DotExporter instance = new DotExporter();

    private DotExporter() {
    }

    public static DotExporter getInstance() {
        return instance;
    }

    public String printToString(Plan plan) {
        PresentationGraph graph = GraphRenderer.getInstance().render(plan);
        StringBuilder sb = new StringBuilder();
        sb.append("digraph plan {\n");
        sb.append("  rankdir=TB;\n");
        sb.append("  graph [margin=0.2, pad=0.2, color=\"#cccccc\"];\n");
        sb.append("  node [fontname=\"Helvetica\"];\n");
        sb.append("  edge [fontname=\"Helvetica\", fontsize=10];\n");

        for (PresentationGraph.Node node : graph.getNodes()) {
            sb.append("  ").append(quote(node.getId())).append(" [label=").append(quote(
                    node.isOutput() ? node.getLabel() : node.getOp()));
            if (node.isOutput()) {
                sb.append(", shape=note");
            } else {
                sb.append(", shape=box");
            }
            sb.append(", style=filled, fillcolor=").append(quote(node.getColor())).append("];\n");
        }
        for (PresentationGraph.Edge edge : graph.getEdges()) {
            sb.append("  ").append(quote(edge.getFrom())).append(" -> ").append(quote(edge.getTo()));
            if (!edge.getLabel().isEmpty()) {
                sb.append(" [label=").append(quote(edge.getLabel())).append("]");
            }
            sb.append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    public void printToFile(Plan plan, Path file) {
        try {
            Files.writeString(file, printToString(plan), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("cannot write " + file, e);
        }
        logger.debug("wrote {}", file);
    }

    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
