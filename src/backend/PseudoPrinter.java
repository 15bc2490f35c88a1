package backend;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import exception.CompileException;
import ir.Operation;
import ir.Output;
import ir.Plan;
import ir.PlanSerializer;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Readable text form of a plan, one line per operation and per output:
 *
 * <pre>
 * settings(mode="fast")
 *
 * a_1 = AG.op1()
 * b_1 = AG.op2(a_1, k=1)
 *
 * output(b_1, as="return")
 * </pre>
 */
public class PseudoPrinter {
    private static final Logger logger = LogManager.getLogger(PseudoPrinter.class);
    private static final PseudoPrinter instance = new PseudoPrinter();

    private PseudoPrinter() {
    }

    public static PseudoPrinter getInstance() {
        return instance;
    }

    public String printToString(Plan plan) {
        List<String> lines = new ArrayList<>();
        if (!plan.getSettings().isEmpty()) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, Object> entry : plan.getSettings().entrySet()) {
                parts.add(entry.getKey() + "=" + PlanSerializer.literalToJson(entry.getValue()));
            }
            lines.add("settings(" + String.join(", ", parts) + ")");
            lines.add("");
        }

        for (Operation op : plan.getOps()) {
            lines.add(op.getId() + " = " + op.getOp() + "(" + String.join(", ", arguments(op)) + ")");
        }
        if (!plan.getOps().isEmpty()) {
            lines.add("");
        }

        for (Output output : plan.getOutputs()) {
            lines.add("output(" + output.getFrom() + ", as=" + PlanSerializer.literalToJson(output.getAs()) + ")");
        }
        return String.join("\n", lines).stripTrailing() + "\n";
    }

    private static List<String> arguments(Operation op) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < op.getDeps().size(); i++) {
            String dep = op.getDeps().get(i);
            String label = op.getDepLabels().get(i);
            switch (label) {
                case Operation.POSITIONAL -> parts.add(dep);
                case Operation.SPLAT -> parts.add("*" + dep);
                case Operation.DOUBLE_SPLAT -> parts.add("**" + dep);
                default -> parts.add(label + "=" + dep);
            }
        }
        for (Map.Entry<String, Object> arg : op.getArgs().entrySet()) {
            parts.add(arg.getKey() + "=" + PlanSerializer.literalToJson(arg.getValue()));
        }
        return parts;
    }

    public void printToFile(Plan plan, Path file) {
        try {
            Files.writeString(file, printToString(plan), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("cannot write " + file, e);
        }
        logger.debug("wrote {}", file);
    }
}
