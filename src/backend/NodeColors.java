package backend;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ir.Operation;
import ir.Plan;

/**
 * Stable fill colour per operation name: SHA-256 of the name picks one of
 * ten crayon colours, so a node type looks the same in every export.
 */
public final class NodeColors {
    public static final String OUTPUT = "output";

    public static final List<String> CRAYON_COLORS = List.of(
            "cornflowerblue",
            "lightcoral",
            "gold",
            "mediumseagreen",
            "orchid",
            "sandybrown",
            "plum",
            "turquoise",
            "khaki",
            "salmon");

    private NodeColors() {
    }

    public static String colorFor(String name) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(name.getBytes(StandardCharsets.UTF_8));
            int index = new BigInteger(1, digest).mod(BigInteger.valueOf(CRAYON_COLORS.size())).intValue();
            return CRAYON_COLORS.get(index);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    /** Colour of every op name in the plan, plus {@value #OUTPUT}. */
    public static Map<String, String> colorMap(Plan plan) {
        Map<String, String> colors = new LinkedHashMap<>();
        for (Operation op : plan.getOps()) {
            colors.computeIfAbsent(op.getOp(), NodeColors::colorFor);
        }
        colors.put(OUTPUT, colorFor(OUTPUT));
        return colors;
    }
}
