package frontend.plangen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exception.DslViolation;
import ir.Operation;
import ir.Plan;

/** Shared helpers for compiler tests. */
final class Plans {

    private Plans() {
    }

    static Plan compile(String source) {
        return PlanAssembler.compile(source);
    }

    static Plan compile(String source, CompilerConfig config) {
        return new PlanAssembler(config).assemble(source, null);
    }

    static DslViolation violation(String source) {
        return violation(source, CompilerConfig.defaultConfig());
    }

    static DslViolation violation(String source, CompilerConfig config) {
        return assertThrows(DslViolation.class, () -> compile(source, config));
    }

    static List<String> ids(Plan plan) {
        List<String> ids = new ArrayList<>();
        for (Operation op : plan.getOps()) {
            ids.add(op.getId());
        }
        return ids;
    }

    static Operation op(Plan plan, String id) {
        Operation op = plan.getOp(id);
        assertNotNull(op, "op " + id + " in " + ids(plan));
        return op;
    }

    /** Ids unique, every dep emitted earlier, every output reads an op. */
    static void assertWellFormed(Plan plan) {
        Set<String> seen = new HashSet<>();
        for (Operation op : plan.getOps()) {
            assertTrue(seen.containsAll(op.getDeps()), "deps of " + op.getId());
            assertTrue(seen.add(op.getId()), "duplicate id " + op.getId());
            assertEquals(op.getDeps().size(), op.getDepLabels().size());
        }
        plan.getOutputs().forEach(output -> assertTrue(seen.contains(output.getFrom()), output.getFrom()));
    }
}
