package ir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import exception.DslViolation;

class PlanBuilderTest {

    @Test
    void armedAnchorIsAppendedToNextOpOnly() {
        PlanBuilder builder = new PlanBuilder(10);
        builder.emitLeaf("_cond_1", Opcode.COND_EVAL, Map.of("kind", "if"));
        builder.armAnchor("_cond_1");
        Operation first = builder.emit("a_1@then1", "AG.a", List.of(), List.of(), Map.of(), false);
        Operation second = builder.emit("b_1@then1", "AG.b", List.of("a_1@then1"), List.of(""), Map.of(), false);

        assertEquals(List.of("_cond_1"), first.getDeps());
        assertEquals(List.of(""), first.getDepLabels());
        assertEquals(List.of("a_1@then1"), second.getDeps());
    }

    @Test
    void anchorAlreadyInDepsIsNotRepeated() {
        PlanBuilder builder = new PlanBuilder(10);
        builder.emitLeaf("_iter_1", Opcode.ITER_EVAL, Map.of());
        builder.armAnchor("_iter_1");
        Operation item = builder.emit("i_1@for1", Opcode.ITER_ITEM, List.of("_iter_1"), List.of(""), Map.of());

        assertEquals(List.of("_iter_1"), item.getDeps());
    }

    @Test
    void disarmDropsUnconsumedAnchor() {
        PlanBuilder builder = new PlanBuilder(10);
        builder.emitLeaf("_cond_1", Opcode.COND_EVAL, Map.of());
        builder.armAnchor("_cond_1");
        builder.disarmAnchor();
        Operation op = builder.emitConst("x_1", 3L);

        assertTrue(op.getDeps().isEmpty());
    }

    @Test
    void armingOverPendingAnchorFails() {
        PlanBuilder builder = new PlanBuilder(10);
        builder.emitLeaf("_cond_1", Opcode.COND_EVAL, Map.of());
        builder.emitLeaf("_cond_2", Opcode.COND_EVAL, Map.of());
        builder.armAnchor("_cond_1");

        assertThrows(IllegalStateException.class, () -> builder.armAnchor("_cond_2"));
        builder.disarmAnchor();
        builder.armAnchor("_cond_2");
        assertEquals(List.of("_cond_2"), builder.emitConst("x_1", 3L).getDeps());
    }

    @Test
    void ceilingRaisesPlanTooLarge() {
        PlanBuilder builder = new PlanBuilder(2);
        builder.emitConst("a_1", 1L);
        builder.emitConst("b_1", 2L);

        DslViolation e = assertThrows(DslViolation.class, () -> builder.emitConst("c_1", 3L));
        assertEquals(DslViolation.Kind.PLAN_TOO_LARGE, e.getKind());
        assertEquals(2, builder.size());
    }

    @Test
    void rejectsDuplicateIdsAndUnknownDeps() {
        PlanBuilder builder = new PlanBuilder(10);
        builder.emitConst("a_1", 1L);

        assertThrows(IllegalStateException.class, () -> builder.emitConst("a_1", 2L));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> builder.emit("b_1", "AG.b", List.of("ghost_1"), List.of(""), Map.of(), false));
        assertTrue(e.getMessage().contains("ghost_1"), e.getMessage());
    }

    @Test
    void lookupReturnsEmittedOps() {
        PlanBuilder builder = new PlanBuilder(10);
        builder.emitConst("a_1", "hello");

        assertTrue(builder.contains("a_1"));
        assertEquals("hello", builder.get("a_1").getArg("value"));
        assertNull(builder.get("missing"));
    }
}
