package frontend.plangen;

import static org.junit.jupiter.api.Assertions.*;

import static frontend.plangen.Plans.assertWellFormed;
import static frontend.plangen.Plans.compile;
import static frontend.plangen.Plans.ids;
import static frontend.plangen.Plans.op;
import static frontend.plangen.Plans.violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import exception.DslViolation;
import ir.Opcode;
import ir.Operation;
import ir.Output;
import ir.Plan;
import ir.PlanSerializer;

class PlanPropertiesTest {

    private static final String KITCHEN_SINK = """
            def flow():
                settings(mode="fast")
                a = AG.load(path="in.txt")
                items = AG.list(a)
                total = AG.zero()
                for item in items:
                    total = AG.add(total, item)
                if COND.is_ok(total):
                    note = f"total {total}"
                else:
                    note = AG.describe(total, extra={"a": a, "n": 1})
                c = AG.start()
                while c:
                    c = AG.next(c)
                try:
                    r = await AG.fetch(c)
                except (TimeoutError, ValueError) as err:
                    r = AG.recover(err)
                output(note, as_="note")
                output(c, as_="result.txt")
            """;

    @Test
    void simpleFlow() {
        Plan plan = compile("""
                def flow():
                    a = AG.op1()
                    b = AG.op2(a, k=1)
                    return b
                """);

        assertEquals("flow", plan.getFunction());
        assertEquals(List.of("a_1", "b_1"), ids(plan));
        Operation first = op(plan, "a_1");
        assertEquals("AG.op1", first.getOp());
        assertTrue(first.getDeps().isEmpty());
        Operation second = op(plan, "b_1");
        assertEquals("AG.op2", second.getOp());
        assertEquals(List.of("a_1"), second.getDeps());
        assertEquals(List.of(Map.entry("k", 1L)), new ArrayList<>(second.getArgs().entrySet()));
        assertEquals(List.of(new Output("b_1", "return")), plan.getOutputs());
    }

    @Test
    void ifElseMergesWithOnePhi() {
        Plan plan = compile("""
                def flow():
                    a = AG.a()
                    if a:
                        x = AG.x(a)
                    else:
                        x = AG.y(a)
                    return x
                """);

        List<Operation> phis = plan.getOps(Opcode.PHI);
        assertEquals(1, phis.size());
        Operation phi = phis.get(0);
        assertEquals(List.of("x_1@then1", "x_1@else1"), phi.getDeps());
        assertEquals("x", phi.getArg("var"));
        assertEquals(List.of(new Output(phi.getId(), "return")), plan.getOutputs());
        assertEquals("x_2", phi.getId());
    }

    @Test
    void loopCarriedVariableGetsPhi() {
        Plan plan = compile("""
                def flow():
                    x = AG.src()
                    for i in range(3):
                        x = AG.step(x)
                    return x
                """);

        assertEquals(1, plan.getOps(Opcode.ITER_EVAL).size());
        List<Operation> phis = plan.getOps(Opcode.PHI);
        assertEquals(1, phis.size());
        assertEquals(List.of("x_1", "x_2@for1"), phis.get(0).getDeps());
        assertEquals(List.of(new Output(phis.get(0).getId(), "return")), plan.getOutputs());
    }

    @Test
    void thenOnlyBindingDoesNotEscape() {
        DslViolation e = violation("""
                def flow():
                    a = AG.a()
                    if a:
                        y = AG.y()
                    return y
                """);

        assertEquals(DslViolation.Kind.UNDEFINED_DEPENDENCY, e.getKind());
        assertTrue(e.getMessage().contains("y"));
    }

    @Test
    void splatOfPackedListDependsOnElements() {
        Plan plan = compile("""
                def flow():
                    base = AG.base()
                    args = [base]
                    kw = AG.kw()
                    b = AG.call(*args, **kw)
                    return b
                """);

        Operation call = op(plan, "b_1");
        assertEquals(List.of("base_1", "kw_1"), call.getDeps());
        assertEquals(List.of("*", "**"), call.getDepLabels());
        assertEquals("PACK.list", op(plan, "args_1").getOp());
    }

    @Test
    void operationCeilingIsEnforced() {
        CompilerConfig config = CompilerConfig.defaultConfig().setMaxOps(3);

        DslViolation direct = violation("""
                def flow():
                    a = AG.a()
                    b = AG.b()
                    c = AG.c()
                    d = AG.d()
                    return d
                """, config);
        DslViolation nested = violation("""
                def flow():
                    r = AG.x(AG.y(AG.z(AG.w())))
                    return r
                """, config);

        assertEquals(DslViolation.Kind.PLAN_TOO_LARGE, direct.getKind());
        assertEquals(DslViolation.Kind.PLAN_TOO_LARGE, nested.getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = { "a", "a=1", "*args", "**kwargs", "*, key", "a, /" })
    void parametersAreRejected(String params) {
        DslViolation e = violation("def flow(" + params + "):\n    r = AG.x()\n    return r\n");

        assertEquals(DslViolation.Kind.PARAMETERS, e.getKind());
    }

    @Test
    void compilationIsDeterministic() {
        Plan first = compile(KITCHEN_SINK);
        Plan second = compile(KITCHEN_SINK);

        assertEquals(first, second);
        assertEquals(PlanSerializer.toJson(first), PlanSerializer.toJson(second));
    }

    @Test
    void kitchenSinkIsWellFormed() {
        Plan plan = compile(KITCHEN_SINK);

        assertWellFormed(plan);
        assertEquals("fast", plan.getSettings().get("mode"));
        assertEquals(List.of("note", "result.txt"), plan.getOutputs().stream().map(Output::getAs).toList());
        assertEquals(List.of("total", "note", "c"),
                plan.getOps(Opcode.PHI).stream().map(o -> o.getArg("var")).toList());
        assertEquals(1, plan.getOps(Opcode.EXC_CAUGHT).size());
        assertEquals(List.of("TimeoutError", "ValueError"), plan.getOps(Opcode.EXC_CAUGHT).get(0).getArg("types"));
    }

    @Test
    void everyIdIsUniqueAcrossNestedScopes() {
        Plan plan = compile("""
                def flow():
                    x = AG.a()
                    for i in AG.range():
                        if x:
                            x = AG.b(x)
                        else:
                            x = AG.c(x)
                        for j in AG.range():
                            x = AG.d(x, j)
                    if x:
                        x = AG.e(x)
                    else:
                        x = AG.f(x)
                    return x
                """);

        assertWellFormed(plan);
    }
}
