package frontend.plangen;

import static org.junit.jupiter.api.Assertions.*;

import static frontend.plangen.Plans.compile;
import static frontend.plangen.Plans.ids;
import static frontend.plangen.Plans.op;
import static frontend.plangen.Plans.violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import exception.DslViolation;
import ir.Operation;
import ir.Plan;

class ExpressionEmitterTest {

    private static String body(String... lines) {
        StringBuilder sb = new StringBuilder("def flow():\n");
        for (String line : lines) {
            sb.append("    ").append(line).append('\n');
        }
        return sb.toString();
    }

    // ==================== calls ====================

    @Test
    void positionalLiteralsAreBoxed() {
        Plan plan = compile(body("r = AG.x(1, \"a\", None)", "return r"));

        assertEquals(List.of("_const_1", "_const_2", "_const_3", "r_1"), ids(plan));
        assertEquals("a", op(plan, "_const_2").getArg("value"));
        assertEquals(null, op(plan, "_const_3").getArgs().get("value"));
        assertEquals(List.of("_const_1", "_const_2", "_const_3"), op(plan, "r_1").getDeps());
    }

    @Test
    void keywordLiteralsStayInArgs() {
        Plan plan = compile(body("r = AG.x(k=1, name=\"n\", opts=[1, 2])", "return r"));

        Operation call = op(plan, "r_1");
        assertTrue(call.getDeps().isEmpty());
        assertEquals(List.of(Map.entry("k", 1L), Map.entry("name", "n"), Map.entry("opts", List.of(1L, 2L))),
                new ArrayList<>(call.getArgs().entrySet()));
    }

    @Test
    void keywordLiteralsCanBeBoxed() {
        CompilerConfig config = CompilerConfig.defaultConfig().setBoxKeywordLiterals(true);
        Plan plan = Plans.compile(body("r = AG.x(k=1)", "return r"), config);

        assertEquals(List.of("_const_1", "r_1"), ids(plan));
        Operation call = op(plan, "r_1");
        assertEquals(List.of("_const_1"), call.getDeps());
        assertEquals(List.of("k"), call.getDepLabels());
        assertEquals(1L, call.getArgs().get("k"));
    }

    @Test
    void keywordNamesAndNestedCallsAreLabelled() {
        Plan plan = compile(body("a = AG.a()", "r = AG.x(a, src=a, other=AG.y(a))", "return r"));

        Operation call = op(plan, "r_1");
        assertEquals(List.of("a_1", "a_1", "_tmp_1"), call.getDeps());
        assertEquals(List.of("", "src", "other"), call.getDepLabels());
        assertEquals("AG.y", op(plan, "_tmp_1").getOp());
    }

    @Test
    void sequenceArgumentDependsOnEachElement() {
        Plan plan = compile(body("a = AG.a()", "b = AG.b()", "r = AG.x([a, b])", "return r"));

        assertEquals(List.of("a_1", "b_1"), op(plan, "r_1").getDeps());
    }

    @Test
    void splatForms() {
        Plan plan = compile(body(
                "a = AG.a()",
                "b = AG.b()",
                "xs = AG.list()",
                "r = AG.x(*[a, b], *xs, **{\"mode\": \"fast\"})",
                "return r"));

        Operation call = op(plan, "r_1");
        assertEquals(List.of("a_1", "b_1", "xs_1"), call.getDeps());
        assertEquals(List.of("*", "*", "*"), call.getDepLabels());
        assertEquals(List.of(Map.entry("mode", "fast")), new ArrayList<>(call.getArgs().entrySet()));
    }

    @Test
    void malformedSplatsAreRejected() {
        assertEquals(DslViolation.Kind.INVALID_SPLAT, violation(body("r = AG.x(*AG.y())", "return r")).getKind());
        assertEquals(DslViolation.Kind.INVALID_SPLAT, violation(body("r = AG.x(*[1, 2])", "return r")).getKind());
        assertEquals(DslViolation.Kind.INVALID_SPLAT, violation(body("r = AG.x(**AG.y())", "return r")).getKind());
    }

    @Test
    void calleeMustBeADottedName() {
        DslViolation e = violation(body("a = AG.a()", "r = a[0]()", "return r"));

        assertEquals(DslViolation.Kind.INVALID_CALLEE, e.getKind());
    }

    @Test
    void awaitedCallIsFlagged() {
        Plan plan = compile("""
                async def flow():
                    r = await AG.fetch()
                    return r
                """);

        assertTrue(op(plan, "r_1").isAwaited());
    }

    @Test
    void undefinedArgumentFails() {
        DslViolation e = violation(body("r = AG.x(missing)", "return r"));

        assertEquals(DslViolation.Kind.UNDEFINED_DEPENDENCY, e.getKind());
        assertEquals("Undefined dependency: missing", e.getReason());
    }

    // ==================== other shapes ====================

    @Test
    void subscriptWithLiteralKey() {
        Plan plan = compile(body("d = AG.d()", "v = d[\"key\"]", "w = d[0]", "return v"));

        Operation get = op(plan, "v_1");
        assertEquals("GET.item", get.getOp());
        assertEquals(List.of("d_1"), get.getDeps());
        assertEquals("key", get.getArg("key"));
        assertEquals(0L, op(plan, "w_1").getArg("key"));
        assertEquals(DslViolation.Kind.UNSUPPORTED_EXPRESSION,
                violation(body("d = AG.d()", "k = AG.k()", "v = d[k]", "return v")).getKind());
    }

    @Test
    void fStringBecomesTextFormat() {
        Plan plan = compile(body("name = AG.name()", "msg = f\"hi {name}, {{literal}} {name}!\"", "return msg"));

        Operation format = op(plan, "msg_1");
        assertEquals("TEXT.format", format.getOp());
        assertEquals(List.of("name_1", "name_1"), format.getDeps());
        assertEquals("hi {0}, {literal} {1}!", format.getArg("template"));
    }

    @Test
    void fStringSlotsMustBeNames() {
        assertEquals(DslViolation.Kind.UNSUPPORTED_EXPRESSION,
                violation(body("a = AG.a()", "msg = f\"{a!r}\"", "return msg")).getKind());
        assertEquals(DslViolation.Kind.UNSUPPORTED_EXPRESSION,
                violation(body("a = AG.a()", "msg = f\"{a:>10}\"", "return msg")).getKind());
        assertEquals(DslViolation.Kind.UNSUPPORTED_EXPRESSION,
                violation(body("msg = f\"{AG.x()}\"", "return msg")).getKind());
    }

    @Test
    void comprehensionIsOneNode() {
        Plan plan = compile(body("items = AG.list()", "r = [AG.f(x) for x in items if x]", "return r"));

        Operation comp = op(plan, "r_1");
        assertEquals("COMP.listcomp", comp.getOp());
        assertEquals(List.of("items_1"), comp.getDeps());
        assertEquals(List.of("items_1", "r_1"), ids(plan));
    }

    @Test
    void comprehensionKinds() {
        Plan plan = compile(body(
                "items = AG.list()",
                "s = {x for x in items}",
                "d = {x: 1 for x in items}",
                "g = AG.sum(x for x in items)",
                "return g"));

        assertEquals("COMP.setcomp", op(plan, "s_1").getOp());
        assertEquals("COMP.dictcomp", op(plan, "d_1").getOp());
        assertEquals("COMP.genexpr", op(plan, "_tmp_1").getOp());
    }

    @Test
    void ternaryProducesAnchoredPhi() {
        Plan plan = compile(body("a = AG.a()", "r = AG.x() if a else AG.y()", "return r"));

        assertEquals(List.of("a_1", "_cond_1", "_tmp_1", "_tmp_2", "r_1"), ids(plan));
        Operation cond = op(plan, "_cond_1");
        assertEquals(List.of(Map.entry("kind", "ternary"), Map.entry("expr", "a")),
                new ArrayList<>(cond.getArgs().entrySet()));
        assertEquals(List.of("_cond_1"), op(plan, "_tmp_1").getDeps());
        assertEquals(List.of("_cond_1"), op(plan, "_tmp_2").getDeps());
        Operation phi = op(plan, "r_1");
        assertEquals("PHI", phi.getOp());
        assertEquals(List.of("_tmp_1", "_tmp_2"), phi.getDeps());
        assertEquals("r", phi.getArg("var"));
    }

    @Test
    void nestedTernaryUsesInternalPhi() {
        Plan plan = compile(body("a = AG.a()", "r = AG.x(a if a else 0)", "return r"));

        Operation phi = op(plan, "_ternary_1");
        assertEquals(List.of("a_1", "_const_1"), phi.getDeps());
        assertEquals(List.of("_cond_1"), op(plan, "_const_1").getDeps());
        assertEquals(List.of("_ternary_1"), op(plan, "r_1").getDeps());
    }

    @Test
    void operatorsAreNotDecomposed() {
        Plan plan = compile(body("a = AG.a()", "b = AG.b()", "s = a + b * 2", "ok = a > b and not b", "return s"));

        Operation sum = op(plan, "s_1");
        assertEquals("EXPR.eval", sum.getOp());
        assertEquals(List.of("a_1", "b_1"), sum.getDeps());
        assertEquals("a + b * 2", sum.getArg("expr"));
        assertEquals(List.of("a_1", "b_1"), op(plan, "ok_1").getDeps());
    }

    @Test
    void unsupportedExpressions() {
        String[] values = { "a.b", "lambda x: x", "a[1:2]" };
        for (String value : values) {
            DslViolation e = violation(body("a = AG.a()", "r = " + value, "return r"));
            assertEquals(DslViolation.Kind.UNSUPPORTED_EXPRESSION, e.getKind(), value);
        }
    }
}
