package frontend.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import exception.DslViolation;

class AstBuilderTest {

    private static Expr expr(String text) {
        return AstBuilder.parseExpression(text, 1);
    }

    private static Object constant(String text) {
        Expr expr = expr(text);
        assertInstanceOf(Expr.Constant.class, expr);
        return ((Expr.Constant) expr).getValue();
    }

    // ==================== statements ====================

    @Test
    void collectsTopLevelFunctions() {
        Module module = AstBuilder.parseModule("""
                import os

                def first():
                    return 1

                async def second(a, *rest, key=1, **extra):
                    pass
                """);

        assertEquals(3, module.getBody().size());
        assertEquals(List.of("first", "second"),
                module.getFunctions().stream().map(Stmt.FunctionDef::getName).toList());
        Stmt.FunctionDef second = module.getFunctions().get(1);
        assertTrue(second.isAsync());
        assertEquals(List.of(Stmt.ParamKind.POSITIONAL, Stmt.ParamKind.VARARGS, Stmt.ParamKind.POSITIONAL,
                Stmt.ParamKind.KWARGS), second.getParams().stream().map(Stmt.Param::getKind).toList());
        assertTrue(second.getParams().get(2).isDefaulted());
    }

    @Test
    void elifNestsIntoElse() {
        Module module = AstBuilder.parseModule("""
                def flow():
                    if a:
                        x = 1
                    elif b:
                        x = 2
                    else:
                        x = 3
                """);

        Stmt.If outer = (Stmt.If) module.getFunctions().get(0).getBody().get(0);
        assertEquals(1, outer.getOrelse().size());
        Stmt.If inner = (Stmt.If) outer.getOrelse().get(0);
        assertEquals("b", inner.getTest().getText());
        assertEquals(4, inner.getLine());
        assertEquals(1, inner.getOrelse().size());
        assertInstanceOf(Stmt.Assign.class, inner.getOrelse().get(0));
    }

    @Test
    void tryClausesAreSplit() {
        Module module = AstBuilder.parseModule("""
                def flow():
                    try:
                        a = 1
                    except (KeyError, ValueError) as err:
                        pass
                    except:
                        pass
                    finally:
                        b = 2
                """);

        Stmt.Try stmt = (Stmt.Try) module.getFunctions().get(0).getBody().get(0);
        assertEquals(2, stmt.getHandlers().size());
        assertEquals("err", stmt.getHandlers().get(0).getName());
        assertInstanceOf(Expr.Sequence.class, stmt.getHandlers().get(0).getType());
        assertNull(stmt.getHandlers().get(1).getType());
        assertTrue(stmt.getOrelse().isEmpty());
        assertEquals(1, stmt.getFinalbody().size());
    }

    @Test
    void rejectedConstructsStayOpaque() {
        Module module = AstBuilder.parseModule("""
                def flow():
                    x += 1
                    with open(p) as f:
                        pass
                    del x
                """);

        assertEquals(List.of("augmented assignment", "with", "del"),
                module.getFunctions().get(0).getBody().stream().map(stmt -> ((Stmt.Opaque) stmt).getKind()).toList());
    }

    @Test
    void semicolonsAndLineJoining() {
        Module module = AstBuilder.parseModule("def flow():\n    a = 1; b = \\\n        2\n    return b\n");

        assertEquals(3, module.getFunctions().get(0).getBody().size());
    }

    @Test
    void syntaxErrorCarriesLine() {
        DslViolation e = assertThrows(DslViolation.class, () -> AstBuilder.parseModule("def flow():\n    x = = 1\n"));
        assertEquals(DslViolation.Kind.SYNTAX, e.getKind());
        assertEquals(2, e.getLine());
    }

    // ==================== expressions ====================

    @Test
    void numbers() {
        assertEquals(42L, constant("42"));
        assertEquals(5L, constant("0b101"));
        assertEquals(15L, constant("0o17"));
        assertEquals(1_000_000L, constant("1_000_000"));
        assertEquals(2.5, constant("2.5"));
        assertEquals(1000.0, constant("1e3"));
        assertEquals(-3L, constant("-3"));
        assertFalse(((Expr.Constant) expr("3j")).isRepresentable());
    }

    @Test
    void strings() {
        assertEquals("ab", constant("'a' \"b\""));
        assertEquals("tab\there", constant("'tab\\there'"));
        assertEquals("raw\\n", constant("r'raw\\n'"));
        assertEquals("\u00e9", constant("'\\u00e9'"));
        assertEquals("multi\nline", constant("'''multi\nline'''"));
        assertFalse(((Expr.Constant) expr("b'bytes'")).isRepresentable());
    }

    @Test
    void fStringParts() {
        Expr expr = expr("f'a {x} b {y!r:>4}' 'c'");

        assertInstanceOf(Expr.JoinedStr.class, expr);
        List<Expr> parts = ((Expr.JoinedStr) expr).getParts();
        assertEquals(5, parts.size());
        Expr.FormattedValue first = (Expr.FormattedValue) parts.get(1);
        assertEquals("x", ((Expr.Name) first.getValue()).getId());
        Expr.FormattedValue second = (Expr.FormattedValue) parts.get(3);
        assertEquals("r", second.getConversion());
        assertEquals(">4", second.getFormatSpec());
        assertEquals("c", ((Expr.Constant) parts.get(4)).getValue());
    }

    @Test
    void trailersBuildAttributeCallSubscript() {
        Expr expr = expr("AG.sub.run(x, *ys, key=1, **kw)[0]");

        assertInstanceOf(Expr.Subscript.class, expr);
        Expr.Call call = (Expr.Call) ((Expr.Subscript) expr).getValue();
        assertInstanceOf(Expr.Attribute.class, call.getFunc());
        assertEquals("run", ((Expr.Attribute) call.getFunc()).getAttr());
        assertEquals(2, call.getArgs().size());
        assertInstanceOf(Expr.Starred.class, call.getArgs().get(1));
        assertEquals(Arrays.asList("key", null), call.getKeywords().stream().map(Expr.Keyword::getName).toList());
        assertTrue(call.getKeywords().get(1).isDoubleStar());
    }

    @Test
    void displaysAndComprehensions() {
        assertEquals(Expr.SequenceKind.TUPLE, ((Expr.Sequence) expr("(1,)")).getKind());
        assertInstanceOf(Expr.Name.class, expr("(a)"));
        assertEquals(Expr.SequenceKind.SET, ((Expr.Sequence) expr("{1, 2}")).getKind());
        assertInstanceOf(Expr.Dict.class, expr("{}"));
        assertEquals(Expr.ComprehensionKind.DICT, ((Expr.Comprehension) expr("{k: v for k, v in items}")).getKind());
        assertEquals(Expr.ComprehensionKind.GENERATOR, ((Expr.Comprehension) expr("(x for x in xs)")).getKind());
    }

    @Test
    void operatorsKeepSourceText() {
        Expr expr = expr("a  +  b * c");

        assertInstanceOf(Expr.Operator.class, expr);
        assertEquals("a  +  b * c", expr.getText());
        assertInstanceOf(Expr.IfExp.class, expr("x if c else y"));
        assertEquals(Expr.OperatorKind.COMPARE, ((Expr.Operator) expr("a not in b")).getKind());
    }

    @Test
    void decoratedDefsAreFunctions() {
        Module module = AstBuilder.parseModule("""
                @first
                @second.attr(1)
                def flow():
                    pass
                """);

        assertEquals(List.of("flow"), module.getFunctions().stream().map(Stmt.FunctionDef::getName).toList());
    }

    @Test
    void nestingPastLimitIsTooDeep() {
        AstBuilder.parseModule("def flow():\n    a = ((1))\n", 5);
        DslViolation e = assertThrows(DslViolation.class,
                () -> AstBuilder.parseModule("def flow():\n    a = " + "(".repeat(10) + "1" + ")".repeat(10) + "\n", 5));

        assertEquals(DslViolation.Kind.TOO_DEEP, e.getKind());
        assertEquals(2, e.getLine());
    }
}
