package frontend.plangen;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import frontend.ast.AstBuilder;

class FreeVariablesTest {

    private static java.util.List<String> free(String text) {
        return FreeVariables.of(AstBuilder.parseExpression(text, 1));
    }

    @Test
    void sourceOrderWithoutDuplicates() {
        assertEquals(List.of("a", "b", "c"), free("a + b * a - c"));
    }

    @Test
    void callsIncludeCalleeRoot() {
        assertEquals(List.of("AG", "x", "y"), free("AG.run(x, key=y)"));
    }

    @Test
    void comprehensionTargetsAreLocal() {
        assertEquals(List.of("f", "n", "items", "limit"), free("[f(item, n) for item in items if item > limit]"));
    }

    @Test
    void lambdaParametersAreLocal() {
        assertEquals(List.of("y"), free("lambda x, *rest: x + y"));
    }

    @Test
    void boundKeepsOnlyNamesWithBindings() {
        VariableTable table = new VariableTable(new ScopeContext());
        table.bind("count");

        assertEquals(List.of("count"), FreeVariables.bound(AstBuilder.parseExpression("count > limit", 1), table));
    }
}
