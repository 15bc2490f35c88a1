package backend;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import frontend.plangen.PlanAssembler;
import ir.Operation;
import ir.Output;
import ir.Plan;

class GraphRendererTest {
    private final GraphRenderer renderer = GraphRenderer.getInstance();

    private static String label(PresentationGraph graph, String from, String to) {
        for (PresentationGraph.Edge edge : graph.getEdges()) {
            if (edge.getFrom().equals(from) && edge.getTo().equals(to)) {
                return edge.getLabel();
            }
        }
        throw new AssertionError("no edge " + from + " -> " + to + " in " + graph.getEdges());
    }

    @Test
    void controlNodesAreNotes() {
        PresentationGraph graph = renderer.render(PlanAssembler.compile("""
                def flow():
                    a = AG.a()
                    items = AG.list()
                    for item in items:
                        a = AG.step(a, item)
                    if a > 2:
                        b = AG.x()
                    else:
                        b = AG.y()
                    return b
                """));

        assertEquals("FOR items", graph.getNode("_iter_1").getLabel());
        assertEquals("IF a > 2", graph.getNode("_cond_1").getLabel());
        assertEquals("PHI (a)", graph.getNode("a_3").getLabel());
        assertEquals("note", graph.getNode("_cond_1").getCssClass());
        assertEquals("op", graph.getNode("a_1").getCssClass());
        assertEquals("AG.a", graph.getNode("a_1").getLabel());
        assertTrue(graph.getNode("out:return").isOutput());
    }

    @Test
    void edgeLabelPreference() {
        PresentationGraph graph = renderer.render(PlanAssembler.compile("""
                def flow():
                    a = AG.a()
                    items = AG.list()
                    for item in items:
                        AG.use(item)
                    if a:
                        b = AG.x(src=a)
                    else:
                        b = AG.y(a)
                    c = AG.start()
                    while c:
                        c = AG.next(c)
                    d = {"key": a}
                    return d
                """));

        assertEquals("src", label(graph, "a_1", "b_1@then1"));
        assertEquals("then", label(graph, "_cond_1", "b_1@then1"));
        assertEquals("else", label(graph, "_cond_1", "b_1@else1"));
        assertEquals("cond", label(graph, "_cond_2", "c_2@while1"));
        assertEquals("item", label(graph, "_iter_1", "item_1@for1"));
        assertEquals("key", label(graph, "a_1", "d_1"));
        assertEquals("a_1", label(graph, "a_1", "b_1@else1"));
        assertTrue(label(graph, "d_1", "out:return").isEmpty());
    }

    @Test
    void repeatedDependenciesYieldOneEdge() {
        PresentationGraph graph = renderer.render(PlanAssembler.compile("""
                def flow():
                    a = AG.a()
                    r = AG.pair(a, a, other=a)
                    return r
                """));

        assertEquals(1, graph.edgesInto("r_1").size());
        assertEquals("a_1", graph.edgesInto("r_1").get(0).getLabel());
    }

    @Test
    void userOpsWithoutArgsStillRender() {
        Plan plan = new Plan("f", List.of(new Operation("x_1", "CUSTOM.op", List.of(), Map.of(), List.of(), false)),
                List.of(new Output("x_1", "out")), Map.of());

        PresentationGraph graph = renderer.render(plan);

        assertEquals(List.of("x_1", "out:out"), graph.getNodes().stream().map(PresentationGraph.Node::getId).toList());
        assertEquals(1, graph.toJsonTree().getAsJsonArray("edges").size());
    }
}
