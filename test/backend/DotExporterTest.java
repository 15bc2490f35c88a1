package backend;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import frontend.plangen.PlanAssembler;

class DotExporterTest {

    @Test
    void nodesEdgesAndOutputs() {
        String dot = DotExporter.getInstance().printToString(PlanAssembler.compile("""
                def flow():
                    a = AG.op1()
                    b = AG.op2(a, key=a)
                    return b
                """));

        assertTrue(dot.startsWith("digraph plan {\n  rankdir=TB;\n"));
        assertTrue(dot.contains("\"a_1\" [label=\"AG.op1\", shape=box, style=filled, fillcolor=\""
                + NodeColors.colorFor("AG.op1") + "\"];"));
        assertTrue(dot.contains("\"out:return\" [label=\"return\", shape=note"));
        assertTrue(dot.contains("\"a_1\" -> \"b_1\" [label=\"a_1\"];"));
        assertTrue(dot.contains("\"b_1\" -> \"out:return\";"));
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    void quotesAreEscaped() {
        assertEquals("\"say \\\"hi\\\"\\\\\"", DotExporter.quote("say \"hi\"\\"));
    }
}
