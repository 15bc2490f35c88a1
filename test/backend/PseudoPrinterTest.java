package backend;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import frontend.plangen.PlanAssembler;
import ir.Plan;

class PseudoPrinterTest {

    @Test
    void oneLinePerOpAndOutput() {
        Plan plan = PlanAssembler.compile("""
                def flow():
                    a = AG.op1()
                    b = AG.op2(a, k=1)
                    return b
                """);

        assertEquals("""
                a_1 = AG.op1()
                b_1 = AG.op2(a_1, k=1)

                output(b_1, as="return")
                """, PseudoPrinter.getInstance().printToString(plan));
    }

    @Test
    void settingsLabelsAndSplats() {
        Plan plan = PlanAssembler.compile("""
                def flow():
                    settings(mode="fast", debug=True)
                    xs = AG.list()
                    kw = AG.opts()
                    r = AG.run(*xs, **kw, src=xs, tags=["a", None])
                    output(r, as_="result")
                """);

        assertEquals("""
                settings(mode="fast", debug=true)

                xs_1 = AG.list()
                kw_1 = AG.opts()
                r_1 = AG.run(*xs_1, **kw_1, src=xs_1, tags=["a",null])

                output(r_1, as="result")
                """, PseudoPrinter.getInstance().printToString(plan));
    }

    @Test
    void writesFile(@TempDir Path dir) throws Exception {
        Plan plan = PlanAssembler.compile("def flow():\n    return 1\n");
        Path file = dir.resolve("plan.pseudo");

        PseudoPrinter.getInstance().printToFile(plan, file);

        assertEquals("return_value_1 = CONST.value(value=1)\n\n"
                + "output(return_value_1, as=\"return\")\n", Files.readString(file));
    }
}
