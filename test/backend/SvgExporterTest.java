package backend;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import exception.CompileException;
import frontend.plangen.PlanAssembler;
import ir.Plan;

class SvgExporterTest {

    @Test
    void missingGraphvizWritesNothing(@TempDir Path dir) {
        Plan plan = PlanAssembler.compile("def flow():\n    return 1\n");
        Path target = dir.resolve("plan.svg");
        SvgExporter exporter = new SvgExporter("pydag-no-such-dot-executable");

        CompileException e = assertThrows(CompileException.class, () -> exporter.printToFile(plan, target));
        assertTrue(e.getMessage().contains("not found"), e.getMessage());
        assertFalse(Files.exists(target));
    }
}
