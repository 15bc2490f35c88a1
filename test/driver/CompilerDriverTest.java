package driver;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import exception.CompileException;

class CompilerDriverTest {

    private static final String SOURCE = """
            def flow():
                a = AG.op1()
                b = AG.op2(a, k=1)
                return b
            """;

    @Test
    void parsesFlags() {
        CompilerDriver driver = new CompilerDriver();
        driver.parseArgs(new String[] { "plan.py", "--func", "flow", "-o", "out", "--html", "--dot" });

        assertEquals("plan.py", driver.getSource());
        assertEquals("flow", driver.getFunction());
        assertEquals(Path.of("out"), driver.getOutputDir());
        assertTrue(driver.isEmitHtml());
        assertTrue(driver.isEmitDot());
        assertFalse(driver.isEmitSvg());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(CompileException.class, () -> new CompilerDriver().parseArgs(new String[] {}));
        CompileException e = assertThrows(CompileException.class,
                () -> new CompilerDriver().parseArgs(new String[] { "plan.py", "--bogus" }));
        assertTrue(e.getMessage().contains("--bogus"), e.getMessage());
        assertThrows(CompileException.class, () -> new CompilerDriver().parseArgs(new String[] { "plan.py", "-o" }));
        assertThrows(CompileException.class, () -> new CompilerDriver().parseArgs(new String[] { "a.py", "b.py" }));
        assertThrows(CompileException.class, () -> new CompilerDriver().parseArgs(new String[] { "--html" }));
    }

    @Test
    void exitCodes(@TempDir Path dir) throws Exception {
        Path good = dir.resolve("good.py");
        Files.writeString(good, SOURCE);
        Path bad = dir.resolve("bad.py");
        Files.writeString(bad, "def flow(a):\n    return a\n");
        Path out = dir.resolve("out");

        assertEquals(CompilerDriver.EXIT_OK,
                CompilerDriver.execute(new String[] { good.toString(), "-o", out.toString() }));
        assertEquals(CompilerDriver.EXIT_VIOLATION,
                CompilerDriver.execute(new String[] { bad.toString(), "-o", out.toString() }));
        assertEquals(CompilerDriver.EXIT_VIOLATION,
                CompilerDriver.execute(new String[] { dir.resolve("missing.py").toString() }));
        assertEquals(CompilerDriver.EXIT_USAGE, CompilerDriver.execute(new String[] { "--nope" }));
    }

    @Test
    void deepNestingIsAViolation(@TempDir Path dir) throws Exception {
        Path deep = dir.resolve("deep.py");
        Files.writeString(deep, "def flow():\n    a = " + "(".repeat(5000) + "1" + ")".repeat(5000) + "\n    return a\n");

        assertEquals(CompilerDriver.EXIT_VIOLATION,
                CompilerDriver.execute(new String[] { deep.toString(), "-o", dir.resolve("out").toString() }));
    }

    @Test
    void writesRequestedArtifacts(@TempDir Path dir) throws Exception {
        Path source = dir.resolve("plan.py");
        Files.writeString(source, SOURCE);
        Path out = dir.resolve("build");

        CompilerDriver driver = new CompilerDriver();
        driver.parseArgs(new String[] { source.toString(), "-o", out.toString(), "--html", "--dot" });
        var written = driver.run();

        assertEquals(List.of(out.resolve("plan.json"), out.resolve("plan.pseudo"), out.resolve("plan.html"),
                out.resolve("plan.dot")), written);
        assertTrue(Files.readString(out.resolve("plan.json")).contains("\"function\": \"flow\""));
        assertTrue(Files.readString(out.resolve("plan.pseudo")).contains("b_1 = AG.op2(a_1, k=1)"));
    }
}
