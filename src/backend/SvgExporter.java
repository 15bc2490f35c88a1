package backend;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import exception.CompileException;
import ir.Plan;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Renders a plan to SVG by piping its DOT text through Graphviz.
 * Nothing is written unless {@code dot} succeeds.
 */
public class SvgExporter {
    private static final Logger logger = LogManager.getLogger(SvgExporter.class);
    public static final String DEFAULT_EXECUTABLE = "dot";

    private final String executable;

    public SvgExporter() {
        this(DEFAULT_EXECUTABLE);
    }

    public SvgExporter(String executable) {
        this.executable = executable;
    }

    public String printToString(Plan plan) {
        String dot = DotExporter.getInstance().printToString(plan);
        Process process = start();
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(dot.getBytes(StandardCharsets.UTF_8));
            }
            ByteArrayOutputStream stdout = new ByteArrayOutputStream();
            ByteArrayOutputStream stderr = new ByteArrayOutputStream();
            Thread errPump = new Thread(() -> pump(process.getErrorStream(), stderr));
            errPump.start();
            pump(process.getInputStream(), stdout);
            int code = process.waitFor();
            errPump.join();
            if (code != 0) {
                throw new CompileException("Graphviz exited with code " + code + ": "
                        + stderr.toString(StandardCharsets.UTF_8).trim());
            }
            return stdout.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("talking to " + executable, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompileException("interrupted while waiting for " + executable, e);
        } finally {
            process.destroy();
        }
    }

    private Process start() {
        try {
            return new ProcessBuilder(List.of(executable, "-Tsvg")).start();
        } catch (IOException e) {
            throw CompileException.toolMissing(
                    "Graphviz '" + executable + "' executable not found; install Graphviz to export SVG");
        }
    }

    /**
     * @return the written path
     */
    public Path printToFile(Plan plan, Path file) {
        String svg = printToString(plan);
        try {
            Files.writeString(file, svg, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("cannot write " + file, e);
        }
        logger.debug("wrote {}", file);
        return file;
    }

    private static void pump(InputStream in, ByteArrayOutputStream out) {
        try {
            in.transferTo(out);
        } catch (IOException e) {
            logger.warn("lost process output: {}", e.getMessage());
        }
    }
}
