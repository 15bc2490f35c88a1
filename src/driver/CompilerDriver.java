package driver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import backend.DotExporter;
import backend.HtmlExporter;
import backend.PseudoPrinter;
import backend.SvgExporter;
import exception.CompileException;
import exception.DslViolation;
import frontend.plangen.PlanAssembler;
import ir.Plan;
import ir.PlanSerializer;
import util.logging.LogLevel;
import util.logging.LogManager;
import util.logging.Logger;

public class CompilerDriver {
    private static final Logger logger = LogManager.getLogger(CompilerDriver.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_VIOLATION = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = "usage: CompilerDriver FILE [--func NAME] [-o DIR] [--html] [--svg] [--dot] [--debug]";

    private String source = null;
    private String function = null;
    private Path outputDir = Path.of(".");
    private boolean emitHtml = false;
    private boolean emitSvg = false;
    private boolean emitDot = false;
    private boolean debug = false;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Runs one command line and maps the outcome to a process exit code.
     */
    public static int execute(String[] args) {
        CompilerDriver driver = new CompilerDriver();
        try {
            driver.parseArgs(args);
        } catch (CompileException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        try {
            driver.run();
            return EXIT_OK;
        } catch (DslViolation e) {
            logger.error("{}: {}", driver.source, e.getMessage());
            System.err.println(driver.source + ": " + e.getMessage());
            return EXIT_VIOLATION;
        } catch (CompileException e) {
            logger.error("{}: {}", driver.source, e.getMessage());
            System.err.println(e.getMessage());
            return EXIT_VIOLATION;
        }
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws CompileException {
        if (args == null || args.length == 0) {
            throw CompileException.noArgs();
        }
        var cmds = Arrays.asList(args);
        var iter = cmds.iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        outputDir = Path.of(iter.next());
                    } else {
                        throw CompileException.wrongArgs("Need arg after -o");
                    }
                }
                case "--func" -> {
                    if (iter.hasNext()) {
                        function = iter.next();
                    } else {
                        throw CompileException.wrongArgs("Need arg after --func");
                    }
                }
                case "--html" -> {
                    emitHtml = true;
                }
                case "--svg" -> {
                    emitSvg = true;
                }
                case "--dot" -> {
                    emitDot = true;
                }
                case "--debug" -> {
                    debug = true;
                }
                default -> {
                    if (cmd.startsWith("-") || source != null) {
                        throw CompileException.wrongArgs(cmd);
                    }
                    source = cmd;
                }
            }
        }
        if (source == null) {
            throw CompileException.wrongArgs("no source file given");
        }
    }

    /*
     * compile the source and write every requested artifact into the output directory
     */
    public List<Path> run() {
        if (debug || Config.getInstance().isDebug) {
            LogManager.setRootLevel(LogLevel.DEBUG);
            LogManager.enableConsole();
        }
        LogManager.setSourceTag(source);

        String text;
        try {
            text = Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("cannot read " + source, e);
        }

        PlanAssembler assembler = new PlanAssembler(Config.getInstance().toCompilerConfig());
        Plan plan = assembler.assemble(text, function);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw CompileException.io("cannot create " + outputDir, e);
        }

        List<Path> written = new ArrayList<>();
        Path json = outputDir.resolve("plan.json");
        try {
            Files.writeString(json, PlanSerializer.toJson(plan), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw CompileException.io("cannot write " + json, e);
        }
        written.add(json);

        Path pseudo = outputDir.resolve("plan.pseudo");
        PseudoPrinter.getInstance().printToFile(plan, pseudo);
        written.add(pseudo);

        if (emitHtml) {
            written.add(HtmlExporter.getInstance().printToFile(plan, outputDir.resolve("plan.html")));
        }
        if (emitDot) {
            Path dot = outputDir.resolve("plan.dot");
            DotExporter.getInstance().printToFile(plan, dot);
            written.add(dot);
        }
        if (emitSvg) {
            written.add(new SvgExporter().printToFile(plan, outputDir.resolve("plan.svg")));
        }
        logger.info("wrote {}", written);
        return written;
    }

    public String getSource() {
        return source;
    }

    public String getFunction() {
        return function;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isEmitHtml() {
        return emitHtml;
    }

    public boolean isEmitSvg() {
        return emitSvg;
    }

    public boolean isEmitDot() {
        return emitDot;
    }
}
