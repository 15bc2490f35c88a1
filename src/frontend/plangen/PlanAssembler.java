package frontend.plangen;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import exception.DslViolation;
import frontend.ast.AstBuilder;
import frontend.ast.Module;
import frontend.ast.Stmt;
import ir.Opcode;
import ir.Operation;
import ir.Output;
import ir.Plan;
import ir.PlanBuilder;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Source text to {@link Plan}: picks the function, checks its signature,
 * compiles the body and resolves outputs.
 */
public class PlanAssembler {
    private static final Logger logger = LogManager.getLogger(PlanAssembler.class);

    static final String EXIT = "_exit";

    private final CompilerConfig config;

    public PlanAssembler() {
        this(CompilerConfig.defaultConfig());
    }

    public PlanAssembler(CompilerConfig config) {
        this.config = config.copy();
    }

    /** Compile with default options, auto-detecting the function. */
    public static Plan compile(String source) {
        return new PlanAssembler().assemble(source, null);
    }

    public static Plan compile(String source, String functionName) {
        return new PlanAssembler().assemble(source, functionName);
    }

    /**
     * @param functionName function to compile; null tries every definition in
     *                     source order and keeps the first that compiles
     */
    public Plan assemble(String source, String functionName) {
        if (source.length() > config.getMaxSourceLength()) {
            throw DslViolation.sourceTooLarge(source.length(), config.getMaxSourceLength());
        }
        Module module = AstBuilder.parseModule(source, config.getMaxDepth());
        List<Stmt.FunctionDef> candidates = module.getFunctions();

        if (functionName != null) {
            for (Stmt.FunctionDef fn : candidates) {
                if (fn.getName().equals(functionName)) {
                    return assemble(fn);
                }
            }
            throw DslViolation.functionNotFound(functionName);
        }

        if (candidates.isEmpty()) {
            throw DslViolation.noFunction();
        }
        DslViolation last = null;
        for (Stmt.FunctionDef fn : candidates) {
            try {
                return assemble(fn);
            } catch (DslViolation e) {
                logger.debug("candidate '{}' rejected: {}", fn.getName(), e.getMessage());
                last = e;
            }
        }
        if (candidates.size() == 1) {
            throw last;
        }
        throw DslViolation.ambiguous(last);
    }

    /**
     * One compilation attempt over one function definition.
     */
    public Plan assemble(Stmt.FunctionDef fn) {
        if (!fn.getParams().isEmpty()) {
            throw DslViolation.parameters(fn.getName(), fn.getLine());
        }

        PlanContext ctx = new PlanContext(config);
        StatementCompiler compiler = new StatementCompiler(ctx);
        compiler.compile(fn.getBody());

        PlanBuilder builder = ctx.getBuilder();
        String result = compiler.getResult();
        if (result == null && endsInControlFlow(fn.getBody())) {
            emitExit(ctx);
        }

        List<Output> outputs = new ArrayList<>(compiler.getOutputs());
        if (outputs.isEmpty()) {
            if (result == null) {
                if (config.isRequireResult()) {
                    throw DslViolation.noResult(fn.getName());
                }
                result = ctx.getTable().mint(StatementCompiler.RETURN_VALUE);
                builder.emitConst(result, null);
            }
            outputs.add(new Output(result, Output.RETURN_LABEL));
        }

        Plan plan = new Plan(fn.getName(), builder.getOps(), outputs, compiler.getSettings());
        logger.info("compiled '{}': {} ops, {} outputs", fn.getName(), plan.getOps().size(),
                plan.getOutputs().size());
        return plan;
    }

    private static boolean endsInControlFlow(List<Stmt> body) {
        if (body.isEmpty()) {
            return false;
        }
        Stmt last = body.get(body.size() - 1);
        return last instanceof Stmt.If || last instanceof Stmt.For || last instanceof Stmt.While
                || last instanceof Stmt.Try;
    }

    /** Terminal marker after the last op, so fallthrough shows in the graph. */
    private static void emitExit(PlanContext ctx) {
        PlanBuilder builder = ctx.getBuilder();
        List<String> deps = new ArrayList<>();
        if (builder.size() > 0) {
            Operation lastOp = builder.getOps().get(builder.size() - 1);
            deps.add(lastOp.getId());
        }
        builder.emit(ctx.getTable().mint(EXIT), Opcode.EXIT, deps, ExpressionEmitter.positional(deps.size()),
                Map.of());
    }
}
