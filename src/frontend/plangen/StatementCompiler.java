package frontend.plangen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import exception.DslViolation;
import frontend.ast.Expr;
import frontend.ast.Stmt;
import frontend.ast.StmtVisitor;
import ir.Opcode;
import ir.Output;
import ir.PlanBuilder;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Walks a function body in source order. Control flow forks the variable
 * table into tagged scopes and merges it back with PHI operations.
 */
public class StatementCompiler implements StmtVisitor<Void> {
    private static final Logger logger = LogManager.getLogger(StatementCompiler.class);

    public static final Pattern VALID_NAME = Pattern.compile("[a-z_][a-z0-9_]{0,63}");

    static final String CALL = "_call";
    static final String ITER = "_iter";
    static final String FOREACH = "_foreach";
    static final String BREAK = "_break";
    static final String RETURN_VALUE = "return_value";

    private static final String SETTINGS = "settings";
    private static final String OUTPUT = "output";

    private final PlanContext ctx;
    private final ExpressionEmitter emitter;

    private final List<Output> outputs = new ArrayList<>();
    private final Map<String, Object> settings = new LinkedHashMap<>();
    private String result = null;
    private int loopDepth = 0;

    public StatementCompiler(PlanContext ctx) {
        this.ctx = ctx;
        this.emitter = new ExpressionEmitter(ctx);
    }

    public void compile(List<Stmt> body) {
        for (Stmt stmt : body) {
            ctx.enter(stmt.getLine());
            try {
                stmt.accept(this);
            } finally {
                ctx.leave();
            }
        }
    }

    /** Explicit {@code output(...)} declarations, in source order. */
    public List<Output> getOutputs() {
        return outputs;
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    /** Id of the last value returned, or null when no return was compiled. */
    public String getResult() {
        return result;
    }

    private VariableTable table() {
        return ctx.getTable();
    }

    private PlanBuilder builder() {
        return ctx.getBuilder();
    }

    private static String checkName(String name, int line) {
        if (!VALID_NAME.matcher(name).matches()) {
            throw DslViolation.invalidIdentifier(name, line);
        }
        return name;
    }

    // ==================== simple statements ====================

    @Override
    public Void visit(Stmt.Assign stmt) {
        if (stmt.getTargets().size() != 1) {
            throw DslViolation.unsupportedStatement("chained assignment", stmt.getLine());
        }
        Expr target = stmt.getTargets().get(0);
        Expr value = stmt.getValue();

        if (target instanceof Expr.Name name) {
            String var = checkName(name.getId(), stmt.getLine());
            if (value instanceof Expr.Name source) {
                // y = x: no node, y now names x's value
                table().alias(var, table().resolve(source.getId(), source.getLine()));
            } else {
                emitter.emit(value, Target.variable(var));
            }
        } else if (target instanceof Expr.Subscript subscript) {
            assignItem(subscript, value, stmt.getLine());
        } else {
            throw DslViolation.unsupportedStatement(
                    "assignment targets must be simple names or subscripts: " + target.getText(), stmt.getLine());
        }
        return null;
    }

    /**
     * {@code container[key] = value}: a SET.item node becomes the container's
     * next version.
     */
    private void assignItem(Expr.Subscript subscript, Expr value, int line) {
        if (!(subscript.getValue() instanceof Expr.Name container)) {
            throw DslViolation.unsupportedStatement("subscript assignment needs a variable container: "
                    + subscript.getText(), line);
        }
        if (!LiteralMaterializer.isLiteral(subscript.getIndex())) {
            throw DslViolation.unsupportedStatement("subscript assignment keys must be literals: "
                    + subscript.getText(), line);
        }
        String name = checkName(container.getId(), line);
        String valueId = emitter.value(value);
        String containerId = table().resolve(name, line);

        Map<String, Object> args = new LinkedHashMap<>();
        args.put("key", LiteralMaterializer.toValue(subscript.getIndex()));
        String id = table().bind(name);
        builder().emit(id, Opcode.SET_ITEM, List.of(containerId, valueId), ExpressionEmitter.positional(2), args);
    }

    @Override
    public Void visit(Stmt.ExprStmt stmt) {
        Expr value = stmt.getValue();
        if (value instanceof Expr.Constant constant && constant.getValue() instanceof String) {
            // docstring
            return null;
        }
        Expr.Call call = null;
        if (value instanceof Expr.Call direct) {
            call = direct;
        } else if (value instanceof Expr.Await awaited && awaited.getValue() instanceof Expr.Call inner) {
            call = inner;
        }
        if (call == null) {
            throw DslViolation.unsupportedStatement("only call expressions are allowed as statements: "
                    + value.getText(), stmt.getLine());
        }

        String callee = ExpressionEmitter.calleeName(call.getFunc());
        if (callee.equals(SETTINGS)) {
            declareSettings(call);
        } else if (callee.equals(OUTPUT)) {
            declareOutput(call);
        } else {
            emitter.emit(value, Target.internal(CALL));
        }
        return null;
    }

    private void declareSettings(Expr.Call call) {
        if (!call.getArgs().isEmpty()) {
            throw DslViolation.invalidDeclaration("settings only accepts keyword literals", call.getLine());
        }
        for (Expr.Keyword keyword : call.getKeywords()) {
            if (keyword.isDoubleStar()) {
                throw DslViolation.invalidDeclaration("settings does not accept **kwargs", call.getLine());
            }
            if (!LiteralMaterializer.isLiteral(keyword.getValue())) {
                throw DslViolation.invalidDeclaration("settings values must be literals: "
                        + keyword.getValue().getText(), call.getLine());
            }
            settings.put(keyword.getName(), LiteralMaterializer.toValue(keyword.getValue()));
        }
    }

    private void declareOutput(Expr.Call call) {
        if (call.getArgs().size() != 1 || !(call.getArgs().get(0) instanceof Expr.Name var)) {
            throw DslViolation.invalidDeclaration("output requires a single variable name argument",
                    call.getLine());
        }
        String from = table().resolve(var.getId(), var.getLine());
        Object label = null;
        for (Expr.Keyword keyword : call.getKeywords()) {
            if (keyword.isDoubleStar() || !(keyword.getName().equals("as") || keyword.getName().equals("as_"))) {
                throw DslViolation.invalidDeclaration("output only accepts the 'as' keyword", call.getLine());
            }
            if (!LiteralMaterializer.isLiteral(keyword.getValue())) {
                throw DslViolation.invalidDeclaration("output label must be a string literal", call.getLine());
            }
            label = LiteralMaterializer.toValue(keyword.getValue());
        }
        if (!(label instanceof String as)) {
            throw DslViolation.invalidDeclaration("output requires as_=\"label\"", call.getLine());
        }
        outputs.add(new Output(from, as));
    }

    @Override
    public Void visit(Stmt.Return stmt) {
        Expr value = stmt.getValue();
        if (value instanceof Expr.Name name) {
            result = table().resolve(name.getId(), name.getLine());
        } else if (value != null && LiteralMaterializer.isLiteral(value)) {
            result = emitter.getLiterals().constant(LiteralMaterializer.toValue(value),
                    Target.internal(RETURN_VALUE));
        } else {
            throw DslViolation.invalidReturn("return must return a variable name or literal"
                    + (value == null ? "" : ", got " + value.getText()), stmt.getLine());
        }
        if (loopDepth > 0) {
            // leaving the loop early
            emitBreak();
        }
        return null;
    }

    @Override
    public Void visit(Stmt.Break stmt) {
        if (loopDepth == 0) {
            throw DslViolation.unsupportedStatement("'break' outside loop", stmt.getLine());
        }
        emitBreak();
        return null;
    }

    private void emitBreak() {
        builder().emitLeaf(table().mint(BREAK), Opcode.BREAK, Map.of());
    }

    @Override
    public Void visit(Stmt.Continue stmt) {
        return null;
    }

    @Override
    public Void visit(Stmt.Pass stmt) {
        return null;
    }

    @Override
    public Void visit(Stmt.FunctionDef stmt) {
        throw DslViolation.unsupportedStatement("nested function definition '" + stmt.getName() + "'",
                stmt.getLine());
    }

    @Override
    public Void visit(Stmt.Opaque stmt) {
        throw DslViolation.unsupportedStatement(stmt.getKind(), stmt.getLine());
    }

    // ==================== if / else ====================

    @Override
    public Void visit(Stmt.If stmt) {
        String cond = emitter.condition(stmt.getTest(), "if");
        ScopeContext scope = ctx.getScope();
        int n = scope.next(ScopeContext.IF);
        VariableTable outer = table();

        VariableTable thenTable = outer.fork();
        compileBranch(thenTable, "then" + n, cond, stmt.getBody());
        VariableTable elseTable = outer.fork();
        compileBranch(elseTable, "else" + n, cond, stmt.getOrelse());

        outer.absorbVersions(thenTable);
        outer.absorbVersions(elseTable);

        // only names both paths know can escape the conditional
        Map<String, String> thenExit = thenTable.snapshot();
        Map<String, String> elseExit = elseTable.snapshot();
        for (String name : VariableTable.diff(thenExit, elseExit)) {
            phi(outer, name, thenExit.get(name), elseExit.get(name));
        }
        return null;
    }

    private void compileBranch(VariableTable branch, String tag, String anchor, List<Stmt> body) {
        ctx.getScope().push(tag);
        VariableTable outer = table();
        ctx.setTable(branch);
        builder().armAnchor(anchor);
        try {
            compile(body);
        } finally {
            builder().disarmAnchor();
            ctx.setTable(outer);
            ctx.getScope().pop();
        }
    }

    private void phi(VariableTable into, String name, String first, String second) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("var", name);
        String id = into.bind(name);
        builder().emit(id, Opcode.PHI, List.of(first, second), ExpressionEmitter.positional(2), args);
        logger.trace("phi {} <- [{}, {}]", id, first, second);
    }

    // ==================== loops ====================

    @Override
    public Void visit(Stmt.For stmt) {
        if (!stmt.getOrelse().isEmpty()) {
            throw DslViolation.unsupportedStatement("for/else", stmt.getLine());
        }
        List<String> targets = loopTargets(stmt.getTarget(), stmt.getLine());
        boolean tuple = stmt.getTarget() instanceof Expr.Sequence;

        List<String> iterDeps = emitter.boundDeps(stmt.getIter());
        Map<String, Object> iterArgs = new LinkedHashMap<>();
        iterArgs.put("expr", stmt.getIter().getText());
        iterArgs.put("target", stmt.getTarget().getText());
        String iter = table().mint(ITER);
        builder().emit(iter, Opcode.ITER_EVAL.getOpName(), iterDeps, ExpressionEmitter.positional(iterDeps.size()),
                iterArgs, stmt.isAsync());

        int n = ctx.getScope().next(ScopeContext.FOR);
        VariableTable outer = table();
        Map<String, String> before = outer.snapshot();
        VariableTable body = outer.fork();

        ctx.getScope().push("for" + n);
        ctx.setTable(body);
        loopDepth++;
        try {
            for (int i = 0; i < targets.size(); i++) {
                Map<String, Object> args = new LinkedHashMap<>();
                args.put("target", targets.get(i));
                if (tuple) {
                    args.put("index", i);
                }
                builder().emit(body.bind(targets.get(i)), Opcode.ITER_ITEM, List.of(iter),
                        ExpressionEmitter.positional(1), args);
            }
            builder().armAnchor(iter);
            compile(stmt.getBody());
        } finally {
            builder().disarmAnchor();
            loopDepth--;
            ctx.setTable(outer);
            ctx.getScope().pop();
        }
        outer.absorbVersions(body);

        Map<String, Object> foreachArgs = new LinkedHashMap<>();
        foreachArgs.put("target", stmt.getTarget().getText());
        foreachArgs.put("expr", stmt.getIter().getText());
        List<String> foreachDeps = emitter.boundDeps(stmt.getIter());
        builder().emit(outer.mint(FOREACH), Opcode.COMP_FOREACH, foreachDeps,
                ExpressionEmitter.positional(foreachDeps.size()), foreachArgs);

        mergeLoop(outer, before, body.snapshot());
        return null;
    }

    private static List<String> loopTargets(Expr target, int line) {
        List<String> names = new ArrayList<>();
        if (target instanceof Expr.Name name) {
            names.add(checkName(name.getId(), line));
        } else if (target instanceof Expr.Sequence sequence && sequence.getKind() == Expr.SequenceKind.TUPLE) {
            for (Expr element : sequence.getElements()) {
                if (!(element instanceof Expr.Name name)) {
                    throw DslViolation.unsupportedStatement(
                            "loop targets must be a name or a flat tuple of names: " + target.getText(), line);
                }
                names.add(checkName(name.getId(), line));
            }
        } else {
            throw DslViolation.unsupportedStatement(
                    "loop targets must be a name or a flat tuple of names: " + target.getText(), line);
        }
        return names;
    }

    @Override
    public Void visit(Stmt.While stmt) {
        if (!stmt.getOrelse().isEmpty()) {
            throw DslViolation.unsupportedStatement("while/else", stmt.getLine());
        }
        String cond = emitter.condition(stmt.getTest(), "while");

        int n = ctx.getScope().next(ScopeContext.WHILE);
        VariableTable outer = table();
        Map<String, String> before = outer.snapshot();
        VariableTable body = outer.fork();

        loopDepth++;
        try {
            compileBranch(body, "while" + n, cond, stmt.getBody());
        } finally {
            loopDepth--;
        }
        outer.absorbVersions(body);

        mergeLoop(outer, before, body.snapshot());
        return null;
    }

    /**
     * Loop-carried names: bound before the loop and rebound in its body. The
     * PHI reads [before loop, end of body].
     */
    private void mergeLoop(VariableTable outer, Map<String, String> before, Map<String, String> bodyExit) {
        for (String name : VariableTable.diff(before, bodyExit)) {
            phi(outer, name, before.get(name), bodyExit.get(name));
        }
    }

    // ==================== try / except ====================

    @Override
    public Void visit(Stmt.Try stmt) {
        VariableTable working = table();
        VariableTable beforeTry = working.fork();

        compile(stmt.getBody());
        compile(stmt.getOrelse());

        for (Stmt.Handler handler : stmt.getHandlers()) {
            int n = ctx.getScope().next(ScopeContext.EXCEPT);
            // the body may have failed before binding anything
            VariableTable handlerTable = beforeTry.fork();
            handlerTable.absorbVersions(working);

            ctx.getScope().push("except" + n);
            ctx.setTable(handlerTable);
            try {
                if (handler.getName() != null) {
                    String name = checkName(handler.getName(), handler.getLine());
                    Map<String, Object> args = new LinkedHashMap<>();
                    args.put("types", exceptionTypes(handler.getType()));
                    builder().emitLeaf(handlerTable.bind(name), Opcode.EXC_CAUGHT, args);
                }
                compile(handler.getBody());
            } finally {
                ctx.setTable(working);
                ctx.getScope().pop();
            }
            working.absorbVersions(handlerTable);
        }

        // TODO: PHI-merge handler bindings with the try path; handlers currently never escape
        compile(stmt.getFinalbody());
        return null;
    }

    private static List<String> exceptionTypes(Expr type) {
        List<String> types = new ArrayList<>();
        if (type instanceof Expr.Sequence sequence) {
            for (Expr element : sequence.getElements()) {
                types.add(element.getText());
            }
        } else if (type != null) {
            types.add(type.getText());
        }
        return types;
    }
}
