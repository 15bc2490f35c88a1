package frontend.plangen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exception.DslViolation;
import frontend.ast.Expr;
import frontend.ast.ExprVisitor;
import ir.Opcode;
import ir.Operation;
import ir.PlanBuilder;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Lowers one expression to an SSA id: either the existing binding of a name
 * or the id of a freshly emitted operation.
 */
public class ExpressionEmitter {
    private static final Logger logger = LogManager.getLogger(ExpressionEmitter.class);

    static final String CONST = "_const";
    static final String COND = "_cond";
    static final String TERNARY = "_ternary";
    static final String TMP = "_tmp";

    private final PlanContext ctx;
    private final LiteralMaterializer literals;

    public ExpressionEmitter(PlanContext ctx) {
        this.ctx = ctx;
        this.literals = new LiteralMaterializer(ctx, this);
    }

    public LiteralMaterializer getLiterals() {
        return literals;
    }

    /**
     * Lower {@code expr}; a new operation, if any, gets its id from {@code target}.
     */
    public String emit(Expr expr, Target target) {
        ctx.enter(expr.getLine());
        try {
            return expr.accept(new Lowering(target));
        } finally {
            ctx.leave();
        }
    }

    /**
     * Lower a nested operand. Names resolve to their binding, literals become
     * {@code _const} nodes, anything else a {@code _tmp} node.
     */
    public String value(Expr expr) {
        if (expr instanceof Expr.Name name) {
            return resolve(name);
        }
        if (LiteralMaterializer.isLiteral(expr)) {
            return emit(expr, Target.internal(CONST));
        }
        return emit(expr, Target.internal(TMP));
    }

    /**
     * Emit {@code COND.eval} for an if / while / ternary test. Its deps are the
     * bound names the test reads.
     */
    public String condition(Expr test, String kind) {
        List<String> deps = boundDeps(test);
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("kind", kind);
        args.put("expr", test.getText());
        String id = table().mint(COND);
        builder().emit(id, Opcode.COND_EVAL, deps, positional(deps.size()), args);
        return id;
    }

    /** Ids of the already-bound free names of {@code expr}, in source order. */
    public List<String> boundDeps(Expr expr) {
        List<String> deps = new ArrayList<>();
        for (String name : FreeVariables.bound(expr, table())) {
            deps.add(table().lookup(name));
        }
        return deps;
    }

    public static List<String> positional(int count) {
        return new ArrayList<>(Collections.nCopies(count, Operation.POSITIONAL));
    }

    /**
     * Dotted operation name of a callee: a bare name or an attribute chain
     * ending in a name.
     */
    public static String calleeName(Expr func) {
        List<String> parts = new ArrayList<>();
        Expr current = func;
        while (current instanceof Expr.Attribute attribute) {
            parts.add(0, attribute.getAttr());
            current = attribute.getValue();
        }
        if (!(current instanceof Expr.Name name)) {
            throw DslViolation.invalidCallee(func.getText(), func.getLine());
        }
        parts.add(0, name.getId());
        return String.join(".", parts);
    }

    private VariableTable table() {
        return ctx.getTable();
    }

    private PlanBuilder builder() {
        return ctx.getBuilder();
    }

    private String resolve(Expr.Name name) {
        return table().resolve(name.getId(), name.getLine());
    }

    // ==================== calls ====================

    private String call(Expr.Call call, Target target, boolean awaited) {
        String opName = calleeName(call.getFunc());
        List<String> deps = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        Map<String, Object> args = new LinkedHashMap<>();

        for (Expr arg : call.getArgs()) {
            if (arg instanceof Expr.Starred starred) {
                splat(starred, deps, labels);
            } else if (arg instanceof Expr.Name name) {
                deps.add(resolve(name));
                labels.add(Operation.POSITIONAL);
            } else if (LiteralMaterializer.isLiteral(arg)) {
                deps.add(literals.constant(LiteralMaterializer.toValue(arg), Target.internal(CONST)));
                labels.add(Operation.POSITIONAL);
            } else if (arg instanceof Expr.Sequence sequence && sequence.getKind() != Expr.SequenceKind.SET) {
                // f([a, b]) depends on a and b
                for (Expr element : sequence.getElements()) {
                    deps.add(value(element));
                    labels.add(Operation.POSITIONAL);
                }
            } else {
                deps.add(value(arg));
                labels.add(Operation.POSITIONAL);
            }
        }

        for (Expr.Keyword keyword : call.getKeywords()) {
            Expr value = keyword.getValue();
            if (keyword.isDoubleStar()) {
                doubleSplat(value, deps, labels, args);
            } else if (value instanceof Expr.Name name) {
                deps.add(resolve(name));
                labels.add(keyword.getName());
            } else if (LiteralMaterializer.isLiteral(value)) {
                Object literal = LiteralMaterializer.toValue(value);
                args.put(keyword.getName(), literal);
                if (ctx.getConfig().isBoxKeywordLiterals()) {
                    deps.add(literals.constant(literal, Target.internal(CONST)));
                    labels.add(keyword.getName());
                }
            } else {
                deps.add(value(value));
                labels.add(keyword.getName());
            }
        }

        String id = target.claim(table());
        builder().emit(id, opName, deps, labels, args, awaited);
        return id;
    }

    private void splat(Expr.Starred starred, List<String> deps, List<String> labels) {
        Expr inner = starred.getValue();
        if (inner instanceof Expr.Name name) {
            String id = resolve(name);
            List<String> elements = LiteralMaterializer.packedElements(builder(), id);
            if (elements == null) {
                deps.add(id);
                labels.add(Operation.SPLAT);
            } else {
                for (String element : elements) {
                    deps.add(element);
                    labels.add(Operation.SPLAT);
                }
            }
        } else if (inner instanceof Expr.Sequence sequence && sequence.getKind() != Expr.SequenceKind.SET) {
            for (Expr element : sequence.getElements()) {
                if (!(element instanceof Expr.Name name)) {
                    throw DslViolation.invalidSplat("Starred list/tuple elements must be names: "
                            + starred.getText(), starred.getLine());
                }
                deps.add(resolve(name));
                labels.add(Operation.SPLAT);
            }
        } else {
            throw DslViolation.invalidSplat("*args must be a name or list/tuple of names: " + starred.getText(),
                    starred.getLine());
        }
    }

    private void doubleSplat(Expr value, List<String> deps, List<String> labels, Map<String, Object> args) {
        if (value instanceof Expr.Dict dict && LiteralMaterializer.isLiteral(dict)) {
            args.putAll(LiteralMaterializer.dictValue(dict));
        } else if (value instanceof Expr.Name name) {
            deps.add(resolve(name));
            labels.add(Operation.DOUBLE_SPLAT);
        } else {
            throw DslViolation.invalidSplat("**kwargs must be a dict literal or a variable name: "
                    + value.getText(), value.getLine());
        }
    }

    // ==================== one visitor per emit ====================

    private class Lowering implements ExprVisitor<String> {
        private final Target target;

        Lowering(Target target) {
            this.target = target;
        }

        @Override
        public String visit(Expr.Name expr) {
            return resolve(expr);
        }

        @Override
        public String visit(Expr.Constant expr) {
            return literals.materialize(expr, target);
        }

        @Override
        public String visit(Expr.Sequence expr) {
            return literals.materialize(expr, target);
        }

        @Override
        public String visit(Expr.Dict expr) {
            return literals.materialize(expr, target);
        }

        @Override
        public String visit(Expr.Call expr) {
            return call(expr, target, false);
        }

        @Override
        public String visit(Expr.Attribute expr) {
            throw DslViolation.unsupportedExpression("attribute access outside a call: " + expr.getText(),
                    expr.getLine());
        }

        @Override
        public String visit(Expr.Subscript expr) {
            if (!LiteralMaterializer.isLiteral(expr.getIndex())) {
                throw DslViolation.unsupportedExpression("subscript keys must be literals: " + expr.getText(),
                        expr.getLine());
            }
            String base = value(expr.getValue());
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("key", LiteralMaterializer.toValue(expr.getIndex()));
            String id = target.claim(table());
            builder().emit(id, Opcode.GET_ITEM, List.of(base), positional(1), args);
            return id;
        }

        @Override
        public String visit(Expr.Slice expr) {
            throw DslViolation.unsupportedExpression("slice: " + expr.getText(), expr.getLine());
        }

        @Override
        public String visit(Expr.Await expr) {
            if (!(expr.getValue() instanceof Expr.Call awaitedCall)) {
                throw DslViolation.unsupportedExpression("await only applies to calls: " + expr.getText(),
                        expr.getLine());
            }
            return call(awaitedCall, target, true);
        }

        @Override
        public String visit(Expr.Starred expr) {
            throw DslViolation.unsupportedExpression("starred expression outside a call: " + expr.getText(),
                    expr.getLine());
        }

        @Override
        public String visit(Expr.FormattedValue expr) {
            throw DslViolation.unsupportedExpression("f-strings may only contain variable names: "
                    + expr.getText(), expr.getLine());
        }

        @Override
        public String visit(Expr.JoinedStr expr) {
            StringBuilder template = new StringBuilder();
            List<String> deps = new ArrayList<>();
            for (Expr part : expr.getParts()) {
                if (part instanceof Expr.Constant constant) {
                    template.append(constant.getValue());
                    continue;
                }
                Expr.FormattedValue slot = (Expr.FormattedValue) part;
                if (slot.getConversion() != null || slot.getFormatSpec() != null
                        || !(slot.getValue() instanceof Expr.Name name)) {
                    throw DslViolation.unsupportedExpression("f-strings may only contain variable names: "
                            + slot.getText(), expr.getLine());
                }
                deps.add(resolve(name));
                template.append('{').append(deps.size() - 1).append('}');
            }
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("template", template.toString());
            String id = target.claim(table());
            builder().emit(id, Opcode.TEXT_FORMAT, deps, positional(deps.size()), args);
            return id;
        }

        @Override
        public String visit(Expr.Comprehension expr) {
            // never unrolled: one node reading every bound free name
            List<String> deps = boundDeps(expr);
            String id = target.claim(table());
            builder().emit(id, "COMP." + expr.getKind().getOpSuffix(), deps, positional(deps.size()), Map.of(),
                    false);
            return id;
        }

        @Override
        public String visit(Expr.IfExp expr) {
            String cond = condition(expr.getTest(), "ternary");

            builder().armAnchor(cond);
            String whenTrue = value(expr.getBody());
            builder().disarmAnchor();

            builder().armAnchor(cond);
            String whenFalse = value(expr.getOrelse());
            builder().disarmAnchor();

            Target phiTarget = target.isVariable() ? target : Target.internal(TERNARY);
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("var", phiTarget.getName());
            String id = phiTarget.claim(table());
            builder().emit(id, Opcode.PHI, List.of(whenTrue, whenFalse), positional(2), args);
            logger.trace("ternary phi {} <- [{}, {}]", id, whenTrue, whenFalse);
            return id;
        }

        @Override
        public String visit(Expr.Operator expr) {
            // no decomposition: one node with the expression text
            List<String> deps = boundDeps(expr);
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("expr", expr.getText());
            String id = target.claim(table());
            builder().emit(id, Opcode.EXPR_EVAL, deps, positional(deps.size()), args);
            return id;
        }

        @Override
        public String visit(Expr.Lambda expr) {
            throw DslViolation.unsupportedExpression("lambda: " + expr.getText(), expr.getLine());
        }
    }
}
