package frontend.plangen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exception.DslViolation;
import frontend.ast.Expr;
import frontend.ast.Expr.SequenceKind;
import ir.Opcode;
import ir.Operation;
import ir.PlanBuilder;

/**
 * Constant shapes to plan values.
 *
 * A JSON-representable tree (numbers, strings, booleans, None, lists, tuples
 * and dicts of those) becomes one {@code CONST.value}. A list or tuple of bound
 * names becomes {@code PACK.list} / {@code PACK.tuple}; a dict with literal
 * keys and computed values becomes {@code PACK.dict}.
 */
public class LiteralMaterializer {
    private final PlanContext ctx;
    private final ExpressionEmitter emitter;

    public LiteralMaterializer(PlanContext ctx, ExpressionEmitter emitter) {
        this.ctx = ctx;
        this.emitter = emitter;
    }

    // ==================== pure literal checks ====================

    public static boolean isLiteral(Expr expr) {
        if (expr instanceof Expr.Constant constant) {
            return constant.isRepresentable();
        }
        if (expr instanceof Expr.Sequence sequence) {
            if (sequence.getKind() == SequenceKind.SET) {
                return false;
            }
            for (Expr element : sequence.getElements()) {
                if (!isLiteral(element)) {
                    return false;
                }
            }
            return true;
        }
        if (expr instanceof Expr.Dict dict) {
            for (int i = 0; i < dict.getValues().size(); i++) {
                Expr key = dict.getKeys().get(i);
                if (key == null || !isScalarLiteral(key) || !isLiteral(dict.getValues().get(i))) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static boolean isScalarLiteral(Expr expr) {
        return expr instanceof Expr.Constant constant && constant.isRepresentable();
    }

    /**
     * The plain value of a literal tree: null, Boolean, Long, BigInteger,
     * Double, String, List or Map with String keys.
     */
    public static Object toValue(Expr expr) {
        if (expr instanceof Expr.Constant constant && constant.isRepresentable()) {
            return constant.getValue();
        }
        if (expr instanceof Expr.Sequence sequence && sequence.getKind() != SequenceKind.SET) {
            List<Object> values = new ArrayList<>();
            for (Expr element : sequence.getElements()) {
                values.add(toValue(element));
            }
            return values;
        }
        if (expr instanceof Expr.Dict dict) {
            return dictValue(dict);
        }
        throw DslViolation.unsupportedLiteral(
                "values must be JSON-serialisable literals, got " + expr.getText(), expr.getLine());
    }

    /**
     * The plain value of a literal dict, keys spelled as JSON object keys.
     */
    public static Map<String, Object> dictValue(Expr.Dict dict) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < dict.getValues().size(); i++) {
            Expr key = dict.getKeys().get(i);
            if (key == null) {
                throw DslViolation.unsupportedLiteral("dict unpacking in a literal: " + dict.getText(),
                        dict.getLine());
            }
            values.put(keyOf(key), toValue(dict.getValues().get(i)));
        }
        return values;
    }

    /** JSON object key for a scalar literal key, spelled the way JSON encoders do. */
    static String keyOf(Expr key) {
        if (!isScalarLiteral(key)) {
            throw DslViolation.unsupportedLiteral("dict keys must be scalar literals, got " + key.getText(),
                    key.getLine());
        }
        Object value = ((Expr.Constant) key).getValue();
        if (value == null) {
            return "null";
        }
        return String.valueOf(value);
    }

    // ==================== emission ====================

    /**
     * Lower a constant, list/tuple/set or dict display.
     */
    public String materialize(Expr expr, Target target) {
        if (isLiteral(expr)) {
            return constant(toValue(expr), target);
        }
        if (expr instanceof Expr.Sequence sequence) {
            if (sequence.getKind() == SequenceKind.SET) {
                throw DslViolation.unsupportedLiteral("set displays are not JSON-serialisable: " + expr.getText(),
                        expr.getLine());
            }
            return pack(sequence, target);
        }
        if (expr instanceof Expr.Dict dict) {
            return packDict(dict, target);
        }
        throw DslViolation.unsupportedLiteral(expr.getText(), expr.getLine());
    }

    public String constant(Object value, Target target) {
        String id = target.claim(ctx.getTable());
        ctx.getBuilder().emitConst(id, value);
        return id;
    }

    private String pack(Expr.Sequence sequence, Target target) {
        List<String> deps = new ArrayList<>();
        for (Expr element : sequence.getElements()) {
            if (!(element instanceof Expr.Name name)) {
                throw DslViolation.unsupportedLiteral(
                        "only names are allowed in a non-literal list/tuple: " + sequence.getText(),
                        sequence.getLine());
            }
            deps.add(ctx.getTable().resolve(name.getId(), name.getLine()));
        }
        Opcode opcode = sequence.getKind() == SequenceKind.LIST ? Opcode.PACK_LIST : Opcode.PACK_TUPLE;
        String id = target.claim(ctx.getTable());
        ctx.getBuilder().emit(id, opcode, deps, ExpressionEmitter.positional(deps.size()), Map.of());
        return id;
    }

    private String packDict(Expr.Dict dict, Target target) {
        List<String> keys = new ArrayList<>();
        List<String> deps = new ArrayList<>();
        for (int i = 0; i < dict.getValues().size(); i++) {
            Expr key = dict.getKeys().get(i);
            if (key == null) {
                throw DslViolation.unsupportedLiteral("dict unpacking in a literal: " + dict.getText(),
                        dict.getLine());
            }
            keys.add(keyOf(key));
            deps.add(field(dict.getValues().get(i)));
        }

        Map<String, Object> args = new LinkedHashMap<>();
        args.put("keys", keys);
        String id = target.claim(ctx.getTable());
        ctx.getBuilder().emit(id, Opcode.PACK_DICT, deps, ExpressionEmitter.positional(deps.size()), args);
        return id;
    }

    /**
     * One dict value: names resolve, literals and calls are lowered, anything
     * else is kept as its source text.
     */
    private String field(Expr value) {
        if (value instanceof Expr.Name name) {
            return ctx.getTable().resolve(name.getId(), name.getLine());
        }
        if (isLiteral(value)) {
            return constant(toValue(value), Target.internal(ExpressionEmitter.CONST));
        }
        if (value instanceof Expr.Call
                || (value instanceof Expr.Await awaited && awaited.getValue() instanceof Expr.Call)) {
            return emitter.emit(value, Target.internal(ExpressionEmitter.TMP));
        }
        return constant(value.getText(), Target.internal(ExpressionEmitter.CONST));
    }

    /** Element deps of a PACK.list / PACK.tuple op, or null if {@code id} is not one. */
    public static List<String> packedElements(PlanBuilder builder, String id) {
        Operation op = builder.get(id);
        if (op == null || op.getOpcode() == null || !op.getOpcode().isPack()) {
            return null;
        }
        return op.getDeps();
    }
}
