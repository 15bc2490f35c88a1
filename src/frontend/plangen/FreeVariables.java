package frontend.plangen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import frontend.ast.Expr;
import frontend.ast.ExprVisitor;

/**
 * Names read by an expression, in source order, each reported once.
 * Comprehension targets and lambda parameters are local to their expression
 * and are not reported from inside it.
 */
public final class FreeVariables implements ExprVisitor<Void> {
    private final Set<String> found = new LinkedHashSet<>();
    private final Set<String> local;

    private FreeVariables(Set<String> local) {
        this.local = local;
    }

    public static List<String> of(Expr expr) {
        FreeVariables collector = new FreeVariables(Set.of());
        expr.accept(collector);
        return new ArrayList<>(collector.found);
    }

    /** Free names of {@code expr} that already have a binding in {@code table}. */
    public static List<String> bound(Expr expr, VariableTable table) {
        List<String> names = new ArrayList<>();
        for (String name : of(expr)) {
            if (table.isBound(name)) {
                names.add(name);
            }
        }
        return names;
    }

    private void scan(Expr expr) {
        if (expr != null) {
            expr.accept(this);
        }
    }

    private void scanNested(Expr expr, Set<String> extraLocals) {
        if (expr == null) {
            return;
        }
        Set<String> locals = new HashSet<>(local);
        locals.addAll(extraLocals);
        FreeVariables nested = new FreeVariables(locals);
        expr.accept(nested);
        found.addAll(nested.found);
    }

    private static void targetNames(Expr target, Set<String> out) {
        if (target instanceof Expr.Name name) {
            out.add(name.getId());
        } else if (target instanceof Expr.Sequence sequence) {
            for (Expr element : sequence.getElements()) {
                targetNames(element, out);
            }
        } else if (target instanceof Expr.Starred starred) {
            targetNames(starred.getValue(), out);
        }
    }

    @Override
    public Void visit(Expr.Name expr) {
        if (!local.contains(expr.getId())) {
            found.add(expr.getId());
        }
        return null;
    }

    @Override
    public Void visit(Expr.Constant expr) {
        return null;
    }

    @Override
    public Void visit(Expr.Sequence expr) {
        expr.getElements().forEach(this::scan);
        return null;
    }

    @Override
    public Void visit(Expr.Dict expr) {
        for (int i = 0; i < expr.getValues().size(); i++) {
            scan(expr.getKeys().get(i));
            scan(expr.getValues().get(i));
        }
        return null;
    }

    @Override
    public Void visit(Expr.Call expr) {
        scan(expr.getFunc());
        expr.getArgs().forEach(this::scan);
        for (Expr.Keyword keyword : expr.getKeywords()) {
            scan(keyword.getValue());
        }
        return null;
    }

    @Override
    public Void visit(Expr.Attribute expr) {
        scan(expr.getValue());
        return null;
    }

    @Override
    public Void visit(Expr.Subscript expr) {
        scan(expr.getValue());
        scan(expr.getIndex());
        return null;
    }

    @Override
    public Void visit(Expr.Slice expr) {
        scan(expr.getLower());
        scan(expr.getUpper());
        scan(expr.getStep());
        return null;
    }

    @Override
    public Void visit(Expr.Await expr) {
        scan(expr.getValue());
        return null;
    }

    @Override
    public Void visit(Expr.Starred expr) {
        scan(expr.getValue());
        return null;
    }

    @Override
    public Void visit(Expr.FormattedValue expr) {
        scan(expr.getValue());
        return null;
    }

    @Override
    public Void visit(Expr.JoinedStr expr) {
        expr.getParts().forEach(this::scan);
        return null;
    }

    @Override
    public Void visit(Expr.Comprehension expr) {
        Set<String> targets = new HashSet<>();
        for (Expr.Generator generator : expr.getGenerators()) {
            targetNames(generator.getTarget(), targets);
        }
        scanNested(expr.getElement(), targets);
        scanNested(expr.getValue(), targets);
        for (Expr.Generator generator : expr.getGenerators()) {
            scanNested(generator.getIter(), targets);
            for (Expr condition : generator.getIfs()) {
                scanNested(condition, targets);
            }
        }
        return null;
    }

    @Override
    public Void visit(Expr.IfExp expr) {
        // source order: body if test else orelse
        scan(expr.getBody());
        scan(expr.getTest());
        scan(expr.getOrelse());
        return null;
    }

    @Override
    public Void visit(Expr.Operator expr) {
        expr.getOperands().forEach(this::scan);
        return null;
    }

    @Override
    public Void visit(Expr.Lambda expr) {
        Set<String> params = new HashSet<>();
        for (String param : expr.getParams()) {
            params.add(param.replaceFirst("^\\*+", "").replaceAll("[=:].*$", ""));
        }
        scanNested(expr.getBody(), params);
        return null;
    }
}
