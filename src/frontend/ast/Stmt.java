package frontend.ast;

import java.util.List;

/**
 * Statement shapes of the DSL. Shapes the compiler never accepts (imports,
 * classes, {@code with}, {@code raise}, ...) are kept as {@link Opaque} so the
 * rejection can name what was found.
 */
public abstract class Stmt extends Node {

    protected Stmt(int line, String text) {
        super(line, text);
    }

    public abstract <T> T accept(StmtVisitor<T> visitor);

    public enum ParamKind {
        POSITIONAL, VARARGS, KWARGS, MARKER
    }

    public static final class Param {
        private final ParamKind kind;
        private final String name;
        private final boolean defaulted;

        public Param(ParamKind kind, String name, boolean defaulted) {
            this.kind = kind;
            this.name = name;
            this.defaulted = defaulted;
        }

        public ParamKind getKind() {
            return kind;
        }

        public String getName() {
            return name;
        }

        public boolean isDefaulted() {
            return defaulted;
        }
    }

    public static final class FunctionDef extends Stmt {
        private final String name;
        private final List<Param> params;
        private final List<Stmt> body;
        private final boolean async;

        public FunctionDef(int line, String text, String name, List<Param> params, List<Stmt> body, boolean async) {
            super(line, text);
            this.name = name;
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
            this.async = async;
        }

        public String getName() {
            return name;
        }

        public List<Param> getParams() {
            return params;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public boolean isAsync() {
            return async;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** {@code t1 = t2 = ... = value}; a single target is the only accepted form. */
    public static final class Assign extends Stmt {
        private final List<Expr> targets;
        private final Expr value;

        public Assign(int line, String text, List<Expr> targets, Expr value) {
            super(line, text);
            this.targets = List.copyOf(targets);
            this.value = value;
        }

        public List<Expr> getTargets() {
            return targets;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class ExprStmt extends Stmt {
        private final Expr value;

        public ExprStmt(int line, String text, Expr value) {
            super(line, text);
            this.value = value;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Return extends Stmt {
        private final Expr value;

        public Return(int line, String text, Expr value) {
            super(line, text);
            this.value = value;
        }

        /** Returned expression, or null for a bare {@code return}. */
        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** {@code elif} chains arrive as an If nested in {@code orelse}. */
    public static final class If extends Stmt {
        private final Expr test;
        private final List<Stmt> body;
        private final List<Stmt> orelse;

        public If(int line, String text, Expr test, List<Stmt> body, List<Stmt> orelse) {
            super(line, text);
            this.test = test;
            this.body = List.copyOf(body);
            this.orelse = List.copyOf(orelse);
        }

        public Expr getTest() {
            return test;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getOrelse() {
            return orelse;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class For extends Stmt {
        private final Expr target;
        private final Expr iter;
        private final List<Stmt> body;
        private final List<Stmt> orelse;
        private final boolean async;

        public For(int line, String text, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse,
                boolean async) {
            super(line, text);
            this.target = target;
            this.iter = iter;
            this.body = List.copyOf(body);
            this.orelse = List.copyOf(orelse);
            this.async = async;
        }

        public Expr getTarget() {
            return target;
        }

        public Expr getIter() {
            return iter;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getOrelse() {
            return orelse;
        }

        public boolean isAsync() {
            return async;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class While extends Stmt {
        private final Expr test;
        private final List<Stmt> body;
        private final List<Stmt> orelse;

        public While(int line, String text, Expr test, List<Stmt> body, List<Stmt> orelse) {
            super(line, text);
            this.test = test;
            this.body = List.copyOf(body);
            this.orelse = List.copyOf(orelse);
        }

        public Expr getTest() {
            return test;
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Stmt> getOrelse() {
            return orelse;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Handler extends Node {
        private final Expr type;
        private final String name;
        private final List<Stmt> body;

        public Handler(int line, String text, Expr type, String name, List<Stmt> body) {
            super(line, text);
            this.type = type;
            this.name = name;
            this.body = List.copyOf(body);
        }

        /** Caught exception expression, or null for a bare {@code except:}. */
        public Expr getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        public List<Stmt> getBody() {
            return body;
        }
    }

    public static final class Try extends Stmt {
        private final List<Stmt> body;
        private final List<Handler> handlers;
        private final List<Stmt> orelse;
        private final List<Stmt> finalbody;

        public Try(int line, String text, List<Stmt> body, List<Handler> handlers, List<Stmt> orelse,
                List<Stmt> finalbody) {
            super(line, text);
            this.body = List.copyOf(body);
            this.handlers = List.copyOf(handlers);
            this.orelse = List.copyOf(orelse);
            this.finalbody = List.copyOf(finalbody);
        }

        public List<Stmt> getBody() {
            return body;
        }

        public List<Handler> getHandlers() {
            return handlers;
        }

        public List<Stmt> getOrelse() {
            return orelse;
        }

        public List<Stmt> getFinalbody() {
            return finalbody;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Pass extends Stmt {
        public Pass(int line, String text) {
            super(line, text);
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Break extends Stmt {
        public Break(int line, String text) {
            super(line, text);
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Continue extends Stmt {
        public Continue(int line, String text) {
            super(line, text);
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** Parsed but never compiled: import, class, with, augmented assignment, raise, ... */
    public static final class Opaque extends Stmt {
        private final String kind;

        public Opaque(int line, String text, String kind) {
            super(line, text);
            this.kind = kind;
        }

        public String getKind() {
            return kind;
        }

        @Override
        public <T> T accept(StmtVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }
}
