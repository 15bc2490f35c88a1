package frontend.ast;

import java.util.List;

/**
 * Expression shapes of the DSL. The set is closed: every shape the parser can
 * produce is one of the nested classes below, and {@link ExprVisitor} has one
 * method per class.
 */
public abstract class Expr extends Node {

    protected Expr(int line, String text) {
        super(line, text);
    }

    public abstract <T> T accept(ExprVisitor<T> visitor);

    public static final class Name extends Expr {
        private final String id;

        public Name(int line, String text, String id) {
            super(line, text);
            this.id = id;
        }

        public String getId() {
            return id;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A constant. {@code value} is null, Boolean, Long, BigInteger, Double or
     * String when the constant is JSON-representable; bytes, complex numbers
     * and {@code ...} keep their source text and are not representable.
     */
    public static final class Constant extends Expr {
        private final Object value;
        private final boolean representable;

        public Constant(int line, String text, Object value, boolean representable) {
            super(line, text);
            this.value = value;
            this.representable = representable;
        }

        public Object getValue() {
            return value;
        }

        public boolean isRepresentable() {
            return representable;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public enum SequenceKind {
        LIST, TUPLE, SET
    }

    /** List, tuple or set display. */
    public static final class Sequence extends Expr {
        private final SequenceKind kind;
        private final List<Expr> elements;

        public Sequence(int line, String text, SequenceKind kind, List<Expr> elements) {
            super(line, text);
            this.kind = kind;
            this.elements = List.copyOf(elements);
        }

        public SequenceKind getKind() {
            return kind;
        }

        public List<Expr> getElements() {
            return elements;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** Dict display. A null key marks a {@code **mapping} entry. */
    public static final class Dict extends Expr {
        private final List<Expr> keys;
        private final List<Expr> values;

        public Dict(int line, String text, List<Expr> keys, List<Expr> values) {
            super(line, text);
            // keys may contain nulls, so no List.copyOf here
            this.keys = keys;
            this.values = List.copyOf(values);
        }

        public List<Expr> getKeys() {
            return keys;
        }

        public List<Expr> getValues() {
            return values;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Keyword {
        private final String name;
        private final Expr value;

        /**
         * @param name keyword name, or null for a {@code **mapping} argument
         */
        public Keyword(String name, Expr value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expr getValue() {
            return value;
        }

        public boolean isDoubleStar() {
            return name == null;
        }
    }

    public static final class Call extends Expr {
        private final Expr func;
        private final List<Expr> args;
        private final List<Keyword> keywords;

        public Call(int line, String text, Expr func, List<Expr> args, List<Keyword> keywords) {
            super(line, text);
            this.func = func;
            this.args = List.copyOf(args);
            this.keywords = List.copyOf(keywords);
        }

        public Expr getFunc() {
            return func;
        }

        public List<Expr> getArgs() {
            return args;
        }

        public List<Keyword> getKeywords() {
            return keywords;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Attribute extends Expr {
        private final Expr value;
        private final String attr;

        public Attribute(int line, String text, Expr value, String attr) {
            super(line, text);
            this.value = value;
            this.attr = attr;
        }

        public Expr getValue() {
            return value;
        }

        public String getAttr() {
            return attr;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Subscript extends Expr {
        private final Expr value;
        private final Expr index;

        public Subscript(int line, String text, Expr value, Expr index) {
            super(line, text);
            this.value = value;
            this.index = index;
        }

        public Expr getValue() {
            return value;
        }

        public Expr getIndex() {
            return index;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** {@code lower:upper:step}, each part optional. */
    public static final class Slice extends Expr {
        private final Expr lower;
        private final Expr upper;
        private final Expr step;

        public Slice(int line, String text, Expr lower, Expr upper, Expr step) {
            super(line, text);
            this.lower = lower;
            this.upper = upper;
            this.step = step;
        }

        public Expr getLower() {
            return lower;
        }

        public Expr getUpper() {
            return upper;
        }

        public Expr getStep() {
            return step;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Await extends Expr {
        private final Expr value;

        public Await(int line, String text, Expr value) {
            super(line, text);
            this.value = value;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Starred extends Expr {
        private final Expr value;

        public Starred(int line, String text, Expr value) {
            super(line, text);
            this.value = value;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * One interpolation slot of an f-string. {@code value} is the parsed slot
     * expression; conversion ({@code !r}) and format spec are kept as text.
     */
    public static final class FormattedValue extends Expr {
        private final Expr value;
        private final String conversion;
        private final String formatSpec;

        public FormattedValue(int line, String text, Expr value, String conversion, String formatSpec) {
            super(line, text);
            this.value = value;
            this.conversion = conversion;
            this.formatSpec = formatSpec;
        }

        public Expr getValue() {
            return value;
        }

        public String getConversion() {
            return conversion;
        }

        public String getFormatSpec() {
            return formatSpec;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** f-string: literal {@link Constant} chunks interleaved with {@link FormattedValue} slots. */
    public static final class JoinedStr extends Expr {
        private final List<Expr> parts;

        public JoinedStr(int line, String text, List<Expr> parts) {
            super(line, text);
            this.parts = List.copyOf(parts);
        }

        public List<Expr> getParts() {
            return parts;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public enum ComprehensionKind {
        LIST("listcomp"), SET("setcomp"), DICT("dictcomp"), GENERATOR("genexpr");

        private final String opSuffix;

        ComprehensionKind(String opSuffix) {
            this.opSuffix = opSuffix;
        }

        public String getOpSuffix() {
            return opSuffix;
        }
    }

    public static final class Generator {
        private final Expr target;
        private final Expr iter;
        private final List<Expr> ifs;
        private final boolean async;

        public Generator(Expr target, Expr iter, List<Expr> ifs, boolean async) {
            this.target = target;
            this.iter = iter;
            this.ifs = List.copyOf(ifs);
            this.async = async;
        }

        public Expr getTarget() {
            return target;
        }

        public Expr getIter() {
            return iter;
        }

        public List<Expr> getIfs() {
            return ifs;
        }

        public boolean isAsync() {
            return async;
        }
    }

    /** List/set/dict comprehension or generator expression. {@code value} is only set for dicts. */
    public static final class Comprehension extends Expr {
        private final ComprehensionKind kind;
        private final Expr element;
        private final Expr value;
        private final List<Generator> generators;

        public Comprehension(int line, String text, ComprehensionKind kind, Expr element, Expr value,
                List<Generator> generators) {
            super(line, text);
            this.kind = kind;
            this.element = element;
            this.value = value;
            this.generators = List.copyOf(generators);
        }

        public ComprehensionKind getKind() {
            return kind;
        }

        public Expr getElement() {
            return element;
        }

        public Expr getValue() {
            return value;
        }

        public List<Generator> getGenerators() {
            return generators;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    /** {@code body if test else orelse} */
    public static final class IfExp extends Expr {
        private final Expr test;
        private final Expr body;
        private final Expr orelse;

        public IfExp(int line, String text, Expr test, Expr body, Expr orelse) {
            super(line, text);
            this.test = test;
            this.body = body;
            this.orelse = orelse;
        }

        public Expr getTest() {
            return test;
        }

        public Expr getBody() {
            return body;
        }

        public Expr getOrelse() {
            return orelse;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public enum OperatorKind {
        BINARY, UNARY, BOOLEAN, COMPARE
    }

    /**
     * Binary, unary, boolean and comparison expressions share one shape: the
     * compiler never looks inside them beyond their operands.
     */
    public static final class Operator extends Expr {
        private final OperatorKind kind;
        private final List<String> operators;
        private final List<Expr> operands;

        public Operator(int line, String text, OperatorKind kind, List<String> operators, List<Expr> operands) {
            super(line, text);
            this.kind = kind;
            this.operators = List.copyOf(operators);
            this.operands = List.copyOf(operands);
        }

        public OperatorKind getKind() {
            return kind;
        }

        public List<String> getOperators() {
            return operators;
        }

        public List<Expr> getOperands() {
            return operands;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Lambda extends Expr {
        private final List<String> params;
        private final Expr body;

        public Lambda(int line, String text, List<String> params, Expr body) {
            super(line, text);
            this.params = List.copyOf(params);
            this.body = body;
        }

        public List<String> getParams() {
            return params;
        }

        public Expr getBody() {
            return body;
        }

        @Override
        public <T> T accept(ExprVisitor<T> visitor) {
            return visitor.visit(this);
        }
    }
}
