package frontend.plangen;

/**
 * Options of one compilation. Instances are mutable builders; the compiler
 * takes a {@link #copy()} so later changes do not leak into a running attempt.
 */
public class CompilerConfig {

    public static final int DEFAULT_MAX_OPS = 200;
    public static final int DEFAULT_MAX_SOURCE_LENGTH = 20_000;
    public static final int DEFAULT_MAX_DEPTH = 100;

    private int maxOps = DEFAULT_MAX_OPS;
    private int maxSourceLength = DEFAULT_MAX_SOURCE_LENGTH;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private boolean boxKeywordLiterals = false;
    private boolean requireResult = false;

    public static CompilerConfig defaultConfig() {
        return new CompilerConfig();
    }

    /**
     * The behaviour of the first DSL release: a function without
     * {@code output()} and without {@code return} is an error instead of
     * yielding an implicit {@code None}.
     */
    public static CompilerConfig strictConfig() {
        CompilerConfig config = new CompilerConfig();
        config.requireResult = true;
        return config;
    }

    public int getMaxOps() {
        return maxOps;
    }

    public CompilerConfig setMaxOps(int maxOps) {
        if (maxOps < 1) {
            throw new IllegalArgumentException("maxOps must be positive: " + maxOps);
        }
        this.maxOps = maxOps;
        return this;
    }

    public int getMaxSourceLength() {
        return maxSourceLength;
    }

    public CompilerConfig setMaxSourceLength(int maxSourceLength) {
        this.maxSourceLength = maxSourceLength;
        return this;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public CompilerConfig setMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        return this;
    }

    /**
     * When set, a literal keyword value is also emitted as its own
     * {@code CONST.value} node and referenced with the keyword's label.
     * The literal is kept in the operation's args either way.
     */
    public boolean isBoxKeywordLiterals() {
        return boxKeywordLiterals;
    }

    public CompilerConfig setBoxKeywordLiterals(boolean boxKeywordLiterals) {
        this.boxKeywordLiterals = boxKeywordLiterals;
        return this;
    }

    public boolean isRequireResult() {
        return requireResult;
    }

    public CompilerConfig setRequireResult(boolean requireResult) {
        this.requireResult = requireResult;
        return this;
    }

    public CompilerConfig copy() {
        CompilerConfig copy = new CompilerConfig();
        copy.maxOps = this.maxOps;
        copy.maxSourceLength = this.maxSourceLength;
        copy.maxDepth = this.maxDepth;
        copy.boxKeywordLiterals = this.boxKeywordLiterals;
        copy.requireResult = this.requireResult;
        return copy;
    }

    @Override
    public String toString() {
        return "CompilerConfig{" +
                "maxOps=" + maxOps +
                ", maxSourceLength=" + maxSourceLength +
                ", maxDepth=" + maxDepth +
                ", boxKeywordLiterals=" + boxKeywordLiterals +
                ", requireResult=" + requireResult +
                '}';
    }
}
