package exception;

/**
 * The single error kind of the plan compiler. The first violation aborts the
 * compilation attempt; no partial plan is ever returned.
 */
public class DslViolation extends CompileException {

    public enum Kind {
        SOURCE_TOO_LARGE,
        SYNTAX,
        FUNCTION_NOT_FOUND,
        NO_FUNCTION,
        PARAMETERS,
        INVALID_IDENTIFIER,
        UNSUPPORTED_STATEMENT,
        UNSUPPORTED_EXPRESSION,
        UNSUPPORTED_LITERAL,
        UNDEFINED_DEPENDENCY,
        INVALID_CALLEE,
        INVALID_SPLAT,
        INVALID_DECLARATION,
        INVALID_RETURN,
        PLAN_TOO_LARGE,
        TOO_DEEP,
        NO_RESULT,
        AMBIGUOUS
    }

    private final Kind kind;
    private final String reason;
    private final int line;

    public DslViolation(Kind kind, String reason) {
        this(kind, reason, -1, null);
    }

    public DslViolation(Kind kind, String reason, int line) {
        this(kind, reason, line, null);
    }

    public DslViolation(Kind kind, String reason, int line, Throwable cause) {
        super(formatMessage(reason, line), cause);
        this.kind = kind;
        this.reason = reason;
        this.line = line;
    }

    public Kind getKind() {
        return kind;
    }

    /** The reason without the line suffix. */
    public String getReason() {
        return reason;
    }

    /** 1-based source line, or -1 when the violation is not tied to a line. */
    public int getLine() {
        return line;
    }

    private static String formatMessage(String reason, int line) {
        return line > 0 ? reason + " (line " + line + ")" : reason;
    }

    public static DslViolation sourceTooLarge(int length, int limit) {
        return new DslViolation(Kind.SOURCE_TOO_LARGE,
                "Source too large: " + length + " characters, limit is " + limit);
    }

    public static DslViolation syntax(String msg, int line, int column) {
        return new DslViolation(Kind.SYNTAX, "Syntax error at " + line + ":" + column + ": " + msg, line);
    }

    public static DslViolation functionNotFound(String name) {
        return new DslViolation(Kind.FUNCTION_NOT_FOUND, "Function '" + name + "' not found");
    }

    public static DslViolation noFunction() {
        return new DslViolation(Kind.NO_FUNCTION, "No function definitions found in source");
    }

    public static DslViolation parameters(String function, int line) {
        return new DslViolation(Kind.PARAMETERS,
                "Function '" + function + "' must not accept parameters", line);
    }

    public static DslViolation invalidIdentifier(String name, int line) {
        return new DslViolation(Kind.INVALID_IDENTIFIER, "Invalid variable name: " + name, line);
    }

    public static DslViolation unsupportedStatement(String msg, int line) {
        return new DslViolation(Kind.UNSUPPORTED_STATEMENT, "Unsupported statement: " + msg, line);
    }

    public static DslViolation unsupportedExpression(String msg, int line) {
        return new DslViolation(Kind.UNSUPPORTED_EXPRESSION, "Unsupported expression: " + msg, line);
    }

    public static DslViolation unsupportedLiteral(String msg, int line) {
        return new DslViolation(Kind.UNSUPPORTED_LITERAL, "Unsupported literal: " + msg, line);
    }

    public static DslViolation undefinedDependency(String name, int line) {
        return new DslViolation(Kind.UNDEFINED_DEPENDENCY, "Undefined dependency: " + name, line);
    }

    public static DslViolation invalidCallee(String callee, int line) {
        return new DslViolation(Kind.INVALID_CALLEE,
                "Only simple or attribute names are allowed for operations: " + callee, line);
    }

    public static DslViolation invalidSplat(String msg, int line) {
        return new DslViolation(Kind.INVALID_SPLAT, msg, line);
    }

    public static DslViolation invalidDeclaration(String msg, int line) {
        return new DslViolation(Kind.INVALID_DECLARATION, msg, line);
    }

    public static DslViolation invalidReturn(String msg, int line) {
        return new DslViolation(Kind.INVALID_RETURN, "Unsupported return value: " + msg, line);
    }

    public static DslViolation planTooLarge(int limit) {
        return new DslViolation(Kind.PLAN_TOO_LARGE, "Too many operations: limit is " + limit);
    }

    public static DslViolation tooDeep(int limit, int line) {
        return new DslViolation(Kind.TOO_DEEP, "Nesting deeper than " + limit + " levels", line);
    }

    public static DslViolation noResult(String function) {
        return new DslViolation(Kind.NO_RESULT,
                "Function '" + function + "' has no output() declaration and no reachable return");
    }

    public static DslViolation ambiguous(Throwable last) {
        return new DslViolation(Kind.AMBIGUOUS,
                "No suitable function matched the DSL; specify the function name to disambiguate", -1, last);
    }
}
