package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CompileException noArgs() {
        return new CompileException("need args to process");
    }

    public static CompileException wrongArgs(String msg) {
        return new CompileException("Unexpected args: " + msg);
    }

    public static CompileException io(String what, Throwable cause) {
        return new CompileException("I/O failure: " + what, cause);
    }

    public static CompileException toolMissing(String msg) {
        return new CompileException("Missing tool: " + msg);
    }
}
