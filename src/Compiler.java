import driver.*;

public class Compiler {
    /*
     * entry point for `java Compiler FILE ...`; the driver owns argument
     * handling and exit codes
     */
    public static void main(String[] args) {
        System.exit(CompilerDriver.execute(args));
    }
}
