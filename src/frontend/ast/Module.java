package frontend.ast;

import java.util.ArrayList;
import java.util.List;

/** A parsed source file: its top-level statements in source order. */
public class Module {
    private final List<Stmt> body;

    public Module(List<Stmt> body) {
        this.body = List.copyOf(body);
    }

    public List<Stmt> getBody() {
        return body;
    }

    public List<Stmt.FunctionDef> getFunctions() {
        List<Stmt.FunctionDef> functions = new ArrayList<>();
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.FunctionDef fn) {
                functions.add(fn);
            }
        }
        return functions;
    }
}
