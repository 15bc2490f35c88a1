package frontend.ast;

public interface StmtVisitor<T> {
    T visit(Stmt.FunctionDef stmt);

    T visit(Stmt.Assign stmt);

    T visit(Stmt.ExprStmt stmt);

    T visit(Stmt.Return stmt);

    T visit(Stmt.If stmt);

    T visit(Stmt.For stmt);

    T visit(Stmt.While stmt);

    T visit(Stmt.Try stmt);

    T visit(Stmt.Pass stmt);

    T visit(Stmt.Break stmt);

    T visit(Stmt.Continue stmt);

    T visit(Stmt.Opaque stmt);
}
