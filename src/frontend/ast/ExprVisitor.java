package frontend.ast;

public interface ExprVisitor<T> {
    T visit(Expr.Name expr);

    T visit(Expr.Constant expr);

    T visit(Expr.Sequence expr);

    T visit(Expr.Dict expr);

    T visit(Expr.Call expr);

    T visit(Expr.Attribute expr);

    T visit(Expr.Subscript expr);

    T visit(Expr.Slice expr);

    T visit(Expr.Await expr);

    T visit(Expr.Starred expr);

    T visit(Expr.FormattedValue expr);

    T visit(Expr.JoinedStr expr);

    T visit(Expr.Comprehension expr);

    T visit(Expr.IfExp expr);

    T visit(Expr.Operator expr);

    T visit(Expr.Lambda expr);
}
