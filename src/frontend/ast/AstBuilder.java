package frontend.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.antlr.v4.runtime.tree.TerminalNode;

import exception.DslViolation;
import frontend.ast.Expr.ComprehensionKind;
import frontend.ast.Expr.OperatorKind;
import frontend.ast.Expr.SequenceKind;
import frontend.ast.Stmt.ParamKind;
import frontend.grammar.DslLexer;
import frontend.grammar.DslParser;
import frontend.grammar.DslParserBaseVisitor;
import frontend.plangen.CompilerConfig;
import util.logging.LogManager;
import util.logging.Logger;

/**
 * Turns the ANTLR parse tree into the {@link Module} / {@link Stmt} /
 * {@link Expr} tree the plan compiler works on.
 *
 * Constructs the compiler rejects (imports, classes, with, ...) are still
 * parsed and kept as {@link Stmt.Opaque} so that the rejection carries a line
 * number and a readable reason.
 */
public class AstBuilder extends DslParserBaseVisitor<Node> {
    private static final Logger logger = LogManager.getLogger(AstBuilder.class);

    private final CharStream input;
    private final int lineOffset;

    private AstBuilder(CharStream input, int lineOffset) {
        this.input = input;
        this.lineOffset = lineOffset;
    }

    // ==================== entry points ====================

    public static Module parseModule(String source) {
        return parseModule(source, CompilerConfig.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth deepest allowed nesting of expressions and blocks
     */
    public static Module parseModule(String source, int maxDepth) {
        CharStream input = CharStreams.fromString(source);
        DslParser parser = newParser(input, 0);
        parser.addParseListener(new NestingGuard(maxDepth));
        Module module;
        try {
            DslParser.File_inputContext tree = parser.file_input();
            module = new AstBuilder(input, 0).buildModule(tree);
        } catch (StackOverflowError e) {
            throw DslViolation.tooDeep(maxDepth, -1);
        }
        logger.debug("parsed {} top-level statements", module.getBody().size());
        return module;
    }

    /**
     * Parse a standalone expression, e.g. the contents of an f-string slot.
     *
     * @param line source line the text was taken from, used for error reports
     */
    public static Expr parseExpression(String text, int line) {
        CharStream input = CharStreams.fromString(text);
        DslParser parser = newParser(input, line - 1);
        DslParser.Eval_inputContext tree = parser.eval_input();
        return new AstBuilder(input, line - 1).testlist(tree.testlist());
    }

    private static DslParser newParser(CharStream input, int lineOffset) {
        ThrowingErrorListener errors = new ThrowingErrorListener(lineOffset);
        DslLexer lexer = new DslLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        DslParser parser = new DslParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);
        return parser;
    }

    private static class ThrowingErrorListener extends BaseErrorListener {
        private final int lineOffset;

        ThrowingErrorListener(int lineOffset) {
            this.lineOffset = lineOffset;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                int charPositionInLine, String msg, RecognitionException e) {
            throw DslViolation.syntax(msg, line + lineOffset, charPositionInLine);
        }
    }

    /**
     * Counts open {@code test} and {@code block} rules while parsing and
     * stops the parse once they nest deeper than the limit.
     */
    private static class NestingGuard implements ParseTreeListener {
        private final int limit;
        private int depth = 0;

        NestingGuard(int limit) {
            this.limit = limit;
        }

        private static boolean counts(ParserRuleContext ctx) {
            return ctx instanceof DslParser.TestContext || ctx instanceof DslParser.BlockContext;
        }

        @Override
        public void enterEveryRule(ParserRuleContext ctx) {
            if (counts(ctx) && ++depth > limit) {
                throw DslViolation.tooDeep(limit, ctx.getStart().getLine());
            }
        }

        @Override
        public void exitEveryRule(ParserRuleContext ctx) {
            if (counts(ctx)) {
                depth--;
            }
        }

        @Override
        public void visitTerminal(TerminalNode node) {
        }

        @Override
        public void visitErrorNode(ErrorNode node) {
        }
    }

    // ==================== helpers ====================

    private int line(ParserRuleContext ctx) {
        return ctx.getStart().getLine() + lineOffset;
    }

    private String text(ParserRuleContext ctx) {
        if (ctx.getStart() == null || ctx.getStop() == null
                || ctx.getStop().getStopIndex() < ctx.getStart().getStartIndex()) {
            return ctx.getText();
        }
        return input.getText(Interval.of(ctx.getStart().getStartIndex(), ctx.getStop().getStopIndex()));
    }

    private String text(ParserRuleContext from, ParserRuleContext to) {
        return input.getText(Interval.of(from.getStart().getStartIndex(), to.getStop().getStopIndex()));
    }

    private Expr expr(ParseTree ctx) {
        return (Expr) visit(ctx);
    }

    // ==================== statements ====================

    private Module buildModule(DslParser.File_inputContext ctx) {
        List<Stmt> body = new ArrayList<>();
        for (DslParser.StmtContext stmt : ctx.stmt()) {
            collect(stmt, body);
        }
        return new Module(body);
    }

    private void collect(DslParser.StmtContext ctx, List<Stmt> out) {
        if (ctx.simple_stmt() != null) {
            for (DslParser.Small_stmtContext small : ctx.simple_stmt().small_stmt()) {
                out.add((Stmt) visit(small));
            }
        } else {
            out.add((Stmt) visit(ctx.compound_stmt()));
        }
    }

    private List<Stmt> block(DslParser.BlockContext ctx) {
        List<Stmt> body = new ArrayList<>();
        if (ctx.simple_stmt() != null) {
            for (DslParser.Small_stmtContext small : ctx.simple_stmt().small_stmt()) {
                body.add((Stmt) visit(small));
            }
        } else {
            for (DslParser.StmtContext stmt : ctx.stmt()) {
                collect(stmt, body);
            }
        }
        return body;
    }

    @Override
    public Node visitSmall_stmt(DslParser.Small_stmtContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitCompound_stmt(DslParser.Compound_stmtContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitExpr_stmt(DslParser.Expr_stmtContext ctx) {
        List<DslParser.Testlist_star_exprContext> sides = ctx.testlist_star_expr();
        if (ctx.annassign() != null) {
            return new Stmt.Opaque(line(ctx), text(ctx), "annotated assignment");
        }
        if (ctx.augassign() != null) {
            return new Stmt.Opaque(line(ctx), text(ctx), "augmented assignment");
        }
        if (sides.size() == 1) {
            return new Stmt.ExprStmt(line(ctx), text(ctx), testlistStarExpr(sides.get(0)));
        }
        List<Expr> targets = new ArrayList<>();
        for (int i = 0; i < sides.size() - 1; i++) {
            targets.add(testlistStarExpr(sides.get(i)));
        }
        Expr value = testlistStarExpr(sides.get(sides.size() - 1));
        return new Stmt.Assign(line(ctx), text(ctx), targets, value);
    }

    @Override
    public Node visitReturn_stmt(DslParser.Return_stmtContext ctx) {
        Expr value = ctx.testlist_star_expr() == null ? null : testlistStarExpr(ctx.testlist_star_expr());
        return new Stmt.Return(line(ctx), text(ctx), value);
    }

    @Override
    public Node visitPass_stmt(DslParser.Pass_stmtContext ctx) {
        return new Stmt.Pass(line(ctx), text(ctx));
    }

    @Override
    public Node visitBreak_stmt(DslParser.Break_stmtContext ctx) {
        return new Stmt.Break(line(ctx), text(ctx));
    }

    @Override
    public Node visitContinue_stmt(DslParser.Continue_stmtContext ctx) {
        return new Stmt.Continue(line(ctx), text(ctx));
    }

    @Override
    public Node visitImport_stmt(DslParser.Import_stmtContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), "import");
    }

    @Override
    public Node visitRaise_stmt(DslParser.Raise_stmtContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), "raise");
    }

    @Override
    public Node visitDel_stmt(DslParser.Del_stmtContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), "del");
    }

    @Override
    public Node visitGlobal_stmt(DslParser.Global_stmtContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), ctx.getStart().getText());
    }

    @Override
    public Node visitAssert_stmt(DslParser.Assert_stmtContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), "assert");
    }

    @Override
    public Node visitWith_stmt(DslParser.With_stmtContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), "with");
    }

    @Override
    public Node visitClassdef(DslParser.ClassdefContext ctx) {
        return new Stmt.Opaque(line(ctx), text(ctx), "class definition");
    }

    @Override
    public Node visitDecorated(DslParser.DecoratedContext ctx) {
        if (ctx.funcdef() == null) {
            return visitClassdef(ctx.classdef());
        }
        // decorators do not change the plan; the function is compiled as written
        logger.debug("ignoring {} decorator(s) on '{}'", ctx.decorator().size(), ctx.funcdef().NAME().getText());
        return visitFuncdef(ctx.funcdef());
    }

    @Override
    public Node visitFuncdef(DslParser.FuncdefContext ctx) {
        List<Stmt.Param> params = new ArrayList<>();
        for (DslParser.ParamContext param : ctx.parameters().param()) {
            params.add(param(param));
        }
        return new Stmt.FunctionDef(line(ctx), text(ctx), ctx.NAME().getText(), params, block(ctx.block()),
                ctx.ASYNC() != null);
    }

    private Stmt.Param param(DslParser.ParamContext ctx) {
        if (ctx.NAME() == null) {
            // bare '*' or '/'
            return new Stmt.Param(ParamKind.MARKER, ctx.getText(), false);
        }
        String name = ctx.NAME().getText();
        if (ctx.STAR() != null) {
            return new Stmt.Param(ParamKind.VARARGS, name, false);
        }
        if (ctx.POWER() != null) {
            return new Stmt.Param(ParamKind.KWARGS, name, false);
        }
        return new Stmt.Param(ParamKind.POSITIONAL, name, ctx.ASSIGN() != null);
    }

    @Override
    public Node visitIf_stmt(DslParser.If_stmtContext ctx) {
        List<DslParser.TestContext> tests = ctx.test();
        List<DslParser.BlockContext> blocks = ctx.block();

        // elif chains become ifs nested in the else branch
        List<Stmt> orelse = blocks.size() > tests.size() ? block(blocks.get(blocks.size() - 1)) : List.of();
        for (int i = tests.size() - 1; i >= 1; i--) {
            DslParser.TestContext test = tests.get(i);
            Stmt.If elif = new Stmt.If(line(test), text(test, blocks.get(i)), expr(test), block(blocks.get(i)),
                    orelse);
            orelse = List.of(elif);
        }
        return new Stmt.If(line(ctx), text(ctx), expr(tests.get(0)), block(blocks.get(0)), orelse);
    }

    @Override
    public Node visitWhile_stmt(DslParser.While_stmtContext ctx) {
        List<DslParser.BlockContext> blocks = ctx.block();
        List<Stmt> orelse = blocks.size() > 1 ? block(blocks.get(1)) : List.of();
        return new Stmt.While(line(ctx), text(ctx), expr(ctx.test()), block(blocks.get(0)), orelse);
    }

    @Override
    public Node visitFor_stmt(DslParser.For_stmtContext ctx) {
        List<DslParser.BlockContext> blocks = ctx.block();
        List<Stmt> orelse = blocks.size() > 1 ? block(blocks.get(1)) : List.of();
        return new Stmt.For(line(ctx), text(ctx), exprlist(ctx.exprlist()), testlist(ctx.testlist()),
                block(blocks.get(0)), orelse, ctx.ASYNC() != null);
    }

    @Override
    public Node visitTry_stmt(DslParser.Try_stmtContext ctx) {
        List<DslParser.BlockContext> blocks = ctx.block();
        int next = 1;
        List<Stmt> orelse = List.of();
        List<Stmt> finalbody = List.of();
        if (ctx.ELSE() != null) {
            orelse = block(blocks.get(next++));
        }
        if (ctx.FINALLY() != null) {
            finalbody = block(blocks.get(next));
        }

        List<Stmt.Handler> handlers = new ArrayList<>();
        for (DslParser.Except_clauseContext clause : ctx.except_clause()) {
            Expr type = clause.test() == null ? null : expr(clause.test());
            String name = clause.NAME() == null ? null : clause.NAME().getText();
            handlers.add(new Stmt.Handler(line(clause), text(clause), type, name, block(clause.block())));
        }
        return new Stmt.Try(line(ctx), text(ctx), block(blocks.get(0)), handlers, orelse, finalbody);
    }

    // ==================== expression lists ====================

    private Expr testlistStarExpr(DslParser.Testlist_star_exprContext ctx) {
        return sequenceOrSingle(ctx, ctx.COMMA().isEmpty());
    }

    private Expr testlist(DslParser.TestlistContext ctx) {
        return sequenceOrSingle(ctx, ctx.COMMA().isEmpty());
    }

    private Expr exprlist(DslParser.ExprlistContext ctx) {
        return sequenceOrSingle(ctx, ctx.COMMA().isEmpty());
    }

    /** A comma list is a tuple; a single element without a trailing comma is itself. */
    private Expr sequenceOrSingle(ParserRuleContext ctx, boolean noComma) {
        List<Expr> elements = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (!(child instanceof TerminalNode)) {
                elements.add(expr(child));
            }
        }
        if (noComma && elements.size() == 1) {
            return elements.get(0);
        }
        return new Expr.Sequence(line(ctx), text(ctx), SequenceKind.TUPLE, elements);
    }

    // ==================== operators ====================

    @Override
    public Node visitTest(DslParser.TestContext ctx) {
        if (ctx.lambdef() != null) {
            return visit(ctx.lambdef());
        }
        List<DslParser.Or_testContext> parts = ctx.or_test();
        if (parts.size() == 1) {
            return visit(parts.get(0));
        }
        return new Expr.IfExp(line(ctx), text(ctx), expr(parts.get(1)), expr(parts.get(0)), expr(ctx.test()));
    }

    @Override
    public Node visitLambdef(DslParser.LambdefContext ctx) {
        List<String> params = new ArrayList<>();
        for (DslParser.Lambda_paramContext param : ctx.lambda_param()) {
            params.add(param.getText());
        }
        return new Expr.Lambda(line(ctx), text(ctx), params, expr(ctx.test()));
    }

    @Override
    public Node visitOr_test(DslParser.Or_testContext ctx) {
        return chain(ctx, OperatorKind.BOOLEAN);
    }

    @Override
    public Node visitAnd_test(DslParser.And_testContext ctx) {
        return chain(ctx, OperatorKind.BOOLEAN);
    }

    @Override
    public Node visitNot_test(DslParser.Not_testContext ctx) {
        if (ctx.NOT() == null) {
            return visit(ctx.comparison());
        }
        return new Expr.Operator(line(ctx), text(ctx), OperatorKind.UNARY, List.of("not"),
                List.of(expr(ctx.not_test())));
    }

    @Override
    public Node visitComparison(DslParser.ComparisonContext ctx) {
        return chain(ctx, OperatorKind.COMPARE);
    }

    @Override
    public Node visitStar_expr(DslParser.Star_exprContext ctx) {
        return new Expr.Starred(line(ctx), text(ctx), expr(ctx.expr()));
    }

    @Override
    public Node visitExpr(DslParser.ExprContext ctx) {
        return chain(ctx, OperatorKind.BINARY);
    }

    @Override
    public Node visitXor_expr(DslParser.Xor_exprContext ctx) {
        return chain(ctx, OperatorKind.BINARY);
    }

    @Override
    public Node visitAnd_expr(DslParser.And_exprContext ctx) {
        return chain(ctx, OperatorKind.BINARY);
    }

    @Override
    public Node visitShift_expr(DslParser.Shift_exprContext ctx) {
        return chain(ctx, OperatorKind.BINARY);
    }

    @Override
    public Node visitArith_expr(DslParser.Arith_exprContext ctx) {
        return chain(ctx, OperatorKind.BINARY);
    }

    @Override
    public Node visitTerm(DslParser.TermContext ctx) {
        return chain(ctx, OperatorKind.BINARY);
    }

    /**
     * {@code a op b op c ...}; a single operand collapses to itself.
     */
    private Expr chain(ParserRuleContext ctx, OperatorKind kind) {
        if (ctx.getChildCount() == 1) {
            return expr(ctx.getChild(0));
        }
        List<String> operators = new ArrayList<>();
        List<Expr> operands = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode terminal) {
                operators.add(terminal.getText());
            } else if (child instanceof DslParser.Comp_opContext op) {
                List<String> words = new ArrayList<>();
                for (ParseTree word : op.children) {
                    words.add(word.getText());
                }
                operators.add(String.join(" ", words));
            } else {
                operands.add(expr(child));
            }
        }
        return new Expr.Operator(line(ctx), text(ctx), kind, operators, operands);
    }

    @Override
    public Node visitFactor(DslParser.FactorContext ctx) {
        if (ctx.power() != null) {
            return visit(ctx.power());
        }
        Expr operand = expr(ctx.factor());
        String sign = ctx.getStart().getText();
        // fold -1 / +2.5 into constants so that negative numbers stay literals
        if (operand instanceof Expr.Constant constant && constant.isRepresentable()
                && constant.getValue() instanceof Number number) {
            if (sign.equals("+")) {
                return new Expr.Constant(line(ctx), text(ctx), number, true);
            }
            if (sign.equals("-")) {
                return new Expr.Constant(line(ctx), text(ctx), negate(number), true);
            }
        }
        return new Expr.Operator(line(ctx), text(ctx), OperatorKind.UNARY, List.of(sign), List.of(operand));
    }

    private static Number negate(Number number) {
        if (number instanceof Long value) {
            return value == Long.MIN_VALUE ? BigInteger.valueOf(value).negate() : -value;
        }
        if (number instanceof BigInteger value) {
            return narrow(value.negate());
        }
        return -number.doubleValue();
    }

    @Override
    public Node visitPower(DslParser.PowerContext ctx) {
        Expr base = expr(ctx.atom_expr());
        if (ctx.factor() == null) {
            return base;
        }
        return new Expr.Operator(line(ctx), text(ctx), OperatorKind.BINARY, List.of("**"),
                List.of(base, expr(ctx.factor())));
    }

    // ==================== primaries ====================

    @Override
    public Node visitAtom_expr(DslParser.Atom_exprContext ctx) {
        Expr result = expr(ctx.atom());
        for (DslParser.TrailerContext trailer : ctx.trailer()) {
            int line = line(ctx.atom());
            String text = text(ctx.atom(), trailer);
            if (trailer.DOT() != null) {
                result = new Expr.Attribute(line, text, result, trailer.NAME().getText());
            } else if (trailer.OPEN_PAREN() != null) {
                List<Expr> args = new ArrayList<>();
                List<Expr.Keyword> keywords = new ArrayList<>();
                if (trailer.arglist() != null) {
                    for (DslParser.ArgumentContext argument : trailer.arglist().argument()) {
                        argument(argument, args, keywords);
                    }
                }
                result = new Expr.Call(line, text, result, args, keywords);
            } else {
                result = new Expr.Subscript(line, text, result, subscriptlist(trailer.subscriptlist()));
            }
        }
        if (ctx.AWAIT() != null) {
            result = new Expr.Await(line(ctx), text(ctx), result);
        }
        return result;
    }

    private void argument(DslParser.ArgumentContext ctx, List<Expr> args, List<Expr.Keyword> keywords) {
        if (ctx.ASSIGN() != null) {
            keywords.add(new Expr.Keyword(ctx.NAME().getText(), expr(ctx.test())));
        } else if (ctx.POWER() != null) {
            keywords.add(new Expr.Keyword(null, expr(ctx.test())));
        } else if (ctx.STAR() != null) {
            args.add(new Expr.Starred(line(ctx), text(ctx), expr(ctx.test())));
        } else if (ctx.comp_for() != null) {
            // f(x for x in xs)
            args.add(new Expr.Comprehension(line(ctx), text(ctx), ComprehensionKind.GENERATOR, expr(ctx.test()),
                    null, generators(ctx.comp_for())));
        } else {
            args.add(expr(ctx.test()));
        }
    }

    private Expr subscriptlist(DslParser.SubscriptlistContext ctx) {
        List<Expr> indices = new ArrayList<>();
        for (DslParser.SubscriptContext subscript : ctx.subscript()) {
            indices.add(subscript(subscript));
        }
        if (indices.size() == 1 && ctx.COMMA().isEmpty()) {
            return indices.get(0);
        }
        return new Expr.Sequence(line(ctx), text(ctx), SequenceKind.TUPLE, indices);
    }

    private Expr subscript(DslParser.SubscriptContext ctx) {
        if (ctx.COLON().isEmpty()) {
            return expr(ctx.test(0));
        }
        Expr[] parts = new Expr[3];
        int slot = 0;
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode) {
                slot++;
            } else {
                parts[slot] = expr(child);
            }
        }
        return new Expr.Slice(line(ctx), text(ctx), parts[0], parts[1], parts[2]);
    }

    @Override
    public Node visitAtom(DslParser.AtomContext ctx) {
        int line = line(ctx);
        String text = text(ctx);
        if (ctx.NAME() != null) {
            return new Expr.Name(line, text, ctx.NAME().getText());
        }
        if (ctx.NUMBER() != null) {
            return number(line, text);
        }
        if (!ctx.STRING().isEmpty()) {
            return strings(line, text, ctx.STRING());
        }
        if (ctx.NONE() != null) {
            return new Expr.Constant(line, text, null, true);
        }
        if (ctx.TRUE() != null || ctx.FALSE() != null) {
            return new Expr.Constant(line, text, ctx.TRUE() != null, true);
        }
        if (ctx.ELLIPSIS() != null) {
            return new Expr.Constant(line, text, text, false);
        }
        if (ctx.OPEN_PAREN() != null) {
            return display(ctx, ctx.testlist_comp(), SequenceKind.TUPLE, ComprehensionKind.GENERATOR);
        }
        if (ctx.OPEN_BRACK() != null) {
            return display(ctx, ctx.testlist_comp(), SequenceKind.LIST, ComprehensionKind.LIST);
        }
        return brace(ctx, ctx.dictorsetmaker());
    }

    private Expr display(DslParser.AtomContext ctx, DslParser.Testlist_compContext items, SequenceKind kind,
            ComprehensionKind compKind) {
        if (items == null) {
            return new Expr.Sequence(line(ctx), text(ctx), kind, List.of());
        }
        if (items.comp_for() != null) {
            return new Expr.Comprehension(line(ctx), text(ctx), compKind, expr(items.getChild(0)), null,
                    generators(items.comp_for()));
        }
        List<Expr> elements = elements(items);
        if (kind == SequenceKind.TUPLE && elements.size() == 1 && items.COMMA().isEmpty()) {
            // parenthesised expression
            return elements.get(0);
        }
        return new Expr.Sequence(line(ctx), text(ctx), kind, elements);
    }

    private Expr brace(DslParser.AtomContext ctx, DslParser.DictorsetmakerContext items) {
        if (items == null) {
            return new Expr.Dict(line(ctx), text(ctx), new ArrayList<>(), List.of());
        }
        if (items.dict_entry().isEmpty()) {
            if (items.comp_for() != null) {
                return new Expr.Comprehension(line(ctx), text(ctx), ComprehensionKind.SET, expr(items.getChild(0)),
                        null, generators(items.comp_for()));
            }
            return new Expr.Sequence(line(ctx), text(ctx), SequenceKind.SET, elements(items));
        }
        if (items.comp_for() != null) {
            DslParser.Dict_entryContext entry = items.dict_entry(0);
            if (entry.POWER() != null) {
                throw DslViolation.syntax("dict unpacking cannot be used in dict comprehension", line(ctx),
                        ctx.getStart().getCharPositionInLine());
            }
            return new Expr.Comprehension(line(ctx), text(ctx), ComprehensionKind.DICT, expr(entry.test(0)),
                    expr(entry.test(1)), generators(items.comp_for()));
        }
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        for (DslParser.Dict_entryContext entry : items.dict_entry()) {
            if (entry.POWER() != null) {
                keys.add(null);
                values.add(expr(entry.expr()));
            } else {
                keys.add(expr(entry.test(0)));
                values.add(expr(entry.test(1)));
            }
        }
        return new Expr.Dict(line(ctx), text(ctx), keys, values);
    }

    private List<Expr> elements(ParserRuleContext ctx) {
        List<Expr> elements = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof DslParser.TestContext || child instanceof DslParser.Star_exprContext) {
                elements.add(expr(child));
            }
        }
        return elements;
    }

    private List<Expr.Generator> generators(DslParser.Comp_forContext first) {
        List<Expr.Generator> generators = new ArrayList<>();
        DslParser.Comp_forContext current = first;
        while (current != null) {
            List<Expr> ifs = new ArrayList<>();
            DslParser.Comp_iterContext iter = current.comp_iter();
            DslParser.Comp_forContext next = null;
            while (iter != null) {
                if (iter.comp_for() != null) {
                    next = iter.comp_for();
                    break;
                }
                ifs.add(expr(iter.comp_if().or_test()));
                iter = iter.comp_if().comp_iter();
            }
            generators.add(new Expr.Generator(exprlist(current.exprlist()), expr(current.or_test()), ifs,
                    current.ASYNC() != null));
            current = next;
        }
        return generators;
    }

    // ==================== literals ====================

    private static Expr number(int line, String text) {
        String digits = text.replace("_", "");
        char last = digits.charAt(digits.length() - 1);
        if (last == 'j' || last == 'J') {
            return new Expr.Constant(line, text, text, false);
        }
        String lower = digits.toLowerCase();
        if (lower.startsWith("0x")) {
            return new Expr.Constant(line, text, narrow(new BigInteger(digits.substring(2), 16)), true);
        }
        if (lower.startsWith("0o")) {
            return new Expr.Constant(line, text, narrow(new BigInteger(digits.substring(2), 8)), true);
        }
        if (lower.startsWith("0b")) {
            return new Expr.Constant(line, text, narrow(new BigInteger(digits.substring(2), 2)), true);
        }
        if (lower.contains(".") || lower.contains("e")) {
            return new Expr.Constant(line, text, Double.parseDouble(digits), true);
        }
        return new Expr.Constant(line, text, narrow(new BigInteger(digits)), true);
    }

    private static Number narrow(BigInteger value) {
        return value.bitLength() < 64 ? (Number) value.longValue() : value;
    }

    /** Decoded form of one STRING token. */
    private record StringPiece(String body, boolean raw, boolean bytes, boolean format) {
    }

    private static StringPiece piece(String token) {
        int quote = 0;
        while (token.charAt(quote) != '\'' && token.charAt(quote) != '"') {
            quote++;
        }
        String prefix = token.substring(0, quote).toLowerCase();
        String rest = token.substring(quote);
        int width = rest.startsWith("'''") || rest.startsWith("\"\"\"") ? 3 : 1;
        String body = rest.substring(width, rest.length() - width);
        return new StringPiece(body, prefix.contains("r"), prefix.contains("b"), prefix.contains("f"));
    }

    /**
     * Adjacent string literals concatenate; if any of them is an f-string the
     * result is a {@link Expr.JoinedStr}.
     */
    private Expr strings(int line, String text, List<TerminalNode> tokens) {
        List<StringPiece> pieces = new ArrayList<>();
        boolean anyFormat = false;
        for (TerminalNode token : tokens) {
            StringPiece piece = piece(token.getText());
            if (piece.bytes()) {
                return new Expr.Constant(line, text, text, false);
            }
            anyFormat |= piece.format();
            pieces.add(piece);
        }

        if (!anyFormat) {
            StringBuilder value = new StringBuilder();
            for (StringPiece piece : pieces) {
                value.append(piece.raw() ? piece.body() : unescape(piece.body()));
            }
            return new Expr.Constant(line, text, value.toString(), true);
        }

        List<Expr> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        for (StringPiece piece : pieces) {
            if (!piece.format()) {
                literal.append(piece.raw() ? piece.body() : unescape(piece.body()));
                continue;
            }
            splitFormat(piece, line, literal, parts);
        }
        if (literal.length() > 0) {
            parts.add(new Expr.Constant(line, literal.toString(), literal.toString(), true));
        }
        return new Expr.JoinedStr(line, text, parts);
    }

    private static void splitFormat(StringPiece piece, int line, StringBuilder literal, List<Expr> parts) {
        String body = piece.body();
        StringBuilder chunk = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                chunk.append('{');
                i += 2;
            } else if (ch == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                chunk.append('}');
                i += 2;
            } else if (ch == '}') {
                throw DslViolation.syntax("f-string: single '}' is not allowed", line, i);
            } else if (ch == '{') {
                literal.append(piece.raw() ? chunk.toString() : unescape(chunk.toString()));
                chunk.setLength(0);
                if (literal.length() > 0) {
                    parts.add(new Expr.Constant(line, literal.toString(), literal.toString(), true));
                    literal.setLength(0);
                }
                int end = slotEnd(body, i + 1, line);
                parts.add(slot(body.substring(i + 1, end), line));
                i = end + 1;
            } else {
                chunk.append(ch);
                i++;
            }
        }
        literal.append(piece.raw() ? chunk.toString() : unescape(chunk.toString()));
    }

    /** Index of the '}' closing the slot that starts at {@code from}. */
    private static int slotEnd(String body, int from, int line) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || (ch == '}' && depth > 0)) {
                depth--;
            } else if (ch == '}') {
                return i;
            }
        }
        throw DslViolation.syntax("f-string: expecting '}'", line, from);
    }

    private static Expr.FormattedValue slot(String content, int line) {
        String expression = content;
        String conversion = null;
        String formatSpec = null;
        int depth = 0;
        for (int i = 0; i < content.length(); i++) {
            char ch = content.charAt(i);
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
            } else if (depth == 0 && ch == '!' && (i + 1 >= content.length() || content.charAt(i + 1) != '=')) {
                expression = content.substring(0, i);
                String tail = content.substring(i + 1);
                int colon = tail.indexOf(':');
                conversion = colon < 0 ? tail : tail.substring(0, colon);
                formatSpec = colon < 0 ? null : tail.substring(colon + 1);
                break;
            } else if (depth == 0 && ch == ':') {
                expression = content.substring(0, i);
                formatSpec = content.substring(i + 1);
                break;
            }
        }
        String trimmed = expression.strip();
        if (trimmed.endsWith("=") && !trimmed.endsWith("==")) {
            // self-documenting {name=}
            conversion = conversion == null ? "=" : conversion;
            trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
        }
        if (trimmed.isEmpty()) {
            throw DslViolation.syntax("f-string: empty expression not allowed", line, 0);
        }
        Expr value = parseExpression(trimmed, line);
        return new Expr.FormattedValue(line, "{" + content + "}", value, conversion, formatSpec);
    }

    static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                sb.append(ch);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> {
                }
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000b');
                case 'x' -> i = appendCodePoint(sb, body, i, 2);
                case 'u' -> i = appendCodePoint(sb, body, i, 4);
                case 'U' -> i = appendCodePoint(sb, body, i, 8);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && body.charAt(end) >= '0'
                                && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        // unknown escapes are kept verbatim
                        sb.append('\\').append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendCodePoint(StringBuilder sb, String body, int from, int width) {
        int end = Math.min(body.length(), from + width);
        try {
            sb.appendCodePoint(Integer.parseInt(body.substring(from, end), 16));
        } catch (IllegalArgumentException e) {
            throw DslViolation.unsupportedLiteral("bad escape in string: " + body, -1);
        }
        return end;
    }
}
