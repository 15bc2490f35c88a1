package frontend.grammar;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Base class of the generated {@code DslLexer}.
 *
 * Python-style blocks have no braces, so the lexer turns line starts into
 * NEWLINE / INDENT / DEDENT tokens. Line breaks inside (), [] and {} are
 * ignored, as are blank and comment-only lines.
 */
public abstract class DslLexerBase extends Lexer {
    private LinkedList<Token> pending = new LinkedList<>();
    private Deque<Integer> indents = new ArrayDeque<>();
    private int opened = 0;
    private boolean eofSeen = false;
    private Token lastToken = null;

    protected DslLexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
    }

    @Override
    public Token nextToken() {
        if (_input.LA(1) == EOF && !eofSeen) {
            eofSeen = true;
            pending.removeIf(t -> t.getType() == EOF);
            // close the last logical line, then every open block
            emit(commonToken(DslLexer.NEWLINE, "\n"));
            while (!indents.isEmpty()) {
                emit(createDedent());
                indents.pop();
            }
            emit(commonToken(EOF, "<EOF>"));
        }

        Token next = super.nextToken();
        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = next;
        }
        return pending.isEmpty() ? next : pending.poll();
    }

    private Token createDedent() {
        CommonToken dedent = commonToken(DslLexer.DEDENT, "");
        if (lastToken != null) {
            dedent.setLine(lastToken.getLine());
        }
        return dedent;
    }

    private CommonToken commonToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        return token;
    }

    /**
     * Tabs advance to the next multiple of eight, as in CPython.
     */
    static int indentationOf(String spaces) {
        int count = 0;
        for (char ch : spaces.toCharArray()) {
            if (ch == '\t') {
                count += 8 - (count % 8);
            } else {
                count++;
            }
        }
        return count;
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    protected void openBrace() {
        opened++;
    }

    protected void closeBrace() {
        if (opened > 0) {
            opened--;
        }
    }

    protected void onNewLine() {
        String newLine = getText().replaceAll("[^\r\n\f]+", "");
        String spaces = getText().replaceAll("[\r\n\f]+", "");
        int next = _input.LA(1);
        int nextNext = _input.LA(2);

        if (opened > 0 || (nextNext != EOF && (next == '\r' || next == '\n' || next == '\f' || next == '#'))) {
            // inside brackets, or a blank / comment-only line
            skip();
            return;
        }

        emit(commonToken(DslLexer.NEWLINE, newLine));
        int indent = indentationOf(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(commonToken(DslLexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(createDedent());
                indents.pop();
            }
        }
    }

    @Override
    public void reset() {
        pending = new LinkedList<>();
        indents = new ArrayDeque<>();
        opened = 0;
        eofSeen = false;
        lastToken = null;
        super.reset();
    }
}
