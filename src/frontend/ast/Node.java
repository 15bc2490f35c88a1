package frontend.ast;

/**
 * Common base of every tree node: the 1-based source line and the exact source
 * text the node was built from.
 */
public abstract class Node {
    private final int line;
    private final String text;

    protected Node(int line, String text) {
        this.line = line;
        this.text = text;
    }

    public int getLine() {
        return line;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + text + ")";
    }
}
