package frontend.plangen;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Stack of scope tags ({@code then1}, {@code else1}, {@code for2}, ...) shared
 * by every variable table of one compilation attempt.
 *
 * Occurrence counters are per construct kind and never reset, so the tag of a
 * region is unique within the plan.
 */
public class ScopeContext {
    public static final String IF = "if";
    public static final String FOR = "for";
    public static final String WHILE = "while";
    public static final String EXCEPT = "except";

    private final Deque<String> tags = new ArrayDeque<>();
    private final Map<String, Integer> counters = new HashMap<>();

    /** @return the occurrence number of the next construct of this kind, starting at 1 */
    public int next(String kind) {
        return counters.merge(kind, 1, Integer::sum);
    }

    public void push(String tag) {
        tags.push(tag);
    }

    public void pop() {
        if (tags.isEmpty()) {
            throw new IllegalStateException("Cannot exit top-level scope.");
        }
        tags.pop();
    }

    /** Innermost active tag, or null at function top level. */
    public String current() {
        return tags.peek();
    }

    public int depth() {
        return tags.size();
    }
}
