package frontend.plangen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exception.DslViolation;

/**
 * Logical name to latest SSA id, plus the per-name version counters.
 *
 * Ids look like {@code x_3} at top level and {@code x_3@then1} inside a scope.
 * A fork copies both maps; when a scope closes the enclosing table takes over
 * the highest version seen through {@link #absorbVersions}, so an id is never
 * produced twice.
 */
public class VariableTable {
    private final ScopeContext scope;
    private final Map<String, String> bindings;
    private final Map<String, Integer> versions;

    public VariableTable(ScopeContext scope) {
        this(scope, new LinkedHashMap<>(), new HashMap<>());
    }

    private VariableTable(ScopeContext scope, Map<String, String> bindings, Map<String, Integer> versions) {
        this.scope = scope;
        this.bindings = bindings;
        this.versions = versions;
    }

    /**
     * New SSA id for {@code name}, recorded as its latest binding.
     */
    public String bind(String name) {
        String id = mint(name);
        bindings.put(name, id);
        return id;
    }

    /**
     * New SSA id for {@code name} without recording a binding. Used for
     * internal placeholders such as {@code _cond} or {@code _call}.
     */
    public String mint(String name) {
        int version = versions.merge(name, 1, Integer::sum);
        String tag = scope.current();
        return tag == null ? name + "_" + version : name + "_" + version + "@" + tag;
    }

    /** Make {@code name} refer to an existing id ({@code y = x}). */
    public void alias(String name, String id) {
        bindings.put(name, id);
    }

    public String resolve(String name, int line) {
        String id = bindings.get(name);
        if (id == null) {
            throw DslViolation.undefinedDependency(name, line);
        }
        return id;
    }

    /** @return the latest id of {@code name}, or null */
    public String lookup(String name) {
        return bindings.get(name);
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public VariableTable fork() {
        return new VariableTable(scope, new LinkedHashMap<>(bindings), new HashMap<>(versions));
    }

    /** Copy of the bindings, in first-binding order. */
    public Map<String, String> snapshot() {
        return new LinkedHashMap<>(bindings);
    }

    public void absorbVersions(VariableTable other) {
        for (Map.Entry<String, Integer> entry : other.versions.entrySet()) {
            versions.merge(entry.getKey(), entry.getValue(), Math::max);
        }
    }

    /**
     * Names bound in both snapshots whose latest id differs, in the order of
     * {@code before}. A name missing from either side is never reported.
     */
    public static List<String> diff(Map<String, String> before, Map<String, String> after) {
        List<String> changed = new ArrayList<>();
        for (Map.Entry<String, String> entry : before.entrySet()) {
            String other = after.get(entry.getKey());
            if (other != null && !other.equals(entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        return changed;
    }

    @Override
    public String toString() {
        return "VariableTable" + bindings;
    }
}
