package frontend.plangen;

/**
 * Where a lowered value lands: a new version of a user variable, or an
 * internal placeholder id that is never recorded as a binding.
 */
public final class Target {
    private final String name;
    private final boolean variable;

    private Target(String name, boolean variable) {
        this.name = name;
        this.variable = variable;
    }

    public static Target variable(String name) {
        return new Target(name, true);
    }

    public static Target internal(String name) {
        return new Target(name, false);
    }

    /** Produce the SSA id for the operation about to be emitted. */
    public String claim(VariableTable table) {
        return variable ? table.bind(name) : table.mint(name);
    }

    public String getName() {
        return name;
    }

    public boolean isVariable() {
        return variable;
    }

    @Override
    public String toString() {
        return (variable ? "var " : "internal ") + name;
    }
}
