package frontend.plangen;

import exception.DslViolation;
import ir.PlanBuilder;

/**
 * State owned by one compilation attempt: the operation list, the scope tags,
 * the active variable table and the nesting depth. Discarded on error.
 */
public class PlanContext {
    private final CompilerConfig config;
    private final PlanBuilder builder;
    private final ScopeContext scope;
    private VariableTable table;
    private int depth = 0;

    public PlanContext(CompilerConfig config) {
        this.config = config;
        this.builder = new PlanBuilder(config.getMaxOps());
        this.scope = new ScopeContext();
        this.table = new VariableTable(scope);
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public PlanBuilder getBuilder() {
        return builder;
    }

    public ScopeContext getScope() {
        return scope;
    }

    public VariableTable getTable() {
        return table;
    }

    public void setTable(VariableTable table) {
        this.table = table;
    }

    public void enter(int line) {
        depth++;
        if (depth > config.getMaxDepth()) {
            throw DslViolation.tooDeep(config.getMaxDepth(), line);
        }
    }

    public void leave() {
        depth--;
    }
}
