package ir;

/**
 * Operation names the compiler itself synthesises. User calls keep their
 * dotted callee name (e.g. {@code AGENT.summarize}) and have no Opcode.
 */
public enum Opcode {
    CONST("CONST.value"),
    PACK_LIST("PACK.list"),
    PACK_TUPLE("PACK.tuple"),
    PACK_DICT("PACK.dict"),
    TEXT_FORMAT("TEXT.format"),
    COMP_LIST("COMP.listcomp"),
    COMP_SET("COMP.setcomp"),
    COMP_DICT("COMP.dictcomp"),
    COMP_GENERATOR("COMP.genexpr"),
    COMP_FOREACH("COMP.foreach"),
    GET_ITEM("GET.item"),
    SET_ITEM("SET.item"),
    EXPR_EVAL("EXPR.eval"),
    COND_EVAL("COND.eval"),
    ITER_EVAL("ITER.eval"),
    ITER_ITEM("ITER.item"),
    PHI("PHI"),
    BREAK("CTRL.break"),
    EXIT("CTRL.exit"),
    EXC_CAUGHT("EXC.caught");

    private final String opName;

    Opcode(String opName) {
        this.opName = opName;
    }

    public String getOpName() {
        return opName;
    }

    public boolean isPack() {
        return this == PACK_LIST || this == PACK_TUPLE;
    }

    /** Nodes that model control flow rather than data. */
    public boolean isControl() {
        return this == COND_EVAL || this == ITER_EVAL || this == PHI || this == BREAK || this == EXIT;
    }

    public static Opcode fromOpName(String opName) {
        for (Opcode opcode : values()) {
            if (opcode.opName.equals(opName)) {
                return opcode;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return opName;
    }
}
