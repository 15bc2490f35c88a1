package ir;

import java.util.Objects;

/** A declared plan output: the SSA id it reads and the label it is published as. */
public final class Output {
    public static final String RETURN_LABEL = "return";

    private final String from;
    private final String as;

    public Output(String from, String as) {
        this.from = Objects.requireNonNull(from, "from");
        this.as = Objects.requireNonNull(as, "as");
    }

    public String getFrom() {
        return from;
    }

    public String getAs() {
        return as;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Output other)) {
            return false;
        }
        return from.equals(other.from) && as.equals(other.as);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, as);
    }

    @Override
    public String toString() {
        return "output(" + from + ", as=" + as + ")";
    }
}
