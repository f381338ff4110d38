package net.littleredcomputer.boolprop.solver;

/**
 * The result of resolving a variable as a boolean: the underlying 0/1 variable, and
 * whether the resolved variable is its negation.
 */
public final class BooleanVar {
    private final IntVar var;
    private final boolean negated;

    BooleanVar(IntVar var, boolean negated) {
        this.var = var;
        this.negated = negated;
    }

    public IntVar var() {
        return var;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public String toString() {
        return (negated ? "~" : "") + var.name();
    }
}
