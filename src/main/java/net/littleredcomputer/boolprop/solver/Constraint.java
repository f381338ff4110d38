package net.littleredcomputer.boolprop.solver;

/**
 * A constraint posted to a {@link Solver}.
 */
public interface Constraint {
    /** Install demons on the variables this constraint watches. */
    void post();

    /** Propagate whatever is already known when the constraint is posted. */
    void initialPropagate();
}
