package net.littleredcomputer.boolprop.solver;

/**
 * Signals that the current search node is inconsistent. Carries no payload: the search
 * driver only needs to know that the branch failed.
 */
public final class Contradiction extends RuntimeException {
    Contradiction() {
        super("contradiction", null, false, false);
    }
}
