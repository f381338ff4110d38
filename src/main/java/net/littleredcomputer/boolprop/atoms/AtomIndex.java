package net.littleredcomputer.boolprop.atoms;

import com.google.common.base.Preconditions;

/**
 * Identifies one polarity of a boolean variable. For the variable with store ordinal k,
 * the true atom is {@code k+1} and the false atom {@code -(k+1)}, so negation always yields
 * the complementary atom. {@link #FAIL} is a separate value that names no atom at all.
 */
public final class AtomIndex {
    public static final AtomIndex FAIL = new AtomIndex(0);

    private final int value;

    private AtomIndex(int value) {
        this.value = value;
    }

    public static AtomIndex of(int value) {
        Preconditions.checkArgument(value != 0, "0 is reserved for the failure atom");
        Preconditions.checkArgument(value != Integer.MIN_VALUE, "%s has no negation", value);
        return new AtomIndex(value);
    }

    static AtomIndex trueAtom(int ordinal) {
        return of(ordinal + 1);
    }

    static AtomIndex falseAtom(int ordinal) {
        return of(-ordinal - 1);
    }

    public boolean isFail() {
        return value == 0;
    }

    public AtomIndex negate() {
        return isFail() ? FAIL : new AtomIndex(-value);
    }

    /** @return true for the atom asserting that its variable is 1 */
    public boolean isTrueAtom() {
        return value > 0;
    }

    /** @return the store ordinal of the variable this atom belongs to */
    public int ordinal() {
        Preconditions.checkState(!isFail(), "the failure atom has no variable");
        return Math.abs(value) - 1;
    }

    /** The signed encoding. */
    public int value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AtomIndex && ((AtomIndex) o).value == value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return isFail() ? "FAIL" : Integer.toString(value);
    }
}
