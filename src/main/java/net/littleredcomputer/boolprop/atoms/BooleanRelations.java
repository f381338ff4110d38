package net.littleredcomputer.boolprop.atoms;

import net.littleredcomputer.boolprop.solver.BooleanVar;
import net.littleredcomputer.boolprop.solver.IntVar;
import net.littleredcomputer.boolprop.solver.Solver;

import javax.annotation.CheckReturnValue;
import java.util.Optional;

/**
 * Encodes relations between two boolean variables as implication edges. Each method
 * returns false, leaving the network untouched, when either side is not boolean.
 */
public final class BooleanRelations {
    private BooleanRelations() {}

    /** left == right */
    @CheckReturnValue
    public static boolean addBoolEq(AtomStore store, IntVar left, IntVar right) {
        AtomIndex[] atoms = resolve(store, left, right);
        if (atoms == null) return false;
        AtomIndex l = atoms[0], r = atoms[1];
        store.addImplication(l, r);
        store.addImplication(r, l);
        store.addImplication(l.negate(), r.negate());
        store.addImplication(r.negate(), l.negate());
        return true;
    }

    /** left <= right */
    @CheckReturnValue
    public static boolean addBoolLe(AtomStore store, IntVar left, IntVar right) {
        AtomIndex[] atoms = resolve(store, left, right);
        if (atoms == null) return false;
        AtomIndex l = atoms[0], r = atoms[1];
        store.addImplication(l, r);
        store.addImplication(r.negate(), l.negate());
        return true;
    }

    /** left == not right */
    @CheckReturnValue
    public static boolean addBoolNot(AtomStore store, IntVar left, IntVar right) {
        AtomIndex[] atoms = resolve(store, left, right);
        if (atoms == null) return false;
        AtomIndex l = atoms[0], r = atoms[1];
        store.addImplication(l, r.negate());
        store.addImplication(r, l.negate());
        store.addImplication(l.negate(), r);
        store.addImplication(r.negate(), l);
        return true;
    }

    // Both sides are resolved before any atom is allocated.
    private static AtomIndex[] resolve(AtomStore store, IntVar left, IntVar right) {
        Solver solver = store.solver();
        Optional<BooleanVar> l = solver.isBooleanVar(left);
        Optional<BooleanVar> r = solver.isBooleanVar(right);
        if (!l.isPresent() || !r.isPresent()) return null;
        return new AtomIndex[]{
                store.atomFor(l.get().var(), l.get().negated()),
                store.atomFor(r.get().var(), r.get().negated())
        };
    }
}
