package net.littleredcomputer.boolprop.atoms;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.boolprop.solver.BooleanVar;
import net.littleredcomputer.boolprop.solver.Constraint;
import net.littleredcomputer.boolprop.solver.IntVar;
import net.littleredcomputer.boolprop.solver.Solver;
import net.littleredcomputer.boolprop.trail.Trail;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns every atom of the network and is the only way to flip one. Each boolean
 * variable seen by the store gets an ordinal, in first-seen order, and a pair of
 * atoms (true and false) allocated together.
 * <p>
 * The network is built before the store is posted: posting installs a bound-demon on
 * every variable, after which no atoms, edges or aggregate constraints may be added.
 */
public class AtomStore implements Constraint {
    private static final Logger log = LogManager.getFormatterLogger(AtomStore.class);
    private final Solver solver;
    private final Map<IntVar, Integer> ordinals = new IdentityHashMap<>();
    private final List<IntVar> variables = new ArrayList<>();
    private final List<Atom> trueAtoms = new ArrayList<>();
    private final List<Atom> falseAtoms = new ArrayList<>();
    private final List<AtMostKGuard> guards = new ArrayList<>();
    private final List<AtLeastKTrigger> triggers = new ArrayList<>();
    private boolean posted = false;

    public AtomStore(Solver solver) {
        this.solver = solver;
    }

    public Solver solver() {
        return solver;
    }

    Trail trail() {
        return solver.trail();
    }

    /**
     * @param var a boolean variable, or a negated view of one
     * @param negated whether the false atom is wanted
     * @return the atom asserting {@code var == (negated ? 0 : 1)}
     */
    public AtomIndex atomFor(IntVar var, boolean negated) {
        BooleanVar b = solver.isBooleanVar(var)
                .orElseThrow(() -> new IllegalArgumentException(var.name() + " is not a boolean variable"));
        int ordinal = ordinalOf(b.var());
        return negated != b.negated() ? AtomIndex.falseAtom(ordinal) : AtomIndex.trueAtom(ordinal);
    }

    private int ordinalOf(IntVar var) {
        Integer ordinal = ordinals.get(var);
        return ordinal != null ? ordinal : allocate(var);
    }

    // Both polarities are always created together.
    private int allocate(IntVar var) {
        checkNotPosted();
        final int ordinal = variables.size();
        variables.add(var);
        ordinals.put(var, ordinal);
        trueAtoms.add(new Atom(AtomIndex.trueAtom(ordinal), trail()));
        falseAtoms.add(new Atom(AtomIndex.falseAtom(ordinal), trail()));
        return ordinal;
    }

    public int variableCount() {
        return variables.size();
    }

    public IntVar variable(int ordinal) {
        return variables.get(ordinal);
    }

    /**
     * Flip an atom. Flipping {@link AtomIndex#FAIL}, or an atom whose complement is
     * already flipped, is a contradiction. Flipping an atom that is already flipped
     * does nothing.
     */
    public void flip(AtomIndex atom) {
        if (atom.isFail()) solver.fail();
        flip(atom.value());
    }

    void flip(int atom) {
        if (atom == 0 || isFlipped(-atom)) solver.fail();
        Atom a = find(atom);
        if (a.isFlipped()) return;
        variables.get(Math.abs(atom) - 1).setValue(atom > 0 ? 1 : 0);
        a.flip(this);
    }

    public boolean isFlipped(AtomIndex atom) {
        return isFlipped(atom.value());
    }

    boolean isFlipped(int atom) {
        return atom != 0 && find(atom).isFlipped();
    }

    /**
     * Reacts to variable {@code ordinal} becoming bound by flipping the atom its value
     * makes true. Idempotent.
     */
    void onVariableBound(int ordinal) {
        IntVar var = variables.get(ordinal);
        flip(var.min() == 0 ? -ordinal - 1 : ordinal + 1);
    }

    void addImplication(AtomIndex source, AtomIndex target) {
        checkNotPosted();
        if (target.isFail()) throw new IllegalArgumentException("implication target cannot be the failure atom");
        find(target.value());
        find(source).addImplication(target);
    }

    void subscribe(AtomIndex atom, AtMostKGuard guard) {
        checkNotPosted();
        find(atom).subscribe(guard);
    }

    void subscribe(AtomIndex atom, AtLeastKTrigger trigger) {
        checkNotPosted();
        find(atom).subscribe(trigger);
    }

    void unsubscribe(int atom, AtLeastKTrigger trigger) {
        find(atom).unsubscribe(trigger);
    }

    void register(AtMostKGuard guard) {
        checkNotPosted();
        guards.add(guard);
    }

    void register(AtLeastKTrigger trigger) {
        checkNotPosted();
        triggers.add(trigger);
    }

    public List<AtMostKGuard> guards() {
        return ImmutableList.copyOf(guards);
    }

    public List<AtLeastKTrigger> triggers() {
        return ImmutableList.copyOf(triggers);
    }

    @Override
    public void post() {
        checkNotPosted();
        posted = true;
        for (int i = 0; i < variables.size(); ++i) {
            final int ordinal = i;
            variables.get(i).whenBound(() -> onVariableBound(ordinal));
        }
        log.debug("store posted with %d variables, %d guards, %d triggers", variables.size(), guards.size(), triggers.size());
    }

    @Override
    public void initialPropagate() {
        for (int i = 0; i < variables.size(); ++i) {
            if (variables.get(i).isBound()) onVariableBound(i);
        }
    }

    Atom find(AtomIndex atom) {
        if (atom.isFail()) throw new IllegalArgumentException("the failure atom has no node");
        return find(atom.value());
    }

    private Atom find(int atom) {
        final int ordinal = Math.abs(atom) - 1;
        if (ordinal >= variables.size()) throw new IllegalArgumentException("unknown atom " + atom);
        return atom > 0 ? trueAtoms.get(ordinal) : falseAtoms.get(ordinal);
    }

    private void checkNotPosted() {
        if (posted) throw new IllegalStateException("the atom network cannot change after the store is posted");
    }

    @Override
    public String toString() {
        return String.format("AtomStore(%d variables, %d guards, %d triggers)", variables.size(), guards.size(), triggers.size());
    }
}
