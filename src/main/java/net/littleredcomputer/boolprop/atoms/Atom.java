package net.littleredcomputer.boolprop.atoms;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.boolprop.trail.DynamicMembershipSet;
import net.littleredcomputer.boolprop.trail.RevSwitch;
import net.littleredcomputer.boolprop.trail.Trail;

import java.util.ArrayList;
import java.util.List;

/**
 * One boolean literal: the atoms it implies, the aggregate constraints that watch it,
 * and whether it has been flipped in the current branch.
 */
final class Atom {
    private final AtomIndex index;
    private final TIntArrayList implications = new TIntArrayList();
    private final List<AtMostKGuard> guards = new ArrayList<>();
    private final DynamicMembershipSet<AtLeastKTrigger> triggers;
    private final RevSwitch flipped;

    Atom(AtomIndex index, Trail trail) {
        this.index = index;
        this.triggers = new DynamicMembershipSet<>(trail);
        this.flipped = trail.makeRevSwitch();
    }

    void subscribe(AtMostKGuard guard) {
        guards.add(guard);
    }

    void subscribe(AtLeastKTrigger trigger) {
        triggers.insert(trigger);
    }

    void unsubscribe(AtLeastKTrigger trigger) {
        triggers.removeByValue(trigger);
    }

    void addImplication(AtomIndex target) {
        implications.add(target.value());
    }

    boolean isFlipped() {
        return flipped.isOn();
    }

    /**
     * Marks this atom flipped, then flips every implied atom, then notifies guards and
     * finally triggers. Each step runs its cascade to completion before the next begins.
     * The store guarantees the atom is not already flipped.
     */
    void flip(AtomStore store) {
        Preconditions.checkState(!flipped.isOn(), "atom %s is already flipped", index);
        flipped.switchOn();
        for (int i = 0; i < implications.size(); ++i) store.flip(implications.get(i));
        for (int i = 0; i < guards.size(); ++i) guards.get(i).onWatchedFlip(store);
        // Firing triggers remove themselves from the live set, so walk a copy.
        for (AtLeastKTrigger t : triggers.snapshot()) t.onWatchedFlip(store);
    }

    int implicationCount() {
        return implications.size();
    }

    int triggerCount() {
        return triggers.size();
    }

    @Override
    public String toString() {
        return index + (isFlipped() ? "*" : "");
    }
}
