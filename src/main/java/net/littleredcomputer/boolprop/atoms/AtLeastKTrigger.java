package net.littleredcomputer.boolprop.atoms;

import net.littleredcomputer.boolprop.trail.RevInt;

import java.util.Arrays;
import java.util.List;

/**
 * Once K of the watched atoms are flipped, flip every action atom. The trigger fires at
 * most once per branch: on firing it stops listening to its watched atoms, and because
 * the subscription sets only shrink reversibly it is listening again after backtracking.
 * An action may be {@link AtomIndex#FAIL}, making the trigger a pure prohibition.
 */
public class AtLeastKTrigger {
    private final int[] watched;
    private final int k;
    private final int[] actions;
    private RevInt count;

    public AtLeastKTrigger(List<AtomIndex> watched, int k, List<AtomIndex> actions) {
        if (k < 1) throw new IllegalArgumentException("threshold must be positive");
        this.watched = AggregateConstraints.watchList(watched);
        if (k > this.watched.length) throw new IllegalArgumentException("threshold exceeds watch list size");
        this.k = k;
        this.actions = actions.stream().mapToInt(AtomIndex::value).toArray();
    }

    public void post(AtomStore store) {
        if (count != null) throw new IllegalStateException("trigger already posted");
        for (int a : actions) if (a != 0) store.find(AtomIndex.of(a));
        count = store.trail().makeRevInt(0);
        store.register(this);
        for (int w : watched) store.subscribe(AtomIndex.of(w), this);
    }

    void onWatchedFlip(AtomStore store) {
        if (count.value() >= k) return;  // already fired in this branch
        if (count.increment() >= k) {
            stopListening(store);
            for (int a : actions) store.flip(a);
        }
    }

    private void stopListening(AtomStore store) {
        for (int w : watched) store.unsubscribe(w, this);
    }

    public int count() {
        return count == null ? 0 : count.value();
    }

    public boolean fired() {
        return count != null && count.value() >= k;
    }

    @Override
    public String toString() {
        return "AtLeast(" + k + ", " + Arrays.toString(watched) + " => " + Arrays.toString(actions) + ")";
    }
}
