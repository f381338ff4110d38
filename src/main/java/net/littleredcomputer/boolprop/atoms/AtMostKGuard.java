package net.littleredcomputer.boolprop.atoms;

import net.littleredcomputer.boolprop.trail.RevInt;

import java.util.Arrays;
import java.util.List;

/**
 * At most K of the watched atoms may be flipped. When exactly K are, every other
 * watched atom is forced false; a (K+1)-th is a contradiction.
 */
public class AtMostKGuard {
    private final int[] watched;
    private final int k;
    private RevInt count;  // watched atoms flipped in the current branch

    public AtMostKGuard(List<AtomIndex> watched, int k) {
        if (k < 0) throw new IllegalArgumentException("threshold must be non-negative");
        this.watched = AggregateConstraints.watchList(watched);
        this.k = k;
    }

    public void post(AtomStore store) {
        if (count != null) throw new IllegalStateException("guard already posted");
        count = store.trail().makeRevInt(0);
        store.register(this);
        for (int w : watched) store.subscribe(AtomIndex.of(w), this);
    }

    void onWatchedFlip(AtomStore store) {
        final int c = count.increment();
        if (c > k) {
            store.solver().fail();
        } else if (c == k) {
            forceRemainingFalse(store);
        }
    }

    private void forceRemainingFalse(AtomStore store) {
        for (int w : watched) {
            if (!store.isFlipped(w)) store.flip(-w);
        }
    }

    public int count() {
        return count == null ? 0 : count.value();
    }

    public int threshold() {
        return k;
    }

    @Override
    public String toString() {
        return "AtMost(" + k + ", " + Arrays.toString(watched) + ")";
    }
}
