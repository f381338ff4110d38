package net.littleredcomputer.boolprop.atoms;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class AggregateConstraints {
    private AggregateConstraints() {}

    /** Encode a watch list, rejecting the failure atom and repeated atoms. */
    static int[] watchList(List<AtomIndex> atoms) {
        if (atoms.isEmpty()) throw new IllegalArgumentException("watch list must not be empty");
        Set<AtomIndex> seen = new HashSet<>();
        int[] w = new int[atoms.size()];
        for (int i = 0; i < w.length; ++i) {
            AtomIndex a = atoms.get(i);
            if (a.isFail()) throw new IllegalArgumentException("cannot watch the failure atom");
            if (!seen.add(a)) throw new IllegalArgumentException("atom repeated in watch list: " + a);
            w[i] = a.value();
        }
        return w;
    }
}
