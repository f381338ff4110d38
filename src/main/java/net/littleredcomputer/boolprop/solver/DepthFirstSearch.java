package net.littleredcomputer.boolprop.solver;

import com.google.common.collect.ImmutableList;
import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.boolprop.trail.Trail;

import java.util.List;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Chronological backtracking over a fixed list of variables: branch on the first unbound
 * variable, trying its values from smallest to largest, with one trail checkpoint per
 * decision. Solutions are produced lazily.
 */
public class DepthFirstSearch extends AbstractSearch {
    private final List<IntVar> vars;

    public DepthFirstSearch(Solver solver, List<IntVar> vars) {
        super("DFS", solver);
        this.vars = ImmutableList.copyOf(vars);
    }

    @Override
    public Stream<int[]> solutions() {
        return StreamSupport.stream(new Solutions(), false);
    }

    private class Solutions implements Spliterator<int[]> {
        private final Trail trail = solver.trail();
        private final int rootLevel = trail.level();
        private final TIntArrayList decisionVar = new TIntArrayList();  // variable branched on at each depth
        private final TIntArrayList decisionValue = new TIntArrayList();  // value being tried at each depth
        private int step = 1;

        private int firstUnbound() {
            for (int i = 0; i < vars.size(); ++i) if (!vars.get(i).isBound()) return i;
            return -1;
        }

        private int[] solution() {
            int[] s = new int[vars.size()];
            for (int i = 0; i < s.length; ++i) s[i] = vars.get(i).value();
            return s;
        }

        @Override
        public boolean tryAdvance(Consumer<? super int[]> action) {
            STEP: while (true) {
                switch (step) {
                    case 1:  // Start.
                        start();
                    case 2: {  // Descend: choose a variable, or visit a solution.
                        ++nodeCount;
                        if (nodeCount % logCheckSteps == 0) maybeReportProgress(decisionValue);
                        int v = firstUnbound();
                        if (v < 0) {
                            step = 4;
                            action.accept(solution());
                            return true;
                        }
                        trail.push();
                        decisionVar.add(v);
                        decisionValue.add(vars.get(v).min());
                    }
                    case 3: {  // Try the value at the deepest level.
                        final int level = decisionVar.size() - 1;
                        final IntVar x = vars.get(decisionVar.get(level));
                        final int value = decisionValue.get(level);
                        try {
                            solver.apply(() -> x.setValue(value));
                            step = 2;
                        } catch (Contradiction e) {
                            step = 4;
                        }
                        continue STEP;
                    }
                    case 4: {  // Undo the deepest decision; try its next value or backtrack further.
                        final int level = decisionVar.size() - 1;
                        if (level < 0) {
                            stop();
                            step = 5;
                            return false;
                        }
                        trail.pop();
                        final IntVar x = vars.get(decisionVar.get(level));
                        final int next = decisionValue.get(level) + 1;
                        if (next <= x.max()) {
                            trail.push();
                            decisionValue.set(level, next);
                            step = 3;
                        } else {
                            decisionVar.removeAt(level);
                            decisionValue.removeAt(level);
                        }
                        continue STEP;
                    }
                    case 5:  // Exhausted.
                        if (trail.level() != rootLevel) throw new IllegalStateException("trail not restored to root");
                        return false;
                }
            }
        }

        @Override
        public Spliterator<int[]> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return 0;
        }
    }
}
