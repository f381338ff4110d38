package net.littleredcomputer.boolprop.solver;

import net.littleredcomputer.boolprop.trail.RevInt;

import java.util.ArrayList;
import java.util.List;

class DomainVar extends IntVar {
    private final Solver solver;
    private final RevInt min;
    private final RevInt max;
    private final List<Runnable> onBound = new ArrayList<>();

    DomainVar(Solver solver, String name, int min, int max) {
        super(name);
        if (min > max) throw new IllegalArgumentException("empty domain for " + name);
        this.solver = solver;
        this.min = solver.trail().makeRevInt(min);
        this.max = solver.trail().makeRevInt(max);
    }

    @Override public int min() { return min.value(); }
    @Override public int max() { return max.value(); }

    @Override
    public void setMin(int m) {
        if (m <= min.value()) return;
        if (m > max.value()) solver.fail();
        min.setValue(m);
        if (isBound()) bound();
    }

    @Override
    public void setMax(int m) {
        if (m >= max.value()) return;
        if (m < min.value()) solver.fail();
        max.setValue(m);
        if (isBound()) bound();
    }

    @Override
    public void whenBound(Runnable demon) {
        onBound.add(demon);
    }

    private void bound() {
        for (Runnable d : onBound) solver.schedule(d);
    }
}
