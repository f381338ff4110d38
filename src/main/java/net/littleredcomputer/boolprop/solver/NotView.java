package net.littleredcomputer.boolprop.solver;

/** The variable {@code 1 - x} for a 0/1 variable x. */
class NotView extends IntVar {
    private final IntVar x;

    NotView(IntVar x) {
        super("~" + x.name());
        this.x = x;
    }

    IntVar base() {
        return x;
    }

    @Override public int min() { return 1 - x.max(); }
    @Override public int max() { return 1 - x.min(); }
    @Override public void setMin(int m) { x.setMax(1 - m); }
    @Override public void setMax(int m) { x.setMin(1 - m); }
    @Override public void whenBound(Runnable demon) { x.whenBound(demon); }
}
