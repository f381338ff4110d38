package net.littleredcomputer.boolprop.solver;

/**
 * An integer decision variable with an interval domain.
 */
public abstract class IntVar {
    private final String name;

    IntVar(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public abstract int min();

    public abstract int max();

    public boolean isBound() {
        return min() == max();
    }

    public int value() {
        if (!isBound()) throw new IllegalStateException(name + " is not bound");
        return min();
    }

    public abstract void setMin(int m);

    public abstract void setMax(int m);

    public void setValue(int v) {
        setMin(v);
        setMax(v);
    }

    /**
     * Registers a demon to be scheduled when this variable's domain becomes a singleton.
     * The demon is not run if the variable is already bound.
     */
    public abstract void whenBound(Runnable demon);

    @Override
    public String toString() {
        return isBound() ? name + "=" + min() : name + "[" + min() + ".." + max() + "]";
    }
}
