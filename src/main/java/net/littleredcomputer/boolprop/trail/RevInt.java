package net.littleredcomputer.boolprop.trail;

/**
 * An integer whose changes are undone when the trail is popped past them.
 */
public final class RevInt {
    private final Trail trail;
    private int value;
    private long savedAt = -1;

    RevInt(Trail trail, int value) {
        this.trail = trail;
        this.value = value;
    }

    public int value() {
        return value;
    }

    public void setValue(int v) {
        if (v == value) return;
        save();
        value = v;
    }

    public int increment() {
        setValue(value + 1);
        return value;
    }

    public int decrement() {
        setValue(value - 1);
        return value;
    }

    private void save() {
        // One undo record per checkpoint is enough: it holds the value from before the first change.
        final long s = trail.stamp();
        if (savedAt == s) return;
        final int prior = value;
        final long priorSavedAt = savedAt;
        trail.record(() -> {
            value = prior;
            savedAt = priorSavedAt;
        });
        savedAt = s;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
