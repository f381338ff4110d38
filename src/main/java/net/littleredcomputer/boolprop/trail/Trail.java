package net.littleredcomputer.boolprop.trail;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.ArrayList;
import java.util.List;

/**
 * A checkpoint/restore log. Reversible primitives record an undo entry the first
 * time they change after a checkpoint; {@link #pop()} replays those entries, newest
 * first, back to the most recent checkpoint.
 */
public final class Trail {
    /** An undo record: restores one field to the value it held when the record was made. */
    interface Entry {
        void restore();
    }

    private final List<Entry> entries = new ArrayList<>();
    private final TIntStack marks = new TIntArrayStack();  // entries.size() at each open checkpoint
    private long stamp = 0;  // changes whenever a checkpoint is opened or closed

    public void push() {
        marks.push(entries.size());
        ++stamp;
    }

    public void pop() {
        if (marks.size() == 0) throw new IllegalStateException("no checkpoint to restore");
        final int mark = marks.pop();
        for (int i = entries.size() - 1; i >= mark; --i) entries.remove(i).restore();
        ++stamp;
    }

    /** Restores every checkpoint, returning the trail to the root level. */
    public void popAll() {
        while (marks.size() > 0) pop();
    }

    public int level() {
        return marks.size();
    }

    public RevInt makeRevInt(int initialValue) {
        return new RevInt(this, initialValue);
    }

    public RevSwitch makeRevSwitch() {
        return new RevSwitch(this);
    }

    long stamp() {
        return stamp;
    }

    // Nothing below the first checkpoint is ever restored.
    void record(Entry e) {
        if (marks.size() > 0) entries.add(e);
    }

    int entryCount() {
        return entries.size();
    }
}
