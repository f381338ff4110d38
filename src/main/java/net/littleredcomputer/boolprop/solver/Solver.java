package net.littleredcomputer.boolprop.solver;

import net.littleredcomputer.boolprop.trail.Trail;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Owns the trail, the variables and the demon queue. Propagation is a FIFO drain of
 * scheduled demons; a {@link Contradiction} empties the queue and unwinds to the caller.
 */
public class Solver {
    private static final Logger log = LogManager.getFormatterLogger(Solver.class);
    private final Trail trail = new Trail();
    private final Deque<Runnable> queue = new ArrayDeque<>();
    private long failures = 0;

    public Trail trail() {
        return trail;
    }

    public IntVar makeIntVar(String name, int min, int max) {
        return new DomainVar(this, name, min, max);
    }

    public IntVar makeBoolVar(String name) {
        return makeIntVar(name, 0, 1);
    }

    /** @return a view equal to {@code 1 - x}; x must be a 0/1 variable */
    public IntVar makeNot(IntVar x) {
        if (x.min() < 0 || x.max() > 1) throw new IllegalArgumentException(x.name() + " is not boolean");
        if (x instanceof NotView) return ((NotView) x).base();
        return new NotView(x);
    }

    /**
     * Determine whether v is a boolean variable, possibly the negation of another.
     * @return the underlying variable and polarity, or empty if v's domain is not within {0,1}
     */
    public Optional<BooleanVar> isBooleanVar(IntVar v) {
        boolean negated = false;
        IntVar x = v;
        if (x instanceof NotView) {
            x = ((NotView) x).base();
            negated = true;
        }
        if (x.min() < 0 || x.max() > 1) return Optional.empty();
        return Optional.of(new BooleanVar(x, negated));
    }

    public void post(Constraint c) {
        log.debug("posting %s", c);
        try {
            c.post();
            c.initialPropagate();
            propagate();
        } catch (Contradiction e) {
            queue.clear();
            throw e;
        }
    }

    void schedule(Runnable demon) {
        queue.add(demon);
    }

    /** Runs scheduled demons until none remain. */
    public void propagate() {
        try {
            while (!queue.isEmpty()) queue.poll().run();
        } catch (Contradiction e) {
            queue.clear();
            throw e;
        }
    }

    /** Applies a decision (typically narrowing a domain) and propagates its consequences. */
    public void apply(Runnable decision) {
        try {
            decision.run();
            propagate();
        } catch (Contradiction e) {
            queue.clear();
            throw e;
        }
    }

    /** Abandon the current search node. */
    public void fail() {
        ++failures;
        throw new Contradiction();
    }

    public long failures() {
        return failures;
    }
}
