package net.littleredcomputer.boolprop.atoms;

import net.littleredcomputer.boolprop.solver.Contradiction;
import net.littleredcomputer.boolprop.solver.IntVar;
import net.littleredcomputer.boolprop.solver.Solver;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class AtLeastKTriggerTest {
    private final Solver solver = new Solver();
    private final AtomStore store = new AtomStore(solver);
    private final List<IntVar> x = IntStream.range(0, 6).mapToObj(i -> solver.makeBoolVar("x" + i)).collect(Collectors.toList());
    private final List<AtomIndex> t = x.stream().map(v -> store.atomFor(v, false)).collect(Collectors.toList());

    private AtLeastKTrigger twoOfThree() {
        // once two of x0, x1, x2 hold: x3 and not x4
        AtLeastKTrigger trigger = new AtLeastKTrigger(t.subList(0, 3), 2, Arrays.asList(t.get(3), t.get(4).negate()));
        trigger.post(store);
        return trigger;
    }

    @Test
    public void firesOnReachingThreshold() {
        AtLeastKTrigger trigger = twoOfThree();
        store.flip(t.get(0));
        assertThat(trigger.fired(), is(false));
        assertThat(x.get(3).isBound(), is(false));
        store.flip(t.get(2));
        assertThat(trigger.fired(), is(true));
        assertThat(store.isFlipped(t.get(3)), is(true));
        assertThat(store.isFlipped(t.get(4).negate()), is(true));
    }

    @Test
    public void stopsListeningOnceFired() {
        AtLeastKTrigger trigger = twoOfThree();
        store.flip(t.get(0));
        store.flip(t.get(1));
        for (int i = 0; i < 3; ++i) assertThat(store.find(t.get(i)).triggerCount(), is(0));
        store.flip(t.get(2));
        assertThat(trigger.count(), is(2));
    }

    @Test
    public void listensAgainAfterBacktrack() {
        AtLeastKTrigger trigger = twoOfThree();
        store.flip(t.get(0));
        solver.trail().push();
        store.flip(t.get(1));
        assertThat(trigger.fired(), is(true));
        solver.trail().pop();
        assertThat(trigger.fired(), is(false));
        assertThat(trigger.count(), is(1));
        for (int i = 0; i < 3; ++i) assertThat(store.find(t.get(i)).triggerCount(), is(1));
        assertThat(store.isFlipped(t.get(3)), is(false));
        store.flip(t.get(1).negate());
        store.flip(t.get(2));
        assertThat(trigger.fired(), is(true));
        assertThat(x.get(4).value(), is(0));
    }

    @Test(expected = Contradiction.class)
    public void actionAgainstOppositeFlipContradicts() {
        twoOfThree();
        store.flip(t.get(3).negate());
        store.flip(t.get(0));
        store.flip(t.get(1));
    }

    @Test(expected = Contradiction.class)
    public void failActionProhibits() {
        new AtLeastKTrigger(t.subList(0, 2), 2, Collections.singletonList(AtomIndex.FAIL)).post(store);
        store.flip(t.get(0));
        store.flip(t.get(1));
    }

    @Test
    public void everyTriggerOnAnAtomIsNotified() {
        AtLeastKTrigger first = new AtLeastKTrigger(t.subList(0, 1), 1, Collections.singletonList(t.get(1)));
        AtLeastKTrigger second = new AtLeastKTrigger(t.subList(0, 1), 1, Collections.singletonList(t.get(2)));
        AtLeastKTrigger third = new AtLeastKTrigger(t.subList(0, 1), 1, Collections.singletonList(t.get(3)));
        first.post(store);
        second.post(store);
        third.post(store);
        store.flip(t.get(0));
        assertThat(first.fired() && second.fired() && third.fired(), is(true));
        for (int i = 1; i <= 3; ++i) assertThat(x.get(i).value(), is(1));
    }

    @Test
    public void chainedTriggers() {
        AtLeastKTrigger first = new AtLeastKTrigger(t.subList(0, 2), 1, Collections.singletonList(t.get(1)));
        AtLeastKTrigger second = new AtLeastKTrigger(t.subList(1, 3), 2, Collections.singletonList(t.get(5)));
        first.post(store);
        second.post(store);
        store.flip(t.get(2));
        store.flip(t.get(0));
        assertThat(first.fired(), is(true));
        assertThat(second.fired(), is(true));
        assertThat(x.get(5).value(), is(1));
        assertThat(first.count(), is(1));
    }

    @Test
    public void triggersRunAfterGuards() {
        // The guard forces x1 false before the trigger tries to make it true.
        new AtMostKGuard(t.subList(0, 2), 1).post(store);
        new AtLeastKTrigger(t.subList(0, 1), 1, Collections.singletonList(t.get(1))).post(store);
        try {
            store.flip(t.get(0));
        } catch (Contradiction e) {
            assertThat(store.isFlipped(t.get(1).negate()), is(true));
            return;
        }
        throw new AssertionError("expected contradiction");
    }

    @Test(expected = IllegalArgumentException.class)
    public void thresholdMustBePositive() {
        new AtLeastKTrigger(t.subList(0, 2), 0, Collections.singletonList(t.get(3)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void thresholdMustNotExceedWatchList() {
        new AtLeastKTrigger(t.subList(0, 2), 3, Collections.singletonList(t.get(3)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateWatchIsRejected() {
        new AtLeastKTrigger(Arrays.asList(t.get(0), t.get(0)), 1, Collections.singletonList(t.get(3)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownActionIsRejectedAtPost() {
        new AtLeastKTrigger(t.subList(0, 2), 1, Collections.singletonList(AtomIndex.of(99))).post(store);
    }
}
