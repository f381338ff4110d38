package net.littleredcomputer.boolprop.solver;

import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class SolverTest {
    private final Solver solver = new Solver();

    @Test
    public void notViewMirrorsDomain() {
        IntVar x = solver.makeBoolVar("x");
        IntVar nx = solver.makeNot(x);
        assertThat(nx.name(), is("~x"));
        nx.setValue(1);
        assertThat(x.isBound(), is(true));
        assertThat(x.value(), is(0));
        assertThat(nx.value(), is(1));
    }

    @Test
    public void doubleNegationIsTheVariable() {
        IntVar x = solver.makeBoolVar("x");
        assertThat(solver.makeNot(solver.makeNot(x)), is(sameInstance(x)));
    }

    @Test
    public void booleanResolution() {
        IntVar x = solver.makeBoolVar("x");
        BooleanVar b = solver.isBooleanVar(solver.makeNot(x)).get();
        assertThat(b.var(), is(sameInstance(x)));
        assertThat(b.negated(), is(true));
        assertThat(solver.isBooleanVar(x).get().negated(), is(false));
        assertThat(solver.isBooleanVar(solver.makeIntVar("one", 1, 1)), isPresent());
        assertThat(solver.isBooleanVar(solver.makeIntVar("n", 0, 2)), isEmpty());
        assertThat(solver.isBooleanVar(solver.makeIntVar("m", -1, 0)), isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void cannotNegateNonBoolean() {
        solver.makeNot(solver.makeIntVar("n", 0, 2));
    }

    @Test
    public void boundDemonsRunOnPropagate() {
        IntVar x = solver.makeIntVar("x", 0, 3);
        AtomicInteger calls = new AtomicInteger();
        x.whenBound(calls::incrementAndGet);
        solver.apply(() -> x.setMin(2));
        assertThat(calls.get(), is(0));
        solver.apply(() -> x.setMax(2));
        assertThat(calls.get(), is(1));
        solver.apply(() -> x.setValue(2));
        assertThat(calls.get(), is(1));
    }

    @Test
    public void emptyDomainContradictsAndClearsQueue() {
        IntVar x = solver.makeBoolVar("x");
        IntVar y = solver.makeBoolVar("y");
        AtomicInteger calls = new AtomicInteger();
        y.whenBound(calls::incrementAndGet);
        y.setValue(1);  // scheduled, not yet run
        try {
            solver.apply(() -> x.setMin(2));
            fail("expected contradiction");
        } catch (Contradiction e) {
            assertThat(solver.failures(), is(1L));
        }
        solver.propagate();
        assertThat(calls.get(), is(0));
    }

    @Test
    public void domainsRestoreOnBacktrack() {
        IntVar x = solver.makeIntVar("x", 0, 5);
        solver.trail().push();
        x.setMin(3);
        x.setMax(4);
        solver.trail().pop();
        assertThat(x.min(), is(0));
        assertThat(x.max(), is(5));
    }

    @Test(expected = IllegalStateException.class)
    public void unboundVariableHasNoValue() {
        solver.makeBoolVar("x").value();
    }

    @Test
    public void postRunsInitialPropagation() {
        IntVar x = solver.makeBoolVar("x");
        IntVar y = solver.makeBoolVar("y");
        x.setValue(1);
        solver.post(new Constraint() {
            @Override public void post() { x.whenBound(() -> y.setValue(x.value())); }
            @Override public void initialPropagate() { if (x.isBound()) y.setValue(x.value()); }
        });
        assertThat(y.value(), is(1));
    }
}
