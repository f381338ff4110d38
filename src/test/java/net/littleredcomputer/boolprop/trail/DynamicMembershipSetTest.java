package net.littleredcomputer.boolprop.trail;

import org.junit.Test;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class DynamicMembershipSetTest {
    private final Trail trail = new Trail();

    private DynamicMembershipSet<String> abcd() {
        DynamicMembershipSet<String> s = new DynamicMembershipSet<>(trail);
        for (String x : new String[]{"a", "b", "c", "d"}) s.insert(x);
        return s;
    }

    @Test
    public void removeSwapsWithLast() {
        DynamicMembershipSet<String> s = abcd();
        trail.push();
        s.removeAt(1);
        assertThat(s.size(), is(3));
        assertThat(s.snapshot(), contains("a", "d", "c"));
        assertThat(s.capacity(), is(4));
    }

    @Test
    public void restoringSizeResurrectsRemovedElements() {
        DynamicMembershipSet<String> s = abcd();
        trail.push();
        assertThat(s.removeByValue("a"), is(true));
        assertThat(s.removeByValue("c"), is(true));
        assertThat(s.snapshot(), containsInAnyOrder("b", "d"));
        trail.push();
        s.removeByValue("d");
        assertThat(s.snapshot(), contains("b"));
        trail.pop();
        assertThat(s.snapshot(), containsInAnyOrder("b", "d"));
        trail.pop();
        assertThat(s.snapshot(), containsInAnyOrder("a", "b", "c", "d"));
        assertThat(s.size(), is(4));
    }

    @Test
    public void removeAbsentElementIsHarmless() {
        DynamicMembershipSet<String> s = abcd();
        trail.push();
        s.removeByValue("b");
        assertThat(s.removeByValue("b"), is(false));
        assertThat(s.removeByValue("z"), is(false));
        assertThat(s.size(), is(3));
    }

    @Test
    public void removeLastElement() {
        DynamicMembershipSet<String> s = abcd();
        trail.push();
        s.removeAt(3);
        assertThat(s.snapshot(), contains("a", "b", "c"));
        trail.pop();
        assertThat(s.get(3), is("d"));
    }

    @Test(expected = IllegalStateException.class)
    public void insertWhileRemovedThrows() {
        DynamicMembershipSet<String> s = abcd();
        trail.push();
        s.removeAt(0);
        s.insert("e");
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void removedElementIsNotReadable() {
        DynamicMembershipSet<String> s = abcd();
        trail.push();
        s.removeAt(0);
        s.get(3);
    }
}
