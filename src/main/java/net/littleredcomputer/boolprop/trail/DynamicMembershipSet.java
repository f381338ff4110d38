package net.littleredcomputer.boolprop.trail;

import java.util.ArrayList;
import java.util.List;

/**
 * An unordered collection whose size, and only its size, is reversible. Removing an
 * element swaps it just past the live segment and shrinks that segment; restoring the
 * size on backtrack brings removed elements back without recording them.
 *
 * @param <T> element type
 */
public final class DynamicMembershipSet<T> {
    private final List<T> elements = new ArrayList<>();
    private final RevInt size;

    public DynamicMembershipSet(Trail trail) {
        this.size = trail.makeRevInt(0);
    }

    public int size() {
        return size.value();
    }

    public T get(int i) {
        if (i < 0 || i >= size.value()) throw new IndexOutOfBoundsException("index " + i + " of " + size.value());
        return elements.get(i);
    }

    /**
     * Appends an element. Only valid while nothing has been removed, since the new
     * element must land at the end of the live segment.
     */
    public void insert(T element) {
        if (size.value() != elements.size()) {
            throw new IllegalStateException("cannot insert while removed elements are pending restoration");
        }
        elements.add(element);
        size.increment();
    }

    public void removeAt(int i) {
        if (i < 0 || i >= size.value()) throw new IndexOutOfBoundsException("index " + i + " of " + size.value());
        final int last = size.decrement();
        if (i != last) {
            T t = elements.get(last);
            elements.set(last, elements.get(i));
            elements.set(i, t);
        }
    }

    /**
     * Removes the first live occurrence of {@code element}, compared by identity.
     * @return true if the element was live
     */
    public boolean removeByValue(T element) {
        for (int i = 0; i < size.value(); ++i) {
            if (elements.get(i) == element) {
                removeAt(i);
                return true;
            }
        }
        return false;
    }

    /** @return a copy of the live segment, in its current order */
    public List<T> snapshot() {
        return new ArrayList<>(elements.subList(0, size.value()));
    }

    /** Number of elements ever inserted, live or not. */
    int capacity() {
        return elements.size();
    }
}
