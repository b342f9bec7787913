package org.janelia.reconstruction.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * In-memory buffer for data sets that must be fully materialized (e.g. to compute a median or
 * build a spatial index).  Everything else should be streamed, so this is the only place where
 * whole tables are held and the buffer refuses to grow past its capacity.
 *
 * @param <T> buffered element type.
 */
public class BoundedBuffer<T> implements Iterable<T> {

    public static final int DEFAULT_CAPACITY = 50_000_000;

    private final String description;
    private final int capacity;
    private final List<T> elements;

    public BoundedBuffer(final String description,
                         final int capacity)
            throws IllegalArgumentException {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity for " + description + " must be positive");
        }
        this.description = description;
        this.capacity = capacity;
        this.elements = new ArrayList<>();
    }

    /**
     * @throws IllegalStateException
     *   if the buffer is already full.
     */
    public void add(final T element)
            throws IllegalStateException {
        if (elements.size() >= capacity) {
            throw new IllegalStateException(
                    description + " buffer capacity of " + capacity +
                    " elements exceeded, increase the materialization limit if this data set is expected");
        }
        elements.add(element);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int getCapacity() {
        return capacity;
    }

    public List<T> asList() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }

    @Override
    public String toString() {
        return description + " buffer with " + elements.size() + " of " + capacity + " elements";
    }
}
