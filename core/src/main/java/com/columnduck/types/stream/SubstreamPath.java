package com.columnduck.types.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered sequence of {@link Substream} steps from a column to one
 * of its physical streams.
 */
public final class SubstreamPath implements Iterable<Substream> {

    /** The path of a column's main stream. */
    public static final SubstreamPath EMPTY = new SubstreamPath(List.of());

    private final List<Substream> elements;

    private SubstreamPath(List<Substream> elements) {
        this.elements = elements;
    }

    public static SubstreamPath of(Substream... elements) {
        return new SubstreamPath(List.copyOf(Arrays.asList(elements)));
    }

    public static SubstreamPath of(List<Substream> elements) {
        return new SubstreamPath(List.copyOf(elements));
    }

    /**
     * Returns a new path with one more step.
     *
     * @param substream the step to append
     * @return the extended path
     */
    public SubstreamPath append(Substream substream) {
        Objects.requireNonNull(substream, "substream must not be null");
        List<Substream> extended = new ArrayList<>(elements.size() + 1);
        extended.addAll(elements);
        extended.add(substream);
        return new SubstreamPath(List.copyOf(extended));
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Substream get(int index) {
        return elements.get(index);
    }

    public List<Substream> elements() {
        return elements;
    }

    @Override
    public Iterator<Substream> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SubstreamPath)) return false;
        return elements.equals(((SubstreamPath) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
