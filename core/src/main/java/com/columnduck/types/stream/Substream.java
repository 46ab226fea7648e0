package com.columnduck.types.stream;

import java.util.Objects;

/**
 * One step in the decomposition of a composite column into physical streams.
 *
 * @param kind the kind of step
 * @param tupleElementName the element name for {@link Kind#TUPLE_ELEMENT}, empty otherwise
 */
public record Substream(Kind kind, String tupleElementName) {

    /**
     * Kinds of decomposition steps.
     */
    public enum Kind {
        /** Null flags of a nullable column. */
        NULL_MAP,
        /** Sizes of the arrays of an array column. */
        ARRAY_SIZES,
        /** Descent into the elements of an array column. */
        ARRAY_ELEMENTS,
        /** Descent into one named element of a tuple column. */
        TUPLE_ELEMENT,
        /** Keys of a dictionary-encoded column. */
        DICTIONARY_KEYS
    }

    public static final Substream NULL_MAP = new Substream(Kind.NULL_MAP, "");
    public static final Substream ARRAY_SIZES = new Substream(Kind.ARRAY_SIZES, "");
    public static final Substream ARRAY_ELEMENTS = new Substream(Kind.ARRAY_ELEMENTS, "");
    public static final Substream DICTIONARY_KEYS = new Substream(Kind.DICTIONARY_KEYS, "");

    public Substream {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(tupleElementName, "tupleElementName must not be null");
        if (kind == Kind.TUPLE_ELEMENT && tupleElementName.isEmpty()) {
            throw new IllegalArgumentException("tuple element substream requires a name");
        }
        if (kind != Kind.TUPLE_ELEMENT && !tupleElementName.isEmpty()) {
            throw new IllegalArgumentException(kind + " substream cannot carry a tuple element name");
        }
    }

    /**
     * Creates a tuple element step.
     *
     * @param name the element name
     * @return the substream
     */
    public static Substream tupleElement(String name) {
        return new Substream(Kind.TUPLE_ELEMENT, name);
    }

    @Override
    public String toString() {
        return kind == Kind.TUPLE_ELEMENT ? "TupleElement(" + tupleElementName + ")" : kind.name();
    }
}
