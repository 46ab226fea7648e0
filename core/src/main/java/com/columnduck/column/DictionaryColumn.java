package com.columnduck.column;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dictionary-encoded column.
 *
 * <p>Distinct values are kept once in a dictionary column; every row stores
 * the position of its value in the dictionary.
 */
public final class DictionaryColumn implements Column {

    private static final int POSITION_WIDTH = 4;

    private final Column dictionary;
    private final Map<Object, Integer> reverseIndex = new HashMap<>();
    private int[] positions = new int[16];
    private int size;

    public DictionaryColumn(Column dictionary) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary must not be null");
        if (!dictionary.isEmpty()) {
            throw new IllegalArgumentException("dictionary of a new DictionaryColumn must be empty");
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public long byteSize() {
        return dictionary.byteSize() + (long) size * POSITION_WIDTH;
    }

    @Override
    public void insert(Object value) {
        appendPosition(getOrAddKey(canonicalize(value)));
    }

    @Override
    public void insertDefault() {
        Column scratch = dictionary.cloneEmpty();
        scratch.insertDefault();
        appendPosition(getOrAddKey(scratch.get(0)));
    }

    @Override
    public Object get(int row) {
        return dictionary.get(positionAt(row));
    }

    @Override
    public DictionaryColumn cloneEmpty() {
        return new DictionaryColumn(dictionary.cloneEmpty());
    }

    /**
     * Returns the column of distinct values.
     *
     * @return the dictionary
     */
    public Column getDictionary() {
        return dictionary;
    }

    public int dictionarySize() {
        return dictionary.size();
    }

    public int positionAt(int row) {
        Objects.checkIndex(row, size);
        return positions[row];
    }

    /**
     * Returns the dictionary position of a value, adding it to the dictionary if absent.
     *
     * @param value the value, in the dictionary column's canonical representation
     * @return the position
     */
    public int getOrAddKey(Object value) {
        Integer position = reverseIndex.get(value);
        if (position != null) {
            return position;
        }
        dictionary.insert(value);
        int added = dictionary.size() - 1;
        reverseIndex.put(dictionary.get(added), added);
        return added;
    }

    /**
     * Appends a row referring to an existing dictionary position.
     *
     * @param position the dictionary position
     */
    public void appendPosition(int position) {
        Objects.checkIndex(position, dictionary.size());
        if (size == positions.length) {
            positions = Arrays.copyOf(positions, size * 2);
        }
        positions[size++] = position;
    }

    private Object canonicalize(Object value) {
        Column scratch = dictionary.cloneEmpty();
        scratch.insert(value);
        return scratch.get(0);
    }

    @Override
    public String toString() {
        return "DictionaryColumn(" + size + " rows, dictionary=" + dictionary + ")";
    }
}
