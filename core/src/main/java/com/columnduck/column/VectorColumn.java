package com.columnduck.column;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Column of fixed-width values.
 *
 * <p>The byte size is the row count times the value width.
 *
 * @param <T> the Java class of the values
 */
public final class VectorColumn<T> implements Column {

    private final int valueWidth;
    private final T defaultValue;
    private final Function<Object, T> converter;
    private final List<T> values;

    /**
     * Creates an empty column.
     *
     * @param valueWidth the width of one value in bytes
     * @param defaultValue the value appended by {@link #insertDefault()}
     * @param converter converts inserted values, throwing on values of the wrong class
     */
    public VectorColumn(int valueWidth, T defaultValue, Function<Object, T> converter) {
        if (valueWidth <= 0) {
            throw new IllegalArgumentException("valueWidth must be positive, got: " + valueWidth);
        }
        this.valueWidth = valueWidth;
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.values = new ArrayList<>();
    }

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public long byteSize() {
        return (long) values.size() * valueWidth;
    }

    @Override
    public void insert(Object value) {
        values.add(converter.apply(value));
    }

    @Override
    public void insertDefault() {
        values.add(defaultValue);
    }

    @Override
    public T get(int row) {
        return values.get(row);
    }

    @Override
    public VectorColumn<T> cloneEmpty() {
        return new VectorColumn<>(valueWidth, defaultValue, converter);
    }

    /**
     * Returns the width of one value in bytes.
     *
     * @return the value width
     */
    public int valueWidth() {
        return valueWidth;
    }

    public void reserve(int rows) {
        ((ArrayList<T>) values).ensureCapacity(rows);
    }

    @Override
    public String toString() {
        return "VectorColumn(" + values + ")";
    }
}
