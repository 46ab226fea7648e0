package com.columnduck.column;

import java.util.Arrays;
import java.util.Objects;

/**
 * Column of values that may be null.
 *
 * <p>A null row holds the default value in the nested column and a set flag
 * in the null map, so the nested column always has the same row count.
 */
public final class NullableColumn implements Column {

    private final Column nested;
    private boolean[] nullMap = new boolean[16];
    private int size;

    public NullableColumn(Column nested) {
        this.nested = Objects.requireNonNull(nested, "nested must not be null");
        if (!nested.isEmpty()) {
            throw new IllegalArgumentException("nested column of a new NullableColumn must be empty");
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public long byteSize() {
        return nested.byteSize() + size;
    }

    @Override
    public void insert(Object value) {
        if (value == null) {
            nested.insertDefault();
            appendNullFlag(true);
        } else {
            nested.insert(value);
            appendNullFlag(false);
        }
    }

    /**
     * Inserts null. The default of a nullable type is null.
     */
    @Override
    public void insertDefault() {
        insert(null);
    }

    @Override
    public Object get(int row) {
        Objects.checkIndex(row, size);
        return nullMap[row] ? null : nested.get(row);
    }

    @Override
    public NullableColumn cloneEmpty() {
        return new NullableColumn(nested.cloneEmpty());
    }

    public Column getNestedColumn() {
        return nested;
    }

    public boolean isNullAt(int row) {
        Objects.checkIndex(row, size);
        return nullMap[row];
    }

    /**
     * Appends a null flag for a row whose value was already appended to the nested column.
     *
     * @param isNull whether the new row is null
     */
    public void appendNullFlag(boolean isNull) {
        if (size == nullMap.length) {
            nullMap = Arrays.copyOf(nullMap, size * 2);
        }
        nullMap[size++] = isNull;
    }

    @Override
    public String toString() {
        return "NullableColumn(" + size + " rows, nested=" + nested + ")";
    }
}
