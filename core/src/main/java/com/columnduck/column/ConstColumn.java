package com.columnduck.column;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;

import java.util.Objects;

/**
 * Column of {@code size} rows that all read as one physical value.
 *
 * <p>The value is held in a single-row column of the underlying type; no
 * per-row copies are materialized until {@link #convertToFullColumn()}.
 */
public final class ConstColumn implements Column {

    private static final int SIZE_FIELD_WIDTH = 8;

    private final Column data;
    private int size;

    /**
     * Wraps a single-row column.
     *
     * @param data a column holding exactly one row
     * @param size the logical row count
     */
    public ConstColumn(Column data, int size) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        if (data.size() != 1) {
            throw new DataTypeException(ErrorCode.LOGICAL_ERROR,
                "Incorrect size of nested column in constructor of ConstColumn: " + data.size() + ", must be 1");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative, got: " + size);
        }
        this.size = size;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public long byteSize() {
        return data.byteSize() + SIZE_FIELD_WIDTH;
    }

    /**
     * Appends one more row. Only the value already held may be inserted.
     */
    @Override
    public void insert(Object value) {
        Column scratch = data.cloneEmpty();
        scratch.insert(value);
        requireSameValue(scratch.get(0));
        size++;
    }

    @Override
    public void insertDefault() {
        Column scratch = data.cloneEmpty();
        scratch.insertDefault();
        requireSameValue(scratch.get(0));
        size++;
    }

    @Override
    public Object get(int row) {
        Objects.checkIndex(row, size);
        return data.get(0);
    }

    @Override
    public ConstColumn cloneEmpty() {
        return new ConstColumn(data, 0);
    }

    @Override
    public boolean isConst() {
        return true;
    }

    /**
     * Returns the single-row column holding the shared value.
     *
     * @return the data column
     */
    public Column getDataColumn() {
        return data;
    }

    public Object getValue() {
        return data.get(0);
    }

    /**
     * Materializes every row into a regular column of the underlying kind.
     *
     * @return a new column with {@code size()} physical rows
     */
    public Column convertToFullColumn() {
        Column full = data.cloneEmpty();
        Object value = data.get(0);
        for (int i = 0; i < size; i++) {
            full.insert(value);
        }
        return full;
    }

    private void requireSameValue(Object value) {
        if (!Objects.equals(value, data.get(0))) {
            throw new DataTypeException(ErrorCode.LOGICAL_ERROR,
                "Cannot insert " + value + " into const column holding " + data.get(0));
        }
    }

    @Override
    public String toString() {
        return "ConstColumn(" + data.get(0) + " x " + size + ")";
    }
}
