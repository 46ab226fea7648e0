package com.columnduck.column;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Column of arrays.
 *
 * <p>All elements of all rows are stored one after another in a single nested
 * column; {@code offsets[i]} is the end position of row {@code i} in it.
 * Values are inserted and returned as {@link List}s.
 */
public final class ArrayColumn implements Column {

    private static final int OFFSET_WIDTH = 8;

    private final Column data;
    private long[] offsets = new long[16];
    private int size;

    /**
     * Creates an empty array column over an empty nested column.
     *
     * @param data the column holding the elements
     */
    public ArrayColumn(Column data) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        if (!data.isEmpty()) {
            throw new IllegalArgumentException("nested column of a new ArrayColumn must be empty");
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public long byteSize() {
        return data.byteSize() + (long) size * OFFSET_WIDTH;
    }

    @Override
    public void insert(Object value) {
        List<?> elements;
        if (value instanceof List<?>) {
            elements = (List<?>) value;
        } else if (value instanceof Object[]) {
            elements = Arrays.asList((Object[]) value);
        } else {
            throw new DataTypeException(ErrorCode.ILLEGAL_TYPE_OF_ARGUMENT,
                "Cannot insert " + StringColumn.describe(value) + " into Array column");
        }
        for (Object element : elements) {
            data.insert(element);
        }
        appendSize(elements.size());
    }

    @Override
    public void insertDefault() {
        appendSize(0);
    }

    @Override
    public List<Object> get(int row) {
        Objects.checkIndex(row, size);
        long start = offsetBefore(row);
        long end = offsets[row];
        List<Object> result = new ArrayList<>((int) (end - start));
        for (long i = start; i < end; i++) {
            result.add(data.get((int) i));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public ArrayColumn cloneEmpty() {
        return new ArrayColumn(data.cloneEmpty());
    }

    /**
     * Returns the nested column holding the elements of all rows.
     *
     * @return the element column
     */
    public Column getData() {
        return data;
    }

    /**
     * Returns the position in the element column where row {@code row} starts.
     */
    public long offsetBefore(int row) {
        return row == 0 ? 0 : offsets[row - 1];
    }

    /**
     * Returns the position in the element column where row {@code row} ends.
     */
    public long offsetAt(int row) {
        Objects.checkIndex(row, size);
        return offsets[row];
    }

    public long sizeAt(int row) {
        return offsetAt(row) - offsetBefore(row);
    }

    /**
     * Appends a row whose elements were already appended to the element column.
     *
     * @param arraySize the number of elements of the new row
     */
    public void appendSize(long arraySize) {
        if (arraySize < 0) {
            throw new DataTypeException(ErrorCode.LOGICAL_ERROR, "Negative array size " + arraySize);
        }
        if (size == offsets.length) {
            offsets = Arrays.copyOf(offsets, size * 2);
        }
        offsets[size] = offsetBefore(size) + arraySize;
        size++;
    }

    @Override
    public String toString() {
        return "ArrayColumn(" + size + " rows, data=" + data + ")";
    }
}
