package com.columnduck.column;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Column of variable-length strings.
 *
 * <p>Byte size counts the UTF-8 bytes of every value plus one terminator byte
 * and an 8-byte offset per row.
 */
public final class StringColumn implements Column {

    private static final int OFFSET_WIDTH = 8;

    private final List<String> values = new ArrayList<>();
    private long charsSize;

    @Override
    public int size() {
        return values.size();
    }

    @Override
    public long byteSize() {
        return charsSize + (long) values.size() * OFFSET_WIDTH;
    }

    @Override
    public void insert(Object value) {
        if (!(value instanceof String)) {
            throw new DataTypeException(ErrorCode.ILLEGAL_TYPE_OF_ARGUMENT,
                "Cannot insert " + describe(value) + " into String column");
        }
        insertString((String) value);
    }

    public void insertString(String value) {
        values.add(value);
        charsSize += value.getBytes(StandardCharsets.UTF_8).length + 1;
    }

    @Override
    public void insertDefault() {
        insertString("");
    }

    @Override
    public String get(int row) {
        return values.get(row);
    }

    @Override
    public StringColumn cloneEmpty() {
        return new StringColumn();
    }

    /**
     * Pre-allocates room for the given number of rows.
     *
     * @param rows the expected row count
     */
    public void reserve(int rows) {
        ((ArrayList<String>) values).ensureCapacity(rows);
    }

    static String describe(Object value) {
        return value == null ? "null" : "value of class " + value.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return "StringColumn(" + values + ")";
    }
}
