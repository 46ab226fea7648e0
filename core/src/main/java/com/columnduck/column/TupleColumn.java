package com.columnduck.column;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Column of tuples, stored as one column per tuple element.
 *
 * <p>Values are inserted and returned as {@link List}s with one entry per element.
 */
public final class TupleColumn implements Column {

    private final List<Column> columns;

    public TupleColumn(List<Column> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("TupleColumn requires at least one element column");
        }
        this.columns = List.copyOf(columns);
        int rows = this.columns.get(0).size();
        for (Column column : this.columns) {
            if (column.size() != rows) {
                throw new IllegalArgumentException("element columns of a TupleColumn must have equal sizes");
            }
        }
    }

    @Override
    public int size() {
        return columns.get(0).size();
    }

    @Override
    public long byteSize() {
        long total = 0;
        for (Column column : columns) {
            total += column.byteSize();
        }
        return total;
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
                "Cannot insert " + StringColumn.describe(value) + " into Tuple column");
        }
        if (elements.size() != columns.size()) {
            throw new DataTypeException(ErrorCode.ILLEGAL_TYPE_OF_ARGUMENT,
                "Cannot insert tuple of size " + elements.size() + " into Tuple column of size " + columns.size());
        }
        for (int i = 0; i < columns.size(); i++) {
            columns.get(i).insert(elements.get(i));
        }
    }

    @Override
    public void insertDefault() {
        for (Column column : columns) {
            column.insertDefault();
        }
    }

    @Override
    public List<Object> get(int row) {
        List<Object> result = new ArrayList<>(columns.size());
        for (Column column : columns) {
            result.add(column.get(row));
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public TupleColumn cloneEmpty() {
        List<Column> empty = new ArrayList<>(columns.size());
        for (Column column : columns) {
            empty.add(column.cloneEmpty());
        }
        return new TupleColumn(empty);
    }

    public Column getColumn(int index) {
        return columns.get(index);
    }

    public int tupleSize() {
        return columns.size();
    }

    @Override
    public String toString() {
        return "TupleColumn(" + columns + ")";
    }
}
