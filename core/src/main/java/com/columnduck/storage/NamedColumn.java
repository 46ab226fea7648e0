package com.columnduck.storage;

import com.columnduck.column.Column;
import com.columnduck.types.DataType;

import java.util.Objects;

/**
 * A column of a block together with its name and type.
 *
 * @param name the column name; dotted names belong to a nested structure
 * @param type the column type
 * @param column the values
 */
public record NamedColumn(String name, DataType type, Column column) {

    public NamedColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(column, "column must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
    }

    public int rows() {
        return column.size();
    }
}
