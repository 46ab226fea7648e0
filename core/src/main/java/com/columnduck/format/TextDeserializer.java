package com.columnduck.format;

import com.columnduck.column.Column;
import com.columnduck.io.ByteSource;

/**
 * Reads one value in one text format and appends it to a column.
 */
@FunctionalInterface
public interface TextDeserializer {

    /**
     * Reads a value from {@code in} and appends it to {@code column}.
     *
     * @param column the column to append to
     * @param in the source
     * @param settings the format settings, read only
     * @throws com.columnduck.exception.DataTypeException if the input cannot be parsed
     */
    void deserialize(Column column, ByteSource in, FormatSettings settings);
}
