package com.columnduck.format;

import com.columnduck.column.Column;
import com.columnduck.io.ByteSink;

/**
 * Writes one row of a column in one text format.
 */
@FunctionalInterface
public interface TextSerializer {

    /**
     * Writes the value at {@code rowNum} of {@code column}.
     *
     * @param column the column
     * @param rowNum the row to write
     * @param out the destination
     * @param settings the format settings, read only
     */
    void serialize(Column column, int rowNum, ByteSink out, FormatSettings settings);
}
