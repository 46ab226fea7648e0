package com.columnduck.column;

/**
 * Mutable in-memory sequence of values of one data type for a batch of rows.
 *
 * <p>A column is owned by the block that holds it and is mutated only by that
 * owner while the block is being built. Columns are created through
 * {@link com.columnduck.types.DataType#createColumn()}.
 */
public interface Column {

    /**
     * Returns the number of rows.
     *
     * @return the row count
     */
    int size();

    /**
     * Returns the approximate number of bytes occupied by the column data.
     *
     * @return the byte size
     */
    long byteSize();

    /**
     * Appends a value.
     *
     * @param value the value, in the Java representation of the column's type
     * @throws com.columnduck.exception.DataTypeException if the value has the wrong class
     */
    void insert(Object value);

    /**
     * Appends the default value of the column's type.
     */
    void insertDefault();

    /**
     * Returns the value at the given row.
     *
     * @param row the row index
     * @return the value
     * @throws IndexOutOfBoundsException if the row is out of range
     */
    Object get(int row);

    /**
     * Creates an empty column of the same kind.
     *
     * @return the new empty column
     */
    Column cloneEmpty();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns whether every row of this column shares one physical value.
     *
     * @return true for constant-run columns
     */
    default boolean isConst() {
        return false;
    }
}
