package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.VectorColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.FormatSettings;
import com.columnduck.format.TextCodecs;
import com.columnduck.format.TextFormat;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

import java.util.EnumSet;

/**
 * Base class of fixed-width numeric types.
 *
 * <p>Values are stored in a {@link VectorColumn}, written little-endian in
 * binary bulk streams, and as decimal text in every text format.
 *
 * @param <T> the Java class of the values
 */
public abstract class NumberType<T extends Number> extends DataType {

    private static final int MAX_RESERVE_ROWS = 65536;

    private final FormatCapabilities formats;

    protected NumberType() {
        this.formats = FormatCapabilities.builder()
            .all(EnumSet.of(TextFormat.ESCAPED, TextFormat.QUOTED, TextFormat.PLAIN, TextFormat.XML),
                this::serializeText, this::deserializeText)
            .serializer(TextFormat.CSV, this::serializeText)
            .deserializer(TextFormat.CSV, this::deserializeTextCSV)
            .serializer(TextFormat.JSON, this::serializeTextJSON)
            .deserializer(TextFormat.JSON, this::deserializeTextJSON)
            .build();
    }

    /**
     * Returns the width of one value in bytes.
     */
    protected abstract int valueWidth();

    @Override
    public abstract T getDefault();

    /**
     * Converts an inserted Java value to this type's representation.
     *
     * @throws DataTypeException with {@link ErrorCode#ILLEGAL_TYPE_OF_ARGUMENT} if it does not fit
     */
    protected abstract T convert(Object value);

    protected abstract String formatText(T value);

    /**
     * Parses a text token.
     *
     * @throws NumberFormatException if the token is not a valid value
     */
    protected abstract T parseText(String token);

    protected abstract void writeBinary(T value, ByteSink out);

    protected abstract T readBinary(ByteSource in);

    /**
     * Returns whether JSON output quotes the value.
     */
    protected boolean quoteInJson(T value, FormatSettings settings) {
        return false;
    }

    @Override
    public VectorColumn<T> createColumn() {
        return new VectorColumn<>(valueWidth(), getDefault(), this::convert);
    }

    @Override
    public int getSizeOfValueInMemory() {
        return valueWidth();
    }

    @Override
    public boolean canBeInsideNullable() {
        return true;
    }

    @Override
    public boolean isValueRepresentedByNumber() {
        return true;
    }

    @Override
    public boolean haveMaximumSizeOfValue() {
        return true;
    }

    @Override
    public FormatCapabilities textFormats() {
        return formats;
    }

    // ==================== Binary bulk ====================

    @Override
    public void serializeBinaryBulk(Column column, ByteSink out, int offset, int limit) {
        VectorColumn<T> vector = vector(column);
        int end = endOfRange(column, offset, limit);
        for (int i = offset; i < end; i++) {
            writeBinary(vector.get(i), out);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ByteSource in, int limit, double avgValueSizeHint) {
        VectorColumn<T> vector = vector(column);
        vector.reserve(vector.size() + Math.min(limit, MAX_RESERVE_ROWS));
        for (int i = 0; i < limit && !in.eof(); i++) {
            vector.insert(readBinary(in));
        }
    }

    // ==================== Text ====================

    private void serializeText(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        out.writeString(formatText(vector(column).get(rowNum)));
    }

    private void serializeTextJSON(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        T value = vector(column).get(rowNum);
        if (quoteInJson(value, settings)) {
            out.write('"');
            out.writeString(formatText(value));
            out.write('"');
        } else {
            out.writeString(formatJson(value, settings));
        }
    }

    /**
     * Returns the unquoted JSON form of a value.
     */
    protected String formatJson(T value, FormatSettings settings) {
        return formatText(value);
    }

    private void deserializeText(Column column, ByteSource in, FormatSettings settings) {
        vector(column).insert(parse(TextCodecs.readNumberToken(in)));
    }

    private void deserializeTextCSV(Column column, ByteSource in, FormatSettings settings) {
        vector(column).insert(parse(TextCodecs.readCSVString(in, settings).trim()));
    }

    private void deserializeTextJSON(Column column, ByteSource in, FormatSettings settings) {
        VectorColumn<T> vector = vector(column);
        if (TextCodecs.checkChar('"', in)) {
            T value = parse(TextCodecs.readNumberToken(in));
            TextCodecs.assertChar('"', in);
            vector.insert(value);
        } else {
            vector.insert(parse(TextCodecs.readNumberToken(in)));
        }
    }

    /**
     * Parses a value from a complete string.
     *
     * @param text the text
     * @return the value
     */
    public T parse(String text) {
        if (text.isEmpty()) {
            throw DataTypeException.cannotParse("empty string", getName());
        }
        try {
            return parseText(text);
        } catch (NumberFormatException e) {
            throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                "Cannot parse '" + text + "' as " + getName(), e, getName());
        }
    }

    @SuppressWarnings("unchecked")
    protected final VectorColumn<T> vector(Column column) {
        return (VectorColumn<T>) checkColumn(column, VectorColumn.class);
    }

    // ==================== Conversion helpers ====================

    /**
     * Converts an integral Java value to a long without loss.
     *
     * @throws DataTypeException if the value is not an integral boxed number
     */
    protected final long toLongExact(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw illegalValue(value);
    }

    protected final DataTypeException illegalValue(Object value) {
        String description = value == null ? "null" : value + " of class " + value.getClass().getSimpleName();
        return new DataTypeException(ErrorCode.ILLEGAL_TYPE_OF_ARGUMENT,
            "Cannot insert " + description + " into column of type " + getName(), getName());
    }
}
