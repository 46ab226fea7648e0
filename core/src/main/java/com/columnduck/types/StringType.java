package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.StringColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.TextCodecs;
import com.columnduck.format.TextFormat;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

import java.nio.charset.StandardCharsets;

/**
 * Data type representing a variable-length UTF-8 string.
 *
 * <p>Binary form: the UTF-8 length as a varuint, then the bytes.
 */
public final class StringType extends DataType {

    private static final StringType INSTANCE = new StringType();

    private static final int MAX_RESERVE_ROWS = 65536;

    private final FormatCapabilities formats = FormatCapabilities.builder()
        .serializer(TextFormat.ESCAPED, (column, row, out, settings) ->
            TextCodecs.writeEscapedString(value(column, row), out))
        .deserializer(TextFormat.ESCAPED, (column, in, settings) ->
            strings(column).insertString(TextCodecs.readEscapedString(in)))
        .serializer(TextFormat.QUOTED, (column, row, out, settings) ->
            TextCodecs.writeQuotedString(value(column, row), out))
        .deserializer(TextFormat.QUOTED, (column, in, settings) ->
            strings(column).insertString(TextCodecs.readQuotedString(in)))
        .serializer(TextFormat.CSV, (column, row, out, settings) ->
            TextCodecs.writeCSVString(value(column, row), out))
        .deserializer(TextFormat.CSV, (column, in, settings) ->
            strings(column).insertString(TextCodecs.readCSVString(in, settings)))
        .serializer(TextFormat.PLAIN, (column, row, out, settings) ->
            out.writeString(value(column, row)))
        .deserializer(TextFormat.PLAIN, (column, in, settings) ->
            strings(column).insertString(TextCodecs.readToEnd(in)))
        .serializer(TextFormat.JSON, (column, row, out, settings) ->
            TextCodecs.writeJSONString(value(column, row), out, settings))
        .deserializer(TextFormat.JSON, (column, in, settings) ->
            strings(column).insertString(TextCodecs.readJSONString(in)))
        .serializer(TextFormat.XML, (column, row, out, settings) ->
            TextCodecs.writeXMLString(value(column, row), out))
        .deserializer(TextFormat.XML, (column, in, settings) ->
            strings(column).insertString(TextCodecs.readXMLString(in)))
        .build();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String getFamilyName() {
        return "String";
    }

    @Override
    public StringColumn createColumn() {
        return new StringColumn();
    }

    @Override
    public String getDefault() {
        return "";
    }

    @Override
    public boolean canBeInsideNullable() {
        return true;
    }

    @Override
    public FormatCapabilities textFormats() {
        return formats;
    }

    @Override
    public void serializeBinaryBulk(Column column, ByteSink out, int offset, int limit) {
        StringColumn strings = strings(column);
        int end = endOfRange(column, offset, limit);
        for (int i = offset; i < end; i++) {
            byte[] bytes = strings.get(i).getBytes(StandardCharsets.UTF_8);
            BinaryEncoding.writeVarUInt(bytes.length, out);
            out.write(bytes);
        }
    }

    /**
     * Reads strings, sizing the scratch buffer from the average value size hint.
     */
    @Override
    public void deserializeBinaryBulk(Column column, ByteSource in, int limit, double avgValueSizeHint) {
        StringColumn strings = strings(column);
        strings.reserve(strings.size() + Math.min(limit, MAX_RESERVE_ROWS));
        byte[] buffer = new byte[Math.max(16, (int) Math.ceil(avgValueSizeHint))];
        for (int i = 0; i < limit && !in.eof(); i++) {
            long length = BinaryEncoding.readVarUInt(in);
            if (length > Integer.MAX_VALUE) {
                throw DataTypeException.cannotParse("string of length " + length, getName());
            }
            if (length > buffer.length) {
                buffer = new byte[(int) Math.max(length, buffer.length * 2L)];
            }
            in.readFully(buffer, 0, (int) length);
            strings.insertString(new String(buffer, 0, (int) length, StandardCharsets.UTF_8));
        }
    }

    private String value(Column column, int row) {
        return strings(column).get(row);
    }

    private StringColumn strings(Column column) {
        return checkColumn(column, StringColumn.class);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringType;
    }

    @Override
    public int hashCode() {
        return getFamilyName().hashCode();
    }
}
