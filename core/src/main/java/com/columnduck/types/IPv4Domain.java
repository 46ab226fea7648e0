package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.VectorColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.TextCodecs;
import com.columnduck.format.TextFormat;
import com.columnduck.io.ByteSink;

/**
 * Domain rendering {@code UInt32} values as dotted-quad IPv4 addresses.
 *
 * <p>Overrides every text format in both directions. The quoted, CSV and
 * JSON forms wrap the address in the format's quotes.
 */
public final class IPv4Domain implements DataTypeDomain {

    public static final String NAME = "IPv4";

    private static final FormatCapabilities FORMATS = FormatCapabilities.builder()
        .serializer(TextFormat.ESCAPED, (column, row, out, settings) -> out.writeString(format(column, row)))
        .deserializer(TextFormat.ESCAPED, (column, in, settings) -> insert(column, TextCodecs.readEscapedString(in)))
        .serializer(TextFormat.QUOTED, (column, row, out, settings) -> quote('\'', format(column, row), out))
        .deserializer(TextFormat.QUOTED, (column, in, settings) -> insert(column, TextCodecs.readQuotedString(in)))
        .serializer(TextFormat.CSV, (column, row, out, settings) -> quote('"', format(column, row), out))
        .deserializer(TextFormat.CSV, (column, in, settings) -> insert(column, TextCodecs.readCSVString(in, settings)))
        .serializer(TextFormat.PLAIN, (column, row, out, settings) -> out.writeString(format(column, row)))
        .deserializer(TextFormat.PLAIN, (column, in, settings) -> insert(column, TextCodecs.readToEnd(in)))
        .serializer(TextFormat.JSON, (column, row, out, settings) -> quote('"', format(column, row), out))
        .deserializer(TextFormat.JSON, (column, in, settings) -> insert(column, TextCodecs.readJSONString(in)))
        .serializer(TextFormat.XML, (column, row, out, settings) -> out.writeString(format(column, row)))
        .deserializer(TextFormat.XML, (column, in, settings) -> insert(column, TextCodecs.readXMLString(in)))
        .build();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public FormatCapabilities textFormats() {
        return FORMATS;
    }

    /**
     * Formats an address as a dotted quad.
     *
     * @param address the address as an unsigned 32-bit value
     * @return the dotted-quad form
     */
    public static String formatAddress(long address) {
        return ((address >>> 24) & 0xFF) + "." + ((address >>> 16) & 0xFF) + "."
            + ((address >>> 8) & 0xFF) + "." + (address & 0xFF);
    }

    /**
     * Parses a dotted-quad address.
     *
     * @param text the text, four decimal octets separated by dots
     * @return the address as an unsigned 32-bit value
     * @throws DataTypeException with {@link ErrorCode#CANNOT_PARSE_TEXT} if the text is not an address
     */
    public static long parseAddress(String text) {
        long address = 0;
        int octets = 0;
        int pos = 0;
        int length = text.length();
        while (octets < 4) {
            int start = pos;
            int value = 0;
            while (pos < length && pos - start < 3 && isDigit(text.charAt(pos))) {
                value = value * 10 + (text.charAt(pos) - '0');
                pos++;
            }
            if (pos == start || value > 255) {
                throw invalid(text);
            }
            address = (address << 8) | value;
            octets++;
            if (octets < 4) {
                if (pos >= length || text.charAt(pos) != '.') {
                    throw invalid(text);
                }
                pos++;
            }
        }
        if (pos != length) {
            throw invalid(text);
        }
        return address;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static DataTypeException invalid(String text) {
        return new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT, "Invalid IPv4 value: '" + text + "'", NAME);
    }

    private static String format(Column column, int row) {
        return formatAddress(((Number) addresses(column).get(row)).longValue());
    }

    private static void insert(Column column, String text) {
        addresses(column).insert(parseAddress(text));
    }

    private static void quote(char quote, String value, ByteSink out) {
        out.write(quote);
        out.writeString(value);
        out.write(quote);
    }

    private static VectorColumn<?> addresses(Column column) {
        if (!(column instanceof VectorColumn)) {
            throw DataTypeException.illegalColumn(column.getClass().getSimpleName(), NAME);
        }
        return (VectorColumn<?>) column;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IPv4Domain;
    }

    @Override
    public int hashCode() {
        return NAME.hashCode();
    }

    @Override
    public String toString() {
        return NAME;
    }
}
