package com.columnduck.types;

import com.columnduck.column.ArrayColumn;
import com.columnduck.column.Column;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.FormatSettings;
import com.columnduck.format.TextCodecs;
import com.columnduck.format.TextFormat;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteArraySink;
import com.columnduck.io.ByteArraySource;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.types.stream.Substream;
import com.columnduck.types.stream.SubstreamPath;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Data type representing an array of values of one nested type.
 *
 * <p>Stored as two kinds of streams: the array sizes ({@code UInt64} per row)
 * at {@link Substream#ARRAY_SIZES}, and the nested type's own streams under
 * {@link Substream#ARRAY_ELEMENTS}.
 */
public final class ArrayType extends DataType {

    private final DataType elementType;
    private final FormatCapabilities formats;

    /**
     * Creates an array type.
     *
     * @param elementType the type of the elements
     */
    public ArrayType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
        this.formats = FormatCapabilities.builder()
            .all(EnumSet.of(TextFormat.ESCAPED, TextFormat.QUOTED, TextFormat.PLAIN),
                this::serializeText, this::deserializeText)
            .serializer(TextFormat.CSV, this::serializeTextCSV)
            .deserializer(TextFormat.CSV, this::deserializeTextCSV)
            .serializer(TextFormat.JSON, this::serializeTextJSON)
            .deserializer(TextFormat.JSON, this::deserializeTextJSON)
            .serializer(TextFormat.XML, this::serializeTextXML)
            .deserializer(TextFormat.XML, this::deserializeTextXML)
            .build();
    }

    public DataType getElementType() {
        return elementType;
    }

    @Override
    public String getFamilyName() {
        return "Array";
    }

    @Override
    protected String doGetName() {
        return "Array(" + elementType.getName() + ")";
    }

    @Override
    public ArrayColumn createColumn() {
        return new ArrayColumn(elementType.createColumn());
    }

    @Override
    public List<Object> getDefault() {
        return List.of();
    }

    @Override
    public boolean haveSubtypes() {
        return true;
    }

    @Override
    public FormatCapabilities textFormats() {
        return formats;
    }

    // ==================== Streams ====================

    @Override
    public void enumerateStreams(Consumer<SubstreamPath> callback, SubstreamPath path) {
        callback.accept(path.append(Substream.ARRAY_SIZES));
        elementType.enumerateStreams(callback, path.append(Substream.ARRAY_ELEMENTS));
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSink> getter,
                                                       int offset, int limit, SubstreamPath path) {
        ArrayColumn array = arrays(column);
        int end = endOfRange(column, offset, limit);

        ByteSink sizes = getter.apply(path.append(Substream.ARRAY_SIZES));
        if (sizes != null) {
            for (int i = offset; i < end; i++) {
                BinaryEncoding.writeLongLE(array.sizeAt(i), sizes);
            }
        }

        long nestedOffset = array.offsetBefore(offset);
        long nestedLimit = array.offsetBefore(end) - nestedOffset;

        // A nested limit of 0 would mean "to the end", so empty ranges write nothing.
        if (nestedLimit > 0) {
            elementType.serializeBinaryBulkWithMultipleStreams(array.getData(), getter,
                (int) nestedOffset, (int) nestedLimit, path.append(Substream.ARRAY_ELEMENTS));
        }
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSource> getter,
                                                         int limit, double avgValueSizeHint, SubstreamPath path) {
        ArrayColumn array = arrays(column);
        Column data = array.getData();

        ByteSource sizes = getter.apply(path.append(Substream.ARRAY_SIZES));
        if (sizes != null) {
            for (int i = 0; i < limit && !sizes.eof(); i++) {
                array.appendSize(BinaryEncoding.readLongLE(sizes));
            }
        }

        long lastOffset = array.offsetBefore(array.size());
        long nestedLimit = lastOffset - data.size();
        if (nestedLimit > Integer.MAX_VALUE) {
            throw new DataTypeException(ErrorCode.LOGICAL_ERROR,
                "Array of " + nestedLimit + " elements is too large for one read", getName());
        }
        if (nestedLimit > 0) {
            elementType.deserializeBinaryBulkWithMultipleStreams(data, getter, (int) nestedLimit, 0,
                path.append(Substream.ARRAY_ELEMENTS));
        }

        if (data.size() != lastOffset) {
            throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                "Cannot read all array values: read just " + data.size() + " of " + lastOffset, getName());
        }
    }

    // ==================== Text ====================

    private void serializeText(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        ArrayColumn array = arrays(column);
        long start = array.offsetBefore(rowNum);
        long end = array.offsetAt(rowNum);
        out.write('[');
        for (long i = start; i < end; i++) {
            if (i > start) {
                out.write(',');
            }
            elementType.serializeAsTextQuoted(array.getData(), (int) i, out, settings);
        }
        out.write(']');
    }

    private void deserializeText(Column column, ByteSource in, FormatSettings settings) {
        readList(column, in, settings, TextFormat.QUOTED);
    }

    private void serializeTextJSON(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        ArrayColumn array = arrays(column);
        long start = array.offsetBefore(rowNum);
        long end = array.offsetAt(rowNum);
        out.write('[');
        for (long i = start; i < end; i++) {
            if (i > start) {
                out.write(',');
            }
            elementType.serializeAsTextJSON(array.getData(), (int) i, out, settings);
        }
        out.write(']');
    }

    private void deserializeTextJSON(Column column, ByteSource in, FormatSettings settings) {
        readList(column, in, settings, TextFormat.JSON);
    }

    private void serializeTextXML(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        ArrayColumn array = arrays(column);
        long start = array.offsetBefore(rowNum);
        long end = array.offsetAt(rowNum);
        out.writeString("<array>");
        for (long i = start; i < end; i++) {
            out.writeString("<elem>");
            elementType.serializeAsTextXML(array.getData(), (int) i, out, settings);
            out.writeString("</elem>");
        }
        out.writeString("</array>");
    }

    private void deserializeTextXML(Column column, ByteSource in, FormatSettings settings) {
        ArrayColumn array = arrays(column);
        Column elements = array.getData().cloneEmpty();
        TextCodecs.assertString("<array>", in);
        while (TextCodecs.checkString("<elem>", in)) {
            elementType.deserializeAsTextXML(elements, in, settings);
            TextCodecs.assertString("</elem>", in);
        }
        TextCodecs.assertString("</array>", in);
        array.insert(valuesOf(elements));
    }

    private void serializeTextCSV(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        ByteArraySink text = new ByteArraySink();
        serializeText(column, rowNum, text, settings);
        TextCodecs.writeCSVString(text.toUtf8String(), out);
    }

    private void deserializeTextCSV(Column column, ByteSource in, FormatSettings settings) {
        ByteArraySource text = ByteArraySource.ofString(TextCodecs.readCSVString(in, settings));
        deserializeText(column, text, settings);
        if (!text.eof()) {
            throw DataTypeException.cannotParse("CSV field with trailing data", getName());
        }
    }

    /**
     * Reads {@code [e1,e2,...]}, parsing the elements into a scratch column first
     * so that a malformed value leaves the target column untouched.
     */
    private void readList(Column column, ByteSource in, FormatSettings settings, TextFormat elementFormat) {
        ArrayColumn array = arrays(column);
        Column elements = array.getData().cloneEmpty();
        TextCodecs.assertChar('[', in);
        TextCodecs.skipWhitespace(in);
        boolean first = true;
        while (!TextCodecs.checkChar(']', in)) {
            if (!first) {
                TextCodecs.assertChar(',', in);
                TextCodecs.skipWhitespace(in);
            }
            first = false;
            elementType.deserializeAs(elementFormat, elements, in, settings);
            TextCodecs.skipWhitespace(in);
        }
        array.insert(valuesOf(elements));
    }

    private static List<Object> valuesOf(Column column) {
        List<Object> values = new ArrayList<>(column.size());
        for (int i = 0; i < column.size(); i++) {
            values.add(column.get(i));
        }
        return values;
    }

    private ArrayColumn arrays(Column column) {
        return checkColumn(column, ArrayColumn.class);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) obj;
        return elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getFamilyName(), elementType);
    }
}
