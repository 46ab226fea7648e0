package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.TupleColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.FormatSettings;
import com.columnduck.format.TextCodecs;
import com.columnduck.format.TextFormat;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.types.stream.Substream;
import com.columnduck.types.stream.SubstreamPath;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Data type representing a fixed-size tuple of values of possibly different types.
 *
 * <p>Each element is stored in its own streams under
 * {@link Substream#tupleElement(String)} with the element's name. Unnamed
 * tuples name their elements {@code 1..n}.
 */
public final class TupleType extends DataType {

    private final List<DataType> elementTypes;
    private final List<String> elementNames;
    private final boolean hasExplicitNames;
    private final FormatCapabilities formats;

    /**
     * Creates a tuple with elements named {@code 1..n}.
     *
     * @param elementTypes the element types
     */
    public TupleType(List<DataType> elementTypes) {
        this(elementTypes, defaultNames(elementTypes.size()), false);
    }

    /**
     * Creates a tuple with named elements.
     *
     * @param elementTypes the element types
     * @param elementNames the element names, unique and non-empty
     * @throws IllegalArgumentException if the names do not match the types
     */
    public TupleType(List<DataType> elementTypes, List<String> elementNames) {
        this(elementTypes, elementNames, true);
    }

    private TupleType(List<DataType> elementTypes, List<String> elementNames, boolean hasExplicitNames) {
        this.elementTypes = List.copyOf(elementTypes);
        this.elementNames = List.copyOf(elementNames);
        this.hasExplicitNames = hasExplicitNames;
        validate();
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

    private void validate() {
        if (elementTypes.isEmpty()) {
            throw new IllegalArgumentException("Tuple must have at least one element");
        }
        if (elementTypes.size() != elementNames.size()) {
            throw new IllegalArgumentException("Tuple has " + elementTypes.size() + " elements but "
                + elementNames.size() + " names");
        }
        Set<String> seen = new HashSet<>();
        for (String name : elementNames) {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Tuple element name must not be empty");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate tuple element name: " + name);
            }
        }
    }

    private static List<String> defaultNames(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            names.add(Integer.toString(i));
        }
        return names;
    }

    public List<DataType> getElementTypes() {
        return elementTypes;
    }

    public List<String> getElementNames() {
        return elementNames;
    }

    public boolean hasExplicitNames() {
        return hasExplicitNames;
    }

    @Override
    public String getFamilyName() {
        return "Tuple";
    }

    @Override
    protected String doGetName() {
        StringBuilder sb = new StringBuilder("Tuple(");
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (hasExplicitNames) {
                sb.append(elementNames.get(i)).append(' ');
            }
            sb.append(elementTypes.get(i).getName());
        }
        return sb.append(')').toString();
    }

    @Override
    public TupleColumn createColumn() {
        List<Column> columns = new ArrayList<>(elementTypes.size());
        for (DataType type : elementTypes) {
            columns.add(type.createColumn());
        }
        return new TupleColumn(columns);
    }

    @Override
    public List<Object> getDefault() {
        List<Object> values = new ArrayList<>(elementTypes.size());
        for (DataType type : elementTypes) {
            values.add(type.getDefault());
        }
        return values;
    }

    @Override
    public boolean haveSubtypes() {
        return true;
    }

    @Override
    public boolean haveMaximumSizeOfValue() {
        for (DataType type : elementTypes) {
            if (!type.haveMaximumSizeOfValue()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int getSizeOfValueInMemory() {
        int size = 0;
        for (DataType type : elementTypes) {
            size += type.getSizeOfValueInMemory();
        }
        return size;
    }

    @Override
    public int getMaximumSizeOfValueInMemory() {
        int size = 0;
        for (DataType type : elementTypes) {
            size += type.getMaximumSizeOfValueInMemory();
        }
        return size;
    }

    @Override
    public FormatCapabilities textFormats() {
        return formats;
    }

    // ==================== Streams ====================

    @Override
    public void enumerateStreams(Consumer<SubstreamPath> callback, SubstreamPath path) {
        for (int i = 0; i < elementTypes.size(); i++) {
            elementTypes.get(i).enumerateStreams(callback, elementPath(path, i));
        }
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSink> getter,
                                                       int offset, int limit, SubstreamPath path) {
        TupleColumn tuple = tuples(column);
        for (int i = 0; i < elementTypes.size(); i++) {
            elementTypes.get(i).serializeBinaryBulkWithMultipleStreams(tuple.getColumn(i), getter,
                offset, limit, elementPath(path, i));
        }
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSource> getter,
                                                         int limit, double avgValueSizeHint, SubstreamPath path) {
        TupleColumn tuple = tuples(column);
        for (int i = 0; i < elementTypes.size(); i++) {
            elementTypes.get(i).deserializeBinaryBulkWithMultipleStreams(tuple.getColumn(i), getter,
                limit, avgValueSizeHint, elementPath(path, i));
        }
        int rows = tuple.getColumn(0).size();
        for (int i = 1; i < elementTypes.size(); i++) {
            if (tuple.getColumn(i).size() != rows) {
                throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                    "Cannot read all tuple values: element " + elementNames.get(i) + " has "
                        + tuple.getColumn(i).size() + " rows, expected " + rows, getName());
            }
        }
    }

    private SubstreamPath elementPath(SubstreamPath path, int index) {
        return path.append(Substream.tupleElement(elementNames.get(index)));
    }

    // ==================== Text ====================

    private void serializeText(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        TupleColumn tuple = tuples(column);
        out.write('(');
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            elementTypes.get(i).serializeAsTextQuoted(tuple.getColumn(i), rowNum, out, settings);
        }
        out.write(')');
    }

    private void deserializeText(Column column, ByteSource in, FormatSettings settings) {
        readElements(column, in, settings, TextFormat.QUOTED, '(', ')');
    }

    private void serializeTextJSON(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        TupleColumn tuple = tuples(column);
        out.write('[');
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) {
                out.write(',');
            }
            elementTypes.get(i).serializeAsTextJSON(tuple.getColumn(i), rowNum, out, settings);
        }
        out.write(']');
    }

    private void deserializeTextJSON(Column column, ByteSource in, FormatSettings settings) {
        readElements(column, in, settings, TextFormat.JSON, '[', ']');
    }

    private void serializeTextXML(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        TupleColumn tuple = tuples(column);
        out.writeString("<tuple>");
        for (int i = 0; i < elementTypes.size(); i++) {
            out.writeString("<elem>");
            elementTypes.get(i).serializeAsTextXML(tuple.getColumn(i), rowNum, out, settings);
            out.writeString("</elem>");
        }
        out.writeString("</tuple>");
    }

    private void deserializeTextXML(Column column, ByteSource in, FormatSettings settings) {
        TupleColumn tuple = tuples(column);
        TupleColumn scratch = tuple.cloneEmpty();
        TextCodecs.assertString("<tuple>", in);
        for (int i = 0; i < elementTypes.size(); i++) {
            TextCodecs.assertString("<elem>", in);
            elementTypes.get(i).deserializeAsTextXML(scratch.getColumn(i), in, settings);
            TextCodecs.assertString("</elem>", in);
        }
        TextCodecs.assertString("</tuple>", in);
        tuple.insert(scratch.get(0));
    }

    private void serializeTextCSV(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        TupleColumn tuple = tuples(column);
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) {
                out.write(settings.csvDelimiter());
            }
            elementTypes.get(i).serializeAsTextCSV(tuple.getColumn(i), rowNum, out, settings);
        }
    }

    private void deserializeTextCSV(Column column, ByteSource in, FormatSettings settings) {
        TupleColumn tuple = tuples(column);
        TupleColumn scratch = tuple.cloneEmpty();
        for (int i = 0; i < elementTypes.size(); i++) {
            if (i > 0) {
                TextCodecs.assertChar(settings.csvDelimiter(), in);
            }
            elementTypes.get(i).deserializeAsTextCSV(scratch.getColumn(i), in, settings);
        }
        tuple.insert(scratch.get(0));
    }

    /**
     * Reads a bracketed, comma-separated element list into a scratch tuple,
     * then appends it as one row.
     */
    private void readElements(Column column, ByteSource in, FormatSettings settings, TextFormat elementFormat,
                              char open, char close) {
        TupleColumn tuple = tuples(column);
        TupleColumn scratch = tuple.cloneEmpty();
        TextCodecs.assertChar(open, in);
        for (int i = 0; i < elementTypes.size(); i++) {
            TextCodecs.skipWhitespace(in);
            if (i > 0) {
                TextCodecs.assertChar(',', in);
                TextCodecs.skipWhitespace(in);
            }
            elementTypes.get(i).deserializeAs(elementFormat, scratch.getColumn(i), in, settings);
        }
        TextCodecs.skipWhitespace(in);
        TextCodecs.assertChar(close, in);
        tuple.insert(scratch.get(0));
    }

    private TupleColumn tuples(Column column) {
        return checkColumn(column, TupleColumn.class);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TupleType)) return false;
        TupleType that = (TupleType) obj;
        return hasExplicitNames == that.hasExplicitNames
            && elementTypes.equals(that.elementTypes)
            && elementNames.equals(that.elementNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementTypes, elementNames, hasExplicitNames);
    }
}
