package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.NullableColumn;
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

import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Data type that adds null to the values of a nested type.
 *
 * <p>The null map (one byte per row) is stored at {@link Substream#NULL_MAP};
 * the nested type's streams follow at the same path.
 */
public final class NullableType extends DataType {

    private static final String ESCAPED_NULL = "\\N";
    private static final String QUOTED_NULL = "NULL";
    private static final String JSON_NULL = "null";

    private static final int MAX_RESERVE_ROWS = 65536;

    private final DataType nestedType;
    private final FormatCapabilities formats;

    /**
     * Creates a nullable type.
     *
     * @param nestedType the type of the non-null values
     * @throws IllegalArgumentException if the nested type cannot be inside Nullable
     */
    public NullableType(DataType nestedType) {
        this.nestedType = Objects.requireNonNull(nestedType, "nestedType must not be null");
        if (!nestedType.canBeInsideNullable()) {
            throw new IllegalArgumentException("Nested type " + nestedType.getName() + " cannot be inside Nullable type");
        }
        FormatCapabilities.Builder builder = FormatCapabilities.builder();
        for (TextFormat format : TextFormat.values()) {
            String marker = nullMarker(format);
            builder.serializer(format, (column, row, out, settings) -> serialize(format, marker, column, row, out, settings));
            builder.deserializer(format, (column, in, settings) -> deserialize(format, marker, column, in, settings));
        }
        this.formats = builder.build();
    }

    public DataType getNestedType() {
        return nestedType;
    }

    @Override
    public String getFamilyName() {
        return "Nullable";
    }

    @Override
    protected String doGetName() {
        return "Nullable(" + nestedType.getName() + ")";
    }

    @Override
    public NullableColumn createColumn() {
        return new NullableColumn(nestedType.createColumn());
    }

    /**
     * The default of a nullable type is null.
     */
    @Override
    public Object getDefault() {
        return null;
    }

    @Override
    public boolean isNullable() {
        return true;
    }

    @Override
    public boolean haveSubtypes() {
        return true;
    }

    @Override
    public boolean haveMaximumSizeOfValue() {
        return nestedType.haveMaximumSizeOfValue();
    }

    /**
     * Returns the nested value size plus one byte of the null map.
     */
    @Override
    public int getSizeOfValueInMemory() {
        return 1 + nestedType.getSizeOfValueInMemory();
    }

    @Override
    public int getMaximumSizeOfValueInMemory() {
        return 1 + nestedType.getMaximumSizeOfValueInMemory();
    }

    @Override
    public FormatCapabilities textFormats() {
        return formats;
    }

    // ==================== Streams ====================

    @Override
    public void enumerateStreams(Consumer<SubstreamPath> callback, SubstreamPath path) {
        callback.accept(path.append(Substream.NULL_MAP));
        nestedType.enumerateStreams(callback, path);
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSink> getter,
                                                       int offset, int limit, SubstreamPath path) {
        NullableColumn nullable = nullables(column);
        int end = endOfRange(column, offset, limit);

        ByteSink nullMap = getter.apply(path.append(Substream.NULL_MAP));
        if (nullMap != null) {
            for (int i = offset; i < end; i++) {
                nullMap.write(nullable.isNullAt(i) ? 1 : 0);
            }
        }
        nestedType.serializeBinaryBulkWithMultipleStreams(nullable.getNestedColumn(), getter, offset, limit, path);
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSource> getter,
                                                         int limit, double avgValueSizeHint, SubstreamPath path) {
        NullableColumn nullable = nullables(column);
        Column nested = nullable.getNestedColumn();

        ByteSource nullMap = getter.apply(path.append(Substream.NULL_MAP));
        boolean[] flags = new boolean[Math.min(Math.max(limit, 0), MAX_RESERVE_ROWS)];
        int flagCount = 0;
        if (nullMap != null) {
            while (flagCount < limit && !nullMap.eof()) {
                if (flagCount == flags.length) {
                    flags = Arrays.copyOf(flags, flags.length * 2);
                }
                flags[flagCount++] = nullMap.read() != 0;
            }
        }

        int nestedLimit = nullMap != null ? flagCount : limit;
        int before = nested.size();
        if (nestedLimit > 0) {
            nestedType.deserializeBinaryBulkWithMultipleStreams(nested, getter, nestedLimit, avgValueSizeHint, path);
        }
        int added = nested.size() - before;

        if (nullMap != null && added != flagCount) {
            throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                "Cannot read all nullable values: read " + added + " values for " + flagCount + " null flags",
                getName());
        }
        for (int i = 0; i < added; i++) {
            nullable.appendNullFlag(nullMap != null && flags[i]);
        }
    }

    // ==================== Text ====================

    private static String nullMarker(TextFormat format) {
        switch (format) {
            case QUOTED:
            case PLAIN:
                return QUOTED_NULL;
            case JSON:
                return JSON_NULL;
            default:
                return ESCAPED_NULL;
        }
    }

    private void serialize(TextFormat format, String marker, Column column, int rowNum, ByteSink out,
                           FormatSettings settings) {
        NullableColumn nullable = nullables(column);
        if (nullable.isNullAt(rowNum)) {
            out.writeString(marker);
        } else {
            nestedType.serializeAs(format, nullable.getNestedColumn(), rowNum, out, settings);
        }
    }

    private void deserialize(TextFormat format, String marker, Column column, ByteSource in,
                             FormatSettings settings) {
        NullableColumn nullable = nullables(column);
        boolean isNull = format == TextFormat.PLAIN
            ? isExactly(marker, in)
            : TextCodecs.checkString(marker, in);
        if (isNull) {
            nullable.insert(null);
            return;
        }
        nestedType.deserializeAs(format, nullable.getNestedColumn(), in, settings);
        nullable.appendNullFlag(false);
    }

    /**
     * Consumes the rest of the input if it is exactly {@code text}.
     */
    private static boolean isExactly(String text, ByteSource in) {
        if (in.peek(text.length()) >= 0) {
            return false;
        }
        return TextCodecs.checkString(text, in);
    }

    private NullableColumn nullables(Column column) {
        return checkColumn(column, NullableColumn.class);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NullableType)) return false;
        NullableType that = (NullableType) obj;
        return nestedType.equals(that.nestedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getFamilyName(), nestedType);
    }
}
