package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.ConstColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.FormatSettings;
import com.columnduck.format.TextDeserializer;
import com.columnduck.format.TextFormat;
import com.columnduck.format.TextSerializer;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.types.stream.SubstreamPath;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Base class of all data type descriptors.
 *
 * <p>A descriptor names a logical type, supplies its default value, creates
 * in-memory columns for it and encodes/decodes its values in binary bulk
 * streams and in the text formats of {@link TextFormat}.
 *
 * <p>Descriptors are immutable and are shared across threads without locking.
 * Domains are attached through {@link DataTypeBuilder}, which produces a new
 * descriptor; a published descriptor is never modified.
 *
 * <p>Type families:
 * <ul>
 *   <li>Leaf types: {@link Int32Type}, {@link Int64Type}, {@link UInt32Type},
 *       {@link UInt64Type}, {@link Float64Type}, {@link StringType}</li>
 *   <li>Composite types: {@link ArrayType}, {@link NullableType},
 *       {@link TupleType}, {@link LowCardinalityType}</li>
 * </ul>
 *
 * <p>Text (de)serialization goes through the twelve {@code serializeAs*} /
 * {@code deserializeAs*} entry points. Each consults the outermost domain's
 * capability for that exact format and direction first and otherwise the
 * type's own {@link #textFormats()} table; there is no generic fallback.
 */
public abstract class DataType {

    /** Upper bound of the average value size hint. */
    public static final double MAX_AVG_VALUE_SIZE_HINT = 1024.0;

    /** Columns with at most this many rows do not update the size hint. */
    public static final int MIN_ROWS_FOR_SIZE_HINT = 10;

    // ==================== Identity ====================

    /**
     * Returns the name of the type family, e.g. {@code Array} for {@code Array(Int32)}.
     *
     * @return the family name
     */
    public abstract String getFamilyName();

    /**
     * Returns the name of the type, ignoring domains.
     *
     * <p>Defaults to the family name; parameterized types override it.
     *
     * @return the undecorated name
     */
    protected String doGetName() {
        return getFamilyName();
    }

    /**
     * Returns the name of the type. Stable, and suitable as a persisted schema identifier.
     *
     * <p>If a domain is attached this is the outermost domain's name, with no
     * fallback to or merge with the base type's name.
     *
     * @return the type name
     */
    public final String getName() {
        return domains().outermost()
            .map(DataTypeDomain::getName)
            .orElseGet(this::doGetName);
    }

    /**
     * Returns the domains attached to this type, outermost first.
     *
     * @return the domain chain, empty for undecorated types
     */
    public DomainChain domains() {
        return DomainChain.empty();
    }

    // ==================== Values and columns ====================

    /**
     * Creates an empty column for values of this type.
     *
     * @return the new column
     */
    public abstract Column createColumn();

    /**
     * Returns the canonical default value, used for constant columns and to
     * fill newly introduced columns.
     *
     * @return the default value
     */
    public abstract Object getDefault();

    /**
     * Creates a column of {@code size} rows that all read as {@code value},
     * backed by one physical value.
     *
     * @param size the logical row count
     * @param value the value
     * @return the constant column
     */
    public Column createColumnConst(int size, Object value) {
        Column column = createColumn();
        column.insert(value);
        return new ConstColumn(column, size);
    }

    public Column createColumnConstWithDefaultValue(int size) {
        return createColumnConst(size, getDefault());
    }

    /**
     * Appends the default value to a column.
     *
     * @param column a column of this type
     */
    public void insertDefaultInto(Column column) {
        column.insertDefault();
    }

    /**
     * Returns the widest type of the same kind, used for overflow-safe aggregation.
     *
     * @return the promoted type
     * @throws DataTypeException with {@link ErrorCode#DATA_TYPE_CANNOT_BE_PROMOTED}
     *         unless the type overrides it
     */
    public DataType promoteNumericType() {
        throw DataTypeException.cannotBePromoted(getName());
    }

    /**
     * Returns the size of one value in memory, for fixed-width types only.
     *
     * @return the size in bytes
     * @throws DataTypeException with {@link ErrorCode#LOGICAL_ERROR} for variable-width types
     */
    public int getSizeOfValueInMemory() {
        throw DataTypeException.notFixedSize(getName());
    }

    // ==================== Capabilities ====================

    public boolean isNullable() {
        return false;
    }

    /**
     * Returns whether {@code Nullable(T)} is a valid type for this type {@code T}.
     */
    public boolean canBeInsideNullable() {
        return false;
    }

    /**
     * Returns whether this type is parameterized by other types.
     */
    public boolean haveSubtypes() {
        return false;
    }

    public boolean isValueRepresentedByNumber() {
        return false;
    }

    /**
     * Returns whether every value fits in a bounded number of bytes.
     */
    public boolean haveMaximumSizeOfValue() {
        return false;
    }

    /**
     * Returns the maximum size of one value in memory.
     *
     * @return the size in bytes
     * @throws DataTypeException with {@link ErrorCode#LOGICAL_ERROR} if values are unbounded
     */
    public int getMaximumSizeOfValueInMemory() {
        return getSizeOfValueInMemory();
    }

    // ==================== Binary bulk ====================

    /**
     * Writes rows {@code [offset, offset + limit)} of a column to a single stream.
     *
     * <p>A {@code limit} of 0, or one reaching past the end, means "to the end of the column".
     *
     * @throws DataTypeException with {@link ErrorCode#MULTIPLE_STREAMS_REQUIRED}
     *         unless the type can be written as one contiguous stream
     */
    public void serializeBinaryBulk(Column column, ByteSink out, int offset, int limit) {
        throw DataTypeException.multipleStreamsRequired(getName(), true);
    }

    /**
     * Reads up to {@code limit} values from a single stream and appends them to a column.
     *
     * <p>Reading stops early when the stream ends.
     *
     * @param avgValueSizeHint expected average value size, 0 if unknown
     * @throws DataTypeException with {@link ErrorCode#MULTIPLE_STREAMS_REQUIRED}
     *         unless the type can be read from one contiguous stream
     */
    public void deserializeBinaryBulk(Column column, ByteSource in, int limit, double avgValueSizeHint) {
        throw DataTypeException.multipleStreamsRequired(getName(), false);
    }

    /**
     * Calls {@code callback} with the path of every physical stream of this type, in write order.
     *
     * @param callback receives each substream path
     * @param path the path of this type within the column
     */
    public void enumerateStreams(Consumer<SubstreamPath> callback, SubstreamPath path) {
        callback.accept(path);
    }

    /**
     * Writes rows of a column, decomposed into substreams.
     *
     * <p>The default writes the single stream at {@code path}. A getter
     * returning null for a path means that stream is skipped.
     */
    public void serializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSink> getter,
                                                       int offset, int limit, SubstreamPath path) {
        ByteSink stream = getter.apply(path);
        if (stream != null) {
            serializeBinaryBulk(column, stream, offset, limit);
        }
    }

    /**
     * Reads up to {@code limit} rows of a column from its substreams.
     */
    public void deserializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSource> getter,
                                                         int limit, double avgValueSizeHint, SubstreamPath path) {
        ByteSource stream = getter.apply(path);
        if (stream != null) {
            deserializeBinaryBulk(column, stream, limit, avgValueSizeHint);
        }
    }

    /**
     * Updates a running average value size from one more column.
     *
     * <p>Columns of 10 rows or fewer are ignored. A larger average raises the
     * hint at once, clamped to {@value #MAX_AVG_VALUE_SIZE_HINT}; an average
     * below half the hint lowers it to {@code (current + 3 * hint) / 4}.
     *
     * @param column the column just read
     * @param avgValueSizeHint the current hint
     * @return the new hint
     */
    public static double updateAvgValueSizeHint(Column column, double avgValueSizeHint) {
        int columnSize = column.size();
        if (columnSize <= MIN_ROWS_FOR_SIZE_HINT) {
            return avgValueSizeHint;
        }
        double currentAvgValueSize = (double) column.byteSize() / columnSize;

        if (currentAvgValueSize > avgValueSizeHint) {
            return Math.min(MAX_AVG_VALUE_SIZE_HINT, currentAvgValueSize);
        } else if (currentAvgValueSize * 2 < avgValueSizeHint) {
            return (currentAvgValueSize + avgValueSizeHint * 3) / 4;
        }
        return avgValueSizeHint;
    }

    /**
     * Returns the exclusive end row of {@code [offset, offset + limit)} within a column.
     */
    protected static int endOfRange(Column column, int offset, int limit) {
        int size = column.size();
        if (offset < 0 || offset > size) {
            throw new IndexOutOfBoundsException("offset " + offset + " out of range for column of size " + size);
        }
        if (limit <= 0 || (long) offset + limit > size) {
            return size;
        }
        return offset + limit;
    }

    // ==================== Text formats ====================

    /**
     * Returns this type's own text format implementations.
     *
     * <p>The base type implements no format.
     *
     * @return the format table
     */
    public FormatCapabilities textFormats() {
        return FormatCapabilities.none();
    }

    /**
     * Writes one row in the given text format.
     */
    public final void serializeAs(TextFormat format, Column column, int rowNum, ByteSink out,
                                  FormatSettings settings) {
        Column source = column;
        int row = rowNum;
        if (column instanceof ConstColumn) {
            source = ((ConstColumn) column).getDataColumn();
            row = 0;
        }
        resolveSerializer(format).serialize(source, row, out, settings);
    }

    /**
     * Reads one value in the given text format and appends it to a column.
     */
    public final void deserializeAs(TextFormat format, Column column, ByteSource in, FormatSettings settings) {
        resolveDeserializer(format).deserialize(column, in, settings);
    }

    private TextSerializer resolveSerializer(TextFormat format) {
        Optional<TextSerializer> custom = domains().outermost()
            .flatMap(domain -> domain.textFormats().serializer(format));
        return custom
            .or(() -> textFormats().serializer(format))
            .orElseThrow(() -> formatNotSupported(format, "serialized"));
    }

    private TextDeserializer resolveDeserializer(TextFormat format) {
        Optional<TextDeserializer> custom = domains().outermost()
            .flatMap(domain -> domain.textFormats().deserializer(format));
        return custom
            .or(() -> textFormats().deserializer(format))
            .orElseThrow(() -> formatNotSupported(format, "deserialized"));
    }

    private DataTypeException formatNotSupported(TextFormat format, String direction) {
        return new DataTypeException(ErrorCode.FORMAT_NOT_SUPPORTED,
            "Data type " + getName() + " cannot be " + direction + " in " + format.displayName() + " format",
            getName());
    }

    public final void serializeAsTextEscaped(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        serializeAs(TextFormat.ESCAPED, column, rowNum, out, settings);
    }

    public final void deserializeAsTextEscaped(Column column, ByteSource in, FormatSettings settings) {
        deserializeAs(TextFormat.ESCAPED, column, in, settings);
    }

    public final void serializeAsTextQuoted(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        serializeAs(TextFormat.QUOTED, column, rowNum, out, settings);
    }

    public final void deserializeAsTextQuoted(Column column, ByteSource in, FormatSettings settings) {
        deserializeAs(TextFormat.QUOTED, column, in, settings);
    }

    public final void serializeAsTextCSV(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        serializeAs(TextFormat.CSV, column, rowNum, out, settings);
    }

    public final void deserializeAsTextCSV(Column column, ByteSource in, FormatSettings settings) {
        deserializeAs(TextFormat.CSV, column, in, settings);
    }

    public final void serializeAsText(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        serializeAs(TextFormat.PLAIN, column, rowNum, out, settings);
    }

    public final void deserializeAsText(Column column, ByteSource in, FormatSettings settings) {
        deserializeAs(TextFormat.PLAIN, column, in, settings);
    }

    public final void serializeAsTextJSON(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        serializeAs(TextFormat.JSON, column, rowNum, out, settings);
    }

    public final void deserializeAsTextJSON(Column column, ByteSource in, FormatSettings settings) {
        deserializeAs(TextFormat.JSON, column, in, settings);
    }

    public final void serializeAsTextXML(Column column, int rowNum, ByteSink out, FormatSettings settings) {
        serializeAs(TextFormat.XML, column, rowNum, out, settings);
    }

    public final void deserializeAsTextXML(Column column, ByteSource in, FormatSettings settings) {
        deserializeAs(TextFormat.XML, column, in, settings);
    }

    // ==================== Helpers ====================

    /**
     * Casts a column to the implementation this type works with.
     *
     * @throws DataTypeException with {@link ErrorCode#ILLEGAL_COLUMN} on mismatch
     */
    protected final <C extends Column> C checkColumn(Column column, Class<C> expected) {
        if (!expected.isInstance(column)) {
            throw DataTypeException.illegalColumn(column.getClass().getSimpleName(), getName());
        }
        return expected.cast(column);
    }

    @Override
    public String toString() {
        return getName();
    }
}
