package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.DictionaryColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatCapabilities;
import com.columnduck.format.TextFormat;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.types.stream.Substream;
import com.columnduck.types.stream.SubstreamPath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Dictionary-encoded data type over a leaf type.
 *
 * <p>Each written block stores the keys it uses at
 * {@link Substream#DICTIONARY_KEYS} (key count, then the keys in the
 * dictionary type's bulk encoding) and, at the column's own path, the row count
 * followed by one {@code UInt32} key position per row.
 *
 * <p>Blocks are read whole: a read stops at the first block boundary at or
 * after {@code limit} rows.
 */
public final class LowCardinalityType extends DataType {

    private final DataType dictionaryType;
    private final FormatCapabilities formats;

    /**
     * Creates a dictionary-encoded type.
     *
     * @param dictionaryType the type of the distinct values
     * @throws IllegalArgumentException if the dictionary type is composite or nullable
     */
    public LowCardinalityType(DataType dictionaryType) {
        this.dictionaryType = Objects.requireNonNull(dictionaryType, "dictionaryType must not be null");
        if (dictionaryType.haveSubtypes() || dictionaryType.isNullable()) {
            throw new IllegalArgumentException("LowCardinality is only supported for leaf types, got "
                + dictionaryType.getName());
        }
        FormatCapabilities.Builder builder = FormatCapabilities.builder();
        for (TextFormat format : TextFormat.values()) {
            builder.serializer(format, (column, row, out, settings) -> {
                DictionaryColumn dictionary = dictionaries(column);
                dictionaryType.serializeAs(format, dictionary.getDictionary(), dictionary.positionAt(row), out,
                    settings);
            });
            builder.deserializer(format, (column, in, settings) -> {
                DictionaryColumn dictionary = dictionaries(column);
                Column scratch = dictionaryType.createColumn();
                dictionaryType.deserializeAs(format, scratch, in, settings);
                dictionary.appendPosition(dictionary.getOrAddKey(scratch.get(0)));
            });
        }
        this.formats = builder.build();
    }

    public DataType getDictionaryType() {
        return dictionaryType;
    }

    @Override
    public String getFamilyName() {
        return "LowCardinality";
    }

    @Override
    protected String doGetName() {
        return "LowCardinality(" + dictionaryType.getName() + ")";
    }

    @Override
    public DictionaryColumn createColumn() {
        return new DictionaryColumn(dictionaryType.createColumn());
    }

    @Override
    public Object getDefault() {
        return dictionaryType.getDefault();
    }

    @Override
    public boolean haveSubtypes() {
        return true;
    }

    @Override
    public boolean isValueRepresentedByNumber() {
        return dictionaryType.isValueRepresentedByNumber();
    }

    @Override
    public FormatCapabilities textFormats() {
        return formats;
    }

    // ==================== Streams ====================

    @Override
    public void enumerateStreams(Consumer<SubstreamPath> callback, SubstreamPath path) {
        callback.accept(path.append(Substream.DICTIONARY_KEYS));
        callback.accept(path);
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSink> getter,
                                                       int offset, int limit, SubstreamPath path) {
        DictionaryColumn dictionary = dictionaries(column);
        int end = endOfRange(column, offset, limit);

        // Only the keys used by this block are written, renumbered in order of first use.
        Map<Integer, Integer> localPositions = new HashMap<>();
        List<Integer> globalPositions = new ArrayList<>();
        int[] rows = new int[end - offset];
        for (int i = offset; i < end; i++) {
            int global = dictionary.positionAt(i);
            Integer local = localPositions.get(global);
            if (local == null) {
                local = globalPositions.size();
                localPositions.put(global, local);
                globalPositions.add(global);
            }
            rows[i - offset] = local;
        }

        ByteSink keys = getter.apply(path.append(Substream.DICTIONARY_KEYS));
        if (keys != null) {
            Column blockKeys = dictionaryType.createColumn();
            for (int global : globalPositions) {
                blockKeys.insert(dictionary.getDictionary().get(global));
            }
            BinaryEncoding.writeLongLE(blockKeys.size(), keys);
            if (!blockKeys.isEmpty()) {
                dictionaryType.serializeBinaryBulk(blockKeys, keys, 0, 0);
            }
        }

        ByteSink indexes = getter.apply(path);
        if (indexes != null) {
            BinaryEncoding.writeLongLE(rows.length, indexes);
            for (int local : rows) {
                BinaryEncoding.writeIntLE(local, indexes);
            }
        }
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, Function<SubstreamPath, ByteSource> getter,
                                                         int limit, double avgValueSizeHint, SubstreamPath path) {
        DictionaryColumn dictionary = dictionaries(column);
        ByteSource keys = getter.apply(path.append(Substream.DICTIONARY_KEYS));
        ByteSource indexes = getter.apply(path);
        if (keys == null || indexes == null) {
            return;
        }

        int read = 0;
        while (read < limit && !indexes.eof()) {
            int[] globalPositions = readBlockKeys(dictionary, keys, avgValueSizeHint);

            long rowCount = BinaryEncoding.readLongLE(indexes);
            for (long i = 0; i < rowCount; i++) {
                long local = Integer.toUnsignedLong(BinaryEncoding.readIntLE(indexes));
                if (local >= globalPositions.length) {
                    throw new DataTypeException(ErrorCode.LOGICAL_ERROR,
                        "Dictionary position " + local + " is out of range for a block of "
                            + globalPositions.length + " keys", getName());
                }
                dictionary.appendPosition(globalPositions[(int) local]);
            }
            read += (int) rowCount;
        }
    }

    /**
     * Reads one block's keys and merges them into the column's dictionary.
     *
     * @return the dictionary position of each block-local key
     */
    private int[] readBlockKeys(DictionaryColumn dictionary, ByteSource keys, double avgValueSizeHint) {
        long keyCount = BinaryEncoding.readLongLE(keys);
        if (keyCount > Integer.MAX_VALUE) {
            throw new DataTypeException(ErrorCode.LOGICAL_ERROR,
                "Invalid dictionary key count " + keyCount, getName());
        }
        Column blockKeys = dictionaryType.createColumn();
        if (keyCount > 0) {
            dictionaryType.deserializeBinaryBulk(blockKeys, keys, (int) keyCount, avgValueSizeHint);
        }
        if (blockKeys.size() != keyCount) {
            throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                "Cannot read all dictionary keys: read just " + blockKeys.size() + " of " + keyCount, getName());
        }
        int[] globalPositions = new int[(int) keyCount];
        for (int i = 0; i < globalPositions.length; i++) {
            globalPositions[i] = dictionary.getOrAddKey(blockKeys.get(i));
        }
        return globalPositions;
    }

    private DictionaryColumn dictionaries(Column column) {
        return checkColumn(column, DictionaryColumn.class);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LowCardinalityType)) return false;
        LowCardinalityType that = (LowCardinalityType) obj;
        return dictionaryType.equals(that.dictionaryType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getFamilyName(), dictionaryType);
    }
}
