package com.columnduck.storage;

import com.columnduck.column.ArrayColumn;
import com.columnduck.column.Column;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.io.ByteArraySink;
import com.columnduck.io.ByteArraySource;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.types.DataType;
import com.columnduck.types.stream.StreamNames;
import com.columnduck.types.stream.SubstreamPath;
import com.columnduck.util.NestedNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory column storage: each column is written as a set of named
 * substreams, named by {@link StreamNames}.
 *
 * <p>Blocks are appended to the streams one after another. Array sizes of the
 * columns of one nested structure ({@code n.a}, {@code n.b}) map to a single
 * stream ({@code n.size0}) that is written once per block.
 *
 * <p>Reading a column reads all its streams from the start and keeps a
 * per-column average value size hint, which is passed to the next read of
 * the same column.
 *
 * <p>Example usage:
 * <pre>
 *   ColumnStreamStore store = new ColumnStreamStore();
 *   store.writeBlock(List.of(new NamedColumn("n.a", arrayType, column)));
 *   Column restored = store.read("n.a", arrayType, column.size());
 * </pre>
 *
 * <p>Not thread-safe.
 */
public class ColumnStreamStore {

    private static final Logger logger = LoggerFactory.getLogger(ColumnStreamStore.class);

    private final Map<String, ByteArraySink> streams = new LinkedHashMap<>();
    private final Map<String, Double> avgValueSizeHints = new HashMap<>();
    private int blocksWritten;

    /**
     * Appends one block of columns to their streams.
     *
     * @param columns the columns of the block
     * @throws DataTypeException with {@link ErrorCode#SIZES_OF_ARRAYS_DOESNT_MATCH} if arrays of one
     *     nested structure differ in size in some row; nothing is written then
     */
    public void writeBlock(List<NamedColumn> columns) {
        checkNestedArraySizes(columns);
        Set<String> writtenInBlock = new HashSet<>();
        for (NamedColumn named : columns) {
            named.type().serializeBinaryBulkWithMultipleStreams(named.column(),
                path -> sinkFor(named.name(), path, writtenInBlock), 0, 0, SubstreamPath.EMPTY);
        }
        blocksWritten++;
        logger.debug("Wrote block {} with {} columns into {} streams",
            blocksWritten, columns.size(), writtenInBlock.size());
    }

    /**
     * Array columns of one nested structure share their sizes stream, so their sizes must agree row by row.
     */
    private static void checkNestedArraySizes(List<NamedColumn> columns) {
        Map<String, NamedColumn> firstByTable = new HashMap<>();
        for (NamedColumn named : columns) {
            String tableName = NestedNames.extractTableName(named.name());
            if (tableName.equals(named.name()) || !(named.column() instanceof ArrayColumn)) {
                continue;
            }
            NamedColumn first = firstByTable.putIfAbsent(tableName, named);
            if (first != null && !sameSizes((ArrayColumn) first.column(), (ArrayColumn) named.column())) {
                throw new DataTypeException(ErrorCode.SIZES_OF_ARRAYS_DOESNT_MATCH,
                    "Sizes of nested arrays do not match: " + first.name() + " and " + named.name());
            }
        }
    }

    private static boolean sameSizes(ArrayColumn left, ArrayColumn right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int row = 0; row < left.size(); row++) {
            if (left.sizeAt(row) != right.sizeAt(row)) {
                return false;
            }
        }
        return true;
    }

    private ByteSink sinkFor(String columnName, SubstreamPath path, Set<String> writtenInBlock) {
        String streamName = StreamNames.getFileNameForStream(columnName, path);
        if (!writtenInBlock.add(streamName)) {
            logger.trace("Stream {} already written in this block, skipping for column {}", streamName, columnName);
            return null;
        }
        return streams.computeIfAbsent(streamName, name -> new ByteArraySink());
    }

    /**
     * Reads up to {@code rows} rows of a column from the start of its streams.
     *
     * @param name the column name
     * @param type the column type
     * @param rows the maximum number of rows to read
     * @return a new column with the rows read
     * @throws DataTypeException with {@link ErrorCode#CANNOT_READ_ALL_DATA} if a stream of the column is missing
     */
    public Column read(String name, DataType type, int rows) {
        Map<String, ByteSource> sources = new HashMap<>();
        Column column = type.createColumn();
        double hint = avgValueSizeHint(name);

        type.deserializeBinaryBulkWithMultipleStreams(column, path -> sources.computeIfAbsent(
            StreamNames.getFileNameForStream(name, path), streamName -> sourceFor(name, streamName)),
            rows, hint, SubstreamPath.EMPTY);

        double updated = DataType.updateAvgValueSizeHint(column, hint);
        avgValueSizeHints.put(name, updated);
        logger.debug("Read {} rows of column {} ({}), size hint {} -> {}",
            column.size(), name, type.getName(), hint, updated);
        return column;
    }

    private ByteSource sourceFor(String columnName, String streamName) {
        ByteArraySink stream = streams.get(streamName);
        if (stream == null) {
            throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                "Stream " + streamName + " of column " + columnName + " does not exist");
        }
        return new ByteArraySource(stream.toByteArray());
    }

    /**
     * Returns the names of all streams the columns of a type map to, in write order.
     *
     * @param name the column name
     * @param type the column type
     * @return the stream names, without duplicates
     */
    public static List<String> streamNamesFor(String name, DataType type) {
        List<String> names = new ArrayList<>();
        type.enumerateStreams(path -> {
            String streamName = StreamNames.getFileNameForStream(name, path);
            if (!names.contains(streamName)) {
                names.add(streamName);
            }
        }, SubstreamPath.EMPTY);
        return names;
    }

    /**
     * Returns the names of all streams written so far, sorted.
     */
    public Set<String> streamNames() {
        return Collections.unmodifiableSet(new TreeSet<>(streams.keySet()));
    }

    /**
     * Returns the bytes of a stream.
     *
     * @param streamName the stream name
     * @return a copy of the bytes, or an empty array if the stream does not exist
     */
    public byte[] streamBytes(String streamName) {
        ByteArraySink stream = streams.get(streamName);
        return stream == null ? new byte[0] : stream.toByteArray();
    }

    /**
     * Returns the current average value size hint of a column, 0 if it was never read.
     */
    public double avgValueSizeHint(String name) {
        return avgValueSizeHints.getOrDefault(name, 0.0);
    }

    public int blocksWritten() {
        return blocksWritten;
    }
}
