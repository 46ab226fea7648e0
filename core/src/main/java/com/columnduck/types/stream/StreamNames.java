package com.columnduck.types.stream;

import com.columnduck.util.FileNames;
import com.columnduck.util.NestedNames;

/**
 * Maps a column and a substream path to the name of a physical stream.
 *
 * <p>The names are persisted: the same (column, path) pair must map to the
 * same bytes in every version, or existing data becomes unreadable.
 *
 * <p>Examples:
 * <pre>
 *   ("x",     [ARRAY_SIZES])                  → "x.size0"
 *   ("n.a",   [ARRAY_SIZES])                  → "n.size0"     (shared by all columns of nested n)
 *   ("arr",   [ARRAY_ELEMENTS, ARRAY_SIZES])  → "arr.size1"
 *   ("v",     [NULL_MAP])                     → "v.null"
 *   ("point", [TUPLE_ELEMENT(lat)])           → "point%2Elat"
 *   ("s",     [DICTIONARY_KEYS])              → "s.dict"
 * </pre>
 */
public final class StreamNames {

    private StreamNames() {} // Utility class

    /**
     * Returns the stream name for a column and a substream path.
     *
     * @param columnName the column name, unescaped
     * @param path the substream path
     * @return the escaped stream name
     */
    public static String getFileNameForStream(String columnName, SubstreamPath path) {
        // Sizes of arrays of one nested structure are shared, but only at the first level.
        String nestedTableName = NestedNames.extractTableName(columnName);
        boolean isSizesOfNestedType = path.size() == 1
            && path.get(0).kind() == Substream.Kind.ARRAY_SIZES
            && !nestedTableName.equals(columnName);

        int arrayLevel = 0;
        StringBuilder streamName = new StringBuilder(
            FileNames.escapeForFileName(isSizesOfNestedType ? nestedTableName : columnName));
        for (Substream elem : path) {
            switch (elem.kind()) {
                case NULL_MAP:
                    streamName.append(".null");
                    break;
                case ARRAY_SIZES:
                    streamName.append(".size").append(arrayLevel);
                    break;
                case ARRAY_ELEMENTS:
                    ++arrayLevel;
                    break;
                case TUPLE_ELEMENT:
                    // %2E instead of a dot: a dotted name already means a column of a nested structure.
                    streamName.append("%2E").append(FileNames.escapeForFileName(elem.tupleElementName()));
                    break;
                case DICTIONARY_KEYS:
                    streamName.append(".dict");
                    break;
                default:
                    throw new IllegalStateException("Unknown substream kind: " + elem.kind());
            }
        }
        return streamName.toString();
    }
}
