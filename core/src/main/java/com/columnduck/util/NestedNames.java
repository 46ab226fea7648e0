package com.columnduck.util;

import java.util.Objects;

/**
 * Names of columns that belong to a nested structure.
 *
 * <p>A nested structure {@code n} with fields {@code a} and {@code b} is stored
 * as sibling array columns {@code n.a} and {@code n.b}. The part before the
 * first dot is the nested table name.
 */
public final class NestedNames {

    private NestedNames() {} // Utility class

    /**
     * A column name split into nested table name and field name.
     *
     * @param tableName the nested table name, or the whole name if it is not nested
     * @param fieldName the field name, or empty if the name is not nested
     */
    public record SplitName(String tableName, String fieldName) {

        public SplitName {
            Objects.requireNonNull(tableName, "tableName must not be null");
            Objects.requireNonNull(fieldName, "fieldName must not be null");
        }

        public boolean isNested() {
            return !fieldName.isEmpty();
        }
    }

    /**
     * Splits a name at its first dot.
     *
     * <p>A name with no dot, a leading dot or a trailing dot is not nested.
     *
     * @param name the column name
     * @return the split name
     */
    public static SplitName splitName(String name) {
        int idx = name.indexOf('.');
        if (idx <= 0 || idx == name.length() - 1) {
            return new SplitName(name, "");
        }
        return new SplitName(name.substring(0, idx), name.substring(idx + 1));
    }

    /**
     * Returns the nested table name of a column, or the name itself if it is not nested.
     *
     * @param name the column name
     * @return the table name
     */
    public static String extractTableName(String name) {
        return splitName(name).tableName();
    }

    /**
     * Joins a nested table name and a field name.
     *
     * @param tableName the nested table name
     * @param fieldName the field name
     * @return {@code tableName.fieldName}
     */
    public static String concatenateName(String tableName, String fieldName) {
        return tableName + "." + fieldName;
    }
}
