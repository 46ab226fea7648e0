package com.columnduck.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses type names back into descriptors.
 *
 * <p>Accepts every name produced by {@link DataType#getName()}:
 * <ul>
 *   <li>{@code Int32}, {@code Int64}, {@code UInt32}, {@code UInt64}, {@code Float64}, {@code String}</li>
 *   <li>{@code IPv4}</li>
 *   <li>{@code Array(T)}, {@code Nullable(T)}, {@code LowCardinality(T)}</li>
 *   <li>{@code Tuple(T1, T2)} and {@code Tuple(a T1, b T2)}</li>
 * </ul>
 */
public final class DataTypeParser {

    private DataTypeParser() {} // Utility class

    /**
     * Parses a type name.
     *
     * @param name the type name
     * @return the parsed type
     * @throws IllegalArgumentException if the name is malformed
     * @throws UnsupportedOperationException if the name refers to an unknown type
     */
    public static DataType parse(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Type name cannot be null or empty");
        }
        String trimmed = name.trim();

        int open = trimmed.indexOf('(');
        if (open == -1) {
            if (trimmed.indexOf(')') != -1) {
                throw new IllegalArgumentException("Invalid type name: " + name);
            }
            return parseSimpleType(trimmed);
        }
        if (!trimmed.endsWith(")")) {
            throw new IllegalArgumentException("Invalid type name: " + name);
        }

        String family = trimmed.substring(0, open).trim();
        String inner = trimmed.substring(open + 1, trimmed.length() - 1);
        switch (family) {
            case "Array":
                return new ArrayType(parse(inner));
            case "Nullable":
                return new NullableType(parse(inner));
            case "LowCardinality":
                return new LowCardinalityType(parse(inner));
            case "Tuple":
                return parseTuple(inner);
            default:
                throw new UnsupportedOperationException("Unknown data type family: " + family);
        }
    }

    private static DataType parseSimpleType(String name) {
        switch (name) {
            case "Int32":
                return Int32Type.get();
            case "Int64":
                return Int64Type.get();
            case "UInt32":
                return UInt32Type.get();
            case "UInt64":
                return UInt64Type.get();
            case "Float64":
                return Float64Type.get();
            case "String":
                return StringType.get();
            case IPv4Domain.NAME:
                return DataTypes.ipv4();
            default:
                throw new UnsupportedOperationException("Unknown data type: " + name);
        }
    }

    /**
     * Parses tuple elements. Either all elements are named or none is.
     */
    private static TupleType parseTuple(String inner) {
        List<String> elementDefs = splitTopLevel(inner, ',');
        if (elementDefs.isEmpty()) {
            throw new IllegalArgumentException("Tuple must have at least one element");
        }

        List<DataType> types = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (String def : elementDefs) {
            int space = findElementNameEnd(def);
            if (space == -1) {
                types.add(parse(def));
            } else {
                names.add(def.substring(0, space));
                types.add(parse(def.substring(space + 1)));
            }
        }

        if (names.isEmpty()) {
            return new TupleType(types);
        }
        if (names.size() != types.size()) {
            throw new IllegalArgumentException("Tuple elements must be either all named or all unnamed: " + inner);
        }
        return new TupleType(types, names);
    }

    /**
     * Returns the index of the space ending an element name, or -1 if the element is unnamed.
     */
    private static int findElementNameEnd(String def) {
        for (int i = 0; i < def.length(); i++) {
            char c = def.charAt(i);
            if (c == '(') {
                return -1;
            }
            if (c == ' ') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Splits a string by a delimiter, respecting nested parentheses.
     *
     * @param str the string to split
     * @param delimiter the delimiter character
     * @return the trimmed, non-empty parts
     */
    private static List<String> splitTopLevel(String str, char delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;

        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == delimiter && depth == 0) {
                String part = str.substring(start, i).trim();
                if (!part.isEmpty()) {
                    parts.add(part);
                }
                start = i + 1;
            }
        }

        if (start < str.length()) {
            String part = str.substring(start).trim();
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced parentheses in type name: " + str);
        }
        return parts;
    }
}
