package com.columnduck.types;

import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for data type descriptors.
 */
public final class DataTypes {

    private DataTypes() {} // Utility class

    public static DataType int32() {
        return Int32Type.get();
    }

    public static DataType int64() {
        return Int64Type.get();
    }

    public static DataType uint32() {
        return UInt32Type.get();
    }

    public static DataType uint64() {
        return UInt64Type.get();
    }

    public static DataType float64() {
        return Float64Type.get();
    }

    public static DataType string() {
        return StringType.get();
    }

    public static ArrayType array(DataType elementType) {
        return new ArrayType(elementType);
    }

    public static NullableType nullable(DataType nestedType) {
        return new NullableType(nestedType);
    }

    public static TupleType tuple(DataType... elementTypes) {
        return new TupleType(Arrays.asList(elementTypes));
    }

    public static TupleType namedTuple(List<String> names, List<DataType> elementTypes) {
        return new TupleType(elementTypes, names);
    }

    public static LowCardinalityType lowCardinality(DataType dictionaryType) {
        return new LowCardinalityType(dictionaryType);
    }

    /**
     * Returns {@code UInt32} decorated with the {@link IPv4Domain}.
     *
     * @return the IPv4 type
     */
    public static DataType ipv4() {
        return DataTypeBuilder.forType(UInt32Type.get())
            .appendDomain(new IPv4Domain())
            .build();
    }

    /**
     * Resolves a type from its name, e.g. {@code Array(Nullable(String))}.
     *
     * @param name the type name as returned by {@link DataType#getName()}
     * @return the type
     * @see DataTypeParser
     */
    public static DataType fromName(String name) {
        return DataTypeParser.parse(name);
    }
}
