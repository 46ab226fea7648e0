package com.columnduck.types;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps data type descriptors to Arrow schema fields.
 *
 * <p>Examples:
 * <pre>
 *   Int32                    → Int(32, signed)
 *   UInt64                   → Int(64, unsigned)
 *   Array(String)            → List&lt;item: Utf8&gt;
 *   Nullable(Float64)        → nullable FloatingPoint(DOUBLE)
 *   Tuple(a Int32, b String) → Struct&lt;a: Int(32), b: Utf8&gt;
 *   LowCardinality(String)   → Utf8, dictionary-encoded with UInt32 indices
 *   IPv4                     → Int(32, unsigned), metadata columnduck.domain=IPv4
 * </pre>
 *
 * <p>Only fields of {@link NullableType} are nullable.
 */
public final class ArrowTypeMapper {

    /** Field metadata key holding the name of a domain-decorated type. */
    public static final String DOMAIN_METADATA_KEY = "columnduck.domain";

    /** Name of the child field of a list. */
    public static final String LIST_ITEM_NAME = "item";

    private ArrowTypeMapper() {} // Utility class

    /**
     * Converts one named column type to an Arrow field.
     *
     * @param name the field name
     * @param type the column type
     * @return the field
     * @throws UnsupportedOperationException if the type has no Arrow counterpart
     */
    public static Field toArrowField(String name, DataType type) {
        return toField(name, type, new DictionaryIds());
    }

    /**
     * Converts named column types to an Arrow schema, in map iteration order.
     *
     * <p>Dictionary-encoded fields get distinct dictionary ids.
     *
     * @param columns column names and types
     * @return the schema
     */
    public static Schema toArrowSchema(Map<String, DataType> columns) {
        DictionaryIds ids = new DictionaryIds();
        List<Field> fields = new ArrayList<>(columns.size());
        for (Map.Entry<String, DataType> column : columns.entrySet()) {
            fields.add(toField(column.getKey(), column.getValue(), ids));
        }
        return new Schema(fields);
    }

    private static Field toField(String name, DataType type, DictionaryIds ids) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }

        Map<String, String> metadata = null;
        DataType structural = type;
        if (type instanceof DomainDecoratedType) {
            metadata = new LinkedHashMap<>();
            metadata.put(DOMAIN_METADATA_KEY, type.getName());
            structural = ((DomainDecoratedType) type).getBaseType();
        }

        if (structural instanceof NullableType) {
            Field nested = toField(name, ((NullableType) structural).getNestedType(), ids);
            FieldType nestedType = nested.getFieldType();
            FieldType nullableType = new FieldType(true, nestedType.getType(), nestedType.getDictionary(),
                merge(nestedType.getMetadata(), metadata));
            return new Field(name, nullableType, nested.getChildren());
        }

        if (structural instanceof ArrayType) {
            Field item = toField(LIST_ITEM_NAME, ((ArrayType) structural).getElementType(), ids);
            return new Field(name, new FieldType(false, ArrowType.List.INSTANCE, null, metadata),
                Collections.singletonList(item));
        }

        if (structural instanceof TupleType) {
            TupleType tuple = (TupleType) structural;
            List<Field> children = new ArrayList<>(tuple.getElementTypes().size());
            for (int i = 0; i < tuple.getElementTypes().size(); i++) {
                children.add(toField(tuple.getElementNames().get(i), tuple.getElementTypes().get(i), ids));
            }
            return new Field(name, new FieldType(false, ArrowType.Struct.INSTANCE, null, metadata), children);
        }

        if (structural instanceof LowCardinalityType) {
            Field values = toField(name, ((LowCardinalityType) structural).getDictionaryType(), ids);
            DictionaryEncoding encoding = new DictionaryEncoding(ids.next(), false, new ArrowType.Int(32, false));
            FieldType valueType = values.getFieldType();
            FieldType encoded = new FieldType(false, valueType.getType(), encoding,
                merge(valueType.getMetadata(), metadata));
            return new Field(name, encoded, values.getChildren());
        }

        return new Field(name, new FieldType(false, toArrowType(structural), null, metadata), null);
    }

    /**
     * Returns the Arrow type of a leaf type.
     *
     * @param type a leaf type
     * @return the Arrow type
     * @throws UnsupportedOperationException for composite or unknown types
     */
    public static ArrowType toArrowType(DataType type) {
        if (type instanceof Int32Type) {
            return new ArrowType.Int(32, true);
        } else if (type instanceof Int64Type) {
            return new ArrowType.Int(64, true);
        } else if (type instanceof UInt32Type) {
            return new ArrowType.Int(32, false);
        } else if (type instanceof UInt64Type) {
            return new ArrowType.Int(64, false);
        } else if (type instanceof Float64Type) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        } else if (type instanceof StringType) {
            return ArrowType.Utf8.INSTANCE;
        } else if (type instanceof DomainDecoratedType) {
            return toArrowType(((DomainDecoratedType) type).getBaseType());
        }
        throw new UnsupportedOperationException("No Arrow type for data type " + type.getName());
    }

    private static Map<String, String> merge(Map<String, String> inner, Map<String, String> outer) {
        if (outer == null || outer.isEmpty()) {
            return inner == null || inner.isEmpty() ? null : inner;
        }
        Map<String, String> merged = new LinkedHashMap<>();
        if (inner != null) {
            merged.putAll(inner);
        }
        merged.putAll(outer);
        return merged;
    }

    private static final class DictionaryIds {
        private long next;

        long next() {
            return next++;
        }
    }
}
