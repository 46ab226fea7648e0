package com.columnduck.types;

import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ArrowTypeMapper}.
 *
 * <p>Test ID prefix: TC-ARROW-*
 */
@TestCategories.Tier1
@TestCategories.TypeMapping
@DisplayName("Arrow Type Mapper Tests")
public class ArrowTypeMapperTest extends TestBase {

    @Test
    @DisplayName("TC-ARROW-001: Leaf types")
    void testLeafTypes() {
        assertThat(ArrowTypeMapper.toArrowType(Int32Type.get())).isEqualTo(new ArrowType.Int(32, true));
        assertThat(ArrowTypeMapper.toArrowType(Int64Type.get())).isEqualTo(new ArrowType.Int(64, true));
        assertThat(ArrowTypeMapper.toArrowType(UInt32Type.get())).isEqualTo(new ArrowType.Int(32, false));
        assertThat(ArrowTypeMapper.toArrowType(UInt64Type.get())).isEqualTo(new ArrowType.Int(64, false));
        assertThat(ArrowTypeMapper.toArrowType(Float64Type.get()))
            .isEqualTo(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE));
        assertThat(ArrowTypeMapper.toArrowType(StringType.get())).isEqualTo(ArrowType.Utf8.INSTANCE);
    }

    @Test
    @DisplayName("TC-ARROW-002: Composite types have no leaf Arrow type")
    void testCompositeLeafUnsupported() {
        assertThatThrownBy(() -> ArrowTypeMapper.toArrowType(new ArrayType(StringType.get())))
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessage("No Arrow type for data type Array(String)");
    }

    @Test
    @DisplayName("TC-ARROW-003: Only Nullable fields are nullable")
    void testNullable() {
        Field plain = ArrowTypeMapper.toArrowField("x", Float64Type.get());
        Field nullable = ArrowTypeMapper.toArrowField("x", new NullableType(Float64Type.get()));

        assertThat(plain.isNullable()).isFalse();
        assertThat(nullable.isNullable()).isTrue();
        assertThat(nullable.getType()).isEqualTo(plain.getType());
    }

    @Test
    @DisplayName("TC-ARROW-004: Arrays become lists with an item child")
    void testArray() {
        Field field = ArrowTypeMapper.toArrowField("tags", new ArrayType(new NullableType(StringType.get())));

        assertThat(field.getType()).isEqualTo(ArrowType.List.INSTANCE);
        assertThat(field.getChildren()).hasSize(1);
        Field item = field.getChildren().get(0);
        assertThat(item.getName()).isEqualTo(ArrowTypeMapper.LIST_ITEM_NAME);
        assertThat(item.isNullable()).isTrue();
        assertThat(item.getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
    }

    @Test
    @DisplayName("TC-ARROW-005: Tuples become structs named after their elements")
    void testTuple() {
        Field field = ArrowTypeMapper.toArrowField("point",
            new TupleType(List.of(Float64Type.get(), Float64Type.get()), List.of("lat", "lon")));

        assertThat(field.getType()).isEqualTo(ArrowType.Struct.INSTANCE);
        assertThat(field.getChildren()).extracting(Field::getName).containsExactly("lat", "lon");

        Field unnamed = ArrowTypeMapper.toArrowField("t", new TupleType(List.of(Int32Type.get())));
        assertThat(unnamed.getChildren()).extracting(Field::getName).containsExactly("1");
    }

    @Test
    @DisplayName("TC-ARROW-006: LowCardinality is dictionary-encoded")
    void testLowCardinality() {
        Field field = ArrowTypeMapper.toArrowField("s", new LowCardinalityType(StringType.get()));

        assertThat(field.getType()).isEqualTo(ArrowType.Utf8.INSTANCE);
        assertThat(field.getDictionary()).isNotNull();
        assertThat(field.getDictionary().getIndexType()).isEqualTo(new ArrowType.Int(32, false));
        assertThat(field.getDictionary().isOrdered()).isFalse();
    }

    @Test
    @DisplayName("TC-ARROW-007: Domains are recorded in field metadata")
    void testDomainMetadata() {
        Field field = ArrowTypeMapper.toArrowField("ip", DataTypes.ipv4());
        Field optional = ArrowTypeMapper.toArrowField("ip", new NullableType(DataTypes.ipv4()));

        assertThat(field.getType()).isEqualTo(new ArrowType.Int(32, false));
        assertThat(field.getMetadata()).containsEntry(ArrowTypeMapper.DOMAIN_METADATA_KEY, "IPv4");
        assertThat(optional.isNullable()).isTrue();
        assertThat(optional.getMetadata()).containsEntry(ArrowTypeMapper.DOMAIN_METADATA_KEY, "IPv4");
        assertThat(ArrowTypeMapper.toArrowField("n", UInt32Type.get()).getMetadata()).isEmpty();
    }

    @Test
    @DisplayName("TC-ARROW-008: Schema keeps column order and distinct dictionary ids")
    void testSchema() {
        Map<String, DataType> columns = new LinkedHashMap<>();
        columns.put("id", DataTypes.uint64());
        columns.put("city", DataTypes.lowCardinality(DataTypes.string()));
        columns.put("country", DataTypes.lowCardinality(DataTypes.string()));

        Schema schema = ArrowTypeMapper.toArrowSchema(columns);
        logData("schema", schema);

        assertThat(schema.getFields()).extracting(Field::getName).containsExactly("id", "city", "country");
        assertThat(schema.findField("city").getDictionary().getId())
            .isNotEqualTo(schema.findField("country").getDictionary().getId());
    }
}
