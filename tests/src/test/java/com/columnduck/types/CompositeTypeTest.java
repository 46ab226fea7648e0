package com.columnduck.types;

import com.columnduck.column.ArrayColumn;
import com.columnduck.column.Column;
import com.columnduck.column.DictionaryColumn;
import com.columnduck.column.NullableColumn;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatSettings;
import com.columnduck.format.TextFormat;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteArraySink;
import com.columnduck.io.ByteArraySource;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import com.columnduck.types.stream.Substream;
import com.columnduck.types.stream.SubstreamPath;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Array, Nullable, Tuple and LowCardinality.
 *
 * <p>Test ID prefix: TC-COMPOSITE-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Serialization
@DisplayName("Composite Type Tests")
public class CompositeTypeTest extends TestBase {

    /** In-memory streams keyed by substream path. */
    private static final class PathStreams {
        private final Map<SubstreamPath, ByteArraySink> sinks = new LinkedHashMap<>();

        ByteSink sink(SubstreamPath path) {
            return sinks.computeIfAbsent(path, p -> new ByteArraySink());
        }

        ByteSource source(SubstreamPath path) {
            ByteArraySink sink = sinks.get(path);
            return sink == null ? null : new ByteArraySource(sink.toByteArray());
        }

        List<SubstreamPath> paths() {
            return new ArrayList<>(sinks.keySet());
        }
    }

    private static Column roundTrip(DataType type, Column column, PathStreams streams) {
        type.serializeBinaryBulkWithMultipleStreams(column, streams::sink, 0, 0, SubstreamPath.EMPTY);
        Column restored = type.createColumn();
        type.deserializeBinaryBulkWithMultipleStreams(restored, streams::source, column.size(), 0,
            SubstreamPath.EMPTY);
        return restored;
    }

    private static Column columnOf(DataType type, Object... values) {
        Column column = type.createColumn();
        for (Object value : values) {
            column.insert(value);
        }
        return column;
    }

    private static List<SubstreamPath> streamsOf(DataType type) {
        List<SubstreamPath> paths = new ArrayList<>();
        type.enumerateStreams(paths::add, SubstreamPath.EMPTY);
        return paths;
    }

    // ==================== Array ====================

    @Nested
    @DisplayName("Array")
    class ArrayTests {

        private final ArrayType type = new ArrayType(Int32Type.get());

        @Test
        @DisplayName("TC-COMPOSITE-001: Name, default and capabilities")
        void testProperties() {
            assertThat(type.getName()).isEqualTo("Array(Int32)");
            assertThat(type.getFamilyName()).isEqualTo("Array");
            assertThat(type.getDefault()).isEmpty();
            assertThat(type.haveSubtypes()).isTrue();
            assertThat(type.canBeInsideNullable()).isFalse();
            assertThat(new ArrayType(new ArrayType(StringType.get())).getName()).isEqualTo("Array(Array(String))");
        }

        @Test
        @DisplayName("TC-COMPOSITE-002: Streams are sizes then elements")
        void testStreams() {
            assertThat(streamsOf(new ArrayType(new NullableType(Int32Type.get())))).containsExactly(
                SubstreamPath.of(Substream.ARRAY_SIZES),
                SubstreamPath.of(Substream.ARRAY_ELEMENTS, Substream.NULL_MAP),
                SubstreamPath.of(Substream.ARRAY_ELEMENTS));
        }

        @Test
        @DisplayName("TC-COMPOSITE-003: Array cannot be written to a single stream")
        void testSingleStreamUnsupported() {
            assertThatThrownBy(() -> type.serializeBinaryBulk(type.createColumn(), new ByteArraySink(), 0, 0))
                .isInstanceOf(DataTypeException.class)
                .extracting(e -> ((DataTypeException) e).getErrorCode())
                .isEqualTo(ErrorCode.MULTIPLE_STREAMS_REQUIRED);
        }

        @Test
        @DisplayName("TC-COMPOSITE-004: Multi-stream round trip")
        void testRoundTrip() {
            Column column = columnOf(type, List.of(1, 2), List.of(), List.of(3));
            PathStreams streams = new PathStreams();

            Column restored = roundTrip(type, column, streams);

            assertThat(streams.paths()).containsExactly(
                SubstreamPath.of(Substream.ARRAY_SIZES), SubstreamPath.of(Substream.ARRAY_ELEMENTS));
            assertThat(streams.sinks.get(SubstreamPath.of(Substream.ARRAY_SIZES)).size()).isEqualTo(24);
            assertThat(restored.size()).isEqualTo(3);
            assertThat(restored.get(0)).isEqualTo(List.of(1, 2));
            assertThat(restored.get(1)).isEqualTo(List.of());
            assertThat(restored.get(2)).isEqualTo(List.of(3));
        }

        @Test
        @DisplayName("TC-COMPOSITE-005: Range of empty arrays writes no elements")
        void testEmptyRange() {
            ArrayColumn column = (ArrayColumn) columnOf(type, List.of(1), List.of(), List.of(), List.of(2));
            PathStreams streams = new PathStreams();

            type.serializeBinaryBulkWithMultipleStreams(column, streams::sink, 1, 2, SubstreamPath.EMPTY);

            assertThat(streams.paths()).containsExactly(SubstreamPath.of(Substream.ARRAY_SIZES));
        }

        @Test
        @DisplayName("TC-COMPOSITE-006: Missing elements fail the read")
        void testMissingElements() {
            PathStreams streams = new PathStreams();
            ByteSink sizes = streams.sink(SubstreamPath.of(Substream.ARRAY_SIZES));
            BinaryEncoding.writeLongLE(2, sizes);
            streams.sink(SubstreamPath.of(Substream.ARRAY_ELEMENTS)).write(new byte[] {1, 0, 0, 0});

            assertThatThrownBy(() -> type.deserializeBinaryBulkWithMultipleStreams(type.createColumn(),
                    streams::source, 1, 0, SubstreamPath.EMPTY))
                .isInstanceOf(DataTypeException.class)
                .extracting(e -> ((DataTypeException) e).getErrorCode())
                .isEqualTo(ErrorCode.CANNOT_READ_ALL_DATA);
        }

        @Test
        @DisplayName("TC-COMPOSITE-007: Text forms of arrays")
        void testText() {
            ArrayType strings = new ArrayType(StringType.get());
            Column column = columnOf(strings, List.of("a", "b'c"));

            assertThat(writeText(strings, TextFormat.ESCAPED, column, 0)).isEqualTo("['a','b\\'c']");
            assertThat(writeText(strings, TextFormat.JSON, column, 0)).isEqualTo("[\"a\",\"b'c\"]");
            assertThat(writeText(strings, TextFormat.XML, column, 0))
                .isEqualTo("<array><elem>a</elem><elem>b'c</elem></array>");
            assertThat(writeText(strings, TextFormat.CSV, column, 0)).isEqualTo("\"['a','b\\'c']\"");
        }

        @Test
        @DisplayName("TC-COMPOSITE-008: Text round trips in every format")
        void testTextRoundTrip() {
            ArrayType strings = new ArrayType(StringType.get());
            List<String> value = List.of("x, y", "", "z");
            for (TextFormat format : TextFormat.values()) {
                logStep("Round trip in " + format);
                assertThat(readValue(strings, format, writeValue(strings, format, value))).isEqualTo(value);
            }
        }

        @Test
        @DisplayName("TC-COMPOSITE-009: Whitespace between elements is accepted")
        void testWhitespace() {
            assertThat(readValue(type, TextFormat.QUOTED, "[ 1 , 2 ]")).isEqualTo(List.of(1, 2));
            assertThat(readValue(type, TextFormat.JSON, "[]")).isEqualTo(List.of());
        }

        @Test
        @DisplayName("TC-COMPOSITE-010: Malformed text leaves the column unchanged")
        void testMalformedLeavesColumnUnchanged() {
            ArrayColumn column = type.createColumn();

            assertThatThrownBy(() -> type.deserializeAsTextQuoted(column, ByteArraySource.ofString("[1,x]"),
                    FormatSettings.defaults()))
                .isInstanceOf(DataTypeException.class);
            assertThat(column.size()).isZero();
            assertThat(column.getData().size()).isZero();
        }
    }

    // ==================== Nullable ====================

    @Nested
    @DisplayName("Nullable")
    class NullableTests {

        private final NullableType type = new NullableType(StringType.get());

        @Test
        @DisplayName("TC-COMPOSITE-011: Name, default and capabilities")
        void testProperties() {
            assertThat(type.getName()).isEqualTo("Nullable(String)");
            assertThat(type.getDefault()).isNull();
            assertThat(type.isNullable()).isTrue();
            assertThat(type.canBeInsideNullable()).isFalse();
            assertThat(new NullableType(Int32Type.get()).getSizeOfValueInMemory()).isEqualTo(5);
        }

        @Test
        @DisplayName("TC-COMPOSITE-012: Only leaf types can be inside Nullable")
        void testInvalidNested() {
            assertThatThrownBy(() -> new NullableType(new ArrayType(Int32Type.get())))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new NullableType(type))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new NullableType(new LowCardinalityType(StringType.get())))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-COMPOSITE-013: Null map stream precedes the nested stream")
        void testStreams() {
            assertThat(streamsOf(type)).containsExactly(
                SubstreamPath.of(Substream.NULL_MAP), SubstreamPath.EMPTY);
        }

        @Test
        @DisplayName("TC-COMPOSITE-014: Multi-stream round trip keeps nulls")
        void testRoundTrip() {
            Column column = columnOf(type, "a", null, "c");
            PathStreams streams = new PathStreams();

            Column restored = roundTrip(type, column, streams);

            assertThat(streams.sinks.get(SubstreamPath.of(Substream.NULL_MAP)).toByteArray())
                .containsExactly((byte) 0, (byte) 1, (byte) 0);
            assertThat(restored.get(0)).isEqualTo("a");
            assertThat(restored.get(1)).isNull();
            assertThat(restored.get(2)).isEqualTo("c");
            assertThat(((NullableColumn) restored).getNestedColumn().get(1)).isEqualTo("");
        }

        @Test
        @DisplayName("TC-COMPOSITE-015: Null markers per format")
        void testNullMarkers() {
            Map<TextFormat, String> expected = new HashMap<>();
            expected.put(TextFormat.ESCAPED, "\\N");
            expected.put(TextFormat.QUOTED, "NULL");
            expected.put(TextFormat.CSV, "\\N");
            expected.put(TextFormat.PLAIN, "NULL");
            expected.put(TextFormat.JSON, "null");
            expected.put(TextFormat.XML, "\\N");

            for (TextFormat format : TextFormat.values()) {
                String text = writeValue(type, format, null);
                assertThat(text).as("null in %s", format).isEqualTo(expected.get(format));
                assertThat(readValue(type, format, text)).as("null from %s", format).isNull();
            }
        }

        @Test
        @DisplayName("TC-COMPOSITE-016: Non-null values use the nested format")
        void testNonNull() {
            for (TextFormat format : TextFormat.values()) {
                assertThat(readValue(type, format, writeValue(type, format, "NULLABLE")))
                    .as("value in %s", format)
                    .isEqualTo("NULLABLE");
            }
        }

        @Test
        @DisplayName("TC-COMPOSITE-017: Nullable numbers in JSON")
        void testNullableNumberJson() {
            NullableType numbers = new NullableType(Int32Type.get());

            assertThat(readValue(numbers, TextFormat.JSON, "null")).isNull();
            assertThat(readValue(numbers, TextFormat.JSON, "15")).isEqualTo(15);
        }
    }

    // ==================== Tuple ====================

    @Nested
    @DisplayName("Tuple")
    class TupleTests {

        private final TupleType unnamed = new TupleType(List.of(Int32Type.get(), StringType.get()));
        private final TupleType named = new TupleType(List.of(Float64Type.get(), Float64Type.get()),
            List.of("lat", "lon"));

        @Test
        @DisplayName("TC-COMPOSITE-018: Names of named and unnamed tuples")
        void testNames() {
            assertThat(unnamed.getName()).isEqualTo("Tuple(Int32, String)");
            assertThat(unnamed.getElementNames()).containsExactly("1", "2");
            assertThat(named.getName()).isEqualTo("Tuple(lat Float64, lon Float64)");
            assertThat(unnamed.getDefault()).isEqualTo(List.of(0, ""));
        }

        @Test
        @DisplayName("TC-COMPOSITE-019: Invalid element names are rejected")
        void testInvalidNames() {
            assertThatThrownBy(() -> new TupleType(List.of(Int32Type.get(), Int32Type.get()), List.of("a", "a")))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new TupleType(List.of(Int32Type.get()), List.of("a", "b")))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new TupleType(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-COMPOSITE-020: Fixed size is the sum of element sizes")
        void testSize() {
            assertThat(named.getSizeOfValueInMemory()).isEqualTo(16);
            assertThat(named.haveMaximumSizeOfValue()).isTrue();
            assertThat(unnamed.haveMaximumSizeOfValue()).isFalse();
        }

        @Test
        @DisplayName("TC-COMPOSITE-021: One stream per element")
        void testStreamsAndRoundTrip() {
            Column column = columnOf(named, List.of(1.5, 2.5), Arrays.asList(3.0, 4.0));
            PathStreams streams = new PathStreams();

            Column restored = roundTrip(named, column, streams);

            assertThat(streams.paths()).containsExactly(
                SubstreamPath.of(Substream.tupleElement("lat")), SubstreamPath.of(Substream.tupleElement("lon")));
            assertThat(restored.get(1)).isEqualTo(List.of(3.0, 4.0));
        }

        @Test
        @DisplayName("TC-COMPOSITE-022: Text forms of tuples")
        void testText() {
            Column column = columnOf(unnamed, List.of(7, "x"));

            assertThat(writeText(unnamed, TextFormat.QUOTED, column, 0)).isEqualTo("(7,'x')");
            assertThat(writeText(unnamed, TextFormat.JSON, column, 0)).isEqualTo("[7,\"x\"]");
            assertThat(writeText(unnamed, TextFormat.XML, column, 0))
                .isEqualTo("<tuple><elem>7</elem><elem>x</elem></tuple>");
            assertThat(writeText(unnamed, TextFormat.CSV, column, 0)).isEqualTo("7,\"x\"");
        }

        @Test
        @DisplayName("TC-COMPOSITE-023: Text round trips in every format")
        void testTextRoundTrip() {
            List<Object> value = List.of(-3, "a,b");
            for (TextFormat format : TextFormat.values()) {
                logStep("Round trip in " + format);
                assertThat(readValue(unnamed, format, writeValue(unnamed, format, value))).isEqualTo(value);
            }
        }

        @Test
        @DisplayName("TC-COMPOSITE-024: CSV elements use the configured delimiter")
        void testCsvDelimiter() {
            FormatSettings settings = FormatSettings.defaults().withCsvDelimiter(';');
            Column column = columnOf(unnamed, List.of(1, "y"));

            String text = writeText(unnamed, TextFormat.CSV, column, 0, settings);

            assertThat(text).isEqualTo("1;\"y\"");
            assertThat(readValue(unnamed, TextFormat.CSV, text, settings)).isEqualTo(List.of(1, "y"));
        }
    }

    // ==================== LowCardinality ====================

    @Nested
    @DisplayName("LowCardinality")
    class LowCardinalityTests {

        private final LowCardinalityType type = new LowCardinalityType(StringType.get());

        @Test
        @DisplayName("TC-COMPOSITE-025: Name and dictionary type validation")
        void testProperties() {
            assertThat(type.getName()).isEqualTo("LowCardinality(String)");
            assertThat(type.getDefault()).isEqualTo("");
            assertThat(new LowCardinalityType(DataTypes.ipv4()).getName()).isEqualTo("LowCardinality(IPv4)");
            assertThatThrownBy(() -> new LowCardinalityType(new NullableType(StringType.get())))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new LowCardinalityType(new ArrayType(StringType.get())))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-COMPOSITE-026: Keys stream precedes the positions stream")
        void testStreams() {
            assertThat(streamsOf(type)).containsExactly(
                SubstreamPath.of(Substream.DICTIONARY_KEYS), SubstreamPath.EMPTY);
        }

        @Test
        @DisplayName("TC-COMPOSITE-027: Each block stores only the keys it uses")
        void testBlockKeys() {
            DictionaryColumn column = (DictionaryColumn) columnOf(type, "a", "b", "a", "c", "c");
            PathStreams streams = new PathStreams();

            logStep("Given: two blocks, rows [0, 3) and [3, 5)");
            type.serializeBinaryBulkWithMultipleStreams(column, streams::sink, 0, 3, SubstreamPath.EMPTY);
            type.serializeBinaryBulkWithMultipleStreams(column, streams::sink, 3, 2, SubstreamPath.EMPTY);

            logStep("Then: block keys are [a, b] and [c]");
            ByteSource keys = streams.source(SubstreamPath.of(Substream.DICTIONARY_KEYS));
            assertThat(BinaryEncoding.readLongLE(keys)).isEqualTo(2L);

            logStep("When: both blocks are read back");
            Column restored = type.createColumn();
            type.deserializeBinaryBulkWithMultipleStreams(restored, streams::source, 5, 0, SubstreamPath.EMPTY);

            assertThat(restored.size()).isEqualTo(5);
            assertThat(restored.get(0)).isEqualTo("a");
            assertThat(restored.get(2)).isEqualTo("a");
            assertThat(restored.get(4)).isEqualTo("c");
            assertThat(((DictionaryColumn) restored).dictionarySize()).isEqualTo(3);
        }

        @Test
        @DisplayName("TC-COMPOSITE-028: Text delegates to the dictionary type")
        void testText() {
            for (TextFormat format : TextFormat.values()) {
                assertThat(readValue(type, format, writeValue(type, format, "v 1"))).isEqualTo("v 1");
            }
            assertThat(writeValue(type, TextFormat.QUOTED, "q")).isEqualTo("'q'");
        }

        @Test
        @DisplayName("TC-COMPOSITE-029: Repeated text values share a dictionary entry")
        void testTextSharesKeys() {
            DictionaryColumn column = type.createColumn();
            for (String text : List.of("x", "y", "x")) {
                type.deserializeAsText(column, ByteArraySource.ofString(text), FormatSettings.defaults());
            }

            assertThat(column.size()).isEqualTo(3);
            assertThat(column.dictionarySize()).isEqualTo(2);
        }

        @Test
        @DisplayName("TC-COMPOSITE-030: Domain formats of the dictionary type are used")
        void testDomainDictionary() {
            LowCardinalityType addresses = new LowCardinalityType(DataTypes.ipv4());

            assertThat(writeValue(addresses, TextFormat.JSON, 0x7F000001L)).isEqualTo("\"127.0.0.1\"");
            assertThat(readValue(addresses, TextFormat.CSV, "\"10.0.0.1\"")).isEqualTo(0x0A000001L);
        }
    }
}
