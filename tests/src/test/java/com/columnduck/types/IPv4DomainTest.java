package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.format.FormatSettings;
import com.columnduck.format.TextFormat;
import com.columnduck.io.ByteArraySink;
import com.columnduck.io.ByteArraySource;
import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import com.columnduck.types.stream.SubstreamPath;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the IPv4 domain over UInt32.
 *
 * <p>Test ID prefix: TC-IPV4-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("IPv4 Domain Tests")
public class IPv4DomainTest extends TestBase {

    private static final long LOCALHOST = 0x7F000001L;

    private final DataType ipv4 = DataTypes.ipv4();

    @Test
    @DisplayName("TC-IPV4-001: Name comes from the domain, storage from UInt32")
    void testNameAndStorage() {
        assertThat(ipv4.getName()).isEqualTo("IPv4");
        assertThat(ipv4.getFamilyName()).isEqualTo("UInt32");
        assertThat(ipv4.getSizeOfValueInMemory()).isEqualTo(4);
        assertThat(ipv4.canBeInsideNullable()).isTrue();
        assertThat(ipv4).isEqualTo(DataTypes.ipv4());
        assertThat(ipv4).isNotEqualTo(UInt32Type.get());
    }

    @Test
    @DisplayName("TC-IPV4-002: Text forms per format")
    void testWrite() {
        assertThat(writeValue(ipv4, TextFormat.ESCAPED, LOCALHOST)).isEqualTo("127.0.0.1");
        assertThat(writeValue(ipv4, TextFormat.QUOTED, LOCALHOST)).isEqualTo("'127.0.0.1'");
        assertThat(writeValue(ipv4, TextFormat.CSV, LOCALHOST)).isEqualTo("\"127.0.0.1\"");
        assertThat(writeValue(ipv4, TextFormat.PLAIN, LOCALHOST)).isEqualTo("127.0.0.1");
        assertThat(writeValue(ipv4, TextFormat.JSON, LOCALHOST)).isEqualTo("\"127.0.0.1\"");
        assertThat(writeValue(ipv4, TextFormat.XML, LOCALHOST)).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("TC-IPV4-003: Every format reads back what it writes")
    void testRoundTrip() {
        for (TextFormat format : TextFormat.values()) {
            String text = writeValue(ipv4, format, 0xFFFFFFFFL);
            logData(format.name(), text);
            assertThat(readValue(ipv4, format, text)).isEqualTo(0xFFFFFFFFL);
        }
    }

    @Test
    @DisplayName("TC-IPV4-004: Unquoted CSV is accepted")
    void testUnquotedCsv() {
        assertThat(readValue(ipv4, TextFormat.CSV, "10.1.2.3")).isEqualTo(0x0A010203L);
    }

    @ParameterizedTest(name = "TC-IPV4-005: rejects ''{0}''")
    @ValueSource(strings = {"", "1.2.3", "1.2.3.4.5", "256.0.0.1", "1.2.3.a", "1..2.3", "0001.2.3.4", " 1.2.3.4"})
    void testInvalidAddresses(String text) {
        assertThatThrownBy(() -> IPv4Domain.parseAddress(text))
            .isInstanceOf(DataTypeException.class)
            .hasMessage("Invalid IPv4 value: '" + text + "'")
            .extracting(e -> ((DataTypeException) e).getErrorCode())
            .isEqualTo(ErrorCode.CANNOT_PARSE_TEXT);
    }

    @Test
    @DisplayName("TC-IPV4-006: Failed parse leaves the column unchanged")
    void testFailedParse() {
        Column column = ipv4.createColumn();

        assertThatThrownBy(() -> ipv4.deserializeAsText(column, ByteArraySource.ofString("300.1.1.1"),
                FormatSettings.defaults()))
            .isInstanceOf(DataTypeException.class);
        assertThat(column.size()).isZero();
    }

    @Test
    @DisplayName("TC-IPV4-007: Binary streams are those of UInt32")
    void testBinary() {
        List<SubstreamPath> paths = new ArrayList<>();
        ipv4.enumerateStreams(paths::add, SubstreamPath.EMPTY);
        assertThat(paths).containsExactly(SubstreamPath.EMPTY);

        ByteArraySink out = new ByteArraySink();
        Column column = ipv4.createColumn();
        column.insert(LOCALHOST);
        ipv4.serializeBinaryBulk(column, out, 0, 0);
        assertThat(out.toByteArray()).containsExactly((byte) 1, (byte) 0, (byte) 0, (byte) 127);
    }

    @Test
    @DisplayName("TC-IPV4-008: Addresses nested in composite types")
    void testNested() {
        ArrayType addresses = new ArrayType(ipv4);
        NullableType optional = new NullableType(ipv4);

        assertThat(writeValue(addresses, TextFormat.QUOTED, List.of(0x01020304L))).isEqualTo("['1.2.3.4']");
        assertThat(writeValue(addresses, TextFormat.JSON, List.of(0x01020304L))).isEqualTo("[\"1.2.3.4\"]");
        assertThat(readValue(addresses, TextFormat.ESCAPED, "['1.2.3.4','5.6.7.8']"))
            .isEqualTo(List.of(0x01020304L, 0x05060708L));
        assertThat(optional.getName()).isEqualTo("Nullable(IPv4)");
        assertThat(readValue(optional, TextFormat.CSV, "\\N")).isNull();
        assertThat(readValue(optional, TextFormat.CSV, "\"8.8.8.8\"")).isEqualTo(0x08080808L);
    }

    @Test
    @DisplayName("TC-IPV4-009: Formatting covers the whole unsigned range")
    void testFormatAddress() {
        assertThat(IPv4Domain.formatAddress(0)).isEqualTo("0.0.0.0");
        assertThat(IPv4Domain.formatAddress(0xC0A80001L)).isEqualTo("192.168.0.1");
        assertThat(IPv4Domain.parseAddress("192.168.0.1")).isEqualTo(0xC0A80001L);
    }
}
