package com.columnduck.format;

import com.columnduck.exception.DataTypeException;
import com.columnduck.io.ByteArraySink;
import com.columnduck.io.ByteArraySource;
import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the string readers and writers of {@link TextCodecs}.
 *
 * <p>Test ID prefix: TC-CODEC-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Text Codec Tests")
public class TextCodecsTest extends TestBase {

    @Nested
    @DisplayName("Writers")
    class Writers {

        @Test
        @DisplayName("TC-CODEC-001: Escaped and quoted strings")
        void testEscaped() {
            ByteArraySink out = new ByteArraySink();
            TextCodecs.writeEscapedString("a\tb\\c'", out);
            out.write('|');
            TextCodecs.writeQuotedString("it's", out);

            assertThat(out.toUtf8String()).isEqualTo("a\\tb\\\\c\\'|'it\\'s'");
        }

        @Test
        @DisplayName("TC-CODEC-002: CSV doubles embedded quotes")
        void testCsv() {
            ByteArraySink out = new ByteArraySink();
            TextCodecs.writeCSVString("say \"hi\"", out);

            assertThat(out.toUtf8String()).isEqualTo("\"say \"\"hi\"\"\"");
        }

        @Test
        @DisplayName("TC-CODEC-003: JSON forward slashes follow the setting")
        void testJsonSlashes() {
            ByteArraySink escaped = new ByteArraySink();
            ByteArraySink plain = new ByteArraySink();
            TextCodecs.writeJSONString("a/b\"", escaped, FormatSettings.defaults());
            TextCodecs.writeJSONString("a/b\"", plain, FormatSettings.defaults().withJsonEscapeForwardSlashes(false));

            assertThat(escaped.toUtf8String()).isEqualTo("\"a\\/b\\\"\"");
            assertThat(plain.toUtf8String()).isEqualTo("\"a/b\\\"\"");
        }

        @Test
        @DisplayName("TC-CODEC-004: XML escapes markup characters")
        void testXml() {
            ByteArraySink out = new ByteArraySink();
            TextCodecs.writeXMLString("<a & b>", out);

            assertThat(out.toUtf8String()).isEqualTo("&lt;a &amp; b&gt;");
        }
    }

    @Nested
    @DisplayName("Readers")
    class Readers {

        @Test
        @DisplayName("TC-CODEC-005: Escaped string stops at tab")
        void testEscapedStopsAtTab() {
            ByteArraySource in = ByteArraySource.ofString("x\\ty\tz");

            assertThat(TextCodecs.readEscapedString(in)).isEqualTo("x\ty");
            assertThat(in.peek()).isEqualTo('\t');
        }

        @Test
        @DisplayName("TC-CODEC-006: Unterminated quoted string fails")
        void testUnterminatedQuoted() {
            assertThatThrownBy(() -> TextCodecs.readQuotedString(ByteArraySource.ofString("'abc")))
                .isInstanceOf(DataTypeException.class)
                .hasMessageContaining("closing quote");
        }

        @Test
        @DisplayName("TC-CODEC-007: CSV quoting and delimiters")
        void testCsv() {
            FormatSettings settings = FormatSettings.defaults();
            ByteArraySource in = ByteArraySource.ofString("\"a\"\"b\",c d,'e'");

            assertThat(TextCodecs.readCSVString(in, settings)).isEqualTo("a\"b");
            TextCodecs.assertChar(',', in);
            assertThat(TextCodecs.readCSVString(in, settings)).isEqualTo("c d");
            TextCodecs.assertChar(',', in);
            assertThat(TextCodecs.readCSVString(in, settings)).isEqualTo("e");
        }

        @Test
        @DisplayName("TC-CODEC-008: Single quotes can be disabled in CSV")
        void testCsvSingleQuotesDisabled() {
            FormatSettings settings = FormatSettings.defaults().withCsvAllowSingleQuotes(false);

            assertThat(TextCodecs.readCSVString(ByteArraySource.ofString("'e'"), settings)).isEqualTo("'e'");
        }

        @Test
        @DisplayName("TC-CODEC-009: JSON escapes are decoded")
        void testJson() {
            ByteArraySource in = ByteArraySource.ofString("\"a\\u00e9\\n\\\"\",");

            assertThat(TextCodecs.readJSONString(in)).isEqualTo("aé\n\"");
            assertThat(in.peek()).isEqualTo(',');
        }

        @Test
        @DisplayName("TC-CODEC-010: XML entities are decoded")
        void testXml() {
            ByteArraySource in = ByteArraySource.ofString("&lt;x&gt; &amp;amp;</elem>");

            assertThat(TextCodecs.readXMLString(in)).isEqualTo("<x> &amp;");
            assertThat(in.peek()).isEqualTo('<');
        }

        @Test
        @DisplayName("TC-CODEC-011: Markers")
        void testMarkers() {
            ByteArraySource in = ByteArraySource.ofString("NULL  x");

            assertThat(TextCodecs.checkString("NULLX", in)).isFalse();
            assertThat(TextCodecs.checkString("NULL", in)).isTrue();
            TextCodecs.skipWhitespace(in);
            assertThat(TextCodecs.checkChar('y', in)).isFalse();
            assertThatThrownBy(() -> TextCodecs.assertChar('y', in))
                .isInstanceOf(DataTypeException.class)
                .hasMessage("Cannot parse input: expected 'y' but found 'x'");
            assertThatThrownBy(() -> TextCodecs.assertChar('y', in))
                .hasMessage("Cannot parse input: expected 'y' but found end of stream");
        }
    }
}
