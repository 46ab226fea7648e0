package com.columnduck.format;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;
import com.columnduck.io.ByteArraySink;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writers and readers for strings and tokens in each text format.
 *
 * <p>Readers work on raw bytes: every special character of the formats is
 * ASCII, and bytes of multi-byte UTF-8 sequences never collide with ASCII, so
 * collected bytes are decoded as UTF-8 only once a value is complete.
 */
public final class TextCodecs {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private TextCodecs() {} // Utility class

    // ==================== Writers ====================

    /**
     * Writes a string with tab-separated escaping.
     */
    public static void writeEscapedString(String s, ByteSink out) {
        out.writeString(escape(s));
    }

    /**
     * Writes a string as a single-quoted literal.
     */
    public static void writeQuotedString(String s, ByteSink out) {
        out.write('\'');
        out.writeString(escape(s));
        out.write('\'');
    }

    /**
     * Writes a string as a double-quoted CSV field, doubling embedded quotes.
     */
    public static void writeCSVString(String s, ByteSink out) {
        out.write('"');
        out.writeString(s.replace("\"", "\"\""));
        out.write('"');
    }

    /**
     * Writes a string as a JSON string literal.
     */
    public static void writeJSONString(String s, ByteSink out, FormatSettings settings) {
        String quoted = new String(JsonStringEncoder.getInstance().quoteAsString(s));
        if (settings.jsonEscapeForwardSlashes()) {
            quoted = quoted.replace("/", "\\/");
        }
        out.write('"');
        out.writeString(quoted);
        out.write('"');
    }

    /**
     * Writes a string as XML element text.
     */
    public static void writeXMLString(String s, ByteSink out) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '&': sb.append("&amp;"); break;
                default: sb.append(c);
            }
        }
        out.writeString(sb.toString());
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                case '\\': sb.append("\\\\"); break;
                case '\'': sb.append("\\'"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    // ==================== Readers ====================

    /**
     * Reads a tab-separated escaped string up to (not including) a tab, a newline or the end.
     */
    public static String readEscapedString(ByteSource in) {
        ByteArraySink value = new ByteArraySink();
        while (!in.eof()) {
            int c = in.peek();
            if (c == '\t' || c == '\n') {
                break;
            }
            in.skip();
            if (c == '\\') {
                value.write(unescape(in));
            } else {
                value.write(c);
            }
        }
        return value.toUtf8String();
    }

    /**
     * Reads a single-quoted literal.
     */
    public static String readQuotedString(ByteSource in) {
        assertChar('\'', in);
        ByteArraySink value = new ByteArraySink();
        while (true) {
            int c = in.read();
            if (c < 0) {
                throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                    "Cannot parse quoted string: expected closing quote");
            }
            if (c == '\'') {
                return value.toUtf8String();
            }
            if (c == '\\') {
                value.write(unescape(in));
            } else {
                value.write(c);
            }
        }
    }

    /**
     * Reads a CSV field: quoted with double (or, if allowed, single) quotes, or
     * unquoted up to the delimiter or the end of the line.
     */
    public static String readCSVString(ByteSource in, FormatSettings settings) {
        int first = in.peek();
        if ((first == '"' && settings.csvAllowDoubleQuotes()) || (first == '\'' && settings.csvAllowSingleQuotes())) {
            in.skip();
            ByteArraySink value = new ByteArraySink();
            while (true) {
                int c = in.read();
                if (c < 0) {
                    throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                        "Cannot parse CSV string: expected closing quote");
                }
                if (c == first) {
                    if (in.peek() == first) {
                        in.skip();
                        value.write(c);
                    } else {
                        return value.toUtf8String();
                    }
                } else {
                    value.write(c);
                }
            }
        }
        ByteArraySink value = new ByteArraySink();
        while (!in.eof()) {
            int c = in.peek();
            if (c == settings.csvDelimiter() || c == '\r' || c == '\n') {
                break;
            }
            value.write(in.read());
        }
        return value.toUtf8String();
    }

    /**
     * Reads a JSON string literal, decoding its escapes with Jackson.
     */
    public static String readJSONString(ByteSource in) {
        assertChar('"', in);
        ByteArraySink raw = new ByteArraySink();
        raw.write('"');
        while (true) {
            int c = in.read();
            if (c < 0) {
                throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                    "Cannot parse JSON string: expected closing quote");
            }
            raw.write(c);
            if (c == '\\') {
                int escaped = in.read();
                if (escaped < 0) {
                    throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                        "Cannot parse JSON string: unexpected end after backslash");
                }
                raw.write(escaped);
            } else if (c == '"') {
                break;
            }
        }
        try {
            return objectMapper.readValue(raw.toByteArray(), String.class);
        } catch (IOException e) {
            throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                "Cannot parse JSON string " + raw.toUtf8String(), e, null);
        }
    }

    /**
     * Reads XML element text up to the next {@code <} or the end, decoding predefined entities.
     */
    public static String readXMLString(ByteSource in) {
        ByteArraySink raw = new ByteArraySink();
        while (!in.eof() && in.peek() != '<') {
            raw.write(in.read());
        }
        String text = raw.toUtf8String();
        if (text.indexOf('&') < 0) {
            return text;
        }
        return text.replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&quot;", "\"")
            .replace("&apos;", "'")
            .replace("&amp;", "&");
    }

    /**
     * Reads all remaining bytes as a UTF-8 string.
     */
    public static String readToEnd(ByteSource in) {
        ByteArraySink raw = new ByteArraySink();
        while (!in.eof()) {
            raw.write(in.read());
        }
        return raw.toUtf8String();
    }

    /**
     * Reads a number-like token: letters, digits, signs and dots.
     *
     * @return the token, possibly empty
     */
    public static String readNumberToken(ByteSource in) {
        StringBuilder sb = new StringBuilder();
        while (!in.eof()) {
            int c = in.peek();
            boolean tokenChar = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || c == '+' || c == '-' || c == '.';
            if (!tokenChar) {
                break;
            }
            sb.append((char) in.read());
        }
        return sb.toString();
    }

    // ==================== Markers ====================

    /**
     * Consumes the expected character or fails.
     *
     * @throws DataTypeException with {@link ErrorCode#CANNOT_PARSE_TEXT} on mismatch
     */
    public static void assertChar(char expected, ByteSource in) {
        int c = in.read();
        if (c != expected) {
            throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                "Cannot parse input: expected '" + expected + "' but found "
                    + (c < 0 ? "end of stream" : "'" + (char) c + "'"));
        }
    }

    /**
     * Consumes the character if it is next.
     *
     * @return true if it was consumed
     */
    public static boolean checkChar(char expected, ByteSource in) {
        if (in.peek() == expected) {
            in.skip();
            return true;
        }
        return false;
    }

    /**
     * Consumes the ASCII string if the input starts with it.
     *
     * @return true if it was consumed
     */
    public static boolean checkString(String expected, ByteSource in) {
        byte[] bytes = expected.getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < bytes.length; i++) {
            if (in.peek(i) != bytes[i]) {
                return false;
            }
        }
        for (int i = 0; i < bytes.length; i++) {
            in.skip();
        }
        return true;
    }

    public static void assertString(String expected, ByteSource in) {
        if (!checkString(expected, in)) {
            throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                "Cannot parse input: expected '" + expected + "'");
        }
    }

    public static void skipWhitespace(ByteSource in) {
        while (true) {
            int c = in.peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                in.skip();
            } else {
                return;
            }
        }
    }

    private static int unescape(ByteSource in) {
        int c = in.read();
        switch (c) {
            case 'b': return '\b';
            case 'f': return '\f';
            case 'n': return '\n';
            case 'r': return '\r';
            case 't': return '\t';
            case '0': return '\0';
            case -1:
                throw new DataTypeException(ErrorCode.CANNOT_PARSE_TEXT,
                    "Cannot parse escape sequence: unexpected end of stream");
            default: return c;
        }
    }
}
