package com.columnduck.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Escaping of identifiers for use as file and stream names.
 *
 * <p>ASCII letters, digits and underscore pass through unchanged. Every other
 * byte of the UTF-8 encoding is written as {@code %XX} with upper-case hex
 * digits, so the result is a valid file name on every platform and contains
 * no dots.
 *
 * <p>The same escaping is used for stream names and for every other persisted
 * identifier; changing it breaks reading of existing data.
 */
public final class FileNames {

    private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

    private FileNames() {} // Utility class

    /**
     * Escapes a name for use as a file name.
     *
     * @param name the name
     * @return the escaped name
     */
    public static String escapeForFileName(String name) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (isWordChar(c)) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX_DIGITS[c >>> 4]).append(HEX_DIGITS[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    /**
     * Reverses {@link #escapeForFileName(String)}.
     *
     * <p>A {@code %} not followed by two hex digits is kept literally.
     *
     * @param escaped the escaped name
     * @return the original name
     */
    public static String unescapeForFileName(String escaped) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(escaped.length());
        byte[] bytes = escaped.getBytes(StandardCharsets.UTF_8);
        int i = 0;
        while (i < bytes.length) {
            int c = bytes[i] & 0xFF;
            if (c == '%' && i + 2 < bytes.length && hexValue(bytes[i + 1]) >= 0 && hexValue(bytes[i + 2]) >= 0) {
                out.write(hexValue(bytes[i + 1]) * 16 + hexValue(bytes[i + 2]));
                i += 3;
            } else {
                out.write(c);
                i++;
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static boolean isWordChar(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }

    private static int hexValue(byte b) {
        if (b >= '0' && b <= '9') return b - '0';
        if (b >= 'A' && b <= 'F') return b - 'A' + 10;
        if (b >= 'a' && b <= 'f') return b - 'a' + 10;
        return -1;
    }
}
