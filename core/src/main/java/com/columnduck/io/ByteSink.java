package com.columnduck.io;

import java.nio.charset.StandardCharsets;

/**
 * Append-only destination for bytes written by binary and text codecs.
 */
public interface ByteSink {

    /**
     * Appends a single byte.
     *
     * @param b the byte (low 8 bits are used)
     */
    void write(int b);

    /**
     * Appends {@code len} bytes of {@code bytes} starting at {@code off}.
     */
    void write(byte[] bytes, int off, int len);

    default void write(byte[] bytes) {
        write(bytes, 0, bytes.length);
    }

    /**
     * Appends the UTF-8 encoding of the given string.
     *
     * @param s the string
     */
    default void writeString(String s) {
        write(s.getBytes(StandardCharsets.UTF_8));
    }
}
