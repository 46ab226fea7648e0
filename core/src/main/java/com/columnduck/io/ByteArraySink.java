package com.columnduck.io;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Growable in-memory {@link ByteSink}.
 */
public final class ByteArraySink implements ByteSink {

    private static final int INITIAL_CAPACITY = 64;

    private byte[] buffer;
    private int size;

    public ByteArraySink() {
        this(INITIAL_CAPACITY);
    }

    public ByteArraySink(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.buffer = new byte[Math.max(initialCapacity, 1)];
    }

    @Override
    public void write(int b) {
        ensureCapacity(size + 1);
        buffer[size++] = (byte) b;
    }

    @Override
    public void write(byte[] bytes, int off, int len) {
        ensureCapacity(size + len);
        System.arraycopy(bytes, off, buffer, size, len);
        size += len;
    }

    /**
     * Returns the number of bytes written so far.
     *
     * @return the size in bytes
     */
    public int size() {
        return size;
    }

    /**
     * Returns a copy of the bytes written so far.
     *
     * @return the written bytes
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, size);
    }

    /**
     * Decodes the written bytes as UTF-8.
     *
     * @return the written text
     */
    public String toUtf8String() {
        return new String(buffer, 0, size, StandardCharsets.UTF_8);
    }

    public void reset() {
        size = 0;
    }

    private void ensureCapacity(int required) {
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }

    @Override
    public String toString() {
        return "ByteArraySink(" + size + " bytes)";
    }
}
