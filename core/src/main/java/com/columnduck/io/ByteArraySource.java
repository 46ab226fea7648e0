package com.columnduck.io;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link ByteSource} over a byte array.
 */
public final class ByteArraySource implements ByteSource {

    private final byte[] bytes;
    private final int limit;
    private int position;

    public ByteArraySource(byte[] bytes) {
        this(bytes, 0, bytes.length);
    }

    public ByteArraySource(byte[] bytes, int offset, int length) {
        this.bytes = Objects.requireNonNull(bytes, "bytes must not be null");
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IllegalArgumentException("Invalid range [" + offset + ", " + (offset + length)
                + ") for array of length " + bytes.length);
        }
        this.position = offset;
        this.limit = offset + length;
    }

    /**
     * Creates a source over the UTF-8 encoding of a string.
     *
     * @param text the text
     * @return the source
     */
    public static ByteArraySource ofString(String text) {
        return new ByteArraySource(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean eof() {
        return position >= limit;
    }

    @Override
    public int read() {
        if (position >= limit) {
            return -1;
        }
        return bytes[position++] & 0xFF;
    }

    @Override
    public int peek(int ahead) {
        int index = position + ahead;
        if (index >= limit) {
            return -1;
        }
        return bytes[index] & 0xFF;
    }

    @Override
    public void readFully(byte[] target, int off, int len) {
        if (limit - position < len) {
            throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                "Cannot read all data. Bytes read: " + (limit - position) + ". Bytes expected: " + len + ".");
        }
        System.arraycopy(bytes, position, target, off, len);
        position += len;
    }

    /**
     * Returns the number of bytes not yet consumed.
     *
     * @return the remaining byte count
     */
    public int remaining() {
        return limit - position;
    }
}
