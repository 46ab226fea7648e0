package com.columnduck.io;

/**
 * Sequential source of bytes read by binary and text codecs.
 *
 * <p>Supports a small lookahead ({@link #peek(int)}) so text parsers can
 * recognise markers like {@code \N} or {@code NULL} before consuming them.
 */
public interface ByteSource {

    /**
     * Returns whether all bytes have been consumed.
     *
     * @return true at end of stream
     */
    boolean eof();

    /**
     * Consumes and returns the next byte.
     *
     * @return the next byte as 0..255, or -1 at end of stream
     */
    int read();

    /**
     * Returns the byte {@code ahead} positions after the current one without consuming it.
     *
     * @param ahead 0 for the next byte
     * @return the byte as 0..255, or -1 past the end of stream
     */
    int peek(int ahead);

    default int peek() {
        return peek(0);
    }

    /**
     * Reads exactly {@code len} bytes.
     *
     * @throws com.columnduck.exception.DataTypeException with
     *         {@link com.columnduck.exception.ErrorCode#CANNOT_READ_ALL_DATA} if the source ends first
     */
    void readFully(byte[] bytes, int off, int len);

    /**
     * Skips one byte.
     */
    default void skip() {
        read();
    }
}
