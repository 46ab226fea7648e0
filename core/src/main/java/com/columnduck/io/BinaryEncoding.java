package com.columnduck.io;

import com.columnduck.exception.DataTypeException;
import com.columnduck.exception.ErrorCode;

/**
 * Little-endian fixed-width and variable-length integer encodings used by
 * the binary bulk codecs.
 */
public final class BinaryEncoding {

    private BinaryEncoding() {} // Utility class

    /** Maximum number of bytes of an encoded varuint. */
    public static final int MAX_VARUINT_SIZE = 10;

    public static void writeIntLE(int value, ByteSink out) {
        out.write(value);
        out.write(value >>> 8);
        out.write(value >>> 16);
        out.write(value >>> 24);
    }

    public static void writeLongLE(long value, ByteSink out) {
        for (int i = 0; i < 8; i++) {
            out.write((int) (value >>> (8 * i)));
        }
    }

    public static void writeDoubleLE(double value, ByteSink out) {
        writeLongLE(Double.doubleToRawLongBits(value), out);
    }

    public static int readIntLE(ByteSource in) {
        byte[] b = new byte[4];
        in.readFully(b, 0, 4);
        return (b[0] & 0xFF) | (b[1] & 0xFF) << 8 | (b[2] & 0xFF) << 16 | (b[3] & 0xFF) << 24;
    }

    public static long readLongLE(ByteSource in) {
        byte[] b = new byte[8];
        in.readFully(b, 0, 8);
        long value = 0;
        for (int i = 7; i >= 0; i--) {
            value = (value << 8) | (b[i] & 0xFF);
        }
        return value;
    }

    public static double readDoubleLE(ByteSource in) {
        return Double.longBitsToDouble(readLongLE(in));
    }

    /**
     * Writes an unsigned LEB128 varint.
     *
     * @param value the value, interpreted as unsigned
     * @param out the sink
     */
    public static void writeVarUInt(long value, ByteSink out) {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }

    /**
     * Reads an unsigned LEB128 varint.
     *
     * @param in the source
     * @return the value
     * @throws DataTypeException if the source ends inside the varint
     */
    public static long readVarUInt(ByteSource in) {
        long value = 0;
        for (int i = 0; i < MAX_VARUINT_SIZE; i++) {
            int b = in.read();
            if (b < 0) {
                throw new DataTypeException(ErrorCode.CANNOT_READ_ALL_DATA,
                    "Cannot read all data: unexpected end of stream inside varint");
            }
            value |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        return value;
    }
}
