package com.columnduck.types;

import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

/**
 * Data type representing a 32-bit unsigned integer.
 *
 * <p>Values are held as {@code Long} in {@code [0, 2^32)}.
 */
public final class UInt32Type extends NumberType<Long> {

    private static final UInt32Type INSTANCE = new UInt32Type();

    /** Largest UInt32 value. */
    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    private UInt32Type() {}

    public static UInt32Type get() {
        return INSTANCE;
    }

    @Override
    public String getFamilyName() {
        return "UInt32";
    }

    @Override
    protected int valueWidth() {
        return 4;
    }

    @Override
    public Long getDefault() {
        return 0L;
    }

    @Override
    public DataType promoteNumericType() {
        return UInt64Type.get();
    }

    @Override
    protected Long convert(Object value) {
        long v = toLongExact(value);
        if (v < 0 || v > MAX_VALUE) {
            throw illegalValue(value);
        }
        return v;
    }

    @Override
    protected String formatText(Long value) {
        return Long.toString(value);
    }

    @Override
    protected Long parseText(String token) {
        long v = Long.parseLong(token);
        if (v < 0 || v > MAX_VALUE) {
            throw new NumberFormatException("Value out of range for UInt32: " + token);
        }
        return v;
    }

    @Override
    protected void writeBinary(Long value, ByteSink out) {
        BinaryEncoding.writeIntLE((int) (long) value, out);
    }

    @Override
    protected Long readBinary(ByteSource in) {
        return Integer.toUnsignedLong(BinaryEncoding.readIntLE(in));
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UInt32Type;
    }

    @Override
    public int hashCode() {
        return getFamilyName().hashCode();
    }
}
