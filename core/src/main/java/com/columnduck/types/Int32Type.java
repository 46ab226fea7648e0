package com.columnduck.types;

import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

/**
 * Data type representing a 32-bit signed integer.
 */
public final class Int32Type extends NumberType<Integer> {

    private static final Int32Type INSTANCE = new Int32Type();

    private Int32Type() {}

    public static Int32Type get() {
        return INSTANCE;
    }

    @Override
    public String getFamilyName() {
        return "Int32";
    }

    @Override
    protected int valueWidth() {
        return 4;
    }

    @Override
    public Integer getDefault() {
        return 0;
    }

    @Override
    public DataType promoteNumericType() {
        return Int64Type.get();
    }

    @Override
    protected Integer convert(Object value) {
        long v = toLongExact(value);
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw illegalValue(value);
        }
        return (int) v;
    }

    @Override
    protected String formatText(Integer value) {
        return Integer.toString(value);
    }

    @Override
    protected Integer parseText(String token) {
        return Integer.parseInt(token);
    }

    @Override
    protected void writeBinary(Integer value, ByteSink out) {
        BinaryEncoding.writeIntLE(value, out);
    }

    @Override
    protected Integer readBinary(ByteSource in) {
        return BinaryEncoding.readIntLE(in);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Int32Type;
    }

    @Override
    public int hashCode() {
        return getFamilyName().hashCode();
    }
}
