package com.columnduck.types;

import com.columnduck.format.FormatSettings;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

/**
 * Data type representing a 64-bit signed integer.
 *
 * <p>The widest signed integer type: promotion returns the type itself.
 */
public final class Int64Type extends NumberType<Long> {

    private static final Int64Type INSTANCE = new Int64Type();

    private Int64Type() {}

    public static Int64Type get() {
        return INSTANCE;
    }

    @Override
    public String getFamilyName() {
        return "Int64";
    }

    @Override
    protected int valueWidth() {
        return 8;
    }

    @Override
    public Long getDefault() {
        return 0L;
    }

    @Override
    public DataType promoteNumericType() {
        return this;
    }

    @Override
    protected Long convert(Object value) {
        return toLongExact(value);
    }

    @Override
    protected String formatText(Long value) {
        return Long.toString(value);
    }

    @Override
    protected Long parseText(String token) {
        return Long.parseLong(token);
    }

    @Override
    protected boolean quoteInJson(Long value, FormatSettings settings) {
        return settings.jsonQuote64bitIntegers();
    }

    @Override
    protected void writeBinary(Long value, ByteSink out) {
        BinaryEncoding.writeLongLE(value, out);
    }

    @Override
    protected Long readBinary(ByteSource in) {
        return BinaryEncoding.readLongLE(in);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Int64Type;
    }

    @Override
    public int hashCode() {
        return getFamilyName().hashCode();
    }
}
