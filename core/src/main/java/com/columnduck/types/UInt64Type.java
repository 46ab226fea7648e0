package com.columnduck.types;

import com.columnduck.format.FormatSettings;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

/**
 * Data type representing a 64-bit unsigned integer.
 *
 * <p>Values are held as {@code Long} carrying the unsigned bit pattern; text
 * forms use unsigned decimal.
 */
public final class UInt64Type extends NumberType<Long> {

    private static final UInt64Type INSTANCE = new UInt64Type();

    private UInt64Type() {}

    public static UInt64Type get() {
        return INSTANCE;
    }

    @Override
    public String getFamilyName() {
        return "UInt64";
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
        return Long.toUnsignedString(value);
    }

    @Override
    protected Long parseText(String token) {
        return Long.parseUnsignedLong(token);
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
        return obj instanceof UInt64Type;
    }

    @Override
    public int hashCode() {
        return getFamilyName().hashCode();
    }
}
