package com.columnduck.types;

import com.columnduck.format.FormatSettings;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ByteSink;
import com.columnduck.io.ByteSource;

/**
 * Data type representing a 64-bit IEEE 754 floating point number.
 *
 * <p>Non-finite values are written as {@code inf}, {@code -inf} and {@code nan};
 * whole values below 1e15 are written without a fraction.
 */
public final class Float64Type extends NumberType<Double> {

    private static final Float64Type INSTANCE = new Float64Type();

    private static final double MAX_PLAIN_WHOLE = 1e15;

    private Float64Type() {}

    public static Float64Type get() {
        return INSTANCE;
    }

    @Override
    public String getFamilyName() {
        return "Float64";
    }

    @Override
    protected int valueWidth() {
        return 8;
    }

    @Override
    public Double getDefault() {
        return 0.0;
    }

    @Override
    public DataType promoteNumericType() {
        return this;
    }

    @Override
    protected Double convert(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw illegalValue(value);
    }

    @Override
    protected String formatText(Double value) {
        double v = value;
        if (Double.isNaN(v)) {
            return "nan";
        }
        if (Double.isInfinite(v)) {
            return v > 0 ? "inf" : "-inf";
        }
        if (v == Math.rint(v) && Math.abs(v) < MAX_PLAIN_WHOLE) {
            return Double.compare(v, -0.0) == 0 ? "-0" : Long.toString((long) v);
        }
        return Double.toString(v);
    }

    @Override
    protected Double parseText(String token) {
        switch (token.toLowerCase()) {
            case "inf":
            case "+inf":
            case "infinity":
            case "+infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf":
            case "-infinity":
                return Double.NEGATIVE_INFINITY;
            case "nan":
            case "+nan":
            case "-nan":
                return Double.NaN;
            default:
                if (!isDecimalToken(token)) {
                    throw new NumberFormatException("Not a decimal number: " + token);
                }
                return Double.parseDouble(token);
        }
    }

    /**
     * Returns whether the token uses only decimal digits, signs, dots and exponents.
     * Java literal forms such as {@code 1d}, {@code 2f} or {@code 0x1p3} are not numbers here.
     */
    private static boolean isDecimalToken(String token) {
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            boolean allowed = (c >= '0' && c <= '9') || c == '+' || c == '-' || c == '.' || c == 'e' || c == 'E';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected boolean quoteInJson(Double value, FormatSettings settings) {
        return !Double.isFinite(value) && settings.jsonQuoteDenormals();
    }

    @Override
    protected String formatJson(Double value, FormatSettings settings) {
        return Double.isFinite(value) ? formatText(value) : "null";
    }

    @Override
    protected void writeBinary(Double value, ByteSink out) {
        BinaryEncoding.writeDoubleLE(value, out);
    }

    @Override
    protected Double readBinary(ByteSource in) {
        return BinaryEncoding.readDoubleLE(in);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Float64Type;
    }

    @Override
    public int hashCode() {
        return getFamilyName().hashCode();
    }
}
