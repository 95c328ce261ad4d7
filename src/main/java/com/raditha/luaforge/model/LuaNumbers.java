package com.raditha.luaforge.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Conversions between Lua numerals, Lua's number-to-string coercion and doubles.
 */
public final class LuaNumbers {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEXADECIMAL = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final double MAX_EXACT_INTEGER = 1e15;

    private LuaNumbers() {
    }

    /**
     * Value of a numeral as written in source (hexadecimal, binary, decimal, with underscores).
     */
    public static double parseLiteral(String raw) {
        String text = raw.replace("_", "");
        String lower = text.toLowerCase();
        if (lower.startsWith("0x")) {
            if (lower.contains("p")) {
                return Double.parseDouble(text);
            }
            if (lower.contains(".")) {
                return Double.parseDouble(text + "p0");
            }
            return new BigInteger(text.substring(2), 16).doubleValue();
        }
        if (lower.startsWith("0b")) {
            return new BigInteger(text.substring(2), 2).doubleValue();
        }
        return Double.parseDouble(text);
    }

    /**
     * Coerce a string to a number the way arithmetic operators do.
     * Forms the runtime may treat differently across versions are not converted.
     */
    public static Optional<Double> coerce(String text) {
        String trimmed = text.strip();
        if (DECIMAL.matcher(trimmed).matches()) {
            return Optional.of(Double.parseDouble(trimmed));
        }
        if (HEXADECIMAL.matcher(trimmed).matches()) {
            return Optional.of(new BigInteger(trimmed.substring(2), 16).doubleValue());
        }
        return Optional.empty();
    }

    /**
     * Number to string coercion, equivalent to the C format {@code %.14g}.
     * Returns empty for infinities and NaN whose spelling depends on the platform.
     */
    public static Optional<String> format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Optional.empty();
        }
        if (value == 0) {
            return Optional.of(1 / value < 0 ? "-0" : "0");
        }
        BigDecimal rounded = new BigDecimal(value).round(new MathContext(14, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= 14) {
            BigDecimal mantissa = rounded.movePointLeft(exponent);
            String digits = stripZeros(mantissa.toPlainString());
            String sign = exponent < 0 ? "-" : "+";
            int magnitude = Math.abs(exponent);
            return Optional.of(digits + "e" + sign + (magnitude < 10 ? "0" : "") + magnitude);
        }
        return Optional.of(stripZeros(rounded.toPlainString()));
    }

    /**
     * Numeral that reads back as exactly the given finite value.
     */
    public static String toSource(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGER) {
            return Long.toString((long) value);
        }
        String text = Double.toString(value);
        int exponent = text.indexOf('E');
        if (exponent < 0) {
            return text;
        }
        String mantissa = text.substring(0, exponent);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return mantissa + "e" + text.substring(exponent + 1);
    }

    private static String stripZeros(String text) {
        if (!text.contains(".")) {
            return text;
        }
        String stripped = text.replaceAll("0+$", "");
        return stripped.endsWith(".") ? stripped.substring(0, stripped.length() - 1) : stripped;
    }
}
