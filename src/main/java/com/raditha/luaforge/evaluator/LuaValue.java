package com.raditha.luaforge.evaluator;

import com.raditha.luaforge.model.LuaNumbers;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * A value the evaluator could, or could not, work out statically.
 * <p>
 * Tables and functions are only known by their kind: they are truthy but can never be
 * written back as a literal.
 */
public final class LuaValue {

    public enum Kind {
        UNKNOWN,
        NIL,
        BOOLEAN,
        NUMBER,
        STRING,
        TABLE,
        FUNCTION
    }

    public static final LuaValue UNKNOWN = new LuaValue(Kind.UNKNOWN, false, 0, null);
    public static final LuaValue NIL = new LuaValue(Kind.NIL, false, 0, null);
    public static final LuaValue TRUE = new LuaValue(Kind.BOOLEAN, true, 0, null);
    public static final LuaValue FALSE = new LuaValue(Kind.BOOLEAN, false, 0, null);
    public static final LuaValue TABLE = new LuaValue(Kind.TABLE, false, 0, null);
    public static final LuaValue FUNCTION = new LuaValue(Kind.FUNCTION, false, 0, null);

    private final Kind kind;
    private final boolean bool;
    private final double number;
    private final byte[] bytes;

    private LuaValue(Kind kind, boolean bool, double number, byte[] bytes) {
        this.kind = kind;
        this.bool = bool;
        this.number = number;
        this.bytes = bytes;
    }

    public static LuaValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static LuaValue number(double value) {
        return new LuaValue(Kind.NUMBER, false, value, null);
    }

    public static LuaValue string(byte[] value) {
        return new LuaValue(Kind.STRING, false, 0, value.clone());
    }

    public static LuaValue string(String value) {
        return new LuaValue(Kind.STRING, false, 0, value.getBytes(StandardCharsets.UTF_8));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    /**
     * True for values that have a literal form: nil, booleans, numbers and strings.
     */
    public boolean isLiteral() {
        return kind == Kind.NIL || kind == Kind.BOOLEAN || kind == Kind.NUMBER || kind == Kind.STRING;
    }

    /**
     * Lua truthiness: everything except nil and false is true. Empty when unknown.
     */
    public Optional<Boolean> truthiness() {
        return switch (kind) {
            case UNKNOWN -> Optional.empty();
            case NIL -> Optional.of(false);
            case BOOLEAN -> Optional.of(bool);
            default -> Optional.of(true);
        };
    }

    public boolean isTruthy() {
        return truthiness().orElse(false);
    }

    public boolean isFalsy() {
        return !truthiness().orElse(true);
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return bool;
    }

    public double asNumber() {
        requireKind(Kind.NUMBER);
        return number;
    }

    public byte[] asBytes() {
        requireKind(Kind.STRING);
        return bytes.clone();
    }

    /**
     * The number this value converts to in arithmetic, following string coercion.
     */
    public Optional<Double> toNumber() {
        if (kind == Kind.NUMBER) {
            return Optional.of(number);
        }
        if (kind == Kind.STRING) {
            return LuaNumbers.coerce(new String(bytes, StandardCharsets.ISO_8859_1));
        }
        return Optional.empty();
    }

    /**
     * The bytes this value converts to in a concatenation.
     */
    public Optional<byte[]> toStringBytes() {
        if (kind == Kind.STRING) {
            return Optional.of(bytes.clone());
        }
        if (kind == Kind.NUMBER) {
            return LuaNumbers.format(number).map(text -> text.getBytes(StandardCharsets.US_ASCII));
        }
        return Optional.empty();
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("expected a " + expected + " value but got " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LuaValue other) || kind != other.kind) {
            return false;
        }
        return switch (kind) {
            case NIL, UNKNOWN -> true;
            case BOOLEAN -> bool == other.bool;
            case NUMBER -> Double.compare(number, other.number) == 0;
            case STRING -> Arrays.equals(bytes, other.bytes);
            default -> false;
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case BOOLEAN -> Boolean.hashCode(bool);
            case NUMBER -> Double.hashCode(number);
            case STRING -> Arrays.hashCode(bytes);
            default -> kind.hashCode();
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case BOOLEAN -> String.valueOf(bool);
            case NUMBER -> LuaNumbers.toSource(number);
            case STRING -> '"' + new String(bytes, StandardCharsets.UTF_8) + '"';
            default -> kind.name().toLowerCase();
        };
    }
}
