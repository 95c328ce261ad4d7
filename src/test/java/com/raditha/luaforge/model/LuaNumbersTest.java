package com.raditha.luaforge.model;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LuaNumbersTest {

    @Test
    void testParseLiteral() {
        assertEquals(255, LuaNumbers.parseLiteral("0xFF"));
        assertEquals(5, LuaNumbers.parseLiteral("0b101"));
        assertEquals(1000000, LuaNumbers.parseLiteral("1_000_000"));
        assertEquals(1500, LuaNumbers.parseLiteral("1.5e3"));
        assertEquals(0.5, LuaNumbers.parseLiteral(".5"));
        assertEquals(1.5, LuaNumbers.parseLiteral("0x1.8"));
    }

    @Test
    void testFormatFollowsCoercion() {
        assertEquals(Optional.of("10"), LuaNumbers.format(10));
        assertEquals(Optional.of("0.1"), LuaNumbers.format(0.1));
        assertEquals(Optional.of("1e+15"), LuaNumbers.format(1e15));
        assertEquals(Optional.of("1e-05"), LuaNumbers.format(0.00001));
        assertEquals(Optional.of("3.1415926535898"), LuaNumbers.format(Math.PI));
        assertEquals(Optional.of("-0"), LuaNumbers.format(-0.0));
        assertEquals(Optional.empty(), LuaNumbers.format(Double.NaN));
        assertEquals(Optional.empty(), LuaNumbers.format(Double.POSITIVE_INFINITY));
    }

    @Test
    void testCoerce() {
        assertEquals(Optional.of(12.0), LuaNumbers.coerce(" 12 "));
        assertEquals(Optional.of(255.0), LuaNumbers.coerce("0xff"));
        assertEquals(Optional.empty(), LuaNumbers.coerce("12a"));
        assertEquals(Optional.empty(), LuaNumbers.coerce(""));
    }

    @Test
    void testToSource() {
        assertEquals("3", LuaNumbers.toSource(3));
        assertEquals("0.25", LuaNumbers.toSource(0.25));
        assertEquals("1e20", LuaNumbers.toSource(1e20));
    }

    @Property(tries = 500)
    void testToSourceReadsBack(@ForAll double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0 || 1 / value < 0) {
            return;
        }
        assertEquals(value, LuaNumbers.parseLiteral(LuaNumbers.toSource(value)));
    }
}
