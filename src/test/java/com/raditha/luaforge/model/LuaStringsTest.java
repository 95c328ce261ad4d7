package com.raditha.luaforge.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LuaStringsTest {

    private static String decode(String raw) {
        return new String(LuaStrings.decode(raw), StandardCharsets.UTF_8);
    }

    @Test
    void testDecodeEscapes() {
        assertEquals("a\tb\n", decode("'a\\tb\\n'"));
        assertEquals("AB", decode("\"\\65\\x42\""));
        assertEquals("é", decode("'\\u{E9}'"));
        assertEquals("ab", decode("'a\\z   \n  b'"));
        assertEquals("'\"", decode("'\\'\"'"));
    }

    @Test
    void testDecodeLongBrackets() {
        assertEquals("x", decode("[[\nx]]"));
        assertEquals("a]]b", decode("[==[a]]b]==]"));
    }

    @Test
    void testQuoteChoosesDelimiter() {
        assertEquals("\"abc\"", LuaStrings.quote("abc".getBytes(StandardCharsets.UTF_8)));
        assertEquals("'say \"hi\"'", LuaStrings.quote("say \"hi\"".getBytes(StandardCharsets.UTF_8)));
        assertEquals("\"it's \\\"x\\\"\"", LuaStrings.quote("it's \"x\"".getBytes(StandardCharsets.UTF_8)));
        assertEquals("\"a\\nb\\\\\"", LuaStrings.quote("a\nb\\".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testQuoteEscapesBinary() {
        assertEquals("\"\\000\\255\"", LuaStrings.quote(new byte[]{0, (byte) 0xFF}));
    }

    @Test
    void testIdentifiers() {
        assertTrue(LuaStrings.isValidIdentifier("_a1"));
        assertFalse(LuaStrings.isValidIdentifier("1a"));
        assertFalse(LuaStrings.isValidIdentifier("end"));
        assertFalse(LuaStrings.isValidIdentifier("a-b"));
        assertFalse(LuaStrings.isValidIdentifier(""));
        assertTrue(LuaStrings.isKeyword("while"));
        assertFalse(LuaStrings.isKeyword("continue"));
    }
}
