package com.raditha.luaforge.generator;

import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReadableLuaGeneratorTest {

    private static String readable(String source) throws ParseException {
        return new ReadableLuaGenerator().generate(Parser.parse(source));
    }

    @Test
    void testIndentation() throws ParseException {
        assertEquals("if x then\n    return 1\nend\n", readable("if x then return 1 end"));
    }

    @Test
    void testNestedBlocks() throws ParseException {
        assertEquals("local function f(a)\n    while a do\n        a = g(a)\n    end\n    return a\nend\n",
                readable("local function f(a) while a do a = g(a) end return a end"));
    }

    @Test
    void testEmptyInput() throws ParseException {
        assertEquals("", readable("-- nothing"));
    }

    @Test
    void testOutputReparsesToSameProgram() throws ParseException {
        String source = "local t={1,2,x=3} for k,v in pairs(t) do if v>1 then print(k..v) else break end end";
        String output = readable(source);
        DenseLuaGenerator dense = new DenseLuaGenerator();
        assertEquals(dense.generate(Parser.parse(source)), new DenseLuaGenerator().generate(Parser.parse(output)));
    }
}
