package com.raditha.luaforge.generator;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.Identifier;
import com.raditha.luaforge.ast.LocalAssignStatement;
import com.raditha.luaforge.ast.TypedIdentifier;
import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenBasedLuaGeneratorTest {

    private static String regenerate(String source) throws ParseException {
        return new TokenBasedLuaGenerator().generate(Parser.parse(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "\n\n",
            "-- only a comment",
            "#!/usr/bin/env lua\nprint('hi')\n",
            "local a = 1\nlocal b = a -- note\n\n\nreturn a + b\n",
            "local t = {\n    1, 2,\n    x = 'y';\n    [k] = v,\n}\n",
            "if a then\n\tb()\nelseif c then\r\n\td()\nelse\n\te()\nend",
            "for i = 1, 10, 2 do print(i) end\nfor k, v in pairs(t) do end",
            "while x do x = x - 1 end repeat y() until y",
            "local function f(a, b, ...) return a and b or ... end",
            "function M.a.b:c(self2) return self end",
            "--[[ block\ncomment ]] local s = [==[\nlong]==] .. \"esc\\n\" .. 'q'",
            "x = a.b[c]:d(e) { f } 'g'",
            "local v: number | string = if a then 1 else 'x'\ntype T<U> = { [string]: U }",
            "local s = `value {x + 1} and {y}`\ncounter += 1; total //= 2",
            "a = 1; b = 2;",
            "return (f())",
            "local x <const>, y <close> = 1, nil",
            "return `a`..b, `{c}`",
    })
    void testUnchangedTreeIsWrittenBackExactly(String source) throws ParseException {
        assertEquals(source, regenerate(source));
    }

    @Test
    void testRenamedIdentifierKeepsLayout() throws ParseException {
        Block block = Parser.parse("local longName = 1 -- keep\n\nreturn longName");
        LocalAssignStatement local = (LocalAssignStatement) block.get(0);
        local.getVariables().get(0).setName("a");
        String output = new TokenBasedLuaGenerator().generate(block);
        assertTrue(output.startsWith("local a = 1 -- keep\n\n"));
    }

    @Test
    void testRemovedStatementKeepsFollowingLines() throws ParseException {
        Block block = Parser.parse("local a = 1\nlocal b = 2\nreturn b");
        block.remove(0);
        String output = new TokenBasedLuaGenerator().generate(block);
        assertEquals(3, output.split("\n", -1).length);
        assertTrue(output.endsWith("local b = 2\nreturn b"));
    }

    @Test
    void testSynthesizedNodesAreSpaced() throws ParseException {
        Block block = Parser.parse("return x");
        Identifier replaced = new Identifier("y");
        ((com.raditha.luaforge.ast.ReturnStatement) block.getLastStatement()).getValues().set(0, replaced);
        assertEquals("return y", new TokenBasedLuaGenerator().generate(block));
    }

    @Test
    void testRemovedListEntryKeepsSpacing() throws ParseException {
        Block block = Parser.parse("local a, b = f(), 2");
        LocalAssignStatement local = (LocalAssignStatement) block.get(0);
        local.getVariables().remove(1);
        local.getValues().remove(1);
        assertEquals("local a = f()", new TokenBasedLuaGenerator().generate(block));
    }

    @Test
    void testRemovedListEntryWithoutWhitespaceStaysCompact() throws ParseException {
        Block block = Parser.parse("local a,b=f(),2");
        LocalAssignStatement local = (LocalAssignStatement) block.get(0);
        local.getVariables().remove(1);
        local.getValues().remove(1);
        assertEquals("local a=f()", new TokenBasedLuaGenerator().generate(block));
    }

    @Test
    void testAddedListEntryIsSeparated() throws ParseException {
        Block block = Parser.parse("local a = f()");
        ((LocalAssignStatement) block.get(0)).getVariables().add(new TypedIdentifier("b"));
        assertEquals("local a, b = f()", new TokenBasedLuaGenerator().generate(block));
    }
}
