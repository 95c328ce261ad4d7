package com.raditha.luaforge.generator;

import com.raditha.luaforge.ast.BinaryExpression;
import com.raditha.luaforge.ast.BinaryOperator;
import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.Identifier;
import com.raditha.luaforge.ast.ReturnStatement;
import com.raditha.luaforge.ast.UnaryExpression;
import com.raditha.luaforge.ast.UnaryOperator;
import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DenseLuaGeneratorTest {

    private static String dense(String source) throws ParseException {
        return new DenseLuaGenerator().generate(Parser.parse(source));
    }

    private static String dense(Block block) {
        return new DenseLuaGenerator().generate(block);
    }

    @Test
    void testMinimalSpacing() throws ParseException {
        assertEquals("local a=1", dense("local   a  =  1"));
        assertEquals("return(a+b)*c", dense("return (a + b) * c"));
        assertEquals("print\"x\"", dense("print \"x\""));
        assertEquals("local a=1 local b=2", dense("local a = 1\nlocal b = 2"));
    }

    @Test
    void testCommentsAreDropped() throws ParseException {
        assertEquals("return 1", dense("-- a\nreturn 1 --[[ b ]]\n-- c\n"));
    }

    @Test
    void testAmbiguousTokensStaySeparated() throws ParseException {
        assertEquals("return a- -b", dense("return a - -b"));
        assertEquals("return 1 ..2", dense("return 1 .. 2"));
    }

    @Test
    void testSynthesizedPrecedenceGetsParentheses() {
        Block block = new Block(List.of(), new ReturnStatement(List.of(
                new BinaryExpression(BinaryOperator.ASTERISK,
                        new BinaryExpression(BinaryOperator.PLUS, new Identifier("a"), new Identifier("b")),
                        new Identifier("c")))));
        assertTrue(dense(block).contains("(a+b)*c"));
    }

    @Test
    void testSynthesizedRightAssociativity() {
        Block block = new Block(List.of(), new ReturnStatement(List.of(
                new BinaryExpression(BinaryOperator.MINUS, new Identifier("a"),
                        new BinaryExpression(BinaryOperator.MINUS, new Identifier("b"), new Identifier("c"))),
                new BinaryExpression(BinaryOperator.CARET,
                        new UnaryExpression(UnaryOperator.MINUS, new Identifier("x")), new Identifier("y")))));
        assertEquals("return a-(b-c),(-x)^y", dense(block));
    }

    @Test
    void testSemicolonBeforeParenthesizedStatement() throws ParseException {
        Block block = Parser.parse("a = b;(f)()");
        block.get(0).setSemicolon(null);
        assertEquals("a=b;(f)()", dense(block));
    }

    @Test
    void testWrapsAtColumnSpan() throws ParseException {
        String source = "local alpha = 1 local beta = alpha + 2 local gamma = beta * alpha return gamma";
        String wrapped = new DenseLuaGenerator(20).generate(Parser.parse(source));
        assertTrue(wrapped.contains("\n"));
        for (String line : wrapped.split("\n")) {
            assertTrue(line.length() <= 20, line);
        }
        assertEquals(dense(source), dense(wrapped));
    }
}
