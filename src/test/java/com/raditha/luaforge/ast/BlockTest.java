package com.raditha.luaforge.ast;

import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockTest {

    private static Statement statement(String source) throws ParseException {
        return Parser.parse(source).get(0);
    }

    @Test
    void testAppendSetsLastStatement() throws ParseException {
        Block block = new Block();
        block.append(statement("a = 1"));
        block.append(new ReturnStatement(List.of()));
        assertEquals(2, block.size());
        assertEquals(1, block.statementCount());
        assertInstanceOf(ReturnStatement.class, block.getLastStatement());
    }

    @Test
    void testOnlyOneLastStatement() {
        Block block = new Block();
        block.append(new BreakStatement());
        assertThrows(AstInvariantException.class, () -> block.append(new BreakStatement()));
    }

    @Test
    void testLastStatementOnlyAtTheEnd() throws ParseException {
        Block block = new Block();
        block.append(statement("a = 1"));
        block.append(statement("b = 2"));
        assertThrows(AstInvariantException.class, () -> block.insert(0, new BreakStatement()));
        assertThrows(AstInvariantException.class, () -> block.replace(0, new BreakStatement()));
        block.replace(1, new BreakStatement());
        assertEquals(1, block.statementCount());
        assertInstanceOf(BreakStatement.class, block.getLastStatement());
    }

    @Test
    void testInsertBeforeLastStatement() throws ParseException {
        Block block = Parser.parse("return 1");
        block.insert(0, statement("a = 1"));
        assertEquals(2, block.size());
        assertInstanceOf(AssignStatement.class, block.get(0));
        assertInstanceOf(ReturnStatement.class, block.get(1));
        assertThrows(AstInvariantException.class, () -> block.insert(3, statement("b = 1")));
    }

    @Test
    void testNullAndRange() {
        Block block = new Block();
        assertThrows(AstInvariantException.class, () -> block.append(null));
        assertThrows(AstInvariantException.class, () -> block.get(0));
        assertThrows(AstInvariantException.class, () -> block.remove(0));
        assertThrows(AstInvariantException.class, () -> block.truncate(1));
    }

    @Test
    void testRemoveAndTruncate() throws ParseException {
        Block block = Parser.parse("a = 1 b = 2 c = 3 return");
        assertEquals(4, block.size());
        assertInstanceOf(ReturnStatement.class, block.remove(3));
        assertNull(block.getLastStatement());
        block.truncate(1);
        assertEquals(1, block.size());
    }

    @Test
    void testSpliceAndFilter() throws ParseException {
        Block block = Parser.parse("a = 1 b = 2 return a");
        block.splice(0, List.of(statement("x = 1"), statement("y = 2")));
        assertEquals(4, block.size());
        assertEquals(1, block.indexOf(block.get(1)));
        block.filter(s -> !(s instanceof ReturnStatement));
        assertEquals(3, block.size());
        assertTrue(block.getAllStatements().stream().allMatch(AssignStatement.class::isInstance));
    }

    @Test
    void testNumeralsCannotBeNegative() {
        assertThrows(AstInvariantException.class, () -> new NumberExpression(-1));
        assertThrows(AstInvariantException.class, () -> new NumberExpression(Double.NaN));
        assertThrows(AstInvariantException.class, () -> new NumberExpression(-0.0));
        assertEquals("3", new NumberExpression(3).getRaw());
    }

    @Test
    void testIfStatementNeedsBranch() {
        assertThrows(AstInvariantException.class, () -> new IfStatement(List.of(), null));
    }

    @Test
    void testCopyIsDeep() throws ParseException {
        Block block = Parser.parse("local a = { 1, f(x) }\nreturn a");
        Block copy = block.copy();
        assertEquals(block.size(), copy.size());
        assertNotSame(block.get(0), copy.get(0));
        LocalAssignStatement original = (LocalAssignStatement) block.get(0);
        LocalAssignStatement copied = (LocalAssignStatement) copy.get(0);
        copied.getVariables().get(0).setName("b");
        assertEquals("a", original.getVariables().get(0).getName());
        assertFalse(copied.hasTokens());
    }
}
