package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.apply;
import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ComputeExpressionTest {

    private Rule rule;

    @BeforeEach
    void setUp() throws RuleConfigurationException {
        rule = RuleTestSupport.rule(ComputeExpression.NAME);
    }

    @Test
    void testFoldsAdditionInPlace() throws ParseException {
        assertEquals("return 2", apply(rule, "return 1 + 1"));
    }

    @Test
    void testFoldsArithmeticWithRuntimeSemantics() throws ParseException {
        assertTransforms(rule, "return 2 ^ 3, 7 / 2, 7 // 2, -7 // 2, 5 % -3",
                "return 8, 3.5, 3, -4, -1");
    }

    @Test
    void testFoldsConcatenationAndComparisons() throws ParseException {
        assertTransforms(rule, "return 'a' .. 'b', 1 < 2, not nil, nil or 3, 1 == 1",
                "return \"ab\", true, true, 3, true");
    }

    @Test
    void testDivisionByZeroKeepsInfinity() throws ParseException {
        assertUnchanged(rule, "return 1 / 0");
        assertTransforms(rule, "return -1 / 0", "return -(1 / 0)");
    }

    @Test
    void testUnknownValuesAreKept() throws ParseException {
        assertUnchanged(rule, "return x + 1");
        assertUnchanged(rule, "return f() .. 'x'");
    }

    @Test
    void testNestedConstantInsideUnknownExpression() throws ParseException {
        assertTransforms(rule, "return x + (2 * 3)", "return x + 6");
    }

    @Test
    void testCallsAreNotFolded() throws ParseException {
        assertUnchanged(rule, "return f() and 1");
    }

    @Test
    void testKnownLeftOperandSelectsUnknownOperand() throws ParseException {
        assertTransforms(rule, "return true and x", "return x");
        assertTransforms(rule, "return false or x", "return x");
        assertTransforms(rule, "return 'a' and x.y", "return x.y");
        assertTransforms(rule, "return true and a + b", "return a + b");
    }

    @Test
    void testKnownLeftOperandIsKeptWhenItDecides() throws ParseException {
        assertTransforms(rule, "return false and x", "return false");
        assertTransforms(rule, "return nil and f()", "return nil");
        assertTransforms(rule, "return 1 or f()", "return 1");
    }

    @Test
    void testSelectedCallIsTruncatedToOneValue() throws ParseException {
        assertTransforms(rule, "return 1 and f()", "return (f())");
        assertTransforms(rule, "return nil or f()", "return (f())");
        assertTransforms(rule, "local a, b = true and ...", "local a, b = (...)");
    }

    @Test
    void testUnknownLeftOperandIsNotShortCircuited() throws ParseException {
        assertUnchanged(rule, "return x and true");
        assertUnchanged(rule, "return x or false");
    }

    @Test
    void testShortCircuitKeepsLineOfReplacedExpression() throws ParseException {
        assertEquals("local a = x\nreturn a", apply(rule, "local a = true and x\nreturn a"));
    }
}
