package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;

class RemoveUnusedVariableTest {

    private Rule rule;

    @BeforeEach
    void setUp() throws RuleConfigurationException {
        rule = RuleTestSupport.rule(RemoveUnusedVariable.NAME);
    }

    @Test
    void testPureDeclarationIsRemoved() throws ParseException {
        assertTransforms(rule, "local a = 1\nreturn 2", "return 2");
    }

    @Test
    void testCallInitializerIsKeptAsStatement() throws ParseException {
        assertTransforms(rule, "local a = f()", "f()");
    }

    @Test
    void testTrailingUnusedVariableIsTrimmed() throws ParseException {
        assertTransforms(rule, "local a, b = 1, 2\nreturn a", "local a = 1\nreturn a");
    }

    @Test
    void testLeadingUnusedVariableKeepsArity() throws ParseException {
        assertUnchanged(rule, "local a, b = f()\nreturn b");
    }

    @Test
    void testRemovalIteratesToFixedPoint() throws ParseException {
        assertTransforms(rule, "local a = 1\nlocal b = a", "");
    }

    @Test
    void testUnusedLocalFunctionIsRemoved() throws ParseException {
        assertTransforms(rule, "local function f() end\nreturn 1", "return 1");
        assertUnchanged(rule, "local function f() end\nf()");
    }

    @Test
    void testWrittenVariableCountsAsUsed() throws ParseException {
        assertUnchanged(rule, "local a = 1\na = 2");
    }

    @Test
    void testCloseAttributeIsKept() throws ParseException {
        assertUnchanged(rule, "local x <close> = y");
    }
}
