package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.apply;
import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GroupLocalAssignmentTest {

    private Rule rule;

    @BeforeEach
    void setUp() throws RuleConfigurationException {
        rule = RuleTestSupport.rule(GroupLocalAssignment.NAME);
    }

    @Test
    void testDependentLocalsAreNotMerged() throws ParseException {
        assertEquals("local foo = 1\nlocal bar = foo", apply(rule, "local foo = 1\nlocal bar = foo"));
    }

    @Test
    void testIndependentLocalsAreMerged() throws ParseException {
        assertTransforms(rule, "local a = 1\nlocal b = 2\nlocal c = 3", "local a, b, c = 1, 2, 3");
    }

    @Test
    void testDeclarationsWithoutValues() throws ParseException {
        assertTransforms(rule, "local a\nlocal b", "local a, b");
        assertUnchanged(rule, "local a\nlocal b = 1");
    }

    @Test
    void testMultipleValueCallBlocksMergeWithEmptyDeclaration() throws ParseException {
        assertUnchanged(rule, "local a = f()\nlocal b");
        assertTransforms(rule, "local a = f()\nlocal b = 1", "local a, b = f(), 1");
    }

    @Test
    void testRedeclarationIsNotMerged() throws ParseException {
        assertUnchanged(rule, "local a = 1\nlocal a = 2");
    }

    @Test
    void testNestedBlocks() throws ParseException {
        assertTransforms(rule, "do local a = 1 local b = 2 end", "do local a, b = 1, 2 end");
    }
}
