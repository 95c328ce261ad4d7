package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.apply;
import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RemoveUnusedIfBranchTest {

    private Rule rule;

    @BeforeEach
    void setUp() throws RuleConfigurationException {
        rule = RuleTestSupport.rule(RemoveUnusedIfBranch.NAME);
    }

    @Test
    void testBranchAfterTruthyElseIfIsDropped() throws ParseException {
        assertEquals("if unknown then return 2 elseif true then return 1 end",
                apply(rule, "if unknown then return 2 elseif true then return 1 else return 0 end"));
    }

    @Test
    void testTruthyFirstBranchBecomesDo() throws ParseException {
        assertTransforms(rule, "if true then foo() else bar() end", "do foo() end");
    }

    @Test
    void testFalsyBranchPromotesElse() throws ParseException {
        assertTransforms(rule, "if false then a() else b() end", "do b() end");
    }

    @Test
    void testFalsyBranchWithoutElseRemovesStatement() throws ParseException {
        assertTransforms(rule, "if nil then a() end\nreturn 1", "return 1");
    }

    @Test
    void testFalsyFirstBranchPromotesElseIf() throws ParseException {
        assertTransforms(rule, "if false then a() elseif x then b() end", "if x then b() end");
    }

    @Test
    void testUnknownConditionsAreKept() throws ParseException {
        assertUnchanged(rule, "if x then a() elseif y then b() else c() end");
    }

    @Test
    void testIfExpressionWithKnownCondition() throws ParseException {
        assertTransforms(rule, "return if true then 1 else 2", "return 1");
        assertTransforms(rule, "return if false then 1 else 2", "return 2");
    }

    @Test
    void testIfExpressionDropsFalsyElseIf() throws ParseException {
        assertTransforms(rule, "return if x then 1 elseif false then 2 else 3", "return if x then 1 else 3");
    }

    @Test
    void testIfExpressionKeepsSingleValueOfCall() throws ParseException {
        assertTransforms(rule, "return if true then f() else 2", "return (f())");
    }
}
