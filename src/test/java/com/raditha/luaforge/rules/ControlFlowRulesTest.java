package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;
import static com.raditha.luaforge.rules.RuleTestSupport.rule;

/**
 * Tests for remove_unused_while, filter_after_early_return and remove_empty_do.
 */
class ControlFlowRulesTest {

    @Test
    void testRemoveUnusedWhile_FalsyCondition() throws Exception {
        Rule rule = rule(RemoveUnusedWhile.NAME);
        assertTransforms(rule, "while false do f() end\nreturn 1", "return 1");
        assertTransforms(rule, "while nil do end", "");
    }

    @Test
    void testRemoveUnusedWhile_KeepsUnknownCondition() throws Exception {
        Rule rule = rule(RemoveUnusedWhile.NAME);
        assertUnchanged(rule, "while x do f() end");
        assertUnchanged(rule, "while true do f() end");
    }

    @Test
    void testFilterAfterEarlyReturn_DropsFollowingStatements() throws Exception {
        Rule rule = rule(FilterAfterEarlyReturn.NAME);
        assertTransforms(rule, "do return 1 end\nprint(2)\nreturn 3", "do return 1 end");
    }

    @Test
    void testFilterAfterEarlyReturn_NestedDo() throws Exception {
        Rule rule = rule(FilterAfterEarlyReturn.NAME);
        assertTransforms(rule, "do do return end end\nprint(1)", "do do return end end");
    }

    @Test
    void testFilterAfterEarlyReturn_KeepsConditionalReturn() throws Exception {
        Rule rule = rule(FilterAfterEarlyReturn.NAME);
        assertUnchanged(rule, "if x then return 1 end\nprint(2)");
        assertUnchanged(rule, "do print(1) end\nprint(2)");
    }

    @Test
    void testRemoveEmptyDo() throws Exception {
        Rule rule = rule(RemoveEmptyDo.NAME);
        assertTransforms(rule, "do end\nlocal a = 1", "local a = 1");
        assertTransforms(rule, "do do end end", "");
        assertUnchanged(rule, "do local a = 1 end");
    }
}
