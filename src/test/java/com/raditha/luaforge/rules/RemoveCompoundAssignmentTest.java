package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.apply;
import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemoveCompoundAssignmentTest {

    private Rule rule;

    @BeforeEach
    void setUp() throws RuleConfigurationException {
        rule = RuleTestSupport.rule(RemoveCompoundAssignment.NAME);
    }

    @Test
    void testIdentifierTarget() throws ParseException {
        assertEquals("counter = counter + 1", apply(rule, "counter += 1"));
    }

    @Test
    void testEachOperator() throws ParseException {
        assertTransforms(rule, "s ..= 'x'", "s = s .. 'x'");
        assertTransforms(rule, "a -= 1 a *= 2 a /= 3 a %= 4 a ^= 5",
                "a = a - 1 a = a * 2 a = a / 3 a = a % 4 a = a ^ 5");
    }

    @Test
    void testOperandPrecedence() throws ParseException {
        assertTransforms(rule, "a *= b + c", "a = a * (b + c)");
    }

    @Test
    void testSimpleFieldIsDuplicated() throws ParseException {
        assertTransforms(rule, "t.x += 1", "t.x = t.x + 1");
        assertTransforms(rule, "t[1] += 1", "t[1] = t[1] + 1");
    }

    @Test
    void testCallPrefixIsEvaluatedOnce() throws ParseException {
        assertTransforms(rule, "f().x += 1",
                "do local __LUAFORGE_VAR = f() __LUAFORGE_VAR.x = __LUAFORGE_VAR.x + 1 end");
    }

    @Test
    void testComputedKeyIsEvaluatedOnce() throws ParseException {
        assertTransforms(rule, "a[g()] -= 2",
                "do local __LUAFORGE_VAR = g() a[__LUAFORGE_VAR] = a[__LUAFORGE_VAR] - 2 end");
        assertTransforms(rule, "f()[g()] += 1",
                "do local __LUAFORGE_VAR = f() local __LUAFORGE_VAR1 = g() "
                        + "__LUAFORGE_VAR[__LUAFORGE_VAR1] = __LUAFORGE_VAR[__LUAFORGE_VAR1] + 1 end");
    }

    @Test
    void testTemporaryNamesRestartForEachStatement() throws ParseException {
        assertTransforms(rule, "f().x += 1\ng().y += 2",
                "do local __LUAFORGE_VAR = f() __LUAFORGE_VAR.x = __LUAFORGE_VAR.x + 1 end "
                        + "do local __LUAFORGE_VAR = g() __LUAFORGE_VAR.y = __LUAFORGE_VAR.y + 2 end");
    }

    @Test
    void testRewrittenStatementsStayApartWhenLinesAreRetained() throws ParseException {
        String output = apply(rule, "a[g()] -= 2");
        assertTrue(output.contains("g() a["), output);
        assertFalse(output.contains("g()a["), output);
    }
}
