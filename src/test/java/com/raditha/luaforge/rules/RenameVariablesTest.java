package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;
import static com.raditha.luaforge.rules.RuleTestSupport.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RenameVariablesTest {

    @Test
    void testNameSequence() {
        assertEquals("a", RenameVariables.nameAt(0));
        assertEquals("z", RenameVariables.nameAt(25));
        assertEquals("A", RenameVariables.nameAt(26));
        assertEquals("_", RenameVariables.nameAt(52));
        assertEquals("aa", RenameVariables.nameAt(53));
        assertEquals("ab", RenameVariables.nameAt(54));
    }

    @Test
    void testLocalsAreRenamedInOrder() throws Exception {
        assertTransforms(rule(RenameVariables.NAME),
                "local foo = 1\nlocal bar = foo\nreturn bar",
                "local a = 1\nlocal b = a\nreturn b");
    }

    @Test
    void testShadowingIsPreserved() throws Exception {
        assertTransforms(rule(RenameVariables.NAME),
                "local x = 1 do local x = x + 1 print(x) end print(x)",
                "local a = 1 do local b = a + 1 print(b) end print(a)");
    }

    @Test
    void testGlobalsAreNotRenamedOrReused() throws Exception {
        assertTransforms(rule(RenameVariables.NAME),
                "local value = a\nreturn value",
                "local b = a\nreturn b");
    }

    @Test
    void testFunctionNamesAreKeptByDefault() throws Exception {
        assertTransforms(rule(RenameVariables.NAME),
                "local function f(value) return value end return f",
                "local function f(a) return a end return f");
    }

    @Test
    void testIncludeFunctions() throws Exception {
        Rule rule = rule(RenameVariables.NAME, Map.of("include_functions", true));
        assertTransforms(rule,
                "local function f(value) return value end return f",
                "local function a(b) return b end return a");
    }

    @Test
    void testGlobalsOnly() throws Exception {
        assertUnchanged(rule(RenameVariables.NAME), "print(x)\nreturn y");
    }

    @Test
    void testSerializesNonDefaultProperties() throws Exception {
        Rule rule = rule(RenameVariables.NAME, Map.of("globals", List.of("$default", "$roblox"),
                "include_functions", true));
        Map<String, Object> properties = rule.serializeToProperties();
        assertEquals(List.of("$default", "$roblox"), properties.get("globals"));
        assertEquals(true, properties.get("include_functions"));
        assertTrue(rule(RenameVariables.NAME).serializeToProperties().isEmpty());
    }

    @Test
    void testInvalidGlobals() {
        assertThrows(RuleConfigurationException.class,
                () -> rule(RenameVariables.NAME, Map.of("globals", List.of("not valid"))));
        assertThrows(RuleConfigurationException.class,
                () -> rule(RenameVariables.NAME, Map.of("globals", List.of("$unknown"))));
        assertThrows(RuleConfigurationException.class,
                () -> rule(RenameVariables.NAME, Map.of("include_functions", "yes")));
    }

    @Test
    void testDeterministic() throws Exception {
        String source = "local a1, a2 = 1, 2\nlocal function g(x, y) local z = x + y return z end\nreturn g(a1, a2)";
        assertEquals(RuleTestSupport.applyDense(rule(RenameVariables.NAME), source),
                RuleTestSupport.applyDense(rule(RenameVariables.NAME), source));
    }

    @Test
    void testRenamingTwiceIsStable() throws ParseException, RuleConfigurationException {
        String once = RuleTestSupport.apply(rule(RenameVariables.NAME), "local foo = 1\nlocal bar = foo\nreturn bar");
        assertEquals(once, RuleTestSupport.apply(rule(RenameVariables.NAME), once));
    }
}
