package com.raditha.luaforge.rules;

import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;

class RemoveTypesTest {

    private Rule rule;

    @BeforeEach
    void setUp() throws RuleConfigurationException {
        rule = RuleTestSupport.rule(RemoveTypes.NAME);
    }

    @Test
    void testVariableAnnotations() throws ParseException {
        assertTransforms(rule, "local x: number = 1", "local x = 1");
        assertTransforms(rule, "for i: number = 1, 2 do end", "for i = 1, 2 do end");
    }

    @Test
    void testTypeDeclarationsAreRemoved() throws ParseException {
        assertTransforms(rule, "type T = string\nexport type U<V> = {V}\nreturn 1", "return 1");
    }

    @Test
    void testFunctionSignatures() throws ParseException {
        assertTransforms(rule, "local function f<T>(a: T, ...: number): T return a end",
                "local function f(a, ...) return a end");
    }

    @Test
    void testCasts() throws ParseException {
        assertTransforms(rule, "return y :: any", "return y");
        assertTransforms(rule, "return f() :: number", "return (f())");
    }

    @Test
    void testUntypedCodeIsUnchanged() throws ParseException {
        assertUnchanged(rule, "local function f(a) return a end");
    }
}
