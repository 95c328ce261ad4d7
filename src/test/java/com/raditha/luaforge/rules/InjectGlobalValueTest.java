package com.raditha.luaforge.rules;

import com.raditha.luaforge.evaluator.LuaValue;
import com.raditha.luaforge.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.raditha.luaforge.rules.RuleTestSupport.apply;
import static com.raditha.luaforge.rules.RuleTestSupport.assertTransforms;
import static com.raditha.luaforge.rules.RuleTestSupport.assertUnchanged;
import static com.raditha.luaforge.rules.RuleTestSupport.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InjectGlobalValueTest {

    private static Rule inject(Object value) throws RuleConfigurationException {
        Map<String, Object> properties = new HashMap<>();
        properties.put("identifier", "CONSTANT");
        properties.put("value", value);
        return rule(InjectGlobalValue.NAME, properties);
    }

    private static InjectGlobalValue fromEnvironment(String text) throws RuleConfigurationException {
        InjectGlobalValue rule = new InjectGlobalValue(name -> "VALUE".equals(name) ? text : null);
        rule.configure(new RuleProperties(InjectGlobalValue.NAME, Map.of("identifier", "CONSTANT", "env", "VALUE")));
        return rule;
    }

    @Test
    void testInjectsBoolean() throws Exception {
        assertEquals("return true", apply(inject(true), "return CONSTANT"));
    }

    @Test
    void testInjectsNumbersStringsAndNil() throws Exception {
        assertTransforms(inject(3.5), "return CONSTANT", "return 3.5");
        assertTransforms(inject("hi"), "return CONSTANT", "return \"hi\"");
        assertTransforms(inject(null), "return CONSTANT", "return nil");
    }

    @Test
    void testGlobalTableAccess() throws Exception {
        assertTransforms(inject(1), "return _G.CONSTANT, _G['CONSTANT']", "return 1, 1");
    }

    @Test
    void testShadowedNameIsKept() throws Exception {
        assertUnchanged(inject(true), "local CONSTANT = 1\nreturn CONSTANT");
        assertUnchanged(inject(true), "local function f(CONSTANT) return CONSTANT end");
    }

    @Test
    void testAssignmentTargetIsKept() throws Exception {
        assertUnchanged(inject(true), "CONSTANT = 1");
    }

    @Test
    void testEnvironmentValueIsDecoded() throws Exception {
        assertEquals(LuaValue.number(42), fromEnvironment("42").getValue());
        assertEquals(LuaValue.TRUE, fromEnvironment("true").getValue());
        assertEquals(LuaValue.string("text"), fromEnvironment("\"text\"").getValue());
        assertEquals(LuaValue.string("hello"), fromEnvironment("hello").getValue());
        assertEquals(LuaValue.NIL, fromEnvironment(null).getValue());
    }

    @Test
    void testEnvironmentValueIsInjected() throws ParseException, RuleConfigurationException {
        assertTransforms(fromEnvironment("42"), "return CONSTANT", "return 42");
    }

    @Test
    void testConfigurationErrors() {
        assertThrows(RuleConfigurationException.class, () -> rule(InjectGlobalValue.NAME, Map.of()));
        assertThrows(RuleConfigurationException.class,
                () -> rule(InjectGlobalValue.NAME, Map.of("identifier", "1abc")));
        assertThrows(RuleConfigurationException.class,
                () -> rule(InjectGlobalValue.NAME, Map.of("identifier", "A", "value", 1, "env", "B")));
        assertThrows(RuleConfigurationException.class,
                () -> rule(InjectGlobalValue.NAME, Map.of("identifier", "A", "other", 1)));
    }

    @Test
    void testSerializesValue() throws Exception {
        Map<String, Object> properties = inject(true).serializeToProperties();
        assertEquals("CONSTANT", properties.get("identifier"));
        assertEquals(true, properties.get("value"));
    }
}
