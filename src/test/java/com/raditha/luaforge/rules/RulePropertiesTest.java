package com.raditha.luaforge.rules;

import com.raditha.luaforge.evaluator.LuaValue;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RulePropertiesTest {

    @Test
    void testTypedAccessors() throws RuleConfigurationException {
        RuleProperties properties = new RuleProperties("r",
                Map.of("flag", true, "name", "x", "count", 3, "list", List.of("a", "b")));
        assertTrue(properties.getBoolean("flag", false));
        assertEquals("x", properties.requireString("name"));
        assertEquals(Optional.of(3.0), properties.getNumber("count"));
        assertEquals(List.of("a", "b"), properties.getStringList("list"));
        properties.requireNoneLeft();
    }

    @Test
    void testSingleStringIsAList() throws RuleConfigurationException {
        RuleProperties properties = new RuleProperties("r", Map.of("list", "a"));
        assertEquals(List.of("a"), properties.getStringList("list"));
        assertEquals(List.of(), properties.getStringList("missing"));
    }

    @Test
    void testWrongTypes() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> new RuleProperties("r", Map.of("flag", "yes")).getBoolean("flag"));
        assertEquals("rule 'r', property 'flag': expected a boolean but got string 'yes'", e.getMessage());
        assertThrows(RuleConfigurationException.class,
                () -> new RuleProperties("r", Map.of("list", List.of(1))).getStringList("list"));
        assertThrows(RuleConfigurationException.class,
                () -> new RuleProperties("r", Map.of("value", Map.of())).getLiteral("value"));
    }

    @Test
    void testMissingRequired() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> RuleProperties.empty("r").requireString("text"));
        assertEquals("text", e.getProperty());
        assertEquals("rule 'r', property 'text': missing required property", e.getMessage());
    }

    @Test
    void testLiterals() throws RuleConfigurationException {
        Map<String, Object> values = new HashMap<>();
        values.put("nil", null);
        values.put("bool", false);
        values.put("number", 2.5);
        values.put("string", "s");
        RuleProperties properties = new RuleProperties("r", values);
        assertTrue(properties.contains("nil"));
        assertEquals(Optional.of(LuaValue.NIL), properties.getLiteral("nil"));
        assertEquals(Optional.of(LuaValue.FALSE), properties.getLiteral("bool"));
        assertEquals(Optional.of(LuaValue.number(2.5)), properties.getLiteral("number"));
        assertEquals(Optional.of(LuaValue.string("s")), properties.getLiteral("string"));
        assertEquals(Optional.empty(), properties.getLiteral("absent"));
        assertFalse(properties.contains("nil"));
    }
}
