package com.raditha.luaforge.rules;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private final RuleRegistry registry = new RuleRegistry();

    @Test
    void testDefaultPipelineOrder() {
        List<String> names = registry.defaultRules().stream().map(Rule::getName).toList();
        assertEquals(List.of(
                "remove_spaces",
                "remove_comments",
                "compute_expression",
                "remove_unused_if_branch",
                "remove_unused_while",
                "filter_after_early_return",
                "remove_empty_do",
                "remove_unused_variable",
                "remove_method_definition",
                "convert_index_to_field",
                "remove_nil_declaration",
                "rename_variables",
                "remove_function_call_parens"), names);
    }

    @Test
    void testEveryDefinitionCreatesItsRule() throws RuleConfigurationException {
        for (RuleRegistry.RuleDefinition definition : registry.definitions()) {
            assertEquals(definition.name(), registry.create(definition.name()).getName());
        }
    }

    @Test
    void testUnknownRule() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> registry.create("no_such_rule"));
        assertEquals("no_such_rule", e.getRuleName());
        assertNull(e.getProperty());
        assertEquals("rule 'no_such_rule': invalid rule name", e.getMessage());
    }

    @Test
    void testCreateWithProperties() throws RuleConfigurationException {
        Rule rule = registry.create(RemoveComments.NAME, Map.of("except", List.of("^--!")));
        assertEquals(Map.of("except", List.of("^--!")), rule.serializeToProperties());
    }

    @Test
    void testUnexpectedProperty() {
        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> registry.create(RemoveSpaces.NAME, Map.of("zeta", 1, "alpha", 2)));
        assertEquals("rule 'remove_spaces', property 'alpha': unexpected property", e.getMessage());
    }

    @Test
    void testRegisterReplacesDefinition() throws RuleConfigurationException {
        Rule custom = new RemoveEmptyDo();
        registry.register("custom", () -> custom, false);
        assertTrue(registry.isKnown("custom"));
        assertSame(custom, registry.create("custom"));
        assertFalse(registry.defaultRules().contains(custom));
    }
}
