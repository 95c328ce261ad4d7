package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.generator.DenseLuaGenerator;
import com.raditha.luaforge.generator.TokenBasedLuaGenerator;
import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Helpers shared by the rule tests. Structural comparisons go through the dense
 * generator so that they do not depend on the formatting kept by the rule.
 */
final class RuleTestSupport {

    private static final RuleRegistry REGISTRY = new RuleRegistry();

    private RuleTestSupport() {
    }

    static Rule rule(String name) throws RuleConfigurationException {
        return REGISTRY.create(name, Map.of());
    }

    static Rule rule(String name, Map<String, Object> properties) throws RuleConfigurationException {
        return REGISTRY.create(name, properties);
    }

    static String dense(String source) throws ParseException {
        return new DenseLuaGenerator().generate(Parser.parse(source));
    }

    static String applyDense(Rule rule, String source) throws ParseException {
        Block block = Parser.parse(source);
        rule.process(block, RuleContext.anonymous());
        return new DenseLuaGenerator().generate(block);
    }

    /**
     * Applies the rule and writes the tree back with the line-preserving generator.
     */
    static String apply(Rule rule, String source) throws ParseException {
        Block block = Parser.parse(source);
        rule.process(block, RuleContext.anonymous());
        return new TokenBasedLuaGenerator().generate(block);
    }

    static void assertTransforms(Rule rule, String input, String expected) throws ParseException {
        assertEquals(dense(expected), applyDense(rule, input));
    }

    static void assertUnchanged(Rule rule, String input) throws ParseException {
        assertEquals(dense(input), applyDense(rule, input));
    }
}
