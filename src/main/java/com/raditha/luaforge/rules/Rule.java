package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;

import java.util.Map;

/**
 * A named transformation of a syntax tree.
 * <p>
 * A rule is configured once and then only read: {@link #process} keeps its working
 * state local, so one configured instance may process many trees, concurrently.
 * A rule that meets a construct it cannot handle leaves it untouched.
 */
public interface Rule {

    String getName();

    /**
     * Reads the rule's properties. Properties the rule does not know are an error.
     */
    default void configure(RuleProperties properties) throws RuleConfigurationException {
        properties.requireNoneLeft();
    }

    void process(Block block, RuleContext context);

    /**
     * Properties that differ from their defaults, in a form {@link #configure} accepts.
     */
    default Map<String, Object> serializeToProperties() {
        return Map.of();
    }
}
