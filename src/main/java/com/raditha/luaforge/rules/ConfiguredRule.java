package com.raditha.luaforge.rules;

/**
 * A configured rule together with the files it applies to.
 */
public record ConfiguredRule(Rule rule, FileFilter filter) {

    public ConfiguredRule {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        if (filter == null) {
            filter = FileFilter.ALL;
        }
    }

    public ConfiguredRule(Rule rule) {
        this(rule, FileFilter.ALL);
    }

    public String name() {
        return rule.getName();
    }

    public boolean appliesTo(RuleContext context) {
        return filter.accepts(context.relativePath());
    }
}
