package com.raditha.luaforge.rules;

/**
 * What a rule knows about the file it processes.
 *
 * @param relativePath path of the file relative to the processed root, with {@code /} separators
 */
public record RuleContext(String relativePath) {

    public RuleContext {
        relativePath = relativePath == null ? "" : relativePath.replace('\\', '/');
    }

    public static RuleContext anonymous() {
        return new RuleContext("");
    }
}
