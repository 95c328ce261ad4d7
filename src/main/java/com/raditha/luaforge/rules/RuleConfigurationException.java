package com.raditha.luaforge.rules;

/**
 * A rule entry that cannot be turned into a working rule: unknown name, unexpected or
 * missing property, or a property of the wrong type.
 */
public class RuleConfigurationException extends Exception {

    private final String ruleName;
    private final String property;

    public RuleConfigurationException(String ruleName, String property, String message) {
        super(format(ruleName, property, message));
        this.ruleName = ruleName;
        this.property = property;
    }

    public RuleConfigurationException(String ruleName, String property, String message, Throwable cause) {
        super(format(ruleName, property, message), cause);
        this.ruleName = ruleName;
        this.property = property;
    }

    private static String format(String ruleName, String property, String message) {
        if (property == null) {
            return "rule '" + ruleName + "': " + message;
        }
        return "rule '" + ruleName + "', property '" + property + "': " + message;
    }

    public String getRuleName() {
        return ruleName;
    }

    /**
     * The offending property, or null when the error is about the rule itself.
     */
    public String getProperty() {
        return property;
    }
}
