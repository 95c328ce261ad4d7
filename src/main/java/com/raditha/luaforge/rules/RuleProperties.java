package com.raditha.luaforge.rules;

import com.raditha.luaforge.evaluator.LuaValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * The properties of one rule entry. Each property a rule reads is consumed; whatever
 * is left once the rule is configured was not expected.
 */
public class RuleProperties {

    private final String ruleName;
    private final Map<String, Object> remaining;

    public RuleProperties(String ruleName, Map<String, Object> properties) {
        this.ruleName = ruleName;
        this.remaining = new LinkedHashMap<>(properties);
    }

    public static RuleProperties empty(String ruleName) {
        return new RuleProperties(ruleName, Map.of());
    }

    public String getRuleName() {
        return ruleName;
    }

    public Optional<Boolean> getBoolean(String key) throws RuleConfigurationException {
        Object value = remaining.remove(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Boolean) {
            return Optional.of((Boolean) value);
        }
        throw wrongType(key, "a boolean", value);
    }

    public boolean getBoolean(String key, boolean defaultValue) throws RuleConfigurationException {
        return getBoolean(key).orElse(defaultValue);
    }

    public Optional<String> getString(String key) throws RuleConfigurationException {
        Object value = remaining.remove(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String) {
            return Optional.of((String) value);
        }
        throw wrongType(key, "a string", value);
    }

    public String requireString(String key) throws RuleConfigurationException {
        return getString(key).orElseThrow(() -> missing(key));
    }

    public Optional<Double> getNumber(String key) throws RuleConfigurationException {
        Object value = remaining.remove(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number) {
            return Optional.of(((Number) value).doubleValue());
        }
        throw wrongType(key, "a number", value);
    }

    /**
     * A list of strings; a single string is accepted as a list of one.
     */
    public List<String> getStringList(String key) throws RuleConfigurationException {
        Object value = remaining.remove(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (value instanceof List<?> list) {
            List<String> strings = new ArrayList<>();
            for (Object element : list) {
                if (!(element instanceof String)) {
                    throw wrongType(key, "a list of strings", value);
                }
                strings.add((String) element);
            }
            return strings;
        }
        throw wrongType(key, "a list of strings", value);
    }

    /**
     * A value that has a Lua literal form: null (nil), a boolean, a number or a string.
     */
    public Optional<LuaValue> getLiteral(String key) throws RuleConfigurationException {
        if (!remaining.containsKey(key)) {
            return Optional.empty();
        }
        Object value = remaining.remove(key);
        if (value == null) {
            return Optional.of(LuaValue.NIL);
        }
        if (value instanceof Boolean) {
            return Optional.of(LuaValue.of((Boolean) value));
        }
        if (value instanceof Number) {
            return Optional.of(LuaValue.number(((Number) value).doubleValue()));
        }
        if (value instanceof String) {
            return Optional.of(LuaValue.string((String) value));
        }
        throw wrongType(key, "nil, a boolean, a number or a string", value);
    }

    public boolean contains(String key) {
        return remaining.containsKey(key);
    }

    public void requireNoneLeft() throws RuleConfigurationException {
        if (!remaining.isEmpty()) {
            String first = new TreeSet<>(remaining.keySet()).first();
            throw new RuleConfigurationException(ruleName, first, "unexpected property");
        }
    }

    public RuleConfigurationException missing(String key) {
        return new RuleConfigurationException(ruleName, key, "missing required property");
    }

    public RuleConfigurationException invalid(String key, String message) {
        return new RuleConfigurationException(ruleName, key, message);
    }

    private RuleConfigurationException wrongType(String key, String expected, Object value) {
        return new RuleConfigurationException(ruleName, key,
                "expected " + expected + " but got " + describe(value));
    }

    private static String describe(Object value) {
        if (value instanceof List) {
            return "a list";
        }
        if (value instanceof Map) {
            return "an object";
        }
        return value.getClass().getSimpleName().toLowerCase() + " '" + value + "'";
    }
}
