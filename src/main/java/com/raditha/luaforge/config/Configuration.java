package com.raditha.luaforge.config;

import com.raditha.luaforge.generator.GeneratorKind;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.rules.ConfiguredRule;
import com.raditha.luaforge.rules.FileFilter;
import com.raditha.luaforge.rules.RuleRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The rule pipeline and the generator used to write its result.
 *
 * @param rules     configured rules, in the order they run
 * @param generator output settings
 */
public record Configuration(List<ConfiguredRule> rules, GeneratorParameters generator) {

    public Configuration {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (generator == null) {
            generator = GeneratorParameters.retainLines();
        }
        rules = List.copyOf(rules);
    }

    /**
     * The default rule list with the line-preserving generator.
     */
    public static Configuration defaults(RuleRegistry registry) {
        return new Configuration(
                registry.defaultRules().stream().map(ConfiguredRule::new).toList(),
                GeneratorParameters.retainLines());
    }

    public Configuration withGenerator(GeneratorParameters parameters) {
        return new Configuration(rules, parameters);
    }

    /**
     * The mapping form of this configuration, as {@link ConfigurationLoader#fromMap} reads it.
     * Rules without non-default properties or file filters are written by name only.
     */
    public Map<String, Object> toMap() {
        List<Object> entries = new ArrayList<>();
        for (ConfiguredRule configured : rules) {
            Map<String, Object> properties = configured.rule().serializeToProperties();
            FileFilter filter = configured.filter();
            if (properties.isEmpty() && filter.isEmpty()) {
                entries.add(configured.name());
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rule", configured.name());
            entry.putAll(properties);
            if (!filter.apply().isEmpty()) {
                entry.put("apply_to_files", filter.apply().stream().map(FilePattern::getGlob).toList());
            }
            if (!filter.skip().isEmpty()) {
                entry.put("skip_files", filter.skip().stream().map(FilePattern::getGlob).toList());
            }
            entries.add(entry);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("rules", entries);
        if (generator.kind() == GeneratorKind.RETAIN_LINES
                || generator.columnSpan() == GeneratorParameters.DEFAULT_COLUMN_SPAN) {
            result.put("generator", generator.kind().getConfigName());
        } else {
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("name", generator.kind().getConfigName());
            parameters.put("column_span", generator.columnSpan());
            result.put("generator", parameters);
        }
        return result;
    }
}
