package com.raditha.luaforge.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.raditha.luaforge.generator.GeneratorKind;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.rules.ConfiguredRule;
import com.raditha.luaforge.rules.FileFilter;
import com.raditha.luaforge.rules.Rule;
import com.raditha.luaforge.rules.RuleConfigurationException;
import com.raditha.luaforge.rules.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;

/**
 * Builds a {@link Configuration} from a configuration file or from an already parsed mapping.
 * <p>
 * Recognized top-level keys are {@code rules} (or its alias {@code process}) and
 * {@code generator}. Without {@code rules} the default rule list is used.
 */
public class ConfigurationLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String RULES = "rules";
    private static final String PROCESS = "process";
    private static final String GENERATOR = "generator";
    private static final String APPLY_TO_FILES = "apply_to_files";
    private static final String SKIP_FILES = "skip_files";
    private static final Set<String> TOP_LEVEL_KEYS = Set.of(RULES, PROCESS, GENERATOR);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RuleRegistry registry;
    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();
    private final ObjectMapper yamlMapper = new YAMLMapper();

    public ConfigurationLoader(RuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Reads a {@code .json}, {@code .json5}, {@code .yaml} or {@code .yml} file.
     */
    public Configuration load(Path file) throws ConfigurationException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper;
        if (name.endsWith(".json") || name.endsWith(".json5")) {
            mapper = jsonMapper;
        } else if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            mapper = yamlMapper;
        } else {
            throw new ConfigurationException(file + ": unsupported configuration format"
                    + " (expected .json, .json5, .yaml or .yml)");
        }
        Map<String, Object> content;
        try {
            content = mapper.readValue(Files.readString(file), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException(file + ": cannot read configuration: " + e.getMessage(), e);
        }
        logger.debug("Loaded configuration from {}", file);
        try {
            return fromMap(content == null ? Map.of() : content);
        } catch (ConfigurationException e) {
            throw new ConfigurationException(file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a JSON or JSON5 document held in memory.
     */
    public Configuration fromJson(String json) throws ConfigurationException {
        try {
            Map<String, Object> content = jsonMapper.readValue(json, MAP_TYPE);
            return fromMap(content == null ? Map.of() : content);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(e.getOriginalMessage(), e);
        }
    }

    public Configuration fromMap(Map<String, Object> content) throws ConfigurationException {
        Set<String> unknown = new TreeSet<>(content.keySet());
        unknown.removeAll(TOP_LEVEL_KEYS);
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("unexpected field '" + unknown.iterator().next()
                    + "' (expected rules, process or generator)");
        }
        if (content.containsKey(RULES) && content.containsKey(PROCESS)) {
            throw new ConfigurationException("'rules' and 'process' cannot both be given");
        }
        Object rules = content.containsKey(RULES) ? content.get(RULES) : content.get(PROCESS);
        List<ConfiguredRule> configured = rules == null
                ? Configuration.defaults(registry).rules()
                : readRules(rules);
        return new Configuration(configured, readGenerator(content.get(GENERATOR)));
    }

    private List<ConfiguredRule> readRules(Object rules) throws ConfigurationException {
        if (!(rules instanceof List<?> entries)) {
            throw new ConfigurationException("'rules' must be a list");
        }
        List<ConfiguredRule> configured = new ArrayList<>();
        for (Object entry : entries) {
            try {
                configured.add(readRule(entry));
            } catch (RuleConfigurationException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
        return configured;
    }

    private ConfiguredRule readRule(Object entry) throws RuleConfigurationException, ConfigurationException {
        if (entry instanceof String name) {
            return new ConfiguredRule(registry.create(name, Map.of()));
        }
        if (!(entry instanceof Map<?, ?> map)) {
            throw new ConfigurationException("a rule must be a name or an object with a 'rule' field");
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        map.forEach((key, value) -> properties.put(String.valueOf(key), value));
        Object name = properties.remove("rule");
        if (!(name instanceof String ruleName)) {
            throw new ConfigurationException("a rule object needs a 'rule' field holding the rule name");
        }
        List<FilePattern> apply = readPatterns(ruleName, APPLY_TO_FILES, properties.remove(APPLY_TO_FILES));
        List<FilePattern> skip = readPatterns(ruleName, SKIP_FILES, properties.remove(SKIP_FILES));
        Rule rule = registry.create(ruleName, properties);
        return new ConfiguredRule(rule, new FileFilter(apply, skip));
    }

    private static List<FilePattern> readPatterns(String ruleName, String key, Object value)
            throws RuleConfigurationException {
        List<String> globs;
        if (value == null) {
            return List.of();
        } else if (value instanceof String glob) {
            globs = List.of(glob);
        } else if (value instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
            globs = list.stream().map(String.class::cast).toList();
        } else {
            throw new RuleConfigurationException(ruleName, key, "expected a string or a list of strings");
        }
        List<FilePattern> patterns = new ArrayList<>();
        for (String glob : globs) {
            try {
                patterns.add(FilePattern.compile(glob));
            } catch (PatternSyntaxException e) {
                throw new RuleConfigurationException(ruleName, key, "invalid pattern '" + glob + "'", e);
            }
        }
        return patterns;
    }

    private static GeneratorParameters readGenerator(Object value) throws ConfigurationException {
        if (value == null) {
            return GeneratorParameters.retainLines();
        }
        if (value instanceof String name) {
            return new GeneratorParameters(kind(name));
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new ConfigurationException("'generator' must be a name or an object");
        }
        Set<String> unknown = new TreeSet<>();
        map.keySet().forEach(key -> unknown.add(String.valueOf(key)));
        unknown.removeAll(Set.of("name", "column_span"));
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("generator: unexpected field '" + unknown.iterator().next() + "'");
        }
        if (!(map.get("name") instanceof String name)) {
            throw new ConfigurationException("generator: 'name' is required");
        }
        GeneratorKind kind = kind(name);
        Object span = map.get("column_span");
        if (span == null) {
            return new GeneratorParameters(kind);
        }
        if (kind == GeneratorKind.RETAIN_LINES) {
            throw new ConfigurationException("generator: 'column_span' does not apply to retain_lines");
        }
        if (!(span instanceof Integer columnSpan) || columnSpan < 1) {
            throw new ConfigurationException("generator: 'column_span' must be a positive integer");
        }
        return new GeneratorParameters(kind, columnSpan);
    }

    private static GeneratorKind kind(String name) throws ConfigurationException {
        try {
            return GeneratorKind.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }
}
