package com.raditha.luaforge.config;

import com.raditha.luaforge.generator.GeneratorKind;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.rules.ConfiguredRule;
import com.raditha.luaforge.rules.RemoveComments;
import com.raditha.luaforge.rules.RuleConfigurationException;
import com.raditha.luaforge.rules.RuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    private RuleRegistry registry;
    private ConfigurationLoader loader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry();
        loader = new ConfigurationLoader(registry);
    }

    private static List<String> names(Configuration configuration) {
        return configuration.rules().stream().map(ConfiguredRule::name).toList();
    }

    @Test
    void testEmptyConfigurationUsesDefaults() throws ConfigurationException {
        Configuration configuration = loader.fromJson("{}");
        assertEquals(names(Configuration.defaults(registry)), names(configuration));
        assertEquals(GeneratorParameters.retainLines(), configuration.generator());
    }

    @Test
    void testJson5Syntax() throws ConfigurationException {
        Configuration configuration = loader.fromJson("""
                {
                    // comments and trailing commas are accepted
                    rules: [
                        'remove_comments',
                        { rule: 'rename_variables', include_functions: true },
                    ],
                    generator: { name: 'dense', column_span: 120 },
                }
                """);
        assertEquals(List.of("remove_comments", "rename_variables"), names(configuration));
        assertEquals(new GeneratorParameters(GeneratorKind.DENSE, 120), configuration.generator());
        assertEquals(Map.of("include_functions", true),
                configuration.rules().get(1).rule().serializeToProperties());
    }

    @Test
    void testProcessIsAnAliasForRules() throws ConfigurationException {
        Configuration configuration = loader.fromJson("{\"process\": [\"remove_spaces\"]}");
        assertEquals(List.of("remove_spaces"), names(configuration));
    }

    @Test
    void testEmptyRuleListIsKept() throws ConfigurationException {
        assertTrue(loader.fromJson("{\"rules\": []}").rules().isEmpty());
    }

    @Test
    void testFileFilters() throws ConfigurationException {
        Configuration configuration = loader.fromJson("{\"rules\": [{\"rule\": \"remove_comments\","
                + " \"apply_to_files\": \"src/**\", \"skip_files\": [\"**/*.spec.lua\"]}]}");
        ConfiguredRule rule = configuration.rules().get(0);
        assertTrue(rule.filter().accepts("src/a.lua"));
        assertFalse(rule.filter().accepts("src/a.spec.lua"));
        assertFalse(rule.filter().accepts("lib/a.lua"));
    }

    @Test
    void testLoadYaml() throws Exception {
        Path file = tempDir.resolve(".luaforge.yaml");
        Files.writeString(file, """
                rules:
                  - remove_spaces
                  - rule: remove_comments
                    except: ["^--!"]
                generator: readable
                """);
        Configuration configuration = loader.load(file);
        assertEquals(List.of("remove_spaces", "remove_comments"), names(configuration));
        assertEquals(GeneratorParameters.readable(), configuration.generator());
    }

    @Test
    void testLoadErrorsNameTheFile() throws Exception {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"rules\": [\"no_such_rule\"]}");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(file));
        assertTrue(e.getMessage().startsWith(file.toString()));
        assertTrue(e.getMessage().contains("no_such_rule"));
        assertInstanceOf(RuleConfigurationException.class, e.getCause().getCause());
    }

    @Test
    void testLoadRejectsUnknownFormatAndMissingFile() throws Exception {
        Path toml = tempDir.resolve("config.toml");
        Files.writeString(toml, "");
        assertThrows(ConfigurationException.class, () -> loader.load(toml));
        assertThrows(ConfigurationException.class, () -> loader.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testMalformedJson() {
        assertThrows(ConfigurationException.class, () -> loader.fromJson("{ rules: [ }"));
    }

    @Test
    void testStructuralErrors() {
        assertMessage("unexpected field 'rule' (expected rules, process or generator)", "{\"rule\": []}");
        assertMessage("'rules' and 'process' cannot both be given", "{\"rules\": [], \"process\": []}");
        assertMessage("'rules' must be a list", "{\"rules\": \"remove_spaces\"}");
        assertMessage("a rule must be a name or an object with a 'rule' field", "{\"rules\": [1]}");
        assertMessage("a rule object needs a 'rule' field holding the rule name", "{\"rules\": [{}]}");
        assertMessage("rule 'remove_comments', property 'skip_files': expected a string or a list of strings",
                "{\"rules\": [{\"rule\": \"remove_comments\", \"skip_files\": 3}]}");
        assertMessage("rule 'remove_spaces', property 'extra': unexpected property",
                "{\"rules\": [{\"rule\": \"remove_spaces\", \"extra\": 1}]}");
    }

    @Test
    void testGeneratorErrors() {
        assertMessage("generator: 'name' is required", "{\"generator\": {}}");
        assertMessage("generator: unexpected field 'width'", "{\"generator\": {\"name\": \"dense\", \"width\": 3}}");
        assertMessage("generator: 'column_span' does not apply to retain_lines",
                "{\"generator\": {\"name\": \"retain_lines\", \"column_span\": 3}}");
        assertMessage("generator: 'column_span' must be a positive integer",
                "{\"generator\": {\"name\": \"dense\", \"column_span\": 0}}");
        assertThrows(ConfigurationException.class, () -> loader.fromJson("{\"generator\": \"pretty\"}"));
    }

    private void assertMessage(String expected, String json) {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.fromJson(json));
        assertEquals(expected, e.getMessage());
    }

    @Test
    void testToMapReadsBack() throws ConfigurationException {
        Configuration configuration = loader.fromJson("{\"rules\": [\"remove_spaces\","
                + " {\"rule\": \"remove_comments\", \"except\": [\"^--!\"], \"skip_files\": \"vendor/**\"},"
                + " {\"rule\": \"inject_global_value\", \"identifier\": \"DEV\", \"value\": false}],"
                + " \"generator\": {\"name\": \"readable\", \"column_span\": 100}}");
        Map<String, Object> map = configuration.toMap();
        assertEquals(Map.of("name", "readable", "column_span", 100), map.get("generator"));
        Configuration again = loader.fromMap(map);
        assertEquals(names(configuration), names(again));
        assertEquals(configuration.generator(), again.generator());
        assertEquals(map, again.toMap());
    }

    @Test
    void testDefaultsToMap() {
        Map<String, Object> map = Configuration.defaults(registry).toMap();
        assertEquals("retain_lines", map.get("generator"));
        assertEquals(13, ((List<?>) map.get("rules")).size());
        assertEquals(RemoveComments.NAME, ((List<?>) map.get("rules")).get(1));
    }
}
