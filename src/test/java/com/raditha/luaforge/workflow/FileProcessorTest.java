package com.raditha.luaforge.workflow;

import com.raditha.luaforge.config.Configuration;
import com.raditha.luaforge.config.ConfigurationException;
import com.raditha.luaforge.config.ConfigurationLoader;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.rules.RuleContext;
import com.raditha.luaforge.rules.RuleRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileProcessorTest {

    private static FileProcessor processor(String json) throws ConfigurationException {
        return new FileProcessor(new ConfigurationLoader(new RuleRegistry()).fromJson(json));
    }

    @Test
    void testEmptyPipelineKeepsSource() throws Exception {
        String source = "-- comment\nlocal  x = 1   \n\nreturn x\n";
        assertEquals(source, processor("{\"rules\": []}").process(source));
    }

    @Test
    void testGeneratorIsApplied() throws Exception {
        FileProcessor processor = processor("{\"rules\": [], \"generator\": \"dense\"}");
        assertEquals("local x=1 return x", processor.process("local x = 1\nreturn x"));
    }

    @Test
    void testResultListsAppliedAndSkippedRules() throws Exception {
        FileProcessor processor = processor("{\"rules\": [\"remove_comments\","
                + " {\"rule\": \"remove_spaces\", \"apply_to_files\": \"src/**\"}]}");
        FileProcessor.Result result = processor.process("return 1", new RuleContext("lib/a.lua"));
        assertEquals(List.of("remove_comments"), result.rules().applied());
        assertEquals(List.of("remove_spaces"), result.rules().skipped());
    }

    @Test
    void testParseErrorIsReported() throws ConfigurationException {
        FileProcessor processor = processor("{}");
        assertThrows(ParseException.class, () -> processor.process("local = 1"));
    }

    @Test
    void testDefaultPipeline() throws Exception {
        FileProcessor processor = new FileProcessor(Configuration.defaults(new RuleRegistry())
                .withGenerator(GeneratorParameters.dense()));
        assertEquals("return 3", processor.process("local unused = 1\n-- note\nreturn 1 + 2"));
    }
}
