package com.raditha.luaforge.rules;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.raditha.luaforge.rules.RuleTestSupport.apply;
import static com.raditha.luaforge.rules.RuleTestSupport.dense;
import static com.raditha.luaforge.rules.RuleTestSupport.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the rules that only touch whitespace and comments.
 */
class TriviaRulesTest {

    @Test
    void testRemoveSpaces_KeepsTokensApart() throws Exception {
        assertEquals("local a=1", apply(rule(RemoveSpaces.NAME), "local  a   =   1"));
    }

    @Test
    void testRemoveSpaces_KeepsLines() throws Exception {
        assertEquals("local a=1\nlocal b=2", apply(rule(RemoveSpaces.NAME), "local a = 1\n  local b = 2"));
    }

    @Test
    void testRemoveComments() throws Exception {
        String source = "-- header\nlocal a = 1 -- trailing\n--[[ block ]] return a\n";
        String result = apply(rule(RemoveComments.NAME), source);
        assertFalse(result.contains("--"));
        assertEquals(dense(source), dense(result));
        assertEquals(source.split("\n", -1).length, result.split("\n", -1).length);
    }

    @Test
    void testRemoveComments_Except() throws Exception {
        Rule rule = rule(RemoveComments.NAME, Map.of("except", List.of("^--!")));
        String result = apply(rule, "--!strict\n-- note\nreturn 1");
        assertTrue(result.contains("--!strict"));
        assertFalse(result.contains("note"));
    }

    @Test
    void testRemoveComments_InvalidPattern() {
        assertThrows(RuleConfigurationException.class,
                () -> rule(RemoveComments.NAME, Map.of("except", List.of("("))));
    }

    @Test
    void testAppendTextComment_Start() throws Exception {
        Rule rule = rule(AppendTextComment.NAME, Map.of("text", "hello"));
        assertEquals("--hello\nreturn 1", apply(rule, "return 1"));
    }

    @Test
    void testAppendTextComment_StartKeepsFollowingLines() throws Exception {
        Rule rule = rule(AppendTextComment.NAME, Map.of("text", "hello"));
        assertEquals("--hello\nlocal a = 1\nreturn a", apply(rule, "local a = 1\nreturn a"));
    }

    @Test
    void testAppendTextComment_AfterShebang() throws Exception {
        Rule rule = rule(AppendTextComment.NAME, Map.of("text", "hello"));
        assertEquals("#!/usr/bin/lua\n--hello\nreturn 1", apply(rule, "#!/usr/bin/lua\nreturn 1"));
    }

    @Test
    void testAppendTextComment_MultiLine() throws Exception {
        Rule rule = rule(AppendTextComment.NAME, Map.of("text", "a\nb"));
        assertEquals("--[[a\nb]]\nreturn 1", apply(rule, "return 1"));
    }

    @Test
    void testAppendTextComment_End() throws Exception {
        Rule rule = rule(AppendTextComment.NAME, Map.of("text", "hello", "location", "end"));
        assertEquals("return 1\n--hello", apply(rule, "return 1"));
    }

    @Test
    void testAppendTextComment_BlockLevelAvoidsClosingBrackets() {
        assertEquals("--[=[x]]y\nz]=]", AppendTextComment.comment("x]]y\nz").text());
    }

    @Test
    void testAppendTextComment_Configuration() throws Exception {
        assertThrows(RuleConfigurationException.class, () -> rule(AppendTextComment.NAME, Map.of()));
        assertThrows(RuleConfigurationException.class,
                () -> rule(AppendTextComment.NAME, Map.of("text", "x", "location", "middle")));
        Map<String, Object> properties = rule(AppendTextComment.NAME, Map.of("text", "x", "location", "end"))
                .serializeToProperties();
        assertEquals(Map.of("text", "x", "location", "end"), properties);
    }
}
