package com.raditha.luaforge.workflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private final DiffGenerator diffGenerator = new DiffGenerator();

    @Test
    void testNoChangesGivesEmptyDiff() {
        assertEquals("", diffGenerator.generateUnifiedDiff("a.lua", "return 1\n", "return 1\n"));
    }

    @Test
    void testUnifiedDiffHeadersAndLines() {
        String diff = diffGenerator.generateUnifiedDiff("src/a.lua", "local x = 1\nreturn x\n", "return 1\n");
        assertTrue(diff.contains("--- a/src/a.lua"));
        assertTrue(diff.contains("+++ b/src/a.lua"));
        assertTrue(diff.contains("-local x = 1"));
        assertTrue(diff.contains("+return 1"));
    }
}
