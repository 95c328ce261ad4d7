package com.raditha.luaforge.config;

import com.raditha.luaforge.rules.FileFilter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class FilePatternTest {

    @Test
    void testSingleStarStaysInSegment() {
        FilePattern pattern = FilePattern.compile("src/*.lua");
        assertTrue(pattern.matches("src/main.lua"));
        assertFalse(pattern.matches("src/sub/main.lua"));
        assertFalse(pattern.matches("src/main.luau"));
    }

    @Test
    void testDoubleStarCrossesSegments() {
        FilePattern pattern = FilePattern.compile("**/*.spec.lua");
        assertTrue(pattern.matches("a.spec.lua"));
        assertTrue(pattern.matches("a/b/c.spec.lua"));
        assertFalse(pattern.matches("a/b/c.lua"));
        assertTrue(FilePattern.compile("vendor/**").matches("vendor/x/y.lua"));
    }

    @Test
    void testQuestionMarkAndSeparators() {
        FilePattern pattern = FilePattern.compile("v?.lua");
        assertTrue(pattern.matches("v1.lua"));
        assertFalse(pattern.matches("v12.lua"));
        assertTrue(FilePattern.compile("a/b.lua").matches("a\\b.lua"));
        assertTrue(FilePattern.compile("a/b.lua").matches("./a/b.lua"));
    }

    @Test
    void testInvalidPatterns() {
        assertThrows(PatternSyntaxException.class, () -> FilePattern.compile(""));
        assertThrows(PatternSyntaxException.class, () -> FilePattern.compile("[a"));
    }

    @Test
    void testFileFilter() {
        FileFilter filter = new FileFilter(List.of(FilePattern.compile("src/**")),
                List.of(FilePattern.compile("**/*.spec.lua")));
        assertTrue(filter.accepts("src/a.lua"));
        assertFalse(filter.accepts("src/a.spec.lua"));
        assertFalse(filter.accepts("test/a.lua"));
        assertTrue(FileFilter.ALL.accepts("anything.lua"));
        assertTrue(FileFilter.ALL.isEmpty());
        assertFalse(filter.isEmpty());
    }
}
