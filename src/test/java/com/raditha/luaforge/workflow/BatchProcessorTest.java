package com.raditha.luaforge.workflow;

import com.raditha.luaforge.config.Configuration;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.rules.ConfiguredRule;
import com.raditha.luaforge.rules.RuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchProcessorTest {

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;
    private FileProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        input = tempDir.resolve("in");
        output = tempDir.resolve("out");
        Files.createDirectories(input.resolve("sub"));
        Files.writeString(input.resolve("a.lua"), "return 1 + 1");
        Files.writeString(input.resolve("sub/b.luau"), "local x: number = 2\nreturn x");
        Files.writeString(input.resolve("sub/broken.lua"), "local = ");
        Files.writeString(input.resolve("notes.txt"), "not lua");
        processor = new FileProcessor(new Configuration(
                List.of(new ConfiguredRule(
                        new RuleRegistry().create("compute_expression"))),
                GeneratorParameters.retainLines()));
    }

    @Test
    void testCollectDirectory() throws IOException {
        List<FileJob> jobs = BatchProcessor.collect(input, output);
        assertEquals(List.of("a.lua", "sub/b.luau", "sub/broken.lua"), jobs.stream().map(FileJob::relativePath).toList());
        assertEquals(output.resolve("sub").resolve("b.luau"), jobs.get(1).output());
    }

    @Test
    void testCollectSingleFile() throws IOException {
        List<FileJob> toFile = BatchProcessor.collect(input.resolve("a.lua"), tempDir.resolve("x.lua"));
        assertEquals(tempDir.resolve("x.lua"), toFile.get(0).output());
        List<FileJob> toDirectory = BatchProcessor.collect(input.resolve("a.lua"), tempDir);
        assertEquals(tempDir.resolve("a.lua"), toDirectory.get(0).output());
        assertEquals("a.lua", toDirectory.get(0).relativePath());
    }

    @Test
    void testCollectMissingInput() {
        assertThrows(IOException.class, () -> BatchProcessor.collect(tempDir.resolve("missing"), output));
    }

    @Test
    void testFailureIsIsolated() throws Exception {
        BatchReport report = new BatchProcessor(processor).run(BatchProcessor.collect(input, output), true);

        assertEquals(3, report.outcomes().size());
        assertEquals(2, report.successCount());
        assertTrue(report.hasFailures());
        assertEquals("sub/broken.lua", report.failures().get(0).relativePath());
        assertEquals("return 2", Files.readString(output.resolve("a.lua")));
        assertTrue(Files.exists(output.resolve("sub/b.luau")));
        assertFalse(Files.exists(output.resolve("sub/broken.lua")));
        assertEquals(1, report.changedCount());
    }

    @Test
    void testDeeplyChainedFileFailsAlone() throws Exception {
        Files.writeString(input.resolve("chain.lua"), "local x = a" + " + a".repeat(5000) + "\nreturn x");
        Files.writeString(input.resolve("concat.lua"), "return x" + " .. x".repeat(800));

        BatchReport report = new BatchProcessor(processor).run(BatchProcessor.collect(input, output), false);

        assertEquals(5, report.outcomes().size());
        List<String> failed = report.failures().stream().map(FileOutcome::relativePath).toList();
        assertEquals(List.of("chain.lua", "sub/broken.lua"), failed);
        assertTrue(report.failures().get(0).error().contains("nesting is too deep"));
        FileOutcome concat = report.outcomes().stream()
                .filter(outcome -> outcome.relativePath().equals("concat.lua"))
                .findFirst().orElseThrow();
        assertTrue(concat.isSuccess());
        assertEquals(800, concat.transformed().split("\\.\\.", -1).length - 1);
    }

    @Test
    void testDryRunWritesNothing() throws Exception {
        BatchReport report = new BatchProcessor(processor).run(BatchProcessor.collect(input, output), false);
        assertFalse(Files.exists(output));
        assertEquals("return 2", report.outcomes().get(0).transformed());
    }

    @Test
    void testThreadsKeepInputOrder() throws Exception {
        for (int i = 0; i < 20; i++) {
            Files.writeString(input.resolve(String.format("f%02d.lua", i)), "return " + i + " * 2");
        }
        List<FileJob> jobs = BatchProcessor.collect(input, output);
        BatchReport sequential = new BatchProcessor(processor).run(jobs, false);
        BatchReport parallel = new BatchProcessor(processor, 4).run(jobs, false);
        assertEquals(sequential.outcomes().stream().map(FileOutcome::relativePath).toList(),
                parallel.outcomes().stream().map(FileOutcome::relativePath).toList());
        assertEquals(sequential.outcomes().stream().map(FileOutcome::transformed).toList(),
                parallel.outcomes().stream().map(FileOutcome::transformed).toList());
    }

    @Test
    void testInvalidThreadCount() {
        assertThrows(IllegalArgumentException.class, () -> new BatchProcessor(processor, 0));
    }

    @Test
    void testLuaFileDetection() {
        assertTrue(BatchProcessor.isLuaFile(Path.of("a.LUA")));
        assertTrue(BatchProcessor.isLuaFile(Path.of("dir/b.luau")));
        assertFalse(BatchProcessor.isLuaFile(Path.of("c.txt")));
    }
}
