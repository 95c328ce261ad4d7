package com.raditha.luaforge.workflow;

import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.rules.RuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Processes a set of files with one shared {@link FileProcessor}.
 * <p>
 * A file that cannot be read, parsed or written is recorded as a failure and the batch
 * moves on. Files are processed on a fixed pool of worker threads with a large stack,
 * since parsing, rules and generators all recurse over the tree; the report lists the
 * files in input order whatever the pool size.
 */
public class BatchProcessor {

    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    /** Stack size requested for worker threads */
    static final long WORKER_STACK_SIZE = 64L * 1024 * 1024;

    private final FileProcessor processor;
    private final int threads;

    public BatchProcessor(FileProcessor processor) {
        this(processor, 1);
    }

    public BatchProcessor(FileProcessor processor, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        this.processor = processor;
        this.threads = threads;
    }

    /**
     * Lists the jobs for an input file or directory. A directory contributes every
     * {@code .lua} and {@code .luau} file below it, mapped to the same relative path
     * under {@code output}.
     */
    public static List<FileJob> collect(Path input, Path output) throws IOException {
        if (!Files.isDirectory(input)) {
            if (!Files.exists(input)) {
                throw new IOException("input not found: " + input);
            }
            Path target = Files.isDirectory(output) ? output.resolve(input.getFileName()) : output;
            return List.of(new FileJob(input, target, input.getFileName().toString()));
        }
        try (Stream<Path> files = Files.walk(input)) {
            return files.filter(Files::isRegularFile)
                    .filter(BatchProcessor::isLuaFile)
                    .sorted()
                    .map(file -> {
                        Path relative = input.relativize(file);
                        return new FileJob(file, output.resolve(relative), relative.toString().replace('\\', '/'));
                    })
                    .toList();
        }
    }

    static boolean isLuaFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".lua") || name.endsWith(".luau");
    }

    /**
     * Processes every job.
     *
     * @param write whether results are written to the job outputs
     */
    public BatchReport run(List<FileJob> jobs, boolean write) throws InterruptedException {
        List<FileOutcome> outcomes = new ArrayList<>();
        if (!jobs.isEmpty()) {
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, jobs.size()),
                    workerThreads());
            try {
                List<Future<FileOutcome>> futures = new ArrayList<>();
                for (FileJob job : jobs) {
                    futures.add(executor.submit(() -> processFile(job, write)));
                }
                for (Future<FileOutcome> future : futures) {
                    outcomes.add(await(future));
                }
            } finally {
                executor.shutdownNow();
            }
        }
        BatchReport report = new BatchReport(outcomes);
        logger.info("Processed {} file(s): {} changed, {} failed",
                jobs.size(), report.changedCount(), report.failures().size());
        return report;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(null, task, "luaforge-worker-" + counter.incrementAndGet(),
                    WORKER_STACK_SIZE);
            thread.setDaemon(true);
            return thread;
        };
    }

    private static FileOutcome await(Future<FileOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    FileOutcome processFile(FileJob job, boolean write) {
        String source;
        try {
            source = Files.readString(job.input());
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", job.input(), e.getMessage());
            return FileOutcome.failure(job, null, "cannot read file: " + e.getMessage());
        }
        String code;
        try {
            code = processor.process(source, new RuleContext(job.relativePath())).code();
        } catch (ParseException e) {
            logger.warn("Failed to parse {}: {}", job.input(), e.getMessage());
            return FileOutcome.failure(job, source, e.getMessage());
        } catch (StackOverflowError e) {
            logger.warn("Failed to process {}: the syntax tree is nested too deeply", job.input());
            return FileOutcome.failure(job, source, "syntax tree is nested too deeply to process");
        }
        if (write) {
            try {
                Path parent = job.output().toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(job.output(), code);
            } catch (IOException e) {
                logger.warn("Cannot write {}: {}", job.output(), e.getMessage());
                return FileOutcome.failure(job, source, "cannot write file: " + e.getMessage());
            }
        }
        logger.debug("Processed {}", job.relativePath());
        return FileOutcome.success(job, source, code);
    }
}
