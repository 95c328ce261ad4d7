package com.raditha.luaforge.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.luaforge.config.Configuration;
import com.raditha.luaforge.config.ConfigurationException;
import com.raditha.luaforge.config.ConfigurationLoader;
import com.raditha.luaforge.generator.GeneratorKind;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.rules.RuleRegistry;
import com.raditha.luaforge.workflow.BatchProcessor;
import com.raditha.luaforge.workflow.BatchReport;
import com.raditha.luaforge.workflow.DiffGenerator;
import com.raditha.luaforge.workflow.FileJob;
import com.raditha.luaforge.workflow.FileOutcome;
import com.raditha.luaforge.workflow.FileProcessor;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for luaforge.
 * <p>
 * Usage:
 * <pre>
 * luaforge process [--config FILE] [--generator NAME] [--dry-run] [--verbose] [--threads N] &lt;input&gt; &lt;output&gt;
 * luaforge rules
 * luaforge config [--config FILE]
 * </pre>
 * Exit codes: 0 success, 1 some files failed, 2 configuration error, 3 I/O error.
 */
@Command(name = "luaforge", mixinStandardHelpOptions = true, version = "luaforge 1.0.0",
        description = "Lua and Luau source transformation tool",
        subcommands = {
                LuaforgeCLI.ProcessCommand.class,
                LuaforgeCLI.RulesCommand.class,
                LuaforgeCLI.ConfigCommand.class
        })
public class LuaforgeCLI implements Callable<Integer> {

    public static final int EXIT_FAILED_FILES = 1;
    public static final int EXIT_CONFIGURATION = 2;
    public static final int EXIT_IO = 3;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * The command line with luaforge's exit code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new LuaforgeCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ConfigurationException || ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_FAILED_FILES;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return EXIT_CONFIGURATION;
        });
        return cmd;
    }

    static Configuration loadConfiguration(RuleRegistry registry, Path configFile) throws ConfigurationException {
        if (configFile == null) {
            return Configuration.defaults(registry);
        }
        return new ConfigurationLoader(registry).load(configFile);
    }

    @Command(name = "process", mixinStandardHelpOptions = true,
            description = "Transform a Lua file, or every .lua/.luau file under a directory")
    static class ProcessCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Input file or directory", paramLabel = "<input>")
        private Path input;

        @Parameters(index = "1", description = "Output file or directory", paramLabel = "<output>")
        private Path output;

        @Option(names = "--config", description = "Configuration file (.json, .json5, .yaml, .yml)", paramLabel = "<path>")
        private Path configFile;

        @Option(names = "--generator", description = "Code generator: dense, readable or retain_lines",
                paramLabel = "<name>", converter = GeneratorKindConverter.class)
        private GeneratorKind generator;

        @Option(names = "--dry-run", description = "Print a unified diff per file instead of writing")
        private boolean dryRun;

        @Option(names = "--verbose", description = "Log each rule applied to each file")
        private boolean verbose;

        @Option(names = "--threads", description = "Number of files processed in parallel (default: 1)", paramLabel = "<n>")
        private int threads = 1;

        @Override
        public Integer call() throws ConfigurationException, IOException, InterruptedException {
            if (threads < 1) {
                throw new IllegalArgumentException("Threads must be positive, got: " + threads);
            }
            if (verbose) {
                enableDebugLogging();
            }
            Configuration configuration = loadConfiguration(new RuleRegistry(), configFile);
            if (generator != null) {
                configuration = configuration.withGenerator(
                        new GeneratorParameters(generator, configuration.generator().columnSpan()));
            }

            List<FileJob> jobs = BatchProcessor.collect(input, output);
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            if (jobs.isEmpty()) {
                out.println("No Lua files found under " + input);
                return 0;
            }

            BatchReport report = new BatchProcessor(new FileProcessor(configuration), threads).run(jobs, !dryRun);

            if (dryRun) {
                DiffGenerator diffGenerator = new DiffGenerator();
                for (FileOutcome outcome : report.outcomes()) {
                    if (outcome.isChanged()) {
                        out.println(diffGenerator.generateUnifiedDiff(
                                outcome.relativePath(), outcome.original(), outcome.transformed()));
                    }
                }
            }
            for (FileOutcome failure : report.failures()) {
                err.println(failure.relativePath() + ": " + failure.error());
            }
            out.printf("%d file(s) processed, %d changed, %d failed%n",
                    report.outcomes().size(), report.changedCount(), report.failures().size());
            out.flush();
            err.flush();
            return report.hasFailures() ? EXIT_FAILED_FILES : 0;
        }

        private static void enableDebugLogging() {
            org.slf4j.Logger logger = LoggerFactory.getLogger("com.raditha.luaforge");
            if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
                logbackLogger.setLevel(Level.DEBUG);
            }
        }
    }

    @Command(name = "rules", mixinStandardHelpOptions = true, description = "List the available rules")
    static class RulesCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            for (RuleRegistry.RuleDefinition definition : new RuleRegistry().definitions()) {
                out.println(definition.enabledByDefault()
                        ? definition.name() + " (default)"
                        : definition.name());
            }
            out.flush();
            return 0;
        }
    }

    @Command(name = "config", mixinStandardHelpOptions = true,
            description = "Print the effective configuration as JSON")
    static class ConfigCommand implements Callable<Integer> {

        @Spec
        private CommandSpec spec;

        @Option(names = "--config", description = "Configuration file (.json, .json5, .yaml, .yml)", paramLabel = "<path>")
        private Path configFile;

        @Override
        public Integer call() throws ConfigurationException, IOException {
            Configuration configuration = loadConfiguration(new RuleRegistry(), configFile);
            PrintWriter out = spec.commandLine().getOut();
            out.println(new ObjectMapper().writerWithDefaultPrettyPrinter()
                    .writeValueAsString(configuration.toMap()));
            out.flush();
            return 0;
        }
    }

    /**
     * Converts generator names, accepting {@code retain-lines} for {@code retain_lines}.
     */
    public static class GeneratorKindConverter implements ITypeConverter<GeneratorKind> {
        @Override
        public GeneratorKind convert(String value) {
            return GeneratorKind.fromName(value);
        }
    }
}
