package com.raditha.luaforge.workflow;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.config.Configuration;
import com.raditha.luaforge.engine.ProcessResult;
import com.raditha.luaforge.engine.RuleEngine;
import com.raditha.luaforge.generator.GeneratorParameters;
import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;
import com.raditha.luaforge.rules.RuleContext;

/**
 * Parses one source text, runs the rule pipeline over it and writes it back out.
 * Holds no per-file state, so a single instance serves every file of a batch.
 */
public class FileProcessor {

    private final RuleEngine engine;
    private final GeneratorParameters generator;

    public FileProcessor(Configuration configuration) {
        this(new RuleEngine(configuration.rules()), configuration.generator());
    }

    public FileProcessor(RuleEngine engine, GeneratorParameters generator) {
        this.engine = engine;
        this.generator = generator;
    }

    /**
     * Processes a source that is not associated with a file; path filters see an empty path.
     */
    public String process(String source) throws ParseException {
        return process(source, RuleContext.anonymous()).code();
    }

    public Result process(String source, RuleContext context) throws ParseException {
        Block block = Parser.parse(source);
        ProcessResult result = engine.process(block, context);
        String code = generator.createGenerator().generate(block);
        return new Result(code, result);
    }

    /**
     * Generated code and the rules that ran to produce it.
     */
    public record Result(String code, ProcessResult rules) {
    }
}
