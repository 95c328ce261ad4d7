package com.raditha.luaforge.engine;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.rules.ConfiguredRule;
import com.raditha.luaforge.rules.RuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs an ordered list of configured rules over a syntax tree.
 * <p>
 * Rules run strictly in order, each one seeing the tree left by the previous one.
 * A rule is skipped when its file filter excludes the file being processed. The
 * engine holds no per-tree state and can be shared between threads.
 */
public class RuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngine.class);

    private final List<ConfiguredRule> rules;

    public RuleEngine(List<ConfiguredRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<ConfiguredRule> getRules() {
        return rules;
    }

    public ProcessResult process(Block block, RuleContext context) {
        List<String> applied = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (ConfiguredRule configured : rules) {
            if (!configured.appliesTo(context)) {
                logger.debug("Skipping {} for {}", configured.name(), context.relativePath());
                skipped.add(configured.name());
                continue;
            }
            long start = System.nanoTime();
            configured.rule().process(block, context);
            if (logger.isDebugEnabled()) {
                logger.debug("Applied {} to {} in {} us", configured.name(), context.relativePath(),
                        (System.nanoTime() - start) / 1_000);
            }
            applied.add(configured.name());
        }
        return new ProcessResult(applied, skipped);
    }
}
