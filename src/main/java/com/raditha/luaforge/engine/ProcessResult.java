package com.raditha.luaforge.engine;

import java.util.List;

/**
 * What the engine did to one tree.
 *
 * @param applied names of the rules that ran, in order
 * @param skipped names of the rules whose file filter excluded the file
 */
public record ProcessResult(List<String> applied, List<String> skipped) {

    public ProcessResult {
        applied = List.copyOf(applied);
        skipped = List.copyOf(skipped);
    }
}
