package com.raditha.luaforge.generator;

import com.raditha.luaforge.ast.Block;

/**
 * Turns a syntax tree back into source text.
 * Instances keep output state and are used for a single tree.
 */
public interface LuaGenerator {

    String generate(Block block);
}
