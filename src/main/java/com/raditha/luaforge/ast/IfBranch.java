package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A condition and its block. Owns its {@code if} or {@code elseif} keyword and {@code then}.
 */
public class IfBranch extends Node {

    private Expression condition;
    private Block block;

    public IfBranch(Expression condition, Block block) {
        this.condition = condition;
        this.block = block;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = block;
    }

    @Override
    public List<Node> getChildren() {
        return children(condition, block);
    }

    @Override
    public IfBranch copy() {
        return new IfBranch(condition.copy(), block.copy());
    }
}
