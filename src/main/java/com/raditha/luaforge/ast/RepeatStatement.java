package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code repeat ... until condition}. Locals of the block are visible in the condition.
 */
public class RepeatStatement extends Statement {

    private Block block;
    private Expression condition;

    public RepeatStatement(Block block, Expression condition) {
        this.block = block;
        this.condition = condition;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = block;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(block, condition);
    }

    @Override
    public RepeatStatement copy() {
        return new RepeatStatement(block.copy(), condition.copy());
    }
}
