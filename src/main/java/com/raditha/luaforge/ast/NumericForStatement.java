package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code for i = start, end[, step] do ... end}
 */
public class NumericForStatement extends Statement {

    private TypedIdentifier variable;
    private Expression start;
    private Expression end;
    private Expression step;
    private Block block;

    public NumericForStatement(TypedIdentifier variable, Expression start, Expression end, Expression step,
            Block block) {
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.step = step;
        this.block = block;
    }

    public TypedIdentifier getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public void setStart(Expression start) {
        this.start = start;
    }

    public Expression getEnd() {
        return end;
    }

    public void setEnd(Expression end) {
        this.end = end;
    }

    public Expression getStep() {
        return step;
    }

    public void setStep(Expression step) {
        this.step = step;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = block;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(variable, start, end, step, block);
    }

    @Override
    public NumericForStatement copy() {
        return new NumericForStatement(variable.copy(), start.copy(), end.copy(), copyOrNull(step), block.copy());
    }
}
