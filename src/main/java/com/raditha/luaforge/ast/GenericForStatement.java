package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code for k, v in expressions do ... end}
 */
public class GenericForStatement extends Statement {

    private final List<TypedIdentifier> variables;
    private final List<Expression> expressions;
    private Block block;

    public GenericForStatement(List<TypedIdentifier> variables, List<Expression> expressions, Block block) {
        this.variables = new ArrayList<>(variables);
        this.expressions = new ArrayList<>(expressions);
        this.block = block;
    }

    public List<TypedIdentifier> getVariables() {
        return variables;
    }

    public List<Expression> getExpressions() {
        return expressions;
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
        return children(variables, expressions, block);
    }

    @Override
    public GenericForStatement copy() {
        return new GenericForStatement(copyAll(variables), copyAll(expressions), block.copy());
    }
}
