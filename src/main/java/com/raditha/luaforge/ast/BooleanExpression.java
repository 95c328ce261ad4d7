package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

public class BooleanExpression extends Expression {

    private final boolean value;

    public BooleanExpression(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public BooleanExpression copy() {
        return new BooleanExpression(value);
    }
}
