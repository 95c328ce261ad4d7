package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

public class BreakStatement extends LastStatement {

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public BreakStatement copy() {
        return new BreakStatement();
    }
}
