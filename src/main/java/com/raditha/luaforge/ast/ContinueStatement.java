package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

public class ContinueStatement extends LastStatement {

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public ContinueStatement copy() {
        return new ContinueStatement();
    }
}
