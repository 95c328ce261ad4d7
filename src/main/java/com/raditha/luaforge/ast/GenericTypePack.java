package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code T...}
 */
public class GenericTypePack extends TypeNode {

    private Identifier name;

    public GenericTypePack(Identifier name) {
        this.name = name;
    }

    public Identifier getName() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = name;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(name);
    }

    @Override
    public GenericTypePack copy() {
        return new GenericTypePack(name.copy());
    }
}
