package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code ...Type}
 */
public class VariadicTypePack extends TypeNode {

    private TypeNode type;

    public VariadicTypePack(TypeNode type) {
        this.type = type;
    }

    public TypeNode getType() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(type);
    }

    @Override
    public VariadicTypePack copy() {
        return new VariadicTypePack(type.copy());
    }
}
