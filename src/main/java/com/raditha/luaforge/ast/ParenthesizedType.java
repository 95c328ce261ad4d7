package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code (Type)}
 */
public class ParenthesizedType extends TypeNode {

    private TypeNode inner;

    public ParenthesizedType(TypeNode inner) {
        this.inner = inner;
    }

    public TypeNode getInner() {
        return inner;
    }

    public void setInner(TypeNode inner) {
        this.inner = inner;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(inner);
    }

    @Override
    public ParenthesizedType copy() {
        return new ParenthesizedType(inner.copy());
    }
}
