package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code Type?}
 */
public class OptionalType extends TypeNode {

    private TypeNode inner;

    public OptionalType(TypeNode inner) {
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
    public OptionalType copy() {
        return new OptionalType(inner.copy());
    }
}
