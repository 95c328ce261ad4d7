package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code {Type}}
 */
public class ArrayType extends TypeNode {

    private TypeNode element;

    public ArrayType(TypeNode element) {
        this.element = element;
    }

    public TypeNode getElement() {
        return element;
    }

    public void setElement(TypeNode element) {
        this.element = element;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(element);
    }

    @Override
    public ArrayType copy() {
        return new ArrayType(element.copy());
    }
}
