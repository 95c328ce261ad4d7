package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A declared name: local variable, parameter or loop variable, with an optional
 * type annotation and an optional attribute such as {@code <const>}.
 */
public class TypedIdentifier extends Identifier {

    private TypeNode type;
    private String attribute;

    public TypedIdentifier(String name) {
        super(name);
    }

    public TypedIdentifier(String name, TypeNode type) {
        super(name);
        this.type = type;
    }

    public TypeNode getType() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    public String getAttribute() {
        return attribute;
    }

    public void setAttribute(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public List<Node> getChildren() {
        return children(type);
    }

    @Override
    public TypedIdentifier copy() {
        TypedIdentifier copy = new TypedIdentifier(getName(), copyOrNull(type));
        copy.attribute = attribute;
        return copy;
    }
}
