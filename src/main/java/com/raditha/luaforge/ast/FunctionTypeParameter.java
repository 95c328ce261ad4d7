package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A parameter of a function type, optionally named: {@code name: Type} or {@code Type}.
 */
public class FunctionTypeParameter extends Node {

    private final Identifier name;
    private TypeNode type;

    public FunctionTypeParameter(Identifier name, TypeNode type) {
        this.name = name;
        this.type = type;
    }

    public Identifier getName() {
        return name;
    }

    public TypeNode getType() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    @Override
    public List<Node> getChildren() {
        return children(name, type);
    }

    @Override
    public FunctionTypeParameter copy() {
        return new FunctionTypeParameter(copyOrNull(name), type.copy());
    }
}
