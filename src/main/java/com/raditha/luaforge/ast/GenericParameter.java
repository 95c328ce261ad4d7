package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A generic type parameter such as {@code T}, {@code T...} or {@code T = string}.
 */
public class GenericParameter extends Node {

    private Identifier name;
    private final boolean pack;
    private TypeNode defaultType;

    public GenericParameter(Identifier name, boolean pack, TypeNode defaultType) {
        this.name = name;
        this.pack = pack;
        this.defaultType = defaultType;
    }

    public Identifier getName() {
        return name;
    }

    public boolean isPack() {
        return pack;
    }

    public TypeNode getDefaultType() {
        return defaultType;
    }

    public void setDefaultType(TypeNode defaultType) {
        this.defaultType = defaultType;
    }

    @Override
    public List<Node> getChildren() {
        return children(name, defaultType);
    }

    @Override
    public GenericParameter copy() {
        return new GenericParameter(name.copy(), pack, copyOrNull(defaultType));
    }
}
