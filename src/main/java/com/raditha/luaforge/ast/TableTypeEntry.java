package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A property {@code name: Type} or an indexer {@code [Key]: Type} of a table type.
 */
public class TableTypeEntry extends Node {

    private final String access;
    private final Identifier name;
    private TypeNode key;
    private TypeNode value;

    private TableTypeEntry(String access, Identifier name, TypeNode key, TypeNode value) {
        this.access = access;
        this.name = name;
        this.key = key;
        this.value = value;
    }

    public static TableTypeEntry property(String access, Identifier name, TypeNode value) {
        return new TableTypeEntry(access, name, null, value);
    }

    public static TableTypeEntry indexer(String access, TypeNode key, TypeNode value) {
        return new TableTypeEntry(access, null, key, value);
    }

    /**
     * {@code read} or {@code write} modifier, or null.
     */
    public String getAccess() {
        return access;
    }

    public boolean isProperty() {
        return name != null;
    }

    public Identifier getName() {
        return name;
    }

    public TypeNode getKey() {
        return key;
    }

    public void setKey(TypeNode key) {
        this.key = key;
    }

    public TypeNode getValue() {
        return value;
    }

    public void setValue(TypeNode value) {
        this.value = value;
    }

    @Override
    public List<Node> getChildren() {
        return children(name, key, value);
    }

    @Override
    public TableTypeEntry copy() {
        return new TableTypeEntry(access, copyOrNull(name), copyOrNull(key), value.copy());
    }
}
