package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

public class TableType extends TypeNode {

    private final List<TableTypeEntry> entries;

    public TableType(List<TableTypeEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    public List<TableTypeEntry> getEntries() {
        return entries;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(entries);
    }

    @Override
    public TableType copy() {
        return new TableType(copyAll(entries));
    }
}
