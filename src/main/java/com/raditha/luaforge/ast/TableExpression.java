package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A table constructor. Owns the braces and the entry separators.
 */
public class TableExpression extends Expression {

    private final List<TableEntry> entries;

    public TableExpression(List<TableEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    public List<TableEntry> getEntries() {
        return entries;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(entries);
    }

    @Override
    public TableExpression copy() {
        return new TableExpression(copyAll(entries));
    }
}
