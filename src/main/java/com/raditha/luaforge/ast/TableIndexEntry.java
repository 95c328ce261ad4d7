package com.raditha.luaforge.ast;

import java.util.List;

/**
 * {@code [key] = value}
 */
public class TableIndexEntry extends TableEntry {

    private Expression key;
    private Expression value;

    public TableIndexEntry(Expression key, Expression value) {
        this.key = key;
        this.value = value;
    }

    public Expression getKey() {
        return key;
    }

    public void setKey(Expression key) {
        this.key = key;
    }

    @Override
    public Expression getValue() {
        return value;
    }

    @Override
    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public List<Node> getChildren() {
        return children(key, value);
    }

    @Override
    public TableIndexEntry copy() {
        return new TableIndexEntry(key.copy(), value.copy());
    }
}
