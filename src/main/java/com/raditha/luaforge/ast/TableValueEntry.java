package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A positional entry.
 */
public class TableValueEntry extends TableEntry {

    private Expression value;

    public TableValueEntry(Expression value) {
        this.value = value;
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
        return children(value);
    }

    @Override
    public TableValueEntry copy() {
        return new TableValueEntry(value.copy());
    }
}
