package com.raditha.luaforge.ast;

import java.util.List;

/**
 * {@code name = value}
 */
public class TableFieldEntry extends TableEntry {

    private Identifier field;
    private Expression value;

    public TableFieldEntry(Identifier field, Expression value) {
        this.field = field;
        this.value = value;
    }

    public Identifier getField() {
        return field;
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
        return children(field, value);
    }

    @Override
    public TableFieldEntry copy() {
        return new TableFieldEntry(field.copy(), value.copy());
    }
}
