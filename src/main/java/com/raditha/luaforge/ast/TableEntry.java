package com.raditha.luaforge.ast;

/**
 * An entry of a table constructor.
 */
public abstract class TableEntry extends Node {

    public abstract Expression getValue();

    public abstract void setValue(Expression value);

    @Override
    public abstract TableEntry copy();
}
