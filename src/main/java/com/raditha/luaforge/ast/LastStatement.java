package com.raditha.luaforge.ast;

/**
 * A statement that terminates control flow of its block (return, break, continue).
 * Only the final slot of a {@link Block} can hold one.
 */
public abstract class LastStatement extends Statement {

    @Override
    public abstract LastStatement copy();
}
