package com.raditha.luaforge.ast;

/**
 * Signals misuse of the tree mutation API or a tree left in a malformed state.
 * This is a programming error in a rule, never a consequence of user input.
 */
public class AstInvariantException extends IllegalStateException {

    public AstInvariantException(String message) {
        super(message);
    }
}
