package com.raditha.luaforge.model;

/**
 * Kind of non-semantic text attached to a token.
 */
public enum TriviaKind {
    WHITESPACE,
    LINE_COMMENT,
    BLOCK_COMMENT,
    SHEBANG;

    public boolean isComment() {
        return this == LINE_COMMENT || this == BLOCK_COMMENT;
    }
}
