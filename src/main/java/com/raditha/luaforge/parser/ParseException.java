package com.raditha.luaforge.parser;

/**
 * Raised when source text cannot be tokenized or parsed.
 * Carries the location of the offending input.
 */
public class ParseException extends Exception {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
