package com.raditha.luaforge.model;

/**
 * Lexical category of a {@link Token}.
 * Keywords and symbols are distinguished by their text; contextual keywords
 * such as {@code continue}, {@code type} and {@code export} are lexed as names.
 */
public enum TokenType {
    /** Identifier or contextual keyword */
    NAME,

    /** Reserved word (and, break, do, ...) */
    KEYWORD,

    /** Numeric literal in any base */
    NUMBER,

    /** Quoted or long-bracket string literal */
    STRING,

    /** Backtick string with embedded expressions */
    INTERPOLATED_STRING,

    /** Operator or punctuation */
    SYMBOL,

    /** End of input, owns the trailing trivia of the file */
    EOF
}
