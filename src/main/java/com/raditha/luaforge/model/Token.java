package com.raditha.luaforge.model;

import java.util.List;

/**
 * A lexical unit together with the trivia surrounding it.
 * Tokens are the only carriers of source positions and formatting; a token
 * created by a transformation has no position and is said to be synthesized.
 *
 * @param type           Lexical category
 * @param text           Exact source text of the token
 * @param leadingTrivia  Whitespace and comments preceding the token, line breaks included
 * @param trailingTrivia Whitespace and comments following the token on the same line
 * @param line           Source line number (1-indexed), 0 when synthesized
 * @param column         Source column number (1-indexed), 0 when synthesized
 * @param index          Position in the token stream of the source, -1 when unknown
 */
public record Token(
        TokenType type,
        String text,
        List<Trivia> leadingTrivia,
        List<Trivia> trailingTrivia,
        int line,
        int column,
        int index) {

    public Token {
        leadingTrivia = List.copyOf(leadingTrivia);
        trailingTrivia = List.copyOf(trailingTrivia);
    }

    public Token(TokenType type, String text, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia,
                 int line, int column) {
        this(type, text, leadingTrivia, trailingTrivia, line, column, -1);
    }

    /**
     * Create a token that does not originate from source text.
     */
    public static Token synthesized(TokenType type, String text) {
        return new Token(type, text, List.of(), List.of(), 0, 0);
    }

    public boolean isSynthesized() {
        return line <= 0;
    }

    public Token withText(String newText) {
        return new Token(type, newText, leadingTrivia, trailingTrivia, line, column, index);
    }

    public Token withType(TokenType newType, String newText) {
        return new Token(newType, newText, leadingTrivia, trailingTrivia, line, column, index);
    }

    public Token withLeadingTrivia(List<Trivia> trivia) {
        return new Token(type, text, trivia, trailingTrivia, line, column, index);
    }

    public Token withTrailingTrivia(List<Trivia> trivia) {
        return new Token(type, text, leadingTrivia, trivia, line, column, index);
    }

    public Token withLine(int newLine) {
        return new Token(type, text, leadingTrivia, trailingTrivia, newLine, column, index);
    }

    /**
     * Whether this token directly follows {@code previous} in the source token stream.
     */
    public boolean follows(Token previous) {
        return index >= 0 && previous.index >= 0 && previous.index + 1 == index;
    }

    public boolean is(String expected) {
        return (type == TokenType.KEYWORD || type == TokenType.SYMBOL) && text.equals(expected);
    }

    public boolean isName(String expected) {
        return type == TokenType.NAME && text.equals(expected);
    }

    public String location() {
        return line + ":" + column;
    }
}
