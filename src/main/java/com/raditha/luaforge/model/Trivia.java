package com.raditha.luaforge.model;

/**
 * Whitespace or comment text carried by a token.
 *
 * @param kind the trivia category
 * @param text the exact source text
 */
public record Trivia(TriviaKind kind, String text) {

    public static Trivia whitespace(String text) {
        return new Trivia(TriviaKind.WHITESPACE, text);
    }

    public static Trivia lineComment(String text) {
        return new Trivia(TriviaKind.LINE_COMMENT, text);
    }

    public static Trivia blockComment(String text) {
        return new Trivia(TriviaKind.BLOCK_COMMENT, text);
    }

    /**
     * Number of line breaks contained in the text.
     */
    public int lineCount() {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
