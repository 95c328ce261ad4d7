package com.raditha.luaforge.parser;

import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;
import com.raditha.luaforge.model.Trivia;
import com.raditha.luaforge.model.TriviaKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts Lua or Luau source text into tokens.
 * <p>
 * Every token owns the whitespace and comments that precede it (leading trivia)
 * and the whitespace and comments that follow it up to the end of its line
 * (trailing trivia). Concatenating the trivia and text of all tokens, including
 * the final EOF token, reproduces the input exactly.
 */
public class Lexer {

    public static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function",
            "if", "in", "local", "nil", "not", "or", "repeat", "return", "then", "true",
            "until", "while");

    private static final String[] SYMBOLS = {
            "...", "..=", "//=",
            "..", "==", "~=", "<=", ">=", "//", "::", "->",
            "+=", "-=", "*=", "/=", "%=", "^=",
            "+", "-", "*", "/", "%", "^", "#", "&", "|", "~", "<", ">", "=",
            "(", ")", "{", "}", "[", "]", ";", ":", ",", ".", "?"
    };

    private final String source;
    private int pos;
    private int line;
    private int col;

    public Lexer(String source) {
        this(source, 1, 1);
    }

    /**
     * Create a lexer over a fragment that starts at the given position of a larger file.
     */
    public Lexer(String source, int startLine, int startColumn) {
        this.source = source;
        this.line = startLine;
        this.col = startColumn;
    }

    public List<Token> tokenize() throws ParseException {
        List<Token> tokens = new ArrayList<>();
        List<Trivia> leading = new ArrayList<>();
        if (pos == 0 && source.startsWith("#!")) {
            int start = pos;
            while (!isAtEnd() && peek() != '\n') {
                advance();
            }
            leading.add(new Trivia(TriviaKind.SHEBANG, source.substring(start, pos)));
        }

        while (true) {
            collectLeadingTrivia(leading);
            int startLine = line;
            int startCol = col;
            if (isAtEnd()) {
                tokens.add(new Token(TokenType.EOF, "", leading, List.of(), startLine, startCol, tokens.size()));
                return tokens;
            }
            int start = pos;
            TokenType type = scanToken();
            String text = source.substring(start, pos);
            List<Trivia> trailing = collectTrailingTrivia();
            tokens.add(new Token(type, text, leading, trailing, startLine, startCol, tokens.size()));
            leading = new ArrayList<>();
        }
    }

    // ================= trivia =================

    private void collectLeadingTrivia(List<Trivia> into) throws ParseException {
        while (!isAtEnd()) {
            char c = peek();
            if (isWhitespace(c)) {
                int start = pos;
                while (!isAtEnd() && isWhitespace(peek())) {
                    advance();
                }
                into.add(Trivia.whitespace(source.substring(start, pos)));
            } else if (c == '-' && peekNext() == '-') {
                into.add(comment());
            } else {
                return;
            }
        }
    }

    private List<Trivia> collectTrailingTrivia() throws ParseException {
        List<Trivia> trailing = new ArrayList<>();
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t') {
                int start = pos;
                while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
                    advance();
                }
                trailing.add(Trivia.whitespace(source.substring(start, pos)));
            } else if (c == '-' && peekNext() == '-') {
                trailing.add(comment());
            } else {
                break;
            }
        }
        return trailing;
    }

    private Trivia comment() throws ParseException {
        int start = pos;
        int startLine = line;
        int startCol = col;
        advance();
        advance();
        if (peek() == '[') {
            int level = longBracketLevel();
            if (level >= 0) {
                skipLongBracket(level, startLine, startCol, "unfinished long comment");
                return Trivia.blockComment(source.substring(start, pos));
            }
        }
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
            advance();
        }
        return Trivia.lineComment(source.substring(start, pos));
    }

    // ================= tokens =================

    private TokenType scanToken() throws ParseException {
        char c = peek();
        if (isAlpha(c)) {
            int start = pos;
            while (!isAtEnd() && isAlphaNumeric(peek())) {
                advance();
            }
            return KEYWORDS.contains(source.substring(start, pos)) ? TokenType.KEYWORD : TokenType.NAME;
        }
        if (isDigit(c) || (c == '.' && isDigit(peekNext()))) {
            number();
            return TokenType.NUMBER;
        }
        switch (c) {
            case '"', '\'' -> {
                quotedString(c);
                return TokenType.STRING;
            }
            case '`' -> {
                interpolatedString();
                return TokenType.INTERPOLATED_STRING;
            }
            case '[' -> {
                int level = longBracketLevel();
                if (level >= 0) {
                    int startLine = line;
                    int startCol = col;
                    skipLongBracket(level, startLine, startCol, "unfinished long string");
                    return TokenType.STRING;
                }
            }
            default -> {
                // handled below
            }
        }
        for (String symbol : SYMBOLS) {
            if (source.startsWith(symbol, pos)) {
                for (int i = 0; i < symbol.length(); i++) {
                    advance();
                }
                return TokenType.SYMBOL;
            }
        }
        throw new ParseException("unexpected character '" + c + "'", line, col);
    }

    private void number() throws ParseException {
        int startLine = line;
        int startCol = col;
        if (peek() == '0' && (peekNext() == 'x' || peekNext() == 'X')) {
            advance();
            advance();
            while (!isAtEnd() && (isHexDigit(peek()) || peek() == '_' || peek() == '.')) {
                advance();
            }
            if (peek() == 'p' || peek() == 'P') {
                exponent();
            }
        } else if (peek() == '0' && (peekNext() == 'b' || peekNext() == 'B')) {
            advance();
            advance();
            while (!isAtEnd() && (peek() == '0' || peek() == '1' || peek() == '_')) {
                advance();
            }
        } else {
            while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
                advance();
            }
            if (peek() == '.' && peekNext() != '.') {
                advance();
                while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
                    advance();
                }
            }
            if (peek() == 'e' || peek() == 'E') {
                exponent();
            }
        }
        if (!isAtEnd() && (isAlpha(peek()) || peek() == '.')) {
            throw new ParseException("malformed number", startLine, startCol);
        }
    }

    private void exponent() throws ParseException {
        advance();
        if (peek() == '+' || peek() == '-') {
            advance();
        }
        if (!isDigit(peek())) {
            throw new ParseException("malformed number exponent", line, col);
        }
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            advance();
        }
    }

    private void quotedString(char quote) throws ParseException {
        int startLine = line;
        int startCol = col;
        advance();
        while (true) {
            if (isAtEnd()) {
                throw new ParseException("unfinished string", startLine, startCol);
            }
            char c = advance();
            if (c == quote) {
                return;
            }
            if (c == '\n' || c == '\r') {
                throw new ParseException("unfinished string", startLine, startCol);
            }
            if (c == '\\') {
                skipEscape(startLine, startCol);
            }
        }
    }

    private void skipEscape(int startLine, int startCol) throws ParseException {
        if (isAtEnd()) {
            throw new ParseException("unfinished string", startLine, startCol);
        }
        char escaped = advance();
        if (escaped == 'z') {
            while (!isAtEnd() && isWhitespace(peek())) {
                advance();
            }
        } else if (escaped == '\r' && peek() == '\n') {
            advance();
        }
    }

    private void interpolatedString() throws ParseException {
        int startLine = line;
        int startCol = col;
        advance();
        while (true) {
            if (isAtEnd()) {
                throw new ParseException("unfinished interpolated string", startLine, startCol);
            }
            char c = advance();
            switch (c) {
                case '`' -> {
                    return;
                }
                case '\\' -> skipEscape(startLine, startCol);
                case '\n' -> throw new ParseException("unfinished interpolated string", startLine, startCol);
                case '{' -> skipInterpolatedExpression(startLine, startCol);
                default -> {
                    // literal character
                }
            }
        }
    }

    private void skipInterpolatedExpression(int startLine, int startCol) throws ParseException {
        int depth = 1;
        while (depth > 0) {
            if (isAtEnd()) {
                throw new ParseException("unfinished interpolated string", startLine, startCol);
            }
            char c = peek();
            if (c == '"' || c == '\'') {
                quotedString(c);
            } else if (c == '`') {
                interpolatedString();
            } else if (c == '[' && longBracketLevel() >= 0) {
                skipLongBracket(longBracketLevel(), line, col, "unfinished long string");
            } else {
                advance();
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                }
            }
        }
    }

    /**
     * Level of the long bracket starting at the current position, or -1 if there is none.
     */
    private int longBracketLevel() {
        if (peek() != '[') {
            return -1;
        }
        int i = pos + 1;
        int level = 0;
        while (i < source.length() && source.charAt(i) == '=') {
            level++;
            i++;
        }
        return i < source.length() && source.charAt(i) == '[' ? level : -1;
    }

    private void skipLongBracket(int level, int startLine, int startCol, String error) throws ParseException {
        for (int i = 0; i < level + 2; i++) {
            advance();
        }
        String close = "]" + "=".repeat(level) + "]";
        int end = source.indexOf(close, pos);
        if (end < 0) {
            throw new ParseException(error, startLine, startCol);
        }
        while (pos < end + close.length()) {
            advance();
        }
    }

    // ================= helpers =================

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f' || c == 0x0B;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
