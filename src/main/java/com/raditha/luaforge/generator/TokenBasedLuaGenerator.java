package com.raditha.luaforge.generator;

import com.raditha.luaforge.ast.Node;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.Trivia;
import com.raditha.luaforge.model.TriviaKind;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reproduces the trivia kept by the tokens of the tree and keeps every source token on
 * its original line where possible: blank lines are added when output falls behind,
 * and line breaks in trivia are dropped when it runs ahead. An unmodified tree is
 * written back exactly as it was read.
 * <p>
 * Tokens are matched by text, in order, among the tokens owned by each node, so that
 * tokens left over by a transformation are skipped. Synthesized tokens get the spacing
 * of their role. Whitespace around tokens that a transformation left behind is carried
 * over to the next token written, and a statement that no longer follows its source
 * neighbour is kept apart from it.
 */
public class TokenBasedLuaGenerator extends AbstractLuaGenerator {

    private final StringBuilder out = new StringBuilder();
    private final Map<Node, Integer> cursors = new IdentityHashMap<>();
    private int line = 1;
    private boolean lineCommentOpen;
    private boolean pendingSpace;
    private boolean previousSynthesized;
    private boolean statementStart;
    private boolean carriedSpace;
    private Token previousSource;

    @Override
    protected Token findToken(Node owner, String text) {
        if (owner == null) {
            return null;
        }
        List<Token> tokens = owner.getTokens();
        int cursor = cursors.getOrDefault(owner, 0);
        for (int i = cursor; i < tokens.size(); i++) {
            if (tokens.get(i).text().equals(text)) {
                skip(tokens, cursor, i);
                cursors.put(owner, i + 1);
                return tokens.get(i);
            }
        }
        return null;
    }

    @Override
    protected Token leafToken(Node owner) {
        List<Token> tokens = owner.getTokens();
        if (tokens.isEmpty()) {
            return null;
        }
        cursors.put(owner, 1);
        return tokens.get(0);
    }

    @Override
    protected Token findSeparator(Node owner) {
        List<Token> tokens = owner.getTokens();
        int cursor = cursors.getOrDefault(owner, 0);
        for (int i = cursor; i < tokens.size(); i++) {
            if (isSeparator(tokens.get(i))) {
                skip(tokens, cursor, i);
                cursors.put(owner, i + 1);
                return tokens.get(i);
            }
        }
        return null;
    }

    private void skip(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (hasTrivia(token.leadingTrivia()) || hasTrivia(token.trailingTrivia())) {
                carriedSpace = true;
            }
        }
    }

    private static boolean hasTrivia(List<Trivia> trivia) {
        return trivia.stream().anyMatch(item -> !item.text().isEmpty());
    }

    @Override
    protected Token findTrailingSeparator(Node owner, int entryCount) {
        long separators = owner.getTokens().stream().filter(TokenBasedLuaGenerator::isSeparator).count();
        if (entryCount == 0 || separators != entryCount) {
            return null;
        }
        return findSeparator(owner);
    }

    private static boolean isSeparator(Token token) {
        return token.text().equals(",") || token.text().equals(";");
    }

    @Override
    protected void beginStatement(Statement statement) {
        statementStart = true;
    }

    @Override
    protected void semicolon(Statement statement, boolean required) {
        Token semicolon = statement.getSemicolon();
        if (semicolon != null) {
            write(semicolon, ";", Spacing.ATTACHED, false);
        } else if (required) {
            write(null, ";", Spacing.ATTACHED, false);
        }
    }

    @Override
    protected void write(Token token, String text, Spacing spacing, boolean separate) {
        if (token == null || token.isSynthesized()) {
            if (token != null) {
                token.leadingTrivia().forEach(this::appendTrivia);
            }
            closeLineComment();
            if (!separate && (spacing == Spacing.ATTACHED || spacing == Spacing.COMMA) && !insideInterpolation()) {
                trimTrailingSpaces();
            }
            boolean space = separate || statementStart || spacing == Spacing.SPACED || spacing == Spacing.LEADING
                    || pendingSpace && spacing != Spacing.ATTACHED;
            if (space && !endsWithWhitespace()) {
                append(" ");
            }
        } else {
            int before = out.length();
            writeLeadingTrivia(token.leadingTrivia(), token.line());
            closeLineComment();
            boolean wantsSpace = statementStart || spacing == Spacing.SPACED || spacing == Spacing.LEADING
                    || pendingSpace && spacing != Spacing.ATTACHED;
            boolean space = separate || carriedSpace || previousSynthesized && wantsSpace
                    || statementStart && !insideInterpolation() && detached(previousSource, token);
            if (space && out.length() == before && !endsWithWhitespace()) {
                append(" ");
            }
        }
        append(text);
        if (token != null) {
            token.trailingTrivia().forEach(this::appendTrivia);
        }
        pendingSpace = spacing == Spacing.SPACED || spacing == Spacing.COMMA;
        previousSynthesized = token == null || token.isSynthesized();
        previousSource = previousSynthesized ? null : token;
        statementStart = false;
        carriedSpace = false;
    }

    /**
     * Whether source tokens stood between two source tokens that are now written next to
     * each other. Only tokens on the same line are compared; line breaks are restored
     * by the leading trivia.
     */
    private static boolean detached(Token previous, Token token) {
        return previous != null && previous.line() == token.line()
                && previous.index() >= 0 && token.index() >= 0 && !token.follows(previous);
    }

    private void trimTrailingSpaces() {
        int length = out.length();
        while (length > 0 && (out.charAt(length - 1) == ' ' || out.charAt(length - 1) == '\t')) {
            length--;
        }
        out.setLength(length);
    }

    @Override
    protected void raw(String text) {
        append(text);
        pendingSpace = false;
        previousSource = null;
    }

    @Override
    protected void endOfFile(Token token) {
        if (token == null) {
            return;
        }
        if (token.isSynthesized()) {
            token.leadingTrivia().forEach(this::appendTrivia);
        } else {
            writeLeadingTrivia(token.leadingTrivia(), token.line());
        }
    }

    @Override
    protected String result() {
        return out.toString();
    }

    /**
     * Writes trivia so that the following token lands on the target line: missing lines
     * are added before the trivia, surplus line breaks are taken out of its whitespace.
     */
    private void writeLeadingTrivia(List<Trivia> trivia, int targetLine) {
        int triviaLines = 0;
        for (Trivia item : trivia) {
            triviaLines += item.lineCount();
        }
        int missing = targetLine - (line + triviaLines);
        if (missing > 0) {
            closeLineComment();
            append("\n".repeat(missing));
        }
        int surplus = Math.max(0, -missing);
        for (Trivia item : trivia) {
            if (surplus > 0 && item.kind() == TriviaKind.WHITESPACE) {
                String text = item.text();
                StringBuilder kept = new StringBuilder();
                for (int i = 0; i < text.length(); i++) {
                    char c = text.charAt(i);
                    if (surplus > 0 && c == '\n') {
                        surplus--;
                    } else if (!(c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n' && surplus > 0)) {
                        kept.append(c);
                    }
                }
                appendTrivia(Trivia.whitespace(kept.toString()));
            } else {
                appendTrivia(item);
            }
        }
    }

    private void appendTrivia(Trivia trivia) {
        if (trivia.text().isEmpty()) {
            return;
        }
        if (trivia.kind() != TriviaKind.WHITESPACE) {
            closeLineComment();
        }
        append(trivia.text());
        if (trivia.kind() == TriviaKind.LINE_COMMENT || trivia.kind() == TriviaKind.SHEBANG) {
            lineCommentOpen = true;
        }
    }

    private void closeLineComment() {
        if (lineCommentOpen) {
            append("\n");
        }
    }

    private boolean endsWithWhitespace() {
        return out.length() == 0 || Character.isWhitespace(out.charAt(out.length() - 1));
    }

    private void append(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineCommentOpen = false;
            }
        }
        out.append(text);
    }
}
